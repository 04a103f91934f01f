/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.attributes.VersionAttribute;

/**
 * The validated, immutable description of a model, produced by {@link SchemaRegistry}. Safe to share across
 * threads.
 */
public final class Schema {

    private final String tableName;
    private final Map<String, Attribute<?>> attributes;
    private final Map<String, IndexDescriptor> indexes;
    private final Attribute<?> hashKey;
    private final Attribute<?> rangeKey;
    private final VersionAttribute versionAttribute;

    Schema(String tableName, Map<String, Attribute<?>> attributes, Map<String, IndexDescriptor> indexes,
        Attribute<?> hashKey, Attribute<?> rangeKey, VersionAttribute versionAttribute) {
        this.tableName = tableName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<String, Attribute<?>>(attributes));
        this.indexes = Collections.unmodifiableMap(new LinkedHashMap<String, IndexDescriptor>(indexes));
        this.hashKey = hashKey;
        this.rangeKey = rangeKey;
        this.versionAttribute = versionAttribute;
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * @return the attributes in declaration order, parent attributes first
     */
    public Collection<Attribute<?>> getAttributes() {
        return attributes.values();
    }

    /**
     * @return the attribute, or null if the schema does not declare it
     */
    public Attribute<?> getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public Attribute<?> getHashKey() {
        return hashKey;
    }

    /**
     * @return the range key, or null for a hash-only table
     */
    public Attribute<?> getRangeKey() {
        return rangeKey;
    }

    /**
     * @return the version attribute, or null if the model is not versioned
     */
    public VersionAttribute getVersionAttribute() {
        return versionAttribute;
    }

    public Collection<IndexDescriptor> getIndexes() {
        return indexes.values();
    }

    /**
     * @return the index, or null if the schema does not declare it
     */
    public IndexDescriptor getIndex(String name) {
        return indexes.get(name);
    }

    public List<String> getKeyAttributeNames() {
        List<String> names = new ArrayList<String>(2);
        names.add(hashKey.getName());
        if(rangeKey != null) {
            names.add(rangeKey.getName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "Schema(" + tableName + ", " + attributes.keySet() + ")";
    }
}
