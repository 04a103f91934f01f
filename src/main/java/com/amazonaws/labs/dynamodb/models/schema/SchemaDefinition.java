/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.exceptions.SchemaException;

/**
 * The declaration of a model: its table, ordered attributes and indexes. A definition is a mutable builder;
 * {@link #register()} validates it and produces the immutable {@link Schema}.
 * <pre>
 * Schema thread = new SchemaDefinition("Thread")
 *     .attribute(FORUM_NAME)
 *     .attribute(SUBJECT)
 *     .attribute(VIEWS)
 *     .register();
 * </pre>
 */
public class SchemaDefinition {

    private final String tableName;
    private final List<Attribute<?>> attributes = new ArrayList<Attribute<?>>();
    private final List<IndexDescriptor> indexes = new ArrayList<IndexDescriptor>();

    /**
     * @param tableName the table, or null for a definition that derives from a parent schema and keeps its table
     */
    public SchemaDefinition(String tableName) {
        this.tableName = tableName;
    }

    public SchemaDefinition attribute(Attribute<?> attribute) {
        if(attribute == null) {
            throw new IllegalArgumentException("attribute must not be null");
        }
        for(Attribute<?> declared : attributes) {
            if(declared.getName().equals(attribute.getName())) {
                throw new SchemaException("Attribute " + attribute.getName() + " is declared twice",
                    Collections.singletonList(attribute.getName()));
            }
        }
        attributes.add(attribute);
        return this;
    }

    public SchemaDefinition index(IndexDescriptor index) {
        if(index == null) {
            throw new IllegalArgumentException("index must not be null");
        }
        indexes.add(index);
        return this;
    }

    public String getTableName() {
        return tableName;
    }

    public List<Attribute<?>> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    public List<IndexDescriptor> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    public Schema register() {
        return SchemaRegistry.register(this, null);
    }

    public Schema register(Schema parent) {
        return SchemaRegistry.register(this, parent);
    }
}
