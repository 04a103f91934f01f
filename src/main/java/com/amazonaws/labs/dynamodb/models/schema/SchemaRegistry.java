/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.attributes.VersionAttribute;
import com.amazonaws.labs.dynamodb.models.exceptions.SchemaException;
import com.amazonaws.services.dynamodbv2.model.ProjectionType;

/**
 * Turns {@link SchemaDefinition}s into validated {@link Schema}s.
 *
 * Registration is a pure function of the definition and its optional parent. The parent's attributes are
 * merged first and a child attribute with the same name replaces the parent's in place. The merged schema must
 * have exactly one hash key, at most one range key, at most one version attribute, key attributes of scalar
 * type, and indexes that only reference declared attributes.
 */
public final class SchemaRegistry {

    private static final Log LOG = LogFactory.getLog(SchemaRegistry.class);

    private SchemaRegistry() { }

    public static Schema register(SchemaDefinition definition, Schema parent) {
        if(definition == null) {
            throw new IllegalArgumentException("definition must not be null");
        }
        String tableName = definition.getTableName();
        if(tableName == null && parent != null) {
            tableName = parent.getTableName();
        }
        if(tableName == null || tableName.isEmpty()) {
            throw new SchemaException("The model does not name a table");
        }

        Map<String, Attribute<?>> attributes = new LinkedHashMap<String, Attribute<?>>();
        Map<String, IndexDescriptor> indexes = new LinkedHashMap<String, IndexDescriptor>();
        if(parent != null) {
            for(Attribute<?> attribute : parent.getAttributes()) {
                attributes.put(attribute.getName(), attribute);
            }
            for(IndexDescriptor index : parent.getIndexes()) {
                indexes.put(index.getName(), index);
            }
        }
        for(Attribute<?> attribute : definition.getAttributes()) {
            attributes.put(attribute.getName(), attribute);
        }
        for(IndexDescriptor index : definition.getIndexes()) {
            indexes.put(index.getName(), index);
        }

        List<String> hashKeys = new ArrayList<String>();
        List<String> rangeKeys = new ArrayList<String>();
        List<String> versions = new ArrayList<String>();
        for(Attribute<?> attribute : attributes.values()) {
            if(attribute.isHashKey() && attribute.isRangeKey()) {
                throw new SchemaException("Attribute " + attribute.getName() + " cannot be both hash and range key",
                    singleton(attribute.getName()));
            }
            if(attribute.isHashKey()) {
                hashKeys.add(attribute.getName());
            }
            if(attribute.isRangeKey()) {
                rangeKeys.add(attribute.getName());
            }
            if(attribute instanceof VersionAttribute) {
                versions.add(attribute.getName());
            }
            if((attribute.isHashKey() || attribute.isRangeKey()) && attribute.getType().toScalarAttributeType() == null) {
                throw new SchemaException("Key attribute " + attribute.getName() + " must be a string, number or binary, not "
                    + attribute.getType(), singleton(attribute.getName()));
            }
        }
        if(hashKeys.size() != 1) {
            throw new SchemaException("The model must have exactly one hash key, found " + (hashKeys.isEmpty() ? "none" : names(hashKeys)), hashKeys);
        }
        if(rangeKeys.size() > 1) {
            throw new SchemaException("The model has more than one range key: " + names(rangeKeys), rangeKeys);
        }
        if(versions.size() > 1) {
            throw new SchemaException("The model has more than one Version attribute: " + names(versions), versions);
        }

        Attribute<?> hashKey = attributes.get(hashKeys.get(0));
        Attribute<?> rangeKey = rangeKeys.isEmpty() ? null : attributes.get(rangeKeys.get(0));
        VersionAttribute version = versions.isEmpty() ? null : (VersionAttribute) attributes.get(versions.get(0));

        for(IndexDescriptor index : indexes.values()) {
            validateIndex(index, attributes, hashKey);
        }

        Schema schema = new Schema(tableName, attributes, indexes, hashKey, rangeKey, version);
        if(LOG.isDebugEnabled()) {
            LOG.debug("Registered " + schema + " with " + indexes.size() + " indexes"
                + (parent == null ? "" : ", derived from " + parent));
        }
        return schema;
    }

    private static void validateIndex(IndexDescriptor index, Map<String, Attribute<?>> attributes, Attribute<?> tableHashKey) {
        checkIndexKey(index, index.getHashKeyName(), attributes);
        if(index.getRangeKeyName() != null) {
            checkIndexKey(index, index.getRangeKeyName(), attributes);
        }
        if(index.getKind() == IndexDescriptor.Kind.LOCAL) {
            if(!tableHashKey.getName().equals(index.getHashKeyName())) {
                throw new SchemaException("Local index " + index.getName() + " must use the table's hash key "
                    + tableHashKey.getName() + ", not " + index.getHashKeyName(), singleton(index.getHashKeyName()));
            }
            if(index.getRangeKeyName() == null) {
                throw new SchemaException("Local index " + index.getName() + " needs a range key");
            }
        }
        if(index.getProjection().getType() == ProjectionType.INCLUDE) {
            for(String name : index.getProjection().getNonKeyAttributes()) {
                if(!attributes.containsKey(name)) {
                    throw new SchemaException("Index " + index.getName() + " projects undeclared attribute " + name,
                        singleton(name));
                }
            }
        }
    }

    private static void checkIndexKey(IndexDescriptor index, String keyName, Map<String, Attribute<?>> attributes) {
        Attribute<?> attribute = attributes.get(keyName);
        if(attribute == null) {
            throw new SchemaException("Index " + index.getName() + " references undeclared attribute " + keyName,
                singleton(keyName));
        }
        if(attribute.getType().toScalarAttributeType() == null) {
            throw new SchemaException("Index " + index.getName() + " key " + keyName + " must be a string, number or binary",
                singleton(keyName));
        }
    }

    private static List<String> singleton(String name) {
        List<String> list = new ArrayList<String>(1);
        list.add(name);
        return list;
    }

    private static String names(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for(String name : names) {
            if(sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(name);
        }
        return sb.toString();
    }
}
