/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.exceptions.SchemaException;
import com.amazonaws.labs.dynamodb.models.schema.Schema;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * One instance of a model: native attribute values keyed by name, always checked against the item's
 * {@link Schema}. Attributes read from the store that the schema does not declare are kept as raw values.
 *
 * Items are not thread-safe.
 */
public class Item {

    private final Schema schema;
    private final Map<String, Object> values = new LinkedHashMap<String, Object>();
    private final Map<String, AttributeValue> unknownAttributes = new LinkedHashMap<String, AttributeValue>();

    /**
     * Creates an item with every defaulted attribute set to a freshly provided default.
     */
    public Item(Schema schema) {
        this(schema, true);
    }

    Item(Schema schema, boolean applyDefaults) {
        if(schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        this.schema = schema;
        if(applyDefaults) {
            for(Attribute<?> attribute : schema.getAttributes()) {
                if(attribute.hasDefault()) {
                    values.put(attribute.getName(), attribute.getDefault());
                }
            }
        }
    }

    public Schema getSchema() {
        return schema;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(Attribute<T> attribute) {
        return (T) values.get(declared(attribute.getName()).getName());
    }

    public Object get(String attributeName) {
        return values.get(declared(attributeName).getName());
    }

    public <T> Item set(Attribute<T> attribute, T value) {
        return set(attribute.getName(), value);
    }

    /**
     * Sets an attribute, or clears it when the value is null.
     *
     * @throws SchemaException if the schema does not declare the attribute
     * @throws com.amazonaws.labs.dynamodb.models.exceptions.MarshalException if the value does not fit the attribute
     */
    public Item set(String attributeName, Object value) {
        Attribute<?> attribute = declared(attributeName);
        if(value == null) {
            values.remove(attributeName);
        } else {
            attribute.serializeObject(value);
            values.put(attributeName, value);
        }
        return this;
    }

    public boolean has(String attributeName) {
        return values.get(attributeName) != null;
    }

    /**
     * @return the stored version, or null if the model has no version attribute or the item was never saved
     */
    public Long getVersion() {
        Attribute<?> version = schema.getVersionAttribute();
        return version == null ? null : (Long) values.get(version.getName());
    }

    void setVersion(Long version) {
        Attribute<?> attribute = schema.getVersionAttribute();
        if(version == null) {
            values.remove(attribute.getName());
        } else {
            values.put(attribute.getName(), version);
        }
    }

    /**
     * @throws IllegalArgumentException if the hash key is not set
     */
    public ItemKey getKey() {
        Object rangeKey = schema.getRangeKey() == null ? null : values.get(schema.getRangeKey().getName());
        return ItemKey.of(values.get(schema.getHashKey().getName()), rangeKey);
    }

    /**
     * @return attributes read from the store that the schema does not declare, as raw values
     */
    public Map<String, AttributeValue> getUnknownAttributes() {
        return Collections.unmodifiableMap(unknownAttributes);
    }

    /**
     * @return a read-only view of the native values
     */
    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    void putValue(String attributeName, Object value) {
        values.put(attributeName, value);
    }

    void putUnknown(String attributeName, AttributeValue value) {
        unknownAttributes.put(attributeName, value);
    }

    /**
     * Replaces this item's state with another's, as after a refresh from the store.
     */
    void replaceWith(Item other) {
        values.clear();
        values.putAll(other.values);
        unknownAttributes.clear();
        unknownAttributes.putAll(other.unknownAttributes);
    }

    private Attribute<?> declared(String attributeName) {
        Attribute<?> attribute = schema.getAttribute(attributeName);
        if(attribute == null) {
            throw new SchemaException("Model for table " + schema.getTableName() + " has no attribute " + attributeName,
                Collections.singletonList(attributeName));
        }
        return attribute;
    }

    @Override
    public String toString() {
        return schema.getTableName() + values;
    }
}
