/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.exceptions.DecodeException;
import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.labs.dynamodb.models.schema.Schema;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Converts {@link Item}s to and from the store's item documents using the attributes of a {@link Schema}.
 */
public class ItemCodec {

    private final Schema schema;

    public ItemCodec(Schema schema) {
        if(schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        this.schema = schema;
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Encodes every set attribute. Absent nullable attributes and empty sets are omitted. Raw attributes the
     * item carries from an earlier read are written back unchanged.
     *
     * @throws MarshalException if a key or other non-nullable attribute has no value, or a value does not fit
     */
    public Map<String, AttributeValue> encode(Item item) {
        Map<String, AttributeValue> document = new HashMap<String, AttributeValue>();
        for(Map.Entry<String, AttributeValue> unknown : item.getUnknownAttributes().entrySet()) {
            if(!schema.hasAttribute(unknown.getKey())) {
                document.put(unknown.getKey(), unknown.getValue());
            }
        }
        for(Attribute<?> attribute : schema.getAttributes()) {
            Object value = item.getValues().get(attribute.getName());
            AttributeValue serialized = attribute.serializeObject(value);
            if(serialized == null) {
                if(value == null && !attribute.isNullable()) {
                    throw new MarshalException(attribute.getName(), null, "Attribute '" + attribute.getName() + "' cannot be null");
                }
                continue;
            }
            document.put(attribute.getName(), serialized);
        }
        return document;
    }

    /**
     * @throws MarshalException if the item has no value for a key attribute
     */
    public Map<String, AttributeValue> encodeKey(Item item) {
        Object rangeKey = schema.getRangeKey() == null ? null : item.getValues().get(schema.getRangeKey().getName());
        return encodeKey(item.getValues().get(schema.getHashKey().getName()), rangeKey);
    }

    public Map<String, AttributeValue> encodeKey(ItemKey key) {
        return encodeKey(key.getHashKey(), key.getRangeKey());
    }

    private Map<String, AttributeValue> encodeKey(Object hashKey, Object rangeKey) {
        Map<String, AttributeValue> key = new HashMap<String, AttributeValue>();
        key.put(schema.getHashKey().getName(), keyValue(schema.getHashKey(), hashKey));
        if(schema.getRangeKey() != null) {
            key.put(schema.getRangeKey().getName(), keyValue(schema.getRangeKey(), rangeKey));
        } else if(rangeKey != null) {
            throw new IllegalArgumentException("Table " + schema.getTableName() + " has no range key, but one was given: " + rangeKey);
        }
        return key;
    }

    private static AttributeValue keyValue(Attribute<?> attribute, Object value) {
        if(value == null) {
            throw new MarshalException(attribute.getName(), null, "Key attribute '" + attribute.getName() + "' cannot be null");
        }
        return attribute.serializeObject(value);
    }

    /**
     * Extracts the table key, plus the given index's keys if any, from a full item document.
     */
    Map<String, AttributeValue> keyOf(Map<String, AttributeValue> document, String indexHashKey, String indexRangeKey) {
        Map<String, AttributeValue> key = new LinkedHashMap<String, AttributeValue>();
        for(String name : schema.getKeyAttributeNames()) {
            copyIfPresent(document, name, key);
        }
        copyIfPresent(document, indexHashKey, key);
        copyIfPresent(document, indexRangeKey, key);
        return key;
    }

    private static void copyIfPresent(Map<String, AttributeValue> from, String name, Map<String, AttributeValue> to) {
        if(name != null && from.containsKey(name)) {
            to.put(name, from.get(name));
        }
    }

    /**
     * Decodes a document read from the store. Attributes the schema does not declare are carried into the item
     * as raw values. No defaults are applied.
     *
     * @throws DecodeException if a key attribute is missing
     * @throws com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException if a value carries the wrong tag
     */
    public Item decode(Map<String, AttributeValue> document) {
        return decode(document, true);
    }

    /**
     * @param requireKeys false for partial documents such as the prior state returned with a failed condition,
     *            which only hold the attributes the store chose to return
     */
    public Item decode(Map<String, AttributeValue> document, boolean requireKeys) {
        if(document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        if(requireKeys) {
            for(String keyName : schema.getKeyAttributeNames()) {
                if(document.get(keyName) == null) {
                    throw new DecodeException("Missing key attribute " + keyName, schema.getTableName(), document);
                }
            }
        }
        Item item = new Item(schema, false);
        for(Map.Entry<String, AttributeValue> entry : document.entrySet()) {
            Attribute<?> attribute = schema.getAttribute(entry.getKey());
            if(attribute == null) {
                item.putUnknown(entry.getKey(), entry.getValue());
                continue;
            }
            Object value = attribute.deserialize(entry.getValue());
            if(value != null) {
                item.putValue(attribute.getName(), value);
            }
        }
        return item;
    }
}
