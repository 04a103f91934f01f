/**
 * Copyright 2013-2013 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * An immutable, write-only key map for storing a DynamoDB primary key value as a map key in other maps or sets.
 */
public class ImmutableKey {

    private final String tableName;
    private final Map<String, ImmutableAttributeValue> key;

    public ImmutableKey(String tableName, Map<String, AttributeValue> mutableKey) {
        if(mutableKey == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        this.tableName = tableName;
        Map<String, ImmutableAttributeValue> keyBuilder = new HashMap<String, ImmutableAttributeValue>(mutableKey.size());
        for(Map.Entry<String, AttributeValue> e : mutableKey.entrySet()) {
            keyBuilder.put(e.getKey(), new ImmutableAttributeValue(e.getValue()));
        }
        this.key = Collections.unmodifiableMap(keyBuilder);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((tableName == null) ? 0 : tableName.hashCode());
        result = prime * result + key.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ImmutableKey other = (ImmutableKey) obj;
        if (tableName == null) {
            if (other.tableName != null)
                return false;
        }
        else if (!tableName.equals(other.tableName))
            return false;
        return key.equals(other.key);
    }
}
