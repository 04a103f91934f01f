/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.expressions;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.amazonaws.labs.dynamodb.models.util.ImmutableAttributeValue;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Hands out the #aN and :vN tokens substituted for attribute names and literal values in one request.
 * A name or value that is referenced again gets the token it was given the first time.
 *
 * Not thread-safe. Create one per request.
 */
public class Placeholders {

    private static final String NAME_PREFIX = "#a";
    private static final String VALUE_PREFIX = ":v";

    private final Map<String, String> nameTokens = new HashMap<String, String>();
    private final Map<String, String> names = new LinkedHashMap<String, String>();
    private final Map<ImmutableAttributeValue, String> valueTokens = new HashMap<ImmutableAttributeValue, String>();
    private final Map<String, AttributeValue> values = new LinkedHashMap<String, AttributeValue>();

    public String name(String attributeName) {
        if(attributeName == null) {
            throw new IllegalArgumentException("attributeName must not be null");
        }
        String token = nameTokens.get(attributeName);
        if(token == null) {
            token = NAME_PREFIX + nameTokens.size();
            nameTokens.put(attributeName, token);
            names.put(token, attributeName);
        }
        return token;
    }

    public String value(AttributeValue value) {
        if(value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        ImmutableAttributeValue key = new ImmutableAttributeValue(value);
        String token = valueTokens.get(key);
        if(token == null) {
            token = VALUE_PREFIX + valueTokens.size();
            valueTokens.put(key, token);
            values.put(token, value);
        }
        return token;
    }

    /**
     * @return token to attribute name, or null if no name was referenced (the store rejects empty maps)
     */
    public Map<String, String> getExpressionAttributeNames() {
        return names.isEmpty() ? null : new LinkedHashMap<String, String>(names);
    }

    /**
     * @return token to value, or null if no value was referenced (the store rejects empty maps)
     */
    public Map<String, AttributeValue> getExpressionAttributeValues() {
        return values.isEmpty() ? null : new LinkedHashMap<String, AttributeValue>(values);
    }
}
