/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A map attribute holding untyped values, converted with {@link AttributeValues}.
 */
public class MapAttribute extends Attribute<Map<String, Object>> {

    public MapAttribute(String name) {
        super(name, AttributeType.MAP, Map.class, false);
    }

    @Override
    protected AttributeValue doSerialize(Map<String, Object> value) {
        return AttributeValues.toAttributeValue(getName(), value);
    }

    @Override
    protected Map<String, Object> doDeserialize(AttributeValue value) {
        return AttributeValues.toMap(getName(), value.getM());
    }
}
