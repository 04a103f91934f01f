/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.io.IOException;

import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Stores any Jackson-mappable value as a JSON string.
 *
 * @param <T> the bound Java type, e.g. a bean, a Map or a JsonNode
 */
public class JsonAttribute<T> extends Attribute<T> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Class<T> javaType;

    public JsonAttribute(String name, Class<T> javaType) {
        super(name, AttributeType.STRING, javaType, false);
        if(javaType == null) {
            throw new IllegalArgumentException("javaType must not be null");
        }
        this.javaType = javaType;
    }

    @Override
    protected AttributeValue doSerialize(T value) {
        try {
            return new AttributeValue().withS(MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new MarshalException(getName(), value, "value cannot be written as JSON", e);
        }
    }

    @Override
    protected T doDeserialize(AttributeValue value) {
        try {
            return MAPPER.readValue(value.getS(), javaType);
        } catch (IOException e) {
            throw new UnmarshalException(getName(), value, "value is not JSON for " + javaType.getName(), e);
        }
    }
}
