/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.ScalarAttributeType;

/**
 * The wire types an attribute may declare, with the tag each one carries in an item document.
 */
public enum AttributeType {
    STRING("S"),
    NUMBER("N"),
    BINARY("B"),
    BOOLEAN("BOOL"),
    STRING_SET("SS"),
    NUMBER_SET("NS"),
    BINARY_SET("BS"),
    LIST("L"),
    MAP("M");

    private final String tag;

    private AttributeType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isSet() {
        return this == STRING_SET || this == NUMBER_SET || this == BINARY_SET;
    }

    /**
     * @return the key attribute type for this wire type, or null if it cannot be used in a key
     */
    public ScalarAttributeType toScalarAttributeType() {
        switch (this) {
            case STRING:
                return ScalarAttributeType.S;
            case NUMBER:
                return ScalarAttributeType.N;
            case BINARY:
                return ScalarAttributeType.B;
            default:
                return null;
        }
    }

    public boolean isPresentIn(AttributeValue value) {
        if(value == null) {
            return false;
        }
        switch (this) {
            case STRING:
                return value.getS() != null;
            case NUMBER:
                return value.getN() != null;
            case BINARY:
                return value.getB() != null;
            case BOOLEAN:
                return value.getBOOL() != null;
            case STRING_SET:
                return value.getSS() != null;
            case NUMBER_SET:
                return value.getNS() != null;
            case BINARY_SET:
                return value.getBS() != null;
            case LIST:
                return value.getL() != null;
            case MAP:
                return value.getM() != null;
            default:
                throw new IllegalStateException("Unknown attribute type " + this);
        }
    }
}
