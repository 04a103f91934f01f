/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Thrown when a wire value does not carry the tag its attribute declares, or its content cannot be parsed.
 */
public class UnmarshalException extends ModelException {

    private static final long serialVersionUID = -4400937208152318262L;

    private final String attributeName;
    private final AttributeValue attributeValue;

    public UnmarshalException(String attributeName, AttributeValue attributeValue, String message) {
        this(attributeName, attributeValue, message, null);
    }

    public UnmarshalException(String attributeName, AttributeValue attributeValue, String message, Throwable t) {
        super("Cannot deserialize attribute " + attributeName + ": " + message + ", value: " + attributeValue, t);
        this.attributeName = attributeName;
        this.attributeValue = attributeValue;
    }

    public String getAttributeName() {
        return attributeName;
    }

    public AttributeValue getAttributeValue() {
        return attributeValue;
    }
}
