/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

/**
 * Thrown when a native value cannot be represented as the wire type its attribute declares.
 */
public class MarshalException extends ModelException {

    private static final long serialVersionUID = 6215300178441125237L;

    private final String attributeName;
    private final Object value;

    public MarshalException(String attributeName, Object value, String message) {
        this(attributeName, value, message, null);
    }

    public MarshalException(String attributeName, Object value, String message, Throwable t) {
        super("Cannot serialize attribute " + attributeName + ": " + message, t);
        this.attributeName = attributeName;
        this.value = value;
    }

    public String getAttributeName() {
        return attributeName;
    }

    public Object getValue() {
        return value;
    }
}
