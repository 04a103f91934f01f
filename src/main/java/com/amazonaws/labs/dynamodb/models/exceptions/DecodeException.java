/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Thrown when an item document cannot be turned into an item, for example because a key attribute is missing.
 */
public class DecodeException extends ModelException {

    private static final long serialVersionUID = 1880145542620385069L;

    private final String tableName;
    private final Map<String, AttributeValue> document;

    public DecodeException(String message, String tableName, Map<String, AttributeValue> document) {
        this(message, tableName, document, null);
    }

    public DecodeException(String message, String tableName, Map<String, AttributeValue> document, Throwable t) {
        super(message + " for table " + tableName + ", document: " + document, t);
        this.tableName = tableName;
        this.document = document;
    }

    public String getTableName() {
        return tableName;
    }

    public Map<String, AttributeValue> getDocument() {
        return document;
    }
}
