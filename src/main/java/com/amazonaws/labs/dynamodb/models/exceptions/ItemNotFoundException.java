/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

public class ItemNotFoundException extends ModelException {

    private static final long serialVersionUID = -5090412760281529301L;

    private final Map<String, AttributeValue> key;

    public ItemNotFoundException(String tableName, Map<String, AttributeValue> key) {
        super("Item does not exist in table " + tableName + " for key " + key);
        this.key = key;
    }

    public Map<String, AttributeValue> getKey() {
        return key;
    }
}
