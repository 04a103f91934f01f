/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A write was rejected because its condition did not hold for the item's current state.
 *
 * If the caller asked for it, {@link #getRawValuesOnConditionFailure()} holds the item as the store saw it,
 * exactly as returned. Decode it with {@code ModelTable.fromRawData}.
 */
public class ConditionalWriteException extends ModelException {

    private static final long serialVersionUID = 8209964143402532190L;

    private final String tableName;
    private final Map<String, AttributeValue> key;
    private final Map<String, AttributeValue> rawValuesOnConditionFailure;

    public ConditionalWriteException(String message, String tableName, Map<String, AttributeValue> key,
        Map<String, AttributeValue> rawValuesOnConditionFailure, Throwable t) {
        super(message + " for table " + tableName + " key " + key, t);
        this.tableName = tableName;
        this.key = key;
        this.rawValuesOnConditionFailure = rawValuesOnConditionFailure;
    }

    public String getTableName() {
        return tableName;
    }

    public Map<String, AttributeValue> getKey() {
        return key;
    }

    /**
     * @return the stored item at the time of the failure, or null if it was not requested or the item does not exist
     */
    public Map<String, AttributeValue> getRawValuesOnConditionFailure() {
        return rawValuesOnConditionFailure;
    }
}
