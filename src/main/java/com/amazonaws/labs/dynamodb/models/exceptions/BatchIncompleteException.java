/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.WriteRequest;

/**
 * The store kept reporting unprocessed items after the retry ceiling was reached. Everything listed here was
 * not applied (or not read); everything else in the batch was.
 */
public class BatchIncompleteException extends ModelException {

    private static final long serialVersionUID = 4306188206316650153L;

    private final String tableName;
    private final List<Map<String, AttributeValue>> unprocessedKeys;
    private final List<WriteRequest> unprocessedWrites;

    private BatchIncompleteException(String message, String tableName, List<Map<String, AttributeValue>> unprocessedKeys,
        List<WriteRequest> unprocessedWrites) {
        super(message);
        this.tableName = tableName;
        this.unprocessedKeys = unprocessedKeys;
        this.unprocessedWrites = unprocessedWrites;
    }

    public static BatchIncompleteException forKeys(String tableName, int attempts, List<Map<String, AttributeValue>> keys) {
        return new BatchIncompleteException("BatchGetItem for table " + tableName + " left " + keys.size()
            + " keys unprocessed after " + attempts + " attempts: " + keys,
            tableName, Collections.unmodifiableList(keys), Collections.<WriteRequest>emptyList());
    }

    public static BatchIncompleteException forWrites(String tableName, int attempts, List<WriteRequest> writes) {
        return new BatchIncompleteException("BatchWriteItem for table " + tableName + " left " + writes.size()
            + " operations unprocessed after " + attempts + " attempts: " + writes,
            tableName, Collections.<Map<String, AttributeValue>>emptyList(), Collections.unmodifiableList(writes));
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * @return keys of a batch get that were never read
     */
    public List<Map<String, AttributeValue>> getUnprocessedKeys() {
        return unprocessedKeys;
    }

    /**
     * @return put and delete requests of a batch write that were never applied
     */
    public List<WriteRequest> getUnprocessedWrites() {
        return unprocessedWrites;
    }
}
