/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * The stored item's version no longer matches the version held in memory. Never retried automatically:
 * reload the item and decide whether to apply the change again.
 */
public class VersionConflictException extends ConditionalWriteException {

    private static final long serialVersionUID = -1567290331406928377L;

    private final String versionAttributeName;
    private final Long expectedVersion;

    public VersionConflictException(String tableName, Map<String, AttributeValue> key, String versionAttributeName,
        Long expectedVersion, Map<String, AttributeValue> rawValuesOnConditionFailure, Throwable t) {
        super("Version conflict on attribute " + versionAttributeName + ", expected " + expectedVersion,
            tableName, key, rawValuesOnConditionFailure, t);
        this.versionAttributeName = versionAttributeName;
        this.expectedVersion = expectedVersion;
    }

    public String getVersionAttributeName() {
        return versionAttributeName;
    }

    public Long getExpectedVersion() {
        return expectedVersion;
    }
}
