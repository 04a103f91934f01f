/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.Map;

import com.amazonaws.labs.dynamodb.models.attributes.VersionAttribute;
import com.amazonaws.labs.dynamodb.models.exceptions.ConditionalWriteException;
import com.amazonaws.labs.dynamodb.models.exceptions.VersionConflictException;
import com.amazonaws.labs.dynamodb.models.expressions.Condition;
import com.amazonaws.labs.dynamodb.models.expressions.Operand;
import com.amazonaws.labs.dynamodb.models.expressions.UpdateAction;
import com.amazonaws.labs.dynamodb.models.schema.Schema;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException;

/**
 * Optimistic locking through the model's version attribute.
 *
 * An item that has never been written has no version: its first put is unconditional and writes version 1.
 * Every later write is conditioned on the stored version and writes the next one. The in-memory version is only
 * advanced by the caller once the store accepted the write.
 */
class VersionControl {

    private final VersionAttribute version;

    VersionControl(Schema schema) {
        this.version = schema.getVersionAttribute();
    }

    boolean isVersioned() {
        return version != null;
    }

    String getAttributeName() {
        return version == null ? null : version.getName();
    }

    Long nextVersion(Long stored) {
        return stored == null ? Long.valueOf(1L) : Long.valueOf(stored.longValue() + 1);
    }

    /**
     * The condition for overwriting an item with a put: the stored item exists and has the expected version.
     *
     * @return null if the model is not versioned or the item was never written
     */
    Condition putCondition(Long stored) {
        if(version == null || stored == null) {
            return null;
        }
        return version.exists().and(version.eq(stored));
    }

    /**
     * The condition for updating or deleting an item. An item that was never written must not exist yet.
     */
    Condition writeCondition(Long stored) {
        if(version == null) {
            return null;
        }
        if(stored == null) {
            return version.notExists();
        }
        return version.eq(stored);
    }

    UpdateAction increment(Long stored) {
        return new UpdateAction.Set(version, Operand.value(version, nextVersion(stored)));
    }

    AttributeValue serialize(Long value) {
        return version.serialize(value);
    }

    /**
     * Translates a failed conditional write. A failure of a write that carried a version condition is reported
     * as a version conflict, unless the returned prior state shows the expected version, in which case another
     * part of the condition failed.
     */
    ConditionalWriteException translate(ConditionalCheckFailedException e, String tableName, Map<String, AttributeValue> key,
        boolean versionChecked, Long expected) {
        Map<String, AttributeValue> stored = e.getItem();
        if(versionChecked) {
            boolean versionMatched = expected != null && stored != null
                && expected.equals(version.deserialize(stored.get(version.getName())));
            if(!versionMatched) {
                return new VersionConflictException(tableName, key, version.getName(), expected, stored, e);
            }
        }
        return new ConditionalWriteException("Conditional write failed", tableName, key, stored, e);
    }
}
