/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * The optimistic locking attribute of a model. Absent until the item is first written, then 1, then incremented
 * by one on every successful write. A schema may contain at most one.
 */
public class VersionAttribute extends Attribute<Long> {

    public VersionAttribute(String name) {
        super(name, AttributeType.NUMBER, Long.class, true);
    }

    @Override
    public boolean isVersion() {
        return true;
    }

    @Override
    public Attribute<Long> withHashKey(boolean hashKey) {
        if(hashKey) {
            throw new IllegalArgumentException("Version attribute " + getName() + " cannot be a key");
        }
        return super.withHashKey(hashKey);
    }

    @Override
    public Attribute<Long> withRangeKey(boolean rangeKey) {
        if(rangeKey) {
            throw new IllegalArgumentException("Version attribute " + getName() + " cannot be a key");
        }
        return super.withRangeKey(rangeKey);
    }

    @Override
    protected AttributeValue doSerialize(Long value) {
        return new AttributeValue().withN(value.toString());
    }

    @Override
    protected Long doDeserialize(AttributeValue value) {
        try {
            return Long.valueOf(NumberAttribute.fromWire(getName(), value, value.getN()).longValueExact());
        } catch (ArithmeticException e) {
            throw new UnmarshalException(getName(), value, "version is not a whole number", e);
        }
    }
}
