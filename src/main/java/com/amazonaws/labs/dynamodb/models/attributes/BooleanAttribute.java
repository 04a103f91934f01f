/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

public class BooleanAttribute extends Attribute<Boolean> {

    public BooleanAttribute(String name) {
        super(name, AttributeType.BOOLEAN, Boolean.class, false);
    }

    @Override
    protected AttributeValue doSerialize(Boolean value) {
        return new AttributeValue().withBOOL(value);
    }

    @Override
    protected Boolean doDeserialize(AttributeValue value) {
        return value.getBOOL();
    }
}
