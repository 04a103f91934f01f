/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

public class StringAttribute extends Attribute<String> {

    public StringAttribute(String name) {
        super(name, AttributeType.STRING, String.class, false);
    }

    @Override
    protected AttributeValue doSerialize(String value) {
        return new AttributeValue().withS(value);
    }

    @Override
    protected String doDeserialize(AttributeValue value) {
        return value.getS();
    }
}
