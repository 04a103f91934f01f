/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A set of strings. The store cannot hold an empty set, so an empty set serializes to null and is written as
 * an absent attribute.
 */
public class StringSetAttribute extends Attribute<Set<String>> {

    public StringSetAttribute(String name) {
        super(name, AttributeType.STRING_SET, Set.class, true);
    }

    @Override
    protected AttributeValue doSerialize(Set<String> value) {
        if(value.isEmpty()) {
            return null;
        }
        List<String> elements = new ArrayList<String>(value.size());
        for(Object element : value) {
            if(!(element instanceof String)) {
                throw new MarshalException(getName(), value, "string sets can only hold non-null strings");
            }
            elements.add((String) element);
        }
        return new AttributeValue().withSS(elements);
    }

    @Override
    protected Set<String> doDeserialize(AttributeValue value) {
        return new LinkedHashSet<String>(value.getSS());
    }

    @Override
    protected AttributeValue serializeOperand(Object operand) {
        if(!(operand instanceof String)) {
            throw new MarshalException(getName(), operand, "expected a string element");
        }
        return new AttributeValue().withS((String) operand);
    }
}
