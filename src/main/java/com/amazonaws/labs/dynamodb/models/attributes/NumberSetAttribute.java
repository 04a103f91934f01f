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
 * A set of numbers, read back as {@link java.math.BigDecimal}s. An empty set serializes to null.
 */
public class NumberSetAttribute extends Attribute<Set<Number>> {

    public NumberSetAttribute(String name) {
        super(name, AttributeType.NUMBER_SET, Set.class, true);
    }

    @Override
    protected AttributeValue doSerialize(Set<Number> value) {
        if(value.isEmpty()) {
            return null;
        }
        List<String> elements = new ArrayList<String>(value.size());
        for(Object element : value) {
            if(!(element instanceof Number)) {
                throw new MarshalException(getName(), value, "number sets can only hold non-null numbers");
            }
            elements.add(NumberAttribute.toWire(getName(), (Number) element));
        }
        return new AttributeValue().withNS(elements);
    }

    @Override
    protected Set<Number> doDeserialize(AttributeValue value) {
        Set<Number> result = new LinkedHashSet<Number>();
        for(String n : value.getNS()) {
            result.add(NumberAttribute.fromWire(getName(), value, n));
        }
        return result;
    }

    @Override
    protected AttributeValue serializeOperand(Object operand) {
        if(!(operand instanceof Number)) {
            throw new MarshalException(getName(), operand, "expected a number element");
        }
        return new AttributeValue().withN(NumberAttribute.toWire(getName(), (Number) operand));
    }
}
