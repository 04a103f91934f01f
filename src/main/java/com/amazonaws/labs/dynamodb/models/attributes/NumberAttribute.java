/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.math.BigDecimal;
import java.math.BigInteger;

import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A number attribute. Any {@link Number} may be stored; values are read back as {@link BigDecimal} so that no
 * precision is lost in either direction.
 */
public class NumberAttribute extends Attribute<Number> {

    public NumberAttribute(String name) {
        super(name, AttributeType.NUMBER, Number.class, false);
    }

    @Override
    protected AttributeValue doSerialize(Number value) {
        return new AttributeValue().withN(toWire(getName(), value));
    }

    @Override
    protected Number doDeserialize(AttributeValue value) {
        return fromWire(getName(), value, value.getN());
    }

    /**
     * Renders a number as the decimal string the store expects.
     *
     * @throws MarshalException for NaN and infinite values
     */
    static String toWire(String attributeName, Number value) {
        if(value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if(Double.isNaN(d) || Double.isInfinite(d)) {
                throw new MarshalException(attributeName, value, "NaN and infinite numbers cannot be stored");
            }
            // Float.toString keeps the float's own shortest representation
            return new BigDecimal(value.toString()).toString();
        }
        if(value instanceof BigDecimal) {
            return ((BigDecimal) value).toString();
        }
        if(value instanceof BigInteger || value instanceof Long || value instanceof Integer
            || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        try {
            return new BigDecimal(value.toString()).toString();
        } catch (NumberFormatException e) {
            throw new MarshalException(attributeName, value, "not a decimal number: " + value, e);
        }
    }

    static BigDecimal fromWire(String attributeName, AttributeValue value, String n) {
        try {
            return new BigDecimal(n);
        } catch (NumberFormatException e) {
            throw new UnmarshalException(attributeName, value, "not a decimal number: " + n, e);
        }
    }
}
