/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

import com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * An instant stored as a UTC timestamp string with microsecond precision, e.g.
 * {@code 2014-03-01T12:30:00.000000+0000}. The fixed width keeps lexical order equal to time order, so the
 * attribute works as a range key.
 */
public class UTCDateTimeAttribute extends Attribute<Instant> {

    static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSZ").withZone(ZoneOffset.UTC);

    public UTCDateTimeAttribute(String name) {
        super(name, AttributeType.STRING, Instant.class, false);
    }

    @Override
    protected AttributeValue doSerialize(Instant value) {
        return new AttributeValue().withS(FORMAT.format(value));
    }

    @Override
    protected Instant doDeserialize(AttributeValue value) {
        try {
            return Instant.from(FORMAT.parse(value.getS()));
        } catch (DateTimeParseException e) {
            throw new UnmarshalException(getName(), value, "not a UTC timestamp: " + value.getS(), e);
        }
    }

    /**
     * A default provider returning the current time, truncated to the stored precision.
     */
    public static DefaultProvider<Instant> now() {
        return new DefaultProvider<Instant>() {
            @Override
            public Instant get() {
                return Instant.now().truncatedTo(ChronoUnit.MICROS);
            }
        };
    }
}
