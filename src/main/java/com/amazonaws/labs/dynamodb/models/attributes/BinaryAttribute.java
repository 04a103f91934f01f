/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.nio.ByteBuffer;
import java.util.Base64;

import com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A binary attribute.
 *
 * With legacy encoding the bytes are base64 encoded before they are handed to the client, which encodes them
 * again on the wire. Tables written by older clients hold values in that form. The encoding is fixed when the
 * attribute is constructed and applies to both directions.
 */
public class BinaryAttribute extends Attribute<byte[]> {

    private final boolean legacyEncoding;

    public BinaryAttribute(String name) {
        this(name, false);
    }

    public BinaryAttribute(String name, boolean legacyEncoding) {
        super(name, AttributeType.BINARY, byte[].class, false);
        this.legacyEncoding = legacyEncoding;
    }

    public boolean isLegacyEncoding() {
        return legacyEncoding;
    }

    @Override
    protected AttributeValue doSerialize(byte[] value) {
        return new AttributeValue().withB(encode(value, legacyEncoding));
    }

    @Override
    protected byte[] doDeserialize(AttributeValue value) {
        return decode(getName(), value, value.getB(), legacyEncoding);
    }

    static ByteBuffer encode(byte[] value, boolean legacyEncoding) {
        if(legacyEncoding) {
            return ByteBuffer.wrap(Base64.getEncoder().encode(value));
        }
        return ByteBuffer.wrap(value.clone());
    }

    static byte[] decode(String attributeName, AttributeValue value, ByteBuffer buf, boolean legacyEncoding) {
        ByteBuffer dup = buf.duplicate();
        byte[] bytes = new byte[dup.remaining()];
        dup.get(bytes);
        if(!legacyEncoding) {
            return bytes;
        }
        try {
            return Base64.getDecoder().decode(bytes);
        } catch (IllegalArgumentException e) {
            throw new UnmarshalException(attributeName, value, "legacy binary value is not valid base64", e);
        }
    }
}
