/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A set of binary values. Elements are {@link ByteBuffer}s so that set membership compares content. The legacy
 * encoding flag behaves as it does for {@link BinaryAttribute}.
 */
public class BinarySetAttribute extends Attribute<Set<ByteBuffer>> {

    private final boolean legacyEncoding;

    public BinarySetAttribute(String name) {
        this(name, false);
    }

    public BinarySetAttribute(String name, boolean legacyEncoding) {
        super(name, AttributeType.BINARY_SET, Set.class, true);
        this.legacyEncoding = legacyEncoding;
    }

    public boolean isLegacyEncoding() {
        return legacyEncoding;
    }

    @Override
    protected AttributeValue doSerialize(Set<ByteBuffer> value) {
        if(value.isEmpty()) {
            return null;
        }
        List<ByteBuffer> elements = new ArrayList<ByteBuffer>(value.size());
        for(Object element : value) {
            elements.add(BinaryAttribute.encode(toBytes(element, value), legacyEncoding));
        }
        return new AttributeValue().withBS(elements);
    }

    @Override
    protected Set<ByteBuffer> doDeserialize(AttributeValue value) {
        Set<ByteBuffer> result = new LinkedHashSet<ByteBuffer>();
        for(ByteBuffer b : value.getBS()) {
            result.add(ByteBuffer.wrap(BinaryAttribute.decode(getName(), value, b, legacyEncoding)));
        }
        return result;
    }

    @Override
    protected AttributeValue serializeOperand(Object operand) {
        return new AttributeValue().withB(BinaryAttribute.encode(toBytes(operand, operand), legacyEncoding));
    }

    private byte[] toBytes(Object element, Object reported) {
        if(element instanceof byte[]) {
            return (byte[]) element;
        }
        if(element instanceof ByteBuffer) {
            ByteBuffer dup = ((ByteBuffer) element).duplicate();
            byte[] bytes = new byte[dup.remaining()];
            dup.get(bytes);
            return bytes;
        }
        throw new MarshalException(getName(), reported, "binary sets can only hold non-null byte buffers");
    }
}
