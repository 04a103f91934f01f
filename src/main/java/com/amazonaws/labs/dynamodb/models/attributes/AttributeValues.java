/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Converts untyped values, such as the contents of lists and maps without an element attribute, to and from
 * {@link AttributeValue}s by inspecting their runtime type.
 *
 * <ul>
 * <li>String, Number, Boolean, byte[] and ByteBuffer map to S, N, BOOL and B</li>
 * <li>non-empty Sets of strings, numbers or binaries map to SS, NS and BS</li>
 * <li>other Collections map to L, Maps with string keys to M, and null to NULL</li>
 * </ul>
 * Reading returns BigDecimal for numbers, byte[] for binaries and ByteBuffer for binary set elements.
 */
public final class AttributeValues {

    private AttributeValues() { }

    public static AttributeValue toAttributeValue(String attributeName, Object value) {
        if(value == null) {
            return new AttributeValue().withNULL(true);
        }
        if(value instanceof String) {
            return new AttributeValue().withS((String) value);
        }
        if(value instanceof Number) {
            return new AttributeValue().withN(NumberAttribute.toWire(attributeName, (Number) value));
        }
        if(value instanceof Boolean) {
            return new AttributeValue().withBOOL((Boolean) value);
        }
        if(value instanceof byte[]) {
            return new AttributeValue().withB(ByteBuffer.wrap(((byte[]) value).clone()));
        }
        if(value instanceof ByteBuffer) {
            return new AttributeValue().withB(copy((ByteBuffer) value));
        }
        if(value instanceof Set) {
            return toSet(attributeName, (Set<?>) value);
        }
        if(value instanceof Collection) {
            List<AttributeValue> list = new ArrayList<AttributeValue>();
            for(Object element : (Collection<?>) value) {
                list.add(toAttributeValue(attributeName, element));
            }
            return new AttributeValue().withL(list);
        }
        if(value instanceof Map) {
            Map<String, AttributeValue> map = new LinkedHashMap<String, AttributeValue>();
            for(Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if(!(entry.getKey() instanceof String)) {
                    throw new MarshalException(attributeName, value, "map keys must be strings, found " + entry.getKey());
                }
                map.put((String) entry.getKey(), toAttributeValue(attributeName, entry.getValue()));
            }
            return new AttributeValue().withM(map);
        }
        throw new MarshalException(attributeName, value, "cannot store a value of type " + value.getClass().getName());
    }

    private static AttributeValue toSet(String attributeName, Set<?> value) {
        if(value.isEmpty()) {
            throw new MarshalException(attributeName, value, "empty sets cannot be stored");
        }
        Object first = value.iterator().next();
        if(first instanceof String) {
            List<String> ss = new ArrayList<String>();
            for(Object element : value) {
                ss.add((String) checkElement(attributeName, value, element, String.class));
            }
            return new AttributeValue().withSS(ss);
        }
        if(first instanceof Number) {
            List<String> ns = new ArrayList<String>();
            for(Object element : value) {
                ns.add(NumberAttribute.toWire(attributeName, (Number) checkElement(attributeName, value, element, Number.class)));
            }
            return new AttributeValue().withNS(ns);
        }
        if(first instanceof ByteBuffer || first instanceof byte[]) {
            List<ByteBuffer> bs = new ArrayList<ByteBuffer>();
            for(Object element : value) {
                if(element instanceof byte[]) {
                    bs.add(ByteBuffer.wrap(((byte[]) element).clone()));
                } else {
                    bs.add(copy((ByteBuffer) checkElement(attributeName, value, element, ByteBuffer.class)));
                }
            }
            return new AttributeValue().withBS(bs);
        }
        throw new MarshalException(attributeName, value, "sets can only hold strings, numbers or binaries");
    }

    private static Object checkElement(String attributeName, Set<?> set, Object element, Class<?> expected) {
        if(!expected.isInstance(element)) {
            throw new MarshalException(attributeName, set, "set elements must all be of type " + expected.getSimpleName());
        }
        return element;
    }

    public static Object toObject(String attributeName, AttributeValue value) {
        if(value == null || Boolean.TRUE.equals(value.getNULL())) {
            return null;
        }
        if(value.getS() != null) {
            return value.getS();
        }
        if(value.getN() != null) {
            return NumberAttribute.fromWire(attributeName, value, value.getN());
        }
        if(value.getBOOL() != null) {
            return value.getBOOL();
        }
        if(value.getB() != null) {
            ByteBuffer dup = value.getB().duplicate();
            byte[] bytes = new byte[dup.remaining()];
            dup.get(bytes);
            return bytes;
        }
        if(value.getSS() != null) {
            return new LinkedHashSet<String>(value.getSS());
        }
        if(value.getNS() != null) {
            Set<BigDecimal> ns = new LinkedHashSet<BigDecimal>();
            for(String n : value.getNS()) {
                ns.add(NumberAttribute.fromWire(attributeName, value, n));
            }
            return ns;
        }
        if(value.getBS() != null) {
            Set<ByteBuffer> bs = new LinkedHashSet<ByteBuffer>();
            for(ByteBuffer b : value.getBS()) {
                bs.add(copy(b));
            }
            return bs;
        }
        if(value.getL() != null) {
            List<Object> list = new ArrayList<Object>(value.getL().size());
            for(AttributeValue element : value.getL()) {
                list.add(toObject(attributeName, element));
            }
            return list;
        }
        if(value.getM() != null) {
            return toMap(attributeName, value.getM());
        }
        throw new UnmarshalException(attributeName, value, "attribute value carries no known tag");
    }

    /**
     * Converts the entries of an M value with {@link #toObject(String, AttributeValue)}, keeping their order.
     */
    public static Map<String, Object> toMap(String attributeName, Map<String, AttributeValue> entries) {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for(Map.Entry<String, AttributeValue> entry : entries.entrySet()) {
            map.put(entry.getKey(), toObject(attributeName, entry.getValue()));
        }
        return map;
    }

    private static ByteBuffer copy(ByteBuffer buffer) {
        ByteBuffer dup = buffer.duplicate();
        byte[] bytes = new byte[dup.remaining()];
        dup.get(bytes);
        return ByteBuffer.wrap(bytes);
    }
}
