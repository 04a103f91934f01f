/**
 * Copyright 2013-2013 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

public class ImmutableAttributeValueTest {

    @Test
    public void testBSEquals() {
        byte[] b1 = { (byte)0x01 };
        byte[] b2 = { (byte)0x01 };
        AttributeValue av1 = new AttributeValue().withBS(ByteBuffer.wrap(b1));
        AttributeValue av2 = new AttributeValue().withBS(ByteBuffer.wrap(b2));
        assertEquals(new ImmutableAttributeValue(av1), new ImmutableAttributeValue(av2));
    }

    @Test
    public void testBSNotEq() {
        AttributeValue av1 = new AttributeValue().withBS(ByteBuffer.wrap(new byte[] { 0x01 }));
        AttributeValue av2 = new AttributeValue().withBS(ByteBuffer.wrap(new byte[] { 0x02 }));
        assertFalse(new ImmutableAttributeValue(av1).equals(new ImmutableAttributeValue(av2)));
    }

    @Test
    public void testBSWithNull() {
        byte[] b1 = { (byte)0x01 };
        AttributeValue av1 = new AttributeValue().withBS(ByteBuffer.wrap(b1), ByteBuffer.wrap(b1));
        AttributeValue av2 = new AttributeValue().withBS(ByteBuffer.wrap(b1), null);
        assertFalse(new ImmutableAttributeValue(av1).equals(new ImmutableAttributeValue(av2)));
    }

    @Test
    public void testNestedDocumentsCompareByValue() {
        AttributeValue av1 = new AttributeValue().withM(Collections.singletonMap("tags",
            new AttributeValue().withL(new AttributeValue("a"), new AttributeValue().withN("1"))));
        AttributeValue av2 = new AttributeValue().withM(Collections.singletonMap("tags",
            new AttributeValue().withL(new AttributeValue("a"), new AttributeValue().withN("1"))));
        AttributeValue av3 = new AttributeValue().withM(Collections.singletonMap("tags",
            new AttributeValue().withL(new AttributeValue().withN("1"), new AttributeValue("a"))));
        assertEquals(new ImmutableAttributeValue(av1), new ImmutableAttributeValue(av2));
        assertEquals(new ImmutableAttributeValue(av1).hashCode(), new ImmutableAttributeValue(av2).hashCode());
        assertFalse(new ImmutableAttributeValue(av1).equals(new ImmutableAttributeValue(av3)));
    }

    @Test
    public void testSSAndNSDiffer() {
        AttributeValue ss = new AttributeValue().withSS(Arrays.asList("1", "2"));
        AttributeValue ns = new AttributeValue().withNS(Arrays.asList("1", "2"));
        assertFalse(new ImmutableAttributeValue(ss).equals(new ImmutableAttributeValue(ns)));
    }

    @Test
    public void testKeysIgnoreLaterMutation() {
        Map<String, AttributeValue> key = new HashMap<String, AttributeValue>();
        key.put("id", new AttributeValue("a"));
        ImmutableKey immutable = new ImmutableKey("Table", key);
        key.put("id", new AttributeValue("b"));
        assertEquals(new ImmutableKey("Table", Collections.singletonMap("id", new AttributeValue("a"))), immutable);
        assertFalse(immutable.equals(new ImmutableKey("Other", Collections.singletonMap("id", new AttributeValue("a")))));
    }
}
