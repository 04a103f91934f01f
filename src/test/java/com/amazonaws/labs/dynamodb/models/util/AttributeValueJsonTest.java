/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import com.amazonaws.labs.dynamodb.models.exceptions.DecodeException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

public class AttributeValueJsonTest {

    @Test
    public void testTaggedForm() {
        Map<String, AttributeValue> item = new LinkedHashMap<String, AttributeValue>();
        item.put("id", new AttributeValue("a"));
        item.put("n", new AttributeValue().withN("1.5"));
        item.put("b", new AttributeValue().withB(ByteBuffer.wrap("abc".getBytes(StandardCharsets.UTF_8))));
        item.put("ok", new AttributeValue().withBOOL(true));
        item.put("none", new AttributeValue().withNULL(true));
        item.put("tags", new AttributeValue().withSS("x", "y"));

        assertEquals("{\"id\":{\"S\":\"a\"},\"n\":{\"N\":\"1.5\"},\"b\":{\"B\":\"YWJj\"},\"ok\":{\"BOOL\":true},"
            + "\"none\":{\"NULL\":true},\"tags\":{\"SS\":[\"x\",\"y\"]}}", AttributeValueJson.toJson(item));
    }

    @Test
    public void testParseNested() {
        Map<String, AttributeValue> item = AttributeValueJson.fromJson(
            "{\"doc\":{\"M\":{\"list\":{\"L\":[{\"N\":\"1\"},{\"S\":\"two\"}]}}},\"ns\":{\"NS\":[\"1\",\"2\"]}}");

        AttributeValue list = item.get("doc").getM().get("list");
        assertEquals(Arrays.asList(new AttributeValue().withN("1"), new AttributeValue("two")), list.getL());
        assertEquals(Arrays.asList("1", "2"), item.get("ns").getNS());
    }

    @Test(expected = DecodeException.class)
    public void testUnknownTag() {
        AttributeValueJson.fromJson("{\"id\":{\"X\":\"a\"}}");
    }

    @Test(expected = DecodeException.class)
    public void testUntaggedValue() {
        AttributeValueJson.fromJson("{\"id\":\"a\"}");
    }

    @Test(expected = DecodeException.class)
    public void testNotJson() {
        AttributeValueJson.fromJson("{id");
    }

    @Test
    public void testSizeGrowsWithContent() {
        Map<String, AttributeValue> small = new LinkedHashMap<String, AttributeValue>();
        small.put("id", new AttributeValue("a"));
        Map<String, AttributeValue> large = new LinkedHashMap<String, AttributeValue>(small);
        large.put("payload", new AttributeValue(new String(new char[1000]).replace('\0', 'x')));

        assertEquals(0, AttributeValueJson.sizeOf(null));
        assertTrue(AttributeValueJson.sizeOf(large) > AttributeValueJson.sizeOf(small) + 1000);
    }
}
