/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.attributes.StringAttribute;
import com.amazonaws.labs.dynamodb.models.schema.Schema;
import com.amazonaws.labs.dynamodb.models.schema.SchemaDefinition;

public class BatchWriteTest {

    private static final Attribute<String> ID = new StringAttribute("id").withHashKey(true);
    private static final Attribute<String> PAYLOAD = new StringAttribute("payload").withNullable(true);

    private static final Schema SCHEMA = new SchemaDefinition(FakeBatchDynamoDB.TABLE)
        .attribute(ID)
        .attribute(PAYLOAD)
        .register();

    private FakeBatchDynamoDB client;
    private ModelTable table;

    @Before
    public void setup() {
        client = new FakeBatchDynamoDB();
        table = new ModelTable(client, SCHEMA);
    }

    private Item item(String id) {
        Item item = table.newItem();
        item.set(ID, id);
        item.set(PAYLOAD, "payload of " + id);
        return item;
    }

    @Test
    public void testFlushesWhenFullAndOnClose() {
        BatchWrite batch = table.batchWrite();
        try {
            for(int i = 0; i < 30; i++) {
                batch.save(item("id-" + i));
            }
            assertEquals(Collections.singletonList(25), client.writeSubmissions);
            assertEquals(5, batch.getPendingCount());
        } finally {
            batch.close();
        }
        assertEquals(Arrays.asList(25, 5), client.writeSubmissions);
        assertEquals(0, batch.getPendingCount());
        assertEquals(30, client.items.size());
    }

    @Test
    public void testCloseFlushesWhenBlockExitsWithError() {
        IllegalStateException caught = null;
        try (BatchWrite batch = table.batchWrite()) {
            batch.save(item("a"));
            batch.save(item("b"));
            throw new IllegalStateException("caller failed");
        } catch (IllegalStateException e) {
            caught = e;
        }
        assertEquals("caller failed", caught.getMessage());
        assertEquals(Collections.singletonList(2), client.writeSubmissions);
        assertTrue(client.contains("a"));
        assertTrue(client.contains("b"));
    }

    @Test
    public void testDeletes() {
        BatchWrite batch = table.batchWrite();
        batch.save(item("a"));
        batch.save(item("b"));
        batch.flush();

        batch.delete(item("a"));
        batch.delete(ItemKey.of("b"));
        batch.save(item("c"));
        batch.close();

        assertFalse(client.contains("a"));
        assertFalse(client.contains("b"));
        assertTrue(client.contains("c"));
    }

    @Test
    public void testFlushWithNothingPending() {
        table.batchWrite().flush();
        assertTrue(client.writeSubmissions.isEmpty());
    }

    @Test
    public void testBatchGetDecodesItems() {
        BatchWrite batch = table.batchWrite();
        for(int i = 0; i < 5; i++) {
            batch.save(item("id-" + i));
        }
        batch.close();

        List<ItemKey> keys = new ArrayList<ItemKey>();
        keys.add(ItemKey.of("id-1"));
        keys.add(ItemKey.of("id-3"));
        keys.add(ItemKey.of("missing"));
        Iterator<Item> items = table.batchGet(keys);
        Set<String> payloads = new HashSet<String>();
        while(items.hasNext()) {
            payloads.add(items.next().get(PAYLOAD));
        }
        assertEquals(new HashSet<String>(Arrays.asList("payload of id-1", "payload of id-3")), payloads);
    }
}
