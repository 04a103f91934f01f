/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.amazonaws.labs.dynamodb.models.exceptions.BatchIncompleteException;
import com.amazonaws.labs.dynamodb.models.exceptions.ModelException;
import com.amazonaws.labs.dynamodb.models.util.AttributeValueJson;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.BatchWriteItemRequest;
import com.amazonaws.services.dynamodbv2.model.PutRequest;
import com.amazonaws.services.dynamodbv2.model.WriteRequest;

public class BatchExecutorTest {

    private FakeBatchDynamoDB client;
    private List<Long> sleeps;

    @Before
    public void setup() {
        client = new FakeBatchDynamoDB();
        sleeps = new ArrayList<Long>();
    }

    private BatchExecutor executor(ModelConfig config) {
        return new BatchExecutor(client, FakeBatchDynamoDB.TABLE, config) {
            @Override
            protected void sleep(long millis) {
                sleeps.add(Long.valueOf(millis));
            }
        };
    }

    private static List<WriteRequest> puts(int count) {
        List<WriteRequest> writes = new ArrayList<WriteRequest>();
        for(int i = 0; i < count; i++) {
            writes.add(put("id-" + i));
        }
        return writes;
    }

    private static WriteRequest put(String id) {
        return new WriteRequest().withPutRequest(new PutRequest().withItem(FakeBatchDynamoDB.item(id, "payload")));
    }

    @Test
    public void testUnprocessedWritesAreResubmitted() {
        client.throttledSubmissions = 2;
        client.heldBack = 5;

        executor(ModelConfig.DEFAULT).batchWrite(puts(30));

        assertEquals(30, client.items.size());
        // chunk of 25, its 5 leftovers twice, then the second chunk
        assertEquals(Arrays.asList(25, 5, 5, 5), client.writeSubmissions);
        assertTrue(client.writeSubmissions.size() <= 2 * (ModelConfig.DEFAULT.getMaxBatchRetries() + 1));
        assertEquals(Arrays.asList(25L, 50L), sleeps);
    }

    @Test
    public void testStuckWriteIsReportedAfterRetryCeiling() {
        client.stuckIds.add("id-7");
        try {
            executor(ModelConfig.DEFAULT.withMaxBatchRetries(2)).batchWrite(puts(10));
            fail();
        } catch (BatchIncompleteException e) {
            assertEquals(FakeBatchDynamoDB.TABLE, e.getTableName());
            assertEquals(Collections.singletonList(put("id-7")), e.getUnprocessedWrites());
            assertTrue(e.getUnprocessedKeys().isEmpty());
        }
        assertEquals(9, client.items.size());
        assertFalse(client.contains("id-7"));
        assertEquals(3, client.writeSubmissions.size());
        assertEquals(Arrays.asList(25L, 50L), sleeps);
    }

    @Test
    public void testStuckWriteListsChunksNotSubmitted() {
        client.stuckIds.add("id-3");
        try {
            executor(ModelConfig.DEFAULT.withMaxBatchRetries(1)).batchWrite(puts(30));
            fail();
        } catch (BatchIncompleteException e) {
            List<WriteRequest> expected = new ArrayList<WriteRequest>();
            expected.add(put("id-3"));
            expected.addAll(puts(30).subList(25, 30));
            assertEquals(expected, e.getUnprocessedWrites());
        }
        assertEquals(24, client.items.size());
        assertFalse(client.contains("id-25"));
    }

    @Test
    public void testWritesAreChunkedByPayloadSize() {
        int itemSize = AttributeValueJson.sizeOf(FakeBatchDynamoDB.item("id-0", "payload"));
        executor(ModelConfig.DEFAULT.withMaxRequestBytes(2 * itemSize)).batchWrite(puts(10));

        assertEquals(Arrays.asList(2, 2, 2, 2, 2), client.writeSubmissions);
        assertEquals(10, client.items.size());
    }

    @Test
    public void testBatchGetChunksLazily() {
        List<Map<String, AttributeValue>> keys = new ArrayList<Map<String, AttributeValue>>();
        for(int i = 0; i < 250; i++) {
            String id = "id-" + i;
            if(i % 2 == 0) {
                client.batchWriteItem(new BatchWriteItemRequest()
                    .addRequestItemsEntry(FakeBatchDynamoDB.TABLE, Collections.singletonList(put(id))));
            }
            keys.add(FakeBatchDynamoDB.key(id));
        }
        client.throttledSubmissions = 1;
        client.heldBack = 10;

        Iterator<Map<String, AttributeValue>> items = executor(ModelConfig.DEFAULT).batchGet(keys, true, null, null);
        assertTrue(client.getSubmissions.isEmpty());

        Set<String> ids = new HashSet<String>();
        while(items.hasNext()) {
            ids.add(items.next().get("id").getS());
        }
        assertEquals(125, ids.size());
        assertTrue(ids.contains("id-0"));
        assertTrue(ids.contains("id-248"));
        assertEquals(Arrays.asList(100, 10, 100, 50), client.getSubmissions);
        assertEquals(Collections.singletonList(25L), sleeps);
    }

    @Test
    public void testStuckKeyIsReported() {
        client.stuckIds.add("id-1");
        List<Map<String, AttributeValue>> keys = Arrays.asList(FakeBatchDynamoDB.key("id-0"), FakeBatchDynamoDB.key("id-1"));
        Iterator<Map<String, AttributeValue>> items = executor(ModelConfig.DEFAULT.withMaxBatchRetries(1)).batchGet(keys, false, null, null);
        try {
            items.hasNext();
            fail();
        } catch (BatchIncompleteException e) {
            assertEquals(Collections.singletonList(FakeBatchDynamoDB.key("id-1")), e.getUnprocessedKeys());
        }
        assertEquals(2, client.getSubmissions.size());
    }

    @Test
    public void testBackoffDoublesUpToCap() {
        BatchExecutor executor = executor(ModelConfig.DEFAULT.withBackoff(100, 1000));
        assertEquals(100, executor.backoffDelayMillis(1));
        assertEquals(200, executor.backoffDelayMillis(2));
        assertEquals(400, executor.backoffDelayMillis(3));
        assertEquals(800, executor.backoffDelayMillis(4));
        assertEquals(1000, executor.backoffDelayMillis(5));
        assertEquals(1000, executor.backoffDelayMillis(40));
    }

    @Test
    public void testInterruptedWaitStopsRetrying() {
        client.stuckIds.add("id-0");
        BatchExecutor executor = new BatchExecutor(client, FakeBatchDynamoDB.TABLE, ModelConfig.DEFAULT);
        Thread.currentThread().interrupt();
        try {
            executor.batchWrite(puts(1));
            fail();
        } catch (BatchIncompleteException e) {
            fail("should stop at the first wait");
        } catch (ModelException e) {
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals(1, client.writeSubmissions.size());
    }
}
