/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazonaws.labs.dynamodb.models.util.ImmutableKey;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.DeleteRequest;
import com.amazonaws.services.dynamodbv2.model.PutRequest;
import com.amazonaws.services.dynamodbv2.model.WriteRequest;

/**
 * Accumulates puts and deletes and applies them with BatchWriteItem. Operations are flushed whenever a full
 * request has accumulated and when the batch is closed:
 * <pre>
 * try (BatchWrite batch = table.batchWrite()) {
 *     batch.save(item);
 *     batch.delete(other);
 * }
 * </pre>
 * Batch writes cannot be conditional, so puts neither check nor advance the version attribute. Flushed
 * operations are not rolled back if a later flush fails.
 */
public class BatchWrite implements AutoCloseable {

    private static final Log LOG = LogFactory.getLog(BatchWrite.class);

    private final BatchExecutor executor;
    private final ItemCodec codec;
    private final String tableName;
    private final int flushThreshold;
    private final List<WriteRequest> pending = new ArrayList<WriteRequest>();
    private final Set<ImmutableKey> pendingKeys = new HashSet<ImmutableKey>();

    BatchWrite(BatchExecutor executor, ItemCodec codec, int flushThreshold) {
        this.executor = executor;
        this.codec = codec;
        this.tableName = codec.getSchema().getTableName();
        this.flushThreshold = flushThreshold;
    }

    public void save(Item item) {
        add(new WriteRequest().withPutRequest(new PutRequest().withItem(codec.encode(item))), codec.encodeKey(item));
    }

    public void delete(Item item) {
        Map<String, AttributeValue> key = codec.encodeKey(item);
        add(new WriteRequest().withDeleteRequest(new DeleteRequest().withKey(key)), key);
    }

    public void delete(ItemKey key) {
        Map<String, AttributeValue> encoded = codec.encodeKey(key);
        add(new WriteRequest().withDeleteRequest(new DeleteRequest().withKey(encoded)), encoded);
    }

    private void add(WriteRequest write, Map<String, AttributeValue> key) {
        if(!pendingKeys.add(new ImmutableKey(tableName, key))) {
            LOG.warn("Batch write on " + tableName + " has more than one pending operation for key " + key
                + "; the store rejects such requests");
        }
        pending.add(write);
        if(pending.size() >= flushThreshold) {
            flush();
        }
    }

    public int getPendingCount() {
        return pending.size();
    }

    /**
     * Submits every pending operation.
     */
    public void flush() {
        if(pending.isEmpty()) {
            return;
        }
        List<WriteRequest> writes = new ArrayList<WriteRequest>(pending);
        pending.clear();
        pendingKeys.clear();
        executor.batchWrite(writes);
    }

    @Override
    public void close() {
        flush();
    }
}
