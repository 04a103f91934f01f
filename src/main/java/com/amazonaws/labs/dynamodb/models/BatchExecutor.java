/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazonaws.labs.dynamodb.models.exceptions.BatchIncompleteException;
import com.amazonaws.labs.dynamodb.models.exceptions.ModelException;
import com.amazonaws.labs.dynamodb.models.util.AttributeValueJson;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.BatchGetItemRequest;
import com.amazonaws.services.dynamodbv2.model.BatchGetItemResult;
import com.amazonaws.services.dynamodbv2.model.BatchWriteItemRequest;
import com.amazonaws.services.dynamodbv2.model.BatchWriteItemResult;
import com.amazonaws.services.dynamodbv2.model.KeysAndAttributes;
import com.amazonaws.services.dynamodbv2.model.WriteRequest;

/**
 * Runs batch reads and writes against one table.
 *
 * Requests are split into chunks within the store's item count and payload limits and submitted one chunk at a
 * time. Items the store reports as unprocessed are resubmitted after an exponentially growing delay until the
 * configured retry ceiling is reached, at which point a {@link BatchIncompleteException} names every key or
 * operation that was not applied. Chunks are independent: a failing chunk does not undo earlier ones.
 */
public class BatchExecutor {

    private static final Log LOG = LogFactory.getLog(BatchExecutor.class);

    private final AmazonDynamoDB client;
    private final String tableName;
    private final ModelConfig config;

    public BatchExecutor(AmazonDynamoDB client, String tableName, ModelConfig config) {
        if(client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if(tableName == null) {
            throw new IllegalArgumentException("tableName must not be null");
        }
        this.client = client;
        this.tableName = tableName;
        this.config = config == null ? ModelConfig.DEFAULT : config;
    }

    /**
     * Reads the given keys. The returned iterator submits one chunk at a time as it is consumed; items come
     * back in the order the store returns them.
     *
     * @param projection a projection expression, or null for all attributes
     * @param nameAliases aliases used by the projection, or null
     */
    public Iterator<Map<String, AttributeValue>> batchGet(List<Map<String, AttributeValue>> keys,
        final boolean consistentRead, final String projection, final Map<String, String> nameAliases) {
        final List<List<Map<String, AttributeValue>>> chunks = chunk(keys, null, config.getBatchGetLimit(), Integer.MAX_VALUE);
        return new Iterator<Map<String, AttributeValue>>() {
            private int nextChunk = 0;
            private Iterator<Map<String, AttributeValue>> current = Collections.<Map<String, AttributeValue>>emptyList().iterator();

            @Override
            public boolean hasNext() {
                while(!current.hasNext() && nextChunk < chunks.size()) {
                    List<Map<String, AttributeValue>> chunk = chunks.get(nextChunk++);
                    current = getChunk(chunk, chunks.subList(nextChunk, chunks.size()), consistentRead, projection, nameAliases).iterator();
                }
                return current.hasNext();
            }

            @Override
            public Map<String, AttributeValue> next() {
                if(!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }

            @Override
            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    private List<Map<String, AttributeValue>> getChunk(List<Map<String, AttributeValue>> chunk,
        List<List<Map<String, AttributeValue>>> pendingChunks, boolean consistentRead, String projection,
        Map<String, String> nameAliases) {
        List<Map<String, AttributeValue>> items = new ArrayList<Map<String, AttributeValue>>();
        List<Map<String, AttributeValue>> remaining = chunk;
        int attempts = 0;
        while(true) {
            KeysAndAttributes keysAndAttributes = new KeysAndAttributes()
                .withKeys(remaining)
                .withConsistentRead(consistentRead)
                .withProjectionExpression(projection)
                .withExpressionAttributeNames(nameAliases);
            BatchGetItemRequest request = new BatchGetItemRequest()
                .withRequestItems(Collections.singletonMap(tableName, keysAndAttributes));
            attempts++;
            BatchGetItemResult result = client.batchGetItem(request);
            if(result.getResponses() != null && result.getResponses().get(tableName) != null) {
                items.addAll(result.getResponses().get(tableName));
            }
            KeysAndAttributes unprocessed = result.getUnprocessedKeys() == null ? null : result.getUnprocessedKeys().get(tableName);
            if(unprocessed == null || unprocessed.getKeys() == null || unprocessed.getKeys().isEmpty()) {
                return items;
            }
            remaining = new ArrayList<Map<String, AttributeValue>>(unprocessed.getKeys());
            if(attempts > config.getMaxBatchRetries()) {
                List<Map<String, AttributeValue>> unread = new ArrayList<Map<String, AttributeValue>>(remaining);
                for(List<Map<String, AttributeValue>> pending : pendingChunks) {
                    unread.addAll(pending);
                }
                throw BatchIncompleteException.forKeys(tableName, attempts, unread);
            }
            long delay = backoffDelayMillis(attempts);
            LOG.warn("BatchGetItem on " + tableName + " left " + remaining.size() + " keys unprocessed, attempt "
                + attempts + ", retrying in " + delay + " ms");
            sleep(delay);
        }
    }

    /**
     * Applies the given put and delete requests. Duplicate keys are not removed.
     *
     * @throws BatchIncompleteException if a chunk still has unprocessed operations after the last retry; it lists
     *             those operations and every operation that was not submitted yet
     */
    public void batchWrite(List<WriteRequest> writes) {
        List<List<WriteRequest>> chunks = chunk(writes, sizesOf(writes), config.getBatchWriteLimit(), config.getMaxRequestBytes());
        for(int i = 0; i < chunks.size(); i++) {
            writeChunk(chunks.get(i), chunks.subList(i + 1, chunks.size()));
        }
    }

    private void writeChunk(List<WriteRequest> chunk, List<List<WriteRequest>> pendingChunks) {
        List<WriteRequest> remaining = chunk;
        int attempts = 0;
        while(true) {
            BatchWriteItemRequest request = new BatchWriteItemRequest()
                .withRequestItems(Collections.singletonMap(tableName, remaining));
            attempts++;
            if(LOG.isDebugEnabled()) {
                LOG.debug("BatchWriteItem on " + tableName + " with " + remaining.size() + " operations, attempt " + attempts);
            }
            BatchWriteItemResult result = client.batchWriteItem(request);
            List<WriteRequest> unprocessed = result.getUnprocessedItems() == null ? null : result.getUnprocessedItems().get(tableName);
            if(unprocessed == null || unprocessed.isEmpty()) {
                return;
            }
            remaining = new ArrayList<WriteRequest>(unprocessed);
            if(attempts > config.getMaxBatchRetries()) {
                List<WriteRequest> unapplied = new ArrayList<WriteRequest>(remaining);
                for(List<WriteRequest> pending : pendingChunks) {
                    unapplied.addAll(pending);
                }
                throw BatchIncompleteException.forWrites(tableName, attempts, unapplied);
            }
            long delay = backoffDelayMillis(attempts);
            LOG.warn("BatchWriteItem on " + tableName + " left " + remaining.size() + " operations unprocessed, attempt "
                + attempts + ", retrying in " + delay + " ms");
            sleep(delay);
        }
    }

    /**
     * @param retry the 1-based number of the resubmission about to happen
     * @return base * 2^(retry - 1), capped at the configured maximum
     */
    protected long backoffDelayMillis(int retry) {
        long delay = config.getBaseBackoffMillis();
        for(int i = 1; i < retry && delay < config.getMaxBackoffMillis(); i++) {
            delay *= 2;
        }
        return Math.min(delay, config.getMaxBackoffMillis());
    }

    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelException("Interrupted while waiting to resubmit unprocessed batch items for " + tableName, e);
        }
    }

    /**
     * Splits elements into chunks of at most maxItems, starting a new chunk whenever the next element would take
     * the chunk's payload past maxBytes. An element larger than maxBytes on its own gets a chunk of its own.
     *
     * @param sizes the payload size of each element, or null to split by count only
     */
    private static <T> List<List<T>> chunk(List<T> elements, List<Integer> sizes, int maxItems, int maxBytes) {
        List<List<T>> chunks = new ArrayList<List<T>>();
        List<T> current = new ArrayList<T>();
        long currentBytes = 0;
        for(int i = 0; i < elements.size(); i++) {
            T element = elements.get(i);
            int size = sizes == null ? 0 : sizes.get(i).intValue();
            if(!current.isEmpty() && (current.size() >= maxItems || currentBytes + size > maxBytes)) {
                chunks.add(current);
                current = new ArrayList<T>();
                currentBytes = 0;
            }
            current.add(element);
            currentBytes += size;
        }
        if(!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    private static List<Integer> sizesOf(List<WriteRequest> writes) {
        List<Integer> sizes = new ArrayList<Integer>(writes.size());
        for(WriteRequest write : writes) {
            if(write.getPutRequest() != null) {
                sizes.add(Integer.valueOf(AttributeValueJson.sizeOf(write.getPutRequest().getItem())));
            } else {
                sizes.add(Integer.valueOf(AttributeValueJson.sizeOf(write.getDeleteRequest().getKey())));
            }
        }
        return sizes;
    }
}
