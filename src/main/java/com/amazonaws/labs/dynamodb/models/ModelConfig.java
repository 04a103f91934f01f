/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

/**
 * Settings for a {@link ModelTable}. Immutable; the {@code withX} methods return modified copies.
 */
public final class ModelConfig {

    /**
     * Maximum number of keys in one BatchGetItem request.
     */
    public static final int MAX_BATCH_GET_ITEMS = 100;

    /**
     * Maximum number of operations in one BatchWriteItem request.
     */
    public static final int MAX_BATCH_WRITE_ITEMS = 25;

    /**
     * Maximum payload of one batch request, in bytes.
     */
    public static final int MAX_REQUEST_BYTES = 16 * 1024 * 1024;

    public static final ModelConfig DEFAULT = new ModelConfig(false, 5, 25L, 1000L,
        MAX_BATCH_GET_ITEMS, MAX_BATCH_WRITE_ITEMS, MAX_REQUEST_BYTES, null);

    private final boolean consistentRead;
    private final int maxBatchRetries;
    private final long baseBackoffMillis;
    private final long maxBackoffMillis;
    private final int batchGetLimit;
    private final int batchWriteLimit;
    private final int maxRequestBytes;
    private final Integer pageSize;

    private ModelConfig(boolean consistentRead, int maxBatchRetries, long baseBackoffMillis, long maxBackoffMillis,
        int batchGetLimit, int batchWriteLimit, int maxRequestBytes, Integer pageSize) {
        this.consistentRead = consistentRead;
        this.maxBatchRetries = maxBatchRetries;
        this.baseBackoffMillis = baseBackoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
        this.batchGetLimit = batchGetLimit;
        this.batchWriteLimit = batchWriteLimit;
        this.maxRequestBytes = maxRequestBytes;
        this.pageSize = pageSize;
    }

    public ModelConfig withConsistentRead(boolean consistentRead) {
        return new ModelConfig(consistentRead, maxBatchRetries, baseBackoffMillis, maxBackoffMillis,
            batchGetLimit, batchWriteLimit, maxRequestBytes, pageSize);
    }

    /**
     * @param maxBatchRetries how many times unprocessed batch items are resubmitted before giving up
     */
    public ModelConfig withMaxBatchRetries(int maxBatchRetries) {
        if(maxBatchRetries < 0) {
            throw new IllegalArgumentException("maxBatchRetries must not be negative");
        }
        return new ModelConfig(consistentRead, maxBatchRetries, baseBackoffMillis, maxBackoffMillis,
            batchGetLimit, batchWriteLimit, maxRequestBytes, pageSize);
    }

    public ModelConfig withBackoff(long baseBackoffMillis, long maxBackoffMillis) {
        if(baseBackoffMillis < 0 || maxBackoffMillis < baseBackoffMillis) {
            throw new IllegalArgumentException("Backoff must satisfy 0 <= base <= max");
        }
        return new ModelConfig(consistentRead, maxBatchRetries, baseBackoffMillis, maxBackoffMillis,
            batchGetLimit, batchWriteLimit, maxRequestBytes, pageSize);
    }

    public ModelConfig withBatchGetLimit(int batchGetLimit) {
        if(batchGetLimit < 1 || batchGetLimit > MAX_BATCH_GET_ITEMS) {
            throw new IllegalArgumentException("batchGetLimit must be between 1 and " + MAX_BATCH_GET_ITEMS);
        }
        return new ModelConfig(consistentRead, maxBatchRetries, baseBackoffMillis, maxBackoffMillis,
            batchGetLimit, batchWriteLimit, maxRequestBytes, pageSize);
    }

    public ModelConfig withBatchWriteLimit(int batchWriteLimit) {
        if(batchWriteLimit < 1 || batchWriteLimit > MAX_BATCH_WRITE_ITEMS) {
            throw new IllegalArgumentException("batchWriteLimit must be between 1 and " + MAX_BATCH_WRITE_ITEMS);
        }
        return new ModelConfig(consistentRead, maxBatchRetries, baseBackoffMillis, maxBackoffMillis,
            batchGetLimit, batchWriteLimit, maxRequestBytes, pageSize);
    }

    public ModelConfig withMaxRequestBytes(int maxRequestBytes) {
        if(maxRequestBytes < 1 || maxRequestBytes > MAX_REQUEST_BYTES) {
            throw new IllegalArgumentException("maxRequestBytes must be between 1 and " + MAX_REQUEST_BYTES);
        }
        return new ModelConfig(consistentRead, maxBatchRetries, baseBackoffMillis, maxBackoffMillis,
            batchGetLimit, batchWriteLimit, maxRequestBytes, pageSize);
    }

    /**
     * @param pageSize the default Limit of query and scan requests, or null to let the store decide
     */
    public ModelConfig withPageSize(Integer pageSize) {
        if(pageSize != null && pageSize.intValue() < 1) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        return new ModelConfig(consistentRead, maxBatchRetries, baseBackoffMillis, maxBackoffMillis,
            batchGetLimit, batchWriteLimit, maxRequestBytes, pageSize);
    }

    public boolean isConsistentRead() {
        return consistentRead;
    }

    public int getMaxBatchRetries() {
        return maxBatchRetries;
    }

    public long getBaseBackoffMillis() {
        return baseBackoffMillis;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public int getBatchGetLimit() {
        return batchGetLimit;
    }

    public int getBatchWriteLimit() {
        return batchWriteLimit;
    }

    public int getMaxRequestBytes() {
        return maxRequestBytes;
    }

    public Integer getPageSize() {
        return pageSize;
    }
}
