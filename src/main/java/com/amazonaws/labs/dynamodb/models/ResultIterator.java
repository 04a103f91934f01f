/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Lazily pages through the results of a query or scan, decoding items as they are consumed. Each page's
 * continuation key is followed until the store reports no more pages or the limit is reached. An iterator can be
 * consumed once.
 */
public abstract class ResultIterator implements Iterator<Item>, Iterable<Item> {

    /**
     * One response from the store.
     */
    protected static final class Page {
        private final List<Map<String, AttributeValue>> items;
        private final Map<String, AttributeValue> lastEvaluatedKey;
        private final int count;
        private final int scannedCount;

        public Page(List<Map<String, AttributeValue>> items, Map<String, AttributeValue> lastEvaluatedKey,
            Integer count, Integer scannedCount) {
            this.items = items == null ? Collections.<Map<String, AttributeValue>>emptyList() : items;
            this.lastEvaluatedKey = lastEvaluatedKey == null || lastEvaluatedKey.isEmpty() ? null : lastEvaluatedKey;
            this.count = count == null ? this.items.size() : count.intValue();
            this.scannedCount = scannedCount == null ? this.count : scannedCount.intValue();
        }
    }

    private final ItemCodec codec;
    private final Integer limit;
    private final String indexHashKey;
    private final String indexRangeKey;

    private Iterator<Map<String, AttributeValue>> current = Collections.<Map<String, AttributeValue>>emptyList().iterator();
    private Map<String, AttributeValue> lastEvaluatedKey;
    private boolean started;
    private int returned;
    private int totalCount;
    private int scannedCount;

    /**
     * @param limit maximum number of items to return, or null for all
     * @param indexHashKey hash key of the queried index, included in a continuation key built mid-page
     */
    protected ResultIterator(ItemCodec codec, Map<String, AttributeValue> exclusiveStartKey, Integer limit,
        String indexHashKey, String indexRangeKey) {
        this.codec = codec;
        this.lastEvaluatedKey = exclusiveStartKey;
        this.limit = limit;
        this.indexHashKey = indexHashKey;
        this.indexRangeKey = indexRangeKey;
    }

    /**
     * Requests the page that starts after the given key.
     *
     * @param exclusiveStartKey null for the first page
     */
    protected abstract Page fetchPage(Map<String, AttributeValue> exclusiveStartKey);

    @Override
    public boolean hasNext() {
        if(limit != null && returned >= limit.intValue()) {
            return false;
        }
        while(!current.hasNext() && (!started || lastEvaluatedKey != null)) {
            Page page = fetchPage(lastEvaluatedKey);
            started = true;
            current = page.items.iterator();
            lastEvaluatedKey = page.lastEvaluatedKey;
            totalCount += page.count;
            scannedCount += page.scannedCount;
        }
        return current.hasNext();
    }

    @Override
    public Item next() {
        if(!hasNext()) {
            throw new NoSuchElementException();
        }
        Map<String, AttributeValue> raw = current.next();
        returned++;
        if(limit != null && returned >= limit.intValue() && current.hasNext()) {
            // stopped inside a page: resume after the last returned item
            lastEvaluatedKey = codec.keyOf(raw, indexHashKey, indexRangeKey);
        }
        return codec.decode(raw);
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException();
    }

    @Override
    public Iterator<Item> iterator() {
        return this;
    }

    /**
     * @return the key to resume from, or null once every page has been read
     */
    public Map<String, AttributeValue> getLastEvaluatedKey() {
        return lastEvaluatedKey;
    }

    /**
     * @return the number of items matched so far, summed over the pages fetched
     */
    public int getTotalCount() {
        return totalCount;
    }

    /**
     * @return the number of items the store evaluated so far, before any filter
     */
    public int getScannedCount() {
        return scannedCount;
    }
}
