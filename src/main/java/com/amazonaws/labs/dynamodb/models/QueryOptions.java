/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Optional settings of a query. Unset values fall back to the table's {@link ModelConfig}.
 */
public class QueryOptions {

    private String indexName;
    private Boolean consistentRead;
    private boolean scanIndexForward = true;
    private Integer limit;
    private Integer pageSize;
    private Map<String, AttributeValue> exclusiveStartKey;
    private List<String> attributesToGet;

    /**
     * @param indexName a local or global secondary index declared by the schema
     */
    public QueryOptions withIndexName(String indexName) {
        this.indexName = indexName;
        return this;
    }

    public QueryOptions withConsistentRead(boolean consistentRead) {
        this.consistentRead = Boolean.valueOf(consistentRead);
        return this;
    }

    /**
     * @param scanIndexForward false to return items in descending range key order
     */
    public QueryOptions withScanIndexForward(boolean scanIndexForward) {
        this.scanIndexForward = scanIndexForward;
        return this;
    }

    /**
     * @param limit the maximum number of items to return across all pages
     */
    public QueryOptions withLimit(int limit) {
        this.limit = Integer.valueOf(limit);
        return this;
    }

    /**
     * @param pageSize the number of items the store evaluates per request
     */
    public QueryOptions withPageSize(int pageSize) {
        this.pageSize = Integer.valueOf(pageSize);
        return this;
    }

    public QueryOptions withExclusiveStartKey(Map<String, AttributeValue> exclusiveStartKey) {
        this.exclusiveStartKey = exclusiveStartKey;
        return this;
    }

    /**
     * @param attributeNames attributes to read; key attributes are always read
     */
    public QueryOptions withAttributesToGet(String... attributeNames) {
        this.attributesToGet = new ArrayList<String>(Arrays.asList(attributeNames));
        return this;
    }

    public String getIndexName() {
        return indexName;
    }

    public Boolean getConsistentRead() {
        return consistentRead;
    }

    public boolean isScanIndexForward() {
        return scanIndexForward;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getPageSize() {
        return pageSize;
    }

    public Map<String, AttributeValue> getExclusiveStartKey() {
        return exclusiveStartKey;
    }

    public List<String> getAttributesToGet() {
        return attributesToGet;
    }
}
