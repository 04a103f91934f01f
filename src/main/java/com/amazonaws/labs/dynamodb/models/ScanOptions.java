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
 * Optional settings of a scan. A parallel scan sets both a segment and the total number of segments.
 */
public class ScanOptions {

    private String indexName;
    private Boolean consistentRead;
    private Integer limit;
    private Integer pageSize;
    private Map<String, AttributeValue> exclusiveStartKey;
    private List<String> attributesToGet;
    private Integer segment;
    private Integer totalSegments;

    public ScanOptions withIndexName(String indexName) {
        this.indexName = indexName;
        return this;
    }

    public ScanOptions withConsistentRead(boolean consistentRead) {
        this.consistentRead = Boolean.valueOf(consistentRead);
        return this;
    }

    public ScanOptions withLimit(int limit) {
        this.limit = Integer.valueOf(limit);
        return this;
    }

    public ScanOptions withPageSize(int pageSize) {
        this.pageSize = Integer.valueOf(pageSize);
        return this;
    }

    public ScanOptions withExclusiveStartKey(Map<String, AttributeValue> exclusiveStartKey) {
        this.exclusiveStartKey = exclusiveStartKey;
        return this;
    }

    public ScanOptions withAttributesToGet(String... attributeNames) {
        this.attributesToGet = new ArrayList<String>(Arrays.asList(attributeNames));
        return this;
    }

    public ScanOptions withSegment(int segment, int totalSegments) {
        if(totalSegments < 1 || segment < 0 || segment >= totalSegments) {
            throw new IllegalArgumentException("Invalid segment " + segment + " of " + totalSegments);
        }
        this.segment = Integer.valueOf(segment);
        this.totalSegments = Integer.valueOf(totalSegments);
        return this;
    }

    public String getIndexName() {
        return indexName;
    }

    public Boolean getConsistentRead() {
        return consistentRead;
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

    public Integer getSegment() {
        return segment;
    }

    public Integer getTotalSegments() {
        return totalSegments;
    }
}
