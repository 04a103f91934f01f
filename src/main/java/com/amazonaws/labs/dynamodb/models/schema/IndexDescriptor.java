/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.schema;

/**
 * Declares a local or global secondary index. Local indexes share the table's hash key and must have a range
 * key; global indexes define their own key pair and may carry provisioned throughput.
 */
public final class IndexDescriptor {

    public enum Kind {
        LOCAL,
        GLOBAL
    }

    private final String name;
    private final Kind kind;
    private final String hashKeyName;
    private final String rangeKeyName;
    private final IndexProjection projection;
    private final Long readCapacityUnits;
    private final Long writeCapacityUnits;

    private IndexDescriptor(String name, Kind kind, String hashKeyName, String rangeKeyName, IndexProjection projection,
        Long readCapacityUnits, Long writeCapacityUnits) {
        if(name == null || name.isEmpty()) {
            throw new IllegalArgumentException("index name must not be empty");
        }
        if(hashKeyName == null) {
            throw new IllegalArgumentException("hashKeyName must not be null");
        }
        this.name = name;
        this.kind = kind;
        this.hashKeyName = hashKeyName;
        this.rangeKeyName = rangeKeyName;
        this.projection = projection == null ? IndexProjection.all() : projection;
        this.readCapacityUnits = readCapacityUnits;
        this.writeCapacityUnits = writeCapacityUnits;
    }

    public static IndexDescriptor local(String name, String hashKeyName, String rangeKeyName, IndexProjection projection) {
        return new IndexDescriptor(name, Kind.LOCAL, hashKeyName, rangeKeyName, projection, null, null);
    }

    public static IndexDescriptor global(String name, String hashKeyName, String rangeKeyName, IndexProjection projection) {
        return new IndexDescriptor(name, Kind.GLOBAL, hashKeyName, rangeKeyName, projection, null, null);
    }

    public IndexDescriptor withProvisionedThroughput(long readCapacityUnits, long writeCapacityUnits) {
        if(kind == Kind.LOCAL) {
            throw new IllegalArgumentException("Local index " + name + " shares the table's throughput");
        }
        return new IndexDescriptor(name, kind, hashKeyName, rangeKeyName, projection,
            Long.valueOf(readCapacityUnits), Long.valueOf(writeCapacityUnits));
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public String getHashKeyName() {
        return hashKeyName;
    }

    /**
     * @return the range key name, or null if the index has none
     */
    public String getRangeKeyName() {
        return rangeKeyName;
    }

    public IndexProjection getProjection() {
        return projection;
    }

    public boolean hasProvisionedThroughput() {
        return readCapacityUnits != null;
    }

    public Long getReadCapacityUnits() {
        return readCapacityUnits;
    }

    public Long getWriteCapacityUnits() {
        return writeCapacityUnits;
    }

    @Override
    public String toString() {
        return kind + " index " + name + "(" + hashKeyName + (rangeKeyName == null ? "" : ", " + rangeKeyName) + ")";
    }
}
