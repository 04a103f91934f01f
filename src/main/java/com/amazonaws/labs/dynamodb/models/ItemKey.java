/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

/**
 * The native hash and optional range value identifying an item.
 */
public final class ItemKey {

    private final Object hashKey;
    private final Object rangeKey;

    private ItemKey(Object hashKey, Object rangeKey) {
        if(hashKey == null) {
            throw new IllegalArgumentException("hashKey must not be null");
        }
        this.hashKey = hashKey;
        this.rangeKey = rangeKey;
    }

    public static ItemKey of(Object hashKey) {
        return new ItemKey(hashKey, null);
    }

    public static ItemKey of(Object hashKey, Object rangeKey) {
        return new ItemKey(hashKey, rangeKey);
    }

    public Object getHashKey() {
        return hashKey;
    }

    public Object getRangeKey() {
        return rangeKey;
    }

    @Override
    public int hashCode() {
        return 31 * hashKey.hashCode() + (rangeKey == null ? 0 : rangeKey.hashCode());
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof ItemKey)) {
            return false;
        }
        ItemKey other = (ItemKey) obj;
        return hashKey.equals(other.hashKey) && (rangeKey == null ? other.rangeKey == null : rangeKey.equals(other.rangeKey));
    }

    @Override
    public String toString() {
        return "ItemKey(" + hashKey + (rangeKey == null ? "" : ", " + rangeKey) + ")";
    }
}
