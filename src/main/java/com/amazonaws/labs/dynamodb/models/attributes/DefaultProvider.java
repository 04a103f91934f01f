/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

/**
 * Supplies the value of an attribute that was not set when an item is constructed.
 * Called once per item.
 */
public interface DefaultProvider<T> {

    T get();
}
