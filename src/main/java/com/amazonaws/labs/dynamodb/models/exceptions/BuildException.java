/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

/**
 * A condition or update expression was put together in a way the store cannot accept.
 */
public class BuildException extends ModelException {

    private static final long serialVersionUID = -6950417352086262001L;

    public BuildException(String message) {
        super(message);
    }
}
