/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

/**
 * Base class of every error raised by the models library.
 */
public class ModelException extends RuntimeException {

    private static final long serialVersionUID = -2871053164930745528L;

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable t) {
        super(message, t);
    }
}
