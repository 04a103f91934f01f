/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * Indicates an invalid model or index definition. Raised when a schema is registered, never afterwards.
 */
public class SchemaException extends ModelException {

    private static final long serialVersionUID = 3397461625105524811L;

    private final List<String> attributeNames;

    public SchemaException(String message) {
        this(message, Collections.<String>emptyList());
    }

    public SchemaException(String message, List<String> attributeNames) {
        super(message);
        this.attributeNames = Collections.unmodifiableList(attributeNames);
    }

    /**
     * @return the attributes involved in the conflict, in the order they were discovered
     */
    public List<String> getAttributeNames() {
        return attributeNames;
    }
}
