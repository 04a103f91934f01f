/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.expressions;

import java.util.Collections;
import java.util.Map;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A compiled expression together with the name and value substitutions it refers to.
 */
public final class Expression {

    private final String expression;
    private final Map<String, String> nameAliases;
    private final Map<String, AttributeValue> valueAliases;

    Expression(String expression, Map<String, String> nameAliases, Map<String, AttributeValue> valueAliases) {
        this.expression = expression;
        this.nameAliases = nameAliases == null ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(nameAliases);
        this.valueAliases = valueAliases == null ? Collections.<String, AttributeValue>emptyMap() : Collections.unmodifiableMap(valueAliases);
    }

    public String getExpression() {
        return expression;
    }

    public Map<String, String> getNameAliases() {
        return nameAliases;
    }

    public Map<String, AttributeValue> getValueAliases() {
        return valueAliases;
    }

    @Override
    public String toString() {
        return expression + " names=" + nameAliases + " values=" + valueAliases;
    }
}
