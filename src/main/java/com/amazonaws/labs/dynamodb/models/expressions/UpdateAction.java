/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.expressions;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.attributes.AttributeType;
import com.amazonaws.labs.dynamodb.models.exceptions.BuildException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * One action of an update expression. Actions are grouped into the store's SET, REMOVE, ADD and DELETE
 * clauses when compiled.
 */
public abstract class UpdateAction {

    /**
     * Clauses in the order they are written into the expression.
     */
    public enum Clause {
        SET,
        REMOVE,
        ADD,
        DELETE
    }

    private final String attributeName;

    protected UpdateAction(Attribute<?> attribute) {
        if(attribute == null) {
            throw new IllegalArgumentException("attribute must not be null");
        }
        this.attributeName = attribute.getName();
    }

    public String getAttributeName() {
        return attributeName;
    }

    public abstract Clause getClause();

    abstract String serialize(Placeholders placeholders);

    public static final class Set extends UpdateAction {

        private final Operand operand;

        public Set(Attribute<?> attribute, Operand operand) {
            super(attribute);
            if(operand == null) {
                throw new BuildException("SET on attribute " + attribute.getName() + " needs an operand");
            }
            this.operand = operand;
        }

        @Override
        public Clause getClause() {
            return Clause.SET;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.name(getAttributeName()) + " = " + operand.serialize(placeholders);
        }
    }

    public static final class Remove extends UpdateAction {

        public Remove(Attribute<?> attribute) {
            super(attribute);
            if(attribute.isHashKey() || attribute.isRangeKey()) {
                throw new BuildException("Cannot remove key attribute " + attribute.getName());
            }
        }

        @Override
        public Clause getClause() {
            return Clause.REMOVE;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.name(getAttributeName());
        }
    }

    public static final class Add extends UpdateAction {

        private final AttributeValue value;

        public Add(Attribute<?> attribute, AttributeValue value) {
            super(attribute);
            AttributeType type = attribute.getType();
            if(type != AttributeType.NUMBER && !type.isSet()) {
                throw new BuildException("ADD is only valid for number or set attributes, " + attribute.getName() + " is " + type);
            }
            if(value == null) {
                throw new BuildException("ADD on attribute " + attribute.getName() + " needs a non-null, non-empty value");
            }
            this.value = value;
        }

        @Override
        public Clause getClause() {
            return Clause.ADD;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.name(getAttributeName()) + " " + placeholders.value(value);
        }
    }

    public static final class Delete extends UpdateAction {

        private final AttributeValue subset;

        public Delete(Attribute<?> attribute, AttributeValue subset) {
            super(attribute);
            if(!attribute.getType().isSet()) {
                throw new BuildException("DELETE is only valid for set attributes, " + attribute.getName() + " is " + attribute.getType());
            }
            if(subset == null) {
                throw new BuildException("DELETE on attribute " + attribute.getName() + " needs a non-empty set");
            }
            this.subset = subset;
        }

        @Override
        public Clause getClause() {
            return Clause.DELETE;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.name(getAttributeName()) + " " + placeholders.value(subset);
        }
    }
}
