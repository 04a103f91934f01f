/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.expressions;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.exceptions.BuildException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * The right-hand side of a SET action: a literal, another attribute, or one of the store's update functions.
 */
public abstract class Operand {

    abstract String serialize(Placeholders placeholders);

    public static Operand path(Attribute<?> attribute) {
        return new Path(attribute);
    }

    public static <T> Operand value(Attribute<T> attribute, T value) {
        AttributeValue serialized = attribute.serialize(value);
        if(serialized == null) {
            throw new BuildException("Operand for attribute " + attribute.getName() + " needs a non-null, non-empty value");
        }
        return new Value(serialized);
    }

    /**
     * if_not_exists (path, value): the attribute's current value, or the given value if it has none.
     */
    public static Operand ifNotExists(Attribute<?> attribute, Operand value) {
        return new IfNotExists(new Path(attribute), value);
    }

    /**
     * list_append (left, right): concatenation of two lists.
     */
    public static Operand listAppend(Operand left, Operand right) {
        return new ListAppend(left, right);
    }

    public static Operand plus(Operand left, Operand right) {
        return new Arithmetic(left, "+", right);
    }

    public static Operand minus(Operand left, Operand right) {
        return new Arithmetic(left, "-", right);
    }

    public static final class Path extends Operand {

        private final String attributeName;

        public Path(Attribute<?> attribute) {
            if(attribute == null) {
                throw new IllegalArgumentException("attribute must not be null");
            }
            this.attributeName = attribute.getName();
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.name(attributeName);
        }
    }

    public static final class Value extends Operand {

        private final AttributeValue value;

        public Value(AttributeValue value) {
            if(value == null) {
                throw new IllegalArgumentException("value must not be null");
            }
            this.value = value;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.value(value);
        }
    }

    public static final class IfNotExists extends Operand {

        private final Path path;
        private final Operand value;

        public IfNotExists(Path path, Operand value) {
            if(path == null || value == null) {
                throw new BuildException("if_not_exists needs a path and a value");
            }
            this.path = path;
            this.value = value;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "if_not_exists (" + path.serialize(placeholders) + ", " + value.serialize(placeholders) + ")";
        }
    }

    public static final class ListAppend extends Operand {

        private final Operand left;
        private final Operand right;

        public ListAppend(Operand left, Operand right) {
            if(left == null || right == null) {
                throw new BuildException("list_append needs two operands");
            }
            this.left = left;
            this.right = right;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "list_append (" + left.serialize(placeholders) + ", " + right.serialize(placeholders) + ")";
        }
    }

    public static final class Arithmetic extends Operand {

        private final Operand left;
        private final String operator;
        private final Operand right;

        public Arithmetic(Operand left, String operator, Operand right) {
            if(left == null || right == null) {
                throw new BuildException("Arithmetic needs two operands");
            }
            if(!"+".equals(operator) && !"-".equals(operator)) {
                throw new BuildException("Unsupported operator " + operator);
            }
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return left.serialize(placeholders) + " " + operator + " " + right.serialize(placeholders);
        }
    }
}
