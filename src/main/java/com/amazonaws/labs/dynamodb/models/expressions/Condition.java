/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.expressions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.attributes.AttributeType;
import com.amazonaws.labs.dynamodb.models.exceptions.BuildException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * An immutable node of a condition, filter or key condition tree. Leaves are usually created through the
 * factory methods on {@link Attribute}, e.g. {@code forum.eq("foo").and(views.gt(0))}.
 */
public abstract class Condition {

    public enum Comparator {
        EQ("="),
        NE("<>"),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        private Comparator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    abstract String serialize(Placeholders placeholders);

    public Condition and(Condition other) {
        return new And(this, other);
    }

    public Condition or(Condition other) {
        return new Or(this, other);
    }

    public static Condition not(Condition condition) {
        return new Not(condition);
    }

    /**
     * Joins the given conditions with AND, skipping nulls.
     *
     * @return the combined condition, or null if every argument was null
     */
    public static Condition allOf(Condition... conditions) {
        Condition result = null;
        for(Condition condition : conditions) {
            if(condition == null) {
                continue;
            }
            result = (result == null) ? condition : new And(result, condition);
        }
        return result;
    }

    private static String checkName(Attribute<?> attribute) {
        if(attribute == null) {
            throw new IllegalArgumentException("attribute must not be null");
        }
        return attribute.getName();
    }

    private static AttributeValue checkValue(Attribute<?> attribute, AttributeValue value) {
        if(value == null) {
            throw new BuildException("Condition on attribute " + attribute.getName() + " needs a non-null value");
        }
        return value;
    }

    /*
     * Leaves
     */

    public static final class Comparison extends Condition {

        private final String attributeName;
        private final Comparator comparator;
        private final AttributeValue value;

        public Comparison(Attribute<?> attribute, Comparator comparator, AttributeValue value) {
            this.attributeName = checkName(attribute);
            this.comparator = comparator;
            this.value = checkValue(attribute, value);
        }

        public String getAttributeName() {
            return attributeName;
        }

        public Comparator getComparator() {
            return comparator;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.name(attributeName) + " " + comparator.getSymbol() + " " + placeholders.value(value);
        }
    }

    public static final class Between extends Condition {

        private final String attributeName;
        private final AttributeValue lower;
        private final AttributeValue upper;

        public Between(Attribute<?> attribute, AttributeValue lower, AttributeValue upper) {
            this.attributeName = checkName(attribute);
            this.lower = checkValue(attribute, lower);
            this.upper = checkValue(attribute, upper);
        }

        public String getAttributeName() {
            return attributeName;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return placeholders.name(attributeName) + " BETWEEN " + placeholders.value(lower) + " AND " + placeholders.value(upper);
        }
    }

    public static final class In extends Condition {

        private final String attributeName;
        private final List<AttributeValue> values;

        public In(Attribute<?> attribute, List<AttributeValue> values) {
            this.attributeName = checkName(attribute);
            if(values == null || values.isEmpty()) {
                throw new BuildException("IN condition on attribute " + attributeName + " needs at least one value");
            }
            List<AttributeValue> copy = new ArrayList<AttributeValue>(values.size());
            for(AttributeValue value : values) {
                copy.add(checkValue(attribute, value));
            }
            this.values = Collections.unmodifiableList(copy);
        }

        @Override
        String serialize(Placeholders placeholders) {
            StringBuilder sb = new StringBuilder(placeholders.name(attributeName)).append(" IN (");
            for(int i = 0; i < values.size(); i++) {
                if(i > 0) {
                    sb.append(", ");
                }
                sb.append(placeholders.value(values.get(i)));
            }
            return sb.append(")").toString();
        }
    }

    public static final class Exists extends Condition {

        private final String attributeName;

        public Exists(Attribute<?> attribute) {
            this.attributeName = checkName(attribute);
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "attribute_exists (" + placeholders.name(attributeName) + ")";
        }
    }

    public static final class NotExists extends Condition {

        private final String attributeName;

        public NotExists(Attribute<?> attribute) {
            this.attributeName = checkName(attribute);
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "attribute_not_exists (" + placeholders.name(attributeName) + ")";
        }
    }

    public static final class BeginsWith extends Condition {

        private final String attributeName;
        private final AttributeValue prefix;

        public BeginsWith(Attribute<?> attribute, AttributeValue prefix) {
            this.attributeName = checkName(attribute);
            checkSearchable(attribute, "begins_with");
            this.prefix = checkValue(attribute, prefix);
        }

        public String getAttributeName() {
            return attributeName;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "begins_with (" + placeholders.name(attributeName) + ", " + placeholders.value(prefix) + ")";
        }
    }

    public static final class Contains extends Condition {

        private final String attributeName;
        private final AttributeValue operand;

        public Contains(Attribute<?> attribute, AttributeValue operand) {
            this.attributeName = checkName(attribute);
            checkSearchable(attribute, "contains");
            this.operand = checkValue(attribute, operand);
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "contains (" + placeholders.name(attributeName) + ", " + placeholders.value(operand) + ")";
        }
    }

    private static void checkSearchable(Attribute<?> attribute, String function) {
        AttributeType type = attribute.getType();
        if(type != AttributeType.STRING && type != AttributeType.BINARY && !type.isSet()) {
            throw new BuildException(function + " is only valid for string, binary or set attributes, "
                + attribute.getName() + " is " + type);
        }
    }

    /*
     * Combinators
     */

    public static final class And extends Condition {

        private final Condition left;
        private final Condition right;

        public And(Condition left, Condition right) {
            if(left == null || right == null) {
                throw new BuildException("AND needs two operands");
            }
            this.left = left;
            this.right = right;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "(" + left.serialize(placeholders) + " AND " + right.serialize(placeholders) + ")";
        }
    }

    public static final class Or extends Condition {

        private final Condition left;
        private final Condition right;

        public Or(Condition left, Condition right) {
            if(left == null || right == null) {
                throw new BuildException("OR needs two operands");
            }
            this.left = left;
            this.right = right;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "(" + left.serialize(placeholders) + " OR " + right.serialize(placeholders) + ")";
        }
    }

    public static final class Not extends Condition {

        private final Condition condition;

        public Not(Condition condition) {
            if(condition == null) {
                throw new BuildException("NOT needs an operand");
            }
            this.condition = condition;
        }

        @Override
        String serialize(Placeholders placeholders) {
            return "(NOT " + condition.serialize(placeholders) + ")";
        }
    }
}
