/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.expressions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.amazonaws.labs.dynamodb.models.exceptions.BuildException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Compiles condition trees and update actions into the store's expression language.
 *
 * All expressions compiled by one builder share its {@link Placeholders}, so a single request can carry a key
 * condition, a filter, a projection and an update that reference the same aliases. Not thread-safe: use one
 * builder per request.
 */
public class ExpressionBuilder {

    private final Placeholders placeholders = new Placeholders();

    public static Expression compile(Condition condition) {
        ExpressionBuilder builder = new ExpressionBuilder();
        String expression = builder.condition(condition);
        return new Expression(expression, builder.getNameAliases(), builder.getValueAliases());
    }

    public static Expression compile(List<UpdateAction> actions) {
        ExpressionBuilder builder = new ExpressionBuilder();
        String expression = builder.update(actions);
        return new Expression(expression, builder.getNameAliases(), builder.getValueAliases());
    }

    /**
     * @return the condition expression, or null for a null condition
     */
    public String condition(Condition condition) {
        if(condition == null) {
            return null;
        }
        return condition.serialize(placeholders);
    }

    /**
     * Compiles a key condition: equality on the hash key, optionally combined with a condition on the range key.
     *
     * @param rangeKeyName the range key of the table or index being queried, null if it has none
     * @throws BuildException if the range key condition uses an operator key conditions do not support, or
     *             references another attribute
     */
    public String keyCondition(Condition.Comparison hashKeyCondition, Condition rangeKeyCondition, String rangeKeyName) {
        if(hashKeyCondition == null || hashKeyCondition.getComparator() != Condition.Comparator.EQ) {
            throw new BuildException("A key condition needs an equality condition on the hash key");
        }
        if(rangeKeyCondition == null) {
            return condition(hashKeyCondition);
        }
        if(rangeKeyName == null) {
            throw new BuildException("Range key condition given, but there is no range key to query on");
        }
        String referenced;
        if(rangeKeyCondition instanceof Condition.Comparison) {
            Condition.Comparison comparison = (Condition.Comparison) rangeKeyCondition;
            if(comparison.getComparator() == Condition.Comparator.NE) {
                throw new BuildException("<> is not supported in a key condition");
            }
            referenced = comparison.getAttributeName();
        } else if(rangeKeyCondition instanceof Condition.Between) {
            referenced = ((Condition.Between) rangeKeyCondition).getAttributeName();
        } else if(rangeKeyCondition instanceof Condition.BeginsWith) {
            referenced = ((Condition.BeginsWith) rangeKeyCondition).getAttributeName();
        } else {
            throw new BuildException("Unsupported range key condition " + rangeKeyCondition.getClass().getSimpleName());
        }
        if(!rangeKeyName.equals(referenced)) {
            throw new BuildException("Range key condition references " + referenced + ", expected range key " + rangeKeyName);
        }
        return condition(hashKeyCondition.and(rangeKeyCondition));
    }

    /**
     * Groups the actions by clause (SET, REMOVE, ADD, DELETE) keeping the call order inside each clause.
     *
     * @throws BuildException if an attribute is used by more than one clause, or there are no actions
     */
    public String update(List<UpdateAction> actions) {
        if(actions == null || actions.isEmpty()) {
            throw new BuildException("An update needs at least one action");
        }
        Map<UpdateAction.Clause, List<String>> clauses = new EnumMap<UpdateAction.Clause, List<String>>(UpdateAction.Clause.class);
        Map<String, UpdateAction.Clause> clauseByAttribute = new HashMap<String, UpdateAction.Clause>();
        for(UpdateAction action : actions) {
            UpdateAction.Clause previous = clauseByAttribute.get(action.getAttributeName());
            if(previous != null && previous != action.getClause()) {
                throw new BuildException("Attribute " + action.getAttributeName() + " appears in both the "
                    + previous + " and " + action.getClause() + " clauses");
            }
            clauseByAttribute.put(action.getAttributeName(), action.getClause());

            List<String> serialized = clauses.get(action.getClause());
            if(serialized == null) {
                serialized = new ArrayList<String>();
                clauses.put(action.getClause(), serialized);
            }
            serialized.add(action.serialize(placeholders));
        }

        StringBuilder sb = new StringBuilder();
        for(Map.Entry<UpdateAction.Clause, List<String>> clause : clauses.entrySet()) {
            if(sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(clause.getKey().name()).append(' ').append(join(clause.getValue()));
        }
        return sb.toString();
    }

    /**
     * @return a projection expression over the given attributes, or null if none were given
     */
    public String projection(Collection<String> attributeNames) {
        if(attributeNames == null || attributeNames.isEmpty()) {
            return null;
        }
        List<String> tokens = new ArrayList<String>(attributeNames.size());
        for(String name : attributeNames) {
            tokens.add(placeholders.name(name));
        }
        return join(tokens);
    }

    public Map<String, String> getNameAliases() {
        return placeholders.getExpressionAttributeNames();
    }

    public Map<String, AttributeValue> getValueAliases() {
        return placeholders.getExpressionAttributeValues();
    }

    private static String join(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        for(String part : parts) {
            if(sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
