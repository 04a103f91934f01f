/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.amazonaws.labs.dynamodb.models.exceptions.BuildException;
import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.labs.dynamodb.models.exceptions.UnmarshalException;
import com.amazonaws.labs.dynamodb.models.expressions.Condition;
import com.amazonaws.labs.dynamodb.models.expressions.Operand;
import com.amazonaws.labs.dynamodb.models.expressions.UpdateAction;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * Describes one attribute of a model: its name, wire type, key role and default, and how its values are
 * converted to and from the store's {@link AttributeValue}.
 *
 * Attributes are immutable. The {@code withX} methods return a modified copy, so a descriptor can be shared
 * by any number of schemas and threads:
 * <pre>
 * Attribute&lt;String&gt; forum = new StringAttribute("forum").withHashKey(true);
 * Attribute&lt;Number&gt; views = new NumberAttribute("views").withDefault(0);
 * </pre>
 *
 * @param <T> the native type of the attribute's values
 */
public abstract class Attribute<T> implements Cloneable {

    private final String name;
    private final AttributeType type;
    private final Class<?> valueClass;
    private boolean nullable;
    private boolean hashKey;
    private boolean rangeKey;
    private DefaultProvider<? extends T> defaultProvider;

    protected Attribute(String name, AttributeType type, Class<?> valueClass, boolean nullable) {
        if(name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        if(type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        this.name = name;
        this.type = type;
        this.valueClass = valueClass;
        this.nullable = nullable;
    }

    public String getName() {
        return name;
    }

    public AttributeType getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean isHashKey() {
        return hashKey;
    }

    public boolean isRangeKey() {
        return rangeKey;
    }

    /**
     * @return true if the store increments this attribute on every write and conditions writes on it
     */
    public boolean isVersion() {
        return false;
    }

    public boolean hasDefault() {
        return defaultProvider != null;
    }

    /**
     * @return a freshly provided default value, or null if the attribute has no default
     */
    public T getDefault() {
        return defaultProvider == null ? null : defaultProvider.get();
    }

    /*
     * Configuration. Each method returns a copy.
     */

    public Attribute<T> withHashKey(boolean hashKey) {
        Attribute<T> copy = copy();
        copy.hashKey = hashKey;
        if(hashKey) {
            copy.nullable = false;
        }
        return copy;
    }

    public Attribute<T> withRangeKey(boolean rangeKey) {
        Attribute<T> copy = copy();
        copy.rangeKey = rangeKey;
        if(rangeKey) {
            copy.nullable = false;
        }
        return copy;
    }

    public Attribute<T> withNullable(boolean nullable) {
        if(nullable && (hashKey || rangeKey)) {
            throw new IllegalArgumentException("Key attribute " + name + " cannot be nullable");
        }
        Attribute<T> copy = copy();
        copy.nullable = nullable;
        return copy;
    }

    public Attribute<T> withDefault(final T value) {
        if(value == null) {
            throw new IllegalArgumentException("default value must not be null, use withNullable instead");
        }
        return withDefault(new DefaultProvider<T>() {
            @Override
            public T get() {
                return value;
            }
        });
    }

    public Attribute<T> withDefault(DefaultProvider<? extends T> provider) {
        Attribute<T> copy = copy();
        copy.defaultProvider = provider;
        return copy;
    }

    @SuppressWarnings("unchecked")
    private Attribute<T> copy() {
        try {
            return (Attribute<T>) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("Attribute " + name + " could not be copied", e);
        }
    }

    /*
     * Marshalling
     */

    /**
     * @return the wire value, or null if the value is null or is an empty set (which the store cannot hold)
     * @throws MarshalException if the value cannot be represented as this attribute's wire type
     */
    public final AttributeValue serialize(T value) {
        if(value == null) {
            return null;
        }
        try {
            return doSerialize(value);
        } catch (ClassCastException e) {
            throw new MarshalException(name, value, "value of type " + value.getClass().getName() + " is not a " + type, e);
        }
    }

    /**
     * Serializes a value whose static type is unknown, checking its runtime type first.
     *
     * @throws MarshalException if the value's runtime type does not match the attribute
     */
    @SuppressWarnings("unchecked")
    public final AttributeValue serializeObject(Object value) {
        if(value == null) {
            return null;
        }
        if(valueClass != null && !valueClass.isInstance(value)) {
            throw new MarshalException(name, value, "expected a " + valueClass.getName() + " but was a " + value.getClass().getName());
        }
        return serialize((T) value);
    }

    /**
     * @return the native value, or null if the wire value is absent or tagged NULL
     * @throws UnmarshalException if the wire value carries a different tag
     */
    public final T deserialize(AttributeValue value) {
        if(value == null || Boolean.TRUE.equals(value.getNULL())) {
            return null;
        }
        if(!type.isPresentIn(value)) {
            throw new UnmarshalException(name, value, "expected tag " + type.getTag());
        }
        return doDeserialize(value);
    }

    protected abstract AttributeValue doSerialize(T value);

    protected abstract T doDeserialize(AttributeValue value);

    /**
     * Serializes the operand of a begins_with or contains condition: a substring or prefix for scalar
     * attributes, a single element for sets.
     */
    protected AttributeValue serializeOperand(Object operand) {
        return serializeObject(operand);
    }

    /*
     * Conditions
     */

    public Condition eq(T value) {
        return new Condition.Comparison(this, Condition.Comparator.EQ, serialize(value));
    }

    public Condition ne(T value) {
        return new Condition.Comparison(this, Condition.Comparator.NE, serialize(value));
    }

    public Condition lt(T value) {
        return new Condition.Comparison(this, Condition.Comparator.LT, serialize(value));
    }

    public Condition le(T value) {
        return new Condition.Comparison(this, Condition.Comparator.LE, serialize(value));
    }

    public Condition gt(T value) {
        return new Condition.Comparison(this, Condition.Comparator.GT, serialize(value));
    }

    public Condition ge(T value) {
        return new Condition.Comparison(this, Condition.Comparator.GE, serialize(value));
    }

    public Condition between(T lower, T upper) {
        return new Condition.Between(this, serialize(lower), serialize(upper));
    }

    public Condition in(Collection<? extends T> values) {
        if(values == null) {
            throw new BuildException("IN condition on attribute " + name + " needs values");
        }
        List<AttributeValue> serialized = new ArrayList<AttributeValue>(values.size());
        for(T value : values) {
            serialized.add(serialize(value));
        }
        return new Condition.In(this, serialized);
    }

    public Condition exists() {
        return new Condition.Exists(this);
    }

    public Condition notExists() {
        return new Condition.NotExists(this);
    }

    public Condition beginsWith(Object prefix) {
        return new Condition.BeginsWith(this, checkedOperand("begins_with", prefix));
    }

    public Condition contains(Object operand) {
        return new Condition.Contains(this, checkedOperand("contains", operand));
    }

    private AttributeValue checkedOperand(String function, Object operand) {
        if(type != AttributeType.STRING && type != AttributeType.BINARY && !type.isSet()) {
            throw new BuildException(function + " is only valid for string, binary or set attributes, " + name + " is " + type);
        }
        return serializeOperand(operand);
    }

    /*
     * Update actions
     */

    /**
     * Sets the attribute. Setting null or an empty set removes the attribute instead.
     */
    public UpdateAction set(T value) {
        AttributeValue serialized = serialize(value);
        if(serialized == null) {
            return new UpdateAction.Remove(this);
        }
        return new UpdateAction.Set(this, new Operand.Value(serialized));
    }

    public UpdateAction set(Operand operand) {
        return new UpdateAction.Set(this, operand);
    }

    public UpdateAction setIfNotExists(T value) {
        return new UpdateAction.Set(this, Operand.ifNotExists(this, Operand.value(this, value)));
    }

    public UpdateAction remove() {
        return new UpdateAction.Remove(this);
    }

    /**
     * Adds to a number, or adds elements to a set.
     */
    public UpdateAction add(T value) {
        return new UpdateAction.Add(this, serialize(value));
    }

    /**
     * Deletes elements from a set.
     */
    public UpdateAction delete(T subset) {
        return new UpdateAction.Delete(this, serialize(subset));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
