/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.attributes;

import java.util.ArrayList;
import java.util.List;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;

/**
 * A list attribute. With an element attribute every element is converted by it; without one, elements are
 * converted by their runtime type using {@link AttributeValues}. Null elements are stored as NULL.
 *
 * @param <E> the element type
 */
public class ListAttribute<E> extends Attribute<List<E>> {

    private final Attribute<E> elementAttribute;

    public ListAttribute(String name) {
        this(name, null);
    }

    public ListAttribute(String name, Attribute<E> elementAttribute) {
        super(name, AttributeType.LIST, List.class, false);
        this.elementAttribute = elementAttribute;
    }

    public Attribute<E> getElementAttribute() {
        return elementAttribute;
    }

    @Override
    protected AttributeValue doSerialize(List<E> value) {
        List<AttributeValue> elements = new ArrayList<AttributeValue>(value.size());
        for(E element : value) {
            AttributeValue serialized;
            if(elementAttribute == null) {
                serialized = AttributeValues.toAttributeValue(getName(), element);
            } else {
                serialized = elementAttribute.serialize(element);
            }
            elements.add(serialized == null ? new AttributeValue().withNULL(true) : serialized);
        }
        return new AttributeValue().withL(elements);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected List<E> doDeserialize(AttributeValue value) {
        List<E> result = new ArrayList<E>(value.getL().size());
        for(AttributeValue element : value.getL()) {
            if(elementAttribute == null) {
                result.add((E) AttributeValues.toObject(getName(), element));
            } else {
                result.add(elementAttribute.deserialize(element));
            }
        }
        return result;
    }
}
