/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazonaws.services.dynamodbv2.model.Projection;
import com.amazonaws.services.dynamodbv2.model.ProjectionType;

/**
 * Which attributes a secondary index copies from the table.
 */
public final class IndexProjection {

    private static final IndexProjection ALL = new IndexProjection(ProjectionType.ALL, Collections.<String>emptyList());
    private static final IndexProjection KEYS_ONLY = new IndexProjection(ProjectionType.KEYS_ONLY, Collections.<String>emptyList());

    private final ProjectionType type;
    private final List<String> nonKeyAttributes;

    private IndexProjection(ProjectionType type, List<String> nonKeyAttributes) {
        this.type = type;
        this.nonKeyAttributes = nonKeyAttributes;
    }

    public static IndexProjection all() {
        return ALL;
    }

    public static IndexProjection keysOnly() {
        return KEYS_ONLY;
    }

    public static IndexProjection include(String... nonKeyAttributes) {
        if(nonKeyAttributes == null || nonKeyAttributes.length == 0) {
            throw new IllegalArgumentException("An INCLUDE projection needs at least one attribute");
        }
        return new IndexProjection(ProjectionType.INCLUDE,
            Collections.unmodifiableList(new ArrayList<String>(Arrays.asList(nonKeyAttributes))));
    }

    public ProjectionType getType() {
        return type;
    }

    public List<String> getNonKeyAttributes() {
        return nonKeyAttributes;
    }

    public Projection toProjection() {
        Projection projection = new Projection().withProjectionType(type);
        if(type == ProjectionType.INCLUDE) {
            projection.setNonKeyAttributes(nonKeyAttributes);
        }
        return projection;
    }

    @Override
    public String toString() {
        return type == ProjectionType.INCLUDE ? type + nonKeyAttributes.toString() : type.toString();
    }
}
