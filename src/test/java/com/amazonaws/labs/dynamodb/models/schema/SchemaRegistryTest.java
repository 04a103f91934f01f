/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.schema;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.attributes.MapAttribute;
import com.amazonaws.labs.dynamodb.models.attributes.NumberAttribute;
import com.amazonaws.labs.dynamodb.models.attributes.StringAttribute;
import com.amazonaws.labs.dynamodb.models.attributes.VersionAttribute;
import com.amazonaws.labs.dynamodb.models.exceptions.SchemaException;

public class SchemaRegistryTest {

    private static final Attribute<String> FORUM = new StringAttribute("forum").withHashKey(true);
    private static final Attribute<String> SUBJECT = new StringAttribute("subject").withRangeKey(true);
    private static final Attribute<Number> VIEWS = new NumberAttribute("views").withDefault(0);

    private static Schema thread() {
        return new SchemaDefinition("Thread")
            .attribute(FORUM)
            .attribute(SUBJECT)
            .attribute(VIEWS)
            .register();
    }

    @Test
    public void testRegister() {
        Schema schema = thread();
        assertEquals("Thread", schema.getTableName());
        assertSame(FORUM, schema.getHashKey());
        assertSame(SUBJECT, schema.getRangeKey());
        assertNull(schema.getVersionAttribute());
        assertEquals(Arrays.asList("forum", "subject"), schema.getKeyAttributeNames());
        assertEquals(Arrays.asList("forum", "subject", "views"), names(schema));
    }

    @Test
    public void testRegisterIsDeterministic() {
        assertEquals(names(thread()), names(thread()));
    }

    @Test
    public void testChildOverridesParentByName() {
        Schema parent = thread();
        Attribute<String> views = new StringAttribute("views");
        Schema child = new SchemaDefinition(null)
            .attribute(views)
            .attribute(new MapAttribute("data"))
            .register(parent);
        assertEquals("Thread", child.getTableName());
        assertSame(views, child.getAttribute("views"));
        assertEquals(Arrays.asList("forum", "subject", "views", "data"), names(child));
        // the parent is untouched
        assertSame(VIEWS, parent.getAttribute("views"));
    }

    @Test
    public void testTwoVersionAttributesInOneModel() {
        SchemaDefinition definition = new SchemaDefinition("Thread")
            .attribute(FORUM)
            .attribute(new VersionAttribute("version"))
            .attribute(new VersionAttribute("version_invalid"));
        try {
            definition.register();
            fail();
        } catch (SchemaException e) {
            assertEquals("The model has more than one Version attribute: version, version_invalid", e.getMessage());
            assertEquals(Arrays.asList("version", "version_invalid"), e.getAttributeNames());
        }
    }

    @Test
    public void testSecondVersionAttributeThroughInheritance() {
        Schema parent = new SchemaDefinition("Thread")
            .attribute(FORUM)
            .attribute(new VersionAttribute("version"))
            .register();
        try {
            new SchemaDefinition(null).attribute(new VersionAttribute("version_invalid")).register(parent);
            fail();
        } catch (SchemaException e) {
            assertEquals("The model has more than one Version attribute: version, version_invalid", e.getMessage());
        }
    }

    @Test
    public void testInheritedVersionAttributeIsAllowed() {
        Schema parent = new SchemaDefinition("Thread")
            .attribute(FORUM)
            .attribute(new VersionAttribute("version"))
            .register();
        Schema child = new SchemaDefinition(null).attribute(VIEWS).register(parent);
        assertEquals("version", child.getVersionAttribute().getName());
    }

    @Test(expected = SchemaException.class)
    public void testMissingHashKey() {
        new SchemaDefinition("Thread").attribute(VIEWS).register();
    }

    @Test
    public void testTwoHashKeys() {
        try {
            new SchemaDefinition("Thread").attribute(FORUM).attribute(new StringAttribute("other").withHashKey(true)).register();
            fail();
        } catch (SchemaException e) {
            assertEquals(Arrays.asList("forum", "other"), e.getAttributeNames());
        }
    }

    @Test(expected = SchemaException.class)
    public void testTwoRangeKeys() {
        new SchemaDefinition("Thread").attribute(FORUM).attribute(SUBJECT)
            .attribute(new NumberAttribute("other").withRangeKey(true)).register();
    }

    @Test(expected = SchemaException.class)
    public void testMapCannotBeKey() {
        new SchemaDefinition("Thread").attribute(new MapAttribute("data").withHashKey(true)).register();
    }

    @Test(expected = SchemaException.class)
    public void testDuplicateDeclaration() {
        new SchemaDefinition("Thread").attribute(FORUM).attribute(new StringAttribute("forum"));
    }

    @Test(expected = SchemaException.class)
    public void testMissingTableName() {
        new SchemaDefinition(null).attribute(FORUM).register();
    }

    @Test
    public void testIndexes() {
        Attribute<Number> lastPost = new NumberAttribute("last_post");
        Schema schema = new SchemaDefinition("Thread")
            .attribute(FORUM)
            .attribute(SUBJECT)
            .attribute(VIEWS)
            .attribute(lastPost)
            .index(IndexDescriptor.local("LastPostIndex", "forum", "last_post", IndexProjection.keysOnly()))
            .index(IndexDescriptor.global("ViewsIndex", "views", null, IndexProjection.include("last_post"))
                .withProvisionedThroughput(1, 2))
            .register();
        assertEquals(2, schema.getIndexes().size());
        IndexDescriptor views = schema.getIndex("ViewsIndex");
        assertEquals(IndexDescriptor.Kind.GLOBAL, views.getKind());
        assertEquals(Long.valueOf(2), views.getWriteCapacityUnits());
        assertTrue(views.hasProvisionedThroughput());
    }

    @Test
    public void testIndexOnUndeclaredAttribute() {
        try {
            new SchemaDefinition("Thread").attribute(FORUM)
                .index(IndexDescriptor.global("Missing", "nowhere", null, null))
                .register();
            fail();
        } catch (SchemaException e) {
            assertEquals(Arrays.asList("nowhere"), e.getAttributeNames());
        }
    }

    @Test(expected = SchemaException.class)
    public void testLocalIndexMustShareHashKey() {
        new SchemaDefinition("Thread").attribute(FORUM).attribute(SUBJECT).attribute(VIEWS)
            .index(IndexDescriptor.local("Bad", "views", "subject", null))
            .register();
    }

    @Test(expected = SchemaException.class)
    public void testLocalIndexNeedsRangeKey() {
        new SchemaDefinition("Thread").attribute(FORUM).attribute(SUBJECT)
            .index(IndexDescriptor.local("Bad", "forum", null, null))
            .register();
    }

    @Test(expected = SchemaException.class)
    public void testIncludeProjectionOfUndeclaredAttribute() {
        new SchemaDefinition("Thread").attribute(FORUM).attribute(SUBJECT).attribute(VIEWS)
            .index(IndexDescriptor.global("ViewsIndex", "views", null, IndexProjection.include("nowhere")))
            .register();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLocalIndexHasNoOwnThroughput() {
        IndexDescriptor.local("LastPostIndex", "forum", "last_post", null).withProvisionedThroughput(1, 1);
    }

    private static List<String> names(Schema schema) {
        List<String> names = new ArrayList<String>();
        for(Attribute<?> attribute : schema.getAttributes()) {
            names.add(attribute.getName());
        }
        return names;
    }
}
