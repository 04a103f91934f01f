/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.attributes.MapAttribute;
import com.amazonaws.labs.dynamodb.models.attributes.NumberAttribute;
import com.amazonaws.labs.dynamodb.models.attributes.StringAttribute;
import com.amazonaws.labs.dynamodb.models.attributes.VersionAttribute;
import com.amazonaws.labs.dynamodb.models.exceptions.BuildException;
import com.amazonaws.labs.dynamodb.models.exceptions.ConditionalWriteException;
import com.amazonaws.labs.dynamodb.models.exceptions.ItemNotFoundException;
import com.amazonaws.labs.dynamodb.models.exceptions.MarshalException;
import com.amazonaws.labs.dynamodb.models.exceptions.VersionConflictException;
import com.amazonaws.labs.dynamodb.models.expressions.UpdateAction;
import com.amazonaws.labs.dynamodb.models.schema.IndexDescriptor;
import com.amazonaws.labs.dynamodb.models.schema.IndexProjection;
import com.amazonaws.labs.dynamodb.models.schema.Schema;
import com.amazonaws.labs.dynamodb.models.schema.SchemaDefinition;
import com.amazonaws.labs.dynamodb.models.util.AttributeValueJson;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.DeleteItemResult;
import com.amazonaws.services.dynamodbv2.model.GetItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemResult;
import com.amazonaws.services.dynamodbv2.model.PutItemRequest;
import com.amazonaws.services.dynamodbv2.model.PutItemResult;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ReturnValue;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.amazonaws.services.dynamodbv2.model.Select;
import com.amazonaws.services.dynamodbv2.model.UpdateItemRequest;
import com.amazonaws.services.dynamodbv2.model.UpdateItemResult;

@RunWith(MockitoJUnitRunner.class)
public class ModelTableTest {

    private static final Attribute<String> FORUM = new StringAttribute("forum").withHashKey(true);
    private static final Attribute<String> SUBJECT = new StringAttribute("subject").withRangeKey(true);
    private static final Attribute<Number> VIEWS = new NumberAttribute("views").withDefault(0);
    private static final Attribute<Number> LAST_POST = new NumberAttribute("last_post").withNullable(true);
    private static final VersionAttribute VERSION = new VersionAttribute("version");

    private static final Schema THREAD = new SchemaDefinition("Thread")
        .attribute(FORUM)
        .attribute(SUBJECT)
        .attribute(VIEWS)
        .attribute(LAST_POST)
        .attribute(VERSION)
        .index(IndexDescriptor.local("LastPostIndex", "forum", "last_post", IndexProjection.all()))
        .register();

    private static final Schema UNVERSIONED = new SchemaDefinition("Forum")
        .attribute(FORUM)
        .attribute(VIEWS)
        .register();

    private static final MapAttribute DATA = new MapAttribute("data");

    private static final Schema POSTS = new SchemaDefinition("Posts")
        .attribute(new StringAttribute("user_id").withHashKey(true))
        .attribute(new StringAttribute("created_at").withRangeKey(true))
        .attribute(DATA.withNullable(true))
        .attribute(new VersionAttribute("version"))
        .register();

    @Mock
    private AmazonDynamoDB client;

    private ModelTable table;

    @Before
    public void setup() {
        table = new ModelTable(client, THREAD);
    }

    private Item newThread() {
        Item item = table.newItem();
        item.set(FORUM, "java");
        item.set(SUBJECT, "generics");
        return item;
    }

    private static Map<String, AttributeValue> stored(String subject, long views, long version) {
        Map<String, AttributeValue> raw = new HashMap<String, AttributeValue>();
        raw.put("forum", new AttributeValue("java"));
        raw.put("subject", new AttributeValue(subject));
        raw.put("views", new AttributeValue().withN(Long.toString(views)));
        raw.put("version", new AttributeValue().withN(Long.toString(version)));
        return raw;
    }

    @Test
    public void testFirstSaveIsUnconditionalAndWritesVersionOne() {
        when(client.putItem(any(PutItemRequest.class))).thenReturn(new PutItemResult());
        Item item = newThread();

        table.save(item);

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(client).putItem(captor.capture());
        PutItemRequest request = captor.getValue();
        assertEquals("Thread", request.getTableName());
        assertNull(request.getConditionExpression());
        assertEquals("1", request.getItem().get("version").getN());
        assertEquals("0", request.getItem().get("views").getN());
        assertEquals(Long.valueOf(1), item.getVersion());
    }

    @Test
    public void testVersionIsMonotonic() {
        when(client.putItem(any(PutItemRequest.class))).thenReturn(new PutItemResult());
        Item item = newThread();
        int saves = 4;
        for(int i = 0; i < saves; i++) {
            table.save(item);
        }
        assertEquals(Long.valueOf(saves), item.getVersion());

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(client, times(saves)).putItem(captor.capture());
        List<PutItemRequest> requests = captor.getAllValues();
        assertNull(requests.get(0).getConditionExpression());
        for(int i = 1; i < saves; i++) {
            PutItemRequest request = requests.get(i);
            assertEquals("(attribute_exists (#a0) AND #a0 = :v0)", request.getConditionExpression());
            assertEquals("version", request.getExpressionAttributeNames().get("#a0"));
            assertEquals(Integer.toString(i), request.getExpressionAttributeValues().get(":v0").getN());
            assertEquals(Integer.toString(i + 1), request.getItem().get("version").getN());
        }
    }

    @Test
    public void testVersionConflictOnSave() {
        ConditionalCheckFailedException failure = new ConditionalCheckFailedException("The conditional request failed");
        failure.setItem(stored("generics", 10, 5));
        when(client.putItem(any(PutItemRequest.class))).thenReturn(new PutItemResult()).thenThrow(failure);

        Item item = newThread();
        table.save(item);
        try {
            table.save(item, null, true);
            fail();
        } catch (VersionConflictException e) {
            assertSame(failure, e.getCause());
            assertEquals(Long.valueOf(1), e.getExpectedVersion());
            assertEquals("version", e.getVersionAttributeName());
            Item current = table.fromRawData(e.getRawValuesOnConditionFailure());
            assertEquals(Long.valueOf(5), current.getVersion());
            assertEquals(new BigDecimal("10"), current.get(VIEWS));
        }
        // the in-memory version only moves on success
        assertEquals(Long.valueOf(1), item.getVersion());

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(client, times(2)).putItem(captor.capture());
        assertEquals("ALL_OLD", captor.getAllValues().get(1).getReturnValuesOnConditionCheckFailure());
    }

    @Test
    public void testUserConditionFailureOnUnversionedModel() {
        ModelTable forums = new ModelTable(client, UNVERSIONED);
        when(client.putItem(any(PutItemRequest.class))).thenThrow(new ConditionalCheckFailedException("failed"));
        Item forum = forums.newItem();
        forum.set(FORUM, "java");
        try {
            forums.save(forum, FORUM.notExists());
            fail();
        } catch (VersionConflictException e) {
            fail("not a version conflict");
        } catch (ConditionalWriteException e) {
            assertEquals("Forum", e.getTableName());
            assertEquals(Collections.singletonMap("forum", new AttributeValue("java")), e.getKey());
            assertNull(e.getRawValuesOnConditionFailure());
        }
    }

    @Test
    public void testUserConditionFailureWithMatchingVersion() {
        ConditionalCheckFailedException failure = new ConditionalCheckFailedException("failed");
        failure.setItem(stored("generics", 10, 1));
        when(client.putItem(any(PutItemRequest.class))).thenReturn(new PutItemResult()).thenThrow(failure);

        Item item = newThread();
        table.save(item);
        try {
            table.save(item, VIEWS.lt(5), true);
            fail();
        } catch (VersionConflictException e) {
            fail("the stored version matched");
        } catch (ConditionalWriteException e) {
            assertEquals("1", e.getRawValuesOnConditionFailure().get("version").getN());
        }
    }

    @Test
    public void testOtherClientErrorsPassThrough() {
        AmazonServiceException throttled = new AmazonServiceException("slow down");
        when(client.putItem(any(PutItemRequest.class))).thenThrow(throttled);
        try {
            table.save(newThread());
            fail();
        } catch (AmazonServiceException e) {
            assertSame(throttled, e);
        }
    }

    @Test
    public void testUpdateIsConditionedOnVersionAndRefreshesItem() {
        when(client.updateItem(any(UpdateItemRequest.class)))
            .thenReturn(new UpdateItemResult().withAttributes(stored("generics", 11, 3)));
        Item item = table.fromRawData(stored("generics", 10, 2));

        table.update(item, Arrays.<UpdateAction>asList(VIEWS.add(1)));

        ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
        verify(client).updateItem(captor.capture());
        UpdateItemRequest request = captor.getValue();
        assertEquals("SET #a1 = :v1 ADD #a0 :v0", request.getUpdateExpression());
        assertEquals("#a1 = :v2", request.getConditionExpression());
        assertEquals("version", request.getExpressionAttributeNames().get("#a1"));
        assertEquals("3", request.getExpressionAttributeValues().get(":v1").getN());
        assertEquals("2", request.getExpressionAttributeValues().get(":v2").getN());
        assertEquals(ReturnValue.ALL_NEW.toString(), request.getReturnValues());
        assertEquals(2, request.getKey().size());

        assertEquals(Long.valueOf(3), item.getVersion());
        assertEquals(new BigDecimal("11"), item.get(VIEWS));
    }

    @Test
    public void testUpdateConflict() {
        when(client.updateItem(any(UpdateItemRequest.class))).thenThrow(new ConditionalCheckFailedException("failed"));
        Item item = table.fromRawData(stored("generics", 10, 2));
        try {
            table.update(item, Arrays.<UpdateAction>asList(VIEWS.add(1)));
            fail();
        } catch (VersionConflictException e) {
            assertEquals(Long.valueOf(2), e.getExpectedVersion());
        }
        assertEquals(Long.valueOf(2), item.getVersion());
    }

    @Test(expected = BuildException.class)
    public void testUpdateOfVersionAttributeIsRejected() {
        table.update(table.fromRawData(stored("generics", 10, 2)), Arrays.<UpdateAction>asList(VERSION.set(7L)));
    }

    @Test
    public void testDeleteIsConditionedOnVersion() {
        when(client.deleteItem(any(DeleteItemRequest.class))).thenReturn(new DeleteItemResult());
        table.delete(table.fromRawData(stored("generics", 10, 4)));

        ArgumentCaptor<DeleteItemRequest> captor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(client).deleteItem(captor.capture());
        assertEquals("#a0 = :v0", captor.getValue().getConditionExpression());
        assertEquals("4", captor.getValue().getExpressionAttributeValues().get(":v0").getN());
    }

    @Test
    public void testGet() {
        when(client.getItem(any(GetItemRequest.class)))
            .thenReturn(new GetItemResult().withItem(stored("generics", 10, 4)))
            .thenReturn(new GetItemResult());

        Item item = table.get("java", "generics");
        assertEquals("generics", item.get(SUBJECT));
        assertNull(table.get("java", "missing"));

        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(client, times(2)).getItem(captor.capture());
        assertEquals(new AttributeValue("generics"), captor.getAllValues().get(0).getKey().get("subject"));
        assertEquals(Boolean.FALSE, captor.getAllValues().get(0).getConsistentRead());
    }

    @Test
    public void testGetWithProjectionAlwaysReadsKeys() {
        when(client.getItem(any(GetItemRequest.class))).thenReturn(new GetItemResult());
        table.get(ItemKey.of("java", "generics"), true, Arrays.asList("views"));

        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(client).getItem(captor.capture());
        assertEquals("#a0, #a1, #a2", captor.getValue().getProjectionExpression());
        assertEquals("views", captor.getValue().getExpressionAttributeNames().get("#a2"));
        assertEquals(Boolean.TRUE, captor.getValue().getConsistentRead());
    }

    @Test
    public void testRefresh() {
        when(client.getItem(any(GetItemRequest.class)))
            .thenReturn(new GetItemResult().withItem(stored("generics", 12, 6)))
            .thenReturn(new GetItemResult());
        Item item = newThread();
        table.refresh(item);
        assertEquals(Long.valueOf(6), item.getVersion());
        try {
            table.refresh(item);
            fail();
        } catch (ItemNotFoundException e) {
            assertEquals(2, e.getKey().size());
        }
    }

    @Test
    public void testQueryFollowsPages() {
        Map<String, AttributeValue> lastKey = new HashMap<String, AttributeValue>();
        lastKey.put("forum", new AttributeValue("java"));
        lastKey.put("subject", new AttributeValue("b"));
        when(client.query(any(QueryRequest.class)))
            .thenReturn(new QueryResult().withItems(stored("a", 1, 1), stored("b", 1, 1)).withCount(2).withScannedCount(3)
                .withLastEvaluatedKey(lastKey))
            .thenReturn(new QueryResult().withItems(stored("c", 1, 1)).withCount(1).withScannedCount(1));

        ResultIterator results = table.query("java", SUBJECT.beginsWith("a"), VIEWS.gt(0), null);
        List<String> subjects = new ArrayList<String>();
        for(Item item : results) {
            subjects.add(item.get(SUBJECT));
        }
        assertEquals(Arrays.asList("a", "b", "c"), subjects);
        assertNull(results.getLastEvaluatedKey());
        assertEquals(3, results.getTotalCount());
        assertEquals(4, results.getScannedCount());

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(client, times(2)).query(captor.capture());
        QueryRequest first = captor.getAllValues().get(0);
        assertEquals("(#a0 = :v0 AND begins_with (#a1, :v1))", first.getKeyConditionExpression());
        assertEquals("#a2 > :v2", first.getFilterExpression());
        assertNull(first.getExclusiveStartKey());
        assertEquals(lastKey, captor.getAllValues().get(1).getExclusiveStartKey());
    }

    @Test
    public void testQueryLimitStopsInsidePage() {
        when(client.query(any(QueryRequest.class)))
            .thenReturn(new QueryResult().withItems(stored("a", 1, 1), stored("b", 1, 1), stored("c", 1, 1)).withCount(3));

        ResultIterator results = table.query("java", null, null, new QueryOptions().withLimit(2).withPageSize(3));
        assertEquals("a", results.next().get(SUBJECT));
        assertEquals("b", results.next().get(SUBJECT));
        assertFalse(results.hasNext());
        assertEquals(new AttributeValue("b"), results.getLastEvaluatedKey().get("subject"));

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(client).query(captor.capture());
        assertEquals(Integer.valueOf(3), captor.getValue().getLimit());
    }

    @Test
    public void testQueryOnIndex() {
        when(client.query(any(QueryRequest.class))).thenReturn(new QueryResult());
        ResultIterator results = table.query("java", LAST_POST.gt(100), null,
            new QueryOptions().withIndexName("LastPostIndex").withScanIndexForward(false));
        assertFalse(results.hasNext());

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(client).query(captor.capture());
        assertEquals("LastPostIndex", captor.getValue().getIndexName());
        assertEquals(Boolean.FALSE, captor.getValue().getScanIndexForward());
        assertEquals("last_post", captor.getValue().getExpressionAttributeNames().get("#a1"));
    }

    @Test(expected = BuildException.class)
    public void testQueryRangeConditionOnWrongAttribute() {
        table.query("java", VIEWS.gt(1), null, null);
    }

    @Test
    public void testCount() {
        Map<String, AttributeValue> lastKey = Collections.singletonMap("forum", new AttributeValue("java"));
        when(client.query(any(QueryRequest.class)))
            .thenReturn(new QueryResult().withCount(5).withLastEvaluatedKey(lastKey))
            .thenReturn(new QueryResult().withCount(2));

        assertEquals(7, table.count("java"));

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(client, times(2)).query(captor.capture());
        assertEquals(Select.COUNT.toString(), captor.getAllValues().get(0).getSelect());
    }

    @Test
    public void testParallelScanSegment() {
        when(client.scan(any(ScanRequest.class)))
            .thenReturn(new ScanResult().withItems(stored("a", 1, 1)).withCount(1).withScannedCount(10));

        ResultIterator results = table.scan(VIEWS.ge(1), new ScanOptions().withSegment(1, 4));
        assertTrue(results.hasNext());
        assertEquals("a", results.next().get(SUBJECT));
        assertFalse(results.hasNext());
        assertEquals(10, results.getScannedCount());

        ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
        verify(client).scan(captor.capture());
        assertEquals(Integer.valueOf(1), captor.getValue().getSegment());
        assertEquals(Integer.valueOf(4), captor.getValue().getTotalSegments());
        assertEquals("#a0 >= :v0", captor.getValue().getFilterExpression());
    }

    @Test
    public void testConditionFailurePayloadWithoutKeysDecodes() {
        ModelTable posts = new ModelTable(client, POSTS);
        Item prior = posts.fromRawData(AttributeValueJson.fromJson(
            "{\"data\": {\"M\": {\"foo\": {\"S\": \"bar\"}}}, \"version\": {\"N\": \"2\"}}"));
        assertEquals(Collections.singletonMap("foo", "bar"), prior.get(DATA));
        assertEquals(Long.valueOf(2), prior.getVersion());
        assertNull(prior.get("user_id"));
    }

    @Test
    public void testVersionIsMonotonicAcrossUpdates() {
        long initial = 5;
        int updates = 3;
        UpdateItemResult[] results = new UpdateItemResult[updates];
        for(int i = 0; i < updates; i++) {
            results[i] = new UpdateItemResult().withAttributes(stored("generics", 10, initial + i + 1));
        }
        when(client.updateItem(any(UpdateItemRequest.class)))
            .thenReturn(results[0], Arrays.copyOfRange(results, 1, updates));

        Item item = table.fromRawData(stored("generics", 10, initial));
        for(int i = 0; i < updates; i++) {
            table.update(item, Arrays.<UpdateAction>asList(VIEWS.add(10)));
        }
        assertEquals(Long.valueOf(initial + updates), item.getVersion());

        ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
        verify(client, times(updates)).updateItem(captor.capture());
        for(int i = 0; i < updates; i++) {
            UpdateItemRequest request = captor.getAllValues().get(i);
            assertEquals("#a1 = :v2", request.getConditionExpression());
            assertEquals("version", request.getExpressionAttributeNames().get("#a1"));
            assertEquals(Long.toString(initial + i), request.getExpressionAttributeValues().get(":v2").getN());
            assertEquals(Long.toString(initial + i + 1), request.getExpressionAttributeValues().get(":v1").getN());
        }
    }

    @Test
    public void testWritesOfItemWithoutKeyFailToMarshal() {
        Item keyless = table.newItem();
        try {
            table.refresh(keyless);
            fail();
        } catch (MarshalException e) {
            assertEquals("forum", e.getAttributeName());
        }
        try {
            table.delete(keyless);
            fail();
        } catch (MarshalException e) {
            assertEquals("forum", e.getAttributeName());
        }
        try {
            table.update(keyless, Arrays.<UpdateAction>asList(VIEWS.add(1)));
            fail();
        } catch (MarshalException e) {
            assertEquals("forum", e.getAttributeName());
        }
    }
}
