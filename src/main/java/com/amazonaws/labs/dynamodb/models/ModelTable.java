/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.exceptions.BuildException;
import com.amazonaws.labs.dynamodb.models.exceptions.ItemNotFoundException;
import com.amazonaws.labs.dynamodb.models.exceptions.SchemaException;
import com.amazonaws.labs.dynamodb.models.expressions.Condition;
import com.amazonaws.labs.dynamodb.models.expressions.ExpressionBuilder;
import com.amazonaws.labs.dynamodb.models.expressions.UpdateAction;
import com.amazonaws.labs.dynamodb.models.schema.IndexDescriptor;
import com.amazonaws.labs.dynamodb.models.schema.Schema;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.ConditionalCheckFailedException;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemResult;
import com.amazonaws.services.dynamodbv2.model.PutItemRequest;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ReturnValue;
import com.amazonaws.services.dynamodbv2.model.ReturnValuesOnConditionCheckFailure;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.amazonaws.services.dynamodbv2.model.Select;
import com.amazonaws.services.dynamodbv2.model.UpdateItemRequest;
import com.amazonaws.services.dynamodbv2.model.UpdateItemResult;

/**
 * Reads and writes the items of one model through an {@link AmazonDynamoDB} client.
 *
 * Writes of versioned models are conditioned on the item's stored version, see {@link VersionControl}. A write
 * whose condition fails raises a {@link com.amazonaws.labs.dynamodb.models.exceptions.ConditionalWriteException},
 * or a {@link com.amazonaws.labs.dynamodb.models.exceptions.VersionConflictException} when the version did not
 * match. Other client exceptions propagate unchanged.
 *
 * A table holds no per-call state and may be shared across threads; the items it returns may not.
 */
public class ModelTable {

    private static final Log LOG = LogFactory.getLog(ModelTable.class);

    private final AmazonDynamoDB client;
    private final Schema schema;
    private final ModelConfig config;
    private final ItemCodec codec;
    private final VersionControl versionControl;
    private final BatchExecutor batchExecutor;

    public ModelTable(AmazonDynamoDB client, Schema schema) {
        this(client, schema, ModelConfig.DEFAULT);
    }

    public ModelTable(AmazonDynamoDB client, Schema schema, ModelConfig config) {
        if(client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if(schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        this.client = client;
        this.schema = schema;
        this.config = config == null ? ModelConfig.DEFAULT : config;
        this.codec = new ItemCodec(schema);
        this.versionControl = new VersionControl(schema);
        this.batchExecutor = new BatchExecutor(client, schema.getTableName(), this.config);
    }

    public Schema getSchema() {
        return schema;
    }

    public ModelConfig getConfig() {
        return config;
    }

    public String getTableName() {
        return schema.getTableName();
    }

    public Item newItem() {
        return new Item(schema);
    }

    /**
     * Decodes a raw item document, such as the prior state attached to a failed conditional write. Key
     * attributes may be missing from such a document.
     */
    public Item fromRawData(Map<String, AttributeValue> document) {
        return codec.decode(document, false);
    }

    /*
     * Single item operations
     */

    /**
     * @return the item, or null if it does not exist
     */
    public Item get(Object hashKey) {
        return get(ItemKey.of(hashKey));
    }

    public Item get(Object hashKey, Object rangeKey) {
        return get(ItemKey.of(hashKey, rangeKey));
    }

    public Item get(ItemKey key) {
        return get(key, config.isConsistentRead(), null);
    }

    /**
     * @param attributesToGet attributes to read, or null for all; key attributes are always read
     * @return the item, or null if it does not exist
     */
    public Item get(ItemKey key, boolean consistentRead, List<String> attributesToGet) {
        return get(codec.encodeKey(key), consistentRead, attributesToGet);
    }

    private Item get(Map<String, AttributeValue> key, boolean consistentRead, List<String> attributesToGet) {
        ExpressionBuilder builder = new ExpressionBuilder();
        GetItemRequest request = new GetItemRequest()
            .withTableName(getTableName())
            .withKey(key)
            .withConsistentRead(consistentRead)
            .withProjectionExpression(builder.projection(withKeys(attributesToGet, null)))
            .withExpressionAttributeNames(builder.getNameAliases());
        GetItemResult result = client.getItem(request);
        if(result.getItem() == null) {
            return null;
        }
        return codec.decode(result.getItem());
    }

    /**
     * Replaces the item's state with the stored one.
     *
     * @throws ItemNotFoundException if the item no longer exists
     * @throws com.amazonaws.labs.dynamodb.models.exceptions.MarshalException if the item has no key
     */
    public void refresh(Item item) {
        Map<String, AttributeValue> key = codec.encodeKey(item);
        Item stored = get(key, config.isConsistentRead(), null);
        if(stored == null) {
            throw new ItemNotFoundException(getTableName(), key);
        }
        item.replaceWith(stored);
    }

    public void save(Item item) {
        save(item, null, false);
    }

    public void save(Item item, Condition condition) {
        save(item, condition, false);
    }

    /**
     * Puts the whole item. A versioned item that was saved before is only written if the stored version still
     * matches; on success the item's version is advanced.
     *
     * @param returnValuesOnConditionFailure whether a failed condition should carry the stored item
     */
    public void save(Item item, Condition condition, boolean returnValuesOnConditionFailure) {
        Long stored = item.getVersion();
        Map<String, AttributeValue> document = codec.encode(item);
        Condition versionCondition = versionControl.putCondition(stored);
        if(versionControl.isVersioned()) {
            document.put(versionControl.getAttributeName(), versionControl.serialize(versionControl.nextVersion(stored)));
        }

        ExpressionBuilder builder = new ExpressionBuilder();
        PutItemRequest request = new PutItemRequest()
            .withTableName(getTableName())
            .withItem(document)
            .withConditionExpression(builder.condition(Condition.allOf(condition, versionCondition)))
            .withExpressionAttributeNames(builder.getNameAliases())
            .withExpressionAttributeValues(builder.getValueAliases());
        if(returnValuesOnConditionFailure) {
            request.setReturnValuesOnConditionCheckFailure(ReturnValuesOnConditionCheckFailure.ALL_OLD);
        }
        if(LOG.isDebugEnabled()) {
            LOG.debug("PutItem on " + getTableName() + " condition " + request.getConditionExpression());
        }
        try {
            client.putItem(request);
        } catch (ConditionalCheckFailedException e) {
            throw versionControl.translate(e, getTableName(), codec.encodeKey(item), versionCondition != null, stored);
        }
        if(versionControl.isVersioned()) {
            item.setVersion(versionControl.nextVersion(stored));
        }
    }

    public void update(Item item, List<UpdateAction> actions) {
        update(item, actions, null, false);
    }

    public void update(Item item, List<UpdateAction> actions, Condition condition) {
        update(item, actions, condition, false);
    }

    /**
     * Applies update actions to the stored item and refreshes the item from the store's response. A versioned
     * update is conditioned on the stored version and increments it.
     *
     * @throws BuildException if an action targets the version attribute
     */
    public void update(Item item, List<UpdateAction> actions, Condition condition, boolean returnValuesOnConditionFailure) {
        if(actions == null || actions.isEmpty()) {
            throw new BuildException("An update needs at least one action");
        }
        Long stored = item.getVersion();
        List<UpdateAction> all = new ArrayList<UpdateAction>(actions);
        Condition versionCondition = null;
        if(versionControl.isVersioned()) {
            for(UpdateAction action : actions) {
                if(action.getAttributeName().equals(versionControl.getAttributeName())) {
                    throw new BuildException("Version attribute " + action.getAttributeName() + " cannot be updated directly");
                }
            }
            versionCondition = versionControl.writeCondition(stored);
            all.add(versionControl.increment(stored));
        }

        Map<String, AttributeValue> key = codec.encodeKey(item);
        ExpressionBuilder builder = new ExpressionBuilder();
        UpdateItemRequest request = new UpdateItemRequest()
            .withTableName(getTableName())
            .withKey(key)
            .withUpdateExpression(builder.update(all))
            .withConditionExpression(builder.condition(Condition.allOf(condition, versionCondition)))
            .withExpressionAttributeNames(builder.getNameAliases())
            .withExpressionAttributeValues(builder.getValueAliases())
            .withReturnValues(ReturnValue.ALL_NEW);
        if(returnValuesOnConditionFailure) {
            request.setReturnValuesOnConditionCheckFailure(ReturnValuesOnConditionCheckFailure.ALL_OLD);
        }
        if(LOG.isDebugEnabled()) {
            LOG.debug("UpdateItem on " + getTableName() + " update " + request.getUpdateExpression()
                + " condition " + request.getConditionExpression());
        }
        UpdateItemResult result;
        try {
            result = client.updateItem(request);
        } catch (ConditionalCheckFailedException e) {
            throw versionControl.translate(e, getTableName(), key, versionCondition != null, stored);
        }
        if(result.getAttributes() != null) {
            item.replaceWith(codec.decode(result.getAttributes()));
        } else if(versionControl.isVersioned()) {
            item.setVersion(versionControl.nextVersion(stored));
        }
    }

    public void delete(Item item) {
        delete(item, null, false);
    }

    public void delete(Item item, Condition condition) {
        delete(item, condition, false);
    }

    /**
     * Deletes the item. A versioned item is only deleted if the stored version still matches.
     */
    public void delete(Item item, Condition condition, boolean returnValuesOnConditionFailure) {
        Long stored = item.getVersion();
        Condition versionCondition = versionControl.writeCondition(stored);
        Map<String, AttributeValue> key = codec.encodeKey(item);
        ExpressionBuilder builder = new ExpressionBuilder();
        DeleteItemRequest request = new DeleteItemRequest()
            .withTableName(getTableName())
            .withKey(key)
            .withConditionExpression(builder.condition(Condition.allOf(condition, versionCondition)))
            .withExpressionAttributeNames(builder.getNameAliases())
            .withExpressionAttributeValues(builder.getValueAliases());
        if(returnValuesOnConditionFailure) {
            request.setReturnValuesOnConditionCheckFailure(ReturnValuesOnConditionCheckFailure.ALL_OLD);
        }
        if(LOG.isDebugEnabled()) {
            LOG.debug("DeleteItem on " + getTableName() + " condition " + request.getConditionExpression());
        }
        try {
            client.deleteItem(request);
        } catch (ConditionalCheckFailedException e) {
            throw versionControl.translate(e, getTableName(), key, versionCondition != null, stored);
        }
    }

    /*
     * Query and scan
     */

    public ResultIterator query(Object hashKey) {
        return query(hashKey, null, null, null);
    }

    /**
     * Queries the table, or the index named by the options, for one hash key. Pages are requested lazily as
     * the returned iterator is consumed.
     *
     * @param rangeKeyCondition a comparison, between or begins_with on the range key, or null
     * @param filter applied by the store after reading, or null
     * @param options null for defaults
     */
    public ResultIterator query(Object hashKey, Condition rangeKeyCondition, Condition filter, QueryOptions options) {
        if(options == null) {
            options = new QueryOptions();
        }
        IndexDescriptor index = resolveIndex(options.getIndexName());
        final QueryRequest template = buildQuery(hashKey, rangeKeyCondition, filter, options.getAttributesToGet(), index);
        template.setConsistentRead(consistentRead(options.getConsistentRead()));
        template.setScanIndexForward(Boolean.valueOf(options.isScanIndexForward()));
        template.setLimit(pageSize(options.getPageSize(), options.getLimit()));
        return new ResultIterator(codec, options.getExclusiveStartKey(), options.getLimit(),
            index == null ? null : index.getHashKeyName(), index == null ? null : index.getRangeKeyName()) {
            @Override
            protected Page fetchPage(Map<String, AttributeValue> exclusiveStartKey) {
                QueryResult result = client.query(template.clone().withExclusiveStartKey(exclusiveStartKey));
                return new Page(result.getItems(), result.getLastEvaluatedKey(), result.getCount(), result.getScannedCount());
            }
        };
    }

    public int count(Object hashKey) {
        return count(hashKey, null, null, null);
    }

    /**
     * Counts the items matching a query without reading them. Follows every page, stopping early once the
     * options' limit is reached.
     */
    public int count(Object hashKey, Condition rangeKeyCondition, Condition filter, QueryOptions options) {
        if(options == null) {
            options = new QueryOptions();
        }
        IndexDescriptor index = resolveIndex(options.getIndexName());
        QueryRequest template = buildQuery(hashKey, rangeKeyCondition, filter, null, index);
        template.setSelect(Select.COUNT);
        template.setConsistentRead(consistentRead(options.getConsistentRead()));
        template.setLimit(pageSize(options.getPageSize(), null));
        Map<String, AttributeValue> startKey = options.getExclusiveStartKey();
        int count = 0;
        do {
            QueryResult result = client.query(template.clone().withExclusiveStartKey(startKey));
            count += result.getCount() == null ? 0 : result.getCount().intValue();
            startKey = result.getLastEvaluatedKey();
            if(options.getLimit() != null && count >= options.getLimit().intValue()) {
                return options.getLimit().intValue();
            }
        } while(startKey != null && !startKey.isEmpty());
        return count;
    }

    public ResultIterator scan() {
        return scan(null, null);
    }

    /**
     * Reads every item of the table or index, or one segment of it for a parallel scan. The store reads and
     * charges for every item whatever the filter, so the cost grows with the table's size.
     */
    public ResultIterator scan(Condition filter, ScanOptions options) {
        if(options == null) {
            options = new ScanOptions();
        }
        IndexDescriptor index = resolveIndex(options.getIndexName());
        ExpressionBuilder builder = new ExpressionBuilder();
        final ScanRequest template = new ScanRequest()
            .withTableName(getTableName())
            .withIndexName(index == null ? null : index.getName())
            .withFilterExpression(builder.condition(filter))
            .withProjectionExpression(builder.projection(withKeys(options.getAttributesToGet(), index)))
            .withConsistentRead(consistentRead(options.getConsistentRead()))
            .withLimit(pageSize(options.getPageSize(), options.getLimit()))
            .withSegment(options.getSegment())
            .withTotalSegments(options.getTotalSegments());
        template.setExpressionAttributeNames(builder.getNameAliases());
        template.setExpressionAttributeValues(builder.getValueAliases());
        if(LOG.isDebugEnabled()) {
            LOG.debug("Scan on " + getTableName() + (index == null ? "" : " index " + index.getName())
                + " filter " + template.getFilterExpression()
                + (options.getSegment() == null ? "" : " segment " + options.getSegment() + "/" + options.getTotalSegments()));
        }
        return new ResultIterator(codec, options.getExclusiveStartKey(), options.getLimit(),
            index == null ? null : index.getHashKeyName(), index == null ? null : index.getRangeKeyName()) {
            @Override
            protected Page fetchPage(Map<String, AttributeValue> exclusiveStartKey) {
                ScanResult result = client.scan(template.clone().withExclusiveStartKey(exclusiveStartKey));
                return new Page(result.getItems(), result.getLastEvaluatedKey(), result.getCount(), result.getScannedCount());
            }
        };
    }

    /*
     * Batches
     */

    public Iterator<Item> batchGet(Collection<ItemKey> keys) {
        return batchGet(keys, config.isConsistentRead(), null);
    }

    /**
     * Reads many items, requesting them in chunks as the returned iterator is consumed. Items come back in no
     * particular order and missing items are skipped.
     *
     * @throws com.amazonaws.labs.dynamodb.models.exceptions.BatchIncompleteException if keys are still
     *             unprocessed after the last retry
     */
    public Iterator<Item> batchGet(Collection<ItemKey> keys, boolean consistentRead, List<String> attributesToGet) {
        List<Map<String, AttributeValue>> encoded = new ArrayList<Map<String, AttributeValue>>(keys.size());
        for(ItemKey key : keys) {
            encoded.add(codec.encodeKey(key));
        }
        ExpressionBuilder builder = new ExpressionBuilder();
        String projection = builder.projection(withKeys(attributesToGet, null));
        final Iterator<Map<String, AttributeValue>> raw =
            batchExecutor.batchGet(encoded, consistentRead, projection, builder.getNameAliases());
        return new Iterator<Item>() {
            @Override
            public boolean hasNext() {
                return raw.hasNext();
            }

            @Override
            public Item next() {
                return codec.decode(raw.next());
            }

            @Override
            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    /**
     * Opens a batch of puts and deletes, flushed when full and on close.
     */
    public BatchWrite batchWrite() {
        return new BatchWrite(batchExecutor, codec, config.getBatchWriteLimit());
    }

    /*
     * Helpers
     */

    private QueryRequest buildQuery(Object hashKey, Condition rangeKeyCondition, Condition filter,
        List<String> attributesToGet, IndexDescriptor index) {
        if(hashKey == null) {
            throw new IllegalArgumentException("hashKey must not be null");
        }
        Attribute<?> hashAttribute = index == null ? schema.getHashKey() : schema.getAttribute(index.getHashKeyName());
        String rangeKeyName;
        if(index != null) {
            rangeKeyName = index.getRangeKeyName();
        } else {
            rangeKeyName = schema.getRangeKey() == null ? null : schema.getRangeKey().getName();
        }
        Condition.Comparison hashKeyCondition =
            new Condition.Comparison(hashAttribute, Condition.Comparator.EQ, hashAttribute.serializeObject(hashKey));

        ExpressionBuilder builder = new ExpressionBuilder();
        QueryRequest request = new QueryRequest()
            .withTableName(getTableName())
            .withIndexName(index == null ? null : index.getName())
            .withKeyConditionExpression(builder.keyCondition(hashKeyCondition, rangeKeyCondition, rangeKeyName))
            .withFilterExpression(builder.condition(filter))
            .withProjectionExpression(builder.projection(withKeys(attributesToGet, index)));
        request.setExpressionAttributeNames(builder.getNameAliases());
        request.setExpressionAttributeValues(builder.getValueAliases());
        if(LOG.isDebugEnabled()) {
            LOG.debug("Query on " + getTableName() + (index == null ? "" : " index " + index.getName())
                + " key " + request.getKeyConditionExpression() + " filter " + request.getFilterExpression());
        }
        return request;
    }

    private IndexDescriptor resolveIndex(String indexName) {
        if(indexName == null) {
            return null;
        }
        IndexDescriptor index = schema.getIndex(indexName);
        if(index == null) {
            throw new SchemaException("Table " + getTableName() + " has no index " + indexName);
        }
        return index;
    }

    /**
     * Adds the table's and index's key attributes to a projection so that results can always be decoded.
     */
    private List<String> withKeys(List<String> attributesToGet, IndexDescriptor index) {
        if(attributesToGet == null || attributesToGet.isEmpty()) {
            return null;
        }
        Set<String> names = new LinkedHashSet<String>(schema.getKeyAttributeNames());
        if(index != null) {
            names.add(index.getHashKeyName());
            if(index.getRangeKeyName() != null) {
                names.add(index.getRangeKeyName());
            }
        }
        names.addAll(attributesToGet);
        return new ArrayList<String>(names);
    }

    private Boolean consistentRead(Boolean requested) {
        return requested != null ? requested : Boolean.valueOf(config.isConsistentRead());
    }

    private Integer pageSize(Integer requested, Integer limit) {
        if(requested != null) {
            return requested;
        }
        return config.getPageSize() != null ? config.getPageSize() : limit;
    }
}
