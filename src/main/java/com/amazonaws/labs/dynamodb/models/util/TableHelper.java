/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Amazon Software License (the "License"). 
 * You may not use this file except in compliance with the License. 
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/asl/
 *
 * or in the "license" file accompanying this file. This file is distributed 
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, express 
 * or implied. See the License for the specific language governing permissions 
 * and limitations under the License. 
 */
package com.amazonaws.labs.dynamodb.models.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazonaws.labs.dynamodb.models.attributes.Attribute;
import com.amazonaws.labs.dynamodb.models.schema.IndexDescriptor;
import com.amazonaws.labs.dynamodb.models.schema.Schema;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.model.AttributeDefinition;
import com.amazonaws.services.dynamodbv2.model.BillingMode;
import com.amazonaws.services.dynamodbv2.model.CreateTableRequest;
import com.amazonaws.services.dynamodbv2.model.DescribeTableRequest;
import com.amazonaws.services.dynamodbv2.model.DescribeTableResult;
import com.amazonaws.services.dynamodbv2.model.GlobalSecondaryIndex;
import com.amazonaws.services.dynamodbv2.model.GlobalSecondaryIndexDescription;
import com.amazonaws.services.dynamodbv2.model.KeySchemaElement;
import com.amazonaws.services.dynamodbv2.model.KeyType;
import com.amazonaws.services.dynamodbv2.model.LocalSecondaryIndex;
import com.amazonaws.services.dynamodbv2.model.LocalSecondaryIndexDescription;
import com.amazonaws.services.dynamodbv2.model.ProvisionedThroughput;
import com.amazonaws.services.dynamodbv2.model.ResourceInUseException;
import com.amazonaws.services.dynamodbv2.model.ResourceNotFoundException;
import com.amazonaws.services.dynamodbv2.model.TableDescription;
import com.amazonaws.services.dynamodbv2.model.TableStatus;

/**
 * Creates and verifies the table backing a {@link Schema}.
 */
public class TableHelper {

    private static final Log LOG = LogFactory.getLog(TableHelper.class);

    private final AmazonDynamoDB client;
    private final long pollIntervalMillis;

    public TableHelper(AmazonDynamoDB client) {
        this(client, 10 * 1000);
    }

    public TableHelper(AmazonDynamoDB client, long pollIntervalMillis) {
        if(client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if(pollIntervalMillis < 0) {
            throw new IllegalArgumentException("Invalid pollIntervalMillis " + pollIntervalMillis);
        }
        this.client = client;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    /**
     * Builds the CreateTable request for a schema: attribute definitions for every table and index key,
     * the key schema, and the secondary indexes with their projections.
     *
     * @param throughput the table's provisioned throughput, or null for on-demand billing
     */
    public static CreateTableRequest createTableRequest(Schema schema, ProvisionedThroughput throughput) {
        CreateTableRequest request = new CreateTableRequest()
            .withTableName(schema.getTableName())
            .withAttributeDefinitions(attributeDefinitions(schema))
            .withKeySchema(keySchema(schema.getHashKey().getName(),
                schema.getRangeKey() == null ? null : schema.getRangeKey().getName()));
        if(throughput == null) {
            request.withBillingMode(BillingMode.PAY_PER_REQUEST);
        } else {
            request.withBillingMode(BillingMode.PROVISIONED);
            request.setProvisionedThroughput(throughput);
        }

        List<LocalSecondaryIndex> localIndexes = new ArrayList<LocalSecondaryIndex>();
        List<GlobalSecondaryIndex> globalIndexes = new ArrayList<GlobalSecondaryIndex>();
        for(IndexDescriptor index : schema.getIndexes()) {
            List<KeySchemaElement> indexKeySchema = keySchema(index.getHashKeyName(), index.getRangeKeyName());
            if(index.getKind() == IndexDescriptor.Kind.LOCAL) {
                localIndexes.add(new LocalSecondaryIndex()
                    .withIndexName(index.getName())
                    .withKeySchema(indexKeySchema)
                    .withProjection(index.getProjection().toProjection()));
            } else {
                GlobalSecondaryIndex gsi = new GlobalSecondaryIndex()
                    .withIndexName(index.getName())
                    .withKeySchema(indexKeySchema)
                    .withProjection(index.getProjection().toProjection());
                if(throughput != null) {
                    gsi.setProvisionedThroughput(index.hasProvisionedThroughput()
                        ? new ProvisionedThroughput(index.getReadCapacityUnits(), index.getWriteCapacityUnits())
                        : throughput);
                }
                globalIndexes.add(gsi);
            }
        }
        if(!localIndexes.isEmpty()) {
            request.setLocalSecondaryIndexes(localIndexes);
        }
        if(!globalIndexes.isEmpty()) {
            request.setGlobalSecondaryIndexes(globalIndexes);
        }
        return request;
    }

    static List<AttributeDefinition> attributeDefinitions(Schema schema) {
        Map<String, AttributeDefinition> definitions = new LinkedHashMap<String, AttributeDefinition>();
        addDefinition(definitions, schema.getHashKey());
        addDefinition(definitions, schema.getRangeKey());
        for(IndexDescriptor index : schema.getIndexes()) {
            addDefinition(definitions, schema.getAttribute(index.getHashKeyName()));
            if(index.getRangeKeyName() != null) {
                addDefinition(definitions, schema.getAttribute(index.getRangeKeyName()));
            }
        }
        return new ArrayList<AttributeDefinition>(definitions.values());
    }

    private static void addDefinition(Map<String, AttributeDefinition> definitions, Attribute<?> attribute) {
        if(attribute != null && !definitions.containsKey(attribute.getName())) {
            definitions.put(attribute.getName(), new AttributeDefinition()
                .withAttributeName(attribute.getName())
                .withAttributeType(attribute.getType().toScalarAttributeType()));
        }
    }

    static List<KeySchemaElement> keySchema(String hashKeyName, String rangeKeyName) {
        List<KeySchemaElement> keySchema = new ArrayList<KeySchemaElement>(2);
        keySchema.add(new KeySchemaElement().withAttributeName(hashKeyName).withKeyType(KeyType.HASH));
        if(rangeKeyName != null) {
            keySchema.add(new KeySchemaElement().withAttributeName(rangeKeyName).withKeyType(KeyType.RANGE));
        }
        return keySchema;
    }

    /**
     * Checks that the table exists with the schema's keys and indexes.
     *
     * @return the table's status
     * @throws ResourceNotFoundException if the table does not exist
     * @throws ResourceInUseException if the table exists with a different key schema or indexes
     */
    public String verifyTableExists(Schema schema) {
        String tableName = schema.getTableName();
        DescribeTableResult describe = client.describeTable(new DescribeTableRequest().withTableName(tableName));
        TableDescription table = describe.getTable();
        List<AttributeDefinition> definitions = attributeDefinitions(schema);
        if(!new HashSet<AttributeDefinition>(definitions).equals(new HashSet<AttributeDefinition>(table.getAttributeDefinitions()))) {
            throw new ResourceInUseException("Table " + tableName + " had the wrong AttributeDefinitions."
                + " Expected: " + definitions + " "
                + " Was: " + table.getAttributeDefinitions());
        }

        List<KeySchemaElement> keySchema = keySchema(schema.getHashKey().getName(),
            schema.getRangeKey() == null ? null : schema.getRangeKey().getName());
        if(!keySchema.equals(table.getKeySchema())) {
            throw new ResourceInUseException("Table " + tableName + " had the wrong KeySchema."
                + " Expected: " + keySchema + " "
                + " Was: " + table.getKeySchema());
        }

        Set<String> expectedIndexes = new HashSet<String>();
        for(IndexDescriptor index : schema.getIndexes()) {
            expectedIndexes.add(index.getName());
        }
        Set<String> theirIndexes = new HashSet<String>();
        if(table.getLocalSecondaryIndexes() != null) {
            for(LocalSecondaryIndexDescription description : table.getLocalSecondaryIndexes()) {
                theirIndexes.add(description.getIndexName());
            }
        }
        if(table.getGlobalSecondaryIndexes() != null) {
            for(GlobalSecondaryIndexDescription description : table.getGlobalSecondaryIndexes()) {
                theirIndexes.add(description.getIndexName());
            }
        }
        if(!expectedIndexes.equals(theirIndexes)) {
            throw new ResourceInUseException("Table " + tableName + " did not have the expected secondary indexes."
                + " Expected: " + expectedIndexes
                + " Was: " + theirIndexes);
        }
        return table.getTableStatus();
    }

    /**
     * Verifies that the table exists with the schema's keys and indexes, and creates it if it does not exist.
     *
     * @param throughput the table's provisioned throughput, or null for on-demand billing
     * @param waitTimeSeconds how long to wait for the table to become ACTIVE, or null to not wait
     */
    public void verifyOrCreateTable(Schema schema, ProvisionedThroughput throughput, Long waitTimeSeconds)
        throws InterruptedException {
        if(waitTimeSeconds != null && waitTimeSeconds < 0) {
            throw new IllegalArgumentException("Invalid waitTimeSeconds " + waitTimeSeconds);
        }

        String status = null;
        try {
            status = verifyTableExists(schema);
        } catch(ResourceNotFoundException e) {
            LOG.info("Creating table " + schema.getTableName());
            status = client.createTable(createTableRequest(schema, throughput)).getTableDescription().getTableStatus();
        }

        if(waitTimeSeconds != null && !TableStatus.ACTIVE.toString().equals(status)) {
            waitForTableActive(schema.getTableName(), waitTimeSeconds);
        }
    }

    public void waitForTableActive(String tableName, long waitTimeSeconds) throws InterruptedException {
        if(waitTimeSeconds < 0) {
            throw new IllegalArgumentException("Invalid waitTimeSeconds " + waitTimeSeconds);
        }

        long startTimeMs = System.currentTimeMillis();
        long elapsedMs = 0;
        do {
            DescribeTableResult describe = client.describeTable(new DescribeTableRequest().withTableName(tableName));
            String status = describe.getTable().getTableStatus();
            if(TableStatus.ACTIVE.toString().equals(status)) {
                return;
            }
            if(TableStatus.DELETING.toString().equals(status)) {
                throw new ResourceInUseException("Table " + tableName + " is " + status + ", and waiting for it to become ACTIVE is not useful.");
            }
            Thread.sleep(pollIntervalMillis);
            elapsedMs = System.currentTimeMillis() - startTimeMs;
        } while(elapsedMs / 1000.0 < waitTimeSeconds);

        throw new ResourceInUseException("Table " + tableName + " did not become ACTIVE after " + waitTimeSeconds + " seconds.");
    }
}
