/**
 * Copyright 2013-2014 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package com.amazonaws.labs.dynamodb.models.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazonaws.labs.dynamodb.models.exceptions.DecodeException;
import com.amazonaws.labs.dynamodb.models.exceptions.ModelException;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts item documents to and from the store's tagged JSON form, where every value is a single-key object
 * such as {"S": "foo"}, {"N": "1.5"} or {"B": "<base64>"}.
 */
public final class AttributeValueJson {

    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper();
        MAPPER.disable(SerializationFeature.INDENT_OUTPUT);
    }

    private AttributeValueJson() {
    }

    public static String toJson(Map<String, AttributeValue> item) {
        try {
            return MAPPER.writeValueAsString(toNode(item));
        } catch (JsonProcessingException e) {
            throw new ModelException("Failed to serialize item " + item, e);
        }
    }

    public static Map<String, AttributeValue> fromJson(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new DecodeException("Failed to parse item JSON", null, null, e);
        }
        if(node == null || !node.isObject()) {
            throw new DecodeException("Item JSON must be an object: " + json, null, null);
        }
        return fromNode(node);
    }

    /**
     * Approximates the number of bytes an item occupies in a request, using the length of its tagged JSON form.
     */
    public static int sizeOf(Map<String, AttributeValue> item) {
        if(item == null || item.isEmpty()) {
            return 0;
        }
        return toJson(item).getBytes(StandardCharsets.UTF_8).length;
    }

    static ObjectNode toNode(Map<String, AttributeValue> item) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for(Map.Entry<String, AttributeValue> e : item.entrySet()) {
            node.set(e.getKey(), toNode(e.getValue()));
        }
        return node;
    }

    static ObjectNode toNode(AttributeValue value) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if(value.getS() != null) {
            node.put("S", value.getS());
        } else if(value.getN() != null) {
            node.put("N", value.getN());
        } else if(value.getB() != null) {
            node.put("B", bytes(value.getB()));
        } else if(value.getSS() != null) {
            ArrayNode array = node.putArray("SS");
            for(String s : value.getSS()) {
                array.add(s);
            }
        } else if(value.getNS() != null) {
            ArrayNode array = node.putArray("NS");
            for(String n : value.getNS()) {
                array.add(n);
            }
        } else if(value.getBS() != null) {
            ArrayNode array = node.putArray("BS");
            for(ByteBuffer b : value.getBS()) {
                array.add(bytes(b));
            }
        } else if(value.getBOOL() != null) {
            node.put("BOOL", value.getBOOL().booleanValue());
        } else if(value.getNULL() != null) {
            node.put("NULL", true);
        } else if(value.getL() != null) {
            ArrayNode array = node.putArray("L");
            for(AttributeValue element : value.getL()) {
                array.add(toNode(element));
            }
        } else if(value.getM() != null) {
            node.set("M", toNode(value.getM()));
        } else {
            throw new ModelException("AttributeValue carries no value: " + value);
        }
        return node;
    }

    static Map<String, AttributeValue> fromNode(JsonNode node) {
        Map<String, AttributeValue> item = new LinkedHashMap<String, AttributeValue>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while(fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            item.put(field.getKey(), valueFromNode(field.getKey(), field.getValue()));
        }
        return item;
    }

    private static AttributeValue valueFromNode(String name, JsonNode node) {
        if(node == null || !node.isObject() || node.size() != 1) {
            throw new DecodeException("Attribute " + name + " must be a single-key tagged object, was " + node, null, null);
        }
        String tag = node.fieldNames().next();
        JsonNode content = node.get(tag);
        if("S".equals(tag)) {
            return new AttributeValue().withS(content.asText());
        } else if("N".equals(tag)) {
            return new AttributeValue().withN(content.asText());
        } else if("B".equals(tag)) {
            return new AttributeValue().withB(ByteBuffer.wrap(binary(name, content)));
        } else if("SS".equals(tag)) {
            List<String> values = new ArrayList<String>();
            for(JsonNode element : content) {
                values.add(element.asText());
            }
            return new AttributeValue().withSS(values);
        } else if("NS".equals(tag)) {
            List<String> values = new ArrayList<String>();
            for(JsonNode element : content) {
                values.add(element.asText());
            }
            return new AttributeValue().withNS(values);
        } else if("BS".equals(tag)) {
            List<ByteBuffer> values = new ArrayList<ByteBuffer>();
            for(JsonNode element : content) {
                values.add(ByteBuffer.wrap(binary(name, element)));
            }
            return new AttributeValue().withBS(values);
        } else if("BOOL".equals(tag)) {
            return new AttributeValue().withBOOL(content.asBoolean());
        } else if("NULL".equals(tag)) {
            return new AttributeValue().withNULL(true);
        } else if("L".equals(tag)) {
            List<AttributeValue> values = new ArrayList<AttributeValue>();
            for(JsonNode element : content) {
                values.add(valueFromNode(name, element));
            }
            return new AttributeValue().withL(values);
        } else if("M".equals(tag)) {
            return new AttributeValue().withM(fromNode(content));
        }
        throw new DecodeException("Unknown tag " + tag + " on attribute " + name, null, null);
    }

    private static byte[] binary(String name, JsonNode node) {
        try {
            return node.binaryValue();
        } catch (IOException e) {
            throw new DecodeException("Attribute " + name + " holds invalid base64", null, null, e);
        }
    }

    private static byte[] bytes(ByteBuffer buf) {
        ByteBuffer dup = buf.duplicate();
        byte[] bytes = new byte[dup.remaining()];
        dup.get(bytes);
        return bytes;
    }
}
