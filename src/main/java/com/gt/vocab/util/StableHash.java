package com.gt.vocab.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gt.vocab.exception.MappingException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Content fingerprint used for merge deduplication. The value is rendered as compact JSON with object keys sorted
 * at every level and non-ASCII characters escaped, then hashed with SHA-256, so structurally equal values always
 * produce the same hex digest regardless of key order.
 */
public class StableHash {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .build();

    public static String hash(Object value) {
        return sha256Hex(canonicalJson(value));
    }

    public static String canonicalJson(Object value) {
        JsonNode node = value instanceof JsonNode ? (JsonNode) value : CANONICAL_MAPPER.valueToTree(value);
        try {
            return CANONICAL_MAPPER.writeValueAsString(sortKeys(node));
        } catch (JsonProcessingException ex) {
            throw new MappingException("Failed to render canonical json", ex);
        }
    }

    private static JsonNode sortKeys(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }

        if (node.isObject()) {
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String fieldName : fieldNames) {
                sorted.set(fieldName, sortKeys(node.get(fieldName)));
            }
            return sorted;
        }

        if (node.isArray()) {
            ArrayNode sorted = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                sorted.add(sortKeys(element));
            }
            return sorted;
        }

        return node;
    }

    private static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
