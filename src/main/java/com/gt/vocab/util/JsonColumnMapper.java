package com.gt.vocab.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.exception.MappingException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Converts between model values and the jsonb columns they are stored in
public class JsonColumnMapper {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };
    private static final TypeReference<LinkedHashMap<String, List<String>>> WORD_FAMILY = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public JsonColumnMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Failed to write json column", ex);
        }
    }

    public List<String> readStringList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Failed to read string list column", ex);
        }
    }

    public Map<String, List<String>> readWordFamily(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, WORD_FAMILY);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Failed to read word family column", ex);
        }
    }

    public JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Failed to read json column", ex);
        }
    }

    public ObjectNode readObject(String json) {
        JsonNode node = readTree(json);
        return node.isObject() ? (ObjectNode) node : objectMapper.createObjectNode();
    }
}
