package com.gt.vocab.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

// Snapshot exchanged between devices; entries stay loosely typed so a partial, older or malformed entry cannot fail the whole import
public record SyncPayload(
        String schemaVersion,
        String exportedAt,
        List<JsonNode> vocabs,
        @JsonProperty("review_logs") List<JsonNode> reviewLogs,
        List<JsonNode> events) {

    public static final String SCHEMA_VERSION = "v1";

    public SyncPayload {
        vocabs = vocabs == null ? List.of() : vocabs;
        reviewLogs = reviewLogs == null ? List.of() : reviewLogs;
        events = events == null ? List.of() : events;
    }
}
