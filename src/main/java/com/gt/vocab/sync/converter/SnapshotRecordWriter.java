package com.gt.vocab.sync.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gt.vocab.model.Event;
import com.gt.vocab.model.ReviewLog;
import com.gt.vocab.model.Vocab;

import java.util.Iterator;
import java.util.Map;

// Renders stored rows as snapshot records: identity under "_id", timestamps as ISO-8601 strings
public class SnapshotRecordWriter {

    private static final ObjectMapper SNAPSHOT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public static ObjectNode convertVocab(Vocab vocab) {
        return toSnapshotRecord(vocab);
    }

    public static ObjectNode convertReviewLog(ReviewLog reviewLog) {
        return toSnapshotRecord(reviewLog);
    }

    public static ObjectNode convertEvent(Event event) {
        return toSnapshotRecord(event);
    }

    private static ObjectNode toSnapshotRecord(Object row) {
        ObjectNode tree = SNAPSHOT_MAPPER.valueToTree(row);
        ObjectNode record = SNAPSHOT_MAPPER.createObjectNode();
        record.set(SnapshotRecordReader.ID_FIELD, tree.get("id"));

        Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!"id".equals(field.getKey())) {
                record.set(field.getKey(), field.getValue());
            }
        }
        return record;
    }
}
