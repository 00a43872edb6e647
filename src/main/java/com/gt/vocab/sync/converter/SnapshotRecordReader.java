package com.gt.vocab.sync.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.model.*;
import com.gt.vocab.review.Sm2Scheduler;
import com.gt.vocab.util.ContentLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Coerces loosely typed snapshot records into stored rows, one field at a time. A missing or malformed field takes
 * its default instead of failing the record: timestamps default to the import time, ease to 2.5 and counters to 0.
 * Non-finite numbers count as malformed. Ease is clamped into the scheduler's range and counters never go below 0.
 * Timestamps without an offset are read as UTC and every timestamp is cut to microseconds, the precision the store
 * keeps.
 */
public class SnapshotRecordReader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRecordReader.class);

    public static final String ID_FIELD = "_id";
    private static final String LEGACY_ID_FIELD = "id";

    private static final double DEFAULT_EASE_FACTOR = 2.5;
    private static final String DEFAULT_EVENT_TYPE = EventType.IMPORT.name();

    public static String sourceId(ObjectNode record) {
        String id = text(record.get(ID_FIELD));
        if (id == null) {
            id = text(record.get(LEGACY_ID_FIELD));
        }
        return id == null ? "" : id;
    }

    // termNormalized is used verbatim; the caller has already normalized and matched it
    public static Vocab convertVocabRecord(ObjectNode record, String vocabId, String termNormalized, Instant now) {
        String term = text(record.get("term"));

        VocabContent content = new VocabContent(
                term == null || term.isEmpty() ? termNormalized : term,
                ContentLists.uniqueStrings(stringList(record.get("meanings"))),
                ContentLists.stripToNull(text(record.get("ipa"))),
                emptyToNull(text(record.get("exampleEn"))),
                emptyToNull(text(record.get("exampleVi"))),
                emptyToNull(text(record.get("mnemonic"))),
                ContentLists.uniqueStrings(stringList(record.get("tags"))),
                ContentLists.uniqueStrings(stringList(record.get("collocations"))),
                ContentLists.uniqueStrings(stringList(record.get("phrases"))),
                ContentLists.normalizeWordFamily(wordFamily(record.get("wordFamily"))),
                ContentLists.uniqueStrings(stringList(record.get("topics"))),
                emptyToNull(text(record.get("cefrLevel"))),
                nullableDouble(record.get("ieltsBand")));

        ScheduleState schedule = new ScheduleState(
                Sm2Scheduler.roundEase(Sm2Scheduler.clampEase(doubleValue(record.get("easeFactor"), DEFAULT_EASE_FACTOR))),
                counter(record.get("intervalDays")),
                counter(record.get("repetitions")),
                counter(record.get("lapses")),
                parseInstant(record.get("dueAt"), now),
                optionalInstant(record.get("lastReviewedAt"), now),
                counter(record.get("readdCount")),
                optionalInstant(record.get("lastReaddAt"), now));

        return new Vocab(vocabId, termNormalized, content, schedule,
                parseInstant(record.get("createdAt"), now), parseInstant(record.get("updatedAt"), now), 0);
    }

    /**
     * Unknown modes and question types fall back to flip and term_to_meaning. A missing grade reads as 0, but a grade
     * outside 0..5 makes the whole log unusable and yields empty.
     */
    public static Optional<ReviewLog> convertReviewLogRecord(ObjectNode record, String vocabId, Instant now) {
        int grade = intValue(record.get("grade"), Sm2Scheduler.MIN_GRADE);
        if (grade < Sm2Scheduler.MIN_GRADE || grade > Sm2Scheduler.MAX_GRADE) {
            log.warn("Skipping imported review log for vocab {} with grade {}", vocabId, grade);
            return Optional.empty();
        }

        JsonNode isNearCorrect = record.get("isNearCorrect");

        return Optional.of(new ReviewLog(
                UUID.randomUUID().toString(),
                vocabId,
                ReviewMode.fromWireName(text(record.get("mode"))).orElse(ReviewMode.Flip),
                QuestionType.fromWireName(text(record.get("questionType"))).orElse(QuestionType.TermToMeaning),
                grade,
                text(record.get("userAnswer")),
                isNearCorrect == null || isNearCorrect.isNull() ? null : isNearCorrect.asBoolean(),
                parseInstant(record.get("createdAt"), now)));
    }

    public static Event convertEventRecord(ObjectNode record, Instant now) {
        String type = text(record.get("type"));
        JsonNode payload = record.get("payload");
        boolean emptyPayload = payload == null || payload.isNull() || (payload.isContainerNode() && payload.isEmpty())
                || (payload.isTextual() && payload.asText().isEmpty());

        return new Event(
                UUID.randomUUID().toString(),
                ContentLists.isBlank(type) ? DEFAULT_EVENT_TYPE : type,
                emptyPayload ? JsonNodeFactory.instance.objectNode() : payload.deepCopy(),
                parseInstant(record.get("createdAt"), now));
    }

    public static Instant parseInstant(JsonNode node, Instant fallback) {
        String value = text(node);
        if (value == null) {
            return fallback == null ? null : fallback.truncatedTo(ChronoUnit.MICROS);
        }

        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.strip(), OffsetDateTime::from, LocalDateTime::from);
            Instant instant = parsed instanceof OffsetDateTime
                    ? ((OffsetDateTime) parsed).toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            return instant.truncatedTo(ChronoUnit.MICROS);
        } catch (DateTimeParseException ex) {
            log.warn("Unparsable timestamp '{}' in snapshot record, using {}", value, fallback);
            return fallback == null ? null : fallback.truncatedTo(ChronoUnit.MICROS);
        }
    }

    private static Instant optionalInstant(JsonNode node, Instant fallback) {
        return ContentLists.isBlank(text(node)) ? null : parseInstant(node, fallback);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                String value = text(item);
                if (value != null) {
                    values.add(value);
                }
            }
        }
        return values;
    }

    private static Map<String, List<String>> wordFamily(JsonNode node) {
        Map<String, List<String>> family = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(entry -> family.put(entry.getKey(), stringList(entry.getValue())));
        }
        return family;
    }

    private static double doubleValue(JsonNode node, double defaultValue) {
        Double value = nullableDouble(node);
        return value == null ? defaultValue : value;
    }

    private static int counter(JsonNode node) {
        return Math.max(0, intValue(node, 0));
    }

    private static int intValue(JsonNode node, int defaultValue) {
        Double value = nullableDouble(node);
        return value == null ? defaultValue : value.intValue();
    }

    private static Double nullableDouble(JsonNode node) {
        Double value = rawDouble(node);
        if (value != null && !Double.isFinite(value)) {
            log.warn("Non-finite number '{}' in snapshot record, using default", node.asText());
            return null;
        }
        return value;
    }

    private static Double rawDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().strip());
            } catch (NumberFormatException ex) {
                log.warn("Unparsable number '{}' in snapshot record, using default", node.asText());
            }
        }
        return null;
    }
}
