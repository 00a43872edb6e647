package com.gt.vocab.sync.converter;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.model.QuestionType;
import com.gt.vocab.model.ReviewLog;
import com.gt.vocab.model.ReviewMode;
import com.gt.vocab.model.Vocab;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotRecordReaderTests {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Instant TEST_NOW = Instant.parse("2024-03-10T08:00:00Z");

    @Test
    public void testParseInstant() {
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"),
                SnapshotRecordReader.parseInstant(NODES.textNode("2024-03-01T10:00:00Z"), TEST_NOW));
        assertEquals(Instant.parse("2024-03-01T03:00:00Z"),
                SnapshotRecordReader.parseInstant(NODES.textNode("2024-03-01T10:00:00+07:00"), TEST_NOW));
        assertEquals(Instant.parse("2024-03-01T10:00:00.123Z"),
                SnapshotRecordReader.parseInstant(NODES.textNode(" 2024-03-01T10:00:00.123 "), TEST_NOW));
    }

    @Test
    public void testParseInstant_truncatedToMicros() {
        assertEquals(Instant.parse("2024-03-01T10:00:00.123456Z"),
                SnapshotRecordReader.parseInstant(NODES.textNode("2024-03-01T10:00:00.1234567Z"), TEST_NOW));
        assertEquals(Instant.parse("2024-03-01T10:00:00.999999Z"),
                SnapshotRecordReader.parseInstant(NODES.textNode("2024-03-01T10:00:00.999999999"), TEST_NOW));
        assertEquals(Instant.parse("2024-03-10T08:00:00.000001Z"),
                SnapshotRecordReader.parseInstant(null, Instant.parse("2024-03-10T08:00:00.000001999Z")));
    }

    @Test
    public void testParseInstant_fallback() {
        assertEquals(TEST_NOW, SnapshotRecordReader.parseInstant(null, TEST_NOW));
        assertEquals(TEST_NOW, SnapshotRecordReader.parseInstant(NODES.nullNode(), TEST_NOW));
        assertEquals(TEST_NOW, SnapshotRecordReader.parseInstant(NODES.textNode("yesterday"), TEST_NOW));
        assertEquals(TEST_NOW, SnapshotRecordReader.parseInstant(NODES.objectNode(), TEST_NOW));
    }

    @Test
    public void testSourceId() {
        ObjectNode current = NODES.objectNode().put("_id", "abc").put("id", "legacy");
        ObjectNode legacy = NODES.objectNode().put("id", 42);

        assertEquals("abc", SnapshotRecordReader.sourceId(current));
        assertEquals("42", SnapshotRecordReader.sourceId(legacy));
        assertEquals("", SnapshotRecordReader.sourceId(NODES.objectNode()));
    }

    @Test
    public void testConvertVocabRecord() {
        ObjectNode record = NODES.objectNode();
        record.put("term", "Take off");
        record.putArray("meanings").add(" cat canh ").add("cat canh").add("").add("coi bo");
        record.put("ipa", "   ");
        record.put("exampleEn", "");
        record.put("easeFactor", "2.1");
        record.put("intervalDays", 4.0);
        record.put("repetitions", "lots");
        record.put("dueAt", "2024-03-12T00:00:00Z");
        record.put("lastReviewedAt", "");
        record.putObject("wordFamily").putArray(" Noun ").add("takeoff");
        record.put("ieltsBand", "6.5");

        Vocab vocab = SnapshotRecordReader.convertVocabRecord(record, "local-id", "take off", TEST_NOW);

        assertEquals("local-id", vocab.id());
        assertEquals("take off", vocab.termNormalized());
        assertEquals("Take off", vocab.content().term());
        assertEquals(List.of("cat canh", "coi bo"), vocab.content().meanings());
        assertNull(vocab.content().ipa());
        assertNull(vocab.content().exampleEn());
        assertEquals(List.of("takeoff"), vocab.content().wordFamily().get("noun"));
        assertEquals(6.5, vocab.content().ieltsBand());

        assertEquals(2.1, vocab.schedule().easeFactor());
        assertEquals(4, vocab.schedule().intervalDays());
        assertEquals(0, vocab.schedule().repetitions());
        assertEquals(Instant.parse("2024-03-12T00:00:00Z"), vocab.schedule().dueAt());
        assertNull(vocab.schedule().lastReviewedAt());
        assertEquals(TEST_NOW, vocab.createdAt());
        assertEquals(TEST_NOW, vocab.updatedAt());
        assertEquals(0, vocab.version());
    }

    @Test
    public void testConvertVocabRecord_defaults() {
        Vocab vocab = SnapshotRecordReader.convertVocabRecord(NODES.objectNode(), "local-id", "walk", TEST_NOW);

        assertEquals("walk", vocab.content().term());
        assertTrue(vocab.content().meanings().isEmpty());
        assertEquals(2.5, vocab.schedule().easeFactor());
        assertEquals(0, vocab.schedule().lapses());
        assertEquals(TEST_NOW, vocab.schedule().dueAt());
        assertNull(vocab.schedule().lastReaddAt());
    }

    @Test
    public void testConvertVocabRecord_nonFiniteAndOutOfRangeNumbers() {
        ObjectNode record = NODES.objectNode();
        record.put("easeFactor", "NaN");
        record.put("intervalDays", -7);
        record.put("repetitions", "-3");
        record.put("lapses", "Infinity");
        record.put("readdCount", -1.5);
        record.put("ieltsBand", "-Infinity");

        Vocab vocab = SnapshotRecordReader.convertVocabRecord(record, "local-id", "walk", TEST_NOW);

        assertEquals(2.5, vocab.schedule().easeFactor());
        assertEquals(0, vocab.schedule().intervalDays());
        assertEquals(0, vocab.schedule().repetitions());
        assertEquals(0, vocab.schedule().lapses());
        assertEquals(0, vocab.schedule().readdCount());
        assertNull(vocab.content().ieltsBand());
    }

    @Test
    public void testConvertVocabRecord_easeClampedAndRounded() {
        assertEquals(3.0, easeOf(5.0));
        assertEquals(1.3, easeOf(0.2));
        assertEquals(2.36, easeOf(2.3649));
    }

    @Test
    public void testConvertReviewLogRecord_gradeOutOfRange() {
        assertTrue(SnapshotRecordReader.convertReviewLogRecord(NODES.objectNode().put("grade", 9), "local-id", TEST_NOW).isEmpty());
        assertTrue(SnapshotRecordReader.convertReviewLogRecord(NODES.objectNode().put("grade", -1), "local-id", TEST_NOW).isEmpty());
        assertEquals(0, SnapshotRecordReader.convertReviewLogRecord(NODES.objectNode(), "local-id", TEST_NOW).orElseThrow().grade());
        assertEquals(5, SnapshotRecordReader.convertReviewLogRecord(NODES.objectNode().put("grade", "5"), "local-id", TEST_NOW).orElseThrow().grade());
    }

    @Test
    public void testConvertReviewLogRecord() {
        ObjectNode record = NODES.objectNode();
        record.put("mode", "speaking");
        record.put("questionType", "meaning_to_term");
        record.put("grade", "3");
        record.put("userAnswer", "walk");
        record.put("isNearCorrect", true);
        record.put("createdAt", "2024-03-09T12:00:00");

        ReviewLog reviewLog = SnapshotRecordReader.convertReviewLogRecord(record, "local-id", TEST_NOW).orElseThrow();

        assertNotNull(reviewLog.id());
        assertEquals("local-id", reviewLog.vocabId());
        assertEquals(ReviewMode.Flip, reviewLog.mode());
        assertEquals(QuestionType.MeaningToTerm, reviewLog.questionType());
        assertEquals(3, reviewLog.grade());
        assertEquals("walk", reviewLog.userAnswer());
        assertEquals(Boolean.TRUE, reviewLog.isNearCorrect());
        assertEquals(Instant.parse("2024-03-09T12:00:00Z"), reviewLog.createdAt());
    }

    @Test
    public void testConvertReviewLogRecord_missingNearCorrect() {
        ObjectNode record = NODES.objectNode();
        record.put("mode", "mcq");
        record.putNull("isNearCorrect");

        ReviewLog reviewLog = SnapshotRecordReader.convertReviewLogRecord(record, "local-id", TEST_NOW).orElseThrow();

        assertEquals(ReviewMode.MultipleChoice, reviewLog.mode());
        assertEquals(QuestionType.TermToMeaning, reviewLog.questionType());
        assertNull(reviewLog.isNearCorrect());
        assertNull(reviewLog.userAnswer());
        assertEquals(TEST_NOW, reviewLog.createdAt());
    }

    private static double easeOf(double easeFactor) {
        ObjectNode record = NODES.objectNode().put("easeFactor", easeFactor);
        return SnapshotRecordReader.convertVocabRecord(record, "local-id", "walk", TEST_NOW).schedule().easeFactor();
    }
}
