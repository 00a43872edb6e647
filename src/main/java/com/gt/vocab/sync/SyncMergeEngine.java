package com.gt.vocab.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.event.EventDao;
import com.gt.vocab.exception.DaoException;
import com.gt.vocab.model.*;
import com.gt.vocab.review.ReviewLogDao;
import com.gt.vocab.sync.converter.SnapshotRecordReader;
import com.gt.vocab.util.ContentLists;
import com.gt.vocab.util.StableHash;
import com.gt.vocab.util.TermNormalizer;
import com.gt.vocab.vocab.VocabDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Reconciles an imported snapshot with the local store. Cards are matched by normalized term, never by id, since
 * ids are local to each device. Must run inside a transaction holding the exclusive merge lock.
 */
@Component
public class SyncMergeEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncMergeEngine.class);

    private final VocabDao vocabDao;
    private final ReviewLogDao reviewLogDao;
    private final EventDao eventDao;

    @Autowired
    public SyncMergeEngine(VocabDao vocabDao, ReviewLogDao reviewLogDao, EventDao eventDao) {
        this.vocabDao = vocabDao;
        this.reviewLogDao = reviewLogDao;
        this.eventDao = eventDao;
    }

    public SyncImportReport merge(SyncPayload payload, Instant now) {
        VocabMergeResult vocabResult = mergeVocabs(payload.vocabs(), now);
        int addedLogs = mergeReviewLogs(payload.reviewLogs(), vocabResult.sourceToLocalIds(), now);

        List<Event> events = objectRecords(payload.events(), "event").stream()
                .map(record -> SnapshotRecordReader.convertEventRecord(record, now))
                .toList();
        if (!events.isEmpty()) {
            eventDao.appendEvents(events);
        }

        return new SyncImportReport(vocabResult.added(), vocabResult.updated(), addedLogs, vocabResult.conflicts());
    }

    private VocabMergeResult mergeVocabs(List<JsonNode> records, Instant now) {
        List<ObjectNode> ordered = objectRecords(records, "vocab");
        ordered.sort(Comparator.comparing(SyncMergeEngine::incomingTermNormalized));

        Map<String, String> sourceToLocalIds = new HashMap<>();
        int added = 0;
        int updated = 0;
        int conflicts = 0;

        for (ObjectNode record : ordered) {
            String termNormalized = incomingTermNormalized(record);
            if (termNormalized.isEmpty()) {
                continue;
            }

            String sourceId = SnapshotRecordReader.sourceId(record);
            Optional<Vocab> existing = vocabDao.findByTermNormalized(termNormalized);

            if (existing.isEmpty()) {
                Vocab incoming = SnapshotRecordReader.convertVocabRecord(record, UUID.randomUUID().toString(), termNormalized, now);
                if (!vocabDao.createVocab(incoming)) {
                    throw new DaoException("Vocab for term " + termNormalized + " appeared during import");
                }
                sourceToLocalIds.put(sourceId, incoming.id());
                added++;
                continue;
            }

            Vocab local = existing.get();
            sourceToLocalIds.put(sourceId, local.id());

            Vocab incoming = SnapshotRecordReader.convertVocabRecord(record, local.id(), termNormalized, now);
            MergeOutcome outcome = mergeVocab(local, incoming);
            conflicts += outcome.conflicts();

            if (!contentHash(outcome.merged()).equals(contentHash(local))) {
                if (!vocabDao.updateVocab(outcome.merged(), local.version())) {
                    throw new DaoException("Vocab " + local.id() + " changed during import");
                }
                updated++;
            }
        }

        return new VocabMergeResult(sourceToLocalIds, added, updated, conflicts);
    }

    private int mergeReviewLogs(List<JsonNode> records, Map<String, String> sourceToLocalIds, Instant now) {
        Set<String> fingerprints = new HashSet<>();
        reviewLogDao.loadAllReviewLogs().forEach(reviewLog -> fingerprints.add(fingerprint(reviewLog)));

        List<ObjectNode> objects = objectRecords(records, "review log");
        List<ReviewLog> candidates = new ArrayList<>();
        int orphaned = 0;
        for (ObjectNode record : objects) {
            String localVocabId = resolveVocabId(record, sourceToLocalIds);
            if (localVocabId == null) {
                orphaned++;
                continue;
            }
            SnapshotRecordReader.convertReviewLogRecord(record, localVocabId, now).ifPresent(candidates::add);
        }
        candidates.sort(Comparator.comparing(ReviewLog::createdAt));

        List<ReviewLog> accepted = new ArrayList<>();
        for (ReviewLog candidate : candidates) {
            if (fingerprints.add(fingerprint(candidate))) {
                accepted.add(candidate);
            }
        }

        if (orphaned > 0) {
            log.info("Dropped {} imported review logs with no matching vocab", orphaned);
        }
        return accepted.isEmpty() ? 0 : reviewLogDao.createReviewLogs(accepted);
    }

    // Entries that are not JSON objects cannot be read field by field and are skipped
    private static List<ObjectNode> objectRecords(List<JsonNode> records, String kind) {
        List<ObjectNode> objects = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            if (record != null && record.isObject()) {
                objects.add((ObjectNode) record);
            } else {
                log.warn("Skipping imported {} entry that is not an object: {}", kind, record);
            }
        }
        return objects;
    }

    private String resolveVocabId(ObjectNode record, Map<String, String> sourceToLocalIds) {
        String sourceVocabId = record.path("vocabId").asText("").strip();
        if (sourceVocabId.isEmpty()) {
            return null;
        }

        String mapped = sourceToLocalIds.get(sourceVocabId);
        if (mapped != null) {
            return mapped;
        }
        return vocabDao.vocabExists(sourceVocabId) ? sourceVocabId : null;
    }

    /**
     * Field-by-field merge of a matched card. Lists and the word family are unioned. Free text follows the side
     * updated last, counting a conflict for every field where both sides hold different non-empty text. Scheduling
     * leans toward the less mastered side so the card comes back no later than either device would show it.
     */
    static MergeOutcome mergeVocab(Vocab local, Vocab incoming) {
        VocabContent localContent = local.content();
        VocabContent incomingContent = incoming.content();

        String term = localContent.term();
        String ipa = localContent.ipa();
        String exampleEn = localContent.exampleEn();
        String exampleVi = localContent.exampleVi();
        String mnemonic = localContent.mnemonic();
        int conflicts = 0;

        if (!incoming.updatedAt().isBefore(local.updatedAt())) {
            conflicts += conflictCount(localContent.term(), incomingContent.term());
            conflicts += conflictCount(localContent.ipa(), incomingContent.ipa());
            conflicts += conflictCount(localContent.exampleEn(), incomingContent.exampleEn());
            conflicts += conflictCount(localContent.exampleVi(), incomingContent.exampleVi());
            conflicts += conflictCount(localContent.mnemonic(), incomingContent.mnemonic());

            term = preferIncoming(term, incomingContent.term());
            ipa = preferIncoming(ipa, incomingContent.ipa());
            exampleEn = preferIncoming(exampleEn, incomingContent.exampleEn());
            exampleVi = preferIncoming(exampleVi, incomingContent.exampleVi());
            mnemonic = preferIncoming(mnemonic, incomingContent.mnemonic());
        }

        VocabContent mergedContent = new VocabContent(
                term,
                ContentLists.mergeUniqueStrings(localContent.meanings(), incomingContent.meanings()),
                ipa,
                exampleEn,
                exampleVi,
                mnemonic,
                ContentLists.mergeUniqueStrings(localContent.tags(), incomingContent.tags()),
                ContentLists.mergeUniqueStrings(localContent.collocations(), incomingContent.collocations()),
                ContentLists.mergeUniqueStrings(localContent.phrases(), incomingContent.phrases()),
                ContentLists.mergeWordFamily(localContent.wordFamily(), incomingContent.wordFamily()),
                ContentLists.mergeUniqueStrings(localContent.topics(), incomingContent.topics()),
                isEmpty(incomingContent.cefrLevel()) ? localContent.cefrLevel() : incomingContent.cefrLevel(),
                incomingContent.ieltsBand() == null ? localContent.ieltsBand() : incomingContent.ieltsBand());

        ScheduleState localSchedule = local.schedule();
        ScheduleState incomingSchedule = incoming.schedule();
        ScheduleState mergedSchedule = new ScheduleState(
                Math.min(localSchedule.easeFactor(), incomingSchedule.easeFactor()),
                Math.min(localSchedule.intervalDays(), incomingSchedule.intervalDays()),
                Math.min(localSchedule.repetitions(), incomingSchedule.repetitions()),
                Math.max(localSchedule.lapses(), incomingSchedule.lapses()),
                earliest(localSchedule.dueAt(), incomingSchedule.dueAt()),
                latest(localSchedule.lastReviewedAt(), incomingSchedule.lastReviewedAt()),
                Math.max(localSchedule.readdCount(), incomingSchedule.readdCount()),
                latest(localSchedule.lastReaddAt(), incomingSchedule.lastReaddAt()));

        Vocab merged = new Vocab(
                local.id(),
                local.termNormalized(),
                mergedContent,
                mergedSchedule,
                earliest(local.createdAt(), incoming.createdAt()),
                latest(local.updatedAt(), incoming.updatedAt()),
                local.version());

        return new MergeOutcome(merged, conflicts);
    }

    // Identity and version are excluded so only a real content or schedule change counts
    static String contentHash(Vocab vocab) {
        Map<String, Object> hashInput = new LinkedHashMap<>();
        hashInput.put("termNormalized", vocab.termNormalized());
        hashInput.put("content", vocab.content());
        hashInput.put("schedule", vocab.schedule());
        hashInput.put("createdAt", vocab.createdAt());
        hashInput.put("updatedAt", vocab.updatedAt());
        return StableHash.hash(hashInput);
    }

    static String fingerprint(ReviewLog reviewLog) {
        Map<String, Object> hashInput = new LinkedHashMap<>();
        hashInput.put("vocabId", reviewLog.vocabId());
        hashInput.put("createdAt", reviewLog.createdAt().toString());
        hashInput.put("grade", reviewLog.grade());
        hashInput.put("mode", reviewLog.mode().getWireName());
        hashInput.put("questionType", reviewLog.questionType().getWireName());
        return StableHash.hash(hashInput);
    }

    private static String incomingTermNormalized(ObjectNode record) {
        String termNormalized = record.path("termNormalized").asText("");
        return TermNormalizer.normalize(termNormalized.isEmpty() ? record.path("term").asText("") : termNormalized);
    }

    // Whitespace-only text still counts as a value here
    private static int conflictCount(String localValue, String incomingValue) {
        return !isEmpty(localValue) && !isEmpty(incomingValue) && !localValue.equals(incomingValue) ? 1 : 0;
    }

    private static String preferIncoming(String localValue, String incomingValue) {
        return isEmpty(incomingValue) ? localValue : incomingValue;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static Instant earliest(Instant left, Instant right) {
        if (left == null || right == null) {
            return left == null ? right : left;
        }
        return left.isBefore(right) ? left : right;
    }

    private static Instant latest(Instant left, Instant right) {
        if (left == null || right == null) {
            return left == null ? right : left;
        }
        return left.isAfter(right) ? left : right;
    }

    record MergeOutcome(Vocab merged, int conflicts) { }

    private record VocabMergeResult(Map<String, String> sourceToLocalIds, int added, int updated, int conflicts) { }
}
