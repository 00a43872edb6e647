package com.gt.vocab.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.event.EventDao;
import com.gt.vocab.exception.UnsupportedVersionException;
import com.gt.vocab.model.Event;
import com.gt.vocab.model.EventType;
import com.gt.vocab.review.ReviewLogDao;
import com.gt.vocab.sync.converter.SnapshotRecordWriter;
import com.gt.vocab.vocab.VocabDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Component
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final VocabDao vocabDao;
    private final ReviewLogDao reviewLogDao;
    private final EventDao eventDao;
    private final MergeLockDao mergeLockDao;
    private final SyncMergeEngine syncMergeEngine;
    private final Clock clock;

    @Autowired
    public SyncService(VocabDao vocabDao,
                       ReviewLogDao reviewLogDao,
                       EventDao eventDao,
                       MergeLockDao mergeLockDao,
                       SyncMergeEngine syncMergeEngine,
                       Clock clock) {
        this.vocabDao = vocabDao;
        this.reviewLogDao = reviewLogDao;
        this.eventDao = eventDao;
        this.mergeLockDao = mergeLockDao;
        this.syncMergeEngine = syncMergeEngine;
        this.clock = clock;
    }

    // The EXPORT event is written first so the snapshot records its own export
    @Transactional
    public SyncPayload exportSnapshot() {
        mergeLockDao.acquireSharedLock();
        Instant now = clock.instant();

        ObjectNode exportPayload = JsonNodeFactory.instance.objectNode();
        exportPayload.put("schemaVersion", SyncPayload.SCHEMA_VERSION);
        eventDao.appendEvent(new Event(UUID.randomUUID().toString(), EventType.EXPORT.name(), exportPayload, now));

        SyncPayload snapshot = new SyncPayload(
                SyncPayload.SCHEMA_VERSION,
                now.toString(),
                vocabDao.loadAllVocab().stream().<JsonNode>map(SnapshotRecordWriter::convertVocab).toList(),
                reviewLogDao.loadAllReviewLogs().stream().<JsonNode>map(SnapshotRecordWriter::convertReviewLog).toList(),
                eventDao.loadAllEvents().stream().<JsonNode>map(SnapshotRecordWriter::convertEvent).toList());

        log.info("Exported {} vocabs, {} review logs, {} events",
                snapshot.vocabs().size(), snapshot.reviewLogs().size(), snapshot.events().size());
        return snapshot;
    }

    // A snapshot without a schemaVersion is treated as the current version
    @Transactional
    public SyncImportReport importSnapshot(SyncPayload payload) {
        String schemaVersion = payload.schemaVersion() == null ? SyncPayload.SCHEMA_VERSION : payload.schemaVersion();
        if (!SyncPayload.SCHEMA_VERSION.equals(schemaVersion)) {
            throw new UnsupportedVersionException(schemaVersion);
        }

        mergeLockDao.acquireExclusiveLock();
        Instant now = clock.instant();

        SyncImportReport report = syncMergeEngine.merge(payload, now);

        ObjectNode importPayload = JsonNodeFactory.instance.objectNode();
        importPayload.put("addedVocabs", report.addedVocabs());
        importPayload.put("updatedVocabs", report.updatedVocabs());
        importPayload.put("addedLogs", report.addedLogs());
        importPayload.put("conflicts", report.conflicts());
        importPayload.put("sourceSchemaVersion", schemaVersion);
        eventDao.appendEvent(new Event(UUID.randomUUID().toString(), EventType.IMPORT.name(), importPayload, now));

        log.info("Imported snapshot: {}", report);
        return report;
    }
}
