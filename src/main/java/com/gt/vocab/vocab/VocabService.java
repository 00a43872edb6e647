package com.gt.vocab.vocab;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.ai.EntryValidation;
import com.gt.vocab.ai.VocabEntryValidator;
import com.gt.vocab.event.EventDao;
import com.gt.vocab.exception.DaoException;
import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.model.*;
import com.gt.vocab.review.Sm2Scheduler;
import com.gt.vocab.sync.MergeLockDao;
import com.gt.vocab.util.ContentLists;
import com.gt.vocab.util.TermNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class VocabService {

    private static final Logger log = LoggerFactory.getLogger(VocabService.class);

    static final String REJECTED_ENTRY_MESSAGE = "Input looks incorrect. Please review spelling/meaning before saving.";

    static final int DEFAULT_PAGE_LIMIT = 20;
    static final int MAX_PAGE_LIMIT = 200;

    private static final Set<String> CEFR_LEVELS = Set.of("A1", "A2", "B1", "B2", "C1", "C2");
    private static final double MIN_IELTS_BAND = 1.0;
    private static final double MAX_IELTS_BAND = 9.0;

    private final VocabDao vocabDao;
    private final VocabUpdater vocabUpdater;
    private final EventDao eventDao;
    private final MergeLockDao mergeLockDao;
    private final Sm2Scheduler sm2Scheduler;
    private final VocabEntryValidator vocabEntryValidator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Autowired
    public VocabService(VocabDao vocabDao,
                        VocabUpdater vocabUpdater,
                        EventDao eventDao,
                        MergeLockDao mergeLockDao,
                        Sm2Scheduler sm2Scheduler,
                        VocabEntryValidator vocabEntryValidator,
                        TransactionTemplate transactionTemplate,
                        Clock clock) {
        this.vocabDao = vocabDao;
        this.vocabUpdater = vocabUpdater;
        this.eventDao = eventDao;
        this.mergeLockDao = mergeLockDao;
        this.sm2Scheduler = sm2Scheduler;
        this.vocabEntryValidator = vocabEntryValidator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Adds a card, or re-adds it when a card with the same normalized term already exists. A re-add merges the new
     * content into the existing card, resets its schedule with the re-add penalty and records a RE_ADD event.
     * The entry check for typed input runs before the transaction starts.
     */
    public Vocab createVocab(VocabCreateRequest request) {
        String termNormalized = TermNormalizer.normalize(request.term());
        if (termNormalized.isEmpty()) {
            throw new ValidationException("term", "Term must not be empty");
        }

        VocabContent content = new VocabContent(
                request.term().strip(),
                ContentLists.uniqueStrings(request.meanings()),
                ContentLists.stripToNull(request.ipa()),
                request.exampleEn(),
                request.exampleVi(),
                request.mnemonic(),
                ContentLists.uniqueStrings(request.tags()),
                ContentLists.uniqueStrings(request.collocations()),
                ContentLists.uniqueStrings(request.phrases()),
                ContentLists.normalizeWordFamily(request.wordFamily()),
                ContentLists.uniqueStrings(request.topics()),
                normalizeCefrLevel(request.cefrLevel()),
                validateIeltsBand(request.ieltsBand()));

        EntryValidation validation = vocabEntryValidator.validate(request.term(), content.meanings(), request.inputMethod());
        if (!validation.accepted()) {
            throw new ValidationException("term", REJECTED_ENTRY_MESSAGE, Map.of("validation", validation));
        }

        return transactionTemplate.execute(status -> {
            mergeLockDao.acquireSharedLock();

            Instant now = clock.instant();
            Vocab vocab = new Vocab(UUID.randomUUID().toString(), termNormalized, content,
                    sm2Scheduler.initialState(now), now, now, 0);
            if (vocabDao.createVocab(vocab)) {
                log.debug("Created vocab {} for term {}", vocab.id(), termNormalized);
                return vocab;
            }

            Vocab existing = vocabDao.findByTermNormalized(termNormalized)
                    .orElseThrow(() -> new DaoException("Vocab for term " + termNormalized + " disappeared during re-add"));
            Vocab readded = vocabUpdater.update(existing.id(), current -> readd(current, content, now));

            ObjectNode payload = JsonNodeFactory.instance.objectNode();
            payload.put("vocabId", readded.id());
            payload.put("termNormalized", termNormalized);
            eventDao.appendEvent(new Event(UUID.randomUUID().toString(), EventType.RE_ADD.name(), payload, now));

            log.info("Re-added vocab {} ({} times)", termNormalized, readded.schedule().readdCount());
            return readded;
        });
    }

    /**
     * Saves an entry without the re-add penalty or a RE_ADD event. An unknown term becomes a new card. For a known
     * term the entry's term spelling always wins; overwrite mode then replaces every field the entry sets with a
     * different value, while merge mode unions the lists and only fills the card's empty fields.
     */
    UpsertOutcome upsertVocab(VocabUpsertRequest request) {
        String termNormalized = TermNormalizer.normalize(request.term());
        if (termNormalized.isEmpty()) {
            throw new ValidationException("term", "Term must not be empty");
        }

        VocabContent incoming = new VocabContent(
                request.term().strip(),
                ContentLists.uniqueStrings(request.meanings()),
                ContentLists.stripToNull(request.ipa()),
                request.exampleEn(),
                request.exampleVi(),
                request.mnemonic(),
                ContentLists.uniqueStrings(request.tags()),
                ContentLists.uniqueStrings(request.collocations()),
                ContentLists.uniqueStrings(request.phrases()),
                ContentLists.normalizeWordFamily(request.wordFamily()),
                ContentLists.uniqueStrings(request.topics()),
                normalizeCefrLevel(request.cefrLevel()),
                validateIeltsBand(request.ieltsBand()));

        EntryValidation validation = vocabEntryValidator.validate(request.term(), incoming.meanings(), request.inputMethod());
        if (!validation.accepted()) {
            throw new ValidationException("term", REJECTED_ENTRY_MESSAGE, Map.of("validation", validation));
        }

        return transactionTemplate.execute(status -> {
            mergeLockDao.acquireSharedLock();

            Instant now = clock.instant();
            Optional<Vocab> existing = vocabDao.findByTermNormalized(termNormalized);
            if (existing.isEmpty()) {
                Vocab vocab = new Vocab(UUID.randomUUID().toString(), termNormalized, incoming,
                        sm2Scheduler.initialState(now), now, now, 0);
                if (vocabDao.createVocab(vocab)) {
                    log.debug("Upsert created vocab {} for term {}", vocab.id(), termNormalized);
                    return new UpsertOutcome(vocab, true, false);
                }
                existing = vocabDao.findByTermNormalized(termNormalized);
            }

            String vocabId = existing
                    .orElseThrow(() -> new DaoException("Vocab for term " + termNormalized + " disappeared during upsert"))
                    .id();
            AtomicBoolean overwritten = new AtomicBoolean();
            Vocab updated = vocabUpdater.update(vocabId, current -> {
                ContentChange change = request.overwriteExisting()
                        ? overwriteContent(current.content(), incoming, request)
                        : fillContent(current.content(), incoming);
                overwritten.set(change.overwritten());
                return change.content().equals(current.content())
                        ? current
                        : current.withContent(current.termNormalized(), change.content(), now);
            });

            log.debug("Upsert {} vocab {} (overwritten={})", request.overwriteExisting() ? "overwrote" : "merged into",
                    vocabId, overwritten.get());
            return new UpsertOutcome(updated, false, overwritten.get());
        });
    }

    public Vocab getVocab(String vocabId) {
        return vocabDao.loadVocab(vocabId).orElseThrow(() -> new NotFoundException("Vocab not found: " + vocabId));
    }

    public List<Vocab> searchVocab(VocabFilterOptions filterOptions, int page, int limit) {
        if (page < 1) {
            throw new ValidationException("page", "Page must be at least 1");
        }
        if (limit < 1 || limit > MAX_PAGE_LIMIT) {
            throw new ValidationException("limit", "Limit must be between 1 and " + MAX_PAGE_LIMIT);
        }

        VocabFilterOptions normalizedOptions = new VocabFilterOptions(
                ContentLists.stripToNull(filterOptions.search()),
                ContentLists.stripToNull(filterOptions.tag()),
                ContentLists.stripToNull(filterOptions.topic()),
                filterOptions.cefrLevel() == null ? null : ContentLists.stripToNull(filterOptions.cefrLevel().toUpperCase(Locale.ROOT)));

        return vocabDao.searchVocab(normalizedOptions, (page - 1) * limit, limit);
    }

    public Vocab updateVocab(String vocabId, VocabUpdateRequest request) {
        String termNormalized = request.term() == null ? null : TermNormalizer.normalize(request.term());
        if (termNormalized != null && termNormalized.isEmpty()) {
            throw new ValidationException("term", "Term must not be empty");
        }
        String cefrLevel = normalizeCefrLevel(request.cefrLevel());
        Double ieltsBand = validateIeltsBand(request.ieltsBand());

        return transactionTemplate.execute(status -> vocabUpdater.update(vocabId, current -> {
            VocabContent content = current.content();
            VocabContent updated = new VocabContent(
                    request.term() == null ? content.term() : request.term().strip(),
                    request.meanings() == null ? content.meanings() : ContentLists.uniqueStrings(request.meanings()),
                    request.ipa() == null ? content.ipa() : ContentLists.stripToNull(request.ipa()),
                    request.exampleEn() == null ? content.exampleEn() : request.exampleEn(),
                    request.exampleVi() == null ? content.exampleVi() : request.exampleVi(),
                    request.mnemonic() == null ? content.mnemonic() : request.mnemonic(),
                    request.tags() == null ? content.tags() : ContentLists.uniqueStrings(request.tags()),
                    request.collocations() == null ? content.collocations() : ContentLists.uniqueStrings(request.collocations()),
                    request.phrases() == null ? content.phrases() : ContentLists.uniqueStrings(request.phrases()),
                    request.wordFamily() == null ? content.wordFamily() : ContentLists.normalizeWordFamily(request.wordFamily()),
                    request.topics() == null ? content.topics() : ContentLists.uniqueStrings(request.topics()),
                    cefrLevel == null ? content.cefrLevel() : cefrLevel,
                    ieltsBand == null ? content.ieltsBand() : ieltsBand);

            return current.withContent(termNormalized == null ? current.termNormalized() : termNormalized,
                    updated, clock.instant());
        }));
    }

    public void deleteVocab(String vocabId) {
        int deleted = transactionTemplate.execute(status -> {
            mergeLockDao.acquireSharedLock();
            return vocabDao.deleteVocab(vocabId);
        });

        if (deleted == 0) {
            throw new NotFoundException("Vocab not found: " + vocabId);
        }
        log.info("Deleted vocab {}", vocabId);
    }

    private Vocab readd(Vocab current, VocabContent incoming, Instant now) {
        VocabContent content = current.content();
        VocabContent merged = new VocabContent(
                content.term(),
                ContentLists.mergeUniqueStrings(content.meanings(), incoming.meanings()),
                ContentLists.isBlank(incoming.ipa()) ? content.ipa() : incoming.ipa(),
                content.exampleEn(),
                content.exampleVi(),
                content.mnemonic(),
                content.tags(),
                ContentLists.mergeUniqueStrings(content.collocations(), incoming.collocations()),
                ContentLists.mergeUniqueStrings(content.phrases(), incoming.phrases()),
                ContentLists.mergeWordFamily(content.wordFamily(), incoming.wordFamily()),
                ContentLists.mergeUniqueStrings(content.topics(), incoming.topics()),
                incoming.cefrLevel() == null ? content.cefrLevel() : incoming.cefrLevel(),
                incoming.ieltsBand() == null ? content.ieltsBand() : incoming.ieltsBand());

        ScheduleState schedule = sm2Scheduler.applyReaddPenalty(current.schedule(), now).withReadd(now);
        return current.withContent(current.termNormalized(), merged, now).withSchedule(schedule, now);
    }

    // Lists and the word family are replaced only by a non-empty value; scalar fields by any value the entry sets
    private static ContentChange overwriteContent(VocabContent existing, VocabContent incoming, VocabUpsertRequest request) {
        FieldReplacer replacer = new FieldReplacer();
        VocabContent content = new VocabContent(
                incoming.term(),
                replacer.pick(!incoming.meanings().isEmpty(), existing.meanings(), incoming.meanings()),
                replacer.pick(request.ipa() != null, existing.ipa(), incoming.ipa()),
                replacer.pick(request.exampleEn() != null, existing.exampleEn(), incoming.exampleEn()),
                replacer.pick(request.exampleVi() != null, existing.exampleVi(), incoming.exampleVi()),
                replacer.pick(request.mnemonic() != null, existing.mnemonic(), incoming.mnemonic()),
                replacer.pick(!incoming.tags().isEmpty(), existing.tags(), incoming.tags()),
                replacer.pick(!incoming.collocations().isEmpty(), existing.collocations(), incoming.collocations()),
                replacer.pick(!incoming.phrases().isEmpty(), existing.phrases(), incoming.phrases()),
                replacer.pick(!incoming.wordFamily().isEmpty(), existing.wordFamily(), incoming.wordFamily()),
                replacer.pick(!incoming.topics().isEmpty(), existing.topics(), incoming.topics()),
                replacer.pick(incoming.cefrLevel() != null, existing.cefrLevel(), incoming.cefrLevel()),
                replacer.pick(incoming.ieltsBand() != null, existing.ieltsBand(), incoming.ieltsBand()));
        return new ContentChange(content, replacer.replaced);
    }

    private static ContentChange fillContent(VocabContent existing, VocabContent incoming) {
        VocabContent content = new VocabContent(
                incoming.term(),
                ContentLists.mergeUniqueStrings(existing.meanings(), incoming.meanings()),
                ContentLists.isBlank(existing.ipa()) && incoming.ipa() != null ? incoming.ipa() : existing.ipa(),
                fillEmpty(existing.exampleEn(), incoming.exampleEn()),
                fillEmpty(existing.exampleVi(), incoming.exampleVi()),
                fillEmpty(existing.mnemonic(), incoming.mnemonic()),
                ContentLists.mergeUniqueStrings(existing.tags(), incoming.tags()),
                ContentLists.mergeUniqueStrings(existing.collocations(), incoming.collocations()),
                ContentLists.mergeUniqueStrings(existing.phrases(), incoming.phrases()),
                ContentLists.mergeWordFamily(existing.wordFamily(), incoming.wordFamily()),
                ContentLists.mergeUniqueStrings(existing.topics(), incoming.topics()),
                fillEmpty(existing.cefrLevel(), incoming.cefrLevel()),
                existing.ieltsBand() == null ? incoming.ieltsBand() : existing.ieltsBand());
        return new ContentChange(content, false);
    }

    private static String fillEmpty(String existingValue, String incomingValue) {
        boolean existingEmpty = existingValue == null || existingValue.isEmpty();
        boolean incomingEmpty = incomingValue == null || incomingValue.isEmpty();
        return existingEmpty && !incomingEmpty ? incomingValue : existingValue;
    }

    private static String normalizeCefrLevel(String cefrLevel) {
        String level = ContentLists.stripToNull(cefrLevel);
        if (level == null) {
            return null;
        }

        level = level.toUpperCase(Locale.ROOT);
        if (!CEFR_LEVELS.contains(level)) {
            throw new ValidationException("cefrLevel", "CEFR level must be one of A1, A2, B1, B2, C1, C2");
        }
        return level;
    }

    private static Double validateIeltsBand(Double ieltsBand) {
        if (ieltsBand != null && (ieltsBand < MIN_IELTS_BAND || ieltsBand > MAX_IELTS_BAND)) {
            throw new ValidationException("ieltsBand", "IELTS band must be between 1.0 and 9.0");
        }
        return ieltsBand;
    }

    record UpsertOutcome(Vocab vocab, boolean created, boolean overwritten) { }

    private record ContentChange(VocabContent content, boolean overwritten) { }

    private static class FieldReplacer {
        private boolean replaced;

        <T> T pick(boolean replace, T existingValue, T incomingValue) {
            if (replace && !Objects.equals(existingValue, incomingValue)) {
                replaced = true;
                return incomingValue;
            }
            return existingValue;
        }
    }
}
