package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.fuzzy.TypingJudge;
import com.gt.vocab.model.AiCacheEntry;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.model.VocabContent;
import com.gt.vocab.util.ContentLists;
import com.gt.vocab.util.TermNormalizer;
import com.gt.vocab.vocab.VocabDao;
import com.gt.vocab.vocab.VocabUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Cached AI helpers for a card: enrichment of learning content, semantic judging of typed answers, and speaking
 * feedback. Provider calls run outside any transaction; only the card back-fill is transactional.
 */
@Component
public class AiContentService {

    private static final Logger log = LoggerFactory.getLogger(AiContentService.class);

    static final String FUZZY_PROVIDER = "fuzzy";
    static final String FUZZY_REASON = "fuzzy match";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final VocabDao vocabDao;
    private final VocabUpdater vocabUpdater;
    private final AiCacheDao aiCacheDao;
    private final AiProviderGateway aiProviderGateway;
    private final TypingJudge typingJudge;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Autowired
    public AiContentService(VocabDao vocabDao,
                            VocabUpdater vocabUpdater,
                            AiCacheDao aiCacheDao,
                            AiProviderGateway aiProviderGateway,
                            TypingJudge typingJudge,
                            TransactionTemplate transactionTemplate,
                            Clock clock) {
        this.vocabDao = vocabDao;
        this.vocabUpdater = vocabUpdater;
        this.aiCacheDao = aiCacheDao;
        this.aiProviderGateway = aiProviderGateway;
        this.typingJudge = typingJudge;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public EnrichResult enrich(String term, List<String> meaningsExisting) {
        return enrich(term, meaningsExisting, false);
    }

    /**
     * Fills the gaps in a term's learning content from the cache, calling the provider only for what is still missing.
     * A forced call asks the provider for every kind of content and rewrites the cache entry even when it exists.
     * When a card exists for the term, its empty fields are back-filled from the merged content.
     */
    public EnrichResult enrich(String term, List<String> meaningsExisting, boolean force) {
        String termNormalized = requireTerm(term);
        String cacheKey = AiCacheKeys.enrichKey(termNormalized);

        Optional<Vocab> vocab = vocabDao.findByTermNormalized(termNormalized);
        Optional<AiCacheEntry> cacheEntry = aiCacheDao.loadCacheEntry(cacheKey);
        ObjectNode cacheData = cacheEntry.map(AiCacheEntry::data).orElseGet(NODES::objectNode);

        List<String> vocabMeanings = vocab.map(v -> v.content().meanings()).orElse(List.of());
        List<String> allMeanings = ContentLists.mergeUniqueStrings(vocabMeanings, meaningsExisting);
        List<JsonNode> examples = collectExamples(vocab.map(Vocab::content).orElse(null), cacheData);
        List<String> mnemonics = collectMnemonics(vocab.map(Vocab::content).orElse(null), cacheData);

        boolean hasCoreContent = allMeanings.size() >= 2
                && vocab.map(v -> !ContentLists.isBlank(v.content().exampleEn())).orElse(false)
                && vocab.map(v -> !ContentLists.isBlank(v.content().mnemonic())).orElse(false);
        boolean hasIpa = vocab.map(v -> !ContentLists.isBlank(v.content().ipa())).orElse(false)
                || !ContentLists.isBlank(cacheData.path("ipa").asText(""));

        EnrichMissing missing = force
                ? new EnrichMissing(true, true, true, true)
                : new EnrichMissing(
                        !hasCoreContent && examples.isEmpty(),
                        !hasCoreContent && mnemonics.isEmpty(),
                        !hasCoreContent && allMeanings.size() < 2,
                        !hasIpa);

        String provider = cacheEntry.map(AiCacheEntry::provider).orElse(StubAiProvider.PROVIDER_NAME);
        ObjectNode generated = NODES.objectNode();
        boolean aiCalled = false;
        if (missing.any()) {
            aiCalled = true;
            GeneratedContent content = aiProviderGateway.enrich(term.strip(), allMeanings, missing);
            generated = content.data();
            provider = content.provider();
        }

        ObjectNode mergedData = AiContentMerger.mergeContent(cacheData, generated);
        if (cacheEntry.isEmpty() || !generated.isEmpty() || force) {
            AiCacheEntry stored = aiCacheDao.upsertCacheEntry(newCacheEntry(cacheKey, termNormalized, provider, mergedData));
            mergedData = stored.data();
        }

        Optional<Vocab> updatedVocab = vocab;
        if (vocab.isPresent()) {
            ObjectNode backfillData = mergedData;
            updatedVocab = Optional.ofNullable(transactionTemplate.execute(status ->
                    vocabUpdater.update(vocab.get().id(), current -> backfill(current, backfillData))));
        }

        ObjectNode responseData = suggestions(updatedVocab.map(Vocab::content).orElse(null), mergedData);

        log.debug("Enriched {} with provider {} (aiCalled={})", termNormalized, provider, aiCalled);
        return new EnrichResult(termNormalized, provider, aiCalled, !aiCalled && cacheEntry.isPresent(),
                responseData, updatedVocab.orElse(null));
    }

    /**
     * Learning content to show for a card: its own example and mnemonic first, then whatever the cached data adds.
     * Pass an empty object as the cached data to describe the card alone.
     */
    public static ObjectNode suggestions(VocabContent content, ObjectNode cacheData) {
        ObjectNode suggestions = NODES.objectNode();
        ArrayNode examples = suggestions.putArray("examples");
        collectExamples(content, cacheData).forEach(examples::add);
        ArrayNode mnemonics = suggestions.putArray("mnemonics");
        collectMnemonics(content, cacheData).forEach(mnemonics::add);
        ArrayNode variants = suggestions.putArray("meaningVariants");
        ContentLists.uniqueStrings(textList(cacheData.get("meaningVariants"))).forEach(variants::add);
        String ipa = content != null && !ContentLists.isBlank(content.ipa())
                ? content.ipa()
                : ContentLists.stripToNull(cacheData.path("ipa").asText(null));
        suggestions.put("ipa", ipa);
        suggestions.set("synonymGroups", arrayOrEmpty(cacheData.get("synonymGroups")));
        suggestions.set("distractors", arrayOrEmpty(cacheData.get("distractors")));
        return suggestions;
    }

    public JudgeResult judgeEquivalence(String term, String userAnswer, List<String> meanings) {
        String termNormalized = requireTerm(term);
        List<String> candidates = ContentLists.uniqueStrings(meanings);
        String cacheKey = AiCacheKeys.judgeKey(termNormalized, userAnswer, candidates);

        if (typingJudge.isNearCorrect(userAnswer, candidates)) {
            ObjectNode judge = NODES.objectNode();
            judge.put("isEquivalent", true);
            judge.put("reasonShort", FUZZY_REASON);
            upsertJudge(cacheKey, termNormalized, FUZZY_PROVIDER, judge);
            learnEquivalentAnswer(termNormalized, userAnswer, FUZZY_PROVIDER);
            return new JudgeResult(true, FUZZY_REASON, FUZZY_PROVIDER, false);
        }

        Optional<AiCacheEntry> cacheEntry = aiCacheDao.loadCacheEntry(cacheKey);
        if (cacheEntry.isPresent() && cacheEntry.get().data().path("judge").isObject()) {
            JsonNode judge = cacheEntry.get().data().get("judge");
            boolean equivalent = judge.path("isEquivalent").asBoolean(false);
            if (equivalent) {
                learnEquivalentAnswer(termNormalized, userAnswer, cacheEntry.get().provider());
            }
            return new JudgeResult(equivalent, judge.path("reasonShort").asText(""), cacheEntry.get().provider(), true);
        }

        GeneratedContent generated = aiProviderGateway.judgeEquivalence(term.strip(), userAnswer, candidates);
        boolean equivalent = generated.data().path("isEquivalent").asBoolean(false);
        ObjectNode judge = NODES.objectNode();
        judge.put("isEquivalent", equivalent);
        judge.put("reasonShort", generated.data().path("reasonShort").asText(""));
        upsertJudge(cacheKey, termNormalized, generated.provider(), judge);
        if (equivalent) {
            learnEquivalentAnswer(termNormalized, userAnswer, generated.provider());
        }

        return new JudgeResult(equivalent, judge.get("reasonShort").asText(), generated.provider(), false);
    }

    public SpeakingFeedbackResult speakingFeedback(String prompt, String responseText, List<String> targetWords) {
        if (ContentLists.isBlank(responseText)) {
            throw new ValidationException("responseText", "Response text must not be empty");
        }

        GeneratedContent generated = aiProviderGateway.speakingFeedback(
                prompt == null ? "" : prompt.strip(), responseText, ContentLists.uniqueStrings(targetWords));
        return new SpeakingFeedbackResult(generated.provider(), generated.data());
    }

    // An accepted answer becomes one of the card's meanings and one of the cached meaning variants
    void learnEquivalentAnswer(String termNormalized, String userAnswer, String provider) {
        String rawAnswer = userAnswer == null ? "" : userAnswer.strip();
        String normalizedAnswer = TermNormalizer.normalize(rawAnswer);
        if (normalizedAnswer.isEmpty()) {
            return;
        }

        vocabDao.findByTermNormalized(termNormalized).ifPresent(vocab ->
                transactionTemplate.executeWithoutResult(status -> vocabUpdater.update(vocab.id(), current -> {
                    if (containsNormalized(current.content().meanings(), normalizedAnswer)) {
                        return current;
                    }
                    List<String> meanings = new ArrayList<>(current.content().meanings());
                    meanings.add(rawAnswer);
                    return current.withContent(current.termNormalized(),
                            current.content().withMeanings(meanings), clock.instant());
                })));

        String cacheKey = AiCacheKeys.enrichKey(termNormalized);
        Optional<AiCacheEntry> cacheEntry = aiCacheDao.loadCacheEntry(cacheKey);
        ObjectNode data = cacheEntry.map(AiCacheEntry::data).orElseGet(NODES::objectNode);
        List<String> variants = ContentLists.uniqueStrings(textList(data.get("meaningVariants")));
        if (containsNormalized(variants, normalizedAnswer)) {
            return;
        }

        ObjectNode updated = data.deepCopy();
        ArrayNode updatedVariants = updated.putArray("meaningVariants");
        variants.forEach(updatedVariants::add);
        updatedVariants.add(rawAnswer);
        aiCacheDao.upsertCacheEntry(newCacheEntry(cacheKey, termNormalized,
                cacheEntry.map(AiCacheEntry::provider).orElse(provider), updated));
        log.info("Learned answer '{}' as a meaning variant of {}", rawAnswer, termNormalized);
    }

    private Vocab backfill(Vocab current, ObjectNode cacheData) {
        VocabContent content = current.content();
        List<JsonNode> examples = collectExamples(null, cacheData);

        String exampleEn = content.exampleEn();
        String exampleVi = content.exampleVi();
        if (!examples.isEmpty()) {
            if (ContentLists.isBlank(exampleEn)) {
                exampleEn = ContentLists.stripToNull(examples.get(0).path("en").asText(null));
            }
            if (ContentLists.isBlank(exampleVi)) {
                exampleVi = ContentLists.stripToNull(examples.get(0).path("vi").asText(null));
            }
        }

        String mnemonic = content.mnemonic();
        if (ContentLists.isBlank(mnemonic)) {
            List<String> mnemonics = collectMnemonics(content, cacheData);
            mnemonic = mnemonics.isEmpty() ? mnemonic : mnemonics.get(0);
        }

        List<String> meanings = content.meanings();
        if (meanings.size() < 2) {
            meanings = ContentLists.mergeUniqueStrings(meanings, textList(cacheData.get("meaningVariants")));
        }

        String ipa = content.ipa();
        if (ContentLists.isBlank(ipa)) {
            String cachedIpa = ContentLists.stripToNull(cacheData.path("ipa").asText(null));
            ipa = cachedIpa == null ? ipa : cachedIpa;
        }

        VocabContent filled = new VocabContent(content.term(), meanings, ipa, exampleEn, exampleVi, mnemonic,
                content.tags(), content.collocations(), content.phrases(), content.wordFamily(), content.topics(),
                content.cefrLevel(), content.ieltsBand());
        if (filled.equals(content)) {
            return current;
        }
        return current.withContent(current.termNormalized(), filled, clock.instant());
    }

    private void upsertJudge(String cacheKey, String termNormalized, String provider, ObjectNode judge) {
        ObjectNode data = NODES.objectNode();
        data.set("judge", judge);
        aiCacheDao.upsertCacheEntry(newCacheEntry(cacheKey, termNormalized, provider, data));
    }

    private AiCacheEntry newCacheEntry(String cacheKey, String termNormalized, String provider, ObjectNode data) {
        Instant now = clock.instant();
        return new AiCacheEntry(cacheKey, termNormalized, AiCacheKeys.CACHE_VERSION, provider, data, now, now);
    }

    // Card examples come first, then cached ones; only objects with a non-blank English sentence count
    private static List<JsonNode> collectExamples(VocabContent content, ObjectNode cacheData) {
        List<JsonNode> examples = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        if (content != null && !ContentLists.isBlank(content.exampleEn())) {
            ObjectNode example = NODES.objectNode();
            example.put("en", content.exampleEn().strip());
            example.put("vi", content.exampleVi() == null ? "" : content.exampleVi().strip());
            examples.add(example);
            seen.add(example.get("en").asText());
        }

        for (JsonNode item : arrayOrEmpty(cacheData.get("examples"))) {
            String en = item.path("en").asText("").strip();
            if (item.isObject() && !en.isEmpty() && seen.add(en)) {
                examples.add(item);
            }
        }
        return examples;
    }

    private static List<String> collectMnemonics(VocabContent content, ObjectNode cacheData) {
        List<String> mnemonics = new ArrayList<>(textList(cacheData.get("mnemonics")));
        if (content != null && content.mnemonic() != null) {
            mnemonics.add(content.mnemonic());
        }
        return ContentLists.uniqueStrings(mnemonics);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            }
        }
        return values;
    }

    private static ArrayNode arrayOrEmpty(JsonNode node) {
        return node != null && node.isArray() ? (ArrayNode) node.deepCopy() : NODES.arrayNode();
    }

    private static boolean containsNormalized(List<String> values, String normalized) {
        return values.stream().map(TermNormalizer::normalize).anyMatch(normalized::equals);
    }

    private static String requireTerm(String term) {
        String termNormalized = TermNormalizer.normalize(term);
        if (termNormalized.isEmpty()) {
            throw new ValidationException("term", "Term must not be empty");
        }
        return termNormalized;
    }
}
