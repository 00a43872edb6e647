package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.model.AiCacheEntry;
import com.gt.vocab.util.TermNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

// Checks a typed-in card for spelling and meaning mistakes before it is saved
@Component
public class VocabEntryValidator {

    private static final Logger log = LoggerFactory.getLogger(VocabEntryValidator.class);

    public static final String TYPED_INPUT = "typed";

    private final AiCacheDao aiCacheDao;
    private final AiProviderGateway aiProviderGateway;
    private final Clock clock;

    @Autowired
    public VocabEntryValidator(AiCacheDao aiCacheDao, AiProviderGateway aiProviderGateway, Clock clock) {
        this.aiCacheDao = aiCacheDao;
        this.aiProviderGateway = aiProviderGateway;
        this.clock = clock;
    }

    public EntryValidation validate(String term, List<String> meanings, String inputMethod) {
        if (!TYPED_INPUT.equals(inputMethod)) {
            return EntryValidation.skipped();
        }

        String cleanTerm = term == null ? "" : term.strip();
        String termNormalized = TermNormalizer.normalize(cleanTerm);
        List<String> cleanMeanings = dedupeByNormalized(meanings);
        String cacheKey = AiCacheKeys.validateKey(termNormalized, cleanTerm, cleanMeanings);

        Optional<AiCacheEntry> cacheEntry = aiCacheDao.loadCacheEntry(cacheKey);
        if (cacheEntry.isPresent() && cacheEntry.get().data().path("validate").isObject()) {
            ObjectNode result = (ObjectNode) cacheEntry.get().data().get("validate");
            return new EntryValidation(true, isAccepted(result), cacheEntry.get().provider(), true, result.deepCopy());
        }

        GeneratedContent generated = aiProviderGateway.validateEntry(cleanTerm, cleanMeanings);
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.set("validate", generated.data());
        Instant now = clock.instant();
        aiCacheDao.upsertCacheEntry(new AiCacheEntry(cacheKey, termNormalized, AiCacheKeys.CACHE_VERSION,
                generated.provider(), data, now, now));

        boolean accepted = isAccepted(generated.data());
        if (!accepted) {
            log.info("Entry '{}' rejected by {}: {}", cleanTerm, generated.provider(),
                    generated.data().path("reasonShort").asText(""));
        }
        return new EntryValidation(true, accepted, generated.provider(), false, generated.data());
    }

    private static boolean isAccepted(JsonNode result) {
        return result.path("isTermValid").asBoolean(false) && result.path("isMeaningPlausible").asBoolean(false);
    }

    private static List<String> dedupeByNormalized(List<String> meanings) {
        if (meanings == null) {
            return List.of();
        }

        Map<String, String> byNormalized = new LinkedHashMap<>();
        for (String meaning : meanings) {
            String normalized = TermNormalizer.normalize(meaning);
            if (!normalized.isEmpty()) {
                byNormalized.putIfAbsent(normalized, meaning.strip());
            }
        }
        return new ArrayList<>(byNormalized.values());
    }
}
