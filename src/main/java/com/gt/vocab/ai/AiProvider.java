package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Source of generated learning content. Implementations may throw {@link com.gt.vocab.exception.AiProviderException};
 * {@link AiProviderGateway} falls back to {@link StubAiProvider} when they do.
 */
public interface AiProvider {

    String providerName();

    // Keys: examples [{en, vi}], mnemonics [], meaningVariants [], ipa; only the ones asked for by missing
    ObjectNode enrich(String term, List<String> meanings, EnrichMissing missing);

    // Keys: isEquivalent, reasonShort
    ObjectNode judgeEquivalence(String term, String userAnswer, List<String> meanings);

    // Keys: isTermValid, isMeaningPlausible, suggestedTerm, suggestedMeanings, reasonShort
    ObjectNode validateEntry(String term, List<String> meanings);

    // Keys: estimatedBand, targetCoverage, usedTargetWords, strengths, improvements, reasonShort
    ObjectNode speakingFeedback(String prompt, String responseText, List<String> targetWords);
}
