package com.gt.vocab.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record VocabContent(
        String term,
        List<String> meanings,
        String ipa,
        String exampleEn,
        String exampleVi,
        String mnemonic,
        List<String> tags,
        List<String> collocations,
        List<String> phrases,
        Map<String, List<String>> wordFamily,
        List<String> topics,
        String cefrLevel,
        Double ieltsBand) {

    public VocabContent {
        meanings = meanings == null ? List.of() : List.copyOf(meanings);
        tags = tags == null ? List.of() : List.copyOf(tags);
        collocations = collocations == null ? List.of() : List.copyOf(collocations);
        phrases = phrases == null ? List.of() : List.copyOf(phrases);
        wordFamily = wordFamily == null ? Map.of() : copyWordFamily(wordFamily);
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    // Keeps role order, which Map.copyOf would not
    private static Map<String, List<String>> copyWordFamily(Map<String, List<String>> wordFamily) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        wordFamily.forEach((role, words) -> copy.put(role, words == null ? List.of() : List.copyOf(words)));
        return Collections.unmodifiableMap(copy);
    }

    public static VocabContent ofTerm(String term, List<String> meanings) {
        return new VocabContent(term, meanings, null, null, null, null, null, null, null, null, null, null, null);
    }

    public VocabContent withMeanings(List<String> newMeanings) {
        return new VocabContent(term, newMeanings, ipa, exampleEn, exampleVi, mnemonic, tags, collocations, phrases,
                wordFamily, topics, cefrLevel, ieltsBand);
    }
}
