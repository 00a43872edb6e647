package com.gt.vocab.vocab;

import java.util.List;
import java.util.Map;

// inputMethod "typed" asks for the entry to be checked before it is saved
public record VocabCreateRequest(
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
        Double ieltsBand,
        String inputMethod) { }
