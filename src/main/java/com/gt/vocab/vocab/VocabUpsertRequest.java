package com.gt.vocab.vocab;

import java.util.List;
import java.util.Map;

// overwriteExisting and useAi default to true, forceAi to false
public record VocabUpsertRequest(
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
        String inputMethod,
        Boolean overwriteExisting,
        Boolean useAi,
        Boolean forceAi) {

    public VocabUpsertRequest {
        overwriteExisting = overwriteExisting == null ? Boolean.TRUE : overwriteExisting;
        useAi = useAi == null ? Boolean.TRUE : useAi;
        forceAi = forceAi == null ? Boolean.FALSE : forceAi;
    }
}
