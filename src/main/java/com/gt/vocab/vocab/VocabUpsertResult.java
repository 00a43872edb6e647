package com.gt.vocab.vocab;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.model.Vocab;

public record VocabUpsertResult(
        String action,
        boolean overwritten,
        Vocab vocab,
        AiInfo ai,
        ObjectNode suggestions) {

    public static final String ACTION_CREATED = "created";
    public static final String ACTION_UPDATED = "updated";

    // provider is null when enrichment was not requested
    public record AiInfo(boolean enabled, String provider, boolean aiCalled, boolean fromCache) { }
}
