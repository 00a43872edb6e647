package com.gt.vocab.vocab;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gt.vocab.ai.AiContentService;
import com.gt.vocab.ai.EnrichResult;
import com.gt.vocab.model.Vocab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Saves an entry and then, unless told not to, enriches the saved card. The card is committed before the provider
 * is called, so a slow or failing provider never holds the card's lock.
 */
@Component
public class VocabUpsertService {

    private static final Logger log = LoggerFactory.getLogger(VocabUpsertService.class);

    private final VocabService vocabService;
    private final AiContentService aiContentService;

    @Autowired
    public VocabUpsertService(VocabService vocabService, AiContentService aiContentService) {
        this.vocabService = vocabService;
        this.aiContentService = aiContentService;
    }

    public VocabUpsertResult upsertWithAi(VocabUpsertRequest request) {
        VocabService.UpsertOutcome outcome = vocabService.upsertVocab(request);
        String action = outcome.created() ? VocabUpsertResult.ACTION_CREATED : VocabUpsertResult.ACTION_UPDATED;

        if (!request.useAi()) {
            return new VocabUpsertResult(action, outcome.overwritten(), outcome.vocab(),
                    new VocabUpsertResult.AiInfo(false, null, false, false),
                    AiContentService.suggestions(outcome.vocab().content(), JsonNodeFactory.instance.objectNode()));
        }

        EnrichResult enriched = aiContentService.enrich(outcome.vocab().content().term(), List.of(), request.forceAi());
        Vocab vocab = enriched.vocab() == null ? outcome.vocab() : enriched.vocab();

        log.info("Upsert {} {} with provider {} (aiCalled={})", action, vocab.termNormalized(), enriched.provider(),
                enriched.aiCalled());
        return new VocabUpsertResult(action, outcome.overwritten(), vocab,
                new VocabUpsertResult.AiInfo(true, enriched.provider(), enriched.aiCalled(), enriched.fromCache()),
                enriched.data());
    }
}
