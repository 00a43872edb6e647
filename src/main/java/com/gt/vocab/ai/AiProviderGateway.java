package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

// Calls the configured provider and answers from the stub provider whenever that call fails
@Component
public class AiProviderGateway {

    private static final Logger log = LoggerFactory.getLogger(AiProviderGateway.class);

    private final AiProvider aiProvider;
    private final StubAiProvider stubAiProvider;

    @Autowired
    public AiProviderGateway(AiProvider aiProvider, StubAiProvider stubAiProvider) {
        this.aiProvider = aiProvider;
        this.stubAiProvider = stubAiProvider;
    }

    public String providerName() {
        return aiProvider.providerName();
    }

    // An empty enrichment is treated like a failure so the caller always gets usable suggestions
    public GeneratedContent enrich(String term, List<String> meanings, EnrichMissing missing) {
        GeneratedContent generated = call("enrich", provider -> provider.enrich(term, meanings, missing));
        if (generated.data().isEmpty() && aiProvider != stubAiProvider) {
            log.warn("Provider {} returned no enrichment for {}, using {}", aiProvider.providerName(), term, stubAiProvider.providerName());
            return new GeneratedContent(stubAiProvider.providerName(), stubAiProvider.enrich(term, meanings, missing));
        }
        return generated;
    }

    public GeneratedContent judgeEquivalence(String term, String userAnswer, List<String> meanings) {
        return call("judgeEquivalence", provider -> provider.judgeEquivalence(term, userAnswer, meanings));
    }

    public GeneratedContent validateEntry(String term, List<String> meanings) {
        return call("validateEntry", provider -> provider.validateEntry(term, meanings));
    }

    public GeneratedContent speakingFeedback(String prompt, String responseText, List<String> targetWords) {
        return call("speakingFeedback", provider -> provider.speakingFeedback(prompt, responseText, targetWords));
    }

    private GeneratedContent call(String operation, Function<AiProvider, ObjectNode> providerCall) {
        try {
            ObjectNode data = providerCall.apply(aiProvider);
            if (data != null) {
                return new GeneratedContent(aiProvider.providerName(), data);
            }
            log.warn("Provider {} returned nothing for {}, using {}", aiProvider.providerName(), operation, stubAiProvider.providerName());
        } catch (RuntimeException ex) {
            log.warn("Provider {} failed for {}, using {}", aiProvider.providerName(), operation, stubAiProvider.providerName(), ex);
        }

        return new GeneratedContent(stubAiProvider.providerName(), providerCall.apply(stubAiProvider));
    }
}
