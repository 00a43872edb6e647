package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.exception.AiProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class AiProviderGatewayTests {

    private static final EnrichMissing ALL_MISSING = new EnrichMissing(true, true, true, true);

    @Mock private AiProvider aiProvider;

    private AiProviderGateway aiProviderGateway;

    @BeforeEach
    public void setup() {
        when(aiProvider.providerName()).thenReturn("openai");
        aiProviderGateway = new AiProviderGateway(aiProvider, new StubAiProvider());
    }

    @Test
    public void testEnrich_providerResultUsed() {
        ObjectNode data = JsonNodeFactory.instance.objectNode().put("ipa", "/wɔːk/");
        when(aiProvider.enrich("walk", List.of("di bo"), ALL_MISSING)).thenReturn(data);

        GeneratedContent generated = aiProviderGateway.enrich("walk", List.of("di bo"), ALL_MISSING);

        assertEquals("openai", generated.provider());
        assertEquals("/wɔːk/", generated.data().get("ipa").asText());
    }

    @Test
    public void testEnrich_providerFailureFallsBackToStub() {
        when(aiProvider.enrich(anyString(), anyList(), any())).thenThrow(new AiProviderException("OpenAI response is empty"));

        GeneratedContent generated = aiProviderGateway.enrich("walk", List.of("di bo"), ALL_MISSING);

        assertEquals(StubAiProvider.PROVIDER_NAME, generated.provider());
        assertEquals("/walk/", generated.data().get("ipa").asText());
        assertEquals(2, generated.data().get("meaningVariants").size());
    }

    @Test
    public void testEnrich_stubAsPrimaryKeepsEmptyResult() {
        StubAiProvider stubAiProvider = new StubAiProvider();
        AiProviderGateway stubOnly = new AiProviderGateway(stubAiProvider, stubAiProvider);

        GeneratedContent generated = stubOnly.enrich("walk", List.of(), new EnrichMissing(false, false, false, false));

        assertEquals(StubAiProvider.PROVIDER_NAME, generated.provider());
        assertTrue(generated.data().isEmpty());
        assertEquals(StubAiProvider.PROVIDER_NAME, stubOnly.providerName());
    }

    @Test
    public void testValidateEntry_nullResultFallsBackToStub() {
        when(aiProvider.validateEntry(anyString(), anyList())).thenReturn(null);

        GeneratedContent generated = aiProviderGateway.validateEntry("walk", List.of("di bo"));

        assertEquals(StubAiProvider.PROVIDER_NAME, generated.provider());
        assertTrue(generated.data().get("isTermValid").asBoolean());
        assertTrue(generated.data().get("isMeaningPlausible").asBoolean());
    }

    @Test
    public void testSpeakingFeedback_providerResultUsed() {
        ObjectNode feedback = JsonNodeFactory.instance.objectNode().put("estimatedBand", 6.5);
        when(aiProvider.speakingFeedback(anyString(), anyString(), anyList())).thenReturn(feedback);

        GeneratedContent generated = aiProviderGateway.speakingFeedback("Describe a trip", "I walked a lot", List.of("walk"));

        assertEquals("openai", generated.provider());
        assertEquals(6.5, generated.data().get("estimatedBand").asDouble());
        assertEquals("openai", aiProviderGateway.providerName());
    }
}
