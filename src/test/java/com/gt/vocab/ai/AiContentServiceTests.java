package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.exception.AiProviderException;
import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.fuzzy.TypingJudge;
import com.gt.vocab.model.AiCacheEntry;
import com.gt.vocab.model.ScheduleState;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.model.VocabContent;
import com.gt.vocab.support.InMemoryAiCacheDao;
import com.gt.vocab.support.InMemoryVocabDao;
import com.gt.vocab.support.RecordingMergeLockDao;
import com.gt.vocab.support.TestVocabs;
import com.gt.vocab.vocab.VocabUpdater;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class AiContentServiceTests {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Instant TEST_NOW = Instant.parse("2024-03-10T08:00:00Z");
    private static final Instant TEST_CREATED = Instant.parse("2024-03-01T00:00:00Z");
    private static final String TEST_PROVIDER = "openai";

    @Mock private AiProvider aiProvider;
    @Mock private PlatformTransactionManager transactionManager;

    private InMemoryVocabDao vocabDao;
    private InMemoryAiCacheDao aiCacheDao;
    private AiContentService aiContentService;

    @BeforeEach
    public void setup() {
        vocabDao = new InMemoryVocabDao();
        aiCacheDao = new InMemoryAiCacheDao();

        when(aiProvider.providerName()).thenReturn(TEST_PROVIDER);

        aiContentService = new AiContentService(
                vocabDao,
                new VocabUpdater(vocabDao, new RecordingMergeLockDao(), 3),
                aiCacheDao,
                new AiProviderGateway(aiProvider, new StubAiProvider()),
                new TypingJudge(85),
                new TransactionTemplate(transactionManager),
                Clock.fixed(TEST_NOW, ZoneOffset.UTC));
    }

    @Test
    public void testEnrich_backfillsExistingVocab() {
        Vocab run = TestVocabs.newVocab("run", List.of("chay"), TEST_CREATED);
        vocabDao.put(run);
        when(aiProvider.enrich(anyString(), anyList(), any())).thenReturn(generatedContent());

        EnrichResult result = aiContentService.enrich(" Run ", List.of());

        verify(aiProvider).enrich("Run", List.of("chay"), new EnrichMissing(true, true, true, true));
        assertEquals("run", result.termNormalized());
        assertEquals(TEST_PROVIDER, result.provider());
        assertTrue(result.aiCalled());
        assertFalse(result.fromCache());

        VocabContent content = result.vocab().content();
        assertEquals(List.of("chay", "van hanh"), content.meanings());
        assertEquals("We run every day.", content.exampleEn());
        assertEquals("Chung toi chay moi ngay.", content.exampleVi());
        assertEquals("run like the wind", content.mnemonic());
        assertEquals("/rʌn/", content.ipa());
        assertEquals(TEST_NOW, result.vocab().updatedAt());
        assertEquals(1, vocabDao.loadVocab(run.id()).orElseThrow().version());

        assertEquals(1, result.data().get("examples").size());
        assertEquals("/rʌn/", result.data().get("ipa").asText());
        assertTrue(result.data().get("distractors").isEmpty());

        AiCacheEntry cached = aiCacheDao.loadCacheEntry(AiCacheKeys.enrichKey("run")).orElseThrow();
        assertEquals(TEST_PROVIDER, cached.provider());
        assertEquals(2, cached.data().get("meaningVariants").size());
    }

    @Test
    public void testEnrich_completeCardSkipsProvider() {
        Vocab run = new Vocab("run-id", "run",
                new VocabContent("run", List.of("chay", "van hanh"), "/rʌn/", "I run.", null, "run run",
                        null, null, null, null, null, null, null),
                new ScheduleState(2.5, 0, 0, 0, TEST_CREATED, null, 0, null), TEST_CREATED, TEST_CREATED, 0);
        vocabDao.put(run);

        EnrichResult first = aiContentService.enrich("run", List.of());
        EnrichResult second = aiContentService.enrich("run", List.of());

        verify(aiProvider, never()).enrich(anyString(), anyList(), any());
        assertFalse(first.aiCalled());
        assertFalse(first.fromCache());
        assertTrue(second.fromCache());
        assertEquals(StubAiProvider.PROVIDER_NAME, second.provider());
        assertEquals(run, second.vocab());
        assertEquals("I run.", second.data().get("examples").get(0).get("en").asText());
        assertEquals("run run", second.data().get("mnemonics").get(0).asText());
        assertEquals(1, aiCacheDao.size());
    }

    @Test
    public void testEnrich_unknownTermUsesStubWhenProviderReturnsNothing() {
        when(aiProvider.enrich(anyString(), anyList(), any())).thenReturn(NODES.objectNode());

        EnrichResult result = aiContentService.enrich("Sprint", List.of("chay nuoc rut"));

        assertNull(result.vocab());
        assertEquals(StubAiProvider.PROVIDER_NAME, result.provider());
        assertEquals("/sprint/", result.data().get("ipa").asText());
        assertEquals("chay nuoc rut", result.data().get("meaningVariants").get(0).asText());
        assertEquals(1, result.data().get("mnemonics").size());
    }

    @Test
    public void testEnrich_emptyTerm() {
        assertThrows(ValidationException.class, () -> aiContentService.enrich(" !! ", List.of()));
    }

    @Test
    public void testJudgeEquivalence_fuzzyMatchSkipsProvider() {
        JudgeResult result = aiContentService.judgeEquivalence("run", "chayy", List.of("chay"));

        verify(aiProvider, never()).judgeEquivalence(anyString(), anyString(), anyList());
        assertTrue(result.isEquivalent());
        assertEquals(AiContentService.FUZZY_PROVIDER, result.provider());
        assertEquals(AiContentService.FUZZY_REASON, result.reasonShort());
        assertFalse(result.cached());
    }

    @Test
    public void testJudgeEquivalence_providerResultCachedAndLearned() {
        Vocab run = TestVocabs.newVocab("run", List.of("chay nhanh"), TEST_CREATED);
        vocabDao.put(run);

        ObjectNode judged = NODES.objectNode();
        judged.put("isEquivalent", true);
        judged.put("reasonShort", "same sense");
        when(aiProvider.judgeEquivalence(eq("run"), eq("tau thoat"), anyList())).thenReturn(judged);

        JudgeResult first = aiContentService.judgeEquivalence("run", "tau thoat", List.of("chay nhanh"));
        JudgeResult second = aiContentService.judgeEquivalence("run", " Tau thoat ", List.of("chay nhanh"));

        verify(aiProvider, times(1)).judgeEquivalence(anyString(), anyString(), anyList());
        assertEquals(new JudgeResult(true, "same sense", TEST_PROVIDER, false), first);
        assertEquals(new JudgeResult(true, "same sense", TEST_PROVIDER, true), second);

        assertEquals(List.of("chay nhanh", "tau thoat"), vocabDao.loadVocab(run.id()).orElseThrow().content().meanings());
        AiCacheEntry enrichEntry = aiCacheDao.loadCacheEntry(AiCacheKeys.enrichKey("run")).orElseThrow();
        assertEquals(1, enrichEntry.data().get("meaningVariants").size());
        assertEquals("tau thoat", enrichEntry.data().get("meaningVariants").get(0).asText());
    }

    @Test
    public void testJudgeEquivalence_rejectedAnswerNotLearned() {
        Vocab run = TestVocabs.newVocab("run", List.of("chay nhanh"), TEST_CREATED);
        vocabDao.put(run);

        ObjectNode judged = NODES.objectNode();
        judged.put("isEquivalent", false);
        judged.put("reasonShort", "different sense");
        when(aiProvider.judgeEquivalence(anyString(), anyString(), anyList())).thenReturn(judged);

        JudgeResult result = aiContentService.judgeEquivalence("run", "ngu say", List.of("chay nhanh"));

        assertFalse(result.isEquivalent());
        assertEquals("different sense", result.reasonShort());
        assertEquals(List.of("chay nhanh"), vocabDao.loadVocab(run.id()).orElseThrow().content().meanings());
        assertTrue(aiCacheDao.loadCacheEntry(AiCacheKeys.enrichKey("run")).isEmpty());
    }

    @Test
    public void testJudgeEquivalence_providerFailureFallsBackToStub() {
        when(aiProvider.judgeEquivalence(anyString(), anyString(), anyList()))
                .thenThrow(new AiProviderException("OpenAI API error: timeout"));

        JudgeResult result = aiContentService.judgeEquivalence("run", "di bo", List.of("chay nhanh"));

        assertEquals(StubAiProvider.PROVIDER_NAME, result.provider());
        assertFalse(result.isEquivalent());
        assertEquals("stub semantic check", result.reasonShort());
    }

    @Test
    public void testSpeakingFeedback() {
        when(aiProvider.speakingFeedback(anyString(), anyString(), anyList())).thenReturn(null);

        SpeakingFeedbackResult result = aiContentService.speakingFeedback(" Describe a hobby ",
                "I like to run and sprint", List.of("sprint", "marathon", "sprint"));

        verify(aiProvider).speakingFeedback("Describe a hobby", "I like to run and sprint", List.of("sprint", "marathon"));
        assertEquals(StubAiProvider.PROVIDER_NAME, result.provider());
        assertEquals(0.5, result.feedback().get("targetCoverage").asDouble());
    }

    @Test
    public void testSpeakingFeedback_blankResponse() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> aiContentService.speakingFeedback("Describe a hobby", "  ", List.of()));

        assertEquals("responseText", ex.getField());
        verify(aiProvider, never()).speakingFeedback(anyString(), anyString(), anyList());
    }

    private static ObjectNode generatedContent() {
        ObjectNode data = NODES.objectNode();
        data.putArray("examples").addObject().put("en", "We run every day.").put("vi", "Chung toi chay moi ngay.");
        data.putArray("mnemonics").add("run like the wind");
        data.putArray("meaningVariants").add("chay").add("van hanh");
        data.put("ipa", "/rʌn/");
        return data;
    }
}
