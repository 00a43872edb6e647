package com.gt.vocab.vocab;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.ai.*;
import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.fuzzy.TypingJudge;
import com.gt.vocab.model.ScheduleState;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.model.VocabContent;
import com.gt.vocab.review.Sm2Scheduler;
import com.gt.vocab.support.*;
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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class VocabUpsertServiceTests {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Instant TEST_NOW = Instant.parse("2024-03-10T08:00:00Z");
    private static final Instant TEST_CREATED = Instant.parse("2024-03-01T00:00:00Z");
    private static final String TEST_PROVIDER = "openai";

    @Mock private AiProvider aiProvider;
    @Mock private PlatformTransactionManager transactionManager;

    private InMemoryVocabDao vocabDao;
    private InMemoryEventDao eventDao;
    private InMemoryAiCacheDao aiCacheDao;
    private VocabUpsertService vocabUpsertService;

    @BeforeEach
    public void setup() {
        vocabDao = new InMemoryVocabDao();
        eventDao = new InMemoryEventDao();
        aiCacheDao = new InMemoryAiCacheDao();
        RecordingMergeLockDao mergeLockDao = new RecordingMergeLockDao();

        when(aiProvider.providerName()).thenReturn(TEST_PROVIDER);

        Clock clock = Clock.fixed(TEST_NOW, ZoneOffset.UTC);
        StubAiProvider stubAiProvider = new StubAiProvider();
        VocabUpdater vocabUpdater = new VocabUpdater(vocabDao, mergeLockDao, 3);
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

        VocabService vocabService = new VocabService(vocabDao, vocabUpdater, eventDao, mergeLockDao, new Sm2Scheduler(),
                new VocabEntryValidator(aiCacheDao, new AiProviderGateway(stubAiProvider, stubAiProvider), clock),
                transactionTemplate, clock);
        AiContentService aiContentService = new AiContentService(vocabDao, vocabUpdater, aiCacheDao,
                new AiProviderGateway(aiProvider, stubAiProvider), new TypingJudge(85), transactionTemplate, clock);

        vocabUpsertService = new VocabUpsertService(vocabService, aiContentService);
    }

    @Test
    public void testUpsertWithAi_createsAndEnriches() {
        when(aiProvider.enrich(anyString(), anyList(), any())).thenReturn(generatedContent());

        VocabUpsertResult result = vocabUpsertService.upsertWithAi(request(" Run ", List.of("chay"), null, null, null));

        assertEquals(VocabUpsertResult.ACTION_CREATED, result.action());
        assertFalse(result.overwritten());
        assertEquals(new VocabUpsertResult.AiInfo(true, TEST_PROVIDER, true, false), result.ai());

        Vocab stored = vocabDao.findByTermNormalized("run").orElseThrow();
        assertEquals(stored, result.vocab());
        assertEquals("Run", stored.content().term());
        assertEquals(List.of("chay", "van hanh"), stored.content().meanings());
        assertEquals("We run every day.", stored.content().exampleEn());
        assertEquals("/rʌn/", stored.content().ipa());
        assertEquals(0, stored.schedule().readdCount());

        assertEquals(1, result.suggestions().get("examples").size());
        assertEquals("run like the wind", result.suggestions().get("mnemonics").get(0).asText());
        assertTrue(eventDao.loadAllEvents().isEmpty());
        assertEquals(1, aiCacheDao.size());
    }

    @Test
    public void testUpsertWithAi_overwriteReplacesFieldsTheEntrySets() {
        Vocab run = existingRun();

        VocabUpsertResult result = vocabUpsertService.upsertWithAi(
                request("RUN", List.of("van hanh"), "She runs.", "b1", Boolean.TRUE, Boolean.FALSE, null));

        assertEquals(VocabUpsertResult.ACTION_UPDATED, result.action());
        assertTrue(result.overwritten());
        assertEquals(new VocabUpsertResult.AiInfo(false, null, false, false), result.ai());

        VocabContent content = vocabDao.loadVocab(run.id()).orElseThrow().content();
        assertEquals("RUN", content.term());
        assertEquals(List.of("van hanh"), content.meanings());
        assertEquals("She runs.", content.exampleEn());
        assertEquals("B1", content.cefrLevel());
        assertEquals(List.of("verb"), content.tags());
        assertEquals("run run", content.mnemonic());
        assertEquals("/rʌn/", content.ipa());

        Vocab stored = vocabDao.loadVocab(run.id()).orElseThrow();
        assertEquals(run.schedule(), stored.schedule());
        assertEquals(TEST_NOW, stored.updatedAt());
        assertEquals(1, stored.version());
        assertEquals("She runs.", result.suggestions().get("examples").get(0).get("en").asText());
        assertTrue(result.suggestions().get("meaningVariants").isEmpty());
        assertTrue(eventDao.loadAllEvents().isEmpty());
        verify(aiProvider, never()).enrich(anyString(), anyList(), any());
    }

    @Test
    public void testUpsertWithAi_mergeOnlyFillsEmptyFields() {
        Vocab run = existingRun();
        VocabUpsertRequest mergeRequest = new VocabUpsertRequest("run", List.of("van hanh", "chay"), " /rʌn/ ", "She runs.",
                "Co ay chay.", null, List.of("motion"), null, null, Map.of("Noun", List.of("runner")), null, "C1", 6.5,
                null, Boolean.FALSE, Boolean.FALSE, null);

        VocabUpsertResult result = vocabUpsertService.upsertWithAi(mergeRequest);

        assertFalse(result.overwritten());
        VocabContent content = vocabDao.loadVocab(run.id()).orElseThrow().content();
        assertEquals(List.of("chay", "van hanh"), content.meanings());
        assertEquals("I run.", content.exampleEn());
        assertEquals("Co ay chay.", content.exampleVi());
        assertEquals(List.of("verb", "motion"), content.tags());
        assertEquals(List.of("runner"), content.wordFamily().get("noun"));
        assertEquals("A1", content.cefrLevel());
        assertEquals(6.5, content.ieltsBand());
    }

    @Test
    public void testUpsertWithAi_unchangedCardNotWritten() {
        Vocab walk = TestVocabs.newVocab("walk", List.of("di bo"), TEST_CREATED);
        vocabDao.put(walk);

        VocabUpsertResult result = vocabUpsertService.upsertWithAi(
                request("walk", List.of("di bo"), null, null, Boolean.TRUE, Boolean.FALSE, null));

        assertEquals(VocabUpsertResult.ACTION_UPDATED, result.action());
        assertFalse(result.overwritten());
        assertEquals(walk, result.vocab());
        assertEquals(0, vocabDao.loadVocab(walk.id()).orElseThrow().version());
    }

    @Test
    public void testUpsertWithAi_forceAiCallsProviderForCompleteCard() {
        Vocab run = new Vocab("run-id", "run",
                new VocabContent("run", List.of("chay", "van hanh"), "/rʌn/", "I run.", null, "run run",
                        null, null, null, null, null, null, null),
                new ScheduleState(2.5, 0, 0, 0, TEST_CREATED, null, 0, null), TEST_CREATED, TEST_CREATED, 0);
        vocabDao.put(run);
        when(aiProvider.enrich(anyString(), anyList(), any())).thenReturn(generatedContent());

        VocabUpsertResult result = vocabUpsertService.upsertWithAi(request("run", List.of(), null, null, null, null, Boolean.TRUE));

        verify(aiProvider).enrich("run", List.of("chay", "van hanh"), new EnrichMissing(true, true, true, true));
        assertTrue(result.ai().aiCalled());
        assertFalse(result.ai().fromCache());
        assertEquals("I run.", result.vocab().content().exampleEn());
        assertEquals(2, result.suggestions().get("examples").size());
    }

    @Test
    public void testUpsertWithAi_cachedContentReused() {
        Vocab run = new Vocab("run-id", "run",
                new VocabContent("run", List.of("chay", "van hanh"), "/rʌn/", "I run.", null, "run run",
                        null, null, null, null, null, null, null),
                new ScheduleState(2.5, 0, 0, 0, TEST_CREATED, null, 0, null), TEST_CREATED, TEST_CREATED, 0);
        vocabDao.put(run);

        vocabUpsertService.upsertWithAi(request("run", List.of(), null, null, null, null, null));
        VocabUpsertResult second = vocabUpsertService.upsertWithAi(request("run", List.of(), null, null, null, null, null));

        verify(aiProvider, never()).enrich(anyString(), anyList(), any());
        assertEquals(new VocabUpsertResult.AiInfo(true, StubAiProvider.PROVIDER_NAME, false, true), second.ai());
    }

    @Test
    public void testUpsertWithAi_emptyTerm() {
        assertThrows(ValidationException.class,
                () -> vocabUpsertService.upsertWithAi(request(" ?? ", List.of("x"), null, null, null, null, null)));
        assertEquals(0, vocabDao.size());
    }

    private Vocab existingRun() {
        Vocab run = new Vocab("run-id", "run",
                new VocabContent("run", List.of("chay"), "/rʌn/", "I run.", null, "run run", List.of("verb"),
                        null, null, null, null, "A1", null),
                new ScheduleState(2.3, 6, 2, 1, Instant.parse("2024-03-12T00:00:00Z"), TEST_CREATED, 0, null),
                TEST_CREATED, TEST_CREATED, 0);
        vocabDao.put(run);
        return run;
    }

    private static VocabUpsertRequest request(String term, List<String> meanings, String exampleEn, String cefrLevel,
                                              Boolean overwriteExisting, Boolean useAi, Boolean forceAi) {
        return new VocabUpsertRequest(term, meanings, null, exampleEn, null, null, null, null, null, null, null, cefrLevel,
                null, null, overwriteExisting, useAi, forceAi);
    }

    private static VocabUpsertRequest request(String term, List<String> meanings, String exampleEn, String cefrLevel,
                                              Boolean useAi) {
        return request(term, meanings, exampleEn, cefrLevel, null, useAi, null);
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
