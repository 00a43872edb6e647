package com.gt.vocab.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/ai")
public class AiController {

    private static final Logger log = LoggerFactory.getLogger(AiController.class);

    private final AiContentService aiContentService;

    @Autowired
    public AiController(AiContentService aiContentService) {
        this.aiContentService = aiContentService;
    }

    @PostMapping(value = "/enrich", consumes = "application/json", produces = "application/json")
    public EnrichResult enrich(@RequestBody EnrichRequest request) {
        return aiContentService.enrich(request.term(), listOrEmpty(request.meaningsExisting()));
    }

    @PostMapping(value = "/judgeEquivalence", consumes = "application/json", produces = "application/json")
    public JudgeResult judgeEquivalence(@RequestBody JudgeEquivalenceRequest request) {
        return aiContentService.judgeEquivalence(request.term(), request.userAnswer(), listOrEmpty(request.meanings()));
    }

    @PostMapping(value = "/speakingFeedback", consumes = "application/json", produces = "application/json")
    public SpeakingFeedbackResult speakingFeedback(@RequestBody SpeakingFeedbackRequest request) {
        log.debug("Speaking feedback requested for {} target words", listOrEmpty(request.targetWords()).size());
        return aiContentService.speakingFeedback(request.prompt(), request.responseText(), listOrEmpty(request.targetWords()));
    }

    private static List<String> listOrEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }

    private record EnrichRequest(String term, List<String> meaningsExisting) { }

    private record JudgeEquivalenceRequest(String term, String userAnswer, List<String> meanings) { }

    private record SpeakingFeedbackRequest(String prompt, String responseText, List<String> targetWords) { }
}
