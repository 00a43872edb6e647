package com.gt.vocab.practice;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/practice")
public class PracticeController {

    private final ClozeService clozeService;

    @Autowired
    public PracticeController(ClozeService clozeService) {
        this.clozeService = clozeService;
    }

    @PostMapping(value = "/cloze/generate", consumes = "application/json", produces = "application/json")
    public ClozeSet generateCloze(@RequestBody ClozeGenerateRequest request) {
        int limit = request.limit() == null ? ClozeService.DEFAULT_LIMIT : request.limit();
        return new ClozeSet(clozeService.generateCloze(request.vocabIds(), request.topic(), limit));
    }

    @PostMapping(value = "/cloze/submit", consumes = "application/json", produces = "application/json")
    public ClozeSubmitResult submitCloze(@RequestBody ClozeSubmitRequest request) {
        return clozeService.submitCloze(request.vocabId(), request.userAnswer());
    }

    public record ClozeSet(List<ClozeItem> items) { }

    private record ClozeGenerateRequest(List<String> vocabIds, String topic, Integer limit) { }

    private record ClozeSubmitRequest(String vocabId, String userAnswer) { }
}
