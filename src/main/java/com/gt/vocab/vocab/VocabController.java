package com.gt.vocab.vocab;

import com.gt.vocab.model.Vocab;
import com.gt.vocab.model.VocabFilterOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/rest/vocab")
public class VocabController {

    private final VocabService vocabService;
    private final VocabUpsertService vocabUpsertService;

    @Autowired
    public VocabController(VocabService vocabService, VocabUpsertService vocabUpsertService) {
        this.vocabService = vocabService;
        this.vocabUpsertService = vocabUpsertService;
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    public Vocab createVocab(@RequestBody VocabCreateRequest request) {
        return vocabService.createVocab(request);
    }

    @PostMapping(value = "/upsertWithAi", consumes = "application/json", produces = "application/json")
    public VocabUpsertResult upsertWithAi(@RequestBody VocabUpsertRequest request) {
        return vocabUpsertService.upsertWithAi(request);
    }

    @GetMapping(produces = "application/json")
    public List<Vocab> searchVocab(@RequestParam(value = "search", required = false) String search,
                                   @RequestParam(value = "tag", required = false) String tag,
                                   @RequestParam(value = "topic", required = false) String topic,
                                   @RequestParam(value = "cefrLevel", required = false) String cefrLevel,
                                   @RequestParam(value = "page", defaultValue = "1") int page,
                                   @RequestParam(value = "limit", defaultValue = "" + VocabService.DEFAULT_PAGE_LIMIT) int limit) {
        return vocabService.searchVocab(new VocabFilterOptions(search, tag, topic, cefrLevel), page, limit);
    }

    @GetMapping(value = "/{vocabId}", produces = "application/json")
    public Vocab getVocab(@PathVariable("vocabId") String vocabId) {
        return vocabService.getVocab(vocabId);
    }

    @PutMapping(value = "/{vocabId}", consumes = "application/json", produces = "application/json")
    public Vocab updateVocab(@PathVariable("vocabId") String vocabId, @RequestBody VocabUpdateRequest request) {
        return vocabService.updateVocab(vocabId, request);
    }

    @DeleteMapping(value = "/{vocabId}", produces = "application/json")
    public Map<String, Boolean> deleteVocab(@PathVariable("vocabId") String vocabId) {
        vocabService.deleteVocab(vocabId);
        return Map.of("deleted", true);
    }
}
