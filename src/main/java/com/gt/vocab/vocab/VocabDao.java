package com.gt.vocab.vocab;

import com.gt.vocab.model.Vocab;
import com.gt.vocab.model.VocabFilterOptions;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface VocabDao {

    Optional<Vocab> loadVocab(String vocabId);
    Optional<Vocab> findByTermNormalized(String termNormalized);
    boolean vocabExists(String vocabId);

    // Returns false, without writing, when another card already holds the same normalized term
    boolean createVocab(Vocab vocab);

    // Compare-and-swap on the version column; returns false when the stored version no longer matches
    boolean updateVocab(Vocab vocab, long expectedVersion);

    List<Vocab> searchVocab(VocabFilterOptions filterOptions, int offset, int limit);
    int deleteVocab(String vocabId);

    List<Vocab> loadAllVocab();
    List<Vocab> loadVocabCreatedBetween(Instant start, Instant end);
    List<Vocab> loadDueVocab(Instant now, Collection<String> excludeIds, int limit);
    List<Vocab> loadVocabReviewedBetween(Instant start, Instant end, Collection<String> excludeIds);
    List<Vocab> loadReaddedVocab(Collection<String> excludeIds, int limit);

    // Most recently updated first
    List<Vocab> loadVocabByIds(Collection<String> vocabIds, int limit);
    List<Vocab> loadEarliestDueVocab(int limit);
}
