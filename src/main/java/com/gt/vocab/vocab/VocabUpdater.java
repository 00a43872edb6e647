package com.gt.vocab.vocab;

import com.gt.vocab.exception.DaoException;
import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.sync.MergeLockDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.UnaryOperator;

/**
 * Read-modify-write of a single card. The change is applied to the freshly loaded card and written with a
 * compare-and-swap on its version; a lost race re-reads and re-applies the change. Callers must already be inside
 * a transaction, which also scopes the shared merge lock taken here.
 */
@Component
public class VocabUpdater {

    private static final Logger log = LoggerFactory.getLogger(VocabUpdater.class);

    static final int DEFAULT_MAX_CAS_ATTEMPTS = 3;

    private final VocabDao vocabDao;
    private final MergeLockDao mergeLockDao;
    private final int maxCasAttempts;

    @Autowired
    public VocabUpdater(VocabDao vocabDao,
                        MergeLockDao mergeLockDao,
                        @Value("${vocab.review.maxCasAttempts:" + DEFAULT_MAX_CAS_ATTEMPTS + "}") int maxCasAttempts) {
        this.vocabDao = vocabDao;
        this.mergeLockDao = mergeLockDao;
        this.maxCasAttempts = Math.max(1, maxCasAttempts);
    }

    public Vocab update(String vocabId, UnaryOperator<Vocab> change) {
        mergeLockDao.acquireSharedLock();

        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            Vocab current = vocabDao.loadVocab(vocabId)
                    .orElseThrow(() -> new NotFoundException("Vocab not found: " + vocabId));

            Vocab changed = change.apply(current);
            if (changed.equals(current)) {
                return current;
            }

            if (vocabDao.updateVocab(changed, current.version())) {
                return changed.withVersion(current.version() + 1);
            }

            log.info("Vocab {} changed concurrently, retrying update ({}/{})", vocabId, attempt, maxCasAttempts);
        }

        throw new DaoException("Failed to update vocab " + vocabId + " after " + maxCasAttempts + " attempts");
    }
}
