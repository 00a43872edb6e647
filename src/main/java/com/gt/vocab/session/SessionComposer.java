package com.gt.vocab.session;

import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.review.ReviewLogDao;
import com.gt.vocab.util.DayBounds;
import com.gt.vocab.vocab.VocabDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;

/**
 * Builds the daily study session. Cards created today are always shown as new; everything else competes for the
 * review list in bucket order:
 * <ol>
 *   <li>due now, earliest first</li>
 *   <li>reviewed yesterday but not mastered, earliest review first</li>
 *   <li>re-added cards, most re-adds first</li>
 * </ol>
 * A card keeps the position of the first bucket it appears in.
 */
@Component
public class SessionComposer {

    private static final Logger log = LoggerFactory.getLogger(SessionComposer.class);

    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 200;

    // Grades below this on a review yesterday mark the card as not mastered
    private static final int MASTERED_GRADE = 3;

    private final VocabDao vocabDao;
    private final ReviewLogDao reviewLogDao;
    private final Clock clock;
    private final ZoneId localZone;

    @Autowired
    public SessionComposer(VocabDao vocabDao, ReviewLogDao reviewLogDao, Clock clock, ZoneId localZone) {
        this.vocabDao = vocabDao;
        this.reviewLogDao = reviewLogDao;
        this.clock = clock;
        this.localZone = localZone;
    }

    public Session composeSession(int limit) {
        return composeSession(limit, clock.instant());
    }

    public Session composeSession(int limit, Instant now) {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "Limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT);
        }

        DayBounds today = DayBounds.containing(now, localZone);
        DayBounds yesterday = today.previousDay(localZone);

        List<Vocab> todayNew = vocabDao.loadVocabCreatedBetween(today.start(), today.end());
        Set<String> todayIds = new HashSet<>();
        todayNew.forEach(vocab -> todayIds.add(vocab.id()));

        List<Vocab> due = vocabDao.loadDueVocab(now, todayIds, limit);
        List<Vocab> notMastered = loadYesterdayNotMastered(yesterday, todayIds, limit);
        List<Vocab> struggle = vocabDao.loadReaddedVocab(todayIds, limit);

        Map<String, Vocab> review = new LinkedHashMap<>();
        for (List<Vocab> bucket : List.of(due, notMastered, struggle)) {
            for (Vocab vocab : bucket) {
                if (review.size() >= limit) {
                    break;
                }
                review.putIfAbsent(vocab.id(), vocab);
            }
        }

        log.debug("Composed session: {} new, {} due, {} not mastered, {} struggling, {} to review",
                todayNew.size(), due.size(), notMastered.size(), struggle.size(), review.size());
        return new Session(todayNew, new ArrayList<>(review.values()));
    }

    private List<Vocab> loadYesterdayNotMastered(DayBounds yesterday, Set<String> excludeIds, int limit) {
        Set<String> lowGradeIds = reviewLogDao.findVocabIdsGradedBelow(MASTERED_GRADE, yesterday.start(), yesterday.end());

        return vocabDao.loadVocabReviewedBetween(yesterday.start(), yesterday.end(), excludeIds).stream()
                .filter(vocab -> lowGradeIds.contains(vocab.id())
                        || vocab.schedule().readdCount() > 0
                        || (vocab.schedule().lapses() > 0 && yesterday.contains(vocab.updatedAt())))
                .limit(limit)
                .toList();
    }
}
