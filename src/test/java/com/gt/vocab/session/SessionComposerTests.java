package com.gt.vocab.session;

import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.model.*;
import com.gt.vocab.support.InMemoryReviewLogDao;
import com.gt.vocab.support.InMemoryVocabDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class SessionComposerTests {

    private static final ZoneId TEST_ZONE = ZoneId.of("Asia/Ho_Chi_Minh");
    // 12:00 local on 2024-03-10; yesterday is [03-08T17:00Z, 03-09T17:00Z)
    private static final Instant TEST_NOW = Instant.parse("2024-03-10T05:00:00Z");
    private static final Instant TEST_OLD = Instant.parse("2024-03-01T00:00:00Z");

    private InMemoryVocabDao vocabDao;
    private InMemoryReviewLogDao reviewLogDao;
    private SessionComposer sessionComposer;

    private Vocab newToday;
    private Vocab dueOld;
    private Vocab dueOlder;
    private Vocab yesterdayFailed;
    private Vocab yesterdayPassed;
    private Vocab yesterdayLapsed;
    private Vocab yesterdayReadded;
    private Vocab lapsedEditedToday;
    private Vocab struggler;
    private Vocab dueStruggler;

    @BeforeEach
    public void setup() {
        vocabDao = new InMemoryVocabDao();
        reviewLogDao = new InMemoryReviewLogDao();
        sessionComposer = new SessionComposer(vocabDao, reviewLogDao, Clock.fixed(TEST_NOW, TEST_ZONE), TEST_ZONE);

        newToday = vocab("fresh", Instant.parse("2024-03-10T01:00:00Z"), Instant.parse("2024-03-10T01:00:00Z"), null, 0, 2);
        dueOld = vocab("due", TEST_OLD, Instant.parse("2024-03-05T00:00:00Z"), null, 0, 0);
        dueOlder = vocab("older", TEST_OLD, Instant.parse("2024-03-03T00:00:00Z"), null, 0, 0);
        yesterdayFailed = vocab("failed", TEST_OLD, Instant.parse("2024-03-12T00:00:00Z"), Instant.parse("2024-03-09T02:00:00Z"), 0, 0);
        yesterdayPassed = vocab("passed", TEST_OLD, Instant.parse("2024-03-15T00:00:00Z"), Instant.parse("2024-03-09T03:00:00Z"), 0, 0);
        yesterdayLapsed = vocab("lapsed", TEST_OLD, Instant.parse("2024-03-11T00:00:00Z"), Instant.parse("2024-03-09T04:00:00Z"), 1, 0);
        struggler = vocab("struggle", TEST_OLD, Instant.parse("2024-03-15T00:00:00Z"), null, 0, 3);
        dueStruggler = vocab("readded", TEST_OLD, Instant.parse("2024-03-04T00:00:00Z"), null, 0, 1);
        // re-added before, passed yesterday; the re-add alone keeps it unmastered
        yesterdayReadded = vocab("readded yesterday", TEST_OLD, Instant.parse("2024-03-14T00:00:00Z"), Instant.parse("2024-03-09T05:00:00Z"), 0, 1);
        // lapsed at some point, reviewed yesterday, but last touched today so the lapse is not yesterday's
        lapsedEditedToday = vocab("edited", TEST_OLD, Instant.parse("2024-03-20T00:00:00Z"), Instant.parse("2024-03-09T01:00:00Z"),
                Instant.parse("2024-03-10T01:00:00Z"), 2, 0);

        List.of(newToday, dueOld, dueOlder, yesterdayFailed, yesterdayPassed, yesterdayLapsed, yesterdayReadded, lapsedEditedToday,
                        struggler, dueStruggler)
                .forEach(vocabDao::put);

        reviewLogDao.createReviewLog(log(yesterdayFailed, 1, yesterdayFailed.schedule().lastReviewedAt()));
        reviewLogDao.createReviewLog(log(yesterdayPassed, 5, yesterdayPassed.schedule().lastReviewedAt()));
        reviewLogDao.createReviewLog(log(yesterdayLapsed, 4, yesterdayLapsed.schedule().lastReviewedAt()));
        reviewLogDao.createReviewLog(log(yesterdayReadded, 4, yesterdayReadded.schedule().lastReviewedAt()));
        reviewLogDao.createReviewLog(log(lapsedEditedToday, 5, lapsedEditedToday.schedule().lastReviewedAt()));
        // a failing grade from two days ago does not count
        reviewLogDao.createReviewLog(log(yesterdayPassed, 0, Instant.parse("2024-03-08T10:00:00Z")));
    }

    @Test
    public void testComposeSession() {
        Session session = sessionComposer.composeSession(30);

        assertEquals(List.of(newToday.id()), ids(session.todayNew()));
        assertEquals(List.of(dueOlder.id(), dueStruggler.id(), dueOld.id(), yesterdayFailed.id(), yesterdayLapsed.id(),
                        yesterdayReadded.id(), struggler.id()),
                ids(session.review()));
    }

    @Test
    public void testComposeSession_yesterdayBucketRules() {
        List<String> review = ids(sessionComposer.composeSession(30, TEST_NOW).review());

        // re-added cards join the yesterday bucket ahead of the struggle bucket
        assertEquals(review.indexOf(yesterdayLapsed.id()) + 1, review.indexOf(yesterdayReadded.id()));
        assertTrue(review.indexOf(yesterdayReadded.id()) < review.indexOf(struggler.id()));
        assertFalse(review.contains(lapsedEditedToday.id()));
        assertFalse(review.contains(yesterdayPassed.id()));
    }

    @Test
    public void testComposeSession_truncatedToLimit() {
        Session session = sessionComposer.composeSession(2, TEST_NOW);

        assertEquals(1, session.todayNew().size());
        assertEquals(List.of(dueOlder.id(), dueStruggler.id()), ids(session.review()));
    }

    @Test
    public void testComposeSession_todayNewUnbounded() {
        vocabDao.put(vocab("fresh2", Instant.parse("2024-03-10T02:00:00Z"), TEST_NOW, null, 0, 0));
        vocabDao.put(vocab("fresh3", Instant.parse("2024-03-10T03:00:00Z"), TEST_NOW, null, 0, 0));

        Session session = sessionComposer.composeSession(1, TEST_NOW);

        assertEquals(3, session.todayNew().size());
        assertEquals(1, session.review().size());
    }

    @Test
    public void testComposeSession_noRepeats() {
        Session session = sessionComposer.composeSession(200, TEST_NOW);

        assertEquals(session.review().size(), ids(session.review()).stream().distinct().count());
        assertTrue(ids(session.review()).stream().noneMatch(ids(session.todayNew())::contains));
    }

    @Test
    public void testComposeSession_invalidLimit() {
        assertThrows(ValidationException.class, () -> sessionComposer.composeSession(0, TEST_NOW));
        assertThrows(ValidationException.class, () -> sessionComposer.composeSession(201, TEST_NOW));
    }

    private static Vocab vocab(String term, Instant createdAt, Instant dueAt, Instant lastReviewedAt, int lapses, int readdCount) {
        return vocab(term, createdAt, dueAt, lastReviewedAt, lastReviewedAt == null ? createdAt : lastReviewedAt, lapses, readdCount);
    }

    private static Vocab vocab(String term, Instant createdAt, Instant dueAt, Instant lastReviewedAt, Instant updatedAt,
                               int lapses, int readdCount) {
        return new Vocab(
                UUID.randomUUID().toString(),
                term,
                VocabContent.ofTerm(term, List.of(term + " meaning")),
                new ScheduleState(2.5, 1, 1, lapses, dueAt, lastReviewedAt, readdCount, null),
                createdAt,
                updatedAt,
                0);
    }

    private static ReviewLog log(Vocab vocab, int grade, Instant createdAt) {
        return new ReviewLog(UUID.randomUUID().toString(), vocab.id(), ReviewMode.Flip, QuestionType.TermToMeaning,
                grade, null, null, createdAt);
    }

    private static List<String> ids(List<Vocab> vocabs) {
        return vocabs.stream().map(Vocab::id).toList();
    }
}
