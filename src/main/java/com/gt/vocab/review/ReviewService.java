package com.gt.vocab.review;

import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.fuzzy.TypingJudge;
import com.gt.vocab.model.QuestionType;
import com.gt.vocab.model.ReviewLog;
import com.gt.vocab.model.ReviewMode;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.vocab.VocabUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Component
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final VocabUpdater vocabUpdater;
    private final ReviewLogDao reviewLogDao;
    private final Sm2Scheduler sm2Scheduler;
    private final TypingJudge typingJudge;
    private final Clock clock;

    @Autowired
    public ReviewService(VocabUpdater vocabUpdater,
                         ReviewLogDao reviewLogDao,
                         Sm2Scheduler sm2Scheduler,
                         TypingJudge typingJudge,
                         Clock clock) {
        this.vocabUpdater = vocabUpdater;
        this.reviewLogDao = reviewLogDao;
        this.sm2Scheduler = sm2Scheduler;
        this.typingJudge = typingJudge;
        this.clock = clock;
    }

    // Request checks all happen before the card is read so a bad request never touches the store
    @Transactional
    public ReviewResult submitReview(ReviewRequest request) {
        if (request.grade() == null) {
            throw new ValidationException("grade", "Grade is required");
        }
        sm2Scheduler.validateGrade(request.grade());

        ReviewMode mode = ReviewMode.fromWireName(request.mode())
                .orElseThrow(() -> new ValidationException("mode", "Unknown review mode: " + request.mode()));
        QuestionType questionType = request.questionType() == null
                ? QuestionType.TermToMeaning
                : QuestionType.fromWireName(request.questionType())
                        .orElseThrow(() -> new ValidationException("questionType", "Unknown question type: " + request.questionType()));
        if (request.cardId() == null || request.cardId().isBlank()) {
            throw new ValidationException("cardId", "Card id is required");
        }

        Instant now = clock.instant();
        int grade = request.grade();
        Boolean[] nearCorrect = new Boolean[1];

        Vocab updated = vocabUpdater.update(request.cardId(), current -> {
            nearCorrect[0] = judgeTypedAnswer(current, mode, questionType, request.userAnswer());
            return current.withSchedule(sm2Scheduler.applyReview(current.schedule(), grade, now), now);
        });

        reviewLogDao.createReviewLog(new ReviewLog(
                UUID.randomUUID().toString(),
                updated.id(),
                mode,
                questionType,
                grade,
                request.userAnswer(),
                nearCorrect[0],
                now));

        log.debug("Reviewed {} with grade {}, next due {}", updated.id(), grade, updated.schedule().dueAt());
        return new ReviewResult(
                updated,
                updated.schedule().dueAt(),
                updated.schedule().intervalDays(),
                updated.schedule().easeFactor(),
                updated.schedule().repetitions(),
                updated.schedule().lapses());
    }

    private Boolean judgeTypedAnswer(Vocab vocab, ReviewMode mode, QuestionType questionType, String userAnswer) {
        if (mode != ReviewMode.Typing || userAnswer == null) {
            return null;
        }

        List<String> candidates = questionType == QuestionType.MeaningToTerm
                ? List.of(vocab.content().term())
                : vocab.content().meanings();
        return typingJudge.isNearCorrect(userAnswer, candidates);
    }
}
