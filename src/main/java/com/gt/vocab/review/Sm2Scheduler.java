package com.gt.vocab.review;

import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.model.ScheduleState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * SM-2 variant used to schedule every card. All methods are pure: the caller supplies the current time and is
 * responsible for persisting the returned state.
 */
@Component
public class Sm2Scheduler {

    static final double MIN_EASE_FACTOR = 1.3;
    static final double MAX_EASE_FACTOR = 3.0;
    static final double INITIAL_EASE_FACTOR = 2.5;
    static final double LAPSE_EASE_PENALTY = 0.2;

    public static final int MIN_GRADE = 0;
    public static final int MAX_GRADE = 5;
    static final int PASSING_GRADE = 3;

    private static final int FIRST_INTERVAL_DAYS = 1;
    private static final int SECOND_INTERVAL_DAYS = 6;

    public ScheduleState initialState(Instant now) {
        return new ScheduleState(INITIAL_EASE_FACTOR, 0, 0, 0, now, null, 0, null);
    }

    public ScheduleState applyReview(ScheduleState state, int grade, Instant now) {
        validateGrade(grade);

        double easeFactor = state.easeFactor();
        int intervalDays = state.intervalDays();
        int repetitions = state.repetitions();
        int lapses = state.lapses();
        Instant dueAt;

        if (grade < PASSING_GRADE) {
            repetitions = 0;
            intervalDays = 0;
            lapses++;
            easeFactor = clampEase(easeFactor - LAPSE_EASE_PENALTY);
            dueAt = now;
        } else {
            if (repetitions == 0) {
                intervalDays = FIRST_INTERVAL_DAYS;
            } else if (repetitions == 1) {
                intervalDays = SECOND_INTERVAL_DAYS;
            } else {
                // rint rounds half to even
                intervalDays = Math.max(1, (int) Math.rint(intervalDays * easeFactor));
            }

            repetitions++;
            int gradeGap = MAX_GRADE - grade;
            easeFactor = clampEase(easeFactor + (0.1 - gradeGap * (0.08 + gradeGap * 0.02)));
            dueAt = now.plus(Duration.ofDays(intervalDays));
        }

        return new ScheduleState(roundEase(easeFactor), intervalDays, repetitions, lapses, dueAt, now,
                state.readdCount(), state.lastReaddAt());
    }

    // Re-entering a known term costs ease and restarts the repetition streak, without counting as a lapse
    public ScheduleState applyReaddPenalty(ScheduleState state, Instant now) {
        return new ScheduleState(
                roundEase(clampEase(state.easeFactor() - LAPSE_EASE_PENALTY)),
                0,
                0,
                state.lapses(),
                now,
                state.lastReviewedAt(),
                state.readdCount(),
                state.lastReaddAt());
    }

    public void validateGrade(int grade) {
        if (grade < MIN_GRADE || grade > MAX_GRADE) {
            throw new ValidationException("grade", "Grade must be in range " + MIN_GRADE + ".." + MAX_GRADE + ", was " + grade);
        }
    }

    public static double clampEase(double easeFactor) {
        return Math.min(MAX_EASE_FACTOR, Math.max(MIN_EASE_FACTOR, easeFactor));
    }

    public static double roundEase(double easeFactor) {
        return new BigDecimal(easeFactor).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
