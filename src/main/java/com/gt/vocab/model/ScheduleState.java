package com.gt.vocab.model;

import java.time.Instant;

// Scheduling fields of a card; ease is kept within [1.3, 3.0] and dueAt is never null
public record ScheduleState(
        double easeFactor,
        int intervalDays,
        int repetitions,
        int lapses,
        Instant dueAt,
        Instant lastReviewedAt,
        int readdCount,
        Instant lastReaddAt) {

    public ScheduleState withReadd(Instant readdAt) {
        return new ScheduleState(easeFactor, intervalDays, repetitions, lapses, dueAt, lastReviewedAt, readdCount + 1, readdAt);
    }
}
