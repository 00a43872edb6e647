package com.gt.vocab.review;

import com.gt.vocab.model.Vocab;

import java.time.Instant;

public record ReviewResult(
        Vocab card,
        Instant nextDueAt,
        int intervalDays,
        double easeFactor,
        int repetitions,
        int lapses) { }
