package com.gt.vocab.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ReviewLog(
        String id,
        String vocabId,
        ReviewMode mode,
        QuestionType questionType,
        int grade,
        String userAnswer,
        @JsonProperty("isNearCorrect") Boolean isNearCorrect,
        Instant createdAt) { }
