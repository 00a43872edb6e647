package com.gt.vocab.review;

import com.fasterxml.jackson.annotation.JsonAlias;

public record ReviewRequest(
        @JsonAlias("vocabId") String cardId,
        String mode,
        String questionType,
        Integer grade,
        String userAnswer) { }
