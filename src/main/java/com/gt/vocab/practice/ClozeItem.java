package com.gt.vocab.practice;

import java.util.List;

// hint is null when the question already carries the meaning
public record ClozeItem(
        String vocabId,
        String term,
        String ipa,
        String question,
        String hint,
        List<String> acceptableAnswers) { }
