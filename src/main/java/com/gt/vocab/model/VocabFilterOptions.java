package com.gt.vocab.model;

public record VocabFilterOptions(
        String search,
        String tag,
        String topic,
        String cefrLevel) { }
