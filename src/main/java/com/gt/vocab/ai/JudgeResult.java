package com.gt.vocab.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JudgeResult(
        @JsonProperty("isEquivalent") boolean isEquivalent,
        String reasonShort,
        String provider,
        boolean cached) { }
