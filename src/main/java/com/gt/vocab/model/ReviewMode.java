package com.gt.vocab.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.vocab.serialization.ReviewModeSerializer;

import java.util.Optional;

@JsonSerialize(using = ReviewModeSerializer.class)
public enum ReviewMode {
    Flip("flip"),
    MultipleChoice("mcq"),
    Typing("typing");

    private final String wireName;

    ReviewMode(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ReviewMode> fromWireName(String wireName) {
        for (ReviewMode reviewMode : values()) {
            if (reviewMode.wireName.equals(wireName)) {
                return Optional.of(reviewMode);
            }
        }
        return Optional.empty();
    }
}
