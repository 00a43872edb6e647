package com.gt.vocab.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.vocab.serialization.QuestionTypeSerializer;

import java.util.Optional;

@JsonSerialize(using = QuestionTypeSerializer.class)
public enum QuestionType {
    TermToMeaning("term_to_meaning"),
    MeaningToTerm("meaning_to_term");

    private final String wireName;

    QuestionType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<QuestionType> fromWireName(String wireName) {
        for (QuestionType questionType : values()) {
            if (questionType.wireName.equals(wireName)) {
                return Optional.of(questionType);
            }
        }
        return Optional.empty();
    }
}
