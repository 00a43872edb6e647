package com.gt.vocab.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.Instant;

public record Vocab(
        String id,
        String termNormalized,
        @JsonUnwrapped VocabContent content,
        @JsonUnwrapped ScheduleState schedule,
        Instant createdAt,
        Instant updatedAt,
        @JsonIgnore long version) {

    public Vocab withContent(String newTermNormalized, VocabContent newContent, Instant newUpdatedAt) {
        return new Vocab(id, newTermNormalized, newContent, schedule, createdAt, newUpdatedAt, version);
    }

    public Vocab withSchedule(ScheduleState newSchedule, Instant newUpdatedAt) {
        return new Vocab(id, termNormalized, content, newSchedule, createdAt, newUpdatedAt, version);
    }

    public Vocab withVersion(long newVersion) {
        return new Vocab(id, termNormalized, content, schedule, createdAt, updatedAt, newVersion);
    }
}
