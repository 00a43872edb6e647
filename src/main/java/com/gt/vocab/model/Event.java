package com.gt.vocab.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

// Type is kept as text so imported events with unrecognised types survive a round trip
public record Event(String id, String type, JsonNode payload, Instant createdAt) { }
