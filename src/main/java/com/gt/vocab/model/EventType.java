package com.gt.vocab.model;

public enum EventType {
    RE_ADD,
    EXPORT,
    IMPORT
}
