package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record EntryValidation(
        boolean checked,
        boolean accepted,
        String provider,
        boolean fromCache,
        ObjectNode result) {

    public static final String SKIPPED_PROVIDER = "skipped";

    public static EntryValidation skipped() {
        return new EntryValidation(false, true, SKIPPED_PROVIDER, false, JsonNodeFactory.instance.objectNode());
    }
}
