package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.vocab.model.Vocab;

public record EnrichResult(
        String termNormalized,
        String provider,
        boolean aiCalled,
        boolean fromCache,
        ObjectNode data,
        Vocab vocab) { }
