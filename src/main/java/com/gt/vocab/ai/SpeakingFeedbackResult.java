package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record SpeakingFeedbackResult(String provider, ObjectNode feedback) { }
