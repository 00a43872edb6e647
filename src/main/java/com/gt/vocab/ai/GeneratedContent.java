package com.gt.vocab.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record GeneratedContent(String provider, ObjectNode data) { }
