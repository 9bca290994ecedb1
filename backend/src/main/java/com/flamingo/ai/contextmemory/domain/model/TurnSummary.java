package com.flamingo.ai.contextmemory.domain.model;

import java.util.List;

/** Summary of a finished turn with its extracted key points and decisions. */
public record TurnSummary(String summary, List<String> keyPoints, List<String> decisions) {}
