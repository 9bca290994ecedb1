package com.flamingo.ai.contextmemory.agent.dto;

import java.util.List;

/** Structured output of {@link com.flamingo.ai.contextmemory.agent.TurnSummaryAgent}. */
public record TurnSummaryResult(String summary, List<String> keyPoints, List<String> decisions) {}
