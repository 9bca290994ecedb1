package com.flamingo.ai.contextmemory.domain.model;

import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import java.util.List;

/** A document with the conversations that referenced it, in first-reference order. */
public record DocumentView(DocumentMemory document, List<String> conversationIds) {}
