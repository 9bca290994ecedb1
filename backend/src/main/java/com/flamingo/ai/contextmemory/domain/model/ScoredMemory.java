package com.flamingo.ai.contextmemory.domain.model;

/** A stored record together with its similarity to the query vector. */
public record ScoredMemory<T>(T record, double similarity) {}
