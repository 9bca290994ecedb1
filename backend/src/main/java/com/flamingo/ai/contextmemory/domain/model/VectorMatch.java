package com.flamingo.ai.contextmemory.domain.model;

/** A candidate returned by a vector index: the record key and its cosine similarity. */
public record VectorMatch(String key, double similarity) {}
