package com.gentoro.docsearch.embedding;

/** Introspection data for the active embedding model. */
public record ModelInfo(
    String name, String device, int maxSequenceLength, int dimension, String version) {}
