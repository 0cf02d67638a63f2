package com.gentoro.docsearch.embedding;

/**
 * A batch embedding result attributed to the position of its input text. Inputs that were empty
 * have no corresponding {@code IndexedVector}.
 */
public record IndexedVector(int index, float[] vector) {}
