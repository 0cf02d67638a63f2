package com.gentoro.docsearch.embedding;

import com.gentoro.docsearch.utility.HashUtility;
import java.time.Instant;

/**
 * Embedding of one chunk together with the model that produced it.
 *
 * @param processingTimeMs share of the batch encode time attributed to this vector
 */
public record EmbeddingVector(
    String chunkId,
    float[] vector,
    int vectorDim,
    String modelName,
    String modelVersion,
    Instant createdAt,
    double processingTimeMs) {

  /** MD5 over the comma-joined components. */
  public String vectorHash() {
    return HashUtility.md5(vector);
  }
}
