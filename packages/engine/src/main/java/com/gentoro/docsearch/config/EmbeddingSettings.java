package com.gentoro.docsearch.config;

import com.gentoro.docsearch.exception.ConfigException;

/**
 * Embedding model selection and batching.
 *
 * @param model model name, resolved by the embedding model factory
 * @param device inference device label reported by model introspection
 * @param batchSize number of texts encoded per model call
 * @param maxSequenceLength maximum characters passed to the model per text
 * @param maxWorkers size of the bounded pool that encodes batches
 */
public record EmbeddingSettings(
    String model, String device, int batchSize, int maxSequenceLength, int maxWorkers) {

  public static final String DEFAULT_MODEL = "all-minilm-l6-v2";

  public EmbeddingSettings {
    if (model == null || model.isBlank()) {
      throw new ConfigException("embedding.model must not be blank");
    }
    if (device == null || device.isBlank()) {
      device = "cpu";
    }
    if (batchSize < 1) {
      throw new ConfigException("embedding.batchSize must be >= 1, got " + batchSize);
    }
    if (maxSequenceLength < 1) {
      throw new ConfigException(
          "embedding.maxSequenceLength must be >= 1, got " + maxSequenceLength);
    }
    if (maxWorkers < 1) {
      throw new ConfigException("embedding.maxWorkers must be >= 1, got " + maxWorkers);
    }
  }

  public static EmbeddingSettings defaults() {
    return new EmbeddingSettings(DEFAULT_MODEL, "cpu", 16, 512, 2);
  }
}
