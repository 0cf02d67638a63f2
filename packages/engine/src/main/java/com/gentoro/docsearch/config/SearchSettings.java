package com.gentoro.docsearch.config;

import com.gentoro.docsearch.exception.ConfigException;

/**
 * Search tuning.
 *
 * @param maxDistance squared-distance normalization cap used to turn distances into scores; 4.0
 *     is the diameter bound for unit-normalized vectors
 * @param similarityThreshold default minimum semantic score
 * @param defaultLimit default number of results
 * @param excerptLength characters of chunk content copied into result excerpts
 */
public record SearchSettings(
    double maxDistance, double similarityThreshold, int defaultLimit, int excerptLength) {

  public SearchSettings {
    if (!(maxDistance > 0)) {
      throw new ConfigException("search.maxDistance must be > 0, got " + maxDistance);
    }
    if (similarityThreshold < 0 || similarityThreshold > 1) {
      throw new ConfigException(
          "search.similarityThreshold must be in [0, 1], got " + similarityThreshold);
    }
    if (defaultLimit < 1) {
      throw new ConfigException("search.defaultLimit must be >= 1, got " + defaultLimit);
    }
    if (excerptLength < 1) {
      throw new ConfigException("search.excerptLength must be >= 1, got " + excerptLength);
    }
  }

  public static SearchSettings defaults() {
    return new SearchSettings(4.0, 0.5, 10, 200);
  }
}
