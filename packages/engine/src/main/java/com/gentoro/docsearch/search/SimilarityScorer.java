package com.gentoro.docsearch.search;

import com.gentoro.docsearch.exception.ConfigException;

/**
 * Maps squared Euclidean distances between unit vectors to scores in {@code [0, 1]} with {@code
 * max(0, 1 - d / maxDistance)}. Smaller distances never score lower than larger ones.
 */
public final class SimilarityScorer {
  private final double maxDistance;

  public SimilarityScorer(double maxDistance) {
    if (!(maxDistance > 0)) {
      throw new ConfigException("Maximum distance must be > 0, got " + maxDistance);
    }
    this.maxDistance = maxDistance;
  }

  public double score(double distance) {
    if (Double.isNaN(distance)) {
      return 0.0;
    }
    double score = 1.0 - Math.max(0.0, distance) / maxDistance;
    return Math.min(1.0, Math.max(0.0, score));
  }

  public double maxDistance() {
    return maxDistance;
  }
}
