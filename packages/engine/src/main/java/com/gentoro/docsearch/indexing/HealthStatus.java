package com.gentoro.docsearch.indexing;

import java.util.List;

/** Result of {@link IndexingPipeline#health()}. */
public record HealthStatus(
    boolean storeReachable,
    boolean modelLoaded,
    boolean sampleSearchSucceeds,
    long rowCount,
    List<String> errors) {

  public HealthStatus {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public boolean healthy() {
    return storeReachable && modelLoaded && sampleSearchSucceeds;
  }
}
