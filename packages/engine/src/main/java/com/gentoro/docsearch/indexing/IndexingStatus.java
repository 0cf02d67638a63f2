package com.gentoro.docsearch.indexing;

import java.util.Locale;

/** Lifecycle of an indexing operation; leaves {@link #RUNNING} exactly once. */
public enum IndexingStatus {
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
