package com.gentoro.docsearch.indexing;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for indexing runs. The pipeline checks the token between documents, so
 * a cancelled run stops after the document in progress has been written.
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
