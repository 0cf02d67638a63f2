package com.gentoro.docsearch.indexing;

import com.gentoro.docsearch.exception.StateException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Record of one indexing operation, mutated only by the call that created it.
 *
 * <p>Counters: {@code documentsProcessed} counts documents that ended in a consistent indexed
 * state, of which {@code documentsUpdated} were rewritten and {@code documentsUnchanged} were
 * skipped because their content hash matched the stored one. {@code documentsSkipped} counts
 * failures. A {@link IndexingStatus#COMPLETED} status means the loop finished; {@link #errors()}
 * may still be non-empty.
 */
public final class IndexingResult {
  private final String operationId;
  private final String operation;
  private final Instant startedAt;
  private final long startedNanos;
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  private IndexingStatus status = IndexingStatus.RUNNING;
  private Instant completedAt;
  private long totalProcessingTimeMs;
  private int documentsProcessed;
  private int documentsUpdated;
  private int documentsSkipped;
  private int documentsUnchanged;
  private int chunksCreated;
  private int embeddingsGenerated;

  private IndexingResult(String operation) {
    this.operationId = UUID.randomUUID().toString();
    this.operation = operation;
    this.startedAt = Instant.now();
    this.startedNanos = System.nanoTime();
  }

  static IndexingResult start(String operation) {
    return new IndexingResult(operation);
  }

  /**
   * Moves the operation to its terminal status.
   *
   * @throws StateException when the result is already finished or {@code terminal} is RUNNING
   */
  synchronized IndexingResult finish(IndexingStatus terminal) {
    if (terminal == null || !terminal.isTerminal()) {
      throw new StateException("Indexing result must finish with a terminal status");
    }
    if (status.isTerminal()) {
      throw new StateException(
          "Indexing operation " + operationId + " already finished as " + status.value());
    }
    this.status = terminal;
    this.completedAt = Instant.now();
    this.totalProcessingTimeMs = (System.nanoTime() - startedNanos) / 1_000_000L;
    return this;
  }

  void addError(String error) {
    errors.add(error);
  }

  void addWarning(String warning) {
    warnings.add(warning);
  }

  void documentProcessed(boolean updated) {
    documentsProcessed++;
    if (updated) {
      documentsUpdated++;
    } else {
      documentsUnchanged++;
    }
  }

  void documentSkipped() {
    documentsSkipped++;
  }

  void chunksCreated(int count) {
    chunksCreated += count;
  }

  void embeddingsGenerated(int count) {
    embeddingsGenerated += count;
  }

  public String operationId() {
    return operationId;
  }

  /** {@code index_all} or {@code index_one}. */
  public String operation() {
    return operation;
  }

  public synchronized IndexingStatus status() {
    return status;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public synchronized Instant completedAt() {
    return completedAt;
  }

  public int documentsProcessed() {
    return documentsProcessed;
  }

  public int documentsUpdated() {
    return documentsUpdated;
  }

  public int documentsSkipped() {
    return documentsSkipped;
  }

  public int documentsUnchanged() {
    return documentsUnchanged;
  }

  public int chunksCreated() {
    return chunksCreated;
  }

  public int embeddingsGenerated() {
    return embeddingsGenerated;
  }

  public List<String> errors() {
    return Collections.unmodifiableList(errors);
  }

  public List<String> warnings() {
    return Collections.unmodifiableList(warnings);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public long totalProcessingTimeMs() {
    return totalProcessingTimeMs;
  }

  /** Wall time of the finished operation, or time elapsed so far while running. */
  public Duration duration() {
    Instant end = completedAt == null ? Instant.now() : completedAt;
    return Duration.between(startedAt, end);
  }

  public double averageTimePerDocumentMs() {
    int attempted = documentsProcessed + documentsSkipped;
    return attempted == 0 ? 0.0 : (double) totalProcessingTimeMs / attempted;
  }

  /** Share of attempted documents that were indexed, in {@code [0, 1]}; 0 when none attempted. */
  public double successRate() {
    int attempted = documentsProcessed + documentsSkipped;
    return attempted == 0 ? 0.0 : (double) documentsProcessed / attempted;
  }

  @Override
  public String toString() {
    return "IndexingResult{id="
        + operationId
        + ", operation="
        + operation
        + ", status="
        + status.value()
        + ", processed="
        + documentsProcessed
        + ", updated="
        + documentsUpdated
        + ", unchanged="
        + documentsUnchanged
        + ", skipped="
        + documentsSkipped
        + ", chunks="
        + chunksCreated
        + ", embeddings="
        + embeddingsGenerated
        + ", errors="
        + errors.size()
        + "}";
  }
}
