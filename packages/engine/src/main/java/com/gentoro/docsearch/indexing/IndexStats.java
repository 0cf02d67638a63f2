package com.gentoro.docsearch.indexing;

import com.gentoro.docsearch.embedding.CacheStats;
import com.gentoro.docsearch.embedding.ModelInfo;
import java.util.Map;

/**
 * Snapshot of the index, computed from row counts on every call.
 *
 * @param storeAvailable false when the store could not be opened; counts are then zero
 */
public record IndexStats(
    boolean storeAvailable,
    long totalChunks,
    int totalDocuments,
    Map<String, CategoryStats> categories,
    ModelInfo model,
    String databaseLocation,
    String tableName,
    CacheStats cache) {

  public IndexStats {
    categories = categories == null ? Map.of() : Map.copyOf(categories);
  }

  /** Document count per category. */
  public int documents(String category) {
    CategoryStats stats = categories.get(category);
    return stats == null ? 0 : stats.documents();
  }

  public long chunks(String category) {
    CategoryStats stats = categories.get(category);
    return stats == null ? 0 : stats.chunks();
  }
}
