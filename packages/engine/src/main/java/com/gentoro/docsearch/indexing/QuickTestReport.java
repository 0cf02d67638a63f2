package com.gentoro.docsearch.indexing;

import com.gentoro.docsearch.config.ChunkingSettings;
import com.gentoro.docsearch.embedding.EmbeddingSelfTest;
import java.util.List;

/**
 * Smoke test of the wiring: embedding, loading and chunking of the first document.
 *
 * @param sampleDocument key of the document that was chunked, null when none loaded
 */
public record QuickTestReport(
    EmbeddingSelfTest embedding,
    int documentsLoaded,
    String sampleDocument,
    int sampleChunks,
    ChunkingSettings chunking,
    boolean storeAvailable,
    List<String> errors) {

  public QuickTestReport {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public boolean success() {
    return embedding.success() && errors.isEmpty();
  }
}
