package com.gentoro.docsearch.content;

import com.gentoro.docsearch.chunking.Chunk;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A loaded source document. Instances are immutable; re-indexing loads a fresh instance instead of
 * mutating an existing one.
 *
 * @param contentHash SHA-256 over the raw markdown and the metadata descriptor, used to detect
 *     unchanged documents
 */
public record Document(
    ContentMetadata metadata,
    Path directory,
    String rawContent,
    String processedContent,
    String contentHash,
    long fileSizeBytes,
    Instant fileModifiedTime,
    List<Chunk> chunks) {

  public Document {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }

  public String slug() {
    return metadata.slug();
  }

  public String category() {
    return metadata.category();
  }

  public String title() {
    return metadata.title();
  }

  /** Stable identity of the document inside the index. */
  public String key() {
    return category() + "/" + slug();
  }

  public Document withChunks(List<Chunk> newChunks) {
    return new Document(
        metadata,
        directory,
        rawContent,
        processedContent,
        contentHash,
        fileSizeBytes,
        fileModifiedTime,
        newChunks);
  }

  public int totalWordCount() {
    return chunks.stream().mapToInt(Chunk::wordCount).sum();
  }
}
