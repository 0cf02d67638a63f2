package com.gentoro.docsearch.config;

import com.gentoro.docsearch.exception.ConfigException;
import java.util.Locale;

/**
 * Chunk sizing and strategy selection. Sizes are in characters.
 *
 * <p>When no strategy is configured explicitly it is derived from {@code preserveSections}:
 * section-aware when sections are preserved, the recursive separator splitter otherwise.
 */
public record ChunkingSettings(
    int chunkSize,
    int chunkOverlap,
    int minChunkSize,
    boolean preserveSections,
    Strategy strategy) {

  /** Upper bound that keeps a chunk within the store's keyword-term size limit. */
  public static final int MAX_CHUNK_SIZE = 8000;

  public enum Strategy {
    SECTIONS,
    RECURSIVE,
    SIMPLE;

    public static Strategy parse(String value) {
      try {
        return Strategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Unknown chunking.strategy '" + value + "'", e);
      }
    }
  }

  public ChunkingSettings {
    if (chunkSize < 1 || chunkSize > MAX_CHUNK_SIZE) {
      throw new ConfigException(
          "chunking.chunkSize must be in [1, " + MAX_CHUNK_SIZE + "], got " + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new ConfigException(
          "chunking.chunkOverlap must be in [0, chunkSize), got " + chunkOverlap);
    }
    if (minChunkSize < 0 || minChunkSize > chunkSize) {
      throw new ConfigException(
          "chunking.minChunkSize must be in [0, chunkSize], got " + minChunkSize);
    }
    if (strategy == null) {
      strategy = preserveSections ? Strategy.SECTIONS : Strategy.RECURSIVE;
    }
  }

  public static ChunkingSettings defaults() {
    return new ChunkingSettings(1000, 200, 100, true, null);
  }

  public ChunkingSettings withStrategy(Strategy newStrategy) {
    return new ChunkingSettings(
        chunkSize, chunkOverlap, minChunkSize, newStrategy == Strategy.SECTIONS, newStrategy);
  }
}
