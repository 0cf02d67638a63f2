package com.gentoro.docsearch.config;

import com.gentoro.docsearch.exception.ConfigException;
import java.nio.file.Path;

/**
 * Embedding cache toggle, the directory used to persist it and the number of vectors kept in
 * memory before the least recently used ones are evicted.
 */
public record CacheSettings(boolean enabled, Path dir, int maxEntries) {

  public static final int DEFAULT_MAX_ENTRIES = 20_000;

  public CacheSettings {
    if (dir == null) {
      dir = Path.of("./data/cache");
    }
    if (maxEntries < 1) {
      throw new ConfigException("cache.maxEntries must be positive, got " + maxEntries);
    }
  }

  public CacheSettings(boolean enabled, Path dir) {
    this(enabled, dir, DEFAULT_MAX_ENTRIES);
  }

  public static CacheSettings defaults() {
    return new CacheSettings(true, Path.of("./data/cache"), DEFAULT_MAX_ENTRIES);
  }
}
