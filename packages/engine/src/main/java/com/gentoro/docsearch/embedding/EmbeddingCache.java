package com.gentoro.docsearch.embedding;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.docsearch.config.CacheSettings;
import com.gentoro.docsearch.utility.HashUtility;
import com.gentoro.docsearch.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process-local embedding memo keyed by model name, dimension and text digest.
 *
 * <p>Holds at most {@code maxEntries} vectors; beyond that the least recently used entry is
 * evicted. Best effort only: it can be cleared at any time, and persistence failures are logged and
 * otherwise ignored.
 */
public class EmbeddingCache {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(EmbeddingCache.class);
  public static final String CACHE_FILE = "embedding_cache.json";

  private final boolean enabled;
  private final Path directory;
  private final int maxEntries;
  private final Map<String, float[]> entries;

  public EmbeddingCache(boolean enabled, Path directory) {
    this(enabled, directory, CacheSettings.DEFAULT_MAX_ENTRIES);
  }

  public EmbeddingCache(boolean enabled, Path directory, int maxEntries) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.enabled = enabled;
    this.directory = directory;
    this.maxEntries = maxEntries;
    this.entries = Collections.synchronizedMap(new LruMap(maxEntries));
  }

  public static EmbeddingCache disabled() {
    return new EmbeddingCache(false, null);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public static String key(String modelName, int dimension, String text) {
    return modelName + "_" + dimension + "_" + HashUtility.md5(text);
  }

  public float[] get(String key) {
    if (!enabled) return null;
    float[] hit = entries.get(key);
    return hit == null ? null : hit.clone();
  }

  public void put(String key, float[] vector) {
    if (!enabled) return;
    entries.put(key, vector.clone());
  }

  public int maxEntries() {
    return maxEntries;
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
    log.info("Embedding cache cleared");
  }

  public Path file() {
    return directory == null ? null : directory.resolve(CACHE_FILE);
  }

  public CacheStats stats() {
    return new CacheStats(enabled, entries.size(), file());
  }

  /** Writes the cache as JSON; returns false when disabled or on failure. */
  public boolean save() {
    Path file = file();
    if (!enabled || file == null) return false;
    try {
      Files.createDirectories(file.getParent());
      Map<String, float[]> snapshot;
      synchronized (entries) {
        snapshot = new LinkedHashMap<>(entries);
      }
      JacksonUtility.getJsonMapper().writeValue(file.toFile(), snapshot);
      log.info("Saved {} cached embeddings to {}", snapshot.size(), file);
      return true;
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to save embedding cache to {}: {}", file, e.getMessage());
      return false;
    }
  }

  /** Merges entries from the JSON file; returns the number of entries read. */
  public int load() {
    Path file = file();
    if (!enabled || file == null || !Files.isRegularFile(file)) return 0;
    try {
      Map<String, float[]> loaded =
          JacksonUtility.getJsonMapper()
              .readValue(file.toFile(), new TypeReference<Map<String, float[]>>() {});
      if (loaded == null) return 0;
      loaded.forEach(
          (k, v) -> {
            if (k != null && v != null && v.length > 0) entries.put(k, v);
          });
      log.info("Loaded {} cached embeddings from {}", loaded.size(), file);
      return loaded.size();
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to load embedding cache from {}: {}", file, e.getMessage());
      return 0;
    }
  }

  private static final class LruMap extends LinkedHashMap<String, float[]> {
    private final int maxEntries;

    LruMap(int maxEntries) {
      super(16, 0.75f, true);
      this.maxEntries = maxEntries;
    }

    @Override
    protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
      return size() > maxEntries;
    }
  }
}
