package com.gentoro.docsearch.embedding;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmbeddingCacheTest {

  @TempDir Path dir;

  @Test
  @DisplayName("Keys combine model, dimension and text digest")
  void keyFormat() {
    String key = EmbeddingCache.key("mini", 384, "hello");

    assertEquals("mini_384_5d41402abc4b2a76b9719d911017c592", key);
    assertNotEquals(key, EmbeddingCache.key("mini", 768, "hello"));
  }

  @Test
  @DisplayName("Stored vectors are copied in and out")
  void storesAndReturnsCopies() {
    EmbeddingCache cache = new EmbeddingCache(true, dir);
    float[] vector = {1f, 2f};

    cache.put("k", vector);
    vector[0] = 9f;
    float[] hit = cache.get("k");
    hit[1] = 7f;

    assertArrayEquals(new float[] {1f, 2f}, cache.get("k"));
  }

  @Test
  @DisplayName("A disabled cache stores nothing and never writes")
  void disabled() {
    EmbeddingCache cache = new EmbeddingCache(false, dir);
    cache.put("k", new float[] {1f});

    assertNull(cache.get("k"));
    assertEquals(0, cache.size());
    assertFalse(cache.save());
    assertFalse(Files.exists(dir.resolve(EmbeddingCache.CACHE_FILE)));
  }

  @Test
  @DisplayName("Saved entries are read back by a new cache")
  void saveAndLoad() {
    EmbeddingCache cache = new EmbeddingCache(true, dir.resolve("nested"));
    cache.put("a", new float[] {0.5f, 0.25f});
    cache.put("b", new float[] {1f});

    assertTrue(cache.save());

    EmbeddingCache reloaded = new EmbeddingCache(true, dir.resolve("nested"));
    assertEquals(2, reloaded.load());
    assertArrayEquals(new float[] {0.5f, 0.25f}, reloaded.get("a"));
    assertEquals(2, reloaded.stats().size());
    assertTrue(reloaded.stats().enabled());
  }

  @Test
  @DisplayName("A corrupt cache file is ignored")
  void corruptFile() throws Exception {
    Files.writeString(dir.resolve(EmbeddingCache.CACHE_FILE), "{not json");
    EmbeddingCache cache = new EmbeddingCache(true, dir);

    assertEquals(0, cache.load());
    assertEquals(0, cache.size());
  }

  @Test
  @DisplayName("Clearing drops every entry")
  void clear() {
    EmbeddingCache cache = new EmbeddingCache(true, dir);
    cache.put("a", new float[] {1f});
    cache.clear();
    assertEquals(0, cache.size());
  }

  @Test
  @DisplayName("The least recently used entry is evicted past the size bound")
  void evictsLeastRecentlyUsed() {
    EmbeddingCache cache = new EmbeddingCache(true, dir, 2);
    cache.put("a", new float[] {1f});
    cache.put("b", new float[] {2f});
    cache.get("a");
    cache.put("c", new float[] {3f});

    assertEquals(2, cache.size());
    assertNull(cache.get("b"));
    assertArrayEquals(new float[] {1f}, cache.get("a"));
    assertArrayEquals(new float[] {3f}, cache.get("c"));
  }

  @Test
  @DisplayName("Loading a larger file keeps only the newest entries")
  void loadRespectsBound() {
    EmbeddingCache full = new EmbeddingCache(true, dir);
    for (int i = 0; i < 5; i++) {
      full.put("k" + i, new float[] {i});
    }
    assertTrue(full.save());

    EmbeddingCache small = new EmbeddingCache(true, dir, 3);
    small.load();

    assertEquals(3, small.size());
    assertNull(small.get("k0"));
    assertArrayEquals(new float[] {4f}, small.get("k4"));
  }

  @Test
  @DisplayName("Rejects a non-positive size bound")
  void invalidBound() {
    assertThrows(IllegalArgumentException.class, () -> new EmbeddingCache(true, dir, 0));
  }
}
