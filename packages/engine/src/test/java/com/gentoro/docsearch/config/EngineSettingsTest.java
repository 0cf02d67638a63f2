package com.gentoro.docsearch.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docsearch.exception.ConfigException;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EngineSettingsTest {

  @Test
  @DisplayName("Missing keys fall back to defaults")
  void defaultsWhenEmpty() {
    EngineSettings settings = EngineSettings.from(new BaseConfiguration());

    assertEquals(EngineSettings.defaults(), settings);
    assertEquals("all-minilm-l6-v2", settings.embedding().model());
    assertEquals(1000, settings.chunking().chunkSize());
    assertEquals(ChunkingSettings.Strategy.SECTIONS, settings.chunking().strategy());
    assertEquals(List.of("blog", "engineering"), settings.content().categories());
    assertEquals(4.0, settings.search().maxDistance());
    assertTrue(settings.processing().checkContentHash());
  }

  @Test
  @DisplayName("Configured keys override defaults")
  void overrides() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("embedding.batchSize", 8);
    cfg.setProperty("chunking.chunkSize", 500);
    cfg.setProperty("chunking.chunkOverlap", 50);
    cfg.setProperty("chunking.preserveSections", false);
    cfg.setProperty("database.path", "/var/index");
    cfg.setProperty("database.table", "docs");
    cfg.addProperty("content.categories", "guides");
    cfg.addProperty("content.categories", "notes");
    cfg.setProperty("content.baseUrl", "https://docs.example.com/");
    cfg.setProperty("content.markdownParser", "plain");
    cfg.setProperty("search.similarityThreshold", 0.3);
    cfg.setProperty("cache.maxEntries", 500);

    EngineSettings settings = EngineSettings.from(cfg);

    assertEquals(8, settings.embedding().batchSize());
    assertEquals(500, settings.chunking().chunkSize());
    assertEquals(ChunkingSettings.Strategy.RECURSIVE, settings.chunking().strategy());
    assertEquals(Path.of("/var/index").resolve("docs"), settings.database().tableDirectory());
    assertEquals(List.of("guides", "notes"), settings.content().categories());
    assertEquals("https://docs.example.com", settings.content().baseUrl());
    assertEquals(ContentSettings.MarkdownParser.PLAIN, settings.content().markdownParser());
    assertEquals(0.3, settings.search().similarityThreshold());
    assertEquals(500, settings.cache().maxEntries());
  }

  @Test
  @DisplayName("An explicit strategy wins over the sections flag")
  void explicitStrategy() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("chunking.strategy", "simple");
    cfg.setProperty("chunking.preserveSections", true);

    assertEquals(ChunkingSettings.Strategy.SIMPLE, EngineSettings.from(cfg).chunking().strategy());
  }

  @Test
  @DisplayName("Invalid values raise configuration errors")
  void invalidValues() {
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("embedding.batchSize", "many")));
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("chunking.chunkSize", 9000)));
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("chunking.chunkOverlap", 1000)));
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("chunking.strategy", "fancy")));
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("database.table", "bad name;")));
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("search.maxDistance", 0)));
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("content.markdownParser", "rst")));
    assertThrows(ConfigException.class, () -> EngineSettings.from(config("cache.maxEntries", 0)));
  }

  private static BaseConfiguration config(String key, Object value) {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty(key, value);
    return cfg;
  }
}
