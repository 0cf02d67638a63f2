package com.gentoro.docsearch.config;

import com.gentoro.docsearch.exception.ConfigException;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Immutable engine configuration, built once and passed explicitly into every component.
 *
 * <p>{@link #from(Configuration)} reads the keys documented in {@code application.yaml}; any key
 * that is absent keeps the value from {@link #defaults()}.
 */
public record EngineSettings(
    EmbeddingSettings embedding,
    ChunkingSettings chunking,
    DatabaseSettings database,
    ContentSettings content,
    CacheSettings cache,
    SearchSettings search,
    ProcessingSettings processing) {

  public EngineSettings {
    if (embedding == null
        || chunking == null
        || database == null
        || content == null
        || cache == null
        || search == null
        || processing == null) {
      throw new ConfigException("All engine settings sections are required");
    }
  }

  public static EngineSettings defaults() {
    return new EngineSettings(
        EmbeddingSettings.defaults(),
        ChunkingSettings.defaults(),
        DatabaseSettings.defaults(),
        ContentSettings.defaults(),
        CacheSettings.defaults(),
        SearchSettings.defaults(),
        ProcessingSettings.defaults());
  }

  public static EngineSettings from(Configuration cfg) {
    if (cfg == null) {
      return defaults();
    }
    EngineSettings d = defaults();
    try {
      EmbeddingSettings embedding =
          new EmbeddingSettings(
              cfg.getString("embedding.model", d.embedding().model()),
              cfg.getString("embedding.device", d.embedding().device()),
              cfg.getInt("embedding.batchSize", d.embedding().batchSize()),
              cfg.getInt("embedding.maxSequenceLength", d.embedding().maxSequenceLength()),
              cfg.getInt("embedding.maxWorkers", d.embedding().maxWorkers()));

      String strategy = cfg.getString("chunking.strategy", null);
      ChunkingSettings chunking =
          new ChunkingSettings(
              cfg.getInt("chunking.chunkSize", d.chunking().chunkSize()),
              cfg.getInt("chunking.chunkOverlap", d.chunking().chunkOverlap()),
              cfg.getInt("chunking.minChunkSize", d.chunking().minChunkSize()),
              cfg.getBoolean("chunking.preserveSections", d.chunking().preserveSections()),
              strategy == null || strategy.isBlank()
                  ? null
                  : ChunkingSettings.Strategy.parse(strategy));

      DatabaseSettings database =
          new DatabaseSettings(
              path(cfg, "database.path", d.database().path()),
              cfg.getString("database.table", d.database().table()));

      List<String> categories =
          cfg.getList(String.class, "content.categories", d.content().categories());
      ContentSettings content =
          new ContentSettings(
              path(cfg, "content.root", d.content().root()),
              categories,
              cfg.getString("content.markdownFile", d.content().markdownFile()),
              cfg.getString("content.metadataFile", d.content().metadataFile()),
              cfg.getBoolean("content.includeDrafts", d.content().includeDrafts()),
              cfg.getInt("content.minContentLength", d.content().minContentLength()),
              cfg.getString("content.baseUrl", d.content().baseUrl()),
              ContentSettings.MarkdownParser.parse(
                  cfg.getString("content.markdownParser", "flexmark")));

      CacheSettings cache =
          new CacheSettings(
              cfg.getBoolean("cache.enabled", d.cache().enabled()),
              path(cfg, "cache.dir", d.cache().dir()),
              cfg.getInt("cache.maxEntries", d.cache().maxEntries()));

      SearchSettings search =
          new SearchSettings(
              cfg.getDouble("search.maxDistance", d.search().maxDistance()),
              cfg.getDouble("search.similarityThreshold", d.search().similarityThreshold()),
              cfg.getInt("search.defaultLimit", d.search().defaultLimit()),
              cfg.getInt("search.excerptLength", d.search().excerptLength()));

      ProcessingSettings processing =
          new ProcessingSettings(
              cfg.getBoolean(
                  "processing.checkContentHash", d.processing().checkContentHash()));

      return new EngineSettings(
          embedding, chunking, database, content, cache, search, processing);
    } catch (ConversionException e) {
      throw new ConfigException("Invalid configuration value: " + e.getMessage(), e);
    }
  }

  private static Path path(Configuration cfg, String key, Path fallback) {
    String value = cfg.getString(key, null);
    return value == null || value.isBlank() ? fallback : Path.of(value.trim());
  }

  public EngineSettings withEmbedding(EmbeddingSettings value) {
    return new EngineSettings(value, chunking, database, content, cache, search, processing);
  }

  public EngineSettings withChunking(ChunkingSettings value) {
    return new EngineSettings(embedding, value, database, content, cache, search, processing);
  }

  public EngineSettings withDatabase(DatabaseSettings value) {
    return new EngineSettings(embedding, chunking, value, content, cache, search, processing);
  }

  public EngineSettings withContent(ContentSettings value) {
    return new EngineSettings(embedding, chunking, database, value, cache, search, processing);
  }

  public EngineSettings withCache(CacheSettings value) {
    return new EngineSettings(embedding, chunking, database, content, value, search, processing);
  }

  public EngineSettings withSearch(SearchSettings value) {
    return new EngineSettings(embedding, chunking, database, content, cache, value, processing);
  }

  public EngineSettings withProcessing(ProcessingSettings value) {
    return new EngineSettings(embedding, chunking, database, content, cache, search, value);
  }
}
