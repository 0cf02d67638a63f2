package com.gentoro.docsearch.indexing;

import com.gentoro.docsearch.chunking.TextProcessor;
import com.gentoro.docsearch.config.ChunkingSettings;
import com.gentoro.docsearch.config.ConfigurationProvider;
import com.gentoro.docsearch.config.EngineSettings;
import com.gentoro.docsearch.content.ContentLoader;
import com.gentoro.docsearch.content.markdown.MarkdownConverter;
import com.gentoro.docsearch.embedding.EmbeddingCache;
import com.gentoro.docsearch.embedding.EmbeddingGenerator;
import com.gentoro.docsearch.embedding.EmbeddingModelFactory;
import com.gentoro.docsearch.logging.LoggingService;
import com.gentoro.docsearch.store.VectorStore;
import com.gentoro.docsearch.store.lucene.LuceneVectorStore;
import dev.langchain4j.model.embedding.EmbeddingModel;

/** Builds fully wired pipelines from configuration. */
public final class IndexingPipelineFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(IndexingPipelineFactory.class);

  private IndexingPipelineFactory() {}

  /**
   * Loads YAML configuration from {@code location} (see {@link ConfigurationProvider}), applies
   * its logging levels and builds a pipeline.
   */
  public static IndexingPipeline fromLocation(String location) {
    ConfigurationProvider provider = new ConfigurationProvider(location);
    LoggingService.applyConfiguration(provider.config());
    return create(provider.settings());
  }

  public static IndexingPipeline create(EngineSettings settings) {
    return create(settings, EmbeddingModelFactory.create(settings.embedding()));
  }

  /** Builds a pipeline around an already constructed embedding model. */
  public static IndexingPipeline create(EngineSettings settings, EmbeddingModel model) {
    EmbeddingCache cache =
        new EmbeddingCache(
            settings.cache().enabled(), settings.cache().dir(), settings.cache().maxEntries());
    cache.load();
    EmbeddingGenerator generator = new EmbeddingGenerator(settings.embedding(), model, cache);
    try {
      boolean keepHeadings =
          settings.chunking().strategy() == ChunkingSettings.Strategy.SECTIONS;
      MarkdownConverter converter =
          MarkdownConverter.create(settings.content().markdownParser(), keepHeadings);
      ContentLoader loader = new ContentLoader(settings.content(), converter);
      TextProcessor processor = new TextProcessor(settings.chunking());
      VectorStore store = new LuceneVectorStore(settings.database());
      log.info(
          "Wiring pipeline: parser {}, chunking {}, store {}",
          converter.name(),
          processor.strategy().name(),
          settings.database().tableDirectory());
      return new IndexingPipeline(settings, loader, processor, generator, store);
    } catch (RuntimeException e) {
      generator.close();
      throw e;
    }
  }
}
