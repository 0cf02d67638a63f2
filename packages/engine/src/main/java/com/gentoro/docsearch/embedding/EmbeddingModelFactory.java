package com.gentoro.docsearch.embedding;

import com.gentoro.docsearch.config.EmbeddingSettings;
import com.gentoro.docsearch.exception.ConfigException;
import com.gentoro.docsearch.exception.EmbeddingException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import java.util.Locale;
import java.util.function.Supplier;

/** Resolves a configured model name to a LangChain4j {@link EmbeddingModel}. */
public final class EmbeddingModelFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(EmbeddingModelFactory.class);

  private EmbeddingModelFactory() {}

  public static EmbeddingModel create(EmbeddingSettings settings) {
    String name = settings.model().trim().toLowerCase(Locale.ROOT);
    if (name.startsWith("sentence-transformers/")) {
      name = name.substring("sentence-transformers/".length());
    }
    return switch (name) {
      case "all-minilm-l6-v2" -> load(settings, AllMiniLmL6V2EmbeddingModel::new);
      default ->
          throw new ConfigException(
              "Unsupported embedding model '%s'".formatted(settings.model()));
    };
  }

  /** Canonical version label recorded on every stored vector. */
  public static String versionOf(String modelName) {
    return "onnx-" + modelName.trim().toLowerCase(Locale.ROOT);
  }

  private static EmbeddingModel load(
      EmbeddingSettings settings, Supplier<EmbeddingModel> supplier) {
    log.info("Loading embedding model '{}' on {}", settings.model(), settings.device());
    try {
      return supplier.get();
    } catch (RuntimeException | LinkageError e) {
      throw new EmbeddingException(
          "Failed to load embedding model '%s'".formatted(settings.model()), e);
    }
  }
}
