package com.gentoro.docsearch.chunking;

import com.gentoro.docsearch.config.ChunkingSettings;
import java.util.List;

/**
 * Splits cleaned text into ordered, non-empty spans. Implementations are deterministic and keep
 * span start offsets non-decreasing.
 */
public interface ChunkingStrategy {

  List<TextSpan> split(String text);

  String name();

  static ChunkingStrategy create(ChunkingSettings settings) {
    SimpleWindowChunker simple =
        new SimpleWindowChunker(
            settings.chunkSize(), settings.chunkOverlap(), settings.minChunkSize());
    return switch (settings.strategy()) {
      case SIMPLE -> simple;
      case RECURSIVE ->
          new RecursiveSeparatorChunker(
              settings.chunkSize(), settings.chunkOverlap(), settings.minChunkSize(), simple);
      case SECTIONS -> new SectionAwareChunker(settings.chunkSize(), simple);
    };
  }
}
