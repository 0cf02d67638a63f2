package com.gentoro.docsearch.search;

import java.util.List;

/**
 * One ranked hit.
 *
 * @param distance squared Euclidean distance, semantic mode only
 * @param termMatches distinct query terms found, keyword mode only
 */
public record SearchResult(
    String title,
    String category,
    String slug,
    String chunkId,
    String excerpt,
    String content,
    double score,
    String url,
    List<String> tags,
    String publishDate,
    String sectionTitle,
    Double distance,
    Integer termMatches) {

  public SearchResult {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
