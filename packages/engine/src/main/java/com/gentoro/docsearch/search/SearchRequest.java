package com.gentoro.docsearch.search;

import com.gentoro.docsearch.exception.ValidationException;

/**
 * Parameters of one search call.
 *
 * @param limit maximum number of results; null selects the configured default
 * @param category restricts results to one category when not blank
 * @param similarityThreshold minimum semantic score; null selects the configured default
 * @param caseSensitive keyword mode only; matches terms in their original case
 */
public record SearchRequest(
    String query,
    SearchMode mode,
    Integer limit,
    String category,
    Double similarityThreshold,
    boolean caseSensitive) {

  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new ValidationException("Search query cannot be empty");
    }
    if (mode == null) {
      mode = SearchMode.SEMANTIC;
    }
    if (limit != null && limit < 1) {
      throw new ValidationException("Search limit must be >= 1, got " + limit);
    }
    if (similarityThreshold != null && (similarityThreshold < 0 || similarityThreshold > 1)) {
      throw new ValidationException(
          "Similarity threshold must be in [0, 1], got " + similarityThreshold);
    }
    if (category != null && category.isBlank()) {
      category = null;
    }
  }

  public static Builder builder(String query) {
    return new Builder(query);
  }

  public static final class Builder {
    private final String query;
    private SearchMode mode = SearchMode.SEMANTIC;
    private Integer limit;
    private String category;
    private Double similarityThreshold;
    private boolean caseSensitive;

    private Builder(String query) {
      this.query = query;
    }

    public Builder mode(SearchMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder similarityThreshold(double similarityThreshold) {
      this.similarityThreshold = similarityThreshold;
      return this;
    }

    public Builder caseSensitive(boolean caseSensitive) {
      this.caseSensitive = caseSensitive;
      return this;
    }

    public SearchRequest build() {
      return new SearchRequest(query, mode, limit, category, similarityThreshold, caseSensitive);
    }
  }
}
