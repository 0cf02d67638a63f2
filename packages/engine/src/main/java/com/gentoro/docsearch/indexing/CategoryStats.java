package com.gentoro.docsearch.indexing;

import java.time.Instant;

/**
 * @param documents distinct documents with rows in the category
 * @param lastUpdated newest row creation time, null for an empty category
 */
public record CategoryStats(String category, int documents, long chunks, Instant lastUpdated) {

  public static CategoryStats empty(String category) {
    return new CategoryStats(category, 0, 0, null);
  }
}
