package com.gentoro.docsearch.chunking;

import com.gentoro.docsearch.utility.HashUtility;
import java.time.Instant;
import java.util.Locale;

/**
 * A contiguous slice of a document's processed text, the unit of embedding and retrieval.
 *
 * <p>{@code startChar}/{@code endChar} are offsets into the cleaned text the chunk was cut from.
 * Chunk ids are derived from category, slug and index only, so re-chunking identical text yields
 * identical ids.
 */
public record Chunk(
    String chunkId,
    String slug,
    String category,
    String content,
    int chunkIndex,
    int startChar,
    int endChar,
    int wordCount,
    int charCount,
    String sectionTitle,
    Instant createdAt) {

  public static String idFor(String category, String slug, int index) {
    return String.format(Locale.ROOT, "%s_%s_%03d", category, slug, index);
  }

  /** MD5 of the chunk text, for change detection. */
  public String contentHash() {
    return HashUtility.md5(content);
  }
}
