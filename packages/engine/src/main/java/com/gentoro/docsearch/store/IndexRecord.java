package com.gentoro.docsearch.store;

import java.time.Instant;
import java.util.List;

/**
 * One persisted row: a chunk, its embedding and the document fields needed to render a search
 * result without a second lookup.
 *
 * @param docKey {@code category/slug}, identity of the owning document
 * @param documentHash content hash of the owning document at indexing time
 * @param chunkHash MD5 of the chunk text
 */
public record IndexRecord(
    String chunkId,
    String docKey,
    String slug,
    String category,
    String title,
    String author,
    String publishDate,
    String url,
    List<String> tags,
    String content,
    int chunkIndex,
    int startChar,
    int endChar,
    int wordCount,
    String sectionTitle,
    float[] vector,
    int vectorDim,
    String modelName,
    String modelVersion,
    Instant createdAt,
    double processingTimeMs,
    String vectorHash,
    String documentHash,
    String chunkHash) {

  public IndexRecord {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public IndexRecord withVectorDim(int dim) {
    return new IndexRecord(
        chunkId,
        docKey,
        slug,
        category,
        title,
        author,
        publishDate,
        url,
        tags,
        content,
        chunkIndex,
        startChar,
        endChar,
        wordCount,
        sectionTitle,
        vector,
        dim,
        modelName,
        modelVersion,
        createdAt,
        processingTimeMs,
        vectorHash,
        documentHash,
        chunkHash);
  }
}
