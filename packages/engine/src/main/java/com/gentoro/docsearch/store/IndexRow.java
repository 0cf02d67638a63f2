package com.gentoro.docsearch.store;

import java.time.Instant;
import java.util.List;

/**
 * A row read back from the store. {@code distance} is the squared Euclidean distance to the query
 * vector for vector searches and null otherwise.
 */
public record IndexRow(
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
    int vectorDim,
    String modelName,
    String modelVersion,
    Instant createdAt,
    String documentHash,
    Double distance) {}
