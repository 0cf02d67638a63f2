package com.gentoro.docsearch.content;

import java.util.List;
import java.util.Map;

/**
 * Summary of the content tree.
 *
 * @param totalContentLength processed characters across published documents
 * @param failedDirectories directories whose metadata or content could not be loaded
 */
public record ContentStats(
    int totalDocuments,
    Map<String, Integer> documentsByCategory,
    Map<String, Integer> documentsByStatus,
    long totalContentLength,
    double averageContentLength,
    List<String> failedDirectories) {}
