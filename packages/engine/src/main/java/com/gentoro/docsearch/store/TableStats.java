package com.gentoro.docsearch.store;

/** Physical facts about the table backing the index. */
public record TableStats(
    String location,
    String tableName,
    long rowCount,
    int vectorDim,
    String modelName,
    String schemaVersion,
    long sizeBytes) {}
