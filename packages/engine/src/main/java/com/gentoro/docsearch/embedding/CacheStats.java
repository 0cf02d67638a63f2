package com.gentoro.docsearch.embedding;

import java.nio.file.Path;

public record CacheStats(boolean enabled, int size, Path file) {}
