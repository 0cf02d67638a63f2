package com.gentoro.docsearch.config;

/** Indexing behaviour switches. */
public record ProcessingSettings(boolean checkContentHash) {

  public static ProcessingSettings defaults() {
    return new ProcessingSettings(true);
  }
}
