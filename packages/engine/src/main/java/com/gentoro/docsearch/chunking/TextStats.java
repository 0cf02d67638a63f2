package com.gentoro.docsearch.chunking;

/** Descriptive statistics of a text. */
public record TextStats(
    int charCount,
    int wordCount,
    int paragraphCount,
    int sentenceCount,
    double averageSentenceLength,
    int readingTimeMinutes) {

  public static final TextStats EMPTY = new TextStats(0, 0, 0, 0, 0.0, 0);
}
