package com.gentoro.docsearch.search;

import com.gentoro.docsearch.exception.ValidationException;
import java.util.Locale;

/** Routing choice of the unified search entry point. */
public enum SearchMode {
  SEMANTIC,
  KEYWORD;

  public static SearchMode parse(String value) {
    if (value == null || value.isBlank()) {
      return SEMANTIC;
    }
    try {
      return SearchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unknown search mode '" + value + "'", e);
    }
  }
}
