package com.gentoro.docsearch.search;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docsearch.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SearchRequestTest {

  @Test
  @DisplayName("Builder defaults to semantic mode with configured limits")
  void defaults() {
    SearchRequest request = SearchRequest.builder("query").category("  ").build();

    assertEquals(SearchMode.SEMANTIC, request.mode());
    assertNull(request.limit());
    assertNull(request.similarityThreshold());
    assertNull(request.category());
    assertFalse(request.caseSensitive());
  }

  @Test
  @DisplayName("Invalid parameters are rejected")
  void validation() {
    assertThrows(ValidationException.class, () -> SearchRequest.builder(" ").build());
    assertThrows(ValidationException.class, () -> SearchRequest.builder("q").limit(0).build());
    assertThrows(
        ValidationException.class, () -> SearchRequest.builder("q").similarityThreshold(1.5).build());
  }

  @Test
  @DisplayName("Mode names parse case-insensitively")
  void modeParsing() {
    assertEquals(SearchMode.KEYWORD, SearchMode.parse("Keyword"));
    assertEquals(SearchMode.SEMANTIC, SearchMode.parse(null));
    assertThrows(ValidationException.class, () -> SearchMode.parse("fuzzy"));
  }
}
