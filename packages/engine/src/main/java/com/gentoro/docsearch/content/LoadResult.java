package com.gentoro.docsearch.content;

import java.util.List;

/** Successfully loaded documents plus one message per document that failed to load. */
public record LoadResult(List<Document> documents, List<String> errors) {

  public LoadResult {
    documents = List.copyOf(documents);
    errors = List.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
