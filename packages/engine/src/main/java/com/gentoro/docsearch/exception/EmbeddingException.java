package com.gentoro.docsearch.exception;

/** Embedding model could not be loaded or failed to encode the given text. */
public class EmbeddingException extends DocSearchException {
  public EmbeddingException(String message) {
    super(DocSearchErrorCode.EMBEDDING_ERROR, message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(DocSearchErrorCode.EMBEDDING_ERROR, message, cause);
  }
}
