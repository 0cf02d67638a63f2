package com.gentoro.docsearch.exception;

/** The vector store is not initialized or its table cannot be opened. */
public class StoreUnavailableException extends DocSearchException {
  public StoreUnavailableException(String message) {
    super(DocSearchErrorCode.STORE_UNAVAILABLE, message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(DocSearchErrorCode.STORE_UNAVAILABLE, message, cause);
  }
}
