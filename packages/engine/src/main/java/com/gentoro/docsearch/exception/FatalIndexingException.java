package com.gentoro.docsearch.exception;

/** Unexpected failure that aborts a whole indexing run. */
public class FatalIndexingException extends DocSearchException {
  public FatalIndexingException(String message) {
    super(DocSearchErrorCode.INDEXING_FAILED, message);
  }

  public FatalIndexingException(String message, Throwable cause) {
    super(DocSearchErrorCode.INDEXING_FAILED, message, cause);
  }
}
