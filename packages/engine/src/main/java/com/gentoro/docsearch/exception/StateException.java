package com.gentoro.docsearch.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends DocSearchException {
  public StateException(String message) {
    super(DocSearchErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(DocSearchErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
