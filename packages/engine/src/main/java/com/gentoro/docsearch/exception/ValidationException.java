package com.gentoro.docsearch.exception;

import java.util.Map;

/** Input validation failure: a malformed document, chunk or record. */
public class ValidationException extends DocSearchException {
  public ValidationException(String message) {
    super(DocSearchErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(DocSearchErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(DocSearchErrorCode.INVALID_ARGUMENT, message, context);
  }
}
