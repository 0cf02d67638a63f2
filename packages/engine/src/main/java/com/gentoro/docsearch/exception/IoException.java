package com.gentoro.docsearch.exception;

/** I/O operation failed (content tree, index directory, cache file). */
public class IoException extends DocSearchException {
  public IoException(String message) {
    super(DocSearchErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(DocSearchErrorCode.IO_ERROR, message, cause);
  }
}
