package com.gentoro.docsearch.exception;

/** Requested document or resource was not found. */
public class NotFoundException extends DocSearchException {
  public NotFoundException(String message) {
    super(DocSearchErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(DocSearchErrorCode.NOT_FOUND, message, cause);
  }
}
