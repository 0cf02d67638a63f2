package com.gentoro.docsearch.exception;

/** Metadata descriptor or cache file could not be parsed or written. */
public class SerializationException extends DocSearchException {
  public SerializationException(String message) {
    super(DocSearchErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(DocSearchErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
