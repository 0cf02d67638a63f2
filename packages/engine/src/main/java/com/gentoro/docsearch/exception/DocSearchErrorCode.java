package com.gentoro.docsearch.exception;

/**
 * Canonical error codes for the indexing engine. Codes are stable and suitable for logs and for
 * the collaborators that surface engine failures to their own callers.
 */
public enum DocSearchErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  STORE_UNAVAILABLE,
  EMBEDDING_ERROR,
  INDEXING_FAILED,
}
