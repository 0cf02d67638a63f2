package com.gentoro.docsearch.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the engine with a stable {@link DocSearchErrorCode} and optional
 * context.
 *
 * <p>The context map is copied and unmodifiable. Subclasses map one failure category each.
 */
public class DocSearchException extends RuntimeException {
  private final DocSearchErrorCode code;
  private final Map<String, Object> context;

  public DocSearchException(DocSearchErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public DocSearchException(DocSearchErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public DocSearchException(DocSearchErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public DocSearchException(
      DocSearchErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public DocSearchErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
