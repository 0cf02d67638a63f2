package com.gentoro.docsearch.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, human-friendly representation of a throwable's stack trace. It captures only
   * the top frames up to the provided limit and joins them in call-order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 5 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 5);
  }

  /**
   * One-line description used in operation error lists: the exception type followed by its
   * message, or by the message of its innermost cause when the top-level message is empty.
   */
  public static String describe(Throwable t) {
    if (t == null) return "";
    String message = t.getMessage();
    Throwable root = t;
    while ((message == null || message.isBlank()) && root.getCause() != null) {
      root = root.getCause();
      message = root.getMessage();
    }
    return t.getClass().getSimpleName() + ": " + (message == null ? "" : message);
  }

  public static DocSearchException rethrowIfUnchecked(
      Throwable t, Function<Throwable, DocSearchException> supplier) {
    if (t instanceof DocSearchException) {
      return (DocSearchException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
