package com.gentoro.docsearch.utility;

import java.util.regex.Pattern;

public final class TextUtility {
  private static final Pattern HORIZONTAL_WS = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
  private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextUtility() {}

  /**
   * Collapses runs of horizontal whitespace, trims every line and limits consecutive blank lines
   * to a single paragraph break. Line structure is otherwise preserved.
   */
  public static String normalizeWhitespace(String text) {
    if (text == null || text.isEmpty()) return "";
    String unified = text.replace("\r\n", "\n").replace('\r', '\n');
    StringBuilder sb = new StringBuilder(unified.length());
    for (String line : unified.split("\n", -1)) {
      sb.append(HORIZONTAL_WS.matcher(line).replaceAll(" ").trim()).append('\n');
    }
    return EXTRA_BLANK_LINES.matcher(sb.toString()).replaceAll("\n\n").trim();
  }

  /** Number of whitespace-separated words. */
  public static int wordCount(String text) {
    if (text == null) return 0;
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }

  /** First {@code length} characters followed by an ellipsis. */
  public static String excerpt(String text, int length) {
    if (text == null) return "...";
    return (text.length() <= length ? text : text.substring(0, length)) + "...";
  }

  /** Non-overlapping occurrences of {@code term} in {@code text}. */
  public static int countOccurrences(String text, String term) {
    if (text == null || term == null || term.isEmpty()) return 0;
    int count = 0;
    int from = 0;
    while ((from = text.indexOf(term, from)) >= 0) {
      count++;
      from += term.length();
    }
    return count;
  }
}
