package com.gentoro.docsearch.chunking;

/**
 * A trimmed slice produced by a chunking strategy, before ids and indices are assigned.
 *
 * @param start offset of the first character of {@code content}
 * @param end offset one past the last character of {@code content}
 * @param sectionTitle enclosing section, or null when the strategy is not section aware
 */
public record TextSpan(int start, int end, String content, String sectionTitle) {

  /** Trims the range {@code [from, to)} of {@code text}; returns null when nothing remains. */
  static TextSpan trimmed(String text, int from, int to, String sectionTitle) {
    int s = from;
    int e = to;
    while (s < e && Character.isWhitespace(text.charAt(s))) s++;
    while (e > s && Character.isWhitespace(text.charAt(e - 1))) e--;
    if (s >= e) return null;
    return new TextSpan(s, e, text.substring(s, e), sectionTitle);
  }

  public int length() {
    return end - start;
  }
}
