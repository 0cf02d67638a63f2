package com.gentoro.docsearch.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Character window with back-overlap.
 *
 * <p>When the window does not reach the end of the text its right edge is pulled back to the last
 * {@code '.'} within the final 100 characters, else to the last paragraph break in that range.
 * Windows whose trimmed content is shorter than {@code minChunkSize} are dropped and the scan
 * continues after them. Each following window starts {@code overlap} characters before the end of
 * the previous one.
 */
public class SimpleWindowChunker implements ChunkingStrategy {
  static final int BOUNDARY_LOOKBACK = 100;

  private final int chunkSize;
  private final int overlap;
  private final int minChunkSize;

  public SimpleWindowChunker(int chunkSize, int overlap, int minChunkSize) {
    if (chunkSize < 1 || overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "Invalid window: size=" + chunkSize + ", overlap=" + overlap);
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
    this.minChunkSize = Math.max(0, minChunkSize);
  }

  @Override
  public String name() {
    return "simple";
  }

  @Override
  public List<TextSpan> split(String text) {
    return split(text, 0, text == null ? 0 : text.length(), null);
  }

  /** Splits {@code text[from, to)}; offsets in the returned spans are relative to {@code text}. */
  List<TextSpan> split(String text, int from, int to, String sectionTitle) {
    List<TextSpan> spans = new ArrayList<>();
    if (text == null || from >= to) return spans;

    int start = from;
    while (start < to) {
      int end = start + chunkSize;
      if (end < to) {
        end = naturalBreak(text, start, end);
      } else {
        end = to;
      }

      TextSpan span = TextSpan.trimmed(text, start, end, sectionTitle);
      if (span == null || span.length() < minChunkSize) {
        start = end;
        continue;
      }
      spans.add(span);

      if (end >= to) break;
      // restart inside the previous window so pulled-back edges leave no gap
      start = Math.max(end - overlap, start + 1);
    }
    return spans;
  }

  private int naturalBreak(String text, int start, int end) {
    int searchStart = Math.max(end - BOUNDARY_LOOKBACK, start);
    int sentenceEnd = text.lastIndexOf('.', end - 1);
    if (sentenceEnd >= searchStart && sentenceEnd > start) {
      return sentenceEnd + 1;
    }
    int paragraphEnd = text.lastIndexOf("\n\n", end - 2);
    if (paragraphEnd >= searchStart && paragraphEnd > start) {
      return paragraphEnd + 2;
    }
    return end;
  }
}
