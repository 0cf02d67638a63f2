package com.gentoro.docsearch.chunking;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structured splitter backed by LangChain4j's recursive document splitter (paragraph, line,
 * sentence, word, then character boundaries).
 *
 * <p>The library returns segment text only, so each segment is located in the source text from a
 * running cursor, allowing whitespace to differ since the splitter re-joins parts with its own
 * delimiters. A segment that still cannot be found is placed at the cursor. When the splitter
 * fails the {@code fallback} strategy is used for the whole text.
 */
public class RecursiveSeparatorChunker implements ChunkingStrategy {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(RecursiveSeparatorChunker.class);

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final DocumentSplitter splitter;
  private final int overlap;
  private final int minChunkSize;
  private final ChunkingStrategy fallback;

  public RecursiveSeparatorChunker(
      int chunkSize, int overlap, int minChunkSize, ChunkingStrategy fallback) {
    this(validated(chunkSize, overlap), overlap, minChunkSize, fallback);
  }

  RecursiveSeparatorChunker(
      DocumentSplitter splitter, int overlap, int minChunkSize, ChunkingStrategy fallback) {
    this.splitter = splitter;
    this.overlap = overlap;
    this.minChunkSize = Math.max(0, minChunkSize);
    this.fallback = fallback;
  }

  private static DocumentSplitter validated(int chunkSize, int overlap) {
    if (chunkSize < 1 || overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "Invalid splitter: size=" + chunkSize + ", overlap=" + overlap);
    }
    return DocumentSplitters.recursive(chunkSize, overlap);
  }

  @Override
  public String name() {
    return "recursive";
  }

  @Override
  public List<TextSpan> split(String text) {
    if (text == null || text.isBlank()) return new ArrayList<>();
    List<TextSegment> segments;
    try {
      segments = splitter.split(Document.from(text));
    } catch (RuntimeException | LinkageError e) {
      if (fallback == null) throw e;
      log.warn("Recursive splitter failed, using '{}' chunking instead", fallback.name(), e);
      return fallback.split(text);
    }
    return locate(text, segments);
  }

  private List<TextSpan> locate(String text, List<TextSegment> segments) {
    List<TextSpan> spans = new ArrayList<>(segments.size());
    int cursor = 0;
    for (TextSegment segment : segments) {
      String content = segment.text() == null ? "" : segment.text().strip();
      if (content.isEmpty() || content.length() < minChunkSize) {
        continue;
      }
      TextSpan span = find(text, content, cursor);
      if (span == null) {
        log.debug("Segment not found at or after offset {}; placing it there", cursor);
        int start = Math.min(cursor, text.length());
        int end = Math.min(text.length(), start + content.length());
        span = new TextSpan(start, end, content, null);
      }
      spans.add(span);
      // the next segment starts inside this one's overlap window; re-joined overlap text can be
      // shorter than the source it came from
      cursor = Math.min(text.length(), Math.max(span.start() + 1, span.end() - 2 * overlap));
    }
    return spans;
  }

  /** Exact match first, then a match that tolerates different whitespace between words. */
  static TextSpan find(String text, String content, int from) {
    int start = text.indexOf(content, from);
    if (start >= 0) {
      return new TextSpan(start, start + content.length(), content, null);
    }
    String[] words = WHITESPACE.split(content);
    StringBuilder regex = new StringBuilder();
    for (String word : words) {
      if (regex.length() > 0) regex.append("\\s+");
      regex.append(Pattern.quote(word));
    }
    Matcher m = Pattern.compile(regex.toString()).matcher(text);
    if (from <= text.length() && m.find(from)) {
      return new TextSpan(m.start(), m.end(), text.substring(m.start(), m.end()), null);
    }
    return null;
  }
}
