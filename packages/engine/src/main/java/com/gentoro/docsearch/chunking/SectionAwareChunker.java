package com.gentoro.docsearch.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into sections on level 3+ heading lines ({@code ### Title}). A section that fits in
 * {@code chunkSize} becomes one span; a larger section is cut by the simple window. All spans
 * carry their section title. Text before the first heading, or the whole text when there are no
 * headings, forms a section titled {@value #DEFAULT_SECTION_TITLE}.
 */
public class SectionAwareChunker implements ChunkingStrategy {
  public static final String DEFAULT_SECTION_TITLE = "Main Content";
  private static final Pattern HEADER_PATTERN = Pattern.compile("^(#{3,})\\s+(.+)$");

  private final int chunkSize;
  private final SimpleWindowChunker window;

  public SectionAwareChunker(int chunkSize, SimpleWindowChunker window) {
    this.chunkSize = chunkSize;
    this.window = window;
  }

  @Override
  public String name() {
    return "sections";
  }

  @Override
  public List<TextSpan> split(String text) {
    List<TextSpan> spans = new ArrayList<>();
    if (text == null || text.isBlank()) return spans;

    for (Section section : extractSections(text)) {
      TextSpan body = TextSpan.trimmed(text, section.start, section.end, section.title);
      if (body == null) continue;
      if (body.length() <= chunkSize) {
        spans.add(body);
      } else {
        spans.addAll(window.split(text, body.start(), body.end(), section.title));
      }
    }
    return spans;
  }

  List<Section> extractSections(String text) {
    List<Section> sections = new ArrayList<>();
    String title = DEFAULT_SECTION_TITLE;
    int bodyStart = 0;
    int lineStart = 0;
    while (lineStart <= text.length()) {
      int lineEnd = text.indexOf('\n', lineStart);
      if (lineEnd < 0) lineEnd = text.length();
      Matcher m = HEADER_PATTERN.matcher(text.substring(lineStart, lineEnd));
      if (m.matches()) {
        sections.add(new Section(title, bodyStart, lineStart));
        title = m.group(2).trim();
        bodyStart = Math.min(lineEnd + 1, text.length());
      }
      lineStart = lineEnd + 1;
    }
    sections.add(new Section(title, bodyStart, text.length()));
    return sections;
  }

  record Section(String title, int start, int end) {}
}
