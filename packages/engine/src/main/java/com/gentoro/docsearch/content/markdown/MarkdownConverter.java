package com.gentoro.docsearch.content.markdown;

import com.gentoro.docsearch.config.ContentSettings;
import java.util.regex.Pattern;

/**
 * Converts markdown into whitespace-normalized plain text with paragraph breaks preserved.
 *
 * <p>Implementations strip headers, emphasis, links (keeping their text), code fences and list
 * markers. When created with {@code keepSectionHeadings}, level 3+ headings survive as {@code ###
 * Title} lines so that section-aware chunking can find their boundaries. Code lines that look
 * like such headings are escaped with a backslash so they never open a section.
 */
public interface MarkdownConverter {
  Pattern SECTION_MARKER_LINE = Pattern.compile("(?m)^([ \\t]*)(#{3,}\\s)");

  String toPlainText(String markdown);

  /** Parser name reported in logs and quick tests. */
  String name();

  /** Escapes code lines starting with {@code ###} so they are not read as section headings. */
  static String escapeSectionMarkers(String code) {
    return SECTION_MARKER_LINE.matcher(code).replaceAll("$1\\\\$2");
  }

  static MarkdownConverter create(
      ContentSettings.MarkdownParser parser, boolean keepSectionHeadings) {
    return switch (parser) {
      case FLEXMARK -> new FlexmarkMarkdownConverter(keepSectionHeadings);
      case PLAIN -> new PlainTextMarkdownConverter(keepSectionHeadings);
    };
  }
}
