package com.gentoro.docsearch.content.markdown;

import com.gentoro.docsearch.utility.TextUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based markdown stripper used when structured parsing is disabled. Fenced code bodies are
 * set aside before the inline rules run and restored verbatim afterwards.
 */
public class PlainTextMarkdownConverter implements MarkdownConverter {
  private static final Pattern FENCE =
      Pattern.compile("(?m)^[ \\t]*(```|~~~)[^\\n]*\\n([\\s\\S]*?)^[ \\t]*\\1[ \\t]*$");
  private static final Pattern CODE_PLACEHOLDER = Pattern.compile("\0CODE(\\d+)\0");
  private static final Pattern HEADING =
      Pattern.compile("(?m)^[ \\t]{0,3}(#{1,6})[ \\t]+(.*?)[ \\t]*#*[ \\t]*$");
  private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]*\\)");
  private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]*\\)");
  private static final Pattern BOLD = Pattern.compile("(\\*\\*|__)(.+?)\\1");
  private static final Pattern ITALIC_STAR = Pattern.compile("\\*(?!\\s)([^*\\n]+?)\\*");
  private static final Pattern ITALIC_UNDERSCORE =
      Pattern.compile("(?<![\\w_])_(?!\\s)([^_\\n]+?)_(?![\\w_])");
  private static final Pattern INLINE_CODE = Pattern.compile("`([^`\\n]+)`");
  private static final Pattern BULLET = Pattern.compile("(?m)^[ \\t]*[-*+][ \\t]+");
  private static final Pattern NUMBERED = Pattern.compile("(?m)^[ \\t]*\\d+[.)][ \\t]+");
  private static final Pattern QUOTE = Pattern.compile("(?m)^[ \\t]*>[ \\t]?");
  private static final Pattern HTML_TAG = Pattern.compile("<[^>\\n]+>");
  private static final Pattern RULE =
      Pattern.compile("(?m)^[ \\t]*([-*_])([ \\t]*\\1){2,}[ \\t]*$");

  private final boolean keepSectionHeadings;

  public PlainTextMarkdownConverter(boolean keepSectionHeadings) {
    this.keepSectionHeadings = keepSectionHeadings;
  }

  @Override
  public String name() {
    return "plain";
  }

  @Override
  public String toPlainText(String markdown) {
    if (markdown == null || markdown.isBlank()) return "";
    String text = markdown.replace("\r\n", "\n").replace('\r', '\n');

    List<String> codeBlocks = new ArrayList<>();
    text =
        FENCE
            .matcher(text)
            .replaceAll(
                m -> {
                  String body = m.group(2);
                  codeBlocks.add(
                      keepSectionHeadings ? MarkdownConverter.escapeSectionMarkers(body) : body);
                  return "\0CODE" + (codeBlocks.size() - 1) + "\0";
                });
    text =
        HEADING
            .matcher(text)
            .replaceAll(
                m -> {
                  String title = m.group(2);
                  if (keepSectionHeadings && m.group(1).length() >= 3) {
                    return Matcher.quoteReplacement(m.group(1) + " " + title);
                  }
                  return Matcher.quoteReplacement(title);
                });
    text = RULE.matcher(text).replaceAll("");
    text = IMAGE.matcher(text).replaceAll("$1");
    text = LINK.matcher(text).replaceAll("$1");
    text = BOLD.matcher(text).replaceAll("$2");
    text = ITALIC_STAR.matcher(text).replaceAll("$1");
    text = ITALIC_UNDERSCORE.matcher(text).replaceAll("$1");
    text = INLINE_CODE.matcher(text).replaceAll("$1");
    text = BULLET.matcher(text).replaceAll("");
    text = NUMBERED.matcher(text).replaceAll("");
    text = QUOTE.matcher(text).replaceAll("");
    text = HTML_TAG.matcher(text).replaceAll("");
    text =
        CODE_PLACEHOLDER
            .matcher(text)
            .replaceAll(
                m -> Matcher.quoteReplacement(codeBlocks.get(Integer.parseInt(m.group(1)))));

    return TextUtility.normalizeWhitespace(text);
  }
}
