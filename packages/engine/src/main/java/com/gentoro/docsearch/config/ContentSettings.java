package com.gentoro.docsearch.config;

import com.gentoro.docsearch.exception.ConfigException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Content tree layout and document inclusion policy.
 *
 * <p>Documents live under {@code <root>/<category>/<slug>/} with a markdown file and a metadata
 * descriptor side by side.
 */
public record ContentSettings(
    Path root,
    List<String> categories,
    String markdownFile,
    String metadataFile,
    boolean includeDrafts,
    int minContentLength,
    String baseUrl,
    MarkdownParser markdownParser) {

  public enum MarkdownParser {
    FLEXMARK,
    PLAIN;

    public static MarkdownParser parse(String value) {
      try {
        return MarkdownParser.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Unknown content.markdownParser '" + value + "'", e);
      }
    }
  }

  public ContentSettings {
    if (root == null) {
      throw new ConfigException("content.root must be set");
    }
    if (categories == null || categories.isEmpty()) {
      throw new ConfigException("content.categories must list at least one category");
    }
    categories = List.copyOf(categories);
    if (markdownFile == null || markdownFile.isBlank()) {
      throw new ConfigException("content.markdownFile must not be blank");
    }
    if (metadataFile == null || metadataFile.isBlank()) {
      throw new ConfigException("content.metadataFile must not be blank");
    }
    if (minContentLength < 0) {
      throw new ConfigException("content.minContentLength must be >= 0");
    }
    if (baseUrl == null) {
      baseUrl = "";
    }
    while (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    if (markdownParser == null) {
      markdownParser = MarkdownParser.FLEXMARK;
    }
  }

  public static ContentSettings defaults() {
    return new ContentSettings(
        Path.of("./data/content"),
        List.of("blog", "engineering"),
        "body.md",
        "metadata.yaml",
        false,
        100,
        "https://fromfirstprinciples.com",
        MarkdownParser.FLEXMARK);
  }

  public ContentSettings withRoot(Path newRoot) {
    return new ContentSettings(
        newRoot,
        categories,
        markdownFile,
        metadataFile,
        includeDrafts,
        minContentLength,
        baseUrl,
        markdownParser);
  }

  public boolean isSupportedCategory(String category) {
    return category != null && categories.contains(category);
  }
}
