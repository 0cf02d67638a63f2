package com.gentoro.docsearch.content;

import com.gentoro.docsearch.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of a document's metadata descriptor.
 *
 * <p>Required fields are validated on construction through {@link #fromMap(Map, List)}. Any key
 * outside the typed set (for example {@code seo}, {@code social}, {@code content} or {@code
 * technical}) is kept verbatim in {@link #extras()}.
 */
public record ContentMetadata(
    String title,
    String slug,
    String author,
    String authorUrl,
    String publishDate,
    String lastModified,
    String category,
    List<String> tags,
    String description,
    String excerpt,
    int readingTime,
    int wordCount,
    boolean featured,
    DocumentStatus status,
    Map<String, Object> extras) {

  public static final List<String> REQUIRED_FIELDS =
      List.of(
          "title",
          "slug",
          "author",
          "publish_date",
          "last_modified",
          "category",
          "description",
          "excerpt",
          "reading_time",
          "word_count");

  private static final Set<String> TYPED_FIELDS =
      Set.of(
          "title",
          "slug",
          "author",
          "author_url",
          "publish_date",
          "last_modified",
          "category",
          "tags",
          "description",
          "excerpt",
          "reading_time",
          "word_count",
          "featured",
          "status");

  public ContentMetadata {
    tags = tags == null ? List.of() : List.copyOf(tags);
    extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    if (status == null) {
      status = DocumentStatus.PUBLISHED;
    }
  }

  /**
   * Builds metadata from a parsed descriptor.
   *
   * @param raw key/value pairs as read from the descriptor
   * @param allowedCategories closed set of supported categories
   * @throws ValidationException when a required field is missing, a value has the wrong type, or
   *     the category or status is not in its closed set
   */
  public static ContentMetadata fromMap(Map<String, Object> raw, List<String> allowedCategories) {
    if (raw == null || raw.isEmpty()) {
      throw new ValidationException("Metadata descriptor is empty");
    }
    List<String> missing = new ArrayList<>();
    for (String field : REQUIRED_FIELDS) {
      Object value = raw.get(field);
      if (value == null || (value instanceof String s && s.isBlank())) {
        missing.add(field);
      }
    }
    if (!missing.isEmpty()) {
      throw new ValidationException(
          "Missing required metadata fields: " + missing, Map.of("missing", missing));
    }

    String category = string(raw, "category");
    if (!allowedCategories.contains(category)) {
      throw new ValidationException(
          "Category must be one of " + allowedCategories + ", got '" + category + "'");
    }

    Map<String, Object> extras = new LinkedHashMap<>();
    raw.forEach(
        (k, v) -> {
          if (!TYPED_FIELDS.contains(k)) extras.put(k, v);
        });

    return new ContentMetadata(
        string(raw, "title"),
        string(raw, "slug"),
        string(raw, "author"),
        raw.get("author_url") == null ? null : string(raw, "author_url"),
        string(raw, "publish_date"),
        string(raw, "last_modified"),
        category,
        stringList(raw.get("tags")),
        string(raw, "description"),
        string(raw, "excerpt"),
        integer(raw, "reading_time"),
        integer(raw, "word_count"),
        bool(raw.get("featured")),
        DocumentStatus.parse(raw.get("status") == null ? null : string(raw, "status")),
        extras);
  }

  public String canonicalUrl(String baseUrl) {
    return baseUrl + "/" + category + "/" + slug;
  }

  public boolean hasMath() {
    return bool(contentSection().get("has_math"));
  }

  public boolean hasCode() {
    return bool(contentSection().get("has_code"));
  }

  public String difficultyLevel() {
    Object level = contentSection().get("difficulty_level");
    return level == null ? "beginner" : level.toString();
  }

  public List<String> relatedPosts() {
    return stringList(contentSection().get("related_posts"));
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> contentSection() {
    Object section = extras.get("content");
    return section instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
  }

  private static String string(Map<String, Object> raw, String key) {
    Object value = raw.get(key);
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      throw new ValidationException("Metadata field '" + key + "' must be a scalar value");
    }
    return String.valueOf(value).trim();
  }

  private static int integer(Map<String, Object> raw, String key) {
    Object value = raw.get(key);
    if (value instanceof Number n) {
      return n.intValue();
    }
    try {
      return Integer.parseInt(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new ValidationException(
          "Metadata field '" + key + "' must be an integer, got '" + value + "'", e);
    }
  }

  private static boolean bool(Object value) {
    if (value instanceof Boolean b) return b;
    return value != null && Boolean.parseBoolean(value.toString().trim());
  }

  private static List<String> stringList(Object value) {
    if (value == null) return List.of();
    if (value instanceof List<?> list) {
      List<String> out = new ArrayList<>(list.size());
      for (Object item : list) {
        if (item != null) out.add(item.toString().trim());
      }
      return out;
    }
    throw new ValidationException("Expected a list but got '" + value + "'");
  }
}
