package com.gentoro.docsearch.content;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.docsearch.config.ContentSettings;
import com.gentoro.docsearch.content.markdown.MarkdownConverter;
import com.gentoro.docsearch.exception.ConfigException;
import com.gentoro.docsearch.exception.DocSearchException;
import com.gentoro.docsearch.exception.ExceptionUtil;
import com.gentoro.docsearch.exception.IoException;
import com.gentoro.docsearch.exception.NotFoundException;
import com.gentoro.docsearch.exception.SerializationException;
import com.gentoro.docsearch.exception.ValidationException;
import com.gentoro.docsearch.utility.FileUtility;
import com.gentoro.docsearch.utility.HashUtility;
import com.gentoro.docsearch.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Discovers and loads documents from a two-level content tree.
 *
 * <p>Layout: {@code <root>/<category>/<slug>/} containing both the markdown file and the metadata
 * descriptor named in {@link ContentSettings}. Directories missing either file are not documents
 * and are skipped without error. Only the categories listed in the settings are scanned.
 */
public class ContentLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(ContentLoader.class);

  private final ContentSettings settings;
  private final MarkdownConverter converter;

  public ContentLoader(ContentSettings settings, MarkdownConverter converter) {
    this.settings = settings;
    this.converter = converter;
    if (!Files.isDirectory(settings.root())) {
      throw new ConfigException("Content root does not exist: " + settings.root().toAbsolutePath());
    }
    log.debug(
        "Content loader ready: root={}, categories={}, parser={}",
        settings.root(),
        settings.categories(),
        converter.name());
  }

  public ContentSettings settings() {
    return settings;
  }

  /** Lists document directories in category order, then by slug. */
  public List<DocumentLocation> discover() {
    List<DocumentLocation> locations = new ArrayList<>();
    for (String category : settings.categories()) {
      Path categoryPath = settings.root().resolve(category);
      if (!Files.isDirectory(categoryPath)) {
        log.debug("Category directory {} not present, skipping", categoryPath);
        continue;
      }
      try (Stream<Path> children = Files.list(categoryPath)) {
        children
            .filter(Files::isDirectory)
            .sorted(Comparator.comparing(p -> p.getFileName().toString()))
            .filter(this::hasRequiredFiles)
            .forEach(
                dir ->
                    locations.add(
                        new DocumentLocation(category, dir.getFileName().toString(), dir)));
      } catch (IOException e) {
        throw new IoException("Failed to list category directory: " + categoryPath, e);
      }
    }
    log.debug("Discovered {} document directories under {}", locations.size(), settings.root());
    return locations;
  }

  private boolean hasRequiredFiles(Path dir) {
    boolean present =
        Files.isRegularFile(dir.resolve(settings.markdownFile()))
            && Files.isRegularFile(dir.resolve(settings.metadataFile()));
    if (!present) {
      log.trace("Skipping {}: markdown or metadata file missing", dir);
    }
    return present;
  }

  /**
   * Parses and validates the metadata descriptor of a document.
   *
   * @throws SerializationException when the descriptor is not a YAML mapping
   * @throws ValidationException when a field is missing or outside its closed set of values
   */
  public ContentMetadata loadMetadata(DocumentLocation location) {
    Path metadataFile = location.directory().resolve(settings.metadataFile());
    Map<String, Object> raw;
    try {
      raw =
          JacksonUtility.getYamlMapper()
              .readValue(
                  metadataFile.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
    } catch (IOException e) {
      throw new SerializationException("Invalid YAML in metadata file: " + metadataFile, e);
    }
    if (raw == null) {
      throw new SerializationException("Metadata file is empty: " + metadataFile);
    }
    raw.values().removeIf(Objects::isNull);
    return ContentMetadata.fromMap(raw, settings.categories());
  }

  /**
   * Loads a document: metadata, raw markdown and its plain-text rendition.
   *
   * @throws ValidationException when the metadata category disagrees with the directory or the
   *     processed text is shorter than the configured minimum
   */
  public Document loadDocument(DocumentLocation location) {
    ContentMetadata metadata = loadMetadata(location);
    return loadDocument(location, metadata);
  }

  private Document loadDocument(DocumentLocation location, ContentMetadata metadata) {
    if (!metadata.category().equals(location.category())) {
      throw new ValidationException(
          "Metadata category '%s' does not match directory category '%s'"
              .formatted(metadata.category(), location.category()),
          Map.of("directory", location.directory().toString()));
    }

    Path markdownFile = location.directory().resolve(settings.markdownFile());
    String raw = FileUtility.readString(markdownFile);
    if (raw.isBlank()) {
      throw new ValidationException("Content cannot be empty: " + markdownFile);
    }

    String processed;
    try {
      processed = converter.toPlainText(raw);
    } catch (RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new ValidationException("Error processing markdown: " + markdownFile, ex));
    }
    if (processed.length() < settings.minContentLength()) {
      throw new ValidationException(
          "Content too short: %d characters (minimum: %d)"
              .formatted(processed.length(), settings.minContentLength()),
          Map.of("document", location.key()));
    }

    long size;
    Instant modified;
    try {
      size = Files.size(markdownFile);
      modified = Files.getLastModifiedTime(markdownFile).toInstant();
    } catch (IOException e) {
      throw new IoException("Failed to stat markdown file: " + markdownFile, e);
    }

    String contentHash = HashUtility.sha256(raw + JacksonUtility.toJson(metadata));
    return new Document(
        metadata, location.directory(), raw, processed, contentHash, size, modified, List.of());
  }

  /** Inclusion policy: archived documents never, drafts only when configured. */
  public boolean shouldInclude(ContentMetadata metadata) {
    return switch (metadata.status()) {
      case ARCHIVED -> false;
      case DRAFT -> settings.includeDrafts();
      case PUBLISHED -> true;
    };
  }

  /**
   * Loads every included document. Failures are collected per document and never thrown, so the
   * result always holds the successfully loaded subset.
   */
  public LoadResult loadAll() {
    List<Document> documents = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    for (DocumentLocation location : discover()) {
      try {
        ContentMetadata metadata = loadMetadata(location);
        if (!shouldInclude(metadata)) {
          log.debug("Excluding {} with status {}", location.key(), metadata.status().value());
          continue;
        }
        documents.add(loadDocument(location, metadata));
      } catch (DocSearchException e) {
        String message =
            "Error loading document from %s: %s".formatted(location.directory(), e.getMessage());
        log.warn(message);
        errors.add(message);
      }
    }
    if (!errors.isEmpty()) {
      log.warn("Encountered {} errors while loading documents", errors.size());
    }
    log.info("Loaded {} documents from {}", documents.size(), settings.root());
    return new LoadResult(documents, errors);
  }

  /**
   * Loads one document by category and slug, regardless of its status.
   *
   * @throws NotFoundException when no document directory exists for the pair
   */
  public Document loadOne(String category, String slug) {
    if (!settings.isSupportedCategory(category)) {
      throw new ValidationException(
          "Category must be one of " + settings.categories() + ", got '" + category + "'");
    }
    if (slug == null || slug.isBlank() || slug.contains("/") || slug.contains("..")) {
      throw new ValidationException("Invalid slug '" + slug + "'");
    }
    Path dir = settings.root().resolve(category).resolve(slug);
    if (!Files.isDirectory(dir) || !hasRequiredFiles(dir)) {
      throw new NotFoundException("Document not found: " + category + "/" + slug);
    }
    return loadDocument(new DocumentLocation(category, slug, dir));
  }

  /** Collection statistics; content length is measured on published documents only. */
  public ContentStats contentStats() {
    int total = 0;
    Map<String, Integer> byCategory = new TreeMap<>();
    Map<String, Integer> byStatus = new TreeMap<>();
    long totalLength = 0;
    List<String> failed = new ArrayList<>();

    for (DocumentLocation location : discover()) {
      try {
        ContentMetadata metadata = loadMetadata(location);
        total++;
        byCategory.merge(metadata.category(), 1, Integer::sum);
        byStatus.merge(metadata.status().value(), 1, Integer::sum);
        if (metadata.status() == DocumentStatus.PUBLISHED) {
          totalLength += loadDocument(location, metadata).processedContent().length();
        }
      } catch (DocSearchException e) {
        log.debug("Content stats: failed to load {}: {}", location.directory(), e.getMessage());
        failed.add(location.directory().toString());
      }
    }
    int published = byStatus.getOrDefault(DocumentStatus.PUBLISHED.value(), 0);
    double average = published > 0 ? (double) totalLength / published : 0.0;
    return new ContentStats(total, byCategory, byStatus, totalLength, average, failed);
  }
}
