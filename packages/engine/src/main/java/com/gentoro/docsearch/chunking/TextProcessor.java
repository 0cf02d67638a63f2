package com.gentoro.docsearch.chunking;

import com.gentoro.docsearch.config.ChunkingSettings;
import com.gentoro.docsearch.utility.TextUtility;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cleans document text and cuts it into chunks with the configured {@link ChunkingStrategy}.
 *
 * <p>Chunking is deterministic: the same text and settings always produce the same chunk ids,
 * boundaries and order.
 */
public class TextProcessor {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(TextProcessor.class);

  static final int WORDS_PER_MINUTE = 200;
  private static final Pattern KEYWORD = Pattern.compile("\\b[a-zA-Z]{3,}\\b");
  private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
          "is", "are", "was", "were", "be", "been", "have", "has", "had", "do", "does", "did",
          "will", "would", "could", "should", "may", "might", "must", "can", "this", "that",
          "these", "those", "i", "you", "he", "she", "it", "we", "they", "me", "him", "her", "us",
          "them");

  private final ChunkingSettings settings;
  private final ChunkingStrategy strategy;

  public TextProcessor(ChunkingSettings settings) {
    this(settings, ChunkingStrategy.create(settings));
  }

  public TextProcessor(ChunkingSettings settings, ChunkingStrategy strategy) {
    this.settings = settings;
    this.strategy = strategy;
    log.debug(
        "Text processor using '{}' chunking (size={}, overlap={}, min={})",
        strategy.name(),
        settings.chunkSize(),
        settings.chunkOverlap(),
        settings.minChunkSize());
  }

  public ChunkingSettings settings() {
    return settings;
  }

  public ChunkingStrategy strategy() {
    return strategy;
  }

  /**
   * Identifies the chunk boundaries this processor produces: strategy and sizes. Documents indexed
   * under a different fingerprint must be re-chunked.
   */
  public String fingerprint() {
    return "%s:%d:%d:%d"
        .formatted(
            strategy.name(),
            settings.chunkSize(),
            settings.chunkOverlap(),
            settings.minChunkSize());
  }

  /** Normalizes whitespace while keeping line and paragraph structure. */
  public String cleanText(String text) {
    return TextUtility.normalizeWhitespace(text);
  }

  /**
   * Cuts {@code text} into ordered chunks. Offsets refer to the cleaned text.
   *
   * @return chunks with {@code chunkIndex} equal to their list position
   */
  public List<Chunk> chunk(String text, String slug, String category) {
    if (text == null || text.isBlank()) return List.of();
    String cleaned = cleanText(text);
    List<TextSpan> spans = strategy.split(cleaned);

    Instant now = Instant.now();
    List<Chunk> chunks = new ArrayList<>(spans.size());
    for (TextSpan span : spans) {
      int index = chunks.size();
      chunks.add(
          new Chunk(
              Chunk.idFor(category, slug, index),
              slug,
              category,
              span.content(),
              index,
              span.start(),
              span.end(),
              TextUtility.wordCount(span.content()),
              span.content().length(),
              span.sectionTitle(),
              now));
    }
    log.trace("Chunked {}/{} into {} chunks", category, slug, chunks.size());
    return chunks;
  }

  /** Estimated reading time in minutes, at least one for non-empty text. */
  public int estimateReadingTime(String text) {
    int words = TextUtility.wordCount(text);
    if (words == 0) return 0;
    return Math.max(1, (int) Math.round(words / (double) WORDS_PER_MINUTE));
  }

  /** Most frequent words of three or more letters, stop words excluded. Ties keep first use. */
  public List<String> extractKeywords(String text, int maxKeywords) {
    if (text == null || text.isBlank()) return List.of();
    Map<String, Integer> frequency = new LinkedHashMap<>();
    Matcher m = KEYWORD.matcher(text.toLowerCase(Locale.ROOT));
    while (m.find()) {
      String word = m.group();
      if (!STOP_WORDS.contains(word)) {
        frequency.merge(word, 1, Integer::sum);
      }
    }
    return frequency.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(maxKeywords)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  public TextStats textStats(String text) {
    if (text == null || text.isEmpty()) return TextStats.EMPTY;
    int words = TextUtility.wordCount(text);
    int paragraphs =
        (int) Arrays.stream(text.split("\n\n")).filter(p -> !p.isBlank()).count();
    int sentences =
        (int) Arrays.stream(SENTENCE_SPLIT.split(text)).filter(s -> !s.isBlank()).count();
    double avgSentence = sentences > 0 ? (double) words / sentences : 0.0;
    return new TextStats(
        text.length(), words, paragraphs, sentences, avgSentence, estimateReadingTime(text));
  }
}
