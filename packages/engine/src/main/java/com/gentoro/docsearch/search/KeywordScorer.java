package com.gentoro.docsearch.search;

import com.gentoro.docsearch.utility.TextUtility;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Explainable term-frequency scoring for keyword search.
 *
 * <p>Per matched term: 0.1 for every occurrence in the content, 0.3 when the first occurrence
 * falls within the first 100 characters, 0.5 for every occurrence in the title. Multi-term queries
 * add {@code 0.5 * matchedTerms / terms}. The total is capped at 1.0.
 */
public final class KeywordScorer {
  static final double CONTENT_WEIGHT = 0.1;
  static final double EARLY_BONUS = 0.3;
  static final int EARLY_WINDOW = 100;
  static final double TITLE_WEIGHT = 0.5;
  static final double COVERAGE_WEIGHT = 0.5;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Score of one candidate and the number of distinct terms it matched. */
  public record Score(double score, int termMatches) {}

  private final List<String> terms;
  private final boolean caseSensitive;

  public KeywordScorer(String query, boolean caseSensitive) {
    this.caseSensitive = caseSensitive;
    this.terms = terms(query, caseSensitive);
  }

  /** Whitespace-separated terms, lowercased unless case sensitive, de-duplicated in order. */
  public static List<String> terms(String query, boolean caseSensitive) {
    if (query == null || query.isBlank()) return List.of();
    Set<String> unique = new LinkedHashSet<>();
    for (String term : WHITESPACE.split(query.strip())) {
      if (!term.isEmpty()) {
        unique.add(caseSensitive ? term : term.toLowerCase(Locale.ROOT));
      }
    }
    return new ArrayList<>(unique);
  }

  public List<String> terms() {
    return List.copyOf(terms);
  }

  public Score score(String title, String content) {
    String body = normalize(content);
    String heading = normalize(title);
    double score = 0.0;
    int matched = 0;
    for (String term : terms) {
      int contentHits = TextUtility.countOccurrences(body, term);
      int titleHits = TextUtility.countOccurrences(heading, term);
      if (contentHits > 0) {
        score += CONTENT_WEIGHT * contentHits;
        int first = body.indexOf(term);
        if (first < EARLY_WINDOW) {
          score += EARLY_BONUS;
        }
      }
      score += TITLE_WEIGHT * titleHits;
      if (contentHits > 0 || titleHits > 0) {
        matched++;
      }
    }
    if (terms.size() > 1 && matched > 0) {
      score += COVERAGE_WEIGHT * matched / terms.size();
    }
    return new Score(Math.min(1.0, score), matched);
  }

  private String normalize(String text) {
    if (text == null) return "";
    return caseSensitive ? text : text.toLowerCase(Locale.ROOT);
  }
}
