package com.gentoro.docsearch.search;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KeywordScorerTest {

  @Test
  @DisplayName("Title hits outrank a single content mention")
  void titleDominates() {
    KeywordScorer scorer = new KeywordScorer("python testing", false);
    String padding = "x".repeat(150) + " ";

    KeywordScorer.Score guide =
        scorer.score("Python Testing Guide", padding + "python and testing, more testing");
    KeywordScorer.Score mention = scorer.score("Cooking Notes", padding + "a python appears");

    assertTrue(guide.score() > mention.score());
    assertEquals(2, guide.termMatches());
    assertEquals(1, mention.termMatches());
    // 0.1 content hit + 0.25 coverage
    assertEquals(0.35, mention.score(), 1e-9);
  }

  @Test
  @DisplayName("Early occurrences earn a bonus")
  void earlyBonus() {
    KeywordScorer scorer = new KeywordScorer("lucene", false);

    assertEquals(0.4, scorer.score(null, "lucene at the start").score(), 1e-9);
    assertEquals(0.1, scorer.score(null, "y".repeat(120) + " lucene").score(), 1e-9);
  }

  @Test
  @DisplayName("Coverage rewards matching more distinct terms")
  void coverage() {
    KeywordScorer scorer = new KeywordScorer("alpha beta gamma delta", false);
    String padding = "z".repeat(200) + " ";

    double one = scorer.score("", padding + "alpha").score();
    double two = scorer.score("", padding + "alpha beta").score();

    assertEquals(0.1 + 0.5 * 1 / 4, one, 1e-9);
    assertEquals(0.2 + 0.5 * 2 / 4, two, 1e-9);
  }

  @Test
  @DisplayName("Case sensitivity controls term matching")
  void caseSensitivity() {
    KeywordScorer insensitive = new KeywordScorer("Java", false);
    KeywordScorer sensitive = new KeywordScorer("Java", true);
    String content = "y".repeat(120) + " JAVA and java";

    assertEquals(0.2, insensitive.score(null, content).score(), 1e-9);
    assertEquals(0.0, sensitive.score(null, content).score(), 1e-9);
    assertEquals(0, sensitive.score(null, content).termMatches());
  }

  @Test
  @DisplayName("Scores are capped at one")
  void capped() {
    KeywordScorer scorer = new KeywordScorer("cache", false);
    assertEquals(1.0, scorer.score("Cache cache cache", "cache ".repeat(30)).score(), 1e-9);
  }

  @Test
  @DisplayName("Terms are split on whitespace, lowercased and de-duplicated")
  void terms() {
    assertEquals(List.of("foo", "bar"), KeywordScorer.terms("  Foo   BAR foo ", false));
    assertEquals(List.of("Foo", "foo"), KeywordScorer.terms("Foo foo", true));
    assertTrue(KeywordScorer.terms(" ", false).isEmpty());
  }
}
