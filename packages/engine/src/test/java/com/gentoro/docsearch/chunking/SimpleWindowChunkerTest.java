package com.gentoro.docsearch.chunking;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimpleWindowChunkerTest {

  @Test
  @DisplayName("Windows without natural breaks advance by size minus overlap")
  void plainWindows() {
    String text = "word ".repeat(50); // 250 chars
    List<TextSpan> spans = new SimpleWindowChunker(100, 20, 10).split(text);

    assertEquals(3, spans.size());
    assertEquals(0, spans.get(0).start());
    assertEquals(80, spans.get(1).start());
    assertEquals(160, spans.get(2).start());
    for (TextSpan span : spans) {
      assertTrue(span.length() <= 100);
      assertEquals(text.substring(span.start(), span.end()), span.content());
    }
  }

  @Test
  @DisplayName("Pulls the window edge back to the last sentence end")
  void sentenceBoundary() {
    String text = "a".repeat(59) + ". " + "b".repeat(80);
    List<TextSpan> spans = new SimpleWindowChunker(100, 10, 1).split(text);

    assertEquals(2, spans.size());
    assertEquals(60, spans.get(0).length());
    assertTrue(spans.get(0).content().endsWith("."));
    assertEquals(50, spans.get(1).start(), "Next window restarts overlap chars before the edge");
    assertEquals(text.length(), spans.get(1).end());
  }

  @Test
  @DisplayName("Falls back to a paragraph break when no sentence end is in range")
  void paragraphBoundary() {
    String text = "x".repeat(70) + "\n\n" + "y".repeat(70);
    List<TextSpan> spans = new SimpleWindowChunker(100, 0, 1).split(text);

    assertEquals(2, spans.size());
    assertEquals("x".repeat(70), spans.get(0).content());
    assertEquals("y".repeat(70), spans.get(1).content());
  }

  @Test
  @DisplayName("Drops windows shorter than the minimum chunk size")
  void dropsTinyWindows() {
    assertTrue(new SimpleWindowChunker(50, 0, 20).split("Tiny.").isEmpty());
    assertTrue(new SimpleWindowChunker(50, 0, 20).split("").isEmpty());
  }

  @Test
  @DisplayName("Covers the text with ordered, bounded, overlapping chunks")
  void coverageAndOrdering() {
    String text =
        IntStream.range(0, 40)
            .mapToObj(i -> "Sentence number " + i + " talks about chunking.")
            .collect(Collectors.joining(" "));
    List<TextSpan> spans = new SimpleWindowChunker(200, 50, 20).split(text);

    assertTrue(spans.size() > 5);
    assertEquals(0, spans.get(0).start());
    assertEquals(text.length(), spans.get(spans.size() - 1).end());
    for (int i = 1; i < spans.size(); i++) {
      TextSpan prev = spans.get(i - 1);
      TextSpan next = spans.get(i);
      assertTrue(next.start() > prev.start(), "starts must increase");
      assertTrue(next.start() <= prev.end(), "no gap between consecutive chunks");
      assertTrue(next.length() <= 200);
    }
  }

  @Test
  @DisplayName("Rejects an overlap that is not smaller than the window")
  void invalidOverlap() {
    assertThrows(IllegalArgumentException.class, () -> new SimpleWindowChunker(100, 100, 0));
  }
}
