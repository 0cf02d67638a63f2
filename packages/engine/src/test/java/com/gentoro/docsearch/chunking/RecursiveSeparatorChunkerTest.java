package com.gentoro.docsearch.chunking;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.segment.TextSegment;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecursiveSeparatorChunkerTest {

  @Mock DocumentSplitter splitter;

  private static RecursiveSeparatorChunker chunker(int size, int overlap, int min) {
    return new RecursiveSeparatorChunker(
        size, overlap, min, new SimpleWindowChunker(size, overlap, min));
  }

  @Test
  @DisplayName("Splits on paragraph breaks first and keeps exact offsets")
  void paragraphsFirst() {
    String p1 = "First paragraph talks about indexing documents for search ok.";
    String p2 = "Second paragraph explains how embeddings are computed in batch.";
    String p3 = "Third paragraph covers storage of vectors inside the index now.";
    String text = p1 + "\n\n" + p2 + "\n\n" + p3;

    List<TextSpan> spans = chunker(100, 0, 1).split(text);

    assertEquals(List.of(p1, p2, p3), spans.stream().map(TextSpan::content).toList());
    for (TextSpan span : spans) {
      assertEquals(text.substring(span.start(), span.end()), span.content());
    }
  }

  @Test
  @DisplayName("Falls back to character splitting for unbroken text")
  void characterFallback() {
    String text = "x".repeat(250);
    List<TextSpan> spans = chunker(100, 0, 1).split(text);

    assertTrue(spans.size() >= 3);
    assertTrue(spans.stream().allMatch(s -> s.length() <= 100));
    assertEquals(250, spans.stream().mapToInt(TextSpan::length).sum());
    assertEquals(0, spans.get(0).start());
    assertEquals(250, spans.get(spans.size() - 1).end());
  }

  @Test
  @DisplayName("Chunks respect the size bound and keep ordered offsets")
  void sizeBoundAndOrder() {
    String text = "alpha beta gamma delta epsilon zeta eta theta iota kappa lambda mu ".repeat(6);
    List<TextSpan> spans = chunker(80, 20, 1).split(text);

    assertTrue(spans.size() > 3);
    for (int i = 0; i < spans.size(); i++) {
      TextSpan span = spans.get(i);
      assertTrue(span.content().length() <= 80, "chunk longer than size: " + span.length());
      assertEquals(text.substring(span.start(), span.end()), span.content());
      if (i > 0) {
        assertTrue(span.start() > spans.get(i - 1).start());
      }
    }
  }

  @Test
  @DisplayName("Drops segments below the minimum chunk size")
  void dropsSmallPieces() {
    List<TextSpan> spans = chunker(50, 0, 5).split("Hi\n\n" + "y".repeat(80));

    assertFalse(spans.isEmpty());
    assertTrue(spans.stream().noneMatch(s -> s.content().contains("Hi")));
    assertTrue(spans.stream().allMatch(s -> s.content().matches("y+")));
  }

  @Test
  @DisplayName("Is deterministic")
  void deterministic() {
    String text = "One. Two, three four.\nFive six seven. Eight nine ten eleven twelve.".repeat(5);
    RecursiveSeparatorChunker chunker = chunker(60, 10, 1);
    assertEquals(chunker.split(text), chunker.split(text));
  }

  @Test
  @DisplayName("Segments re-joined with other whitespace map back to the source slice")
  void rejoinedSegmentsKeepSourceOffsets() {
    String text = "Intro line here.\n\nClosing words follow.";
    when(splitter.split(any(Document.class)))
        .thenReturn(List.of(TextSegment.from("Intro line here. Closing words follow.")));

    List<TextSpan> spans = new RecursiveSeparatorChunker(splitter, 0, 1, null).split(text);

    assertEquals(1, spans.size());
    assertEquals(0, spans.get(0).start());
    assertEquals(text.length(), spans.get(0).end());
    assertEquals(text, spans.get(0).content());
  }

  @Test
  @DisplayName("Segments missing from the source are placed at the cursor")
  void unknownSegmentPlacedAtCursor() {
    String text = "Known opening sentence. Something else entirely.";
    when(splitter.split(any(Document.class)))
        .thenReturn(
            List.of(
                TextSegment.from("Known opening sentence."),
                TextSegment.from("text that does not occur")));

    List<TextSpan> spans = new RecursiveSeparatorChunker(splitter, 0, 1, null).split(text);

    assertEquals(2, spans.size());
    assertEquals(23, spans.get(0).end());
    assertEquals(23, spans.get(1).start());
    assertEquals("text that does not occur", spans.get(1).content());
  }

  @Test
  @DisplayName("Uses the fallback strategy when the splitter fails")
  void fallbackOnSplitterFailure() {
    String text = "Some body text that should still be chunked. ".repeat(10);
    when(splitter.split(any(Document.class))).thenThrow(new IllegalStateException("no model"));
    SimpleWindowChunker fallback = new SimpleWindowChunker(100, 20, 1);

    List<TextSpan> spans = new RecursiveSeparatorChunker(splitter, 20, 1, fallback).split(text);

    assertEquals(fallback.split(text), spans);
    assertFalse(spans.isEmpty());
  }

  @Test
  @DisplayName("Rejects an overlap not smaller than the chunk size")
  void invalidSettings() {
    assertThrows(
        IllegalArgumentException.class, () -> new RecursiveSeparatorChunker(50, 50, 1, null));
  }
}
