package com.gentoro.docsearch.chunking;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SectionAwareChunkerTest {

  private final SectionAwareChunker chunker =
      new SectionAwareChunker(1000, new SimpleWindowChunker(1000, 200, 10));

  @Test
  @DisplayName("Each small section becomes one chunk tagged with its title")
  void oneChunkPerSection() {
    String text =
        "Intro paragraph that is long enough.\n"
            + "### Setup\n"
            + "Install the tools.\n"
            + "### Usage\n"
            + "Run the command.";

    List<TextSpan> spans = chunker.split(text);

    assertEquals(3, spans.size());
    assertEquals(SectionAwareChunker.DEFAULT_SECTION_TITLE, spans.get(0).sectionTitle());
    assertEquals("Intro paragraph that is long enough.", spans.get(0).content());
    assertEquals("Setup", spans.get(1).sectionTitle());
    assertEquals("Install the tools.", spans.get(1).content());
    assertEquals("Usage", spans.get(2).sectionTitle());
    assertEquals("Run the command.", spans.get(2).content());
    for (TextSpan span : spans) {
      assertEquals(text.substring(span.start(), span.end()), span.content());
    }
  }

  @Test
  @DisplayName("Oversized sections are windowed and every piece keeps the title")
  void oversizedSection() {
    String body = "This sentence fills the big section with words. ".repeat(10).strip();
    String text = "### Big\n" + body;
    SectionAwareChunker small = new SectionAwareChunker(100, new SimpleWindowChunker(100, 20, 10));

    List<TextSpan> spans = small.split(text);

    assertTrue(spans.size() > 1);
    for (TextSpan span : spans) {
      assertEquals("Big", span.sectionTitle());
      assertTrue(span.length() <= 100);
      assertFalse(span.content().contains("###"));
    }
  }

  @Test
  @DisplayName("Headings above level three do not start sections")
  void shallowHeadingsIgnored() {
    List<TextSpan> spans = chunker.split("## Not a section\nBody text here.");

    assertEquals(1, spans.size());
    assertEquals(SectionAwareChunker.DEFAULT_SECTION_TITLE, spans.get(0).sectionTitle());
    assertTrue(spans.get(0).content().startsWith("## Not a section"));
  }

  @Test
  @DisplayName("Empty sections between consecutive headings produce no chunks")
  void emptySections() {
    List<TextSpan> spans = chunker.split("### One\n### Two\nOnly the second has text.");

    assertEquals(1, spans.size());
    assertEquals("Two", spans.get(0).sectionTitle());
  }
}
