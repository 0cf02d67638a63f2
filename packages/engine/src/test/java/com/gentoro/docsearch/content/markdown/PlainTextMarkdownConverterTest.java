package com.gentoro.docsearch.content.markdown;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docsearch.config.ContentSettings;
import com.gentoro.docsearch.chunking.SectionAwareChunker;
import com.gentoro.docsearch.chunking.SimpleWindowChunker;
import com.gentoro.docsearch.chunking.TextSpan;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlainTextMarkdownConverterTest {

  @Test
  @DisplayName("Emphasis, links, images and inline code are reduced to text")
  void inlineMarkup() {
    String text =
        new PlainTextMarkdownConverter(false)
            .toPlainText("Use **bold**, _soft_ and [docs](http://x.io) with `run()` ![logo](l.png)");

    assertEquals("Use bold, soft and docs with run() logo", text);
  }

  @Test
  @DisplayName("List markers and quotes are removed line by line")
  void listsAndQuotes() {
    String text = new PlainTextMarkdownConverter(false).toPlainText("- one\n* two\n1. three\n> quoted");

    assertEquals("one\ntwo\nthree\nquoted", text);
  }

  @Test
  @DisplayName("Fenced code keeps its content without the fence")
  void fencedCode() {
    String text = new PlainTextMarkdownConverter(false).toPlainText("```\nprint(1)\n```\n");

    assertEquals("print(1)", text);
  }

  @Test
  @DisplayName("Headings keep their marker only for deep levels when requested")
  void headings() {
    String markdown = "# Top\n\n### Deep\n\nbody";

    assertEquals("Top\n\n### Deep\n\nbody", new PlainTextMarkdownConverter(true).toPlainText(markdown));
    assertEquals("Top\n\nDeep\n\nbody", new PlainTextMarkdownConverter(false).toPlainText(markdown));
  }

  @Test
  @DisplayName("Factory picks the converter by parser name")
  void factory() {
    assertEquals(
        "plain", MarkdownConverter.create(ContentSettings.MarkdownParser.PLAIN, false).name());
    assertEquals(
        "flexmark", MarkdownConverter.create(ContentSettings.MarkdownParser.FLEXMARK, true).name());
  }

  @Test
  @DisplayName("Heading-like lines inside code never open a section")
  void codeCommentsAreNotSections() {
    String markdown =
        "### Setup\n\nInstall the toolchain first.\n\n```bash\n### install deps\npip install foo\n```"
            + "\n\nAfter that the setup is complete.\n";

    String text = new PlainTextMarkdownConverter(true).toPlainText(markdown);

    assertTrue(text.contains("\\### install deps\npip install foo"), text);
    List<TextSpan> spans =
        new SectionAwareChunker(1000, new SimpleWindowChunker(1000, 200, 1)).split(text);
    assertEquals(1, spans.size());
    assertEquals("Setup", spans.get(0).sectionTitle());
    assertTrue(spans.get(0).content().contains("install deps"));
    assertTrue(spans.get(0).content().endsWith("After that the setup is complete."));
  }
}
