package com.gentoro.docsearch.content;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docsearch.config.ContentSettings;
import com.gentoro.docsearch.content.markdown.FlexmarkMarkdownConverter;
import com.gentoro.docsearch.exception.ConfigException;
import com.gentoro.docsearch.exception.NotFoundException;
import com.gentoro.docsearch.exception.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentLoaderTest {

  @TempDir Path root;

  private ContentLoader loader;

  @BeforeEach
  void setUp() throws Exception {
    ContentFixtures.writeStandardCorpus(root);
    loader = new ContentLoader(ContentFixtures.settings(root), new FlexmarkMarkdownConverter(true));
  }

  @Test
  @DisplayName("Discovery lists complete document directories by category then slug")
  void discover() throws Exception {
    Files.createDirectories(root.resolve("blog").resolve("no-metadata"));
    Files.writeString(root.resolve("blog").resolve("no-metadata").resolve("body.md"), "text");
    Files.createDirectories(root.resolve("recipes").resolve("ignored"));

    List<DocumentLocation> locations = loader.discover();

    assertEquals(
        List.of(
            "blog/sourdough-basics", "blog/unfinished-thoughts", "engineering/kubernetes-autoscaling"),
        locations.stream().map(DocumentLocation::key).toList());
  }

  @Test
  @DisplayName("Drafts are excluded unless configured, archived documents always")
  void inclusionPolicy() throws Exception {
    ContentFixtures.writeDocument(
        root, "engineering", "old-post", "Old Post", "archived", ContentFixtures.KUBERNETES_BODY);

    LoadResult result = loader.loadAll();
    assertFalse(result.hasErrors());
    assertEquals(
        List.of("blog/sourdough-basics", "engineering/kubernetes-autoscaling"),
        result.documents().stream().map(Document::key).toList());

    ContentSettings withDrafts =
        new ContentSettings(
            root,
            List.of("blog", "engineering"),
            "body.md",
            "metadata.yaml",
            true,
            100,
            "https://example.com",
            ContentSettings.MarkdownParser.FLEXMARK);
    LoadResult drafts = new ContentLoader(withDrafts, new FlexmarkMarkdownConverter(true)).loadAll();
    assertEquals(3, drafts.documents().size());
  }

  @Test
  @DisplayName("Invalid documents are reported without aborting the load")
  void collectsErrors() throws Exception {
    String badStatus =
        ContentFixtures.metadata("blog", "bad-status", "Bad Status", "published")
            .replace("status: published", "status: pending");
    ContentFixtures.writeDocument(root, "blog", "bad-status", badStatus, ContentFixtures.DRAFT_BODY);
    ContentFixtures.writeDocument(
        root,
        "blog",
        "wrong-category",
        ContentFixtures.metadata("engineering", "wrong-category", "Wrong", "published"),
        ContentFixtures.DRAFT_BODY);
    ContentFixtures.writeDocument(root, "blog", "tiny", "Tiny", "published", "# Tiny\n\nToo short.");

    LoadResult result = loader.loadAll();

    assertEquals(2, result.documents().size());
    assertEquals(3, result.errors().size());
    assertTrue(result.errors().stream().anyMatch(e -> e.contains("pending")));
    assertTrue(result.errors().stream().anyMatch(e -> e.contains("does not match")));
    assertTrue(result.errors().stream().anyMatch(e -> e.contains("Content too short")));
  }

  @Test
  @DisplayName("Metadata with missing required fields is rejected")
  void missingFields() throws Exception {
    ContentFixtures.writeDocument(
        root, "blog", "partial", "title: Partial\nslug: partial\ncategory: blog\n", "body");

    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> loader.loadMetadata(new DocumentLocation("blog", "partial", root.resolve("blog/partial"))));
    assertTrue(e.getMessage().contains("author"));
    assertTrue(e.getMessage().contains("word_count"));
  }

  @Test
  @DisplayName("Loaded documents carry typed metadata, extras and processed text")
  void loadsDocument() {
    Document document = loader.loadOne("blog", "sourdough-basics");

    assertEquals("blog/sourdough-basics", document.key());
    assertEquals("Sourdough Basics", document.title());
    assertEquals(DocumentStatus.PUBLISHED, document.metadata().status());
    assertEquals(List.of("testing", "blog"), document.metadata().tags());
    assertEquals(3, document.metadata().readingTime());
    assertEquals("intermediate", document.metadata().difficultyLevel());
    assertTrue(document.metadata().hasCode());
    assertFalse(document.metadata().hasMath());
    assertEquals(List.of("other-post"), document.metadata().relatedPosts());
    assertTrue(document.metadata().extras().containsKey("seo"));
    assertEquals(
        "https://fromfirstprinciples.com/blog/sourdough-basics",
        document.metadata().canonicalUrl(loader.settings().baseUrl()));
    assertTrue(document.processedContent().contains("### Feeding the starter"));
    assertFalse(document.processedContent().contains("# Sourdough"));
    assertEquals(64, document.contentHash().length());
    assertTrue(document.fileSizeBytes() > 0);
  }

  @Test
  @DisplayName("Loading one document ignores its status")
  void loadOneDraft() {
    Document draft = loader.loadOne("blog", "unfinished-thoughts");
    assertEquals(DocumentStatus.DRAFT, draft.metadata().status());
  }

  @Test
  @DisplayName("Loading one document validates category and existence")
  void loadOneErrors() {
    assertThrows(NotFoundException.class, () -> loader.loadOne("blog", "missing"));
    assertThrows(ValidationException.class, () -> loader.loadOne("recipes", "sourdough-basics"));
    assertThrows(ValidationException.class, () -> loader.loadOne("blog", "../engineering"));
  }

  @Test
  @DisplayName("Content hash changes when the markdown changes")
  void hashTracksContent() throws Exception {
    String before = loader.loadOne("blog", "sourdough-basics").contentHash();
    assertEquals(before, loader.loadOne("blog", "sourdough-basics").contentHash());

    Files.writeString(
        root.resolve("blog/sourdough-basics/body.md"),
        ContentFixtures.SOURDOUGH_BODY + "\nOne more paragraph about rye flour.\n");

    assertNotEquals(before, loader.loadOne("blog", "sourdough-basics").contentHash());
  }

  @Test
  @DisplayName("Content statistics count every status and measure published text")
  void contentStats() {
    ContentStats stats = loader.contentStats();

    assertEquals(3, stats.totalDocuments());
    assertEquals(2, stats.documentsByCategory().get("blog"));
    assertEquals(1, stats.documentsByCategory().get("engineering"));
    assertEquals(2, stats.documentsByStatus().get("published"));
    assertEquals(1, stats.documentsByStatus().get("draft"));
    assertTrue(stats.totalContentLength() > 0);
    assertEquals(stats.totalContentLength() / 2.0, stats.averageContentLength(), 1e-9);
    assertTrue(stats.failedDirectories().isEmpty());
  }

  @Test
  @DisplayName("A missing content root is a configuration error")
  void missingRoot() {
    assertThrows(
        ConfigException.class,
        () ->
            new ContentLoader(
                ContentFixtures.settings(root.resolve("nope")), new FlexmarkMarkdownConverter(false)));
  }
}
