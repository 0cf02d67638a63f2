package com.gentoro.docsearch.indexing;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.docsearch.chunking.TextProcessor;
import com.gentoro.docsearch.config.EngineSettings;
import com.gentoro.docsearch.content.ContentFixtures;
import com.gentoro.docsearch.content.ContentLoader;
import com.gentoro.docsearch.content.markdown.FlexmarkMarkdownConverter;
import com.gentoro.docsearch.embedding.EmbeddingGenerator;
import com.gentoro.docsearch.embedding.HashingEmbeddingModel;
import com.gentoro.docsearch.exception.IoException;
import com.gentoro.docsearch.exception.StoreUnavailableException;
import com.gentoro.docsearch.search.SearchRequest;
import com.gentoro.docsearch.store.Predicate;
import com.gentoro.docsearch.store.VectorStore;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IndexingPipelineStoreFailureTest {

  @TempDir Path workspace;
  @Mock VectorStore store;

  private EngineSettings settings;
  private EmbeddingGenerator embedder;

  @BeforeEach
  void setUp() throws Exception {
    settings = PipelineFixtures.settings(workspace);
    ContentFixtures.writeStandardCorpus(settings.content().root());
    embedder = new EmbeddingGenerator(settings.embedding(), new HashingEmbeddingModel(), null);
  }

  @AfterEach
  void tearDown() {
    embedder.close();
  }

  private IndexingPipeline pipeline() {
    return new IndexingPipeline(
        settings,
        new ContentLoader(settings.content(), new FlexmarkMarkdownConverter(true)),
        new TextProcessor(settings.chunking()),
        embedder,
        store);
  }

  @Test
  @DisplayName("A failing document is recorded and the run continues")
  void perDocumentIsolation() {
    when(store.replaceDocument(eq("blog/sourdough-basics"), anyList()))
        .thenThrow(new IoException("disk full"));
    when(store.replaceDocument(eq("engineering/kubernetes-autoscaling"), anyList())).thenReturn(2);

    IndexingResult result = pipeline().indexAll();

    assertEquals(IndexingStatus.COMPLETED, result.status());
    assertEquals(1, result.documentsProcessed());
    assertEquals(1, result.documentsSkipped());
    assertEquals(1, result.errors().size());
    assertTrue(result.errors().get(0).contains("blog/sourdough-basics"));
    assertTrue(result.errors().get(0).contains("disk full"));
    assertEquals(0.5, result.successRate());
  }

  @Test
  @DisplayName("Fewer stored rows than chunks produce a warning")
  void partialWrite() {
    when(store.replaceDocument(anyString(), anyList())).thenReturn(1);

    IndexingResult result = pipeline().indexAll();

    assertEquals(IndexingStatus.COMPLETED, result.status());
    assertEquals(2, result.warnings().size());
  }

  @Test
  @DisplayName("Losing the store aborts the run")
  void storeLossIsFatal() {
    when(store.replaceDocument(anyString(), anyList()))
        .thenThrow(new StoreUnavailableException("index closed"));

    IndexingResult result = pipeline().indexAll();

    assertEquals(IndexingStatus.FAILED, result.status());
    assertEquals(0, result.documentsProcessed());
    assertTrue(result.errors().stream().anyMatch(e -> e.startsWith("Fatal indexing error")));
  }

  @Test
  @DisplayName("A store that cannot be opened leaves the pipeline degraded")
  void degradedMode() {
    doThrow(new StoreUnavailableException("locked")).when(store).initialize();

    IndexingPipeline pipeline = pipeline();

    assertFalse(pipeline.isStoreAvailable());
    verify(store, never()).ensureSchema(anyInt(), anyString());
    assertTrue(pipeline.search(SearchRequest.builder("anything").build()).isEmpty());
    assertTrue(pipeline.keywordSearch("anything", 5, null, false).isEmpty());

    IndexStats stats = pipeline.stats();
    assertFalse(stats.storeAvailable());
    assertEquals(0, stats.totalChunks());
    assertEquals(0, stats.documents("blog"));

    assertEquals(IndexingStatus.FAILED, pipeline.indexAll().status());
    assertEquals(IndexingStatus.FAILED, pipeline.indexOne("blog", "sourdough-basics").status());
    assertEquals(0, pipeline.clear("blog"));

    HealthStatus health = pipeline.health();
    assertFalse(health.healthy());
    assertFalse(health.storeReachable());
    assertTrue(health.modelLoaded());

    verify(store, never()).delete(any(Predicate.class));
  }

  @Test
  @DisplayName("Search failures yield empty results")
  void searchFailure() {
    when(store.vectorSearch(any(), anyInt(), any())).thenThrow(new IoException("corrupt segment"));

    assertTrue(pipeline().semanticSearch("bread", 5, null, 0.0).isEmpty());
  }

  @Test
  @DisplayName("Unexpected runtime failures from the store also yield empty results")
  void unexpectedSearchFailure() {
    when(store.vectorSearch(any(), anyInt(), any()))
        .thenThrow(new IllegalStateException("searcher closed"));
    when(store.textSearch(any(), anyInt())).thenThrow(new IllegalArgumentException("bad query"));
    IndexingPipeline pipeline = pipeline();

    assertTrue(pipeline.semanticSearch("bread", 5, null, 0.0).isEmpty());
    assertTrue(pipeline.keywordSearch("bread", 5, null, false).isEmpty());
  }

  @Test
  @DisplayName("Keyword over-fetch saturates instead of overflowing")
  void keywordOverFetchSaturates() {
    when(store.textSearch(any(), anyInt())).thenReturn(List.of());

    pipeline().keywordSearch("bread", Integer.MAX_VALUE, null, false);

    verify(store).textSearch(any(), eq(Integer.MAX_VALUE));
  }
}
