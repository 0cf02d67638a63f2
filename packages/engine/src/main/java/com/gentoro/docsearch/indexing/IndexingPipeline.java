package com.gentoro.docsearch.indexing;

import com.gentoro.docsearch.chunking.Chunk;
import com.gentoro.docsearch.chunking.TextProcessor;
import com.gentoro.docsearch.config.EngineSettings;
import com.gentoro.docsearch.content.ContentLoader;
import com.gentoro.docsearch.content.ContentMetadata;
import com.gentoro.docsearch.content.ContentStats;
import com.gentoro.docsearch.content.Document;
import com.gentoro.docsearch.content.LoadResult;
import com.gentoro.docsearch.embedding.EmbeddingGenerator;
import com.gentoro.docsearch.embedding.EmbeddingSelfTest;
import com.gentoro.docsearch.embedding.EmbeddingVector;
import com.gentoro.docsearch.embedding.ModelInfo;
import com.gentoro.docsearch.exception.DocSearchException;
import com.gentoro.docsearch.exception.ExceptionUtil;
import com.gentoro.docsearch.exception.FatalIndexingException;
import com.gentoro.docsearch.exception.StoreUnavailableException;
import com.gentoro.docsearch.exception.ValidationException;
import com.gentoro.docsearch.logging.LoggingService;
import com.gentoro.docsearch.search.KeywordScorer;
import com.gentoro.docsearch.search.SearchMode;
import com.gentoro.docsearch.search.SearchRequest;
import com.gentoro.docsearch.search.SearchResult;
import com.gentoro.docsearch.search.SimilarityScorer;
import com.gentoro.docsearch.store.IndexRecord;
import com.gentoro.docsearch.store.IndexRow;
import com.gentoro.docsearch.store.Predicate;
import com.gentoro.docsearch.store.VectorStore;
import com.gentoro.docsearch.utility.HashUtility;
import com.gentoro.docsearch.utility.TextUtility;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the engine: indexes the content tree and answers search, stats and clear calls.
 *
 * <p>Indexing runs document by document. Each document is chunked, embedded and written with a
 * single atomic replace of its rows, so a failure leaves the previous rows of that document in
 * place. Failures local to one document are recorded in the {@link IndexingResult} and the run
 * continues; anything else aborts the run with status {@link IndexingStatus#FAILED}.
 *
 * <p>When the vector store cannot be opened the pipeline stays usable in a degraded mode: searches
 * return no results, stats report zero counts and indexing runs fail immediately.
 */
public class IndexingPipeline implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(IndexingPipeline.class);

  static final String HEALTH_QUERY = "test";

  private final EngineSettings settings;
  private final ContentLoader loader;
  private final TextProcessor processor;
  private final EmbeddingGenerator embedder;
  private final VectorStore store;
  private final SimilarityScorer similarity;
  private final boolean storeAvailable;

  public IndexingPipeline(
      EngineSettings settings,
      ContentLoader loader,
      TextProcessor processor,
      EmbeddingGenerator embedder,
      VectorStore store) {
    this.settings = settings;
    this.loader = loader;
    this.processor = processor;
    this.embedder = embedder;
    this.store = store;
    this.similarity = new SimilarityScorer(settings.search().maxDistance());
    this.storeAvailable = openStore();
  }

  private boolean openStore() {
    ModelInfo model = embedder.modelInfo();
    try {
      store.initialize();
      store.ensureSchema(model.dimension(), model.name());
      log.info(
          "Indexing pipeline ready: store {} table {}, model {} ({} dims)",
          store.location(),
          store.tableName(),
          model.name(),
          model.dimension());
      return true;
    } catch (DocSearchException e) {
      log.error(
          "Vector store unavailable, searches and stats will return empty results: {}",
          ExceptionUtil.describe(e));
      return false;
    }
  }

  public EngineSettings settings() {
    return settings;
  }

  public ModelInfo modelInfo() {
    return embedder.modelInfo();
  }

  public boolean isStoreAvailable() {
    return storeAvailable;
  }

  public IndexingResult indexAll() {
    return indexAll(null, false, CancellationToken.create());
  }

  public IndexingResult indexAll(String category, boolean forceReindex) {
    return indexAll(category, forceReindex, CancellationToken.create());
  }

  /**
   * Indexes every included document, optionally limited to one category.
   *
   * @param category category filter, null or blank for all configured categories
   * @param forceReindex rewrite documents even when their content hash is unchanged
   * @param cancellation checked between documents
   * @throws ValidationException when {@code category} is not a configured category
   */
  public IndexingResult indexAll(
      String category, boolean forceReindex, CancellationToken cancellation) {
    String filter = normalizeCategory(category);
    IndexingResult result = IndexingResult.start("index_all");
    try (LoggingService.Scope scope = LoggingService.operationScope(result.operationId())) {
      return runIndexAll(filter, forceReindex, cancellation, result);
    }
  }

  private IndexingResult runIndexAll(
      String filter,
      boolean forceReindex,
      CancellationToken cancellation,
      IndexingResult result) {
    log.info(
        "Starting indexing run {} (category: {}, force: {})",
        result.operationId(),
        filter == null ? "all" : filter,
        forceReindex);
    if (!storeAvailable) {
      result.addError("Vector store is not available");
      return result.finish(IndexingStatus.FAILED);
    }

    try {
      LoadResult loaded = loader.loadAll();
      for (String error : loaded.errors()) {
        result.addError(error);
        result.documentSkipped();
      }
      List<Document> documents =
          loaded.documents().stream()
              .filter(doc -> filter == null || filter.equals(doc.category()))
              .toList();
      log.info("Indexing {} documents", documents.size());

      int done = 0;
      for (Document document : documents) {
        if (cancellation != null && cancellation.isCancelled()) {
          result.addWarning(
              "Cancelled after %d of %d documents".formatted(done, documents.size()));
          log.warn("Indexing run {} cancelled after {} documents", result.operationId(), done);
          return finish(result, IndexingStatus.CANCELLED);
        }
        indexIsolated(document, forceReindex, result);
        done++;
      }
      return finish(result, IndexingStatus.COMPLETED);
    } catch (RuntimeException e) {
      FatalIndexingException fatal =
          e instanceof FatalIndexingException f
              ? f
              : new FatalIndexingException("Indexing run " + result.operationId() + " aborted", e);
      log.error("Fatal error during indexing run {}", result.operationId(), fatal);
      result.addError("Fatal indexing error: " + ExceptionUtil.describe(e));
      return finish(result, IndexingStatus.FAILED);
    }
  }

  /**
   * Indexes one document regardless of its status. A document that full runs would exclude is
   * indexed with a warning.
   */
  public IndexingResult indexOne(String category, String slug) {
    IndexingResult result = IndexingResult.start("index_one");
    try (LoggingService.Scope scope = LoggingService.operationScope(result.operationId())) {
      return runIndexOne(category, slug, result);
    }
  }

  private IndexingResult runIndexOne(String category, String slug, IndexingResult result) {
    log.info("Indexing single document {}/{}", category, slug);
    if (!storeAvailable) {
      result.addError("Vector store is not available");
      return result.finish(IndexingStatus.FAILED);
    }
    try {
      Document document = loader.loadOne(category, slug);
      if (!loader.shouldInclude(document.metadata())) {
        result.addWarning(
            "Document %s has status %s and is excluded from full indexing runs"
                .formatted(document.key(), document.metadata().status().value()));
      }
      indexDocument(document, true, result);
      return finish(result, IndexingStatus.COMPLETED);
    } catch (DocSearchException e) {
      String message =
          "Error processing document %s/%s: %s"
              .formatted(category, slug, ExceptionUtil.describe(e));
      log.warn(message);
      result.addError(message);
      result.documentSkipped();
      return finish(result, IndexingStatus.FAILED);
    }
  }

  private void indexIsolated(Document document, boolean force, IndexingResult result) {
    try (LoggingService.Scope scope = LoggingService.documentScope(document.key())) {
      indexDocument(document, force, result);
    } catch (StoreUnavailableException e) {
      throw new FatalIndexingException("Vector store failed while indexing " + document.key(), e);
    } catch (RuntimeException e) {
      recordDocumentFailure(document, e, result);
    }
  }

  private void recordDocumentFailure(Document document, RuntimeException e, IndexingResult result) {
    try (LoggingService.Scope scope = LoggingService.documentScope(document.key())) {
      String message =
          "Error processing document %s: %s"
              .formatted(document.key(), ExceptionUtil.describe(e));
      log.warn(message);
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      result.addError(message);
      result.documentSkipped();
    }
  }

  private void indexDocument(Document document, boolean force, IndexingResult result) {
    if (!force && settings.processing().checkContentHash()) {
      Optional<String> stored = store.storedDocumentHash(document.key());
      if (stored.isPresent() && stored.get().equals(indexedHash(document))) {
        log.debug("Skipping unchanged document {}", document.key());
        result.documentProcessed(false);
        return;
      }
    }

    List<Chunk> chunks =
        processor.chunk(document.processedContent(), document.slug(), document.category());
    if (chunks.isEmpty()) {
      throw new ValidationException("No chunks generated for document " + document.key());
    }
    result.chunksCreated(chunks.size());

    List<EmbeddingVector> vectors = embedder.embedChunks(chunks);
    result.embeddingsGenerated(vectors.size());

    List<IndexRecord> records = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      records.add(toRecord(document, chunks.get(i), vectors.get(i)));
    }
    int written = store.replaceDocument(document.key(), records);
    if (written != records.size()) {
      result.addWarning(
          "Stored %d of %d chunks for document %s"
              .formatted(written, records.size(), document.key()));
    }
    result.documentProcessed(true);
    log.info("Indexed {} ({} chunks)", document.key(), written);
  }

  /** Content hash combined with the chunking fingerprint, so new chunk settings force a rewrite. */
  private String indexedHash(Document document) {
    return HashUtility.sha256(document.contentHash() + "|" + processor.fingerprint());
  }

  private IndexRecord toRecord(Document document, Chunk chunk, EmbeddingVector vector) {
    ContentMetadata metadata = document.metadata();
    return new IndexRecord(
        chunk.chunkId(),
        document.key(),
        chunk.slug(),
        chunk.category(),
        metadata.title(),
        metadata.author(),
        metadata.publishDate(),
        metadata.canonicalUrl(settings.content().baseUrl()),
        metadata.tags(),
        chunk.content(),
        chunk.chunkIndex(),
        chunk.startChar(),
        chunk.endChar(),
        chunk.wordCount(),
        chunk.sectionTitle(),
        vector.vector(),
        vector.vectorDim(),
        vector.modelName(),
        vector.modelVersion(),
        vector.createdAt(),
        vector.processingTimeMs(),
        vector.vectorHash(),
        indexedHash(document),
        chunk.contentHash());
  }

  private IndexingResult finish(IndexingResult result, IndexingStatus status) {
    result.finish(status);
    log.info(
        "Indexing {} {}: {} processed ({} updated, {} unchanged), {} skipped, {} chunks in {} ms",
        result.operationId(),
        status.value(),
        result.documentsProcessed(),
        result.documentsUpdated(),
        result.documentsUnchanged(),
        result.documentsSkipped(),
        result.chunksCreated(),
        result.totalProcessingTimeMs());
    return result;
  }

  /** Routes to semantic or keyword search by {@link SearchRequest#mode()}. */
  public List<SearchResult> search(SearchRequest request) {
    int limit = request.limit() == null ? settings.search().defaultLimit() : request.limit();
    if (request.mode() == SearchMode.KEYWORD) {
      return keywordSearch(request.query(), limit, request.category(), request.caseSensitive());
    }
    double threshold =
        request.similarityThreshold() == null
            ? settings.search().similarityThreshold()
            : request.similarityThreshold();
    return semanticSearch(request.query(), limit, request.category(), threshold);
  }

  /**
   * Nearest chunks to the query embedding, closest first, keeping those with a score of at least
   * {@code threshold}. Failures are logged and yield an empty list.
   */
  public List<SearchResult> semanticSearch(
      String query, int limit, String category, double threshold) {
    if (!storeAvailable || query == null || query.isBlank() || limit < 1) {
      return List.of();
    }
    List<IndexRow> rows;
    try {
      float[] vector = embedder.embed(query);
      rows = store.vectorSearch(vector, limit, Predicate.categoryOrAll(category));
    } catch (RuntimeException e) {
      log.warn("Semantic search failed: {}", ExceptionUtil.describe(e), e);
      return List.of();
    }
    List<SearchResult> results = new ArrayList<>(rows.size());
    for (IndexRow row : rows) {
      double distance = row.distance() == null ? Double.MAX_VALUE : row.distance();
      double score = similarity.score(distance);
      if (score < threshold) {
        continue;
      }
      results.add(toResult(row, score, distance, null));
    }
    log.debug("Semantic search '{}' returned {} of {} rows", query, results.size(), rows.size());
    return results;
  }

  /**
   * Substring candidates ranked by {@link KeywordScorer}, highest first. Failures are logged and
   * yield an empty list.
   */
  public List<SearchResult> keywordSearch(
      String query, int limit, String category, boolean caseSensitive) {
    if (!storeAvailable || query == null || query.isBlank() || limit < 1) {
      return List.of();
    }
    KeywordScorer scorer = new KeywordScorer(query, caseSensitive);
    List<Predicate> termFilters = new ArrayList<>();
    for (String term : scorer.terms()) {
      termFilters.add(Predicate.contains(term, caseSensitive));
    }
    Predicate filter =
        category == null || category.isBlank()
            ? Predicate.or(termFilters)
            : Predicate.and(Predicate.category(category), Predicate.or(termFilters));

    List<IndexRow> candidates;
    try {
      candidates = store.textSearch(filter, (int) Math.min(2L * limit, Integer.MAX_VALUE));
    } catch (RuntimeException e) {
      log.warn("Keyword search failed: {}", ExceptionUtil.describe(e), e);
      return List.of();
    }
    List<SearchResult> results = new ArrayList<>();
    for (IndexRow row : candidates) {
      KeywordScorer.Score score = scorer.score(row.title(), row.content());
      if (score.score() <= 0) {
        continue;
      }
      results.add(toResult(row, score.score(), null, score.termMatches()));
    }
    results.sort(Comparator.comparingDouble(SearchResult::score).reversed());
    return results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
  }

  private SearchResult toResult(IndexRow row, double score, Double distance, Integer matches) {
    return new SearchResult(
        row.title(),
        row.category(),
        row.slug(),
        row.chunkId(),
        TextUtility.excerpt(row.content(), settings.search().excerptLength()),
        row.content(),
        score,
        row.url(),
        row.tags(),
        row.publishDate(),
        row.sectionTitle(),
        distance,
        matches);
  }

  /** Per-category document and chunk counts read from the store on every call. */
  public IndexStats stats() {
    ModelInfo model = embedder.modelInfo();
    Map<String, CategoryStats> categories = new LinkedHashMap<>();
    if (!storeAvailable) {
      for (String category : settings.content().categories()) {
        categories.put(category, CategoryStats.empty(category));
      }
      return new IndexStats(
          false,
          0,
          0,
          categories,
          model,
          store.location(),
          store.tableName(),
          embedder.cache().stats());
    }

    long totalChunks = 0;
    int totalDocuments = 0;
    try {
      for (String category : settings.content().categories()) {
        CategoryStats stats = categoryStats(category);
        categories.put(category, stats);
        totalChunks += stats.chunks();
        totalDocuments += stats.documents();
      }
    } catch (DocSearchException e) {
      log.warn("Failed to compute index stats: {}", ExceptionUtil.describe(e));
      categories.clear();
      totalChunks = 0;
      totalDocuments = 0;
      for (String category : settings.content().categories()) {
        categories.put(category, CategoryStats.empty(category));
      }
    }
    return new IndexStats(
        true,
        totalChunks,
        totalDocuments,
        categories,
        model,
        store.location(),
        store.tableName(),
        embedder.cache().stats());
  }

  private CategoryStats categoryStats(String category) {
    Predicate filter = Predicate.category(category);
    long chunks = store.countRows(filter);
    if (chunks == 0) {
      return CategoryStats.empty(category);
    }
    Set<String> documents = new HashSet<>();
    Instant lastUpdated = null;
    for (IndexRow row : store.textSearch(filter, (int) Math.min(chunks, Integer.MAX_VALUE))) {
      documents.add(row.docKey());
      if (row.createdAt() != null
          && (lastUpdated == null || row.createdAt().isAfter(lastUpdated))) {
        lastUpdated = row.createdAt();
      }
    }
    return new CategoryStats(category, documents.size(), chunks, lastUpdated);
  }

  /**
   * Deletes the rows of one category, or every row when {@code category} is null or blank.
   *
   * @return number of rows deleted, 0 when the store is unavailable
   * @throws ValidationException when {@code category} is not a configured category
   */
  public long clear(String category) {
    String filter = normalizeCategory(category);
    if (!storeAvailable) {
      log.warn("Vector store is not available, nothing to clear");
      return 0;
    }
    log.warn("Clearing index rows for {}", filter == null ? "all categories" : filter);
    try {
      return store.delete(Predicate.categoryOrAll(filter));
    } catch (DocSearchException e) {
      log.warn("Failed to clear index: {}", ExceptionUtil.describe(e));
      return 0;
    }
  }

  /** Store reachability, model self-test and a one-row sample vector search. */
  public HealthStatus health() {
    List<String> errors = new ArrayList<>();
    boolean reachable = false;
    long rows = 0;
    if (storeAvailable) {
      try {
        rows = store.countRows();
        reachable = true;
      } catch (DocSearchException e) {
        errors.add("Store: " + ExceptionUtil.describe(e));
      }
    } else {
      errors.add("Store: vector store is not available");
    }

    EmbeddingSelfTest selfTest = embedder.testEmbedding(null);
    if (!selfTest.success()) {
      errors.add("Model: " + selfTest.error());
    }

    boolean sampleSearch = false;
    if (reachable && selfTest.success()) {
      try {
        store.vectorSearch(embedder.embed(HEALTH_QUERY), 1, Predicate.all());
        sampleSearch = true;
      } catch (DocSearchException e) {
        errors.add("Search: " + ExceptionUtil.describe(e));
      }
    }
    return new HealthStatus(reachable, selfTest.success(), sampleSearch, rows, errors);
  }

  /** Runs the embedding self-test, loads the corpus and chunks its first document. */
  public QuickTestReport quickTest() {
    List<String> errors = new ArrayList<>();
    EmbeddingSelfTest selfTest = embedder.testEmbedding(null);
    if (!selfTest.success()) {
      errors.add("Embedding self-test failed: " + selfTest.error());
    }
    int loadedCount = 0;
    String sample = null;
    int sampleChunks = 0;
    try {
      LoadResult loaded = loader.loadAll();
      loadedCount = loaded.documents().size();
      errors.addAll(loaded.errors());
      if (!loaded.documents().isEmpty()) {
        Document first = loaded.documents().get(0);
        sample = first.key();
        sampleChunks =
            processor.chunk(first.processedContent(), first.slug(), first.category()).size();
      }
    } catch (DocSearchException e) {
      errors.add("Content: " + ExceptionUtil.describe(e));
    }
    if (!storeAvailable) {
      errors.add("Vector store is not available");
    }
    return new QuickTestReport(
        selfTest,
        loadedCount,
        sample,
        sampleChunks,
        processor.settings(),
        storeAvailable,
        errors);
  }

  public ContentStats contentStats() {
    return loader.contentStats();
  }

  private String normalizeCategory(String category) {
    if (category == null || category.isBlank()) {
      return null;
    }
    if (!settings.content().isSupportedCategory(category)) {
      throw new ValidationException(
          "Category must be one of "
              + settings.content().categories()
              + ", got '"
              + category
              + "'");
    }
    return category;
  }

  /** Saves the embedding cache and closes the store. */
  @Override
  public void close() {
    try {
      embedder.close();
    } finally {
      store.shutdown();
    }
  }
}
