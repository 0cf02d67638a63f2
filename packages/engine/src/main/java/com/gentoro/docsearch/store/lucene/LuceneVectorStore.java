package com.gentoro.docsearch.store.lucene;

import com.gentoro.docsearch.config.DatabaseSettings;
import com.gentoro.docsearch.exception.DocSearchException;
import com.gentoro.docsearch.exception.IoException;
import com.gentoro.docsearch.exception.StoreUnavailableException;
import com.gentoro.docsearch.exception.ValidationException;
import com.gentoro.docsearch.logging.LoggingService;
import com.gentoro.docsearch.store.IndexRecord;
import com.gentoro.docsearch.store.IndexRow;
import com.gentoro.docsearch.store.Predicate;
import com.gentoro.docsearch.store.TableStats;
import com.gentoro.docsearch.store.VectorStore;
import com.gentoro.docsearch.utility.FileUtility;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;

/**
 * {@link VectorStore} backed by a Lucene index directory under {@code database.path/table}.
 *
 * <p>Each chunk is one Lucene document. Vectors are indexed for HNSW search with Euclidean
 * similarity, whose score {@code 1 / (1 + d)} is converted back to the squared distance {@code d}.
 * The table schema (vector width, model name, schema version) lives in the commit user data. All
 * writes commit immediately and refresh the shared searcher, so every read sees the last completed
 * write.
 */
public class LuceneVectorStore implements VectorStore {
  private static final Logger log = LoggingService.getLogger(LuceneVectorStore.class);

  static final String SCHEMA_VERSION = "1";
  static final String SEED_ROW_ID = "__schema_seed__";
  /** Longest content prefix indexed for substring filters; bounded by Lucene's term size. */
  static final int MAX_KEYWORD_CHARS = 8000;
  /** Largest vector width accepted by the default Lucene codec. */
  static final int MAX_VECTOR_DIM = 1024;

  private final DatabaseSettings settings;

  private volatile Directory directory;
  private volatile IndexWriter writer;
  private volatile SearcherManager searcherManager;
  private volatile int vectorDim;
  private volatile String modelName;

  public LuceneVectorStore(DatabaseSettings settings) {
    this.settings = settings;
  }

  @Override
  public synchronized void initialize() {
    if (isInitialized()) {
      return;
    }
    try {
      FileUtility.createDirectories(settings.tableDirectory());
      open(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
      Map<String, String> schema = readSchema();
      vectorDim = parseDim(schema.get(LuceneFields.META_VECTOR_DIM));
      modelName = schema.get(LuceneFields.META_MODEL_NAME);
      log.info(
          "Vector store opened at {} (table {}, rows {}, dim {}, model {})",
          settings.path(),
          settings.table(),
          countRows(),
          vectorDim,
          modelName);
    } catch (IOException | RuntimeException e) {
      closeQuietly();
      throw new StoreUnavailableException(
          "Failed to open vector store at " + settings.tableDirectory(), e);
    }
  }

  @Override
  public boolean isInitialized() {
    return writer != null && searcherManager != null;
  }

  @Override
  public synchronized boolean ensureSchema(int dim, String model) {
    requireInitialized();
    if (dim < 1 || dim > MAX_VECTOR_DIM) {
      throw new ValidationException(
          "Vector dimension must be in [1, " + MAX_VECTOR_DIM + "], got " + dim);
    }
    if (model == null || model.isBlank()) {
      throw new ValidationException("Model name is required for the table schema");
    }
    if (vectorDim == dim && model.equals(modelName)) {
      return false;
    }
    try {
      if (vectorDim > 0 || countRows() > 0) {
        log.warn(
            "Table {} schema (dim {}, model {}) does not match (dim {}, model {}); "
                + "dropping and recreating, existing rows are discarded",
            settings.table(),
            vectorDim,
            modelName,
            dim,
            model);
      } else {
        log.info("Creating table {} (dim {}, model {})", settings.table(), dim, model);
      }
      closeQuietly();
      FileUtility.deleteDir(settings.tableDirectory(), false);
      FileUtility.createDirectories(settings.tableDirectory());
      open(IndexWriterConfig.OpenMode.CREATE);

      // pins the vector field's width in the new index
      Document seed = new Document();
      seed.add(new StringField(LuceneFields.CHUNK_ID, SEED_ROW_ID, Field.Store.NO));
      seed.add(
          new KnnFloatVectorField(
              LuceneFields.VECTOR, new float[dim], VectorSimilarityFunction.EUCLIDEAN));
      writer.addDocument(seed);
      writer.deleteDocuments(new Term(LuceneFields.CHUNK_ID, SEED_ROW_ID));

      Map<String, String> schema = new HashMap<>();
      schema.put(LuceneFields.META_VECTOR_DIM, Integer.toString(dim));
      schema.put(LuceneFields.META_MODEL_NAME, model);
      schema.put(LuceneFields.META_SCHEMA_VERSION, SCHEMA_VERSION);
      writer.setLiveCommitData(schema.entrySet());
      commitAndRefresh();
      vectorDim = dim;
      modelName = model;
      return true;
    } catch (IOException e) {
      closeQuietly();
      throw new StoreUnavailableException("Failed to recreate table " + settings.table(), e);
    }
  }

  @Override
  public int insert(List<IndexRecord> records) {
    requireSchema();
    List<Document> docs = toDocuments(records);
    if (docs.isEmpty()) {
      return 0;
    }
    try {
      writer.addDocuments(docs);
      commitAndRefresh();
      log.debug("Inserted {} rows into {}", docs.size(), settings.table());
      return docs.size();
    } catch (IOException e) {
      throw new IoException("Failed to insert rows into " + settings.table(), e);
    }
  }

  @Override
  public int replaceDocument(String docKey, List<IndexRecord> records) {
    requireSchema();
    if (docKey == null || docKey.isBlank()) {
      throw new ValidationException("Document key is required for replace");
    }
    for (IndexRecord record : records) {
      if (!docKey.equals(record.docKey())) {
        throw new ValidationException(
            "Record " + record.chunkId() + " belongs to " + record.docKey() + ", not " + docKey);
      }
    }
    List<Document> docs = toDocuments(records);
    Term term = new Term(LuceneFields.DOC_KEY, docKey);
    try {
      if (docs.isEmpty()) {
        writer.deleteDocuments(term);
      } else {
        // delete-and-add in one atomic operation
        writer.updateDocuments(term, docs);
      }
      commitAndRefresh();
      log.debug("Replaced rows of {} with {} rows", docKey, docs.size());
      return docs.size();
    } catch (IOException e) {
      throw new IoException("Failed to replace rows of " + docKey, e);
    }
  }

  @Override
  public List<IndexRow> vectorSearch(float[] vector, int limit, Predicate filter) {
    requireSchema();
    if (vector == null || vector.length != vectorDim) {
      throw new ValidationException(
          "Query vector has dimension "
              + (vector == null ? 0 : vector.length)
              + ", table expects "
              + vectorDim);
    }
    if (limit < 1) {
      return List.of();
    }
    IndexSearcher searcher = acquire();
    try {
      int k = boundedLimit(searcher, limit);
      Query query =
          new KnnFloatVectorQuery(
              LuceneFields.VECTOR, vector, k, LuceneQueryBuilder.buildFilter(filter));
      TopDocs top = searcher.search(query, k);
      List<IndexRow> rows = new ArrayList<>(top.scoreDocs.length);
      for (ScoreDoc hit : top.scoreDocs) {
        double distance = hit.score > 0 ? (1.0d / hit.score) - 1.0d : Double.MAX_VALUE;
        rows.add(toRow(searcher.storedFields().document(hit.doc), Math.max(0.0d, distance)));
      }
      return rows;
    } catch (IOException e) {
      throw new IoException("Vector search failed on " + settings.table(), e);
    } catch (RuntimeException e) {
      throw queryFailure("Vector search", e);
    } finally {
      release(searcher);
    }
  }

  @Override
  public List<IndexRow> textSearch(Predicate filter, int limit) {
    requireInitialized();
    if (limit < 1) {
      return List.of();
    }
    IndexSearcher searcher = acquire();
    try {
      Query query = LuceneQueryBuilder.build(filter);
      TopDocs top = searcher.search(query, boundedLimit(searcher, limit), Sort.INDEXORDER);
      List<IndexRow> rows = new ArrayList<>(top.scoreDocs.length);
      for (ScoreDoc hit : top.scoreDocs) {
        rows.add(toRow(searcher.storedFields().document(hit.doc), null));
      }
      return rows;
    } catch (IOException e) {
      throw new IoException("Text search failed on " + settings.table(), e);
    } catch (RuntimeException e) {
      throw queryFailure("Text search", e);
    } finally {
      release(searcher);
    }
  }

  @Override
  public long delete(Predicate filter) {
    requireInitialized();
    try {
      long matching = countRows(filter);
      if (matching == 0) {
        return 0;
      }
      writer.deleteDocuments(LuceneQueryBuilder.build(filter));
      commitAndRefresh();
      log.info("Deleted {} rows from {}", matching, settings.table());
      return matching;
    } catch (IOException e) {
      throw new IoException("Failed to delete rows from " + settings.table(), e);
    } catch (RuntimeException e) {
      throw queryFailure("Delete", e);
    }
  }

  @Override
  public long countRows(Predicate filter) {
    requireInitialized();
    IndexSearcher searcher = acquire();
    try {
      return searcher.count(LuceneQueryBuilder.build(filter));
    } catch (IOException e) {
      throw new IoException("Failed to count rows in " + settings.table(), e);
    } catch (RuntimeException e) {
      throw queryFailure("Count", e);
    } finally {
      release(searcher);
    }
  }

  @Override
  public Optional<String> storedDocumentHash(String docKey) {
    requireInitialized();
    IndexSearcher searcher = acquire();
    try {
      TopDocs top = searcher.search(new TermQuery(new Term(LuceneFields.DOC_KEY, docKey)), 1);
      if (top.scoreDocs.length == 0) {
        return Optional.empty();
      }
      Document doc = searcher.storedFields().document(top.scoreDocs[0].doc);
      return Optional.ofNullable(doc.get(LuceneFields.DOCUMENT_HASH));
    } catch (IOException e) {
      throw new IoException("Failed to read stored hash of " + docKey, e);
    } finally {
      release(searcher);
    }
  }

  @Override
  public TableStats tableStats() {
    requireInitialized();
    Map<String, String> schema = readSchemaQuietly();
    return new TableStats(
        settings.path().toString(),
        settings.table(),
        countRows(),
        vectorDim,
        modelName,
        schema.get(LuceneFields.META_SCHEMA_VERSION),
        sizeOnDisk());
  }

  @Override
  public String location() {
    return settings.path().toString();
  }

  @Override
  public String tableName() {
    return settings.table();
  }

  @Override
  public synchronized void shutdown() {
    if (!isInitialized()) {
      return;
    }
    try {
      searcherManager.close();
      writer.close();
      directory.close();
      log.info("Vector store at {} closed", settings.path());
    } catch (IOException e) {
      throw new IoException("Failed to close vector store at " + settings.path(), e);
    } finally {
      searcherManager = null;
      writer = null;
      directory = null;
    }
  }

  private void open(IndexWriterConfig.OpenMode mode) throws IOException {
    directory = FSDirectory.open(settings.tableDirectory());
    IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
    config.setOpenMode(mode);
    writer = new IndexWriter(directory, config);
    searcherManager = new SearcherManager(writer, null);
  }

  private Map<String, String> readSchema() throws IOException {
    if (!DirectoryReader.indexExists(directory)) {
      return Map.of();
    }
    return SegmentInfos.readLatestCommit(directory).getUserData();
  }

  private Map<String, String> readSchemaQuietly() {
    try {
      return readSchema();
    } catch (IOException e) {
      log.warn("Failed to read schema metadata of {}", settings.table(), e);
      return Map.of();
    }
  }

  private static int parseDim(String value) {
    if (value == null) {
      return 0;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Ignoring malformed stored vector dimension '{}'", value);
      return 0;
    }
  }

  private void commitAndRefresh() throws IOException {
    writer.commit();
    searcherManager.maybeRefreshBlocking();
  }

  private IndexSearcher acquire() {
    SearcherManager manager = searcherManager;
    if (manager == null) {
      throw new StoreUnavailableException("Vector store is not initialized");
    }
    try {
      return manager.acquire();
    } catch (IOException e) {
      throw new StoreUnavailableException("Failed to acquire index searcher", e);
    }
  }

  private void release(IndexSearcher searcher) {
    SearcherManager manager = searcherManager;
    if (manager == null) {
      return;
    }
    try {
      manager.release(searcher);
    } catch (IOException e) {
      log.warn("Failed to release index searcher", e);
    }
  }

  /** Hit count for a query; never above the number of documents in the index. */
  private static int boundedLimit(IndexSearcher searcher, int limit) {
    return Math.max(1, Math.min(limit, searcher.getIndexReader().maxDoc()));
  }

  /** Maps runtime failures raised while building or running a query. */
  private DocSearchException queryFailure(String operation, RuntimeException e) {
    if (e instanceof DocSearchException known) {
      return known;
    }
    if (e instanceof IndexSearcher.TooManyClauses) {
      return new ValidationException(
          operation
              + " failed: filter expands to more than "
              + IndexSearcher.getMaxClauseCount()
              + " clauses",
          e);
    }
    return new IoException(operation + " failed on " + settings.table(), e);
  }

  private void requireInitialized() {
    if (!isInitialized()) {
      throw new StoreUnavailableException("Vector store is not initialized");
    }
  }

  private void requireSchema() {
    requireInitialized();
    if (vectorDim < 1) {
      throw new StoreUnavailableException(
          "Table " + settings.table() + " has no schema; call ensureSchema first");
    }
  }

  private long sizeOnDisk() {
    long total = 0;
    try {
      for (String file : directory.listAll()) {
        try {
          total += directory.fileLength(file);
        } catch (NoSuchFileException e) {
          log.debug("Index file {} removed while measuring size", file);
        }
      }
    } catch (IOException e) {
      log.warn("Failed to measure size of {}", settings.tableDirectory(), e);
    }
    return total;
  }

  private void closeQuietly() {
    try {
      shutdown();
    } catch (RuntimeException e) {
      log.warn("Error while closing vector store at {}", settings.path(), e);
    }
  }

  private List<Document> toDocuments(List<IndexRecord> records) {
    List<Document> docs = new ArrayList<>(records.size());
    for (IndexRecord record : records) {
      if (record == null) {
        continue;
      }
      if (record.content() == null || record.content().isBlank()) {
        log.warn("Skipping row {} with empty content", record.chunkId());
        continue;
      }
      float[] vector = record.vector();
      if (vector == null || vector.length == 0) {
        log.warn("Skipping row {} without a vector", record.chunkId());
        continue;
      }
      if (vector.length != vectorDim) {
        log.warn(
            "Skipping row {}: vector has dimension {}, table expects {}",
            record.chunkId(),
            vector.length,
            vectorDim);
        continue;
      }
      IndexRecord valid = record;
      if (record.vectorDim() != vector.length) {
        log.debug(
            "Correcting vector_dim of {} from {} to {}",
            record.chunkId(),
            record.vectorDim(),
            vector.length);
        valid = record.withVectorDim(vector.length);
      }
      docs.add(toDocument(valid));
    }
    return docs;
  }

  private static Document toDocument(IndexRecord r) {
    Document doc = new Document();
    doc.add(new StringField(LuceneFields.CHUNK_ID, r.chunkId(), Field.Store.YES));
    doc.add(new StringField(LuceneFields.DOC_KEY, r.docKey(), Field.Store.YES));
    doc.add(new StringField(LuceneFields.SLUG, r.slug(), Field.Store.YES));
    doc.add(new StringField(LuceneFields.CATEGORY, r.category(), Field.Store.YES));
    addStored(doc, LuceneFields.TITLE, r.title());
    addStored(doc, LuceneFields.AUTHOR, r.author());
    addStored(doc, LuceneFields.PUBLISH_DATE, r.publishDate());
    addStored(doc, LuceneFields.URL, r.url());
    for (String tag : r.tags()) {
      addStored(doc, LuceneFields.TAGS, tag);
    }
    doc.add(new StoredField(LuceneFields.CONTENT, r.content()));
    String keyword = keywordPrefix(r.content());
    doc.add(
        new StringField(LuceneFields.CONTENT_LC, keyword.toLowerCase(Locale.ROOT), Field.Store.NO));
    doc.add(new StringField(LuceneFields.CONTENT_CS, keyword, Field.Store.NO));
    doc.add(new StoredField(LuceneFields.CHUNK_INDEX, r.chunkIndex()));
    doc.add(new StoredField(LuceneFields.START_CHAR, r.startChar()));
    doc.add(new StoredField(LuceneFields.END_CHAR, r.endChar()));
    doc.add(new StoredField(LuceneFields.WORD_COUNT, r.wordCount()));
    addStored(doc, LuceneFields.SECTION_TITLE, r.sectionTitle());
    doc.add(
        new KnnFloatVectorField(
            LuceneFields.VECTOR,
            Arrays.copyOf(r.vector(), r.vector().length),
            VectorSimilarityFunction.EUCLIDEAN));
    doc.add(new StoredField(LuceneFields.VECTOR_DIM, r.vectorDim()));
    addStored(doc, LuceneFields.MODEL_NAME, r.modelName());
    addStored(doc, LuceneFields.MODEL_VERSION, r.modelVersion());
    Instant createdAt = r.createdAt() == null ? Instant.now() : r.createdAt();
    doc.add(new StoredField(LuceneFields.CREATED_AT, createdAt.toString()));
    doc.add(new StoredField(LuceneFields.PROCESSING_TIME_MS, r.processingTimeMs()));
    addStored(doc, LuceneFields.VECTOR_HASH, r.vectorHash());
    addStored(doc, LuceneFields.DOCUMENT_HASH, r.documentHash());
    addStored(doc, LuceneFields.CHUNK_HASH, r.chunkHash());
    return doc;
  }

  private static String keywordPrefix(String content) {
    if (content.length() <= MAX_KEYWORD_CHARS) {
      return content;
    }
    int end = MAX_KEYWORD_CHARS;
    if (Character.isHighSurrogate(content.charAt(end - 1))) {
      end--;
    }
    return content.substring(0, end);
  }

  private static void addStored(Document doc, String name, String value) {
    if (value != null) {
      doc.add(new StoredField(name, value));
    }
  }

  private static IndexRow toRow(Document doc, Double distance) {
    return new IndexRow(
        doc.get(LuceneFields.CHUNK_ID),
        doc.get(LuceneFields.DOC_KEY),
        doc.get(LuceneFields.SLUG),
        doc.get(LuceneFields.CATEGORY),
        doc.get(LuceneFields.TITLE),
        doc.get(LuceneFields.AUTHOR),
        doc.get(LuceneFields.PUBLISH_DATE),
        doc.get(LuceneFields.URL),
        List.of(doc.getValues(LuceneFields.TAGS)),
        doc.get(LuceneFields.CONTENT),
        intValue(doc, LuceneFields.CHUNK_INDEX),
        intValue(doc, LuceneFields.START_CHAR),
        intValue(doc, LuceneFields.END_CHAR),
        intValue(doc, LuceneFields.WORD_COUNT),
        doc.get(LuceneFields.SECTION_TITLE),
        intValue(doc, LuceneFields.VECTOR_DIM),
        doc.get(LuceneFields.MODEL_NAME),
        doc.get(LuceneFields.MODEL_VERSION),
        instantValue(doc.get(LuceneFields.CREATED_AT)),
        doc.get(LuceneFields.DOCUMENT_HASH),
        distance);
  }

  private static int intValue(Document doc, String name) {
    IndexableField field = doc.getField(name);
    return field == null || field.numericValue() == null ? 0 : field.numericValue().intValue();
  }

  private static Instant instantValue(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
