package com.gentoro.docsearch.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of index rows with vector and predicate queries.
 *
 * <p>A table holds vectors from exactly one embedding model and dimension. {@link
 * #ensureSchema(int, String)} drops and recreates the table when the configured model disagrees
 * with the stored schema. Implementations rank vector hits by ascending squared Euclidean distance
 * and leave similarity scoring to the caller.
 */
public interface VectorStore extends AutoCloseable {

  /** Open or create the underlying table. */
  void initialize();

  /** @return true when the store accepts operations. */
  boolean isInitialized();

  /**
   * Makes the table's vector width and model match the given values.
   *
   * @return true when the table was created or recreated
   */
  boolean ensureSchema(int vectorDim, String modelName);

  /**
   * Inserts valid records, skipping invalid ones.
   *
   * @return number of records written
   */
  int insert(List<IndexRecord> records);

  /**
   * Atomically replaces all rows of one document with {@code records}. Readers observe either the
   * previous rows or the new ones.
   *
   * @return number of records written
   */
  int replaceDocument(String docKey, List<IndexRecord> records);

  /** Nearest rows to {@code vector}, closest first, restricted to rows matching {@code filter}. */
  List<IndexRow> vectorSearch(float[] vector, int limit, Predicate filter);

  /** Rows matching {@code filter} in store order. */
  List<IndexRow> textSearch(Predicate filter, int limit);

  /** @return number of rows deleted */
  long delete(Predicate filter);

  long countRows(Predicate filter);

  default long countRows() {
    return countRows(Predicate.all());
  }

  /** Document hash stored with the rows of {@code docKey}, if the document is indexed. */
  Optional<String> storedDocumentHash(String docKey);

  TableStats tableStats();

  String location();

  String tableName();

  /** Shut down the store and release resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
