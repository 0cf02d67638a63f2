package com.gentoro.docsearch.store;

import java.util.List;

/**
 * Row filter. Values are carried as typed data and translated by the store implementation; they
 * are never spliced into query strings.
 */
public interface Predicate {

  /** Indexed row fields usable in equality filters. */
  enum Field {
    CHUNK_ID,
    DOC_KEY,
    SLUG,
    CATEGORY
  }

  record All() implements Predicate {}

  record Eq(Field field, String value) implements Predicate {}

  /** Substring match on chunk content. */
  record Contains(String term, boolean caseSensitive) implements Predicate {}

  record And(List<Predicate> clauses) implements Predicate {}

  record Or(List<Predicate> clauses) implements Predicate {}

  static Predicate all() {
    return new All();
  }

  static Predicate eq(Field field, String value) {
    return new Eq(field, value);
  }

  static Predicate category(String category) {
    return new Eq(Field.CATEGORY, category);
  }

  static Predicate docKey(String docKey) {
    return new Eq(Field.DOC_KEY, docKey);
  }

  static Predicate contains(String term, boolean caseSensitive) {
    return new Contains(term, caseSensitive);
  }

  static Predicate and(Predicate... clauses) {
    return new And(List.of(clauses));
  }

  static Predicate or(List<Predicate> clauses) {
    return new Or(List.copyOf(clauses));
  }

  /** {@code category} equality, or {@link #all()} when no category is given. */
  static Predicate categoryOrAll(String category) {
    return category == null || category.isBlank() ? all() : category(category);
  }
}
