package com.gentoro.docsearch.store.lucene;

import com.gentoro.docsearch.exception.ValidationException;
import com.gentoro.docsearch.store.Predicate;
import java.util.Locale;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;

/**
 * Single place where {@link Predicate} trees become Lucene queries. Equality uses exact term
 * queries; substring matches use wildcard queries over untokenized content fields with wildcard
 * metacharacters in the term escaped.
 */
public final class LuceneQueryBuilder {
  private LuceneQueryBuilder() {}

  public static Query build(Predicate predicate) {
    if (predicate == null || predicate instanceof Predicate.All) {
      return new MatchAllDocsQuery();
    }
    if (predicate instanceof Predicate.Eq eq) {
      if (eq.value() == null) {
        throw new ValidationException("Equality filter on " + eq.field() + " requires a value");
      }
      return new TermQuery(new Term(fieldName(eq.field()), eq.value()));
    }
    if (predicate instanceof Predicate.Contains contains) {
      String term = contains.term();
      if (term == null || term.isEmpty()) {
        throw new ValidationException("Substring filter requires a non-empty term");
      }
      String field = contains.caseSensitive() ? LuceneFields.CONTENT_CS : LuceneFields.CONTENT_LC;
      String value = contains.caseSensitive() ? term : term.toLowerCase(Locale.ROOT);
      return new WildcardQuery(new Term(field, "*" + escapeWildcard(value) + "*"));
    }
    if (predicate instanceof Predicate.And and) {
      BooleanQuery.Builder builder = new BooleanQuery.Builder();
      for (Predicate clause : and.clauses()) {
        builder.add(build(clause), BooleanClause.Occur.FILTER);
      }
      return and.clauses().isEmpty() ? new MatchAllDocsQuery() : builder.build();
    }
    if (predicate instanceof Predicate.Or or) {
      if (or.clauses().isEmpty()) {
        throw new ValidationException("OR filter requires at least one clause");
      }
      BooleanQuery.Builder builder = new BooleanQuery.Builder();
      for (Predicate clause : or.clauses()) {
        builder.add(build(clause), BooleanClause.Occur.SHOULD);
      }
      builder.setMinimumNumberShouldMatch(1);
      return builder.build();
    }
    throw new ValidationException("Unsupported predicate: " + predicate);
  }

  /** Filter for vector queries; null when every row qualifies. */
  public static Query buildFilter(Predicate predicate) {
    return predicate == null || predicate instanceof Predicate.All ? null : build(predicate);
  }

  static String fieldName(Predicate.Field field) {
    return switch (field) {
      case CHUNK_ID -> LuceneFields.CHUNK_ID;
      case DOC_KEY -> LuceneFields.DOC_KEY;
      case SLUG -> LuceneFields.SLUG;
      case CATEGORY -> LuceneFields.CATEGORY;
    };
  }

  static String escapeWildcard(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 4);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == WildcardQuery.WILDCARD_STRING
          || c == WildcardQuery.WILDCARD_CHAR
          || c == WildcardQuery.WILDCARD_ESCAPE) {
        sb.append(WildcardQuery.WILDCARD_ESCAPE);
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
