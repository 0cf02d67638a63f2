package com.gentoro.docsearch.store.lucene;

/** Field names of a chunk row in the Lucene index. */
final class LuceneFields {
  static final String CHUNK_ID = "chunk_id";
  static final String DOC_KEY = "doc_key";
  static final String SLUG = "slug";
  static final String CATEGORY = "category";
  static final String TITLE = "title";
  static final String AUTHOR = "author";
  static final String PUBLISH_DATE = "publish_date";
  static final String URL = "url";
  static final String TAGS = "tags";
  static final String CONTENT = "content";
  static final String CONTENT_LC = "content_lc";
  static final String CONTENT_CS = "content_cs";
  static final String CHUNK_INDEX = "chunk_index";
  static final String START_CHAR = "start_char";
  static final String END_CHAR = "end_char";
  static final String WORD_COUNT = "word_count";
  static final String SECTION_TITLE = "section_title";
  static final String VECTOR = "vector";
  static final String VECTOR_DIM = "vector_dim";
  static final String MODEL_NAME = "model_name";
  static final String MODEL_VERSION = "model_version";
  static final String CREATED_AT = "created_at";
  static final String PROCESSING_TIME_MS = "processing_time_ms";
  static final String VECTOR_HASH = "vector_hash";
  static final String DOCUMENT_HASH = "document_hash";
  static final String CHUNK_HASH = "chunk_hash";

  // commit user data
  static final String META_VECTOR_DIM = "schema.vector_dim";
  static final String META_MODEL_NAME = "schema.model_name";
  static final String META_SCHEMA_VERSION = "schema.version";

  private LuceneFields() {}
}
