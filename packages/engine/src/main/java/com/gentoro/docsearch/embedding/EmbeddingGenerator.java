package com.gentoro.docsearch.embedding;

import com.gentoro.docsearch.chunking.Chunk;
import com.gentoro.docsearch.config.EmbeddingSettings;
import com.gentoro.docsearch.exception.EmbeddingException;
import com.gentoro.docsearch.exception.ExceptionUtil;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns text into unit-length vectors with a LangChain4j {@link EmbeddingModel}.
 *
 * <p>Inputs longer than the configured maximum sequence length are truncated, preferring the last
 * sentence end in the final 20% of the window. Batches are encoded on a fixed pool of {@code
 * maxWorkers} threads; batch boundaries do not influence results. The model is sampled once at
 * construction, so a generator that exists has a working model of known dimension.
 */
public class EmbeddingGenerator implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.docsearch.logging.LoggingService.getLogger(EmbeddingGenerator.class);
  private static final String SAMPLE_TEXT = "dimension check";
  static final int SELF_TEST_SAMPLE = 5;

  private final EmbeddingSettings settings;
  private final EmbeddingModel model;
  private final EmbeddingCache cache;
  private final ModelInfo modelInfo;
  private final ExecutorService workers;

  /**
   * @throws EmbeddingException when the model cannot produce a sample embedding
   */
  public EmbeddingGenerator(
      EmbeddingSettings settings, EmbeddingModel model, EmbeddingCache cache) {
    this.settings = settings;
    this.model = model;
    this.cache = cache == null ? EmbeddingCache.disabled() : cache;

    int dimension;
    try {
      dimension = vectorOf(model.embed(SAMPLE_TEXT), SAMPLE_TEXT).length;
    } catch (RuntimeException e) {
      throw new EmbeddingException(
          "Embedding model '%s' failed to initialize".formatted(settings.model()), e);
    }
    if (dimension == 0) {
      throw new EmbeddingException(
          "Embedding model '%s' returned an empty sample vector".formatted(settings.model()));
    }
    this.modelInfo =
        new ModelInfo(
            settings.model(),
            settings.device(),
            settings.maxSequenceLength(),
            dimension,
            EmbeddingModelFactory.versionOf(settings.model()));
    this.workers = Executors.newFixedThreadPool(settings.maxWorkers(), new WorkerThreadFactory());
    log.info(
        "Embedding model ready: {} ({} dims, batch size {}, {} workers)",
        modelInfo.name(),
        dimension,
        settings.batchSize(),
        settings.maxWorkers());
  }

  public ModelInfo modelInfo() {
    return modelInfo;
  }

  public EmbeddingCache cache() {
    return cache;
  }

  /**
   * Embeds one text.
   *
   * @throws EmbeddingException when the text is empty or the model fails
   */
  public float[] embed(String text) {
    if (text == null || text.isBlank()) {
      throw new EmbeddingException("Text cannot be empty");
    }
    String key = cacheKey(text);
    float[] cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    String prepared = truncate(text.strip());
    float[] vector;
    try {
      vector = normalize(vectorOf(model.embed(prepared), prepared));
    } catch (RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new EmbeddingException("Failed to generate embedding", ex));
    }
    cache.put(key, vector);
    return vector;
  }

  /**
   * Embeds many texts. Empty or blank inputs are skipped; every returned vector carries the
   * position of the input it belongs to, in input order.
   *
   * @throws EmbeddingException when any batch fails to encode
   */
  public List<IndexedVector> embedBatch(List<String> texts) {
    if (texts == null || texts.isEmpty()) return List.of();

    float[][] results = new float[texts.size()][];
    List<Integer> pending = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (text == null || text.isBlank()) continue;
      float[] cached = cache.get(cacheKey(text));
      if (cached != null) {
        results[i] = cached;
      } else {
        pending.add(i);
      }
    }

    List<Future<?>> futures = new ArrayList<>();
    for (int from = 0; from < pending.size(); from += settings.batchSize()) {
      List<Integer> batch =
          pending.subList(from, Math.min(from + settings.batchSize(), pending.size()));
      futures.add(workers.submit(() -> encodeBatch(texts, batch, results)));
    }
    awaitAll(futures);

    List<IndexedVector> out = new ArrayList<>();
    for (int i = 0; i < results.length; i++) {
      if (results[i] != null) {
        out.add(new IndexedVector(i, results[i]));
      }
    }
    log.debug(
        "Embedded {} texts ({} from cache, {} skipped as empty)",
        out.size(),
        out.size() - pending.size(),
        texts.size() - out.size());
    return out;
  }

  private void encodeBatch(List<String> texts, List<Integer> batch, float[][] results) {
    List<TextSegment> segments = new ArrayList<>(batch.size());
    for (int index : batch) {
      segments.add(TextSegment.from(truncate(texts.get(index).strip())));
    }
    Response<List<Embedding>> response = model.embedAll(segments);
    List<Embedding> embeddings = response == null ? null : response.content();
    if (embeddings == null || embeddings.size() != segments.size()) {
      throw new EmbeddingException(
          "Model returned %d embeddings for %d inputs"
              .formatted(embeddings == null ? 0 : embeddings.size(), segments.size()));
    }
    for (int j = 0; j < batch.size(); j++) {
      Embedding embedding = embeddings.get(j);
      float[] raw = embedding == null ? null : embedding.vector();
      if (raw == null || raw.length == 0) {
        throw new EmbeddingException("Model returned an empty vector for batch input " + j);
      }
      float[] vector = normalize(raw);
      int index = batch.get(j);
      results[index] = vector;
      cache.put(cacheKey(texts.get(index)), vector);
    }
  }

  private static void awaitAll(List<Future<?>> futures) {
    try {
      for (Future<?> future : futures) {
        future.get();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(f -> f.cancel(true));
      throw new EmbeddingException("Interrupted while generating batch embeddings", e);
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      throw ExceptionUtil.rethrowIfUnchecked(
          e.getCause(),
          ex -> new EmbeddingException("Failed to generate batch embeddings", ex));
    }
  }

  /**
   * Embeds chunk contents and pairs each vector with its chunk id.
   *
   * @throws EmbeddingException when any chunk did not receive a vector
   */
  public List<EmbeddingVector> embedChunks(List<Chunk> chunks) {
    if (chunks.isEmpty()) return List.of();
    long started = System.nanoTime();
    List<String> contents = chunks.stream().map(Chunk::content).toList();
    List<IndexedVector> vectors = embedBatch(contents);
    if (vectors.size() != chunks.size()) {
      throw new EmbeddingException(
          "Expected %d chunk embeddings but got %d".formatted(chunks.size(), vectors.size()));
    }
    double perVectorMs = (System.nanoTime() - started) / 1_000_000.0 / chunks.size();
    Instant now = Instant.now();
    List<EmbeddingVector> out = new ArrayList<>(chunks.size());
    for (IndexedVector iv : vectors) {
      out.add(
          new EmbeddingVector(
              chunks.get(iv.index()).chunkId(),
              iv.vector(),
              iv.vector().length,
              modelInfo.name(),
              modelInfo.version(),
              now,
              perVectorMs));
    }
    return out;
  }

  /** Embeds a sample text and reports timing and the leading vector components. */
  public EmbeddingSelfTest testEmbedding(String text) {
    String sample = text == null || text.isBlank() ? "This is a test sentence." : text;
    long started = System.nanoTime();
    try {
      float[] vector = embed(sample);
      double ms = (System.nanoTime() - started) / 1_000_000.0;
      List<Float> head = new ArrayList<>();
      for (int i = 0; i < Math.min(SELF_TEST_SAMPLE, vector.length); i++) {
        head.add(vector[i]);
      }
      return new EmbeddingSelfTest(true, sample, vector.length, ms, modelInfo, head, null);
    } catch (RuntimeException e) {
      log.warn("Embedding self-test failed: {}", ExceptionUtil.describe(e));
      return new EmbeddingSelfTest(
          false, sample, 0, 0.0, modelInfo, List.of(), ExceptionUtil.describe(e));
    }
  }

  String truncate(String text) {
    int max = settings.maxSequenceLength();
    if (text.length() <= max) return text;
    String truncated = text.substring(0, max);
    int lastPeriod = truncated.lastIndexOf('.');
    if (lastPeriod > max * 0.8) {
      return truncated.substring(0, lastPeriod + 1);
    }
    return truncated;
  }

  private String cacheKey(String text) {
    return EmbeddingCache.key(modelInfo.name(), modelInfo.dimension(), text);
  }

  private static float[] vectorOf(Response<Embedding> response, String text) {
    Embedding embedding = response == null ? null : response.content();
    float[] vector = embedding == null ? null : embedding.vector();
    if (vector == null || vector.length == 0) {
      throw new EmbeddingException(
          "Model returned an empty vector for text of length " + text.length());
    }
    return vector;
  }

  /** L2-normalizes a copy of {@code raw}; a zero vector is rejected. */
  static float[] normalize(float[] raw) {
    double sum = 0;
    for (float v : raw) sum += (double) v * v;
    if (sum == 0 || Double.isNaN(sum)) {
      throw new EmbeddingException("Model returned a zero or invalid vector");
    }
    double norm = Math.sqrt(sum);
    float[] out = new float[raw.length];
    for (int i = 0; i < raw.length; i++) {
      out[i] = (float) (raw[i] / norm);
    }
    return out;
  }

  /** Persists the cache when enabled and stops the worker pool. */
  @Override
  public void close() {
    cache.save();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "embedding-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
