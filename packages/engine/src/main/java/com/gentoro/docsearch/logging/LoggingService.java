package com.gentoro.docsearch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logger lookup, YAML-driven log levels and the MDC keys that tie log lines to an indexing run.
 *
 * <p>Indexing operations open an {@link #operationScope(String)} so every line they log carries
 * {@value #MDC_OPERATION_ID}; per-document work adds {@value #MDC_DOCUMENT}. Both are printed by
 * the bundled {@code logback.xml}.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  public static final String MDC_OPERATION_ID = "operationId";
  public static final String MDC_DOCUMENT = "document";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /** Tags log lines of the current thread with an indexing operation id until closed. */
  public static Scope operationScope(String operationId) {
    return new Scope(MDC_OPERATION_ID, operationId);
  }

  /** Tags log lines of the current thread with a document key ({@code category/slug}). */
  public static Scope documentScope(String documentKey) {
    return new Scope(MDC_DOCUMENT, documentKey);
  }

  /**
   * Applies {@code logging.level.*} from the engine configuration, e.g.
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.docsearch: DEBUG
   *     org.apache.lucene: WARN
   * </pre>
   *
   * Unknown levels are skipped with a warning. Without a Logback backend nothing is changed.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("Logging backend is not Logback; logging.level settings are ignored");
      return;
    }
    Configuration levels = cfg.subset("logging.level");
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, null);
      if (value == null || value.isBlank()) continue;
      // hierarchical configurations escape dots inside a key by doubling them
      String loggerName = key.replace("..", ".");
      String name = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      setLevel(ctx.getLogger(name), value);
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String value) {
    Level level = Level.toLevel(value.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}' for logger {}; ignoring", value, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Logger '{}' set to {}", logger.getName(), level);
  }

  /** An MDC entry that restores the previous value of its key when closed. */
  public static final class Scope implements AutoCloseable {
    private final String key;
    private final String previous;

    private Scope(String key, String value) {
      this.key = key;
      this.previous = MDC.get(key);
      if (value == null) {
        MDC.remove(key);
      } else {
        MDC.put(key, value);
      }
    }

    @Override
    public void close() {
      if (previous == null) {
        MDC.remove(key);
      } else {
        MDC.put(key, previous);
      }
    }
  }
}
