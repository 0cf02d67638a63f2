package com.gentoro.docsearch.config;

import com.gentoro.docsearch.exception.ConfigException;
import java.nio.file.Path;

/** Location of the persisted index and the name of the table holding chunk rows. */
public record DatabaseSettings(Path path, String table) {

  public DatabaseSettings {
    if (path == null) {
      throw new ConfigException("database.path must be set");
    }
    if (table == null || !table.matches("[A-Za-z0-9_\\-]+")) {
      throw new ConfigException("database.table must be a simple identifier, got '" + table + "'");
    }
  }

  public static DatabaseSettings defaults() {
    return new DatabaseSettings(Path.of("./data/index"), "blog_content");
  }

  /** Directory that holds the table's index files. */
  public Path tableDirectory() {
    return path.resolve(table);
  }
}
