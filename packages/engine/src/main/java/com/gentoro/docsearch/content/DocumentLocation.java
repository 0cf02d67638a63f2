package com.gentoro.docsearch.content;

import java.nio.file.Path;

/**
 * A discovered document directory {@code <root>/<category>/<slug>/}. The category and slug are
 * taken from the directory names.
 */
public record DocumentLocation(String category, String slug, Path directory) {

  public String key() {
    return category + "/" + slug;
  }
}
