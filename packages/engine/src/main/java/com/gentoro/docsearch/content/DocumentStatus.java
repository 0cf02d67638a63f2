package com.gentoro.docsearch.content;

import com.gentoro.docsearch.exception.ValidationException;
import java.util.Locale;

/** Publication status declared in a document's metadata descriptor. */
public enum DocumentStatus {
  DRAFT,
  PUBLISHED,
  ARCHIVED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DocumentStatus parse(String value) {
    if (value == null || value.isBlank()) {
      return PUBLISHED;
    }
    for (DocumentStatus status : values()) {
      if (status.value().equals(value.trim())) {
        return status;
      }
    }
    throw new ValidationException(
        "Status must be one of [draft, published, archived], got '" + value + "'");
  }
}
