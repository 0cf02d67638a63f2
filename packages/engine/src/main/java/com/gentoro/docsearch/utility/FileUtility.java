package com.gentoro.docsearch.utility;

import com.gentoro.docsearch.exception.IoException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

public final class FileUtility {
  private FileUtility() {}

  /** Recursively deletes {@code dir}; missing directories are ignored. */
  public static void deleteDir(Path dir, boolean quietly) {
    try {
      if (Files.exists(dir)) {
        try (var paths = Files.walk(dir)) {
          paths
              .sorted(Comparator.reverseOrder()) // delete children first
              .forEach(
                  path -> {
                    try {
                      Files.delete(path);
                    } catch (IOException e) {
                      throw new IoException("Failed to delete file: " + path, e);
                    }
                  });
        }
      }
    } catch (Exception e) {
      if (!quietly) {
        throw new IoException("Failed to delete directory: " + dir, e);
      }
    }
  }

  public static String readString(Path file) {
    try {
      return Files.readString(file);
    } catch (IOException e) {
      throw new IoException("Failed to read file: " + file, e);
    }
  }

  public static void createDirectories(Path dir) {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new IoException("Failed to create directory: " + dir, e);
    }
  }
}
