package com.gentoro.docsearch.exception;

/** Invalid or missing configuration detected while building engine components. */
public class ConfigException extends DocSearchException {
  public ConfigException(String message) {
    super(DocSearchErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DocSearchErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
