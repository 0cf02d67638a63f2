package com.gentoro.docsearch.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gentoro.docsearch.exception.SerializationException;

/** Shared Jackson mappers: YAML for metadata descriptors, JSON for the embedding cache. */
public final class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final ObjectMapper JSON_MAPPER =
      JsonMapper.builder()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .serializationInclusion(JsonInclude.Include.NON_NULL)
          .build();

  private JacksonUtility() {}

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }
}
