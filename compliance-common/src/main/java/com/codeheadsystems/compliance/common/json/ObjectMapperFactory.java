package com.codeheadsystems.compliance.common.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Builds the object mappers used for every persisted format. Instants and durations are written as ISO-8601
 * text so files stay readable and round-trip without loss of precision.
 */
public class ObjectMapperFactory {

  private ObjectMapperFactory() {
  }

  /**
   * The mapper for files on disk.
   *
   * @return the object mapper
   */
  public static ObjectMapper objectMapper() {
    return builder().build();
  }

  /**
   * A mapper whose output is stable for equal values: properties sorted by name, map entries sorted by key.
   * Used where the bytes are hashed.
   *
   * @return the object mapper
   */
  public static ObjectMapper canonicalObjectMapper() {
    return builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();
  }

  private static JsonMapper.Builder builder() {
    return JsonMapper.builder()
        .addModule(new Jdk8Module())
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

}
