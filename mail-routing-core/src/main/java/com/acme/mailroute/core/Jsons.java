package com.acme.mailroute.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import java.util.Map;

/** Shared Jackson mapper for the JSON columns (headers, probabilities, keywords, action log). */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
  private static final TypeReference<Map<String, Double>> DOUBLE_MAP = new TypeReference<>() {};
  private static final TypeReference<Map<String, List<String>>> LIST_MAP =
      new TypeReference<>() {};

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new PermanentException("Cannot serialize " + o.getClass().getSimpleName(), e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new PermanentException("Cannot deserialize " + clazz.getSimpleName(), e);
    }
  }

  public static <T> T fromJson(String json, TypeReference<T> type) {
    try {
      return M.readValue(json, type);
    } catch (Exception e) {
      throw new PermanentException("Cannot deserialize " + type.getType(), e);
    }
  }

  /** Null and blank columns read back as an empty map. */
  public static Map<String, String> toStringMap(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    return fromJson(json, STRING_MAP);
  }

  public static Map<String, Double> toDoubleMap(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    return fromJson(json, DOUBLE_MAP);
  }

  public static Map<String, List<String>> toListMap(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    return fromJson(json, LIST_MAP);
  }
}
