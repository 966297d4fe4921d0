package com.acme.pubsub.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

public final class Jsons {
  private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot serialize " + o.getClass().getName(), e);
    }
  }

  public static byte[] toBytes(Object o) {
    try {
      return M.writeValueAsBytes(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot serialize " + o.getClass().getName(), e);
    }
  }

  public static <T> T fromBytes(byte[] json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot deserialize " + clazz.getName(), e);
    }
  }

  /** Attribute maps are persisted as flat JSON objects. */
  public static String attributesToJson(Map<String, String> attributes) {
    return toJson(attributes == null ? Map.of() : attributes);
  }

  public static Map<String, String> attributesFromJson(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return M.readValue(json, STRING_MAP);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot deserialize attributes", e);
    }
  }
}
