package com.acme.commanding.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;

public final class Jsons {
  private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static byte[] toJsonBytes(Object o) {
    return toJson(o).getBytes(StandardCharsets.UTF_8);
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJson(byte[] json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }
}
