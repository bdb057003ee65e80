package com.killradar.killfeed.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Lenient field readers for upstream JSON, where ids may arrive as numbers or strings. */
public final class JsonFields {
  private JsonFields() {}

  public static Long longOrNull(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isIntegralNumber()) {
      return value.asLong();
    }
    if (value.isTextual()) {
      try {
        return Long.parseLong(value.asText().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  public static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.isTextual()) {
      return null;
    }
    String text = value.asText().trim();
    return text.isEmpty() ? null : text;
  }

  public static Double doubleOrNull(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isNumber()) {
      return value.asDouble();
    }
    if (value.isTextual()) {
      try {
        return Double.parseDouble(value.asText().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }
}
