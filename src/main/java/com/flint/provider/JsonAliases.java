package com.flint.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;

public final class JsonAliases {
  private JsonAliases() {
  }

  public static JsonNode first(JsonNode node, String... paths) {
    if (node == null || node.isNull()) {
      return null;
    }
    for (String path : paths) {
      JsonNode value = at(node, path);
      if (value != null && !value.isNull() && !value.isMissingNode()) {
        return value;
      }
    }
    return null;
  }

  public static String firstText(JsonNode node, String... paths) {
    if (node == null || node.isNull()) {
      return null;
    }
    for (String path : paths) {
      JsonNode value = at(node, path);
      if (value == null || value.isNull() || value.isContainerNode()) {
        continue;
      }
      String text = value.asText();
      if (!text.isBlank()) {
        return text;
      }
    }
    return null;
  }

  public static BigDecimal firstDecimal(JsonNode node, String... paths) {
    if (node == null || node.isNull()) {
      return null;
    }
    for (String path : paths) {
      BigDecimal value = decimal(at(node, path));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  public static boolean firstBoolean(JsonNode node, boolean fallback, String... paths) {
    JsonNode value = first(node, paths);
    if (value == null) {
      return fallback;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    return "true".equalsIgnoreCase(value.asText());
  }

  public static BigDecimal decimal(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isObject()) {
      return decimal(value.get("amount"));
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    String text = value.asText().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static JsonNode at(JsonNode node, String path) {
    JsonNode current = node;
    for (String segment : path.split("\\.")) {
      if (current == null || !current.isObject()) {
        return null;
      }
      current = current.get(segment);
    }
    return current;
  }
}
