package com.flint.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public final class ProviderErrorClassifier {
  static final Set<String> IDENTITY_EXISTS_CODES = Set.of("1010");
  static final Set<String> AUTH_CODES = Set.of("1076", "1083", "1012");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ProviderErrorClassifier() {
  }

  public static ProviderException classify(String provider, String operation, RestClientException ex) {
    if (ex instanceof ResourceAccessException) {
      return new ProviderException(provider, ProviderFailure.TRANSIENT,
          provider + " " + operation + " timed out or was unreachable", null, null, null, ex);
    }
    if (!(ex instanceof RestClientResponseException response)) {
      return new ProviderException(provider, ProviderFailure.UNKNOWN,
          provider + " " + operation + " failed", null, null, null, ex);
    }
    int status = response.getStatusCode().value();
    JsonNode body = parseBody(response.getResponseBodyAsString());
    String code = textOf(body, "code");
    String detail = firstNonBlank(textOf(body, "detail"), textOf(body, "message"), textOf(body, "error"));
    Long retryAfter = parseRetryAfter(response.getResponseHeaders());
    ProviderFailure failure = classify(status, code, detail);
    String message = provider + " " + operation + " failed with HTTP " + status
        + (code == null ? "" : " (code " + code + ")");
    return new ProviderException(provider, failure, message, status, code, retryAfter, ex);
  }

  static ProviderFailure classify(int status, String code, String detail) {
    if (code != null && IDENTITY_EXISTS_CODES.contains(code)) {
      return ProviderFailure.IDENTITY_EXISTS;
    }
    if (detail != null && detail.toLowerCase(Locale.ROOT).contains("already exist")) {
      return ProviderFailure.IDENTITY_EXISTS;
    }
    if (code != null && AUTH_CODES.contains(code)) {
      return ProviderFailure.AUTH_FAILED;
    }
    return switch (status) {
      case 401, 403 -> ProviderFailure.AUTH_FAILED;
      case 429 -> ProviderFailure.RATE_LIMITED;
      case 404 -> ProviderFailure.NOT_FOUND;
      case 408, 500, 502, 503, 504 -> ProviderFailure.TRANSIENT;
      default -> status >= 500 ? ProviderFailure.TRANSIENT : ProviderFailure.UNKNOWN;
    };
  }

  private static JsonNode parseBody(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readTree(body);
    } catch (JsonProcessingException ex) {
      // plain-text error pages carry no code
      return null;
    }
  }

  private static String textOf(JsonNode body, String field) {
    if (body == null || !body.isObject()) {
      return null;
    }
    JsonNode value = body.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  private static Long parseRetryAfter(HttpHeaders headers) {
    if (headers == null) {
      return null;
    }
    String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (value == null) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      // HTTP-date form is not used by our providers
      return null;
    }
  }
}
