package com.flint.provider.snaptrade;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flint.config.SnapTradeProperties;
import com.flint.provider.JsonAliases;
import com.flint.provider.ProviderErrorClassifier;
import com.flint.provider.ProviderException;
import com.flint.provider.ProviderFailure;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorActivity;
import com.flint.provider.aggregator.AggregatorAuthorization;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.AggregatorPosition;
import com.flint.provider.aggregator.ProviderCredentials;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class SnapTradeClient implements AggregatorClient {
  private static final Logger log = LoggerFactory.getLogger(SnapTradeClient.class);
  private static final String HMAC_SHA256 = "HmacSHA256";
  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(15);

  private final SnapTradeProperties properties;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final ObjectMapper signingMapper;
  private final Clock clock;

  public SnapTradeClient(SnapTradeProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.signingMapper = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    this.clock = clock;
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) orDefault(properties.connectTimeout(), DEFAULT_CONNECT_TIMEOUT).toMillis());
    requestFactory.setReadTimeout((int) orDefault(properties.readTimeout(), DEFAULT_READ_TIMEOUT).toMillis());
    this.restClient = RestClient.builder()
        .requestFactory(requestFactory)
        .build();
  }

  @Override
  public ProviderCredentials registerIdentity(String providerUserId) {
    ObjectNode body = objectMapper.createObjectNode().put("userId", providerUserId);
    JsonNode response = exchange(HttpMethod.POST, "/api/v1/snapTrade/registerUser", Map.of(), null, body,
        "registerUser");
    String userId = JsonAliases.firstText(response, "userId", "user_id");
    String userSecret = JsonAliases.firstText(response, "userSecret", "user_secret");
    if (userId == null || userSecret == null) {
      throw new ProviderException(PROVIDER, ProviderFailure.UNKNOWN,
          "SnapTrade registerUser returned no credentials");
    }
    return new ProviderCredentials(userId, userSecret);
  }

  @Override
  public void deleteIdentity(String providerUserId) {
    exchange(HttpMethod.DELETE, "/api/v1/snapTrade/deleteUser", Map.of("userId", providerUserId), null, null,
        "deleteUser");
  }

  @Override
  public List<AggregatorAccount> listAccounts(ProviderCredentials credentials) {
    return SnapTradePayloads.accounts(
        exchange(HttpMethod.GET, "/api/v1/accounts", Map.of(), credentials, null, "listAccounts"));
  }

  @Override
  public List<AggregatorAuthorization> listAuthorizations(ProviderCredentials credentials) {
    return SnapTradePayloads.authorizations(
        exchange(HttpMethod.GET, "/api/v1/authorizations", Map.of(), credentials, null, "listAuthorizations"));
  }

  @Override
  public void removeAuthorization(ProviderCredentials credentials, String authorizationId) {
    exchange(HttpMethod.DELETE, "/api/v1/authorizations/" + authorizationId, Map.of(), credentials, null,
        "removeAuthorization");
  }

  @Override
  public List<AggregatorPosition> listPositions(ProviderCredentials credentials, String accountId) {
    return SnapTradePayloads.positions(
        exchange(HttpMethod.GET, "/api/v1/accounts/" + accountId + "/positions", Map.of(), credentials, null,
            "listPositions"));
  }

  @Override
  public List<AggregatorActivity> listActivities(ProviderCredentials credentials,
                                                 String accountId,
                                                 LocalDate startDate,
                                                 LocalDate endDate) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("accounts", accountId);
    if (startDate != null) {
      query.put("startDate", startDate.toString());
    }
    if (endDate != null) {
      query.put("endDate", endDate.toString());
    }
    return SnapTradePayloads.activities(
        exchange(HttpMethod.GET, "/api/v1/activities", query, credentials, null, "listActivities"));
  }

  @Override
  public String connectionPortalUrl(ProviderCredentials credentials) {
    ObjectNode body = objectMapper.createObjectNode();
    if (properties.redirectUrl() != null && !properties.redirectUrl().isBlank()) {
      body.put("customRedirect", properties.redirectUrl());
    }
    body.put("connectionType", "read");
    JsonNode response = exchange(HttpMethod.POST, "/api/v1/snapTrade/login", Map.of(), credentials, body, "login");
    return JsonAliases.firstText(response, "redirectURI", "redirect_uri", "loginRedirectURI");
  }

  private JsonNode exchange(HttpMethod method,
                            String path,
                            Map<String, String> extraQuery,
                            ProviderCredentials credentials,
                            JsonNode body,
                            String operation) {
    requireConfigured("clientId", properties.clientId());
    requireConfigured("consumerKey", properties.consumerKey());

    Map<String, String> params = new LinkedHashMap<>();
    params.put("clientId", properties.clientId());
    params.put("timestamp", String.valueOf(clock.instant().getEpochSecond()));
    if (credentials != null) {
      params.put("userId", credentials.providerUserId());
      params.put("userSecret", credentials.providerSecret());
    }
    params.putAll(extraQuery);
    String encodedQuery = params.entrySet().stream()
        .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
        .collect(Collectors.joining("&"));
    URI uri = URI.create(trimTrailingSlash(properties.baseUrl()) + path + "?" + encodedQuery);

    try {
      RestClient.RequestBodySpec spec = restClient.method(method)
          .uri(uri)
          .accept(MediaType.APPLICATION_JSON)
          .header("Signature", sign(path, encodedQuery, body));
      if (body != null) {
        spec = spec.contentType(MediaType.APPLICATION_JSON).body(body);
      }
      JsonNode response = spec.retrieve().body(JsonNode.class);
      log.debug("SnapTrade {} {} ok", method, path);
      return response;
    } catch (RestClientException ex) {
      ProviderException classified = ProviderErrorClassifier.classify(PROVIDER, operation, ex);
      log.warn("SnapTrade {} failed: {} ({})", operation, classified.getMessage(), classified.getFailure());
      throw classified;
    }
  }

  String sign(String path, String encodedQuery, JsonNode body) {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("content", body);
    content.put("path", path);
    content.put("query", encodedQuery);
    try {
      String payload = signingMapper.writeValueAsString(content);
      String key = encode(properties.consumerKey());
      Mac mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
      return Base64.getEncoder().encodeToString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize SnapTrade signature payload", ex);
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to sign SnapTrade request", ex);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static void requireConfigured(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new ProviderException(PROVIDER, ProviderFailure.AUTH_FAILED,
          "SnapTrade " + name + " is not configured");
    }
  }

  private static String trimTrailingSlash(String baseUrl) {
    if (baseUrl == null) {
      return "";
    }
    return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  private static Duration orDefault(Duration value, Duration fallback) {
    return value == null ? fallback : value;
  }
}
