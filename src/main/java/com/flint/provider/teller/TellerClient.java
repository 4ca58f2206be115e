package com.flint.provider.teller;

import com.fasterxml.jackson.databind.JsonNode;
import com.flint.config.TellerProperties;
import com.flint.provider.ProviderErrorClassifier;
import com.flint.provider.ProviderException;
import com.flint.provider.ProviderFailure;
import com.flint.provider.bank.BankAccount;
import com.flint.provider.bank.BankBalance;
import com.flint.provider.bank.BankClient;
import com.flint.provider.bank.BankTransaction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class TellerClient implements BankClient {
  private static final Logger log = LoggerFactory.getLogger(TellerClient.class);

  private final RestClient restClient;

  public TellerClient(TellerProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) orDefault(properties.connectTimeout(), Duration.ofSeconds(5)).toMillis());
    requestFactory.setReadTimeout((int) orDefault(properties.readTimeout(), Duration.ofSeconds(15)).toMillis());
    String baseUrl = properties.baseUrl() == null ? "https://api.teller.io" : properties.baseUrl();
    this.restClient = RestClient.builder()
        .baseUrl(baseUrl)
        .requestFactory(requestFactory)
        .build();
  }

  @Override
  public List<BankAccount> listAccounts(String accessToken) {
    return TellerPayloads.accounts(get("/accounts", accessToken, "listAccounts"));
  }

  @Override
  public BankAccount getAccount(String accessToken, String accountId) {
    BankAccount account = TellerPayloads.account(get("/accounts/{id}", accessToken, "getAccount", accountId));
    if (account == null) {
      throw new ProviderException(PROVIDER, ProviderFailure.NOT_FOUND,
          "Teller getAccount returned no account");
    }
    return account;
  }

  @Override
  public BankBalance getBalances(String accessToken, String accountId) {
    return TellerPayloads.balance(get("/accounts/{id}/balances", accessToken, "getBalances", accountId));
  }

  @Override
  public List<BankTransaction> listTransactions(String accessToken, String accountId, int count) {
    return TellerPayloads.transactions(
        get("/accounts/{id}/transactions?count={count}", accessToken, "listTransactions", accountId, count));
  }

  private JsonNode get(String uri, String accessToken, String operation, Object... variables) {
    try {
      return restClient.get()
          .uri(uri, variables)
          .header(HttpHeaders.AUTHORIZATION, basic(accessToken))
          .accept(MediaType.APPLICATION_JSON)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientException ex) {
      ProviderException classified = ProviderErrorClassifier.classify(PROVIDER, operation, ex);
      log.warn("Teller {} failed: {} ({})", operation, classified.getMessage(), classified.getFailure());
      throw classified;
    }
  }

  private static String basic(String accessToken) {
    String raw = accessToken + ":";
    return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
  }

  private static Duration orDefault(Duration value, Duration fallback) {
    return value == null ? fallback : value;
  }
}
