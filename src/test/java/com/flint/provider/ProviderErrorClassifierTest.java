package com.flint.provider;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

class ProviderErrorClassifierTest {

  @Test
  void identityExistsByCodeOrMessage() {
    assertThat(ProviderErrorClassifier.classify(400, "1010", null)).isEqualTo(ProviderFailure.IDENTITY_EXISTS);
    assertThat(ProviderErrorClassifier.classify(400, null, "User already exists"))
        .isEqualTo(ProviderFailure.IDENTITY_EXISTS);
  }

  @Test
  void authCodesWinOverStatus() {
    assertThat(ProviderErrorClassifier.classify(400, "1076", null)).isEqualTo(ProviderFailure.AUTH_FAILED);
    assertThat(ProviderErrorClassifier.classify(500, "1083", null)).isEqualTo(ProviderFailure.AUTH_FAILED);
  }

  @Test
  void statusMapping() {
    assertThat(ProviderErrorClassifier.classify(401, null, null)).isEqualTo(ProviderFailure.AUTH_FAILED);
    assertThat(ProviderErrorClassifier.classify(404, null, null)).isEqualTo(ProviderFailure.NOT_FOUND);
    assertThat(ProviderErrorClassifier.classify(429, null, null)).isEqualTo(ProviderFailure.RATE_LIMITED);
    assertThat(ProviderErrorClassifier.classify(503, null, null)).isEqualTo(ProviderFailure.TRANSIENT);
    assertThat(ProviderErrorClassifier.classify(418, null, null)).isEqualTo(ProviderFailure.UNKNOWN);
  }

  @Test
  void readsCodeAndRetryAfterFromResponse() {
    HttpHeaders headers = new HttpHeaders();
    headers.add(HttpHeaders.RETRY_AFTER, "12");
    HttpClientErrorException response = HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS,
        "Too Many Requests", headers, "{\"code\":\"9999\",\"detail\":\"slow down\"}"
            .getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

    ProviderException ex = ProviderErrorClassifier.classify("aggregator", "list accounts", response);

    assertThat(ex.getFailure()).isEqualTo(ProviderFailure.RATE_LIMITED);
    assertThat(ex.getHttpStatus()).isEqualTo(429);
    assertThat(ex.getProviderCode()).isEqualTo("9999");
    assertThat(ex.getRetryAfterSeconds()).isEqualTo(12L);
    assertThat(ex.getMessage()).doesNotContain("slow down");
  }

  @Test
  void timeoutIsTransient() {
    ProviderException ex = ProviderErrorClassifier.classify("bank", "balances",
        new ResourceAccessException("Read timed out"));

    assertThat(ex.getFailure()).isEqualTo(ProviderFailure.TRANSIENT);
  }
}
