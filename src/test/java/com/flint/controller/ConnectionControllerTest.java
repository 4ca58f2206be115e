package com.flint.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.provider.bank.BankClient;
import com.flint.repository.UserIdentityRepository;
import com.flint.service.JwtService;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ConnectionControllerTest {

  @Autowired
  MockMvc mockMvc;

  @Autowired
  JwtService jwtService;

  @Autowired
  UserIdentityRepository userIdentityRepository;

  @MockBean
  AggregatorClient aggregatorClient;

  @MockBean
  BankClient bankClient;

  private UUID userId;
  private String bearer;

  @BeforeEach
  void setUp() {
    userId = UUID.randomUUID();
    bearer = "Bearer " + jwtService.generateToken(userId);
    when(aggregatorClient.registerIdentity(anyString()))
        .thenAnswer(inv -> new ProviderCredentials(inv.getArgument(0), "secret-" + inv.getArgument(0)));
    when(aggregatorClient.connectionPortalUrl(any())).thenReturn("https://portal.example/connect");
  }

  @Test
  void unauthenticatedRequestGetsJsonError() throws Exception {
    mockMvc.perform(get("/api/dashboard"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"))
        .andExpect(jsonPath("$.error.requestId").exists());
  }

  @Test
  void mutatingRequestWithoutAntiForgeryTokenIsRejected() throws Exception {
    mockMvc.perform(post("/api/connections/sync")
            .header(HttpHeaders.AUTHORIZATION, bearer)
            .header("X-Request-Id", "req-123"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error.code").value("FORBIDDEN"))
        .andExpect(jsonPath("$.error.message").value(containsString("anti-forgery")))
        .andExpect(jsonPath("$.error.requestId").value("req-123"))
        .andExpect(header().string("X-Request-Id", "req-123"));
  }

  @Test
  void syncBeforeRegistrationRequiresRegistration() throws Exception {
    mockMvc.perform(post("/api/connections/sync")
            .with(csrf().asHeader())
            .header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isPreconditionRequired())
        .andExpect(jsonPath("$.error.code").value("NOT_REGISTERED"))
        .andExpect(jsonPath("$.error.retryable").value(false))
        .andExpect(jsonPath("$.message").exists());
  }

  @Test
  void registerIsIdempotent() throws Exception {
    for (int i = 0; i < 2; i++) {
      mockMvc.perform(post("/api/connections/register")
              .with(csrf().asHeader())
              .header(HttpHeaders.AUTHORIZATION, bearer))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.registered").value(true))
          .andExpect(jsonPath("$.connectionUrl").value("https://portal.example/connect"));
    }

    verify(aggregatorClient, times(1)).registerIdentity(userId.toString());
    assertThat(userIdentityRepository.findById(userId)).hasValueSatisfying(identity -> {
      assertThat(identity.getProviderUserId()).isEqualTo(userId.toString());
      assertThat(identity.getEncryptedProviderSecret()).doesNotContain("secret-");
    });
  }

  @Test
  void simultaneousRegistrationsCreateOneIdentity() throws Exception {
    when(aggregatorClient.registerIdentity(anyString())).thenAnswer(inv -> {
      Thread.sleep(100);
      return new ProviderCredentials(inv.getArgument(0), "secret-" + inv.getArgument(0));
    });
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int i = 0; i < 2; i++) {
        results.add(executor.submit(() -> {
          start.await();
          return mockMvc.perform(post("/api/connections/register")
                  .with(csrf().asHeader())
                  .header(HttpHeaders.AUTHORIZATION, bearer))
              .andReturn().getResponse().getStatus();
        }));
      }
      start.countDown();

      for (Future<Integer> result : results) {
        assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(200);
      }
    } finally {
      executor.shutdownNow();
    }

    verify(aggregatorClient, times(1)).registerIdentity(anyString());
    assertThat(userIdentityRepository.findAll())
        .filteredOn(identity -> identity.getProviderUserId().startsWith(userId.toString()))
        .singleElement()
        .satisfies(identity -> assertThat(identity.getProviderUserId()).isEqualTo(userId.toString()));
  }

  @Test
  void registerIsRateLimited() throws Exception {
    for (int i = 0; i < 5; i++) {
      mockMvc.perform(post("/api/connections/register")
              .with(csrf().asHeader())
              .header(HttpHeaders.AUTHORIZATION, bearer))
          .andExpect(status().isOk());
    }

    mockMvc.perform(post("/api/connections/register")
            .with(csrf().asHeader())
            .header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
        .andExpect(jsonPath("$.error.code").value("RATE_LIMITED"))
        .andExpect(jsonPath("$.error.retryable").value(true))
        .andExpect(jsonPath("$.retryAfter").isNumber());
  }

  @Test
  void dashboardWithoutAccountsNeedsConnection() throws Exception {
    mockMvc.perform(get("/api/dashboard").header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.needsConnection").value(true))
        .andExpect(jsonPath("$.isAdmin").value(false))
        .andExpect(jsonPath("$.connectionStatus.snapTradeError").value("not_connected"));
  }

  @Test
  void disconnectingUnknownAccountIsNotFound() throws Exception {
    mockMvc.perform(delete("/api/accounts/bank/" + UUID.randomUUID())
            .with(csrf().asHeader())
            .header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
  }

  @Test
  void cleanupJobRequiresAdmin() throws Exception {
    mockMvc.perform(get("/api/admin/jobs/orphan-cleanup").header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error.code").value("FORBIDDEN"));
  }

  @Test
  void csrfEndpointIssuesToken() throws Exception {
    mockMvc.perform(get("/api/csrf"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.headerName").value("X-CSRF-Token"))
        .andExpect(jsonPath("$.token").isNotEmpty());
  }
}
