package com.flint.controller;

import com.flint.config.RateLimitProperties;
import com.flint.dto.ConnectionResponse;
import com.flint.dto.LinkBankRequest;
import com.flint.dto.LinkResult;
import com.flint.dto.RegistrationResponse;
import com.flint.dto.SyncResponse;
import com.flint.provider.ProviderException;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.service.BankLinkService;
import com.flint.service.ConnectionSynchronizer;
import com.flint.service.CurrentUserService;
import com.flint.service.RegistrationCoordinator;
import com.flint.service.cache.RateLimiter;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ConnectionController {
  private static final Logger log = LoggerFactory.getLogger(ConnectionController.class);
  private static final int DEFAULT_REGISTER_LIMIT = 5;
  private static final Duration DEFAULT_REGISTER_WINDOW = Duration.ofMinutes(1);

  private final RegistrationCoordinator registrationCoordinator;
  private final ConnectionSynchronizer connectionSynchronizer;
  private final BankLinkService bankLinkService;
  private final AggregatorClient aggregatorClient;
  private final CurrentUserService currentUserService;
  private final RateLimiter rateLimiter;
  private final RateLimitProperties rateLimitProperties;

  public ConnectionController(RegistrationCoordinator registrationCoordinator,
                              ConnectionSynchronizer connectionSynchronizer,
                              BankLinkService bankLinkService,
                              AggregatorClient aggregatorClient,
                              CurrentUserService currentUserService,
                              RateLimiter rateLimiter,
                              RateLimitProperties rateLimitProperties) {
    this.registrationCoordinator = registrationCoordinator;
    this.connectionSynchronizer = connectionSynchronizer;
    this.bankLinkService = bankLinkService;
    this.aggregatorClient = aggregatorClient;
    this.currentUserService = currentUserService;
    this.rateLimiter = rateLimiter;
    this.rateLimitProperties = rateLimitProperties;
  }

  @PostMapping("/connections/register")
  public RegistrationResponse register(@RequestParam(name = "repair", defaultValue = "false") boolean repair) {
    UUID userId = currentUserService.requireUserId();
    rateLimiter.acquire("register:" + userId, registerLimit(), registerWindow());
    ProviderCredentials credentials = repair
        ? registrationCoordinator.repairProviderIdentity(userId)
        : registrationCoordinator.ensureProviderIdentity(userId);
    String connectionUrl = null;
    try {
      connectionUrl = aggregatorClient.connectionPortalUrl(credentials);
    } catch (ProviderException ex) {
      log.warn("Connection portal URL unavailable: {}", ex.getFailure());
    }
    return new RegistrationResponse(true, connectionUrl);
  }

  @PostMapping("/connections/sync")
  public SyncResponse syncConnections() {
    return connectionSynchronizer.syncConnections(currentUserService.requireUserId());
  }

  @PostMapping("/connections/sync/{authorizationId}")
  public ConnectionResponse syncConnection(@PathVariable String authorizationId) {
    return connectionSynchronizer.syncOneConnection(currentUserService.requireUserId(), authorizationId);
  }

  @GetMapping("/connections")
  public List<ConnectionResponse> listConnections() {
    return connectionSynchronizer.listConnections(currentUserService.requireUserId());
  }

  @PostMapping("/connections/bank")
  public ResponseEntity<LinkResult> linkBank(@Valid @RequestBody LinkBankRequest request) {
    LinkResult result = bankLinkService.linkAccounts(currentUserService.requireUserId(), request);
    if (result.isLimitReached()) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN).body(result);
    }
    return ResponseEntity.ok(result);
  }

  private int registerLimit() {
    return rateLimitProperties.registerLimit() > 0 ? rateLimitProperties.registerLimit() : DEFAULT_REGISTER_LIMIT;
  }

  private Duration registerWindow() {
    return rateLimitProperties.registerWindow() == null
        ? DEFAULT_REGISTER_WINDOW
        : rateLimitProperties.registerWindow();
  }
}
