package com.flint.service;

import com.flint.config.SyncProperties;
import com.flint.dto.ConnectionResponse;
import com.flint.dto.SyncResponse;
import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.model.Connection;
import com.flint.model.ConnectionHealth;
import com.flint.provider.ProviderException;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorAuthorization;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.repository.ConnectionRepository;
import com.flint.service.lock.ExclusiveLock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ConnectionSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(ConnectionSynchronizer.class);
  static final String LOCK_PREFIX = "connections:";
  private static final Duration DEFAULT_STALE_AFTER = Duration.ofHours(48);
  private static final String FALLBACK_INSTITUTION = "Brokerage";

  private final RegistrationCoordinator registrationCoordinator;
  private final AggregatorClient aggregatorClient;
  private final ConnectionRepository connectionRepository;
  private final ConnectionLimitPolicy limitPolicy;
  private final ExclusiveLock exclusiveLock;
  private final Clock clock;
  private final Duration staleAfter;

  public ConnectionSynchronizer(RegistrationCoordinator registrationCoordinator,
                                AggregatorClient aggregatorClient,
                                ConnectionRepository connectionRepository,
                                ConnectionLimitPolicy limitPolicy,
                                ExclusiveLock exclusiveLock,
                                SyncProperties properties,
                                Clock clock) {
    this.registrationCoordinator = registrationCoordinator;
    this.aggregatorClient = aggregatorClient;
    this.connectionRepository = connectionRepository;
    this.limitPolicy = limitPolicy;
    this.exclusiveLock = exclusiveLock;
    this.clock = clock;
    this.staleAfter = properties.staleAfter() == null ? DEFAULT_STALE_AFTER : properties.staleAfter();
  }

  public SyncResponse syncConnections(UUID userId) {
    ProviderCredentials credentials = registrationCoordinator.requireCredentials(userId);
    Map<String, ObservedAuthorization> observed = observe(userId, credentials);
    return exclusiveLock.withExclusiveLock(LOCK_PREFIX + userId, () -> upsertAll(userId, observed.values()));
  }

  public ConnectionResponse syncOneConnection(UUID userId, String authorizationId) {
    ProviderCredentials credentials = registrationCoordinator.requireCredentials(userId);
    ObservedAuthorization target = observe(userId, credentials).get(authorizationId);
    if (target == null) {
      throw new ApiException(ErrorCode.CONNECTION_NOT_VISIBLE,
          "Connection is not visible at the brokerage yet, retry in a few seconds");
    }
    return exclusiveLock.withExclusiveLock(LOCK_PREFIX + userId, () -> {
      Instant now = clock.instant();
      Optional<Connection> existing =
          connectionRepository.findByUserIdAndProviderAuthorizationId(userId, authorizationId);
      if (existing.isEmpty() && limitPolicy.allowance(userId).remaining() == 0) {
        throw new ApiException(ErrorCode.FORBIDDEN, "Connection limit reached for your plan");
      }
      return toResponse(upsert(userId, existing, target, now), now);
    });
  }

  public List<ConnectionResponse> listConnections(UUID userId) {
    Instant now = clock.instant();
    return connectionRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
        .map(connection -> toResponse(connection, now))
        .toList();
  }

  public ConnectionHealth health(Connection connection) {
    return ConnectionHealth.of(connection, clock.instant(), staleAfter);
  }

  Map<String, ObservedAuthorization> observe(UUID userId, ProviderCredentials credentials) {
    List<AggregatorAuthorization> authorizations;
    List<AggregatorAccount> accounts;
    try {
      authorizations = aggregatorClient.listAuthorizations(credentials);
      accounts = aggregatorClient.listAccounts(credentials);
    } catch (ProviderException ex) {
      throw ProviderErrorTranslator.translate(userId, "connection sync", ex);
    }

    Map<String, ObservedAuthorization> observed = new LinkedHashMap<>();
    for (AggregatorAuthorization authorization : authorizations) {
      observed.put(authorization.id(),
          new ObservedAuthorization(authorization.id(), authorization.brokerageName(), authorization.disabled()));
    }
    int unresolved = 0;
    for (AggregatorAccount account : accounts) {
      String authorizationId = account.authorizationId();
      if (authorizationId == null) {
        unresolved++;
        continue;
      }
      ObservedAuthorization known = observed.get(authorizationId);
      if (known == null) {
        observed.put(authorizationId, new ObservedAuthorization(authorizationId, account.institutionName(), false));
      } else if (known.institutionName() == null && account.institutionName() != null) {
        observed.put(authorizationId, new ObservedAuthorization(authorizationId, account.institutionName(),
            known.disabled()));
      }
    }
    if (unresolved > 0) {
      log.warn("Skipped {} aggregator accounts without an authorization reference for user {}",
          unresolved, LogIds.hash(userId));
    }
    return observed;
  }

  private SyncResponse upsertAll(UUID userId, Iterable<ObservedAuthorization> observed) {
    Instant now = clock.instant();
    ConnectionLimitPolicy.Allowance allowance = limitPolicy.allowance(userId);
    long slots = allowance.remaining();
    int added = 0;
    int updated = 0;
    int rejected = 0;
    List<ConnectionResponse> responses = new ArrayList<>();
    for (ObservedAuthorization authorization : observed) {
      Optional<Connection> existing =
          connectionRepository.findByUserIdAndProviderAuthorizationId(userId, authorization.id());
      if (existing.isEmpty()) {
        if (slots <= 0) {
          rejected++;
          continue;
        }
        slots--;
        added++;
      } else {
        updated++;
      }
      responses.add(toResponse(upsert(userId, existing, authorization, now), now));
    }
    if (rejected > 0) {
      log.info("Connection limit {} reached for user {}, {} authorizations not stored",
          allowance.limit(), LogIds.hash(userId), rejected);
    }
    String message = rejected > 0
        ? rejected + " connection(s) exceed your plan limit of " + allowance.limit() + " and were not saved"
        : null;
    return new SyncResponse(responses, added, updated, rejected, allowance.limit(), message);
  }

  private Connection upsert(UUID userId,
                            Optional<Connection> existing,
                            ObservedAuthorization authorization,
                            Instant now) {
    Connection connection = existing.orElseGet(() -> {
      Connection created = new Connection();
      created.setUserId(userId);
      created.setProviderAuthorizationId(authorization.id());
      created.setCreatedAt(now);
      return created;
    });
    if (authorization.institutionName() != null) {
      connection.setInstitutionName(authorization.institutionName());
    } else if (connection.getInstitutionName() == null) {
      connection.setInstitutionName(FALLBACK_INSTITUTION);
    }
    connection.setDisabled(authorization.disabled());
    connection.setUpdatedAt(now);
    connection.setLastSyncAt(now);
    return connectionRepository.save(connection);
  }

  private ConnectionResponse toResponse(Connection connection, Instant now) {
    return new ConnectionResponse(
        connection.getId(),
        connection.getProviderAuthorizationId(),
        connection.getInstitutionName(),
        connection.isDisabled(),
        ConnectionHealth.of(connection, now, staleAfter),
        connection.getCreatedAt(),
        connection.getUpdatedAt(),
        connection.getLastSyncAt());
  }

  record ObservedAuthorization(String id, String institutionName, boolean disabled) {}
}
