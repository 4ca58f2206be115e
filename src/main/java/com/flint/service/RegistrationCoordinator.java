package com.flint.service;

import com.flint.config.RequestIdFilter;
import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.provider.ProviderException;
import com.flint.provider.ProviderFailure;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.service.lock.ExclusiveLock;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Guarantees at most one aggregator identity per user, however many requests race to create it, and
 * repairs identities that exist at the aggregator but not locally.
 */
@Service
public class RegistrationCoordinator {
  private static final Logger log = LoggerFactory.getLogger(RegistrationCoordinator.class);
  static final String LOCK_PREFIX = "aggregator-identity:";

  private final CredentialStore credentialStore;
  private final AggregatorClient aggregatorClient;
  private final ExclusiveLock exclusiveLock;
  private final Clock clock;

  public RegistrationCoordinator(CredentialStore credentialStore,
                                 AggregatorClient aggregatorClient,
                                 ExclusiveLock exclusiveLock,
                                 Clock clock) {
    this.credentialStore = credentialStore;
    this.aggregatorClient = aggregatorClient;
    this.exclusiveLock = exclusiveLock;
    this.clock = clock;
  }

  public ProviderCredentials ensureProviderIdentity(UUID userId) {
    Optional<ProviderCredentials> existing = credentialStore.find(userId);
    if (existing.isPresent()) {
      return existing.get();
    }
    return exclusiveLock.withExclusiveLock(LOCK_PREFIX + userId, () -> {
      Optional<ProviderCredentials> created = credentialStore.find(userId);
      if (created.isPresent()) {
        log.debug("Aggregator identity for user {} created by a concurrent request", LogIds.hash(userId));
        return created.get();
      }
      return register(userId);
    });
  }

  public ProviderCredentials repairProviderIdentity(UUID userId) {
    return exclusiveLock.withExclusiveLock(LOCK_PREFIX + userId, () -> {
      String providerUserId = credentialStore.find(userId)
          .map(ProviderCredentials::providerUserId)
          .orElse(userId.toString());
      return recoverOrphan(userId, providerUserId);
    });
  }

  public ProviderCredentials requireCredentials(UUID userId) {
    ProviderCredentials credentials = credentialStore.find(userId).orElseThrow(ApiException::notRegistered);
    String expected = userId.toString();
    String actual = credentials.providerUserId();
    if (actual == null || !(actual.equals(expected) || actual.startsWith(expected + "-v"))) {
      log.error("Stored aggregator identity does not belong to user {} (request {})",
          LogIds.hash(userId), RequestIdFilter.currentRequestId());
      throw new ApiException(ErrorCode.USER_MISMATCH,
          "Stored brokerage identity does not match this user. Re-register to repair it.");
    }
    return credentials;
  }

  private ProviderCredentials register(UUID userId) {
    String providerUserId = userId.toString();
    try {
      ProviderCredentials created = aggregatorClient.registerIdentity(providerUserId);
      credentialStore.save(userId, created);
      log.info("Registered aggregator identity for user {}", LogIds.hash(userId));
      return created;
    } catch (ProviderException ex) {
      if (ex.is(ProviderFailure.IDENTITY_EXISTS)) {
        log.warn("Aggregator already holds an identity for user {} with no local credentials, recovering",
            LogIds.hash(userId));
        return recoverOrphan(userId, providerUserId);
      }
      throw ProviderErrorTranslator.translate(userId, "registration", ex);
    }
  }

  private ProviderCredentials recoverOrphan(UUID userId, String orphanedProviderUserId) {
    try {
      aggregatorClient.deleteIdentity(orphanedProviderUserId);
    } catch (ProviderException ex) {
      if (!ex.is(ProviderFailure.NOT_FOUND)) {
        log.error("Could not delete orphaned aggregator identity for user {} (request {}): {}",
            LogIds.hash(userId), RequestIdFilter.currentRequestId(), ex.getMessage());
        throw new ApiException(ErrorCode.SERVICE_UNAVAILABLE,
            "Brokerage registration is temporarily unavailable, try again shortly", ex);
      }
    }
    credentialStore.delete(userId);

    // deletion at the aggregator is eventually consistent, so the replacement gets a fresh id
    String replacementId = userId + "-v" + Long.toString(clock.millis(), 36);
    try {
      ProviderCredentials created = aggregatorClient.registerIdentity(replacementId);
      credentialStore.save(userId, created);
      log.info("Replaced orphaned aggregator identity for user {}", LogIds.hash(userId));
      return created;
    } catch (ProviderException ex) {
      log.error("Re-registration after orphan recovery failed for user {} (request {}): {}",
          LogIds.hash(userId), RequestIdFilter.currentRequestId(), ex.getMessage());
      if (ex.is(ProviderFailure.RATE_LIMITED)) {
        throw ApiException.rateLimited(ex.getRetryAfterSeconds());
      }
      throw new ApiException(ErrorCode.SERVICE_UNAVAILABLE,
          "Brokerage registration is temporarily unavailable, try again shortly", ex);
    }
  }
}
