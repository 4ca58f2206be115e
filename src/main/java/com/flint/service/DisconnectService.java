package com.flint.service;

import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.model.AccountProvider;
import com.flint.model.ConnectedAccount;
import com.flint.model.Connection;
import com.flint.provider.ProviderException;
import com.flint.provider.ProviderFailure;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.repository.ConnectedAccountRepository;
import com.flint.repository.ConnectionRepository;
import com.flint.repository.HoldingRepository;
import com.flint.service.lock.ExclusiveLock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DisconnectService {
  private static final Logger log = LoggerFactory.getLogger(DisconnectService.class);

  private final ConnectedAccountRepository accountRepository;
  private final ConnectionRepository connectionRepository;
  private final HoldingRepository holdingRepository;
  private final RegistrationCoordinator registrationCoordinator;
  private final CredentialStore credentialStore;
  private final AggregatorClient aggregatorClient;
  private final ExclusiveLock exclusiveLock;

  public DisconnectService(ConnectedAccountRepository accountRepository,
                           ConnectionRepository connectionRepository,
                           HoldingRepository holdingRepository,
                           RegistrationCoordinator registrationCoordinator,
                           CredentialStore credentialStore,
                           AggregatorClient aggregatorClient,
                           ExclusiveLock exclusiveLock) {
    this.accountRepository = accountRepository;
    this.connectionRepository = connectionRepository;
    this.holdingRepository = holdingRepository;
    this.registrationCoordinator = registrationCoordinator;
    this.credentialStore = credentialStore;
    this.aggregatorClient = aggregatorClient;
    this.exclusiveLock = exclusiveLock;
  }

  public void disconnect(UUID userId, String providerPath, String id) {
    AccountProvider provider = AccountProvider.fromPath(providerPath);
    if (provider == null) {
      throw new ApiException(ErrorCode.VALIDATION_ERROR, "Unknown provider: " + providerPath);
    }
    if (provider == AccountProvider.BROKERAGE) {
      disconnectBrokerage(userId, id);
    } else {
      disconnectStoredAccount(userId, provider, id);
    }
  }

  private void disconnectStoredAccount(UUID userId, AccountProvider provider, String id) {
    ConnectedAccount account = parseUuid(id)
        .flatMap(accountId -> accountRepository.findByIdAndUserId(accountId, userId))
        .filter(found -> found.getProvider() == provider)
        .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "Account not found"));
    accountRepository.delete(account);
    log.info("Disconnected {} account {} for user {}", provider, account.getId(), LogIds.hash(userId));
  }

  private void disconnectBrokerage(UUID userId, String id) {
    Connection connection = connectionRepository.findByUserIdAndProviderAuthorizationId(userId, id)
        .or(() -> parseUuid(id).flatMap(connectionRepository::findById)
            .filter(found -> userId.equals(found.getUserId())))
        .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "Connection not found"));
    ProviderCredentials credentials = registrationCoordinator.requireCredentials(userId);

    exclusiveLock.withExclusiveLock(RegistrationCoordinator.LOCK_PREFIX + userId, () -> {
      String authorizationId = connection.getProviderAuthorizationId();
      try {
        aggregatorClient.removeAuthorization(credentials, authorizationId);
      } catch (ProviderException ex) {
        if (!ex.is(ProviderFailure.NOT_FOUND)) {
          throw ProviderErrorTranslator.translate(userId, "disconnect", ex);
        }
        log.info("Authorization {} already gone at the aggregator", authorizationId);
      }
      holdingRepository.deleteByUserIdAndAuthorizationId(userId, authorizationId);
      connectionRepository.delete(connection);
      log.info("Disconnected brokerage authorization {} for user {}", authorizationId, LogIds.hash(userId));

      if (connectionRepository.countByUserId(userId) == 0) {
        deleteIdentity(userId, credentials);
      }
      return null;
    });
  }

  private void deleteIdentity(UUID userId, ProviderCredentials credentials) {
    try {
      aggregatorClient.deleteIdentity(credentials.providerUserId());
    } catch (ProviderException ex) {
      log.warn("Aggregator identity of user {} not deleted after last disconnect: {}",
          LogIds.hash(userId), ex.getFailure());
    }
    credentialStore.delete(userId);
    log.info("Removed aggregator identity of user {} after last brokerage disconnect", LogIds.hash(userId));
  }

  private static Optional<UUID> parseUuid(String value) {
    try {
      return Optional.of(UUID.fromString(value));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
