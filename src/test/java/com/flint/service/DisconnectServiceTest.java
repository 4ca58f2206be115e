package com.flint.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import com.flint.service.lock.LocalExclusiveLock;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class DisconnectServiceTest {

  @Mock
  private ConnectedAccountRepository accountRepository;

  @Mock
  private ConnectionRepository connectionRepository;

  @Mock
  private HoldingRepository holdingRepository;

  @Mock
  private RegistrationCoordinator registrationCoordinator;

  @Mock
  private CredentialStore credentialStore;

  @Mock
  private AggregatorClient aggregatorClient;

  private DisconnectService service;
  private final UUID userId = UUID.randomUUID();
  private final ProviderCredentials credentials = new ProviderCredentials(userId.toString(), "secret");
  private Connection connection;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    connection = new Connection();
    connection.setId(UUID.randomUUID());
    connection.setUserId(userId);
    connection.setProviderAuthorizationId("auth-1");
    when(connectionRepository.findByUserIdAndProviderAuthorizationId(userId, "auth-1"))
        .thenReturn(Optional.of(connection));
    when(registrationCoordinator.requireCredentials(userId)).thenReturn(credentials);
    service = new DisconnectService(accountRepository, connectionRepository, holdingRepository,
        registrationCoordinator, credentialStore, aggregatorClient, new LocalExclusiveLock());
  }

  @Test
  void removesBankAccountOwnedByUser() {
    ConnectedAccount account = new ConnectedAccount();
    account.setId(UUID.randomUUID());
    account.setProvider(AccountProvider.BANK);
    when(accountRepository.findByIdAndUserId(account.getId(), userId)).thenReturn(Optional.of(account));

    service.disconnect(userId, "bank", account.getId().toString());

    verify(accountRepository).delete(account);
  }

  @Test
  void foreignOrMalformedAccountIsNotFound() {
    when(accountRepository.findByIdAndUserId(any(), any())).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.disconnect(userId, "crypto", UUID.randomUUID().toString()))
        .isInstanceOfSatisfying(ApiException.class, ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
    assertThatThrownBy(() -> service.disconnect(userId, "bank", "not-a-uuid"))
        .isInstanceOfSatisfying(ApiException.class, ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
  }

  @Test
  void unknownProviderIsValidationError() {
    assertThatThrownBy(() -> service.disconnect(userId, "carrier-pigeon", "x"))
        .isInstanceOfSatisfying(ApiException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
  }

  @Test
  void lastBrokerageDisconnectRemovesIdentity() {
    when(connectionRepository.countByUserId(userId)).thenReturn(0L);

    service.disconnect(userId, "brokerage", "auth-1");

    verify(aggregatorClient).removeAuthorization(credentials, "auth-1");
    verify(holdingRepository).deleteByUserIdAndAuthorizationId(userId, "auth-1");
    verify(connectionRepository).delete(connection);
    verify(aggregatorClient).deleteIdentity(userId.toString());
    verify(credentialStore).delete(userId);
  }

  @Test
  void keepsIdentityWhileOtherConnectionsRemain() {
    when(connectionRepository.countByUserId(userId)).thenReturn(1L);
    doThrow(new ProviderException(AggregatorClient.PROVIDER, ProviderFailure.NOT_FOUND, "gone"))
        .when(aggregatorClient).removeAuthorization(credentials, "auth-1");

    service.disconnect(userId, "snaptrade", "auth-1");

    verify(connectionRepository).delete(connection);
    verify(aggregatorClient, never()).deleteIdentity(anyString());
    verify(credentialStore, never()).delete(any());
  }

  @Test
  void identityDeleteFailureStillRemovesLocalIdentity() {
    when(connectionRepository.countByUserId(userId)).thenReturn(0L);
    doThrow(new ProviderException(AggregatorClient.PROVIDER, ProviderFailure.TRANSIENT, "timeout"))
        .when(aggregatorClient).deleteIdentity(userId.toString());
    when(connectionRepository.findById(connection.getId())).thenReturn(Optional.of(connection));

    service.disconnect(userId, "brokerage", connection.getId().toString());

    verify(credentialStore).delete(userId);
  }

  @Test
  void providerOutageKeepsLocalConnection() {
    doThrow(new ProviderException(AggregatorClient.PROVIDER, ProviderFailure.TRANSIENT, "timeout"))
        .when(aggregatorClient).removeAuthorization(credentials, "auth-1");

    assertThatThrownBy(() -> service.disconnect(userId, "brokerage", "auth-1"))
        .isInstanceOfSatisfying(ApiException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.SERVICE_UNAVAILABLE));
    verify(connectionRepository, never()).delete(any());
  }
}
