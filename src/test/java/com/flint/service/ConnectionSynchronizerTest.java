package com.flint.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flint.config.SyncProperties;
import com.flint.dto.ConnectionResponse;
import com.flint.dto.SyncResponse;
import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.model.Connection;
import com.flint.model.ConnectionHealth;
import com.flint.model.SubscriptionTier;
import com.flint.provider.ProviderException;
import com.flint.provider.ProviderFailure;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorAuthorization;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.repository.ConnectionRepository;
import com.flint.service.lock.LocalExclusiveLock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ConnectionSynchronizerTest {

  @Mock
  private RegistrationCoordinator registrationCoordinator;

  @Mock
  private AggregatorClient aggregatorClient;

  @Mock
  private ConnectionRepository connectionRepository;

  @Mock
  private ConnectionLimitPolicy limitPolicy;

  private ConnectionSynchronizer synchronizer;
  private final UUID userId = UUID.randomUUID();
  private final Instant now = Instant.parse("2026-03-01T10:00:00Z");
  private final ProviderCredentials credentials = new ProviderCredentials("provider-user", "secret");

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    when(registrationCoordinator.requireCredentials(userId)).thenReturn(credentials);
    when(connectionRepository.findByUserIdAndProviderAuthorizationId(eq(userId), anyString()))
        .thenReturn(Optional.empty());
    when(connectionRepository.save(any(Connection.class))).thenAnswer(inv -> inv.getArgument(0));
    when(limitPolicy.allowance(userId))
        .thenReturn(new ConnectionLimitPolicy.Allowance(SubscriptionTier.PREMIUM, false, null, 0));
    synchronizer = new ConnectionSynchronizer(registrationCoordinator, aggregatorClient, connectionRepository,
        limitPolicy, new LocalExclusiveLock(), new SyncProperties(Duration.ofHours(48)),
        Clock.fixed(now, ZoneOffset.UTC));
  }

  @Test
  void storesAuthorizationsOnlyReferencedByAccounts() {
    when(aggregatorClient.listAuthorizations(credentials)).thenReturn(List.of(
        new AggregatorAuthorization("auth-1", "Robinhood", false)));
    when(aggregatorClient.listAccounts(credentials)).thenReturn(List.of(
        account("acc-1", "auth-1", "Robinhood"),
        account("acc-2", "auth-2", "Fidelity"),
        account("acc-3", null, "Unknown")));

    SyncResponse response = synchronizer.syncConnections(userId);

    assertThat(response.getAdded()).isEqualTo(2);
    assertThat(response.getRejected()).isZero();
    assertThat(response.getConnections())
        .extracting(ConnectionResponse::getAuthorizationId, ConnectionResponse::getInstitutionName)
        .containsExactly(
            tuple("auth-1", "Robinhood"),
            tuple("auth-2", "Fidelity"));
    assertThat(response.getConnections())
        .allSatisfy(connection -> assertThat(connection.getHealth()).isEqualTo(ConnectionHealth.CONNECTED));
  }

  @Test
  void updatesExistingConnectionInPlace() {
    Connection existing = new Connection();
    existing.setUserId(userId);
    existing.setProviderAuthorizationId("auth-1");
    existing.setInstitutionName("Old name");
    existing.setCreatedAt(now.minus(Duration.ofDays(3)));
    existing.setUpdatedAt(now.minus(Duration.ofDays(3)));
    when(connectionRepository.findByUserIdAndProviderAuthorizationId(userId, "auth-1"))
        .thenReturn(Optional.of(existing));
    when(aggregatorClient.listAuthorizations(credentials)).thenReturn(List.of(
        new AggregatorAuthorization("auth-1", "Schwab", true)));
    when(aggregatorClient.listAccounts(credentials)).thenReturn(List.of());

    SyncResponse response = synchronizer.syncConnections(userId);

    assertThat(response.getUpdated()).isEqualTo(1);
    assertThat(response.getAdded()).isZero();
    assertThat(existing.getInstitutionName()).isEqualTo("Schwab");
    assertThat(existing.isDisabled()).isTrue();
    assertThat(existing.getLastSyncAt()).isEqualTo(now);
    assertThat(response.getConnections().get(0).getHealth()).isEqualTo(ConnectionHealth.DISABLED);
  }

  @Test
  void rejectsNewAuthorizationsBeyondPlanLimit() {
    when(limitPolicy.allowance(userId))
        .thenReturn(new ConnectionLimitPolicy.Allowance(SubscriptionTier.FREE, false, 2, 1));
    when(aggregatorClient.listAuthorizations(credentials)).thenReturn(List.of(
        new AggregatorAuthorization("auth-1", "A", false),
        new AggregatorAuthorization("auth-2", "B", false),
        new AggregatorAuthorization("auth-3", "C", false)));
    when(aggregatorClient.listAccounts(credentials)).thenReturn(List.of());

    SyncResponse response = synchronizer.syncConnections(userId);

    assertThat(response.getAdded()).isEqualTo(1);
    assertThat(response.getRejected()).isEqualTo(2);
    assertThat(response.getLimit()).isEqualTo(2);
    assertThat(response.getMessage()).contains("limit of 2");
    ArgumentCaptor<Connection> saved = ArgumentCaptor.forClass(Connection.class);
    verify(connectionRepository, times(1)).save(saved.capture());
    assertThat(saved.getValue().getProviderAuthorizationId()).isEqualTo("auth-1");
  }

  @Test
  void singleSyncReportsAuthorizationNotYetVisible() {
    when(aggregatorClient.listAuthorizations(credentials)).thenReturn(List.of());
    when(aggregatorClient.listAccounts(credentials)).thenReturn(List.of());

    assertThatThrownBy(() -> synchronizer.syncOneConnection(userId, "auth-new"))
        .isInstanceOfSatisfying(ApiException.class, ex -> {
          assertThat(ex.getCode()).isEqualTo(ErrorCode.CONNECTION_NOT_VISIBLE);
          assertThat(ex.getCode().retryable()).isTrue();
        });
    verify(connectionRepository, never()).save(any());
  }

  @Test
  void singleSyncStoresVisibleAuthorization() {
    when(aggregatorClient.listAuthorizations(credentials)).thenReturn(List.of());
    when(aggregatorClient.listAccounts(credentials)).thenReturn(List.of(account("acc-1", "auth-new", "Vanguard")));

    ConnectionResponse response = synchronizer.syncOneConnection(userId, "auth-new");

    assertThat(response.getAuthorizationId()).isEqualTo("auth-new");
    assertThat(response.getInstitutionName()).isEqualTo("Vanguard");
  }

  @Test
  void singleSyncRefusesNewConnectionWithoutFreeSlot() {
    when(limitPolicy.allowance(userId))
        .thenReturn(new ConnectionLimitPolicy.Allowance(SubscriptionTier.FREE, false, 2, 2));
    when(aggregatorClient.listAuthorizations(credentials)).thenReturn(List.of(
        new AggregatorAuthorization("auth-new", "A", false)));
    when(aggregatorClient.listAccounts(credentials)).thenReturn(List.of());

    assertThatThrownBy(() -> synchronizer.syncOneConnection(userId, "auth-new"))
        .isInstanceOfSatisfying(ApiException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.FORBIDDEN));
  }

  @Test
  void providerOutageIsServiceUnavailable() {
    when(aggregatorClient.listAuthorizations(credentials))
        .thenThrow(new ProviderException(AggregatorClient.PROVIDER, ProviderFailure.TRANSIENT, "timeout"));

    assertThatThrownBy(() -> synchronizer.syncConnections(userId))
        .isInstanceOfSatisfying(ApiException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.SERVICE_UNAVAILABLE));
  }

  @Test
  void staleConnectionIsDisconnected() {
    Connection connection = new Connection();
    connection.setLastSyncAt(now.minus(Duration.ofHours(49)));

    assertThat(synchronizer.health(connection)).isEqualTo(ConnectionHealth.DISCONNECTED);
  }

  private static AggregatorAccount account(String id, String authorizationId, String institution) {
    return new AggregatorAccount(id, authorizationId, "Individual", "1234", institution, "margin", "USD",
        null, null, null);
  }
}
