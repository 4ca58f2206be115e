package com.flint.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flint.config.CleanupProperties;
import com.flint.model.Connection;
import com.flint.provider.ProviderException;
import com.flint.provider.ProviderFailure;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.repository.ConnectionRepository;
import com.flint.repository.HoldingRepository;
import com.flint.service.lock.LocalExclusiveLock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class OrphanedConnectionCleanupTest {

  @Mock
  private CredentialStore credentialStore;

  @Mock
  private AggregatorClient aggregatorClient;

  @Mock
  private ConnectionRepository connectionRepository;

  @Mock
  private HoldingRepository holdingRepository;

  private final Instant now = Instant.parse("2026-03-01T10:00:00Z");
  private final UUID orphan = UUID.randomUUID();
  private final UUID active = UUID.randomUUID();
  private final ProviderCredentials orphanCredentials = new ProviderCredentials(orphan.toString(), "s1");
  private final ProviderCredentials activeCredentials = new ProviderCredentials(active.toString(), "s2");
  private OrphanedConnectionCleanup cleanup;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    when(credentialStore.userIdsCreatedBefore(now.minus(Duration.ofHours(24)))).thenReturn(List.of(orphan, active));
    when(credentialStore.find(orphan)).thenReturn(Optional.of(orphanCredentials));
    when(credentialStore.find(active)).thenReturn(Optional.of(activeCredentials));
    when(aggregatorClient.listAccounts(orphanCredentials)).thenReturn(List.of());
    when(aggregatorClient.listAccounts(activeCredentials)).thenReturn(List.of(
        new AggregatorAccount("acc", "auth", "Roth", null, "Vanguard", "IRA", "USD", null, null, null)));
    when(connectionRepository.findNotSyncedSince(any())).thenReturn(List.of());
    cleanup = new OrphanedConnectionCleanup(credentialStore, aggregatorClient, connectionRepository,
        holdingRepository, new LocalExclusiveLock(),
        new CleanupProperties(true, "0 0 */6 * * *", Duration.ofHours(24), Duration.ofDays(30)),
        Clock.fixed(now, ZoneOffset.UTC));
  }

  @Test
  void removesIdentitiesWithoutAccounts() {
    JobStatus status = cleanup.runSweep();

    verify(aggregatorClient).deleteIdentity(orphan.toString());
    verify(credentialStore).delete(orphan);
    verify(connectionRepository).deleteByUserId(orphan);
    verify(holdingRepository).deleteByUserId(orphan);
    verify(aggregatorClient, never()).deleteIdentity(active.toString());
    verify(credentialStore, never()).delete(active);
    assertThat(status.state()).isEqualTo(JobStatus.State.SUCCEEDED);
    assertThat(status.identitiesScanned()).isEqualTo(2);
    assertThat(status.identitiesRemoved()).isEqualTo(1);
    assertThat(cleanup.status()).isEqualTo(status);
  }

  @Test
  void removesLocalStateEvenWhenAggregatorDeleteFails() {
    doThrow(new ProviderException(AggregatorClient.PROVIDER, ProviderFailure.TRANSIENT, "timeout"))
        .when(aggregatorClient).deleteIdentity(orphan.toString());

    JobStatus status = cleanup.runSweep();

    verify(credentialStore).delete(orphan);
    assertThat(status.identitiesRemoved()).isEqualTo(1);
    assertThat(status.providerDeleteFailures()).isEqualTo(1);
  }

  @Test
  void keepsIdentityWhenAccountsCannotBeListed() {
    when(aggregatorClient.listAccounts(orphanCredentials))
        .thenThrow(new ProviderException(AggregatorClient.PROVIDER, ProviderFailure.AUTH_FAILED, "401"));

    JobStatus status = cleanup.runSweep();

    verify(aggregatorClient, never()).deleteIdentity(anyString());
    verify(credentialStore, never()).delete(any());
    assertThat(status.errors()).isEqualTo(1);
    assertThat(status.identitiesRemoved()).isZero();
  }

  @Test
  void keepsIdentityReplacedWhileAccountsWereListed() {
    AtomicReference<ProviderCredentials> stored = new AtomicReference<>(orphanCredentials);
    when(credentialStore.find(orphan)).thenAnswer(invocation -> Optional.of(stored.get()));
    when(aggregatorClient.listAccounts(orphanCredentials)).thenAnswer(invocation -> {
      stored.set(new ProviderCredentials(orphan + "-vnew", "s3"));
      return List.of();
    });

    JobStatus status = cleanup.runSweep();

    verify(aggregatorClient, never()).deleteIdentity(anyString());
    verify(credentialStore, never()).delete(orphan);
    verify(connectionRepository, never()).deleteByUserId(orphan);
    assertThat(status.identitiesRemoved()).isZero();
  }

  @Test
  void keepsIdentityWithStoredConnections() {
    when(connectionRepository.countByUserId(orphan)).thenReturn(1L);

    JobStatus status = cleanup.runSweep();

    verify(aggregatorClient, never()).deleteIdentity(orphan.toString());
    verify(credentialStore, never()).delete(orphan);
    assertThat(status.identitiesRemoved()).isZero();
  }

  @Test
  void unexpectedFailureForOneUserDoesNotStopTheSweep() {
    when(credentialStore.find(active)).thenThrow(new IllegalStateException("Failed to decrypt data"));

    JobStatus status = cleanup.runSweep();

    assertThat(status.state()).isEqualTo(JobStatus.State.SUCCEEDED);
    assertThat(status.identitiesRemoved()).isEqualTo(1);
    assertThat(status.errors()).isEqualTo(1);
    assertThat(status.lastError()).isEqualTo("Failed to decrypt data");
  }

  @Test
  void reportsStaleConnections() {
    Connection stale = new Connection();
    stale.setUserId(active);
    stale.setInstitutionName("Schwab");
    when(connectionRepository.findNotSyncedSince(now.minus(Duration.ofDays(30)))).thenReturn(List.of(stale));

    assertThat(cleanup.runSweep().staleConnections()).isEqualTo(1);
  }

  @Test
  void scheduledRunHonoursDisabledFlag() {
    OrphanedConnectionCleanup disabled = new OrphanedConnectionCleanup(credentialStore, aggregatorClient,
        connectionRepository, holdingRepository, new LocalExclusiveLock(),
        new CleanupProperties(false, null, null, null), Clock.fixed(now, ZoneOffset.UTC));

    disabled.scheduledRun();

    verify(credentialStore, never()).userIdsCreatedBefore(any());
    assertThat(disabled.status().state()).isEqualTo(JobStatus.State.IDLE);
  }
}
