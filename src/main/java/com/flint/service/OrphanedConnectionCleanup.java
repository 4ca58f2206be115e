package com.flint.service;

import com.flint.config.CleanupProperties;
import com.flint.model.Connection;
import com.flint.provider.ProviderException;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.repository.ConnectionRepository;
import com.flint.repository.HoldingRepository;
import com.flint.service.lock.ExclusiveLock;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OrphanedConnectionCleanup {
  private static final Logger log = LoggerFactory.getLogger(OrphanedConnectionCleanup.class);
  private static final Duration DEFAULT_MIN_IDENTITY_AGE = Duration.ofHours(24);
  private static final Duration DEFAULT_STALE_REPORT_AFTER = Duration.ofDays(30);

  private final CredentialStore credentialStore;
  private final AggregatorClient aggregatorClient;
  private final ConnectionRepository connectionRepository;
  private final HoldingRepository holdingRepository;
  private final ExclusiveLock exclusiveLock;
  private final CleanupProperties properties;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.idle());

  public OrphanedConnectionCleanup(CredentialStore credentialStore,
                                   AggregatorClient aggregatorClient,
                                   ConnectionRepository connectionRepository,
                                   HoldingRepository holdingRepository,
                                   ExclusiveLock exclusiveLock,
                                   CleanupProperties properties,
                                   Clock clock) {
    this.credentialStore = credentialStore;
    this.aggregatorClient = aggregatorClient;
    this.connectionRepository = connectionRepository;
    this.holdingRepository = holdingRepository;
    this.exclusiveLock = exclusiveLock;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${flint.cleanup.cron:0 0 */6 * * *}")
  public void scheduledRun() {
    if (!properties.enabled()) {
      return;
    }
    runSweep();
  }

  public JobStatus status() {
    return status.get();
  }

  public JobStatus runSweep() {
    if (!running.compareAndSet(false, true)) {
      log.info("Orphaned-connection cleanup already running, skipping");
      return status.get();
    }
    Instant startedAt = clock.instant();
    status.set(status.get().running(startedAt));
    int scanned = 0;
    int removed = 0;
    int deleteFailures = 0;
    int errors = 0;
    String lastError = null;
    try {
      Instant cutoff = startedAt.minus(orDefault(properties.minIdentityAge(), DEFAULT_MIN_IDENTITY_AGE));
      for (UUID userId : credentialStore.userIdsCreatedBefore(cutoff)) {
        scanned++;
        try {
          SweepOutcome outcome = sweep(userId);
          if (outcome == SweepOutcome.LISTING_FAILED) {
            errors++;
          } else if (outcome != SweepOutcome.KEPT) {
            removed++;
            if (outcome == SweepOutcome.REMOVED_LOCALLY_ONLY) {
              deleteFailures++;
            }
          }
        } catch (RuntimeException ex) {
          errors++;
          lastError = ex.getMessage();
          log.error("Cleanup failed for user {}", LogIds.hash(userId), ex);
        }
      }
      int stale = reportStaleConnections(startedAt);
      JobStatus finished = new JobStatus(JobStatus.State.SUCCEEDED, startedAt, clock.instant(), scanned, removed,
          deleteFailures, errors, stale, lastError);
      status.set(finished);
      log.info("Orphaned-connection cleanup finished: scanned={} removed={} providerDeleteFailures={} errors={}",
          scanned, removed, deleteFailures, errors);
      return finished;
    } catch (RuntimeException ex) {
      JobStatus failed = new JobStatus(JobStatus.State.FAILED, startedAt, clock.instant(), scanned, removed,
          deleteFailures, errors + 1, 0, ex.getMessage());
      status.set(failed);
      log.error("Orphaned-connection cleanup aborted", ex);
      return failed;
    } finally {
      running.set(false);
    }
  }

  private SweepOutcome sweep(UUID userId) {
    Optional<ProviderCredentials> credentials = credentialStore.find(userId);
    if (credentials.isEmpty()) {
      return SweepOutcome.KEPT;
    }
    List<AggregatorAccount> accounts;
    try {
      accounts = aggregatorClient.listAccounts(credentials.get());
    } catch (ProviderException ex) {
      // an unreadable identity is not an empty one
      log.warn("Could not list accounts for user {}, leaving identity in place: {}",
          LogIds.hash(userId), ex.getFailure());
      return SweepOutcome.LISTING_FAILED;
    }
    if (!accounts.isEmpty()) {
      return SweepOutcome.KEPT;
    }
    String providerUserId = credentials.get().providerUserId();
    return exclusiveLock.withExclusiveLock(RegistrationCoordinator.LOCK_PREFIX + userId,
        () -> exclusiveLock.withExclusiveLock(ConnectionSynchronizer.LOCK_PREFIX + userId,
            () -> removeIfStillOrphaned(userId, providerUserId)));
  }

  // registration or sync may have run between listing and locking
  private SweepOutcome removeIfStillOrphaned(UUID userId, String providerUserId) {
    Optional<ProviderCredentials> current = credentialStore.find(userId);
    if (current.isEmpty() || !providerUserId.equals(current.get().providerUserId())) {
      log.info("Aggregator identity of user {} changed during cleanup, keeping it", LogIds.hash(userId));
      return SweepOutcome.KEPT;
    }
    if (connectionRepository.countByUserId(userId) > 0) {
      log.info("User {} has stored connections, keeping aggregator identity", LogIds.hash(userId));
      return SweepOutcome.KEPT;
    }
    return removeIdentity(userId, providerUserId);
  }

  private SweepOutcome removeIdentity(UUID userId, String providerUserId) {
    boolean providerDeleted = true;
    try {
      aggregatorClient.deleteIdentity(providerUserId);
    } catch (ProviderException ex) {
      providerDeleted = false;
      log.warn("Aggregator refused to delete orphaned identity of user {}, removing local state anyway: {}",
          LogIds.hash(userId), ex.getFailure());
    }
    holdingRepository.deleteByUserId(userId);
    connectionRepository.deleteByUserId(userId);
    credentialStore.delete(userId);
    log.info("Removed orphaned aggregator identity of user {}", LogIds.hash(userId));
    return providerDeleted ? SweepOutcome.REMOVED : SweepOutcome.REMOVED_LOCALLY_ONLY;
  }

  private int reportStaleConnections(Instant now) {
    Instant cutoff = now.minus(orDefault(properties.staleReportAfter(), DEFAULT_STALE_REPORT_AFTER));
    List<Connection> stale = connectionRepository.findNotSyncedSince(cutoff);
    for (Connection connection : stale) {
      log.info("Connection {} ({}) of user {} not synced since {}",
          connection.getId(), connection.getInstitutionName(), LogIds.hash(connection.getUserId()),
          connection.getLastSyncAt());
    }
    return stale.size();
  }

  private static Duration orDefault(Duration value, Duration fallback) {
    return value == null ? fallback : value;
  }

  enum SweepOutcome {
    KEPT,
    LISTING_FAILED,
    REMOVED,
    REMOVED_LOCALLY_ONLY
  }
}
