package com.flint.service;

import java.time.Instant;

public record JobStatus(
    State state,
    Instant lastStartedAt,
    Instant lastFinishedAt,
    int identitiesScanned,
    int identitiesRemoved,
    int providerDeleteFailures,
    int errors,
    int staleConnections,
    String lastError
) {
  public enum State {
    IDLE,
    RUNNING,
    SUCCEEDED,
    FAILED
  }

  public static JobStatus idle() {
    return new JobStatus(State.IDLE, null, null, 0, 0, 0, 0, 0, null);
  }

  JobStatus running(Instant startedAt) {
    return new JobStatus(State.RUNNING, startedAt, lastFinishedAt, identitiesScanned, identitiesRemoved,
        providerDeleteFailures, errors, staleConnections, lastError);
  }
}
