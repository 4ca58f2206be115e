package com.flint.model;

import java.time.Duration;
import java.time.Instant;

public enum ConnectionHealth {
  CONNECTED,
  DISCONNECTED,
  DISABLED;

  public static ConnectionHealth of(Connection connection, Instant now, Duration staleAfter) {
    if (connection.isDisabled()) {
      return DISABLED;
    }
    Instant lastSync = connection.getLastSyncAt();
    if (lastSync == null || lastSync.isBefore(now.minus(staleAfter))) {
      return DISCONNECTED;
    }
    return CONNECTED;
  }
}
