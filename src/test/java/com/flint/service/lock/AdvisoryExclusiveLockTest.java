package com.flint.service.lock;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AdvisoryExclusiveLockTest {

  @Test
  void lockIdIsStablePerKey() {
    assertThat(AdvisoryExclusiveLock.lockId("aggregator-identity:42"))
        .isEqualTo(AdvisoryExclusiveLock.lockId("aggregator-identity:42"));
    assertThat(AdvisoryExclusiveLock.lockId("aggregator-identity:42"))
        .isNotEqualTo(AdvisoryExclusiveLock.lockId("connections:42"));
  }
}
