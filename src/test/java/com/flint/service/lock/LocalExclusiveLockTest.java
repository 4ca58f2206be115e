package com.flint.service.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LocalExclusiveLockTest {

  private final LocalExclusiveLock lock = new LocalExclusiveLock();

  @Test
  void serializesActionsOnTheSameKey() throws Exception {
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(6);
    List<Future<Integer>> results = new ArrayList<>();
    try {
      for (int i = 0; i < 6; i++) {
        results.add(pool.submit(() -> lock.withExclusiveLock("user-1", () -> {
          int now = inside.incrementAndGet();
          maxInside.accumulateAndGet(now, Math::max);
          sleep(20);
          inside.decrementAndGet();
          return now;
        })));
      }
      for (Future<Integer> result : results) {
        result.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(lock.trackedKeys()).isZero();
  }

  @Test
  void differentKeysDoNotBlockEachOther() throws Exception {
    CountDownLatch firstHolding = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<String> first = pool.submit(() -> lock.withExclusiveLock("a", () -> {
        firstHolding.countDown();
        await(release);
        return "a";
      }));
      assertThat(firstHolding.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(lock.withExclusiveLock("b", () -> "b")).isEqualTo("b");

      release.countDown();
      assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("a");
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void releasesLockWhenActionThrows() {
    assertThatThrownBy(() -> lock.withExclusiveLock("k", () -> {
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);

    assertThat(lock.trackedKeys()).isZero();
    assertThat(lock.withExclusiveLock("k", () -> 42)).isEqualTo(42);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ex);
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ex);
    }
  }
}
