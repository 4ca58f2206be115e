package com.flint.service.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class InMemoryTtlCache implements TtlCache {
  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryTtlCache(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> get(String key) {
    return live(key).map(Entry::value);
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    entries.put(key, new Entry(value, clock.instant().plus(ttl)));
  }

  @Override
  public long increment(String key, Duration ttl) {
    Instant now = clock.instant();
    Entry updated = entries.compute(key, (ignored, existing) -> {
      if (existing == null || existing.isExpired(now)) {
        return new Entry("1", now.plus(ttl));
      }
      long next = Long.parseLong(existing.value()) + 1;
      return new Entry(Long.toString(next), existing.expiresAt());
    });
    return Long.parseLong(updated.value());
  }

  @Override
  public Optional<Duration> timeToLive(String key) {
    Instant now = clock.instant();
    return live(key).map(entry -> Duration.between(now, entry.expiresAt()));
  }

  @Override
  public void evict(String key) {
    entries.remove(key);
  }

  @Scheduled(fixedDelayString = "${flint.cache.sweep-ms:60000}")
  public void sweepExpired() {
    Instant now = clock.instant();
    entries.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
  }

  int size() {
    return entries.size();
  }

  private Optional<Entry> live(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  private record Entry(String value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
