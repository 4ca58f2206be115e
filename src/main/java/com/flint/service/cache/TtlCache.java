package com.flint.service.cache;

import java.time.Duration;
import java.util.Optional;

public interface TtlCache {
  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  long increment(String key, Duration ttl);

  Optional<Duration> timeToLive(String key);

  void evict(String key);
}
