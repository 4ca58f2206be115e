package com.flint.service.cache;

import com.flint.error.ApiException;
import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
public class RateLimiter {
  private final TtlCache cache;

  public RateLimiter(TtlCache cache) {
    this.cache = cache;
  }

  public void acquire(String key, int limit, Duration window) {
    if (limit <= 0) {
      return;
    }
    String counterKey = "ratelimit:" + key;
    long count = cache.increment(counterKey, window);
    if (count > limit) {
      long retryAfter = cache.timeToLive(counterKey)
          .map(remaining -> Math.max(1L, (remaining.toMillis() + 999) / 1000))
          .orElse(window.toSeconds());
      throw ApiException.rateLimited(retryAfter);
    }
  }
}
