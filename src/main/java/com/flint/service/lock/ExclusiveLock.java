package com.flint.service.lock;

import java.util.function.Supplier;

/**
 * Runs an action while holding a lock scoped to {@code key}. Callers with different keys never wait on
 * each other. The lock is released when the action returns or throws.
 */
public interface ExclusiveLock {
  <T> T withExclusiveLock(String key, Supplier<T> action);
}
