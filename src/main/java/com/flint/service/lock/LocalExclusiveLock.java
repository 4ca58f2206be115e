package com.flint.service.lock;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "flint.locking", name = "mode", havingValue = "local")
public class LocalExclusiveLock implements ExclusiveLock {
  private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

  @Override
  public <T> T withExclusiveLock(String key, Supplier<T> action) {
    Entry entry = locks.compute(key, (ignored, existing) -> {
      Entry current = existing == null ? new Entry() : existing;
      current.holders++;
      return current;
    });
    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      locks.computeIfPresent(key, (ignored, current) -> --current.holders == 0 ? null : current);
    }
  }

  int trackedKeys() {
    return locks.size();
  }

  private static final class Entry {
    private final ReentrantLock lock = new ReentrantLock();
    // guarded by the map's per-key compute
    private int holders;
  }
}
