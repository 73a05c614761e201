package com.acme.mailroute.cache;

import com.acme.mailroute.domain.ClassificationResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded memo of classification results keyed by content fingerprint.
 *
 * <p>Eviction is FIFO by insertion order: a hit refreshes the entry's access time but does not move
 * it, so a frequently read entry is still the first to go once it is the oldest.
 *
 * <p>The compute function runs under the cache lock. Two threads asking for the same missing
 * fingerprint therefore compute it once.
 */
public class ResultCache {
  private static final Logger LOG = LoggerFactory.getLogger(ResultCache.class);

  private final int capacity;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  // access-order=false keeps iteration in insertion order
  private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, false);
  private long insertions;

  public ResultCache(int capacity) {
    this(capacity, Clock.systemUTC());
  }

  public ResultCache(int capacity, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.clock = clock;
  }

  public CacheLookup getOrCompute(String fingerprint, Supplier<ClassificationResult> compute) {
    lock.lock();
    try {
      Instant now = clock.instant();
      Entry hit = entries.get(fingerprint);
      if (hit != null) {
        hit.lastAccess = now;
        return new CacheLookup(hit.result, true, now);
      }
      ClassificationResult computed = compute.get();
      entries.put(fingerprint, new Entry(computed, ++insertions, now));
      if (entries.size() > capacity) {
        evictOldest();
      }
      return new CacheLookup(computed, false, now);
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(String fingerprint) {
    lock.lock();
    try {
      return entries.containsKey(fingerprint);
    } finally {
      lock.unlock();
    }
  }

  /** Last time the entry was written or read, or null when absent. */
  public Instant lastAccess(String fingerprint) {
    lock.lock();
    try {
      Entry e = entries.get(fingerprint);
      return e == null ? null : e.lastAccess;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return capacity;
  }

  public void clear() {
    lock.lock();
    try {
      entries.clear();
    } finally {
      lock.unlock();
    }
  }

  private void evictOldest() {
    Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
    Map.Entry<String, Entry> oldest = it.next();
    it.remove();
    LOG.debug(
        "Evicted fingerprint {} (insertion #{})", oldest.getKey(), oldest.getValue().sequence);
  }

  private static final class Entry {
    private final ClassificationResult result;
    private final long sequence;
    private Instant lastAccess;

    private Entry(ClassificationResult result, long sequence, Instant lastAccess) {
      this.result = result;
      this.sequence = sequence;
      this.lastAccess = lastAccess;
    }
  }
}
