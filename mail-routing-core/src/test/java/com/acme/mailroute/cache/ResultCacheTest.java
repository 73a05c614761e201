package com.acme.mailroute.cache;

import static org.assertj.core.api.Assertions.*;

import com.acme.mailroute.domain.ClassificationResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResultCacheTest {

  private static ClassificationResult result(String category) {
    return ClassificationResult.of(category, Map.of(category, 1.0), "test", null);
  }

  @Nested
  @DisplayName("getOrCompute")
  class GetOrComputeTests {

    @Test
    @DisplayName("should compute on miss and serve the stored value on hit")
    void missThenHit() {
      var cache = new ResultCache(10);
      var calls = new AtomicInteger();
      Supplier<ClassificationResult> compute =
          () -> {
            calls.incrementAndGet();
            return result("spam");
          };

      CacheLookup first = cache.getOrCompute("fp", compute);
      CacheLookup second = cache.getOrCompute("fp", compute);

      assertThat(first.fromCache()).isFalse();
      assertThat(second.fromCache()).isTrue();
      assertThat(second.result()).isSameAs(first.result());
      assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("should refresh the access timestamp on hit")
    void refreshesAccess() {
      var clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
      var cache = new ResultCache(10, clock);
      cache.getOrCompute("fp", () -> result("spam"));

      clock.now = Instant.parse("2025-01-01T00:05:00Z");
      CacheLookup hit = cache.getOrCompute("fp", () -> result("other"));

      assertThat(hit.accessedAt()).isEqualTo(clock.now);
      assertThat(cache.lastAccess("fp")).isEqualTo(clock.now);
      assertThat(hit.result().category()).isEqualTo("spam");
    }
  }

  @Nested
  @DisplayName("FIFO eviction")
  class EvictionTests {

    @Test
    @DisplayName("capacity + 1 inserts should evict exactly the first-inserted entry")
    void evictsFirstInserted() {
      int capacity = 5;
      var cache = new ResultCache(capacity);

      for (int i = 0; i <= capacity; i++) {
        cache.getOrCompute("fp-" + i, () -> result("updates"));
      }

      assertThat(cache.size()).isEqualTo(capacity);
      assertThat(cache.contains("fp-0")).isFalse();
      for (int i = 1; i <= capacity; i++) {
        assertThat(cache.contains("fp-" + i)).as("fp-%d", i).isTrue();
      }
    }

    @Test
    @DisplayName("a recently read entry is still evicted first when it is the oldest")
    void readDoesNotProtect() {
      var cache = new ResultCache(2);
      cache.getOrCompute("a", () -> result("x"));
      cache.getOrCompute("b", () -> result("x"));
      cache.getOrCompute("a", () -> result("x"));

      cache.getOrCompute("c", () -> result("x"));

      assertThat(cache.contains("a")).isFalse();
      assertThat(cache.contains("b")).isTrue();
      assertThat(cache.contains("c")).isTrue();
    }
  }

  @Test
  @DisplayName("should reject a non-positive capacity")
  void rejectsZeroCapacity() {
    assertThatThrownBy(() -> new ResultCache(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("clear should empty the cache")
  void clear() {
    var cache = new ResultCache(3);
    cache.getOrCompute("a", () -> result("x"));

    cache.clear();

    assertThat(cache.size()).isZero();
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    @Override
    public ZoneOffset getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
