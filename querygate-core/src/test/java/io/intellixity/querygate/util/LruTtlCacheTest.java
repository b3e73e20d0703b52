package io.intellixity.querygate.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class LruTtlCacheTest {
  @Test
  void expiresAfterTtl() {
    AtomicLong now = new AtomicLong(0);
    LruTtlCache<String, String> cache = new LruTtlCache<>(10, 100, 0, now::get);
    cache.put("a", "1");
    now.set(99);
    assertEquals("1", cache.get("a"));
    now.set(100);
    assertNull(cache.get("a"));
  }

  @Test
  void evictsLeastRecentlyUsed() {
    LruTtlCache<String, String> cache = new LruTtlCache<>(2, 0, 0);
    cache.put("a", "1");
    cache.put("b", "2");
    cache.get("a");
    cache.put("c", "3");
    assertEquals("1", cache.get("a"));
    assertNull(cache.get("b"));
    assertEquals(2, cache.size());
  }

  @Test
  void computesOnceWhenPresent() {
    LruTtlCache<String, String> cache = new LruTtlCache<>(10, 0, 0);
    AtomicInteger calls = new AtomicInteger();
    assertEquals("v", cache.getOrCompute("k", () -> { calls.incrementAndGet(); return "v"; }));
    assertEquals("v", cache.getOrCompute("k", () -> { calls.incrementAndGet(); return "w"; }));
    assertEquals(1, calls.get());
  }
}
