package io.intellixity.querygate.util;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Small LRU cache with TTL + optional idle expiry.
 *
 * <ul>
 *   <li>LRU eviction: access-order LinkedHashMap</li>
 *   <li>TTL: expire-after-write</li>
 *   <li>Idle: expire-after-access (optional)</li>
 * </ul>
 *
 * {@link #getOrCompute(Object, Supplier)} runs the supplier outside the monitor, so a slow loader
 * never blocks readers of other keys. Two concurrent misses on one key may both load; the first
 * stored value wins and is returned to both.
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Entry<V> {
    final V value;
    final long writeAt;
    long accessAt;

    Entry(V value, long now) {
      this.value = value;
      this.writeAt = now;
      this.accessAt = now;
    }
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis) {
    this(maxEntries, ttlMillis, idleMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    Entry<V> e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, now)) {
      map.remove(key);
      return null;
    }
    e.accessAt = now;
    return e.value;
  }

  public synchronized V put(K key, V value) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    Entry<V> prev = map.put(key, new Entry<>(value, now));
    evictIfNeeded();
    return prev == null ? null : prev.value;
  }

  public V getOrCompute(K key, Supplier<V> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    V existing = get(key);
    if (existing != null) return existing;
    V created = supplier.get();
    if (created == null) return null;
    synchronized (this) {
      V raced = get(key);
      if (raced != null) return raced;
      put(key, created);
      return created;
    }
  }

  public synchronized void invalidate(K key) {
    map.remove(key);
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private boolean isExpired(Entry<V> e, long now) {
    if (ttlMillis > 0 && (now - e.writeAt) >= ttlMillis) return true;
    return idleMillis > 0 && (now - e.accessAt) >= idleMillis;
  }

  private void pruneExpired(long now) {
    if (map.isEmpty()) return;
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<K, Entry<V>> me = it.next();
      if (isExpired(me.getValue(), now)) it.remove();
    }
  }

  private void evictIfNeeded() {
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      it.next();
      it.remove();
    }
  }
}
