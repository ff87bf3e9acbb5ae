package io.intellixity.docscope.spi.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Synchronized LRU cache for schema snapshots.
 * <p>
 * Entries expire {@code ttlMillis} after they were stored and, when {@code idleMillis > 0},
 * after that long without a read. Zero disables either limit. Null values are never stored.
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier clock;

  // access order: the eldest entry is the least recently used
  private final LinkedHashMap<K, Slot<V>> slots = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Slot<V> {
    final V value;
    final long storedAt;
    long readAt;

    Slot(V value, long now) {
      this.value = value;
      this.storedAt = now;
      this.readAt = now;
    }
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis) {
    this(maxEntries, ttlMillis, idleMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, LongSupplier clock) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.idleMillis = idleMillis;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = clock.getAsLong();
    Slot<V> slot = slots.get(key);
    if (slot == null) return null;
    if (expired(slot, now)) {
      slots.remove(key);
      return null;
    }
    slot.readAt = now;
    return slot.value;
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      slots.remove(key);
      return;
    }
    long now = clock.getAsLong();
    purge(now);
    slots.put(key, new Slot<>(value, now));
    while (slots.size() > maxEntries) {
      Iterator<K> eldest = slots.keySet().iterator();
      eldest.next();
      eldest.remove();
    }
  }

  /**
   * Returns the cached value or stores what {@code loader} produces. The loader runs under the cache lock,
   * so concurrent callers for the same key load once.
   */
  public synchronized V getOrLoad(K key, Supplier<V> loader) {
    Objects.requireNonNull(loader, "loader");
    V cached = get(key);
    if (cached != null) return cached;
    V loaded = loader.get();
    put(key, loaded);
    return loaded;
  }

  public synchronized boolean invalidate(K key) {
    return slots.remove(Objects.requireNonNull(key, "key")) != null;
  }

  /** Drops every entry whose key matches; returns how many were dropped. */
  public synchronized int invalidateIf(Predicate<? super K> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    int dropped = 0;
    Iterator<K> it = slots.keySet().iterator();
    while (it.hasNext()) {
      if (predicate.test(it.next())) {
        it.remove();
        dropped++;
      }
    }
    return dropped;
  }

  public synchronized void clear() {
    slots.clear();
  }

  public synchronized int size() {
    purge(clock.getAsLong());
    return slots.size();
  }

  private boolean expired(Slot<V> slot, long now) {
    return (ttlMillis > 0 && now - slot.storedAt >= ttlMillis)
        || (idleMillis > 0 && now - slot.readAt >= idleMillis);
  }

  private void purge(long now) {
    Iterator<Map.Entry<K, Slot<V>>> it = slots.entrySet().iterator();
    while (it.hasNext()) {
      if (expired(it.next().getValue(), now)) it.remove();
    }
  }
}
