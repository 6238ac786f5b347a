package io.eventlog.bus.query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded TTL cache for query results.
 *
 * <p>Entries expire {@code ttl} after they are stored. When the cache is full, the
 * oldest entry is evicted. Expired or invalidated entries are never returned.
 * Results may be {@code null}; a lookup returns an {@link Optional} {@link Hit}
 * wrapping the value.
 *
 * <p>Every invalidation bumps a generation counter. A result computed while an
 * invalidation happened is stored only through {@link #putIfCurrent}, which drops it
 * when the generation has moved.
 */
public final class QueryCache {
  private final Clock clock;
  private final int maxEntries;
  private final LinkedHashMap<Key, Entry> entries = new LinkedHashMap<>();
  private long generation;

  public QueryCache(Clock clock, int maxEntries) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1");
    }
    this.maxEntries = maxEntries;
  }

  /**
   * Returns the live entry for the key, if any. An expired entry is removed.
   */
  public synchronized Optional<Hit> get(String queryType, Object cacheKey) {
    Key key = new Key(queryType, cacheKey);
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(entry.expiresAt)) {
      entries.remove(key);
      return Optional.empty();
    }
    return Optional.of(new Hit(entry.value));
  }

  /**
   * Returns the current generation; read it before computing a result to store.
   */
  public synchronized long generation() {
    return generation;
  }

  public synchronized void put(String queryType, Object cacheKey, Object value, Duration ttl) {
    store(queryType, cacheKey, value, ttl);
  }

  /**
   * Stores the value only if no invalidation happened since {@code expectedGeneration}
   * was read.
   *
   * @return true if the value was stored
   */
  public synchronized boolean putIfCurrent(
      long expectedGeneration, String queryType, Object cacheKey, Object value, Duration ttl) {
    if (generation != expectedGeneration) {
      return false;
    }
    return store(queryType, cacheKey, value, ttl);
  }

  public synchronized void invalidate(String queryType, Object cacheKey) {
    generation++;
    entries.remove(new Key(queryType, cacheKey));
  }

  public synchronized void invalidateType(String queryType) {
    generation++;
    entries.keySet().removeIf(key -> key.queryType.equals(queryType));
  }

  public synchronized void clear() {
    generation++;
    entries.clear();
  }

  /**
   * Returns the number of unexpired entries.
   */
  public synchronized int size() {
    evictExpired();
    return entries.size();
  }

  private boolean store(String queryType, Object cacheKey, Object value, Duration ttl) {
    if (ttl.isZero() || ttl.isNegative()) {
      return false;
    }
    Key key = new Key(queryType, cacheKey);
    entries.remove(key);
    entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    evictExpired();
    while (entries.size() > maxEntries) {
      Iterator<Key> oldest = entries.keySet().iterator();
      oldest.next();
      oldest.remove();
    }
    return true;
  }

  private void evictExpired() {
    Instant now = clock.instant();
    entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt));
  }

  /**
   * A cache hit; {@link #value()} may be {@code null}.
   */
  public record Hit(Object value) {
  }

  private record Key(String queryType, Object cacheKey) {
    Key {
      Objects.requireNonNull(queryType, "queryType");
      Objects.requireNonNull(cacheKey, "cacheKey");
    }
  }

  private static final class Entry {
    final Object value;
    final Instant expiresAt;

    Entry(Object value, Instant expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }
  }

  @Override
  public String toString() {
    synchronized (this) {
      return "QueryCache{entries=" + entries.size() + ", maxEntries=" + maxEntries + '}';
    }
  }
}
