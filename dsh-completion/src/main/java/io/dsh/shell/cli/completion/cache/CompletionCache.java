package io.dsh.shell.cli.completion.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Short-lived cache in front of an expensive enumeration (directory listing, external query,
 * account database).
 *
 * <p>Every entry of one cache lives for the same TTL. A fresh hit served through {@link
 * #getOrLoad} restarts the entry's TTL; a miss or an expired entry is reloaded and replaced as a
 * whole. Concurrent misses on one key each load, and the last writer wins.
 *
 * @param <K> key type, normally the resolved query (absolute directory, argv)
 * @param <V> cached value
 */
public final class CompletionCache<K, V> {

  /** Directory listings. */
  public static final Duration PATH_TTL = Duration.ofSeconds(2);

  /** Output of external commands. */
  public static final Duration COMMAND_TTL = Duration.ofSeconds(3);

  /** User and group lists. */
  public static final Duration ACCOUNT_TTL = Duration.ofSeconds(5);

  /** Network interfaces. */
  public static final Duration INTERFACE_TTL = Duration.ofSeconds(2);

  /** Loads a value on a miss. */
  @FunctionalInterface
  public interface Loader<V, E extends Exception> {
    V load() throws E;
  }

  private record Entry<V>(V value, long insertedAt) {}

  private final ConcurrentHashMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
  private final long ttlNanos;
  private final LongSupplier clock;

  public CompletionCache(Duration ttl) {
    this(ttl, System::nanoTime);
  }

  /**
   * Constructor for testing with a controllable clock.
   *
   * @param ttl lifetime of an entry
   * @param clock monotonic time source in nanoseconds
   */
  public CompletionCache(Duration ttl, LongSupplier clock) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("TTL must be positive: " + ttl);
    }
    this.ttlNanos = ttl.toNanos();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the value under {@code key} if it has not expired. Expired entries are dropped.
   *
   * @param key cache key
   * @return the fresh value, or empty
   */
  public Optional<V> get(K key) {
    Entry<V> entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (isExpired(entry)) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  /** Stores {@code value}, replacing any previous entry. */
  public void set(K key, V value) {
    entries.put(key, new Entry<>(Objects.requireNonNull(value, "value"), clock.getAsLong()));
  }

  /**
   * Restarts the TTL of a fresh entry.
   *
   * @param key cache key
   * @return true if a fresh entry was found and extended
   */
  public boolean extendTtl(K key) {
    Entry<V> entry = entries.get(key);
    if (entry == null || isExpired(entry)) {
      return false;
    }
    return entries.replace(key, entry, new Entry<>(entry.value(), clock.getAsLong()));
  }

  /**
   * Returns the fresh value under {@code key}, extending its TTL, or loads and stores a new one.
   *
   * @param key cache key
   * @param loader called on a miss or an expired entry
   * @return the cached or loaded value
   * @throws E if the loader fails; nothing is stored in that case
   */
  public <E extends Exception> V getOrLoad(K key, Loader<V, E> loader) throws E {
    Optional<V> cached = get(key);
    if (cached.isPresent()) {
      extendTtl(key);
      return cached.get();
    }
    V value = loader.load();
    set(key, value);
    return value;
  }

  /** Number of stored entries, expired ones included until they are next looked up. */
  public int size() {
    return entries.size();
  }

  public void invalidateAll() {
    entries.clear();
  }

  private boolean isExpired(Entry<V> entry) {
    return clock.getAsLong() - entry.insertedAt() >= ttlNanos;
  }
}
