package org.gridiron.service;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Thread-safe map whose entries expire after a fixed time to live. Expired entries are dropped
 * lazily on access.
 * @param <K> Key type
 * @param <V> Value type
 */
public class TtlCache<K, V> {

    /** A loader allowed to fail with an I/O error, typically an HTTP call. */
    @FunctionalInterface
    public interface Loader<V> {
        V load() throws IOException;
    }

    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final long ttlMillis;
    private final LongSupplier clock;

    public TtlCache(long ttlMillis) {
        this(ttlMillis, System::currentTimeMillis);
    }

    /** @param clock current time in epoch millis */
    public TtlCache(long ttlMillis, LongSupplier clock) {
        this.ttlMillis = ttlMillis;
        this.clock = clock;
    }

    public V get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) return null;
        if (clock.getAsLong() > entry.expiresAt) {
            entries.remove(key, entry);
            return null;
        }
        return entry.value;
    }

    public void put(K key, V value) {
        entries.put(key, new Entry<>(value, clock.getAsLong() + ttlMillis));
    }

    /** Returns the cached value or loads, stores and returns it. Null results are not cached. */
    public V getOrLoad(K key, Loader<V> loader) throws IOException {
        V cached = get(key);
        if (cached != null) return cached;
        V loaded = loader.load();
        if (loaded != null) put(key, loaded);
        return loaded;
    }

    public int size() {
        return entries.size();
    }

    private record Entry<V>(V value, long expiresAt) {}
}
