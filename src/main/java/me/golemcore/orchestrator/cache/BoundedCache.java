package me.golemcore.orchestrator.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-capacity least-recently-used cache.
 *
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}:
 * <ul>
 * <li>{@code get} on a present key counts a hit and marks the entry as most
 * recently used</li>
 * <li>{@code set} on a new key evicts exactly one least-recently-used entry
 * when the capacity is exceeded</li>
 * </ul>
 *
 * <p>
 * Methods are synchronized so one instance can be shared between sessions. The
 * capacity is fixed at construction.
 *
 * @param <K>
 *            key type
 * @param <V>
 *            value type
 */
public class BoundedCache<K, V> {

    private final int capacity;
    private final Map<K, V> entries;
    private long hits;
    private long misses;

    public BoundedCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedCache.this.capacity;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        if (!entries.containsKey(key)) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Inserts or updates an entry. Updating an existing key refreshes its
     * recency and never evicts.
     */
    public synchronized void set(K key, V value) {
        entries.put(key, value);
    }

    public synchronized boolean invalidate(K key) {
        if (!entries.containsKey(key)) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    /**
     * Drops all entries and resets hit/miss counters.
     */
    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized CacheStats getStats() {
        long total = hits + misses;
        double hitRate = total > 0 ? (double) hits / total : 0.0;
        return new CacheStats(hits, misses, hitRate, entries.size());
    }
}
