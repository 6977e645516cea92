package me.golemcore.orchestrator.cache;

/**
 * Snapshot of cache counters.
 *
 * @param hits
 *            number of lookups that found a value
 * @param misses
 *            number of lookups that found nothing
 * @param hitRate
 *            {@code hits / (hits + misses)}, or 0 when nothing was looked up
 * @param size
 *            current number of entries
 */
public record CacheStats(long hits, long misses, double hitRate, int size) {
}
