package org.contextql.engine.cache;

import org.contextql.engine.execution.BufferedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL-bounded cache of formatted query results.
 *
 * Keys already fold in the context fingerprint, so an edited context can never
 * hit a stale entry; {@link #evictContext} additionally drops a context's
 * entries eagerly when a new version is saved. Concurrent misses on the same
 * key may both compute and store; the last writer wins.
 */
public class ResultCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultCache.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResultCache(Clock clock, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive: " + maxEntries);
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public ResultCache(int maxEntries) {
        this(Clock.systemUTC(), maxEntries);
    }

    /**
     * @return The live entry for the key; an expired entry is removed and reported as a miss
     */
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry != null && entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            entry = null;
        }
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry);
    }

    public CacheEntry put(String key, String contextId, String fingerprint, BufferedResult result, Duration ttl) {
        CacheEntry entry = new CacheEntry(key, contextId, fingerprint, result, clock.instant(), ttl);
        if (ttl.isZero() || ttl.isNegative()) {
            // a zero lifetime disables caching for the context
            return entry;
        }
        entries.put(key, entry);
        if (entries.size() > maxEntries) {
            evictOverflow();
        }
        return entry;
    }

    /**
     * Drops every entry of a context.
     *
     * @return The number of entries removed
     */
    public int evictContext(String contextId) {
        int before = entries.size();
        entries.values().removeIf(e -> e.contextId().equals(contextId));
        int removed = Math.max(0, before - entries.size());
        if (removed > 0) {
            LOGGER.info("Evicted {} cached result(s) of context {}", removed, contextId);
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private void evictOverflow() {
        Instant now = clock.instant();
        entries.values().removeIf(e -> e.isExpired(now));
        while (entries.size() > maxEntries) {
            Optional<CacheEntry> oldest = entries.values().stream()
                    .min(Comparator.comparing(CacheEntry::storedAt));
            if (oldest.isEmpty()) {
                return;
            }
            entries.remove(oldest.get().key(), oldest.get());
        }
    }
}
