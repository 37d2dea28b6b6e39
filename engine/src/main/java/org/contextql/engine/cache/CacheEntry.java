package org.contextql.engine.cache;

import org.contextql.engine.execution.BufferedResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A formatted result stored under a plan's cache key.
 *
 * @param key         The plan cache key
 * @param contextId   Context the result was computed for
 * @param fingerprint Fingerprint of the context version
 * @param result      Formatted rows
 * @param storedAt    When the entry was written
 * @param ttl         How long the entry stays valid
 */
public record CacheEntry(String key, String contextId, String fingerprint, BufferedResult result,
                         Instant storedAt, Duration ttl) {

    public CacheEntry {
        Objects.requireNonNull(key, "Cache key cannot be null");
        Objects.requireNonNull(contextId, "Context id cannot be null");
        Objects.requireNonNull(result, "Result cannot be null");
        Objects.requireNonNull(storedAt, "Timestamp cannot be null");
        Objects.requireNonNull(ttl, "TTL cannot be null");
    }

    public Instant expiresAt() {
        return storedAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
