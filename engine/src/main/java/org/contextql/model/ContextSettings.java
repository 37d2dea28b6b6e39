package org.contextql.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-context overrides of engine defaults.
 *
 * @param cacheTtlSeconds Result cache TTL for this context, or null for the default
 */
public record ContextSettings(Long cacheTtlSeconds) {

    public static final ContextSettings DEFAULTS = new ContextSettings(null);

    public Optional<Duration> cacheTtl() {
        return Optional.ofNullable(cacheTtlSeconds).map(Duration::ofSeconds);
    }
}
