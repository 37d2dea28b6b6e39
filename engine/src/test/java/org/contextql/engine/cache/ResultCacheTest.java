package org.contextql.engine.cache;

import org.contextql.engine.execution.BufferedResult;
import org.contextql.engine.execution.Column;
import org.contextql.engine.execution.Row;
import org.contextql.test.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Result cache")
class ResultCacheTest {

    private static final BufferedResult RESULT = new BufferedResult(
            List.of(Column.of("total", "BIGINT")), List.of(Row.of(42L)));

    private MutableClock clock;
    private ResultCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new ResultCache(clock, 3);
    }

    @Test
    @DisplayName("Entry is served until its TTL elapses")
    void expiresAfterTtl() {
        // GIVEN
        cache.put("k1", "sales", "fp", RESULT, Duration.ofSeconds(60));

        // WHEN / THEN
        clock.advance(Duration.ofSeconds(59));
        assertEquals(RESULT, cache.get("k1").orElseThrow().result());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("k1").isEmpty());
        assertEquals(0, cache.size());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    @DisplayName("Evicting a context drops only its entries")
    void evictContext() {
        cache.put("k1", "sales", "fp1", RESULT, Duration.ofHours(1));
        cache.put("k2", "sales", "fp1", RESULT, Duration.ofHours(1));
        cache.put("k3", "traffic", "fp2", RESULT, Duration.ofHours(1));

        assertEquals(2, cache.evictContext("sales"));

        assertTrue(cache.get("k1").isEmpty());
        assertTrue(cache.get("k3").isPresent());
    }

    @Test
    @DisplayName("Oldest entry goes first when full")
    void boundedSize() {
        cache.put("k1", "c", "fp", RESULT, Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(1));
        cache.put("k2", "c", "fp", RESULT, Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(1));
        cache.put("k3", "c", "fp", RESULT, Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(1));
        cache.put("k4", "c", "fp", RESULT, Duration.ofHours(1));

        assertEquals(3, cache.size());
        assertTrue(cache.get("k1").isEmpty());
        assertTrue(cache.get("k4").isPresent());
    }

    @Test
    @DisplayName("Zero TTL disables caching")
    void zeroTtl() {
        cache.put("k1", "c", "fp", RESULT, Duration.ZERO);

        assertTrue(cache.get("k1").isEmpty());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ResultCache(clock, 0));
    }
}
