package ru.aritmos.intakequeue.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {

    @Test
    void shouldExpireAfterTtl() {
        MutableClock clock = MutableClock.startingAt("2025-01-10T09:00:00Z");
        TtlCache<String, String> cache = new TtlCache<>(clock, 10);

        cache.put("general-medicine", "snapshot-1", Duration.ofSeconds(30));
        assertEquals("snapshot-1", cache.get("general-medicine").orElseThrow());

        clock.advance(Duration.ofSeconds(29));
        assertTrue(cache.get("general-medicine").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("general-medicine").isEmpty(), "TEST_EXPECTED: снимок старше TTL не возвращается");
    }

    @Test
    void invalidate_shouldDropOnlyGivenKey() {
        TtlCache<String, Integer> cache = new TtlCache<>(MutableClock.startingAt("2025-01-10T09:00:00Z"), 10);
        cache.put("a", 1, Duration.ofMinutes(1));
        cache.put("b", 2, Duration.ofMinutes(1));

        cache.invalidate("a");

        assertTrue(cache.get("a").isEmpty());
        assertEquals(2, cache.get("b").orElseThrow());
    }

    @Test
    void shouldClearWhenFull() {
        TtlCache<Integer, Integer> cache = new TtlCache<>(MutableClock.startingAt("2025-01-10T09:00:00Z"), 2);
        cache.put(1, 1, Duration.ofMinutes(1));
        cache.put(2, 2, Duration.ofMinutes(1));
        cache.put(3, 3, Duration.ofMinutes(1));

        assertEquals(1, cache.size());
        assertEquals(3, cache.get(3).orElseThrow());
    }
}
