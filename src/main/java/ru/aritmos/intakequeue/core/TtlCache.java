package ru.aritmos.intakequeue.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Простой in-memory TTL-кэш.
 * <p>
 * Используется для краткоживущих снимков (каталог услуг, записи очереди услуги), чтобы не обращаться
 * к системе учёта чаще одного интервала опроса.
 * <p>
 * Важно: кэш не является источником истины. Любое изменение очереди услуги обязано сбрасывать
 * соответствующий ключ через {@link #invalidate(Object)}.
 */
public final class TtlCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> map = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public TtlCache(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Получить значение по ключу, если оно не истекло.
     */
    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> e = map.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (e.expiresAtMs <= clock.millis()) {
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value);
    }

    /**
     * Положить значение в кэш.
     * <p>
     * При переполнении кэш очищается целиком.
     */
    public void put(K key, V value, Duration ttl) {
        if (key == null) {
            return;
        }
        if (map.size() >= maxEntries) {
            map.clear();
        }
        long ttlMs = ttl == null || ttl.isNegative() ? 0 : ttl.toMillis();
        map.put(key, new Entry<>(value, clock.millis() + ttlMs));
    }

    public void invalidate(K key) {
        if (key != null) {
            map.remove(key);
        }
    }

    public void clear() {
        map.clear();
    }

    public int size() {
        return map.size();
    }

    private record Entry<V>(V value, long expiresAtMs) {
    }
}
