package ru.aritmos.intakequeue.queue;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Идемпотентность постановки в очередь по ключу {@code Idempotency-Key}.
 * <p>
 * Решения:
 * <ul>
 *   <li>PROCESS — ключ новый (или прошлая попытка завершилась ошибкой), постановку следует выполнить;</li>
 *   <li>SKIP_COMPLETED — запись по ключу уже создана, повтор возвращает её;</li>
 *   <li>LOCKED — параллельная попытка с тем же ключом ещё выполняется.</li>
 * </ul>
 * Ключ действует в рамках одной услуги: тот же ключ в другой услуге — другая постановка.
 * Ключи хранятся в памяти процесса ограниченное время, просроченные строки вычищаются при каждом
 * решении и фиксации. Система учёта дополнительно дедуплицирует по тому же ключу, поэтому повтор
 * после перезапуска не создаёт вторую запись.
 */
@Singleton
public class AdmissionIdempotencyRegistry {

    public enum Decision {
        PROCESS,
        SKIP_COMPLETED,
        LOCKED
    }

    /**
     * @param decision      решение
     * @param existingEntry ранее созданная запись (только для SKIP_COMPLETED)
     */
    public record IdempotencyDecision(Decision decision, QueueModels.QueueEntry existingEntry) {
    }

    private enum Status {
        IN_PROGRESS,
        COMPLETED
    }

    private record Row(Status status, QueueModels.QueueEntry entry, Instant expiresAt) {
    }

    private final ConcurrentHashMap<String, Row> rows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    @Inject
    public AdmissionIdempotencyRegistry(IntakeQueueProperties properties) {
        this(Clock.systemUTC(), Duration.ofSeconds(properties.getQueue().getIdempotencyTtlSeconds()));
    }

    public AdmissionIdempotencyRegistry(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Принять решение и, если это PROCESS, захватить ключ.
     *
     * @param serviceId услуга
     * @param key       ключ идемпотентности (null — идемпотентность не запрошена, всегда PROCESS)
     */
    public IdempotencyDecision decide(String serviceId, String key) {
        if (key == null || key.isBlank()) {
            return new IdempotencyDecision(Decision.PROCESS, null);
        }
        Instant now = clock.instant();
        evictExpired(now);
        Row claimed = new Row(Status.IN_PROGRESS, null, now.plus(ttl));
        Row existing = rows.compute(scoped(serviceId, key), (k, row) -> (row == null || !row.expiresAt().isAfter(now)) ? claimed : row);
        if (existing == claimed) {
            return new IdempotencyDecision(Decision.PROCESS, null);
        }
        if (existing.status() == Status.COMPLETED) {
            return new IdempotencyDecision(Decision.SKIP_COMPLETED, existing.entry());
        }
        return new IdempotencyDecision(Decision.LOCKED, null);
    }

    public void markCompleted(String serviceId, String key, QueueModels.QueueEntry entry) {
        if (key == null || key.isBlank()) {
            return;
        }
        Instant now = clock.instant();
        evictExpired(now);
        rows.put(scoped(serviceId, key), new Row(Status.COMPLETED, entry == null ? null : entry.stripDerived(), now.plus(ttl)));
    }

    /**
     * Освободить ключ после неуспешной попытки: повтор с тем же ключом снова получит PROCESS.
     */
    public void release(String serviceId, String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        rows.computeIfPresent(scoped(serviceId, key), (k, row) -> row.status() == Status.IN_PROGRESS ? null : row);
    }

    public int size() {
        return rows.size();
    }

    private void evictExpired(Instant now) {
        rows.entrySet().removeIf(e -> !e.getValue().expiresAt().isAfter(now));
    }

    private static String scoped(String serviceId, String key) {
        return (serviceId == null ? "" : serviceId) + ":" + key;
    }
}
