package ru.aritmos.intakequeue.queue;

import io.micronaut.context.event.ApplicationEventListener;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.backend.QueueBackend;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.core.TtlCache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Кэш последних прочитанных записей очереди по услугам.
 * <p>
 * Срок жизни снимка равен интервалу опроса. Любое {@link QueueChangedEvent} по услуге сбрасывает её
 * снимок, поэтому после постановки или выхода следующее чтение всегда идёт в систему учёта.
 * Кэшируются только сырые записи: порядок и позиции пересчитываются при каждом чтении.
 */
@Singleton
public class QueueSnapshotCache implements ApplicationEventListener<QueueChangedEvent> {

    private static final Logger log = LoggerFactory.getLogger(QueueSnapshotCache.class);

    private final QueueBackend backend;
    private final Duration ttl;
    private final TtlCache<String, List<QueueModels.QueueEntry>> cache;

    @Inject
    public QueueSnapshotCache(QueueBackend backend, IntakeQueueProperties properties) {
        this(backend, properties.getQueue().refreshInterval(), Clock.systemUTC());
    }

    public QueueSnapshotCache(QueueBackend backend, Duration ttl, Clock clock) {
        this.backend = backend;
        this.ttl = ttl;
        this.cache = new TtlCache<>(clock, 1000);
    }

    /**
     * Записи услуги: из кэша, если снимок не старше интервала опроса, иначе из системы учёта.
     */
    public List<QueueModels.QueueEntry> entries(String serviceId) {
        return cache.get(serviceId).orElseGet(() -> load(serviceId));
    }

    /**
     * Записи услуги напрямую из системы учёта (снимок обновляется).
     */
    public List<QueueModels.QueueEntry> load(String serviceId) {
        List<QueueModels.QueueEntry> entries;
        try {
            entries = backend.getQueueEntries(serviceId);
        } catch (IntakeQueueException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Не удалось прочитать очередь услуги {}: {}", serviceId, e.getMessage());
            throw IntakeQueueException.backendUnavailable("Система учёта очереди недоступна", e);
        }
        List<QueueModels.QueueEntry> copy = entries == null ? List.of() : List.copyOf(entries);
        cache.put(serviceId, copy, ttl);
        return copy;
    }

    public void invalidate(String serviceId) {
        cache.invalidate(serviceId);
    }

    @Override
    public void onApplicationEvent(QueueChangedEvent event) {
        if (event != null) {
            log.debug("Снимок очереди услуги {} сброшен: {}", event.serviceId(), event.reason());
            invalidate(event.serviceId());
        }
    }
}
