package ru.aritmos.intakequeue.queue;

import io.micronaut.context.event.ApplicationEventPublisher;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.backend.QueueBackend;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.core.SensitiveDataSanitizer;

import java.util.List;

/**
 * Отслеживание статуса записи.
 * <p>
 * Переходы WAITING → CALLED → SERVING → COMPLETED выполняет система учёта; трекер их только наблюдает.
 * Единственный переход, который трекер запрашивает сам, — выход из очереди (→ CANCELLED), и только
 * из WAITING или CALLED.
 * <p>
 * Позиция и оценка ожидания всегда пересчитываются из текущего набора записей услуги
 * (снимок не старше одного интервала опроса).
 */
@Singleton
public class QueueStatusTracker {

    private static final Logger log = LoggerFactory.getLogger(QueueStatusTracker.class);

    private final QueueSnapshotCache snapshots;
    private final ServiceCatalog catalog;
    private final WaitTimeEstimator estimator;
    private final QueueBackend backend;
    private final ApplicationEventPublisher<QueueChangedEvent> events;

    public QueueStatusTracker(QueueSnapshotCache snapshots,
                              ServiceCatalog catalog,
                              WaitTimeEstimator estimator,
                              QueueBackend backend,
                              ApplicationEventPublisher<QueueChangedEvent> events) {
        this.snapshots = snapshots;
        this.catalog = catalog;
        this.estimator = estimator;
        this.backend = backend;
        this.events = events;
    }

    /**
     * Обновить состояние записи (опрос по таймеру или ручное обновление).
     *
     * @return запись; для WAITING заполнены позиция и оценка, для остальных статусов они пусты
     */
    public QueueModels.QueueEntry refresh(String serviceId, String entryId) {
        List<QueueModels.QueueEntry> entries = snapshots.entries(serviceId);
        QueueModels.QueueEntry entry = find(entries, serviceId, entryId);
        if (entry.status() != QueueModels.QueueStatus.WAITING) {
            return entry.withEstimate(null);
        }
        return entry.withEstimate(estimator.estimate(entry, entries, catalog.averageServiceMinutes(serviceId)));
    }

    /**
     * Очередь услуги целиком: ожидающие записи в порядке очереди.
     */
    public QueueModels.QueueSnapshot queueView(String serviceId) {
        int avg = estimator.effectiveAverage(catalog.averageServiceMinutes(serviceId));
        return new QueueModels.QueueSnapshot(serviceId, avg, estimator.estimateAll(snapshots.entries(serviceId), avg));
    }

    /**
     * Выйти из очереди.
     *
     * @return запись в статусе CANCELLED
     * @throws IntakeQueueException INVALID_TRANSITION из SERVING/COMPLETED/CANCELLED;
     *                              LEAVE_FAILED при сбое системы учёта
     */
    public QueueModels.QueueEntry leave(String serviceId, String entryId) {
        QueueModels.QueueEntry entry = find(snapshots.load(serviceId), serviceId, entryId);
        if (!entry.status().canTransitionTo(QueueModels.QueueStatus.CANCELLED)) {
            throw IntakeQueueException.invalidTransition(entry.status().name(), QueueModels.QueueStatus.CANCELLED.name());
        }

        QueueBackend.LeaveResult result;
        try {
            result = backend.submitQueueLeave(entryId);
        } catch (RuntimeException e) {
            log.warn("Сбой системы учёта при выходе из очереди услуги {}: {}", serviceId,
                    SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            throw IntakeQueueException.leaveFailed(SensitiveDataSanitizer.userMessage(null), e);
        }
        if (result == null || !result.success()) {
            String code = result == null ? null : result.errorCode();
            if ("INVALID_TRANSITION".equals(code)) {
                // Статус успел смениться на стороне системы учёта.
                snapshots.invalidate(serviceId);
                throw new IntakeQueueException(IntakeQueueException.ErrorCode.INVALID_TRANSITION,
                        SensitiveDataSanitizer.userMessage(result.message()));
            }
            if ("NOT_FOUND".equals(code)) {
                throw IntakeQueueException.entryNotFound(serviceId, entryId);
            }
            String msg = SensitiveDataSanitizer.userMessage(result == null ? null : result.message());
            log.warn("Система учёта отклонила выход из очереди услуги {}: {}", serviceId, msg);
            throw IntakeQueueException.leaveFailed(msg, null);
        }

        events.publishEvent(new QueueChangedEvent(serviceId, entryId, QueueChangedEvent.Reason.LEFT));
        log.info("Запись {} (талон {}) покинула очередь услуги {}", entryId, entry.queueNumber(), serviceId);
        return entry.withStatus(QueueModels.QueueStatus.CANCELLED, entry.calledAt());
    }

    private static QueueModels.QueueEntry find(List<QueueModels.QueueEntry> entries, String serviceId, String entryId) {
        return entries.stream()
                .filter(e -> entryId != null && entryId.equals(e.id()))
                .findFirst()
                .orElseThrow(() -> IntakeQueueException.entryNotFound(serviceId, entryId));
    }
}
