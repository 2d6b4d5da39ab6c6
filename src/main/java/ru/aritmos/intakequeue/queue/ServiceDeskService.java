package ru.aritmos.intakequeue.queue;

import io.micronaut.context.event.ApplicationEventPublisher;
import jakarta.inject.Singleton;
import ru.aritmos.intakequeue.backend.ServiceDeskOperations;
import ru.aritmos.intakequeue.core.IntakeQueueException;

import java.util.Optional;

/**
 * Действия стойки обслуживания с публикацией события изменения очереди.
 */
@Singleton
public class ServiceDeskService {

    private final ServiceDeskOperations desk;
    private final ApplicationEventPublisher<QueueChangedEvent> events;

    public ServiceDeskService(ServiceDeskOperations desk, ApplicationEventPublisher<QueueChangedEvent> events) {
        this.desk = desk;
        this.events = events;
    }

    public Optional<QueueModels.QueueEntry> callNext(String serviceId) {
        Optional<QueueModels.QueueEntry> called = desk.callNext(serviceId);
        called.ifPresent(e -> events.publishEvent(new QueueChangedEvent(serviceId, e.id(), QueueChangedEvent.Reason.CALLED)));
        return called;
    }

    public QueueModels.QueueEntry startServing(String serviceId, String entryId) {
        requireOwnedBy(serviceId, entryId);
        QueueModels.QueueEntry e = desk.startServing(entryId);
        events.publishEvent(new QueueChangedEvent(serviceId, entryId, QueueChangedEvent.Reason.SERVING));
        return e;
    }

    public QueueModels.QueueEntry complete(String serviceId, String entryId) {
        requireOwnedBy(serviceId, entryId);
        QueueModels.QueueEntry e = desk.complete(entryId);
        events.publishEvent(new QueueChangedEvent(serviceId, entryId, QueueChangedEvent.Reason.COMPLETED));
        return e;
    }

    private void requireOwnedBy(String serviceId, String entryId) {
        if (!desk.serviceOf(entryId).map(s -> s.equals(serviceId)).orElse(false)) {
            throw IntakeQueueException.entryNotFound(serviceId, entryId);
        }
    }
}
