package ru.aritmos.intakequeue.queue;

import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;
import ru.aritmos.intakequeue.core.IntakeQueueException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Опрос системы учёта по таймеру.
 * <p>
 * Первое обновление выполняется сразу после подписки, дальше с интервалом
 * {@code intakequeue.queue.refresh-interval-seconds} (записи) и
 * {@code intakequeue.catalog.refresh-interval-seconds} (каталог).
 * Временная ошибка одного тика не останавливает опрос; опрос неизвестной записи прекращается.
 */
@Singleton
public class PollingQueueUpdateSource implements QueueUpdateSource {

    private static final Logger log = LoggerFactory.getLogger(PollingQueueUpdateSource.class);

    private final TaskScheduler scheduler;
    private final QueueStatusTracker tracker;
    private final ServiceCatalog catalog;
    private final Duration entryInterval;
    private final Duration catalogInterval;

    public PollingQueueUpdateSource(@Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler,
                                    QueueStatusTracker tracker,
                                    ServiceCatalog catalog,
                                    IntakeQueueProperties properties) {
        this.scheduler = scheduler;
        this.tracker = tracker;
        this.catalog = catalog;
        this.entryInterval = properties.getQueue().refreshInterval();
        this.catalogInterval = properties.getCatalog().refreshInterval();
    }

    @Override
    public Subscription watchEntry(String serviceId, String entryId, EntryListener listener) {
        PollingSubscription sub = new PollingSubscription();
        sub.attach(scheduler.scheduleAtFixedRate(Duration.ZERO, entryInterval, () -> {
            if (!sub.isActive()) {
                return;
            }
            try {
                QueueModels.QueueEntry entry = tracker.refresh(serviceId, entryId);
                if (entry.status().isTerminal()) {
                    log.info("Запись {} услуги {} в конечном статусе {}: опрос остановлен", entryId, serviceId, entry.status());
                    sub.cancel();
                }
                listener.onUpdate(entry);
            } catch (IntakeQueueException e) {
                log.warn("Ошибка опроса записи {} услуги {}: {} {}", entryId, serviceId, e.code(), e.getMessage());
                if (e.code() == IntakeQueueException.ErrorCode.ENTRY_NOT_FOUND) {
                    // запись исчезла из очереди услуги, дальнейший опрос бессмыслен
                    sub.cancel();
                }
                listener.onError(e);
            } catch (RuntimeException e) {
                log.warn("Ошибка обработки обновления записи {} услуги {}: {}", entryId, serviceId, e.toString());
            }
        }));
        return sub;
    }

    @Override
    public Subscription watchCatalog(Consumer<List<QueueModels.ServiceInfo>> listener) {
        PollingSubscription sub = new PollingSubscription();
        sub.attach(scheduler.scheduleAtFixedRate(Duration.ZERO, catalogInterval, () -> {
            if (!sub.isActive()) {
                return;
            }
            try {
                listener.accept(catalog.refresh());
            } catch (RuntimeException e) {
                log.warn("Ошибка обновления каталога услуг: {}", e.getMessage());
            }
        }));
        return sub;
    }

    /**
     * Подписка поверх {@link ScheduledFuture}. Отмена возможна до привязки задачи: тогда задача
     * отменяется в момент привязки.
     */
    static final class PollingSubscription implements Subscription {

        private final AtomicBoolean active = new AtomicBoolean(true);
        private volatile ScheduledFuture<?> future;

        void attach(ScheduledFuture<?> f) {
            this.future = f;
            if (!active.get() && f != null) {
                f.cancel(false);
            }
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                ScheduledFuture<?> f = future;
                if (f != null) {
                    f.cancel(false);
                }
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
