package ru.aritmos.intakequeue.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.queue.QueueModels;
import ru.aritmos.intakequeue.queue.QueueUpdateSource;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Клиентская сессия: владеет подписками на обновления, последними увиденными снимками записей,
 * снимком каталога и списком уведомлений.
 * <p>
 * Жизненный цикл: создаётся при открытии сессии ({@link IntakeSessionRegistry#open()}),
 * {@link #close()} отменяет все подписки. После закрытия новые подписки не принимаются.
 */
public class IntakeSession {

    private static final Logger log = LoggerFactory.getLogger(IntakeSession.class);

    private final String id;
    private final Instant openedAt;
    private final QueueUpdateSource updates;
    private final Clock clock;
    private final int maxNotifications;

    private final Map<String, Watch> watches = new LinkedHashMap<>();
    private final Deque<SessionModels.SessionNotification> notifications = new ArrayDeque<>();
    private QueueUpdateSource.Subscription catalogSubscription;
    private List<QueueModels.ServiceInfo> services = List.of();
    private boolean closed;

    public IntakeSession(String id, QueueUpdateSource updates, Clock clock, int maxNotifications) {
        this.id = id;
        this.updates = updates;
        this.clock = clock;
        this.maxNotifications = Math.max(1, maxNotifications);
        this.openedAt = clock.instant();
    }

    public String id() {
        return id;
    }

    /**
     * Начать отслеживание записи. Повторный вызов для той же записи заменяет подписку.
     */
    public void watch(String serviceId, String entryId) {
        Watch watch = new Watch(serviceId, entryId);
        Watch previous;
        synchronized (this) {
            ensureOpen();
            previous = watches.put(entryId, watch);
        }
        if (previous != null) {
            previous.cancel();
        }
        QueueUpdateSource.Subscription sub = updates.watchEntry(serviceId, entryId, new QueueUpdateSource.EntryListener() {
            @Override
            public void onUpdate(QueueModels.QueueEntry entry) {
                observe(watch, entry);
            }

            @Override
            public void onError(IntakeQueueException error) {
                synchronized (IntakeSession.this) {
                    watch.lastErrorCode = error.code().name();
                }
            }
        });
        boolean cancelNow;
        synchronized (this) {
            watch.subscription = sub;
            cancelNow = closed || watches.get(entryId) != watch;
        }
        if (cancelNow) {
            sub.cancel();
        }
    }

    /**
     * Прекратить отслеживание записи.
     */
    public void unwatch(String entryId) {
        Watch w;
        synchronized (this) {
            w = watches.remove(entryId);
        }
        if (w != null) {
            w.cancel();
        }
    }

    /**
     * Подписаться на обновления каталога услуг.
     */
    public void watchCatalog() {
        synchronized (this) {
            ensureOpen();
            if (catalogSubscription != null && catalogSubscription.isActive()) {
                return;
            }
        }
        QueueUpdateSource.Subscription sub = updates.watchCatalog(this::onCatalog);
        boolean cancelNow;
        synchronized (this) {
            cancelNow = closed || (catalogSubscription != null && catalogSubscription.isActive());
            if (!cancelNow) {
                catalogSubscription = sub;
            }
        }
        if (cancelNow) {
            sub.cancel();
        }
    }

    public synchronized SessionModels.SessionView view() {
        List<SessionModels.WatchedEntry> watched = new ArrayList<>(watches.size());
        for (Watch w : watches.values()) {
            watched.add(new SessionModels.WatchedEntry(w.serviceId, w.entryId, w.lastSeen, w.lastErrorCode,
                    w.subscription != null && w.subscription.isActive()));
        }
        return new SessionModels.SessionView(id, openedAt, List.copyOf(watched), services, List.copyOf(notifications));
    }

    public synchronized List<SessionModels.SessionNotification> notifications() {
        return List.copyOf(notifications);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Закрыть сессию: отменить все подписки.
     */
    public void close() {
        List<Watch> toCancel;
        QueueUpdateSource.Subscription catalogSub;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toCancel = new ArrayList<>(watches.values());
            catalogSub = catalogSubscription;
        }
        toCancel.forEach(Watch::cancel);
        if (catalogSub != null) {
            catalogSub.cancel();
        }
        log.info("Сессия {} закрыта, отменено подписок: {}", id, toCancel.size() + (catalogSub == null ? 0 : 1));
    }

    private synchronized void observe(Watch watch, QueueModels.QueueEntry entry) {
        if (entry == null || watches.get(watch.entryId) != watch) {
            return;
        }
        QueueModels.QueueEntry previous = watch.lastSeen;
        watch.lastSeen = entry;
        watch.lastErrorCode = null;
        if (previous != null && previous.status() != entry.status()) {
            addNotification(new SessionModels.SessionNotification(
                    clock.instant(), watch.serviceId, watch.entryId, previous.status(), entry.status(), messageFor(entry)));
        }
    }

    private synchronized void onCatalog(List<QueueModels.ServiceInfo> loaded) {
        services = loaded == null ? List.of() : List.copyOf(loaded);
    }

    private void addNotification(SessionModels.SessionNotification n) {
        notifications.addLast(n);
        while (notifications.size() > maxNotifications) {
            notifications.removeFirst();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw IntakeQueueException.sessionNotFound(id);
        }
    }

    static String messageFor(QueueModels.QueueEntry entry) {
        long n = entry.queueNumber();
        return switch (entry.status()) {
            case WAITING -> "Талон " + n + " снова ожидает вызова";
            case CALLED -> "Ваш номер " + n + " вызван. Пройдите к стойке обслуживания";
            case SERVING -> "Начато обслуживание по талону " + n;
            case COMPLETED -> "Обслуживание по талону " + n + " завершено";
            case CANCELLED -> "Талон " + n + " снят с очереди";
        };
    }

    private static final class Watch {
        private final String serviceId;
        private final String entryId;
        private volatile QueueUpdateSource.Subscription subscription;
        private QueueModels.QueueEntry lastSeen;
        private String lastErrorCode;

        private Watch(String serviceId, String entryId) {
            this.serviceId = serviceId;
            this.entryId = entryId;
        }

        private void cancel() {
            QueueUpdateSource.Subscription s = subscription;
            if (s != null) {
                s.cancel();
            }
        }
    }
}
