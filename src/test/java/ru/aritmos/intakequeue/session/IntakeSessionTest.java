package ru.aritmos.intakequeue.session;

import org.junit.jupiter.api.Test;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.core.MutableClock;
import ru.aritmos.intakequeue.queue.QueueModels;
import ru.aritmos.intakequeue.queue.QueueUpdateSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class IntakeSessionTest {

    private final MutableClock clock = MutableClock.startingAt("2025-03-03T08:00:00Z");
    private final ManualUpdateSource updates = new ManualUpdateSource();

    @Test
    void statusChange_shouldProduceNotification() {
        IntakeSession session = new IntakeSession("s-1", updates, clock, 10);
        session.watch("general-medicine", "e-1");

        updates.push("e-1", entry(QueueModels.QueueStatus.WAITING));
        updates.push("e-1", entry(QueueModels.QueueStatus.WAITING));
        updates.push("e-1", entry(QueueModels.QueueStatus.CALLED));

        List<SessionModels.SessionNotification> notifications = session.notifications();
        assertEquals(1, notifications.size(), "TEST_EXPECTED: уведомление только при смене статуса");
        SessionModels.SessionNotification n = notifications.get(0);
        assertEquals(QueueModels.QueueStatus.WAITING, n.previousStatus());
        assertEquals(QueueModels.QueueStatus.CALLED, n.status());
        assertEquals("Ваш номер 7 вызван. Пройдите к стойке обслуживания", n.message());

        SessionModels.WatchedEntry watched = session.view().watched().get(0);
        assertEquals(QueueModels.QueueStatus.CALLED, watched.lastSeen().status());
        assertTrue(watched.active());
    }

    @Test
    void notifications_shouldBeBounded() {
        IntakeSession session = new IntakeSession("s-1", updates, clock, 2);
        session.watch("general-medicine", "e-1");

        updates.push("e-1", entry(QueueModels.QueueStatus.WAITING));
        updates.push("e-1", entry(QueueModels.QueueStatus.CALLED));
        updates.push("e-1", entry(QueueModels.QueueStatus.SERVING));
        updates.push("e-1", entry(QueueModels.QueueStatus.COMPLETED));

        List<SessionModels.SessionNotification> notifications = session.notifications();
        assertEquals(2, notifications.size());
        assertEquals(QueueModels.QueueStatus.SERVING, notifications.get(0).status());
        assertEquals(QueueModels.QueueStatus.COMPLETED, notifications.get(1).status());
    }

    @Test
    void pollingError_shouldBeVisibleInView() {
        IntakeSession session = new IntakeSession("s-1", updates, clock, 10);
        session.watch("general-medicine", "e-1");

        updates.fail("e-1", IntakeQueueException.backendUnavailable("Система учёта недоступна", null));

        assertEquals("BACKEND_UNAVAILABLE", session.view().watched().get(0).lastErrorCode());

        updates.push("e-1", entry(QueueModels.QueueStatus.WAITING));
        assertNull(session.view().watched().get(0).lastErrorCode());
    }

    @Test
    void rewatch_shouldReplacePreviousSubscription() {
        IntakeSession session = new IntakeSession("s-1", updates, clock, 10);
        session.watch("general-medicine", "e-1");
        ManualSubscription first = updates.entrySubscriptions.get(0);

        session.watch("general-medicine", "e-1");

        assertFalse(first.isActive());
        assertEquals(1, session.view().watched().size());
    }

    @Test
    void close_shouldCancelEverySubscriptionAndRejectNewOnes() {
        IntakeSession session = new IntakeSession("s-1", updates, clock, 10);
        session.watch("general-medicine", "e-1");
        session.watch("urgent-care", "e-2");
        session.watchCatalog();

        session.close();

        assertTrue(session.isClosed());
        assertTrue(updates.entrySubscriptions.stream().noneMatch(ManualSubscription::isActive));
        assertFalse(updates.catalogSubscription.isActive());
        IntakeQueueException ex = assertThrows(IntakeQueueException.class, () -> session.watch("general-medicine", "e-3"));
        assertEquals(IntakeQueueException.ErrorCode.SESSION_NOT_FOUND, ex.code());
    }

    @Test
    void catalogUpdate_shouldBeExposedInView() {
        IntakeSession session = new IntakeSession("s-1", updates, clock, 10);
        session.watchCatalog();
        session.watchCatalog();

        updates.catalogListener.accept(List.of(new QueueModels.ServiceInfo("a", "A", "General Medicine", true, 15)));

        assertEquals(1, session.view().services().size());
        assertEquals(1, updates.catalogCalls, "TEST_EXPECTED: повторная подписка на каталог не создаёт второй таймер");
    }

    @Test
    void registry_shouldForgetClosedSessions() {
        IntakeSessionRegistry registry = new IntakeSessionRegistry(updates, new ru.aritmos.intakequeue.config.IntakeQueueProperties());
        IntakeSession session = registry.open();

        assertSame(session, registry.get(session.id()));
        registry.close(session.id());

        assertTrue(session.isClosed());
        assertEquals(0, registry.size());
        IntakeQueueException ex = assertThrows(IntakeQueueException.class, () -> registry.get(session.id()));
        assertEquals(IntakeQueueException.ErrorCode.SESSION_NOT_FOUND, ex.code());
    }

    private static QueueModels.QueueEntry entry(QueueModels.QueueStatus status) {
        return new QueueModels.QueueEntry("e-1", 7, "P-1", "general-medicine", QueueModels.PriorityLevel.NORMAL,
                status, null, null, Instant.parse("2025-03-03T07:55:00Z"), null);
    }

    static final class ManualSubscription implements QueueUpdateSource.Subscription {

        private boolean active = true;

        @Override
        public void cancel() {
            active = false;
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }

    /**
     * Источник обновлений, которым тест управляет вручную.
     */
    static final class ManualUpdateSource implements QueueUpdateSource {

        final List<ManualSubscription> entrySubscriptions = new ArrayList<>();
        final Map<String, EntryListener> listeners = new HashMap<>();
        ManualSubscription catalogSubscription;
        Consumer<List<QueueModels.ServiceInfo>> catalogListener;
        int catalogCalls;

        @Override
        public Subscription watchEntry(String serviceId, String entryId, EntryListener listener) {
            ManualSubscription sub = new ManualSubscription();
            entrySubscriptions.add(sub);
            listeners.put(entryId, listener);
            return sub;
        }

        @Override
        public Subscription watchCatalog(Consumer<List<QueueModels.ServiceInfo>> listener) {
            catalogCalls++;
            catalogListener = listener;
            catalogSubscription = new ManualSubscription();
            return catalogSubscription;
        }

        void push(String entryId, QueueModels.QueueEntry entry) {
            listeners.get(entryId).onUpdate(entry);
        }

        void fail(String entryId, IntakeQueueException error) {
            listeners.get(entryId).onError(error);
        }
    }
}
