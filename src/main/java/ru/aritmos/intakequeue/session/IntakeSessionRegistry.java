package ru.aritmos.intakequeue.session;

import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.queue.QueueUpdateSource;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр открытых клиентских сессий.
 * <p>
 * При остановке приложения все сессии закрываются, чтобы ни один таймер опроса не пережил контекст.
 */
@Singleton
public class IntakeSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(IntakeSessionRegistry.class);

    private final ConcurrentHashMap<String, IntakeSession> sessions = new ConcurrentHashMap<>();
    private final QueueUpdateSource updates;
    private final int maxNotifications;
    private final Clock clock = Clock.systemUTC();

    public IntakeSessionRegistry(QueueUpdateSource updates, IntakeQueueProperties properties) {
        this.updates = updates;
        this.maxNotifications = properties.getSession().getMaxNotifications();
    }

    public IntakeSession open() {
        String id = UUID.randomUUID().toString();
        IntakeSession session = new IntakeSession(id, updates, clock, maxNotifications);
        sessions.put(id, session);
        log.info("Открыта сессия {}", id);
        return session;
    }

    /**
     * @throws IntakeQueueException SESSION_NOT_FOUND, если сессия не открывалась или уже закрыта
     */
    public IntakeSession get(String sessionId) {
        IntakeSession s = sessionId == null ? null : sessions.get(sessionId);
        if (s == null) {
            throw IntakeQueueException.sessionNotFound(sessionId);
        }
        return s;
    }

    public void close(String sessionId) {
        IntakeSession s = sessionId == null ? null : sessions.remove(sessionId);
        if (s == null) {
            throw IntakeQueueException.sessionNotFound(sessionId);
        }
        s.close();
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    void closeAll() {
        List<IntakeSession> all = new ArrayList<>(sessions.values());
        sessions.clear();
        all.forEach(IntakeSession::close);
        if (!all.isEmpty()) {
            log.info("Закрыто сессий при остановке: {}", all.size());
        }
    }
}
