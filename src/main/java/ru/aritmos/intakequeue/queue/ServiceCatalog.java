package ru.aritmos.intakequeue.queue;

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
import java.util.Optional;

/**
 * Каталог услуг с кэшированием на интервал обновления каталога.
 */
@Singleton
public class ServiceCatalog {

    private static final Logger log = LoggerFactory.getLogger(ServiceCatalog.class);
    private static final String KEY = "services";

    private final QueueBackend backend;
    private final Duration ttl;
    private final TtlCache<String, List<QueueModels.ServiceInfo>> cache;

    @Inject
    public ServiceCatalog(QueueBackend backend, IntakeQueueProperties properties) {
        this(backend, properties.getCatalog().refreshInterval(), Clock.systemUTC());
    }

    public ServiceCatalog(QueueBackend backend, Duration ttl, Clock clock) {
        this.backend = backend;
        this.ttl = ttl;
        this.cache = new TtlCache<>(clock, 4);
    }

    /**
     * @return все услуги каталога (активные и неактивные)
     */
    public List<QueueModels.ServiceInfo> services() {
        return cache.get(KEY).orElseGet(this::refresh);
    }

    /**
     * @return только активные услуги
     */
    public List<QueueModels.ServiceInfo> activeServices() {
        return services().stream().filter(QueueModels.ServiceInfo::active).toList();
    }

    /**
     * Перечитать каталог из системы учёта.
     */
    public List<QueueModels.ServiceInfo> refresh() {
        List<QueueModels.ServiceInfo> loaded;
        try {
            loaded = backend.getActiveServices();
        } catch (IntakeQueueException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Не удалось прочитать каталог услуг: {}", e.getMessage());
            throw IntakeQueueException.backendUnavailable("Каталог услуг недоступен", e);
        }
        List<QueueModels.ServiceInfo> copy = loaded == null ? List.of() : List.copyOf(loaded);
        cache.put(KEY, copy, ttl);
        return copy;
    }

    public Optional<QueueModels.ServiceInfo> find(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        return services().stream().filter(s -> serviceId.equals(s.id())).findFirst();
    }

    /**
     * @throws IntakeQueueException SERVICE_UNAVAILABLE, если услуга не найдена или не активна
     */
    public QueueModels.ServiceInfo requireActive(String serviceId) {
        return find(serviceId)
                .filter(QueueModels.ServiceInfo::active)
                .orElseThrow(() -> IntakeQueueException.serviceUnavailable(serviceId));
    }

    /**
     * Среднее время обслуживания услуги для оценки ожидания.
     * <p>
     * Недоступность каталога не ломает оценку: используется значение по умолчанию.
     *
     * @return среднее время или null, если эмпирических данных нет
     */
    public Integer averageServiceMinutes(String serviceId) {
        try {
            return find(serviceId).map(QueueModels.ServiceInfo::averageServiceMinutes).orElse(null);
        } catch (IntakeQueueException e) {
            log.warn("Оценка ожидания услуги {} выполнена со средним временем по умолчанию: {}", serviceId, e.getMessage());
            return null;
        }
    }
}
