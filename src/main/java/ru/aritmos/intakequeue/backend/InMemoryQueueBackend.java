package ru.aritmos.intakequeue.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.core.io.ResourceResolver;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.queue.QueueModels;
import ru.aritmos.intakequeue.queue.QueueOrdering;

import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory система учёта очереди.
 * <p>
 * Используется по умолчанию (разработка, демо, тесты) вместо внешнего хранилища. Состояние живёт
 * только в памяти процесса и не переживает перезапуск.
 * <p>
 * Гарантии:
 * <ul>
 *   <li>все изменения выполняются под одним монитором, частичной постановки в очередь не бывает;</li>
 *   <li>номер талона монотонно растёт в рамках услуги и не переиспользуется даже после отмены;</li>
 *   <li>повтор постановки в ту же услугу с тем же ключом идемпотентности возвращает ранее созданную запись;
 *   ключи разных услуг не пересекаются.</li>
 * </ul>
 */
@Singleton
public class InMemoryQueueBackend implements QueueBackend, ServiceDeskOperations {

    private static final Logger log = LoggerFactory.getLogger(InMemoryQueueBackend.class);

    private final Clock clock;
    private final Map<String, QueueModels.ServiceInfo> services = new LinkedHashMap<>();
    private final Map<String, ServiceLine> lines = new HashMap<>();
    private final Map<String, String> serviceByEntryId = new HashMap<>();
    private final Map<String, String> entryByIdempotencyKey = new HashMap<>();
    private final Map<String, QueueModels.PatientDetails> patients = new HashMap<>();

    @Inject
    public InMemoryQueueBackend(ResourceResolver resourceResolver,
                                ObjectMapper objectMapper,
                                IntakeQueueProperties properties) {
        this(loadCatalog(resourceResolver, objectMapper, properties.getCatalog().getPath()), Clock.systemUTC());
    }

    public InMemoryQueueBackend(List<QueueModels.ServiceInfo> catalog, Clock clock) {
        this.clock = clock;
        if (catalog != null) {
            for (QueueModels.ServiceInfo s : catalog) {
                if (s != null && s.id() != null && !s.id().isBlank()) {
                    services.put(s.id(), s);
                }
            }
        }
    }

    @Override
    public synchronized List<QueueModels.ServiceInfo> getActiveServices() {
        return List.copyOf(services.values());
    }

    @Override
    public synchronized List<QueueModels.QueueEntry> getQueueEntries(String serviceId) {
        ServiceLine line = lines.get(serviceId);
        return line == null ? List.of() : List.copyOf(line.entries.values());
    }

    @Override
    public synchronized QueueModels.QueueEntry submitQueueJoin(String serviceId,
                                                               String patientRef,
                                                               QueueModels.PatientDetails details,
                                                               QueueModels.PriorityLevel priority,
                                                               String idempotencyKey) {
        String scopedKey = idempotencyKey == null ? null : serviceId + ":" + idempotencyKey;
        if (scopedKey != null) {
            String existingId = entryByIdempotencyKey.get(scopedKey);
            if (existingId != null) {
                return find(existingId).orElseThrow(() -> new IllegalStateException("Повреждён индекс идемпотентности"));
            }
        }
        QueueModels.ServiceInfo service = services.get(serviceId);
        if (service == null || !service.active()) {
            throw IntakeQueueException.serviceUnavailable(serviceId);
        }

        ServiceLine line = lines.computeIfAbsent(serviceId, k -> new ServiceLine());
        line.lastNumber++;
        QueueModels.QueueEntry entry = new QueueModels.QueueEntry(
                UUID.randomUUID().toString(),
                line.lastNumber,
                patientRef,
                serviceId,
                priority == null ? QueueModels.PriorityLevel.NORMAL : priority,
                QueueModels.QueueStatus.WAITING,
                null,
                null,
                clock.instant(),
                null
        );
        line.entries.put(entry.id(), entry);
        serviceByEntryId.put(entry.id(), serviceId);
        if (scopedKey != null) {
            entryByIdempotencyKey.put(scopedKey, entry.id());
        }
        if (patientRef != null && details != null) {
            patients.put(patientRef, details);
        }
        return entry;
    }

    @Override
    public synchronized LeaveResult submitQueueLeave(String entryId) {
        Optional<QueueModels.QueueEntry> current = find(entryId);
        if (current.isEmpty()) {
            return LeaveResult.fail("NOT_FOUND", "Запись не найдена: " + entryId);
        }
        QueueModels.QueueEntry e = current.get();
        if (!e.status().canTransitionTo(QueueModels.QueueStatus.CANCELLED)) {
            return LeaveResult.fail("INVALID_TRANSITION",
                    "Нельзя покинуть очередь в статусе " + e.status());
        }
        store(e.withStatus(QueueModels.QueueStatus.CANCELLED, e.calledAt()));
        return LeaveResult.ok();
    }

    @Override
    public synchronized QueueModels.QueueEntry submitPriorityEscalation(String entryId, QueueModels.PriorityLevel priority) {
        QueueModels.QueueEntry e = require(entryId);
        if (priority == null || !priority.isHigherThan(e.priority())) {
            return e;
        }
        QueueModels.QueueEntry updated = e.withPriority(priority);
        store(updated);
        return updated;
    }

    @Override
    public synchronized Optional<QueueModels.QueueEntry> callNext(String serviceId) {
        List<QueueModels.QueueEntry> waiting = QueueOrdering.waitingInOrder(getQueueEntries(serviceId));
        if (waiting.isEmpty()) {
            return Optional.empty();
        }
        QueueModels.QueueEntry called = waiting.get(0).withStatus(QueueModels.QueueStatus.CALLED, clock.instant());
        store(called);
        log.info("Вызван талон {} услуги {}", called.queueNumber(), serviceId);
        return Optional.of(called);
    }

    @Override
    public synchronized QueueModels.QueueEntry startServing(String entryId) {
        return transition(entryId, QueueModels.QueueStatus.SERVING);
    }

    @Override
    public synchronized QueueModels.QueueEntry complete(String entryId) {
        return transition(entryId, QueueModels.QueueStatus.COMPLETED);
    }

    @Override
    public synchronized Optional<String> serviceOf(String entryId) {
        return Optional.ofNullable(serviceByEntryId.get(entryId));
    }

    /**
     * @return данные пациента по ссылке (реестр пациентов in-memory)
     */
    public synchronized Optional<QueueModels.PatientDetails> patient(String patientRef) {
        return Optional.ofNullable(patients.get(patientRef));
    }

    private QueueModels.QueueEntry transition(String entryId, QueueModels.QueueStatus target) {
        QueueModels.QueueEntry e = require(entryId);
        if (!e.status().canTransitionTo(target)) {
            throw IntakeQueueException.invalidTransition(e.status().name(), target.name());
        }
        QueueModels.QueueEntry updated = e.withStatus(target, e.calledAt());
        store(updated);
        return updated;
    }

    private QueueModels.QueueEntry require(String entryId) {
        String serviceId = serviceByEntryId.get(entryId);
        return find(entryId).orElseThrow(() -> IntakeQueueException.entryNotFound(serviceId == null ? "?" : serviceId, entryId));
    }

    private Optional<QueueModels.QueueEntry> find(String entryId) {
        String serviceId = serviceByEntryId.get(entryId);
        if (serviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(lines.get(serviceId).entries.get(entryId));
    }

    private void store(QueueModels.QueueEntry entry) {
        lines.get(entry.serviceRef()).entries.put(entry.id(), entry.stripDerived());
    }

    private static List<QueueModels.ServiceInfo> loadCatalog(ResourceResolver resourceResolver, ObjectMapper objectMapper, String path) {
        Optional<InputStream> streamOpt = resourceResolver.getResourceAsStream(path);
        if (streamOpt.isEmpty() && path != null && !path.startsWith("classpath:")) {
            streamOpt = resourceResolver.getResourceAsStream("classpath:" + path);
        }
        if (streamOpt.isEmpty()) {
            throw new IllegalStateException("Не найден каталог услуг по пути: " + path);
        }
        try (InputStream is = streamOpt.get()) {
            JsonNode root = objectMapper.readTree(is);
            JsonNode list = root;
            for (String key : new String[]{"services", "data", "value"}) {
                if (list.has(key) && list.get(key).isArray()) {
                    list = list.get(key);
                    break;
                }
            }
            List<QueueModels.ServiceInfo> parsed = objectMapper.convertValue(list, new TypeReference<List<QueueModels.ServiceInfo>>() {
            });
            log.info("Каталог услуг загружен: {} услуг(и)", parsed.size());
            return new ArrayList<>(parsed);
        } catch (Exception e) {
            throw new IllegalStateException("Не удалось загрузить каталог услуг: " + e.getMessage(), e);
        }
    }

    private static final class ServiceLine {
        private long lastNumber;
        private final Map<String, QueueModels.QueueEntry> entries = new LinkedHashMap<>();
    }
}
