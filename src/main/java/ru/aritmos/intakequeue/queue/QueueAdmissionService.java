package ru.aritmos.intakequeue.queue;

import io.micronaut.context.event.ApplicationEventPublisher;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.backend.QueueBackend;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.core.SensitiveDataSanitizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Постановка пациента в очередь услуги и повышение приоритета.
 * <p>
 * Порядок постановки:
 * <ol>
 *   <li>проверка обязательных данных пациента (имя, телефон, e-mail);</li>
 *   <li>проверка, что услуга есть в каталоге и активна;</li>
 *   <li>решение по ключу идемпотентности;</li>
 *   <li>создание записи в системе учёта;</li>
 *   <li>событие изменения очереди и расчёт начальной позиции по свежему набору записей.</li>
 * </ol>
 * Ошибка системы учёта не оставляет частичной записи: ключ освобождается, и повтор с тем же ключом безопасен.
 */
@Singleton
public class QueueAdmissionService {

    private static final Logger log = LoggerFactory.getLogger(QueueAdmissionService.class);

    private final ServiceCatalog catalog;
    private final QueueBackend backend;
    private final QueueSnapshotCache snapshots;
    private final WaitTimeEstimator estimator;
    private final AdmissionIdempotencyRegistry idempotency;
    private final ApplicationEventPublisher<QueueChangedEvent> events;

    public QueueAdmissionService(ServiceCatalog catalog,
                                 QueueBackend backend,
                                 QueueSnapshotCache snapshots,
                                 WaitTimeEstimator estimator,
                                 AdmissionIdempotencyRegistry idempotency,
                                 ApplicationEventPublisher<QueueChangedEvent> events) {
        this.catalog = catalog;
        this.backend = backend;
        this.snapshots = snapshots;
        this.estimator = estimator;
        this.idempotency = idempotency;
        this.events = events;
    }

    /**
     * Поставить пациента в очередь.
     *
     * @param serviceId      услуга
     * @param patientRef     ссылка на пациента (null — будет выведена из e-mail)
     * @param priority       итоговый приоритет (null — NORMAL)
     * @param details        данные пациента
     * @param idempotencyKey ключ идемпотентности в рамках услуги (null — повтор не защищён)
     * @return созданная запись с начальной позицией и оценкой ожидания
     */
    public QueueModels.QueueEntry join(String serviceId,
                                       String patientRef,
                                       QueueModels.PriorityLevel priority,
                                       QueueModels.PatientDetails details,
                                       String idempotencyKey) {
        validate(details);
        QueueModels.ServiceInfo service = catalog.requireActive(serviceId);

        // без ключа повтор невозможен, реестр не нужен
        String key = (idempotencyKey == null || idempotencyKey.isBlank()) ? null : idempotencyKey.trim();
        AdmissionIdempotencyRegistry.IdempotencyDecision decision = idempotency.decide(serviceId, key);
        if (decision.decision() == AdmissionIdempotencyRegistry.Decision.SKIP_COMPLETED && decision.existingEntry() != null) {
            log.info("Повтор постановки в очередь услуги {} по тому же ключу: возвращена ранее созданная запись {}",
                    serviceId, decision.existingEntry().id());
            return withInitialEstimate(decision.existingEntry(), service);
        }
        if (decision.decision() == AdmissionIdempotencyRegistry.Decision.LOCKED) {
            throw IntakeQueueException.admissionFailed(
                    "Постановка с этим ключом идемпотентности уже выполняется, повторите позже", null);
        }

        String ref = (patientRef == null || patientRef.isBlank()) ? derivePatientRef(details.email()) : patientRef.trim();
        QueueModels.PriorityLevel effective = priority == null ? QueueModels.PriorityLevel.NORMAL : priority;

        QueueModels.QueueEntry created;
        try {
            created = backend.submitQueueJoin(serviceId, ref, details, effective, key);
        } catch (IntakeQueueException e) {
            idempotency.release(serviceId, key);
            throw e;
        } catch (RuntimeException e) {
            idempotency.release(serviceId, key);
            String msg = SensitiveDataSanitizer.sanitizeText(e.getMessage());
            log.warn("Сбой системы учёта при постановке в очередь услуги {}: {}", serviceId, msg);
            throw IntakeQueueException.admissionFailed(SensitiveDataSanitizer.userMessage(msg), e);
        }
        idempotency.markCompleted(serviceId, key, created);
        events.publishEvent(new QueueChangedEvent(serviceId, created.id(), QueueChangedEvent.Reason.JOINED));

        QueueModels.QueueEntry result = withInitialEstimate(created, service);
        log.info("Пациент поставлен в очередь услуги {}: талон {}, приоритет {}, позиция {}",
                serviceId, result.queueNumber(), result.priority(), result.position());
        return result;
    }

    /**
     * Повысить приоритет ожидающей записи.
     * <p>
     * Приоритет только повышается: равный или более низкий уровень оставляет запись без изменений.
     *
     * @return запись с пересчитанной позицией
     */
    public QueueModels.QueueEntry escalate(String serviceId, String entryId, QueueModels.PriorityLevel priority) {
        if (priority == null) {
            throw IntakeQueueException.validation("Не указан приоритет");
        }
        QueueModels.QueueEntry current = snapshots.load(serviceId).stream()
                .filter(e -> entryId != null && entryId.equals(e.id()))
                .findFirst()
                .orElseThrow(() -> IntakeQueueException.entryNotFound(serviceId, entryId));
        if (current.status() != QueueModels.QueueStatus.WAITING) {
            throw IntakeQueueException.invalidTransition(current.status().name(), "ESCALATED");
        }
        Integer avg = catalog.averageServiceMinutes(serviceId);
        if (!priority.isHigherThan(current.priority())) {
            return current.withEstimate(estimator.estimate(current, snapshots.entries(serviceId), avg));
        }

        QueueModels.QueueEntry updated;
        try {
            updated = backend.submitPriorityEscalation(entryId, priority);
        } catch (IntakeQueueException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Сбой системы учёта при повышении приоритета записи {}: {}", entryId,
                    SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            throw IntakeQueueException.backendUnavailable(SensitiveDataSanitizer.userMessage(null), e);
        }
        events.publishEvent(new QueueChangedEvent(serviceId, entryId, QueueChangedEvent.Reason.ESCALATED));
        log.info("Приоритет записи {} услуги {} повышен: {} -> {}", entryId, serviceId, current.priority(), updated.priority());
        List<QueueModels.QueueEntry> fresh = snapshots.load(serviceId);
        return updated.withEstimate(estimator.estimate(updated, fresh, avg));
    }

    /**
     * Стабильная ссылка на пациента по e-mail: {@code P-} и первые 12 hex-символов SHA-256.
     */
    static String derivePatientRef(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(normalized.getBytes(StandardCharsets.UTF_8));
            return "P-" + HexFormat.of().formatHex(hash).substring(0, 12).toUpperCase(Locale.ROOT);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }

    private QueueModels.QueueEntry withInitialEstimate(QueueModels.QueueEntry entry, QueueModels.ServiceInfo service) {
        List<QueueModels.QueueEntry> fresh = snapshots.load(entry.serviceRef());
        QueueModels.QueueEntry current = fresh.stream()
                .filter(e -> e.id().equals(entry.id()))
                .findFirst()
                .orElse(entry);
        if (current.status() != QueueModels.QueueStatus.WAITING) {
            return current.withEstimate(null);
        }
        return current.withEstimate(estimator.estimate(current, fresh, service.averageServiceMinutes()));
    }

    private static void validate(QueueModels.PatientDetails details) {
        if (details == null) {
            throw IntakeQueueException.validation("Не переданы данные пациента");
        }
        requireText(details.name(), "Укажите имя пациента");
        requireText(details.phone(), "Укажите телефон");
        requireText(details.email(), "Укажите e-mail");
    }

    private static void requireText(String value, String message) {
        if (value == null || value.trim().isEmpty()) {
            throw IntakeQueueException.validation(message);
        }
    }
}
