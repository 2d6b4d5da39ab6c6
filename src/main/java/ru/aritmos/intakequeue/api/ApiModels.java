package ru.aritmos.intakequeue.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.core.SensitiveDataSanitizer;
import ru.aritmos.intakequeue.queue.QueueModels;
import ru.aritmos.intakequeue.triage.TriageModels;

import java.util.List;

/**
 * Тела запросов и ответов REST API.
 */
public final class ApiModels {

    private ApiModels() {
        // утилитарный класс
    }

    @Serdeable
    @Schema(description = "Ошибка API.")
    public record ApiError(
            @Schema(description = "Код ошибки (VALIDATION_ERROR, SERVICE_UNAVAILABLE, ADMISSION_FAILED, ...).")
            String code,
            @Schema(description = "Сообщение для пользователя.")
            String message,
            @Schema(description = "Можно ли повторить запрос (для постановки — с тем же Idempotency-Key).")
            boolean retryable
    ) {
        public static ApiError from(IntakeQueueException e) {
            return new ApiError(e.code().name(), SensitiveDataSanitizer.userMessage(e.getMessage()), e.retryable());
        }
    }

    /**
     * Перевести исключение ядра в HTTP-ответ с {@link ApiError}.
     */
    public static HttpResponse<ApiError> error(IntakeQueueException e) {
        return HttpResponse.<ApiError>status(HttpStatus.valueOf(e.code().httpStatus())).body(ApiError.from(e));
    }

    @Serdeable
    @Schema(description = "Запрос классификации симптомов.")
    public record ClassifyRequest(
            @Schema(description = "Описание симптомов (обязательно).")
            @NotBlank
            String symptoms,
            @Schema(description = "Возрастная группа: pediatric | adult (опционально).")
            String ageBracket,
            @Schema(description = "Желаемое отделение (учитывается только для умеренной срочности).")
            String departmentHint,
            @Schema(description = "Приоритет, выбранный пациентом: low | medium | normal | high | urgent (опционально).")
            String selectedPriority
    ) {
    }

    @Serdeable
    @Schema(description = "Результат классификации и итоговый приоритет для очереди.")
    public record ClassifyResponse(
            @Schema(description = "Итог триажа (источник, признак деградации).")
            TriageModels.TriageOutcome outcome,
            @Schema(description = "Итоговый приоритет: максимум из срочности триажа и выбора пациента.")
            QueueModels.PriorityLevel priority,
            @Schema(description = "Подходящие услуги каталога, от меньшего ожидания к большему (до трёх).")
            List<QueueModels.ServiceRecommendation> recommendedServices
    ) {
    }

    @Serdeable
    @Schema(description = "Запрос постановки в очередь.")
    public record JoinRequest(
            @Schema(description = "Ссылка на пациента (опционально, иначе выводится из e-mail).")
            String patientRef,
            @Schema(description = "Имя пациента.")
            @NotBlank
            String name,
            @Schema(description = "Телефон.")
            @NotBlank
            String phone,
            @Schema(description = "E-mail.")
            @NotBlank
            String email,
            @Schema(description = "Дата рождения (опционально).")
            String dateOfBirth,
            @Schema(description = "Приоритет, выбранный пациентом (опционально).")
            String priority,
            @Schema(description = "Срочность из триажа: critical | high | moderate | low (опционально).")
            String urgencyLevel
    ) {
        public QueueModels.PatientDetails details() {
            return new QueueModels.PatientDetails(name, phone, email, dateOfBirth);
        }
    }

    @Serdeable
    @Schema(description = "Запрос повышения приоритета.")
    public record EscalateRequest(
            @Schema(description = "Новый приоритет: high | urgent | ...")
            String priority
    ) {
    }

    @Serdeable
    @Schema(description = "Запрос на отслеживание записи в сессии.")
    public record WatchRequest(
            @Schema(description = "Услуга.")
            String serviceId,
            @Schema(description = "Запись.")
            String entryId
    ) {
    }

    /**
     * Разобрать приоритет из запроса.
     *
     * @return приоритет или null, если не передан
     * @throws IntakeQueueException VALIDATION_ERROR для неизвестного значения
     */
    static QueueModels.PriorityLevel parsePriority(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        QueueModels.PriorityLevel p = QueueModels.PriorityLevel.parse(raw);
        if (p == null) {
            throw IntakeQueueException.validation("Неизвестный приоритет: " + raw);
        }
        return p;
    }

    static TriageModels.AgeBracket parseAgeBracket(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        TriageModels.AgeBracket a = TriageModels.AgeBracket.parse(raw);
        if (a == null) {
            throw IntakeQueueException.validation("Неизвестная возрастная группа: " + raw);
        }
        return a;
    }

    static TriageModels.UrgencyLevel parseUrgency(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        TriageModels.UrgencyLevel u = TriageModels.UrgencyLevel.parse(raw);
        if (u == null) {
            throw IntakeQueueException.validation("Неизвестный уровень срочности: " + raw);
        }
        return u;
    }
}
