package ru.aritmos.intakequeue.queue;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Контракты очереди пациентов.
 * <p>
 * Очередь каждой услуги независима. Позиция и оценка ожидания — производные поля: они пересчитываются
 * из полного набора ожидающих записей услуги при каждом чтении и никогда не хранятся как источник истины.
 */
public final class QueueModels {

    private QueueModels() {
        // утилитарный класс
    }

    /**
     * Приоритет в очереди. Полный порядок: URGENT > HIGH > NORMAL > LOW.
     */
    public enum PriorityLevel {
        LOW(0),
        NORMAL(1),
        HIGH(2),
        URGENT(3);

        private final int rank;

        PriorityLevel(int rank) {
            this.rank = rank;
        }

        public int rank() {
            return rank;
        }

        public boolean isHigherThan(PriorityLevel other) {
            return other == null || rank > other.rank;
        }

        /**
         * Разобрать приоритет из внешнего представления.
         * <p>
         * Клиенты исторически присылают {@code medium} — это синоним {@link #NORMAL}.
         *
         * @param raw строка
         * @return приоритет или null, если строка пустая или неизвестная
         */
        public static PriorityLevel parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String v = raw.trim().toUpperCase(Locale.ROOT);
            if ("MEDIUM".equals(v)) {
                return NORMAL;
            }
            for (PriorityLevel p : values()) {
                if (p.name().equals(v)) {
                    return p;
                }
            }
            return null;
        }
    }

    /**
     * Статус записи очереди.
     * <p>
     * Допустимые переходы: WAITING → CALLED → SERVING → COMPLETED, а также WAITING → CANCELLED
     * и CALLED → CANCELLED. COMPLETED и CANCELLED — терминальные.
     */
    public enum QueueStatus {
        WAITING,
        CALLED,
        SERVING,
        COMPLETED,
        CANCELLED;

        private static final Map<QueueStatus, Set<QueueStatus>> TRANSITIONS = Map.of(
                WAITING, EnumSet.of(CALLED, CANCELLED),
                CALLED, EnumSet.of(SERVING, CANCELLED),
                SERVING, EnumSet.of(COMPLETED),
                COMPLETED, EnumSet.noneOf(QueueStatus.class),
                CANCELLED, EnumSet.noneOf(QueueStatus.class)
        );

        public boolean canTransitionTo(QueueStatus target) {
            return target != null && TRANSITIONS.get(this).contains(target);
        }

        public boolean isTerminal() {
            return TRANSITIONS.get(this).isEmpty();
        }
    }

    /**
     * Запись очереди.
     * <p>
     * {@code position} и {@code estimatedWaitMinutes} заполняются только для записей в статусе WAITING
     * и только как результат пересчёта; система учёта их не хранит.
     */
    @Serdeable
    @Schema(description = "Запись пациента в очереди услуги.")
    public record QueueEntry(
            @Schema(description = "Идентификатор записи (неизменяемый).")
            String id,
            @Schema(description = "Номер талона, монотонно растущий в рамках услуги.")
            long queueNumber,
            @Schema(description = "Ссылка на пациента во внешнем реестре.")
            String patientRef,
            @Schema(description = "Идентификатор услуги.")
            String serviceRef,
            @Schema(description = "Приоритет.")
            PriorityLevel priority,
            @Schema(description = "Статус.")
            QueueStatus status,
            @Schema(description = "Позиция среди ожидающих (1 = следующий), только для WAITING.")
            Integer position,
            @Schema(description = "Оценка ожидания в минутах, только для WAITING.")
            Integer estimatedWaitMinutes,
            @Schema(description = "Время постановки в очередь.")
            Instant joinedAt,
            @Schema(description = "Время вызова (после перехода в CALLED).")
            Instant calledAt
    ) {
        public QueueEntry withEstimate(QueuePosition estimate) {
            if (estimate == null) {
                return new QueueEntry(id, queueNumber, patientRef, serviceRef, priority, status, null, null, joinedAt, calledAt);
            }
            return new QueueEntry(id, queueNumber, patientRef, serviceRef, priority, status,
                    estimate.position(), estimate.estimatedWaitMinutes(), joinedAt, calledAt);
        }

        public QueueEntry withStatus(QueueStatus newStatus, Instant newCalledAt) {
            return new QueueEntry(id, queueNumber, patientRef, serviceRef, priority, newStatus, null, null, joinedAt, newCalledAt);
        }

        public QueueEntry withPriority(PriorityLevel newPriority) {
            return new QueueEntry(id, queueNumber, patientRef, serviceRef, newPriority, status, null, null, joinedAt, calledAt);
        }

        /**
         * @return копия без производных полей (так запись хранит система учёта)
         */
        public QueueEntry stripDerived() {
            return withEstimate(null);
        }
    }

    /**
     * Производная позиция записи и оценка ожидания.
     */
    @Serdeable
    @Schema(description = "Позиция в очереди и оценка ожидания.")
    public record QueuePosition(
            @Schema(description = "Позиция (>= 1).")
            int position,
            @Schema(description = "Оценка ожидания в минутах = позиция × среднее время обслуживания.")
            int estimatedWaitMinutes
    ) {
    }

    /**
     * Данные пациента для постановки в очередь.
     * <p>
     * Важно: в логи не передаются.
     */
    @Serdeable
    @Schema(description = "Данные пациента: имя, телефон, e-mail обязательны; дата рождения опциональна.")
    public record PatientDetails(
            @Schema(description = "Имя пациента.")
            String name,
            @Schema(description = "Телефон.")
            String phone,
            @Schema(description = "E-mail.")
            String email,
            @Schema(description = "Дата рождения (ISO, опционально).")
            String dateOfBirth
    ) {
        @Override
        public String toString() {
            return "PatientDetails[***]";
        }
    }

    /**
     * Услуга (линия очереди) из внешнего каталога.
     */
    @Serdeable
    @Schema(description = "Услуга: собственная независимая очередь.")
    public record ServiceInfo(
            @Schema(description = "Идентификатор услуги.")
            String id,
            @Schema(description = "Название.")
            String name,
            @Schema(description = "Отделение.")
            String department,
            @Schema(description = "Активна ли услуга.")
            boolean active,
            @Schema(description = "Среднее время обслуживания (минуты), null — нет эмпирических данных.")
            Integer averageServiceMinutes
    ) {
    }

    /**
     * Срез очереди услуги: ожидающие записи в порядке очереди с рассчитанными позициями.
     */
    @Serdeable
    @Schema(description = "Срез очереди услуги.")
    public record QueueSnapshot(
            @Schema(description = "Идентификатор услуги.")
            String serviceId,
            @Schema(description = "Среднее время обслуживания, использованное для оценки (минуты).")
            int averageServiceMinutes,
            @Schema(description = "Ожидающие записи в порядке очереди.")
            List<QueueEntry> waiting
    ) {
        public QueueSnapshot {
            waiting = waiting == null ? List.of() : List.copyOf(waiting);
        }
    }

    /**
     * Основание, по которому услуга попала в рекомендации.
     */
    public enum RecommendationBasis {
        /** Ключевые слова симптомов совпали с отделением или названием услуги. */
        SYMPTOMS,
        /** Совпало отделение, предложенное внешним (ИИ) классификатором. */
        EXTERNAL_SUGGESTION,
        /** Совпало отделение, рекомендованное локальным триажем. */
        TRIAGE_DEPARTMENT,
        /** Совпадений нет: предложены все активные услуги. */
        ALL_SERVICES
    }

    /**
     * Рекомендованная услуга с текущей загрузкой.
     */
    @Serdeable
    @Schema(description = "Рекомендованная услуга и ожидание для нового пациента с обычным приоритетом.")
    public record ServiceRecommendation(
            @Schema(description = "Услуга.")
            ServiceInfo service,
            @Schema(description = "Число ожидающих в очереди услуги.")
            int waitingCount,
            @Schema(description = "Ожидание для нового пациента (минуты) = (ожидающих + 1) × среднее время обслуживания.")
            int estimatedWaitMinutes,
            @Schema(description = "Основание рекомендации.")
            RecommendationBasis basis
    ) {
    }
}
