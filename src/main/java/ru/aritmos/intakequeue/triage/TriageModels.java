package ru.aritmos.intakequeue.triage;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Locale;

/**
 * Контракты слоя триажа.
 * <p>
 * Триаж здесь — грубая подсказка для маршрутизации и приоритета в очереди, а не диагноз.
 * Результат эфемерный: ядро его не хранит.
 */
public final class TriageModels {

    private TriageModels() {
        // утилитарный класс
    }

    /**
     * Уровень срочности, порядок объявления — от наименее срочного к наиболее срочному.
     */
    public enum UrgencyLevel {
        LOW,
        MODERATE,
        HIGH,
        CRITICAL;

        /**
         * Разобрать уровень из внешнего представления ("critical", "HIGH", ...).
         *
         * @param raw строка
         * @return уровень или null, если строка пустая или неизвестная
         */
        public static UrgencyLevel parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String v = raw.trim().toUpperCase(Locale.ROOT);
            for (UrgencyLevel u : values()) {
                if (u.name().equals(v)) {
                    return u;
                }
            }
            return null;
        }
    }

    /**
     * Возрастная группа пациента.
     */
    public enum AgeBracket {
        PEDIATRIC,
        ADULT;

        public static AgeBracket parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String v = raw.trim().toUpperCase(Locale.ROOT);
            for (AgeBracket a : values()) {
                if (a.name().equals(v)) {
                    return a;
                }
            }
            return null;
        }
    }

    /**
     * Результат классификации симптомов.
     */
    @Serdeable
    @Schema(description = "Результат триажа: уровень срочности, балл, рекомендуемое отделение и подсказки.")
    public record TriageResult(
            @Schema(description = "Уровень срочности (CRITICAL/HIGH/MODERATE/LOW).")
            UrgencyLevel urgencyLevel,
            @Schema(description = "Уверенность классификации в диапазоне [0,1].")
            double confidence,
            @Schema(description = "Триажный балл в диапазоне [0,10].")
            int triageScore,
            @Schema(description = "Рекомендуемое отделение.")
            String recommendedDepartment,
            @Schema(description = "Ориентировочное ожидание на этапе триажа (минуты), не путать с оценкой очереди.")
            int estimatedWaitMinutes,
            @Schema(description = "Рекомендуемые действия (фиксированный список по уровню).")
            List<String> recommendedActions,
            @Schema(description = "Факторы риска (фиксированный список по уровню).")
            List<String> riskFactors
    ) {
        public TriageResult {
            recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
            riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        }
    }

    /**
     * Источник результата триажа.
     */
    public enum TriageSource {
        /** Внешний (ИИ) классификатор. */
        EXTERNAL,
        /** Локальный эвристический классификатор. */
        LOCAL
    }

    /**
     * Итог триажа для клиента: результат + признак деградации.
     * <p>
     * {@code degraded=true} означает, что внешний классификатор не использовался или был недоступен,
     * и результат получен локальной эвристикой. Это не ошибка для пользователя, но UI обязан показать
     * предупреждение {@link #notice()}.
     */
    @Serdeable
    @Schema(description = "Итог триажа: результат, источник и признак деградированной точности.")
    public record TriageOutcome(
            @Schema(description = "Результат классификации.")
            TriageResult result,
            @Schema(description = "Источник результата (EXTERNAL/LOCAL).")
            TriageSource source,
            @Schema(description = "true, если использован локальный fallback и точность может быть ниже.")
            boolean degraded,
            @Schema(description = "Текст предупреждения для UI (если degraded=true).")
            String notice
    ) {
        public static final String DEGRADED_NOTICE =
                "Анализ выполнен локально. Результаты могут быть менее точными (results may be less accurate).";

        public static TriageOutcome external(TriageResult result) {
            return new TriageOutcome(result, TriageSource.EXTERNAL, false, null);
        }

        public static TriageOutcome degraded(TriageResult result) {
            return new TriageOutcome(result, TriageSource.LOCAL, true, DEGRADED_NOTICE);
        }
    }
}
