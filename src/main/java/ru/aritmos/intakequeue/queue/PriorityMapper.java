package ru.aritmos.intakequeue.queue;

import jakarta.inject.Singleton;
import ru.aritmos.intakequeue.triage.TriageModels;

/**
 * Маппинг результата триажа и ручного выбора пациента в приоритет очереди.
 * <p>
 * Правило конфликта: если известны и автоматическая срочность, и выбор пациента, берётся более
 * высокий приоритет. Автоматическая классификация может ошибаться в опасную сторону, поэтому
 * самооценку пациента система не понижает.
 */
@Singleton
public class PriorityMapper {

    /**
     * CRITICAL → URGENT, HIGH → HIGH, MODERATE → NORMAL, LOW → LOW.
     *
     * @param urgencyLevel уровень срочности (null трактуется как MODERATE)
     * @return приоритет
     */
    public QueueModels.PriorityLevel toPriority(TriageModels.UrgencyLevel urgencyLevel) {
        if (urgencyLevel == null) {
            return QueueModels.PriorityLevel.NORMAL;
        }
        return switch (urgencyLevel) {
            case CRITICAL -> QueueModels.PriorityLevel.URGENT;
            case HIGH -> QueueModels.PriorityLevel.HIGH;
            case MODERATE -> QueueModels.PriorityLevel.NORMAL;
            case LOW -> QueueModels.PriorityLevel.LOW;
        };
    }

    /**
     * Ручной выбор пациента ("low", "medium"/"normal", "high", "urgent").
     *
     * @param explicitUserChoice строка выбора (null/пусто/неизвестно → NORMAL)
     * @return приоритет
     */
    public QueueModels.PriorityLevel toPriority(String explicitUserChoice) {
        QueueModels.PriorityLevel p = QueueModels.PriorityLevel.parse(explicitUserChoice);
        return p == null ? QueueModels.PriorityLevel.NORMAL : p;
    }

    /**
     * Итоговый приоритет при наличии обоих источников.
     *
     * @param urgencyLevel  срочность из триажа (может быть null)
     * @param userSelection выбор пациента (может быть null)
     * @return максимум из двух по порядку URGENT > HIGH > NORMAL > LOW
     */
    public QueueModels.PriorityLevel resolve(TriageModels.UrgencyLevel urgencyLevel, QueueModels.PriorityLevel userSelection) {
        if (urgencyLevel == null && userSelection == null) {
            return QueueModels.PriorityLevel.NORMAL;
        }
        if (urgencyLevel == null) {
            return userSelection;
        }
        QueueModels.PriorityLevel fromTriage = toPriority(urgencyLevel);
        return higher(fromTriage, userSelection);
    }

    /**
     * @return более высокий из двух приоритетов (null игнорируется)
     */
    public static QueueModels.PriorityLevel higher(QueueModels.PriorityLevel a, QueueModels.PriorityLevel b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.isHigherThan(a) ? b : a;
    }
}
