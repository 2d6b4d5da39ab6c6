package ru.aritmos.intakequeue.triage;

import jakarta.inject.Singleton;
import ru.aritmos.intakequeue.core.IntakeQueueException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Локальный эвристический классификатор симптомов.
 * <p>
 * Классификатор всегда доступен: у него нет внешних зависимостей, и для любого непустого текста
 * он завершается результатом. Поэтому он используется как fallback при недоступности внешнего
 * (ИИ) классификатора.
 * <p>
 * Алгоритм:
 * <ol>
 *   <li>текст приводится к нижнему регистру;</li>
 *   <li>уровни проверяются в фиксированном порядке critical → high → moderate;</li>
 *   <li>первый совпавший уровень завершает классификацию (совпадения нижних уровней не учитываются);</li>
 *   <li>отделение, ожидание, действия и факторы риска берутся из фиксированных таблиц уровня.</li>
 * </ol>
 */
@Singleton
public class TriageClassifier {

    static final List<String> CRITICAL_TERMS = List.of(
            "emergency",
            "urgent",
            "chest pain",
            "severe",
            "bleeding",
            "unconscious",
            "difficulty breathing",
            "critical"
    );

    static final List<String> HIGH_TERMS = List.of(
            "pain",
            "fever",
            "serious",
            "high"
    );

    public static final String EMERGENCY_CARE = "Emergency Care";
    public static final String URGENT_CARE = "Urgent Care";
    public static final String GENERAL_MEDICINE = "General Medicine";

    private static final List<String> CRITICAL_ACTIONS = List.of(
            "CRITICAL EMERGENCY - Immediate medical attention required",
            "Call emergency services immediately",
            "Seek emergency room immediately"
    );

    private static final List<String> HIGH_ACTIONS = List.of(
            "HIGH PRIORITY - Seek medical attention within 30 minutes",
            "Monitor symptoms closely"
    );

    private static final List<String> MODERATE_ACTIONS = List.of(
            "MODERATE PRIORITY - Schedule appointment within 1-2 hours",
            "Routine care appropriate",
            "Monitor symptoms and seek care if they worsen"
    );

    static final String RISK_POTENTIAL_EMERGENCY = "Potential emergency";
    static final String RISK_PEDIATRIC = "Pediatric patient";

    /**
     * Классифицировать симптомы.
     *
     * @param symptomsText   описание симптомов (обязательно, непустое после trim)
     * @param ageBracket     возрастная группа (может быть null)
     * @param departmentHint желаемое отделение (может быть null; учитывается только для MODERATE)
     * @return результат триажа
     * @throws IntakeQueueException с кодом VALIDATION_ERROR, если текст пустой
     */
    public TriageModels.TriageResult classify(String symptomsText,
                                              TriageModels.AgeBracket ageBracket,
                                              String departmentHint) {
        if (symptomsText == null || symptomsText.trim().isEmpty()) {
            throw IntakeQueueException.validation("Опишите симптомы: текст симптомов не может быть пустым");
        }
        String text = symptomsText.toLowerCase(Locale.ROOT);

        int criticalMatches = countMatches(text, CRITICAL_TERMS);
        if (criticalMatches > 0) {
            double confidence = criticalMatches >= 2 ? 0.9 : 0.8;
            return build(TriageModels.UrgencyLevel.CRITICAL, confidence, 9, EMERGENCY_CARE, 0,
                    CRITICAL_ACTIONS, List.of(RISK_POTENTIAL_EMERGENCY), ageBracket);
        }

        if (countMatches(text, HIGH_TERMS) > 0) {
            return build(TriageModels.UrgencyLevel.HIGH, 0.7, 7, URGENT_CARE, 15,
                    HIGH_ACTIONS, List.of(), ageBracket);
        }

        String department = (departmentHint == null || departmentHint.isBlank()) ? GENERAL_MEDICINE : departmentHint.trim();
        return build(TriageModels.UrgencyLevel.MODERATE, 0.6, 5, department, 45,
                MODERATE_ACTIONS, List.of(), ageBracket);
    }

    private TriageModels.TriageResult build(TriageModels.UrgencyLevel level,
                                            double confidence,
                                            int score,
                                            String department,
                                            int waitMinutes,
                                            List<String> actions,
                                            List<String> baseRisks,
                                            TriageModels.AgeBracket ageBracket) {
        List<String> risks = new ArrayList<>(baseRisks);
        if (ageBracket == TriageModels.AgeBracket.PEDIATRIC) {
            risks.add(RISK_PEDIATRIC);
        }
        return new TriageModels.TriageResult(level, confidence, score, department, waitMinutes, actions, risks);
    }

    private static int countMatches(String text, List<String> terms) {
        int n = 0;
        for (String term : terms) {
            if (text.contains(term)) {
                n++;
            }
        }
        return n;
    }
}
