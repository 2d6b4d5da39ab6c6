package ru.aritmos.intakequeue.triage;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.core.SensitiveDataSanitizer;

/**
 * Сервис триажа: сначала внешний классификатор, при недоступности — локальный.
 * <p>
 * Важно: сбой внешнего классификатора не должен блокировать поток записи в очередь.
 * Вместо ошибки пользователь получает результат локальной эвристики с признаком
 * {@code degraded=true} («результаты могут быть менее точными»).
 */
@Singleton
public class TriageService {

    private static final Logger log = LoggerFactory.getLogger(TriageService.class);

    private final ExternalTriageClient externalClient;
    private final TriageClassifier localClassifier;

    public TriageService(ExternalTriageClient externalClient, TriageClassifier localClassifier) {
        this.externalClient = externalClient;
        this.localClassifier = localClassifier;
    }

    /**
     * Классифицировать симптомы.
     *
     * @param symptomsText   описание симптомов
     * @param ageBracket     возрастная группа (может быть null)
     * @param departmentHint желаемое отделение (может быть null)
     * @return итог триажа
     * @throws IntakeQueueException VALIDATION_ERROR при пустом тексте (до обращения к внешнему сервису)
     */
    public TriageModels.TriageOutcome classify(String symptomsText,
                                               TriageModels.AgeBracket ageBracket,
                                               String departmentHint) {
        if (symptomsText == null || symptomsText.trim().isEmpty()) {
            throw IntakeQueueException.validation("Опишите симптомы: текст симптомов не может быть пустым");
        }

        ExternalTriageClient.Classification external;
        try {
            external = externalClient.classify(symptomsText, ageBracket);
        } catch (RuntimeException e) {
            external = ExternalTriageClient.Classification.unavailable(
                    "EXCEPTION: " + SensitiveDataSanitizer.sanitizeText(e.getMessage()));
        }

        if (external != null && external.available() && external.result() != null) {
            return TriageModels.TriageOutcome.external(external.result());
        }

        String reason = external == null ? "NULL_RESPONSE" : external.reason();
        if (!"DISABLED".equals(reason)) {
            log.warn("Внешний классификатор симптомов недоступен ({}), используется локальный триаж", reason);
        }
        return TriageModels.TriageOutcome.degraded(localClassifier.classify(symptomsText, ageBracket, departmentHint));
    }
}
