package ru.aritmos.intakequeue.triage;

/**
 * Внешний (ИИ) классификатор симптомов.
 * <p>
 * Вызов считается ненадёжным: реализация не бросает исключений, а возвращает
 * {@link Classification#unavailable(String)}, после чего {@link TriageService} переходит
 * на локальный {@link TriageClassifier}.
 */
public interface ExternalTriageClient {

    /**
     * Классифицировать симптомы внешним сервисом.
     *
     * @param symptomsText текст симптомов (уже проверен на непустоту)
     * @param ageBracket   возрастная группа (может быть null)
     * @return результат или признак недоступности
     */
    Classification classify(String symptomsText, TriageModels.AgeBracket ageBracket);

    /**
     * Результат внешнего вызова: либо {@code result}, либо причина недоступности.
     */
    record Classification(boolean available, TriageModels.TriageResult result, String reason) {

        public static Classification of(TriageModels.TriageResult result) {
            return new Classification(true, result, null);
        }

        public static Classification unavailable(String reason) {
            return new Classification(false, null, reason);
        }
    }
}
