package ru.aritmos.intakequeue.backend;

import ru.aritmos.intakequeue.queue.QueueModels;

import java.util.List;

/**
 * Граница с внешней системой учёта очереди (хранилище услуг, пациентов и записей).
 * <p>
 * Ядро владеет только логикой: порядок, позиции и оценки вычисляются на стороне ядра из данных,
 * которые возвращает эта граница. Реализации (REST, БД, in-memory) взаимозаменяемы.
 * <p>
 * Сетевые и инфраструктурные сбои реализации сообщают обычными {@link RuntimeException};
 * ядро переводит их в типизированные ошибки своей таксономии.
 */
public interface QueueBackend {

    /**
     * @return услуги каталога (включая признак активности и среднее время обслуживания)
     */
    List<QueueModels.ServiceInfo> getActiveServices();

    /**
     * @param serviceId услуга
     * @return все записи услуги в любом статусе, без производных полей
     */
    List<QueueModels.QueueEntry> getQueueEntries(String serviceId);

    /**
     * Создать запись в очереди.
     * <p>
     * Реализация обязана быть идемпотентной по паре услуга + {@code idempotencyKey}: повтор с тем же
     * ключом в ту же услугу возвращает ранее созданную запись и не создаёт вторую.
     *
     * @param serviceId      услуга
     * @param patientRef     ссылка на пациента
     * @param details        данные пациента
     * @param priority       приоритет
     * @param idempotencyKey ключ идемпотентности
     * @return созданная (или ранее созданная) запись
     */
    QueueModels.QueueEntry submitQueueJoin(String serviceId,
                                           String patientRef,
                                           QueueModels.PatientDetails details,
                                           QueueModels.PriorityLevel priority,
                                           String idempotencyKey);

    /**
     * Запросить выход из очереди (перевод записи в CANCELLED).
     *
     * @param entryId запись
     * @return результат с сообщением внешней системы
     */
    LeaveResult submitQueueLeave(String entryId);

    /**
     * Повысить приоритет записи.
     *
     * @param entryId  запись
     * @param priority новый приоритет
     * @return обновлённая запись
     */
    QueueModels.QueueEntry submitPriorityEscalation(String entryId, QueueModels.PriorityLevel priority);

    /**
     * Результат выхода из очереди.
     *
     * @param success   успех
     * @param errorCode код ошибки внешней системы (например, INVALID_TRANSITION, NOT_FOUND)
     * @param message   сообщение внешней системы (может быть null)
     */
    record LeaveResult(boolean success, String errorCode, String message) {

        public static LeaveResult ok() {
            return new LeaveResult(true, null, null);
        }

        public static LeaveResult fail(String errorCode, String message) {
            return new LeaveResult(false, errorCode, message);
        }
    }
}
