package ru.aritmos.intakequeue.backend;

import ru.aritmos.intakequeue.queue.QueueModels;

import java.util.Optional;

/**
 * Действия стойки обслуживания (внешняя сторона машины состояний записи).
 * <p>
 * Переходы WAITING → CALLED → SERVING → COMPLETED выполняет система учёта, ядро клиента их только
 * наблюдает при опросе. Интерфейс нужен in-memory системе учёта, чтобы сценарий можно было пройти
 * целиком (разработка, демо, тесты).
 */
public interface ServiceDeskOperations {

    /**
     * Вызвать следующего ожидающего пациента услуги (первого по порядку очереди).
     *
     * @param serviceId услуга
     * @return вызванная запись или пусто, если ожидающих нет
     */
    Optional<QueueModels.QueueEntry> callNext(String serviceId);

    /**
     * CALLED → SERVING.
     */
    QueueModels.QueueEntry startServing(String entryId);

    /**
     * SERVING → COMPLETED.
     */
    QueueModels.QueueEntry complete(String entryId);

    /**
     * @param entryId запись
     * @return услуга, к которой относится запись, если запись известна
     */
    Optional<String> serviceOf(String entryId);
}
