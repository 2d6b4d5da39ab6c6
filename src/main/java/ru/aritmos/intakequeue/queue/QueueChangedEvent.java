package ru.aritmos.intakequeue.queue;

/**
 * Событие изменения очереди услуги (постановка, выход, повышение приоритета, действие стойки).
 * <p>
 * Получатели обязаны считать производные поля всех записей услуги устаревшими.
 *
 * @param serviceId услуга
 * @param entryId   затронутая запись (может быть null)
 * @param reason    причина изменения
 */
public record QueueChangedEvent(String serviceId, String entryId, Reason reason) {

    public enum Reason {
        JOINED,
        LEFT,
        ESCALATED,
        CALLED,
        SERVING,
        COMPLETED
    }
}
