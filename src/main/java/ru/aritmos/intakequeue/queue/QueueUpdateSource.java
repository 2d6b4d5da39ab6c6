package ru.aritmos.intakequeue.queue;

import ru.aritmos.intakequeue.core.IntakeQueueException;

import java.util.List;
import java.util.function.Consumer;

/**
 * Источник обновлений очереди для клиентской сессии.
 * <p>
 * Реализация по умолчанию опрашивает систему учёта по таймеру ({@link PollingQueueUpdateSource}).
 * Push-транспорт (поток событий) может заменить опрос, реализовав этот же интерфейс: порядок записей
 * и семантика отмены подписки не зависят от транспорта.
 */
public interface QueueUpdateSource {

    /**
     * Подписаться на обновления записи.
     * <p>
     * Подписка завершается сама, когда запись достигает конечного статуса (COMPLETED или CANCELLED)
     * или когда запись не найдена в очереди услуги.
     */
    Subscription watchEntry(String serviceId, String entryId, EntryListener listener);

    /**
     * Подписаться на обновления каталога услуг (отдельный, более длинный интервал).
     */
    Subscription watchCatalog(Consumer<List<QueueModels.ServiceInfo>> listener);

    interface EntryListener {

        void onUpdate(QueueModels.QueueEntry entry);

        /**
         * Ошибка очередного обновления. Подписка остаётся активной, кроме ENTRY_NOT_FOUND.
         */
        default void onError(IntakeQueueException error) {
            // по умолчанию ошибка только логируется источником
        }
    }

    interface Subscription {

        void cancel();

        boolean isActive();
    }
}
