package ru.aritmos.intakequeue.session;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import ru.aritmos.intakequeue.queue.QueueModels;

import java.time.Instant;
import java.util.List;

/**
 * Контракты клиентской сессии.
 */
public final class SessionModels {

    private SessionModels() {
        // утилитарный класс
    }

    /**
     * Уведомление о смене статуса отслеживаемой записи.
     */
    @Serdeable
    @Schema(description = "Уведомление сессии о смене статуса записи.")
    public record SessionNotification(
            @Schema(description = "Время уведомления.")
            Instant at,
            @Schema(description = "Услуга.")
            String serviceId,
            @Schema(description = "Запись.")
            String entryId,
            @Schema(description = "Предыдущий статус.")
            QueueModels.QueueStatus previousStatus,
            @Schema(description = "Новый статус.")
            QueueModels.QueueStatus status,
            @Schema(description = "Текст для пациента.")
            String message
    ) {
    }

    /**
     * Отслеживаемая запись: последнее увиденное состояние.
     */
    @Serdeable
    @Schema(description = "Отслеживаемая запись сессии.")
    public record WatchedEntry(
            @Schema(description = "Услуга.")
            String serviceId,
            @Schema(description = "Запись.")
            String entryId,
            @Schema(description = "Последнее увиденное состояние (null — ещё не получено).")
            QueueModels.QueueEntry lastSeen,
            @Schema(description = "Код последней ошибки опроса (null — ошибок не было).")
            String lastErrorCode,
            @Schema(description = "Опрос активен.")
            boolean active
    ) {
    }

    /**
     * Состояние сессии.
     */
    @Serdeable
    @Schema(description = "Состояние клиентской сессии.")
    public record SessionView(
            @Schema(description = "Идентификатор сессии.")
            String id,
            @Schema(description = "Время открытия.")
            Instant openedAt,
            @Schema(description = "Отслеживаемые записи.")
            List<WatchedEntry> watched,
            @Schema(description = "Последний полученный каталог услуг (пусто — подписки на каталог нет).")
            List<QueueModels.ServiceInfo> services,
            @Schema(description = "Уведомления, от старых к новым.")
            List<SessionNotification> notifications
    ) {
    }
}
