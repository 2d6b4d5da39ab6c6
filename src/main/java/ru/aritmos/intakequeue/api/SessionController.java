package ru.aritmos.intakequeue.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.session.IntakeSession;
import ru.aritmos.intakequeue.session.IntakeSessionRegistry;
import ru.aritmos.intakequeue.session.SessionModels;

/**
 * Клиентские сессии: отслеживание записей и каталога, уведомления о смене статуса.
 */
@Controller("/api/sessions")
@Tag(name = "Сессии пациента", description = "Сессия владеет таймерами опроса и уведомлениями; закрытие сессии отменяет все подписки.")
public class SessionController {

    private final IntakeSessionRegistry sessions;

    public SessionController(IntakeSessionRegistry sessions) {
        this.sessions = sessions;
    }

    @Post(produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Открыть сессию", description = "Создаёт новую клиентскую сессию без подписок.")
    @ApiResponse(responseCode = "201", description = "Сессия открыта", content = @Content(schema = @Schema(implementation = SessionModels.SessionView.class)))
    public HttpResponse<SessionModels.SessionView> open() {
        return HttpResponse.status(HttpStatus.CREATED).body(sessions.open().view());
    }

    @Get(uri = "/{id}", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Состояние сессии", description = "Последние увиденные состояния записей, каталог и уведомления.")
    @ApiResponse(responseCode = "200", description = "Состояние сессии", content = @Content(schema = @Schema(implementation = SessionModels.SessionView.class)))
    @ApiResponse(responseCode = "404", description = "Сессия не найдена")
    public HttpResponse<?> get(@PathVariable("id") String id) {
        try {
            return HttpResponse.ok(sessions.get(id).view());
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Post(uri = "/{id}/watch", consumes = MediaType.APPLICATION_JSON, produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Отслеживать запись", description = "Подписка на обновления записи с интервалом опроса очереди; первое обновление выполняется сразу.")
    @ApiResponse(responseCode = "200", description = "Состояние сессии")
    @ApiResponse(responseCode = "400", description = "Не указаны услуга или запись")
    @ApiResponse(responseCode = "404", description = "Сессия не найдена")
    public HttpResponse<?> watch(@PathVariable("id") String id, @Body ApiModels.WatchRequest request) {
        try {
            if (request == null || isBlank(request.serviceId()) || isBlank(request.entryId())) {
                throw IntakeQueueException.validation("Укажите услугу и запись для отслеживания");
            }
            IntakeSession session = sessions.get(id);
            session.watch(request.serviceId(), request.entryId());
            return HttpResponse.ok(session.view());
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Post(uri = "/{id}/catalog-watch", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Отслеживать каталог", description = "Подписка на обновления каталога услуг с интервалом обновления каталога.")
    @ApiResponse(responseCode = "200", description = "Состояние сессии")
    @ApiResponse(responseCode = "404", description = "Сессия не найдена")
    public HttpResponse<?> watchCatalog(@PathVariable("id") String id) {
        try {
            IntakeSession session = sessions.get(id);
            session.watchCatalog();
            return HttpResponse.ok(session.view());
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Delete(uri = "/{id}")
    @Operation(summary = "Закрыть сессию", description = "Отменяет все таймеры опроса сессии.")
    @ApiResponse(responseCode = "204", description = "Сессия закрыта")
    @ApiResponse(responseCode = "404", description = "Сессия не найдена")
    public HttpResponse<?> close(@PathVariable("id") String id) {
        try {
            sessions.close(id);
            return HttpResponse.noContent();
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
