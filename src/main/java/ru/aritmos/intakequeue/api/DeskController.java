package ru.aritmos.intakequeue.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.queue.QueueModels;
import ru.aritmos.intakequeue.queue.ServiceDeskService;

import java.util.Optional;

/**
 * Стойка обслуживания (сторона системы учёта): вызов, начало и завершение обслуживания.
 */
@Controller("/api/desk/{serviceId}")
@Tag(name = "Стойка обслуживания", description = "Действия оператора: вызвать следующего, начать и завершить обслуживание.")
public class DeskController {

    private final ServiceDeskService desk;

    public DeskController(ServiceDeskService desk) {
        this.desk = desk;
    }

    @Post(uri = "/call-next", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Вызвать следующего", description = "Переводит первую по порядку ожидающую запись в CALLED.")
    @ApiResponse(responseCode = "200", description = "Вызванная запись")
    @ApiResponse(responseCode = "204", description = "Ожидающих нет")
    public HttpResponse<?> callNext(@PathVariable("serviceId") String serviceId) {
        try {
            Optional<QueueModels.QueueEntry> called = desk.callNext(serviceId);
            if (called.isEmpty()) {
                return HttpResponse.noContent();
            }
            return HttpResponse.ok(called.get());
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Post(uri = "/entries/{entryId}/serve", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Начать обслуживание", description = "CALLED → SERVING.")
    @ApiResponse(responseCode = "200", description = "Запись в обслуживании")
    @ApiResponse(responseCode = "409", description = "Недопустимый переход")
    public HttpResponse<?> serve(@PathVariable("serviceId") String serviceId,
                                 @PathVariable("entryId") String entryId) {
        try {
            return HttpResponse.ok(desk.startServing(serviceId, entryId));
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Post(uri = "/entries/{entryId}/complete", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Завершить обслуживание", description = "SERVING → COMPLETED.")
    @ApiResponse(responseCode = "200", description = "Обслуживание завершено")
    @ApiResponse(responseCode = "409", description = "Недопустимый переход")
    public HttpResponse<?> complete(@PathVariable("serviceId") String serviceId,
                                    @PathVariable("entryId") String entryId) {
        try {
            return HttpResponse.ok(desk.complete(serviceId, entryId));
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }
}
