package ru.aritmos.intakequeue.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.queue.PriorityMapper;
import ru.aritmos.intakequeue.queue.QueueAdmissionService;
import ru.aritmos.intakequeue.queue.QueueModels;
import ru.aritmos.intakequeue.queue.QueueStatusTracker;
import ru.aritmos.intakequeue.queue.ServiceCatalog;

/**
 * Очередь пациентов: каталог услуг, постановка, отслеживание, выход, повышение приоритета.
 */
@Controller("/api")
@Tag(name = "Очередь пациентов", description = "Постановка в очередь услуги, позиция и оценка ожидания, выход из очереди.")
public class QueueController {

    private final ServiceCatalog catalog;
    private final QueueAdmissionService admission;
    private final QueueStatusTracker tracker;
    private final PriorityMapper priorityMapper;

    public QueueController(ServiceCatalog catalog,
                           QueueAdmissionService admission,
                           QueueStatusTracker tracker,
                           PriorityMapper priorityMapper) {
        this.catalog = catalog;
        this.admission = admission;
        this.tracker = tracker;
        this.priorityMapper = priorityMapper;
    }

    @Get(uri = "/services", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Активные услуги", description = "Каталог активных услуг (кэшируется на интервал обновления каталога).")
    @ApiResponse(responseCode = "200", description = "Список услуг")
    @ApiResponse(responseCode = "503", description = "Каталог временно недоступен", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    public HttpResponse<?> services() {
        try {
            return HttpResponse.ok(catalog.activeServices());
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Post(uri = "/queue/{serviceId}/join", consumes = MediaType.APPLICATION_JSON, produces = MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Встать в очередь",
            description = "Создаёт запись со статусом WAITING и сразу возвращает позицию и оценку ожидания. Повтор с тем же Idempotency-Key не создаёт вторую запись."
    )
    @ApiResponse(responseCode = "201", description = "Запись создана", content = @Content(schema = @Schema(implementation = QueueModels.QueueEntry.class)))
    @ApiResponse(responseCode = "400", description = "Не заполнены имя, телефон или e-mail", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    @ApiResponse(responseCode = "409", description = "Услуга не найдена или не активна", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    @ApiResponse(responseCode = "503", description = "Временный сбой, повторите с тем же Idempotency-Key", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    public HttpResponse<?> join(@Parameter(description = "Идентификатор услуги") @PathVariable("serviceId") String serviceId,
                                @Parameter(description = "Ключ идемпотентности постановки") @Nullable @Header("Idempotency-Key") String idempotencyKey,
                                @Body @Valid ApiModels.JoinRequest request) {
        try {
            if (request == null) {
                throw IntakeQueueException.validation("Не переданы данные пациента");
            }
            QueueModels.PriorityLevel priority = priorityMapper.resolve(
                    ApiModels.parseUrgency(request.urgencyLevel()),
                    ApiModels.parsePriority(request.priority()));
            QueueModels.QueueEntry entry = admission.join(serviceId, request.patientRef(), priority, request.details(), idempotencyKey);
            return HttpResponse.status(HttpStatus.CREATED).body(entry);
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Get(uri = "/queue/{serviceId}", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Очередь услуги", description = "Ожидающие записи в порядке очереди с позициями и оценками ожидания.")
    @ApiResponse(responseCode = "200", description = "Срез очереди", content = @Content(schema = @Schema(implementation = QueueModels.QueueSnapshot.class)))
    public HttpResponse<?> queue(@Parameter(description = "Идентификатор услуги") @PathVariable("serviceId") String serviceId) {
        try {
            return HttpResponse.ok(tracker.queueView(serviceId));
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Get(uri = "/queue/{serviceId}/entries/{entryId}", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Состояние записи", description = "Ручное обновление: статус, позиция и оценка ожидания пересчитываются из текущей очереди.")
    @ApiResponse(responseCode = "200", description = "Запись", content = @Content(schema = @Schema(implementation = QueueModels.QueueEntry.class)))
    @ApiResponse(responseCode = "404", description = "Запись не найдена", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    public HttpResponse<?> entry(@PathVariable("serviceId") String serviceId,
                                 @PathVariable("entryId") String entryId) {
        try {
            return HttpResponse.ok(tracker.refresh(serviceId, entryId));
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Post(uri = "/queue/{serviceId}/entries/{entryId}/leave", produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Покинуть очередь", description = "Переводит запись в CANCELLED. Допустимо только из WAITING или CALLED.")
    @ApiResponse(responseCode = "200", description = "Запись отменена", content = @Content(schema = @Schema(implementation = QueueModels.QueueEntry.class)))
    @ApiResponse(responseCode = "409", description = "Недопустимый переход (обслуживание уже начато или завершено)", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    @ApiResponse(responseCode = "503", description = "Временный сбой системы учёта", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    public HttpResponse<?> leave(@PathVariable("serviceId") String serviceId,
                                 @PathVariable("entryId") String entryId) {
        try {
            return HttpResponse.ok(tracker.leave(serviceId, entryId));
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }

    @Post(uri = "/queue/{serviceId}/entries/{entryId}/escalate", consumes = MediaType.APPLICATION_JSON, produces = MediaType.APPLICATION_JSON)
    @Operation(summary = "Повысить приоритет", description = "Повторный триаж: приоритет ожидающей записи только повышается, более низкий уровень игнорируется.")
    @ApiResponse(responseCode = "200", description = "Запись с пересчитанной позицией", content = @Content(schema = @Schema(implementation = QueueModels.QueueEntry.class)))
    @ApiResponse(responseCode = "409", description = "Запись не ожидает вызова", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    public HttpResponse<?> escalate(@PathVariable("serviceId") String serviceId,
                                    @PathVariable("entryId") String entryId,
                                    @Body ApiModels.EscalateRequest request) {
        try {
            QueueModels.PriorityLevel priority = ApiModels.parsePriority(request == null ? null : request.priority());
            return HttpResponse.ok(admission.escalate(serviceId, entryId, priority));
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }
}
