package ru.aritmos.intakequeue.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.queue.PriorityMapper;
import ru.aritmos.intakequeue.queue.QueueModels;
import ru.aritmos.intakequeue.queue.ServiceRecommender;
import ru.aritmos.intakequeue.triage.TriageModels;
import ru.aritmos.intakequeue.triage.TriageService;

/**
 * Триаж: классификация симптомов и итоговый приоритет для очереди.
 */
@Controller("/api/triage")
@Tag(name = "Триаж", description = "Классификация симптомов пациента и расчёт приоритета в очереди.")
public class TriageController {

    private final TriageService triageService;
    private final PriorityMapper priorityMapper;
    private final ServiceRecommender recommender;

    public TriageController(TriageService triageService, PriorityMapper priorityMapper, ServiceRecommender recommender) {
        this.triageService = triageService;
        this.priorityMapper = priorityMapper;
        this.recommender = recommender;
    }

    @Post(uri = "/classify", consumes = MediaType.APPLICATION_JSON, produces = MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Классифицировать симптомы",
            description = "Сначала опрашивается внешний классификатор (если включён), при его недоступности используется локальный триаж с признаком degraded. Итоговый приоритет — максимум из срочности и выбора пациента. К ответу прилагаются до трёх подходящих услуг с наименьшим ожиданием."
    )
    @ApiResponse(responseCode = "200", description = "Итог триажа и приоритет", content = @Content(schema = @Schema(implementation = ApiModels.ClassifyResponse.class)))
    @ApiResponse(responseCode = "400", description = "Пустое описание симптомов или неизвестное значение параметра", content = @Content(schema = @Schema(implementation = ApiModels.ApiError.class)))
    public HttpResponse<?> classify(@Body @Valid ApiModels.ClassifyRequest request) {
        try {
            if (request == null) {
                throw IntakeQueueException.validation("Пустой запрос");
            }
            QueueModels.PriorityLevel selected = ApiModels.parsePriority(request.selectedPriority());
            TriageModels.TriageOutcome outcome = triageService.classify(
                    request.symptoms(),
                    ApiModels.parseAgeBracket(request.ageBracket()),
                    request.departmentHint());
            QueueModels.PriorityLevel priority = priorityMapper.resolve(outcome.result().urgencyLevel(), selected);
            return HttpResponse.ok(new ApiModels.ClassifyResponse(outcome, priority,
                    recommender.recommend(request.symptoms(), outcome)));
        } catch (IntakeQueueException e) {
            return ApiModels.error(e);
        }
    }
}
