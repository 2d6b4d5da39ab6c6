package ru.aritmos.intakequeue.api;

import io.micronaut.context.annotation.Replaces;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import io.micronaut.validation.exceptions.ConstraintExceptionHandler;
import jakarta.inject.Singleton;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.core.IntakeQueueException;

import java.util.stream.Collectors;

/**
 * Ошибки bean validation в теле запроса отдаются в общем формате {@link ApiModels.ApiError}
 * с кодом VALIDATION_ERROR вместо стандартного ответа Micronaut.
 * <p>
 * В сообщение попадают только имена полей: значения могут содержать персональные данные.
 */
@Produces
@Singleton
@Replaces(ConstraintExceptionHandler.class)
public class ConstraintViolationHandler implements ExceptionHandler<ConstraintViolationException, HttpResponse<?>> {

    private static final Logger log = LoggerFactory.getLogger(ConstraintViolationHandler.class);

    @Override
    public HttpResponse<?> handle(HttpRequest request, ConstraintViolationException exception) {
        String fields = exception.getConstraintViolations().stream()
                .map(ConstraintViolationHandler::fieldName)
                .distinct()
                .sorted()
                .collect(Collectors.joining(", "));
        log.info("Запрос {} {} отклонён валидацией: {}", request.getMethod(), request.getPath(), fields);
        return ApiModels.error(IntakeQueueException.validation("Не заполнены обязательные поля: " + fields));
    }

    static String fieldName(ConstraintViolation<?> violation) {
        String name = null;
        for (Path.Node node : violation.getPropertyPath()) {
            name = node.getName();
        }
        return name == null ? "?" : name;
    }
}
