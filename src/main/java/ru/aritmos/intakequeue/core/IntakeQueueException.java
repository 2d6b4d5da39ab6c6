package ru.aritmos.intakequeue.core;

/**
 * Единое исключение ядра очереди.
 * <p>
 * Ошибки делятся по {@link ErrorCode}: контроллеры отображают код в HTTP-статус,
 * а вызывающая сторона по флагу {@link ErrorCode#retryable()} решает, можно ли повторить запрос.
 * <p>
 * Важно: локальные вычисления (маппинг приоритета, порядок очереди, оценка ожидания) это исключение
 * не бросают. Его бросают только граничные операции: постановка в очередь, выход из очереди,
 * чтение состояния у системы учёта.
 */
public class IntakeQueueException extends RuntimeException {

    /**
     * Таксономия ошибок.
     */
    public enum ErrorCode {
        /** Некорректный или неполный ввод (исправляется на форме). */
        VALIDATION_ERROR(400, false),
        /** Услуга не найдена или не активна. */
        SERVICE_UNAVAILABLE(409, false),
        /** Временный сбой при постановке в очередь; повторять с тем же ключом идемпотентности. */
        ADMISSION_FAILED(503, true),
        /** Недопустимый переход статуса записи. */
        INVALID_TRANSITION(409, false),
        /** Запись не найдена в очереди услуги. */
        ENTRY_NOT_FOUND(404, false),
        /** Временный сбой при выходе из очереди. */
        LEAVE_FAILED(503, true),
        /** Система учёта временно недоступна на чтение. */
        BACKEND_UNAVAILABLE(503, true),
        /** Сессия клиента не найдена (закрыта или не открывалась). */
        SESSION_NOT_FOUND(404, false);

        private final int httpStatus;
        private final boolean retryable;

        ErrorCode(int httpStatus, boolean retryable) {
            this.httpStatus = httpStatus;
            this.retryable = retryable;
        }

        public int httpStatus() {
            return httpStatus;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    private final ErrorCode code;

    public IntakeQueueException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public IntakeQueueException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public boolean retryable() {
        return code.retryable();
    }

    public static IntakeQueueException validation(String message) {
        return new IntakeQueueException(ErrorCode.VALIDATION_ERROR, message);
    }

    public static IntakeQueueException serviceUnavailable(String serviceId) {
        return new IntakeQueueException(ErrorCode.SERVICE_UNAVAILABLE,
                "Услуга недоступна для записи в очередь: " + serviceId);
    }

    public static IntakeQueueException admissionFailed(String message, Throwable cause) {
        return new IntakeQueueException(ErrorCode.ADMISSION_FAILED, message, cause);
    }

    public static IntakeQueueException invalidTransition(String from, String to) {
        return new IntakeQueueException(ErrorCode.INVALID_TRANSITION,
                "Недопустимый переход статуса: " + from + " -> " + to);
    }

    public static IntakeQueueException entryNotFound(String serviceId, String entryId) {
        return new IntakeQueueException(ErrorCode.ENTRY_NOT_FOUND,
                "Запись " + entryId + " не найдена в очереди услуги " + serviceId);
    }

    public static IntakeQueueException leaveFailed(String message, Throwable cause) {
        return new IntakeQueueException(ErrorCode.LEAVE_FAILED, message, cause);
    }

    public static IntakeQueueException backendUnavailable(String message, Throwable cause) {
        return new IntakeQueueException(ErrorCode.BACKEND_UNAVAILABLE, message, cause);
    }

    public static IntakeQueueException sessionNotFound(String sessionId) {
        return new IntakeQueueException(ErrorCode.SESSION_NOT_FOUND, "Сессия не найдена: " + sessionId);
    }
}
