package ru.aritmos.intakequeue.triage;

import org.junit.jupiter.api.Test;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.queue.PriorityMapper;
import ru.aritmos.intakequeue.queue.QueueModels;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TriageServiceTest {

    private final TriageClassifier local = new TriageClassifier();

    @Test
    void externalAvailable_shouldUseExternalResult() {
        TriageModels.TriageResult remote = new TriageModels.TriageResult(
                TriageModels.UrgencyLevel.LOW, 0.95, 2, "General Medicine", 90, List.of("Rest"), List.of());
        TriageService service = new TriageService((text, age) -> ExternalTriageClient.Classification.of(remote), local);

        TriageModels.TriageOutcome outcome = service.classify("runny nose", TriageModels.AgeBracket.ADULT, null);

        assertEquals(TriageModels.TriageSource.EXTERNAL, outcome.source());
        assertFalse(outcome.degraded());
        assertNull(outcome.notice());
        assertEquals(remote, outcome.result());
    }

    @Test
    void externalUnavailable_shouldFallBackAndSignalDegraded() {
        TriageService service = new TriageService((text, age) -> ExternalTriageClient.Classification.unavailable("HTTP_503"), local);

        TriageModels.TriageOutcome outcome = service.classify("severe chest pain and difficulty breathing", null, null);

        assertTrue(outcome.degraded());
        assertEquals(TriageModels.TriageSource.LOCAL, outcome.source());
        assertEquals(TriageModels.TriageOutcome.DEGRADED_NOTICE, outcome.notice());
        assertEquals(TriageModels.UrgencyLevel.CRITICAL, outcome.result().urgencyLevel());

        // Поток не блокируется: приоритет по-прежнему вычисляется.
        assertEquals(QueueModels.PriorityLevel.URGENT, new PriorityMapper().toPriority(outcome.result().urgencyLevel()));
    }

    @Test
    void externalThrowing_shouldFallBack() {
        TriageService service = new TriageService((text, age) -> {
            throw new IllegalStateException("connection reset");
        }, local);

        TriageModels.TriageOutcome outcome = service.classify("fever", null, null);

        assertTrue(outcome.degraded());
        assertEquals(TriageModels.UrgencyLevel.HIGH, outcome.result().urgencyLevel());
    }

    @Test
    void blankText_shouldFailBeforeCallingExternal() {
        AtomicInteger calls = new AtomicInteger();
        TriageService service = new TriageService((text, age) -> {
            calls.incrementAndGet();
            return ExternalTriageClient.Classification.unavailable("DISABLED");
        }, local);

        IntakeQueueException e = assertThrows(IntakeQueueException.class, () -> service.classify(" ", null, null));

        assertEquals(IntakeQueueException.ErrorCode.VALIDATION_ERROR, e.code());
        assertEquals(0, calls.get());
    }
}
