package ru.aritmos.intakequeue.queue;

import org.junit.jupiter.api.Test;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WaitTimeEstimatorTest {

    private static final Instant T0 = Instant.parse("2025-03-03T08:00:00Z");

    private final WaitTimeEstimator estimator = new WaitTimeEstimator(new IntakeQueueProperties());

    @Test
    void positionShouldCountOnlyEntriesStrictlyAhead() {
        QueueModels.QueueEntry a = entry("a", QueueModels.PriorityLevel.NORMAL, 1);
        QueueModels.QueueEntry b = entry("b", QueueModels.PriorityLevel.NORMAL, 2);
        QueueModels.QueueEntry c = entry("c", QueueModels.PriorityLevel.NORMAL, 3);
        List<QueueModels.QueueEntry> all = List.of(c, a, b);

        assertEquals(new QueueModels.QueuePosition(1, 15), estimator.estimate(a, all, 15));
        assertEquals(new QueueModels.QueuePosition(2, 30), estimator.estimate(b, all, 15));
        assertEquals(new QueueModels.QueuePosition(3, 45), estimator.estimate(c, all, 15));
    }

    @Test
    void missingOrInvalidAverage_shouldUseDefault() {
        QueueModels.QueueEntry a = entry("a", QueueModels.PriorityLevel.NORMAL, 1);
        assertEquals(15, estimator.estimate(a, List.of(a), null).estimatedWaitMinutes());
        assertEquals(15, estimator.estimate(a, List.of(a), 0).estimatedWaitMinutes());
        assertEquals(8, estimator.estimate(a, List.of(a), 8).estimatedWaitMinutes());
    }

    @Test
    void entryNotInSet_shouldStillGetPositionAtLeastOne() {
        QueueModels.QueueEntry lonely = entry("z", QueueModels.PriorityLevel.LOW, 0);
        QueueModels.QueuePosition p = estimator.estimate(lonely, List.of(), 20);
        assertEquals(1, p.position());
        assertEquals(20, p.estimatedWaitMinutes());
    }

    @Test
    void leavingEntryAhead_shouldStrictlyDecreaseEstimate() {
        QueueModels.QueueEntry a = entry("a", QueueModels.PriorityLevel.HIGH, 1);
        QueueModels.QueueEntry b = entry("b", QueueModels.PriorityLevel.NORMAL, 2);
        int before = estimator.estimate(b, List.of(a, b), 15).estimatedWaitMinutes();
        int after = estimator.estimate(b, List.of(a.withStatus(QueueModels.QueueStatus.CANCELLED, null), b), 15).estimatedWaitMinutes();
        assertTrue(after < before);
    }

    @Test
    void estimateAll_shouldMatchPerEntryEstimate() {
        QueueModels.QueueEntry a = entry("a", QueueModels.PriorityLevel.LOW, 1);
        QueueModels.QueueEntry b = entry("b", QueueModels.PriorityLevel.URGENT, 5);
        QueueModels.QueueEntry c = entry("c", QueueModels.PriorityLevel.NORMAL, 3);
        List<QueueModels.QueueEntry> all = List.of(a, b, c);

        List<QueueModels.QueueEntry> line = estimator.estimateAll(all, 10);

        assertEquals(List.of("b", "c", "a"), line.stream().map(QueueModels.QueueEntry::id).toList());
        for (QueueModels.QueueEntry e : line) {
            QueueModels.QueuePosition p = estimator.estimate(e, all, 10);
            assertEquals(p.position(), e.position());
            assertEquals(p.position() * 10, e.estimatedWaitMinutes());
        }
    }

    private static QueueModels.QueueEntry entry(String id, QueueModels.PriorityLevel p, int seconds) {
        return new QueueModels.QueueEntry(id, 0, "P-1", "svc", p, QueueModels.QueueStatus.WAITING,
                null, null, T0.plusSeconds(seconds), null);
    }
}
