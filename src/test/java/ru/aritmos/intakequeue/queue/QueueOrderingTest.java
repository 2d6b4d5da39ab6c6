package ru.aritmos.intakequeue.queue;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class QueueOrderingTest {

    private static final Instant T0 = Instant.parse("2025-03-03T08:00:00Z");

    @Test
    void shouldOrderByPriorityThenJoinTimeThenId() {
        QueueModels.QueueEntry lowEarly = entry("e1", QueueModels.PriorityLevel.LOW, 0);
        QueueModels.QueueEntry normalLate = entry("e2", QueueModels.PriorityLevel.NORMAL, 50);
        QueueModels.QueueEntry normalEarly = entry("e3", QueueModels.PriorityLevel.NORMAL, 10);
        QueueModels.QueueEntry urgentLate = entry("e4", QueueModels.PriorityLevel.URGENT, 100);
        QueueModels.QueueEntry tieB = entry("b", QueueModels.PriorityLevel.HIGH, 20);
        QueueModels.QueueEntry tieA = entry("a", QueueModels.PriorityLevel.HIGH, 20);

        List<QueueModels.QueueEntry> ordered = QueueOrdering.waitingInOrder(
                List.of(lowEarly, normalLate, normalEarly, urgentLate, tieB, tieA));

        assertEquals(List.of("e4", "a", "b", "e3", "e2", "e1"), ordered.stream().map(QueueModels.QueueEntry::id).toList());
    }

    @Test
    void shouldIgnoreNonWaitingEntries() {
        QueueModels.QueueEntry waiting = entry("w", QueueModels.PriorityLevel.NORMAL, 0);
        QueueModels.QueueEntry called = entry("c", QueueModels.PriorityLevel.URGENT, 0)
                .withStatus(QueueModels.QueueStatus.CALLED, T0);
        QueueModels.QueueEntry cancelled = entry("x", QueueModels.PriorityLevel.URGENT, 0)
                .withStatus(QueueModels.QueueStatus.CANCELLED, null);

        assertEquals(List.of(waiting), QueueOrdering.waitingInOrder(List.of(called, waiting, cancelled)));
    }

    @Test
    void orderingShouldNotDependOnInputOrder() {
        List<QueueModels.QueueEntry> entries = new ArrayList<>();
        QueueModels.PriorityLevel[] levels = QueueModels.PriorityLevel.values();
        for (int i = 0; i < 40; i++) {
            entries.add(entry("id-" + i, levels[i % levels.length], i % 7));
        }
        List<QueueModels.QueueEntry> expected = QueueOrdering.waitingInOrder(entries);

        Random random = new Random(42);
        for (int round = 0; round < 10; round++) {
            List<QueueModels.QueueEntry> shuffled = new ArrayList<>(entries);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, QueueOrdering.waitingInOrder(shuffled));
        }
    }

    @Test
    void comparatorShouldBeStrictTotalOrder() {
        List<QueueModels.QueueEntry> entries = List.of(
                entry("a", QueueModels.PriorityLevel.NORMAL, 5),
                entry("b", QueueModels.PriorityLevel.NORMAL, 5),
                entry("c", QueueModels.PriorityLevel.HIGH, 9),
                entry("d", null, 1));
        for (QueueModels.QueueEntry x : entries) {
            for (QueueModels.QueueEntry y : entries) {
                int xy = QueueOrdering.WAITING_ORDER.compare(x, y);
                int yx = QueueOrdering.WAITING_ORDER.compare(y, x);
                assertEquals(Integer.signum(xy), -Integer.signum(yx));
                assertEquals(x == y, xy == 0);
            }
        }
    }

    private static QueueModels.QueueEntry entry(String id, QueueModels.PriorityLevel p, int secondsAfterStart) {
        return new QueueModels.QueueEntry(id, 0, "P-1", "svc", p, QueueModels.QueueStatus.WAITING,
                null, null, T0.plusSeconds(secondsAfterStart), null);
    }
}
