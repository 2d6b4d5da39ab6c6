package ru.aritmos.intakequeue.queue;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Порядок ожидающих записей одной услуги.
 * <p>
 * Строгий полный порядок: приоритет по убыванию, затем {@code joinedAt} по возрастанию (FIFO внутри
 * приоритета), затем {@code id} по возрастанию. Функция чистая: зависит только от переданного набора,
 * поэтому два клиента, опросившие одну услугу в один момент, получают одинаковые позиции.
 */
public final class QueueOrdering {

    private QueueOrdering() {
        // утилитарный класс
    }

    public static final Comparator<QueueModels.QueueEntry> WAITING_ORDER = Comparator
            .comparingInt((QueueModels.QueueEntry e) -> -rank(e.priority()))
            .thenComparing(QueueModels.QueueEntry::joinedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(QueueModels.QueueEntry::id, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    /**
     * Отфильтровать записи в статусе WAITING и упорядочить их.
     *
     * @param entries все записи услуги (в любом статусе, в любом порядке)
     * @return новый упорядоченный список ожидающих записей
     */
    public static List<QueueModels.QueueEntry> waitingInOrder(List<QueueModels.QueueEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        return entries.stream()
                .filter(e -> e != null && e.status() == QueueModels.QueueStatus.WAITING)
                .sorted(WAITING_ORDER)
                .toList();
    }

    private static int rank(QueueModels.PriorityLevel p) {
        // Запись без приоритета считается NORMAL.
        return p == null ? QueueModels.PriorityLevel.NORMAL.rank() : p.rank();
    }
}
