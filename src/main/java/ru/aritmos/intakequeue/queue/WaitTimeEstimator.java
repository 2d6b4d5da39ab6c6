package ru.aritmos.intakequeue.queue;

import jakarta.inject.Singleton;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Оценка позиции и времени ожидания.
 * <p>
 * Формула детерминированная: {@code position = 1 + число записей строго впереди},
 * {@code estimatedWaitMinutes = position × averageServiceMinutes}. Оценка монотонна и объяснима:
 * уход записи, стоящей впереди, строго уменьшает её, а новая запись с более высоким приоритетом
 * никогда её не уменьшает.
 */
@Singleton
public class WaitTimeEstimator {

    private final int defaultAverageServiceMinutes;

    public WaitTimeEstimator(IntakeQueueProperties properties) {
        this.defaultAverageServiceMinutes = properties.getQueue().getDefaultAverageServiceMinutes();
    }

    /**
     * Оценить позицию записи.
     *
     * @param entry                 запись (ожидается WAITING)
     * @param allWaitingForService  записи той же услуги (нефильтрованные допускаются: берутся только WAITING)
     * @param averageServiceMinutes среднее время обслуживания (null или <= 0 → значение по умолчанию)
     * @return позиция и оценка
     */
    public QueueModels.QueuePosition estimate(QueueModels.QueueEntry entry,
                                              List<QueueModels.QueueEntry> allWaitingForService,
                                              Integer averageServiceMinutes) {
        int avg = effectiveAverage(averageServiceMinutes);
        int ahead = 0;
        if (allWaitingForService != null) {
            for (QueueModels.QueueEntry other : allWaitingForService) {
                if (other == null || other.status() != QueueModels.QueueStatus.WAITING) {
                    continue;
                }
                if (entry.id() != null && entry.id().equals(other.id())) {
                    continue;
                }
                if (QueueOrdering.WAITING_ORDER.compare(other, entry) < 0) {
                    ahead++;
                }
            }
        }
        int position = ahead + 1;
        return new QueueModels.QueuePosition(position, position * avg);
    }

    /**
     * Оценить всю линию ожидания услуги за один проход.
     *
     * @param entries               записи услуги
     * @param averageServiceMinutes среднее время обслуживания
     * @return ожидающие записи в порядке очереди с заполненными позициями
     */
    public List<QueueModels.QueueEntry> estimateAll(List<QueueModels.QueueEntry> entries, Integer averageServiceMinutes) {
        int avg = effectiveAverage(averageServiceMinutes);
        List<QueueModels.QueueEntry> ordered = QueueOrdering.waitingInOrder(entries);
        List<QueueModels.QueueEntry> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            int position = i + 1;
            out.add(ordered.get(i).withEstimate(new QueueModels.QueuePosition(position, position * avg)));
        }
        return out;
    }

    public int effectiveAverage(Integer averageServiceMinutes) {
        return (averageServiceMinutes == null || averageServiceMinutes <= 0)
                ? defaultAverageServiceMinutes
                : averageServiceMinutes;
    }
}
