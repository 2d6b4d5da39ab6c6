package ru.aritmos.intakequeue.queue;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.intakequeue.core.IntakeQueueException;
import ru.aritmos.intakequeue.triage.TriageModels;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Подбор услуг каталога по описанию симптомов.
 * <p>
 * Порядок подбора:
 * <ol>
 *   <li>группы ключевых слов симптомов (первая совпавшая группа) сопоставляются с отделением и названием услуги;</li>
 *   <li>отделение, предложенное внешним классификатором, заменяет результат шага 1, если совпало с каталогом;</li>
 *   <li>если совпадений всё ещё нет — отделение, рекомендованное локальным триажем;</li>
 *   <li>иначе — все активные услуги.</li>
 * </ol>
 * Кандидаты упорядочиваются по ожиданию для нового пациента с обычным приоритетом
 * ({@code (ожидающих + 1) × среднее время обслуживания}), в выдачу попадают первые {@value #MAX_RECOMMENDATIONS}.
 */
@Singleton
public class ServiceRecommender {

    private static final Logger log = LoggerFactory.getLogger(ServiceRecommender.class);

    static final int MAX_RECOMMENDATIONS = 3;

    private static final List<KeywordGroup> GROUPS = List.of(
            new KeywordGroup("emergency", List.of("emergency", "urgent", "chest pain", "severe", "bleeding",
                    "unconscious", "difficulty breathing", "critical")),
            new KeywordGroup("cardiology", List.of("heart", "cardiac", "palpitations", "blood pressure")),
            new KeywordGroup("pediatric", List.of("child", "baby", "infant", "pediatric")),
            new KeywordGroup("laboratory", List.of("blood test", "lab", "test", "screening")),
            new KeywordGroup("radiology", List.of("x-ray", "scan", "imaging", "fracture")),
            new KeywordGroup("general", List.of("fever", "cold", "flu", "headache", "general", "checkup"))
    );

    private final ServiceCatalog catalog;
    private final QueueSnapshotCache snapshots;
    private final WaitTimeEstimator estimator;

    public ServiceRecommender(ServiceCatalog catalog, QueueSnapshotCache snapshots, WaitTimeEstimator estimator) {
        this.catalog = catalog;
        this.snapshots = snapshots;
        this.estimator = estimator;
    }

    /**
     * Подобрать услуги.
     * <p>
     * Недоступность системы учёта не ломает триаж: возвращается пустой список.
     *
     * @param symptomsText описание симптомов
     * @param outcome      итог триажа (может быть null)
     * @return до трёх услуг, от меньшего ожидания к большему
     */
    public List<QueueModels.ServiceRecommendation> recommend(String symptomsText, TriageModels.TriageOutcome outcome) {
        List<QueueModels.ServiceInfo> active;
        try {
            active = catalog.activeServices();
        } catch (IntakeQueueException e) {
            log.warn("Рекомендации услуг недоступны: {} {}", e.code(), e.getMessage());
            return List.of();
        }
        if (active.isEmpty()) {
            return List.of();
        }

        QueueModels.RecommendationBasis basis = QueueModels.RecommendationBasis.SYMPTOMS;
        List<QueueModels.ServiceInfo> candidates = bySymptoms(symptomsText, active);

        String department = outcome == null || outcome.result() == null ? null : outcome.result().recommendedDepartment();
        if (outcome != null && outcome.source() == TriageModels.TriageSource.EXTERNAL) {
            List<QueueModels.ServiceInfo> suggested = byDepartment(department, active);
            if (!suggested.isEmpty()) {
                candidates = suggested;
                basis = QueueModels.RecommendationBasis.EXTERNAL_SUGGESTION;
            }
        }
        if (candidates.isEmpty()) {
            candidates = byDepartment(department, active);
            basis = QueueModels.RecommendationBasis.TRIAGE_DEPARTMENT;
        }
        if (candidates.isEmpty()) {
            candidates = active;
            basis = QueueModels.RecommendationBasis.ALL_SERVICES;
        }

        List<QueueModels.ServiceRecommendation> ranked = new ArrayList<>(candidates.size());
        for (QueueModels.ServiceInfo service : candidates) {
            int waiting;
            try {
                waiting = QueueOrdering.waitingInOrder(snapshots.entries(service.id())).size();
            } catch (IntakeQueueException e) {
                log.warn("Очередь услуги {} недоступна для рекомендации: {}", service.id(), e.code());
                continue;
            }
            int avg = estimator.effectiveAverage(service.averageServiceMinutes());
            ranked.add(new QueueModels.ServiceRecommendation(service, waiting, (waiting + 1) * avg, basis));
        }
        ranked.sort(Comparator.comparingInt(QueueModels.ServiceRecommendation::estimatedWaitMinutes)
                .thenComparing(r -> r.service().id()));
        return ranked.size() > MAX_RECOMMENDATIONS ? List.copyOf(ranked.subList(0, MAX_RECOMMENDATIONS)) : List.copyOf(ranked);
    }

    static List<QueueModels.ServiceInfo> bySymptoms(String symptomsText, List<QueueModels.ServiceInfo> services) {
        if (symptomsText == null || symptomsText.isBlank()) {
            return List.of();
        }
        String text = symptomsText.toLowerCase(Locale.ROOT);
        for (KeywordGroup group : GROUPS) {
            if (group.matches(text)) {
                return services.stream()
                        .filter(s -> contains(s.department(), group.token()) || contains(s.name(), group.token()))
                        .toList();
            }
        }
        return List.of();
    }

    static List<QueueModels.ServiceInfo> byDepartment(String department, List<QueueModels.ServiceInfo> services) {
        if (department == null || department.isBlank()) {
            return List.of();
        }
        String d = department.trim().toLowerCase(Locale.ROOT);
        return services.stream()
                .filter(s -> contains(s.department(), d) || contains(s.name(), d)
                        || containsValue(d, s.department()) || containsValue(d, s.name()))
                .toList();
    }

    private static boolean contains(String value, String token) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(token);
    }

    private static boolean containsValue(String text, String value) {
        return value != null && !value.isBlank() && text.contains(value.toLowerCase(Locale.ROOT));
    }

    private record KeywordGroup(String token, List<String> keywords) {

        boolean matches(String text) {
            for (String k : keywords) {
                if (text.contains(k)) {
                    return true;
                }
            }
            return false;
        }
    }
}
