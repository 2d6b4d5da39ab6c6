package ru.aritmos.intakequeue.triage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;
import ru.aritmos.intakequeue.core.SensitiveDataSanitizer;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Внешний классификатор на базе стандартного JDK {@link HttpClient}.
 * <p>
 * Запрос: {@code POST <url>} с JSON {@code {"symptoms": "...", "ageBracket": "adult"}}.
 * Ответ разбирается терпимо к именованию: поддерживаются camelCase и snake_case поля
 * ({@code urgencyLevel}/{@code emergency_level}, {@code triageScore}/{@code triage_score} и т.д.).
 * <p>
 * Любая проблема (выключено настройкой, сетевой сбой, не-2xx статус, неразбираемое тело,
 * неизвестный уровень срочности, значения вне диапазона) приводит к {@code unavailable}.
 */
@Singleton
public class HttpExternalTriageClient implements ExternalTriageClient {

    private final IntakeQueueProperties.Triage.External config;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpExternalTriageClient(IntakeQueueProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getTriage().getExternal();
        this.objectMapper = objectMapper;
        this.requestTimeout = Duration.ofMillis(Math.max(500, config.getTimeoutMs()));
        this.client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public Classification classify(String symptomsText, TriageModels.AgeBracket ageBracket) {
        if (!config.isEnabled() || config.getUrl() == null) {
            return Classification.unavailable("DISABLED");
        }
        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("symptoms", symptomsText);
            if (ageBracket != null) {
                body.put("ageBracket", ageBracket.name().toLowerCase(Locale.ROOT));
            }

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getUrl()))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> resp = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                return Classification.unavailable("HTTP_" + status);
            }
            if (resp.body() == null || resp.body().isBlank()) {
                return Classification.unavailable("EMPTY_BODY");
            }
            return parse(objectMapper.readTree(resp.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Classification.unavailable("INTERRUPTED");
        } catch (Exception e) {
            return Classification.unavailable("HTTP_CLIENT_ERROR: " + SensitiveDataSanitizer.sanitizeText(e.getMessage()));
        }
    }

    /**
     * Разобрать ответ внешнего классификатора.
     * <p>
     * Поддерживается «обёртка» {@code {"result": {...}}} или {@code {"analysis": {...}}}.
     */
    Classification parse(JsonNode root) {
        JsonNode node = root;
        for (String key : new String[]{"result", "analysis", "triage_result"}) {
            if (node.has(key) && node.get(key).isObject()) {
                node = node.get(key);
                break;
            }
        }

        TriageModels.UrgencyLevel level = TriageModels.UrgencyLevel.parse(text(node, "urgencyLevel", "emergency_level"));
        if (level == null) {
            return Classification.unavailable("UNKNOWN_URGENCY");
        }

        JsonNode confidenceNode = field(node, "confidence", "confidence");
        double confidence = confidenceNode == null ? defaultConfidence(level) : confidenceNode.asDouble(-1);
        if (confidence < 0.0 || confidence > 1.0) {
            return Classification.unavailable("CONFIDENCE_OUT_OF_RANGE");
        }

        JsonNode scoreNode = field(node, "triageScore", "triage_score");
        int score = scoreNode == null ? defaultScore(level) : (int) Math.round(scoreNode.asDouble(-1));
        if (score < 0 || score > 10) {
            return Classification.unavailable("SCORE_OUT_OF_RANGE");
        }

        String department = text(node, "recommendedDepartment", "department_recommendation");
        if (department == null || department.isBlank()) {
            department = defaultDepartment(level);
        }

        JsonNode waitNode = field(node, "estimatedWaitMinutes", "estimated_wait_time");
        int wait = waitNode == null ? defaultWait(level) : Math.max(0, waitNode.asInt(0));

        return Classification.of(new TriageModels.TriageResult(
                level,
                confidence,
                score,
                department,
                wait,
                list(field(node, "recommendedActions", "recommended_actions")),
                list(field(node, "riskFactors", "risk_factors"))
        ));
    }

    private static JsonNode field(JsonNode node, String camel, String snake) {
        JsonNode v = node.get(camel);
        if (v == null || v.isNull()) {
            v = node.get(snake);
        }
        return (v == null || v.isNull()) ? null : v;
    }

    private static String text(JsonNode node, String camel, String snake) {
        JsonNode v = field(node, camel, snake);
        return v == null ? null : v.asText(null);
    }

    private static List<String> list(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode n : node) {
                if (n != null && !n.isNull() && !n.asText("").isBlank()) {
                    out.add(n.asText());
                }
            }
        }
        return out;
    }

    private static double defaultConfidence(TriageModels.UrgencyLevel level) {
        return switch (level) {
            case CRITICAL -> 0.8;
            case HIGH -> 0.7;
            case MODERATE, LOW -> 0.6;
        };
    }

    private static int defaultScore(TriageModels.UrgencyLevel level) {
        return switch (level) {
            case CRITICAL -> 9;
            case HIGH -> 7;
            case MODERATE -> 5;
            case LOW -> 3;
        };
    }

    private static String defaultDepartment(TriageModels.UrgencyLevel level) {
        return switch (level) {
            case CRITICAL -> TriageClassifier.EMERGENCY_CARE;
            case HIGH -> TriageClassifier.URGENT_CARE;
            case MODERATE, LOW -> TriageClassifier.GENERAL_MEDICINE;
        };
    }

    private static int defaultWait(TriageModels.UrgencyLevel level) {
        return switch (level) {
            case CRITICAL -> 0;
            case HIGH -> 15;
            case MODERATE -> 45;
            case LOW -> 90;
        };
    }
}
