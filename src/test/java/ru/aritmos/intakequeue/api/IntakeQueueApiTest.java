package ru.aritmos.intakequeue.api;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.BlockingHttpClient;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сквозные проверки HTTP API на in-memory системе учёта из каталога по умолчанию.
 */
@MicronautTest
class IntakeQueueApiTest {

    @Inject
    @Client("/")
    HttpClient httpClient;

    @Test
    void classify_shouldReturnDegradedLocalResultAndTakeHigherPriority() {
        Map<String, Object> body = Map.of(
                "symptoms", "Severe chest pain since morning",
                "ageBracket", "adult",
                "selectedPriority", "LOW");

        Map<?, ?> response = client().retrieve(HttpRequest.POST("/api/triage/classify", body), Map.class);

        assertEquals("URGENT", response.get("priority"));
        Map<?, ?> outcome = (Map<?, ?>) response.get("outcome");
        assertEquals(Boolean.TRUE, outcome.get("degraded"), "TEST_EXPECTED: внешний классификатор выключен, ожидается локальный fallback");
        assertEquals("LOCAL", outcome.get("source"));
        assertEquals("CRITICAL", ((Map<?, ?>) outcome.get("result")).get("urgencyLevel"));

        List<?> recommended = (List<?>) response.get("recommendedServices");
        assertFalse(recommended.isEmpty(), "TEST_EXPECTED: к результату триажа приложены подходящие услуги");
        Map<?, ?> first = (Map<?, ?>) ((Map<?, ?>) recommended.get(0)).get("service");
        assertEquals("emergency-care", first.get("id"));
    }

    @Test
    void classify_shouldRejectUnknownAgeBracket() {
        HttpClientResponseException ex = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.POST("/api/triage/classify",
                        Map.of("symptoms", "headache", "ageBracket", "child")), Map.class));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        assertEquals("VALIDATION_ERROR", errorCode(ex));
    }

    @Test
    void classify_shouldRejectBlankSymptoms() {
        HttpClientResponseException ex = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.POST("/api/triage/classify", Map.of("symptoms", "  ")), Map.class));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        assertEquals("VALIDATION_ERROR", errorCode(ex));
    }

    @Test
    void services_shouldListOnlyActiveServices() {
        List<?> services = client().retrieve(HttpRequest.GET("/api/services"), List.class);

        assertFalse(services.isEmpty());
        for (Object o : services) {
            Map<?, ?> s = (Map<?, ?>) o;
            assertEquals(Boolean.TRUE, s.get("active"));
            assertNotEquals("radiology", s.get("id"));
        }
    }

    @Test
    void fullVisit_shouldGoFromJoinToCompletion() {
        HttpResponse<Map> joined = client().exchange(
                HttpRequest.POST("/api/queue/urgent-care/join", joinBody("Ivan", "ivan@example.org", "HIGH")), Map.class);
        assertEquals(HttpStatus.CREATED, joined.getStatus());
        Map<?, ?> entry = joined.body();
        assertEquals("WAITING", entry.get("status"));
        assertEquals(1, ((Number) entry.get("position")).intValue());
        assertEquals(10, ((Number) entry.get("estimatedWaitMinutes")).intValue());
        String entryId = (String) entry.get("id");

        Map<?, ?> called = client().retrieve(HttpRequest.POST("/api/desk/urgent-care/call-next", Map.of()), Map.class);
        assertEquals(entryId, called.get("id"));
        assertEquals("CALLED", called.get("status"));

        Map<?, ?> refreshed = client().retrieve(HttpRequest.GET("/api/queue/urgent-care/entries/" + entryId), Map.class);
        assertEquals("CALLED", refreshed.get("status"));
        assertNull(refreshed.get("position"), "TEST_EXPECTED: у вызванной записи нет позиции");

        client().retrieve(HttpRequest.POST("/api/desk/urgent-care/entries/" + entryId + "/serve", Map.of()), Map.class);

        HttpClientResponseException leave = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.POST("/api/queue/urgent-care/entries/" + entryId + "/leave", Map.of()), Map.class));
        assertEquals(HttpStatus.CONFLICT, leave.getStatus());
        assertEquals("INVALID_TRANSITION", errorCode(leave));

        Map<?, ?> completed = client().retrieve(HttpRequest.POST("/api/desk/urgent-care/entries/" + entryId + "/complete", Map.of()), Map.class);
        assertEquals("COMPLETED", completed.get("status"));

        HttpResponse<Map> empty = client().exchange(HttpRequest.POST("/api/desk/urgent-care/call-next", Map.of()), Map.class);
        assertEquals(HttpStatus.NO_CONTENT, empty.getStatus());
    }

    @Test
    void join_withSameIdempotencyKey_shouldReturnSameEntry() {
        Map<String, Object> body = joinBody("Olga", "olga@example.org", null);

        Map<?, ?> first = client().retrieve(HttpRequest.POST("/api/queue/general-medicine/join", body)
                .header("Idempotency-Key", "api-key-1"), Map.class);
        Map<?, ?> second = client().retrieve(HttpRequest.POST("/api/queue/general-medicine/join", body)
                .header("Idempotency-Key", "api-key-1"), Map.class);

        assertEquals(first.get("id"), second.get("id"));
        assertEquals(first.get("queueNumber"), second.get("queueNumber"));
    }

    @Test
    void join_shouldMapErrorsToHttpStatuses() {
        HttpClientResponseException inactive = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.POST("/api/queue/radiology/join", joinBody("Petr", "petr@example.org", null)), Map.class));
        assertEquals(HttpStatus.CONFLICT, inactive.getStatus());
        assertEquals("SERVICE_UNAVAILABLE", errorCode(inactive));

        HttpClientResponseException blankEmail = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.POST("/api/queue/general-medicine/join", joinBody("Petr", " ", null)), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, blankEmail.getStatus());
        assertEquals("VALIDATION_ERROR", errorCode(blankEmail));

        HttpClientResponseException badPriority = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.POST("/api/queue/general-medicine/join", joinBody("Petr", "petr@example.org", "SUPER")), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, badPriority.getStatus());
    }

    @Test
    void join_shouldRejectMissingPatientFieldsBeforeReachingQueue() {
        Map<String, Object> body = joinBody(" ", "petr@example.org", null);
        body.remove("phone");

        HttpClientResponseException ex = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.POST("/api/queue/general-medicine/join", body), Map.class));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        Map<?, ?> error = ex.getResponse().getBody(Map.class).orElseThrow();
        assertEquals("VALIDATION_ERROR", error.get("code"));
        assertEquals(Boolean.FALSE, error.get("retryable"));
        String message = (String) error.get("message");
        assertTrue(message.contains("name") && message.contains("phone"), "TEST_EXPECTED: перечислены незаполненные поля: " + message);
    }

    @Test
    void leave_shouldCancelWaitingEntry() {
        Map<?, ?> entry = client().retrieve(HttpRequest.POST("/api/queue/emergency-care/join", joinBody("Nina", "nina@example.org", null)), Map.class);
        String entryId = (String) entry.get("id");

        Map<?, ?> left = client().retrieve(HttpRequest.POST("/api/queue/emergency-care/entries/" + entryId + "/leave", Map.of()), Map.class);
        assertEquals("CANCELLED", left.get("status"));

        Map<?, ?> queue = client().retrieve(HttpRequest.GET("/api/queue/emergency-care"), Map.class);
        // пустые коллекции в ответ не сериализуются
        List<?> waiting = queue.get("waiting") == null ? List.of() : (List<?>) queue.get("waiting");
        assertTrue(waiting.stream().noneMatch(o -> entryId.equals(((Map<?, ?>) o).get("id"))));

        HttpClientResponseException missing = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.GET("/api/queue/emergency-care/entries/missing"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatus());
        assertEquals("ENTRY_NOT_FOUND", errorCode(missing));
    }

    @Test
    void session_shouldOpenWatchAndClose() {
        HttpResponse<Map> opened = client().exchange(HttpRequest.POST("/api/sessions", Map.of()), Map.class);
        assertEquals(HttpStatus.CREATED, opened.getStatus());
        String sessionId = (String) opened.body().get("id");

        Map<?, ?> entry = client().retrieve(HttpRequest.POST("/api/queue/pediatrics/join", joinBody("Masha", "masha@example.org", null)), Map.class);
        Map<?, ?> view = client().retrieve(HttpRequest.POST("/api/sessions/" + sessionId + "/watch",
                Map.of("serviceId", "pediatrics", "entryId", entry.get("id"))), Map.class);
        assertEquals(1, ((List<?>) view.get("watched")).size());

        HttpResponse<Map> closed = client().exchange(HttpRequest.DELETE("/api/sessions/" + sessionId), Map.class);
        assertEquals(HttpStatus.NO_CONTENT, closed.getStatus());

        HttpClientResponseException gone = assertThrows(HttpClientResponseException.class,
                () -> client().exchange(HttpRequest.GET("/api/sessions/" + sessionId), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, gone.getStatus());
        assertEquals("SESSION_NOT_FOUND", errorCode(gone));
    }

    private BlockingHttpClient client() {
        return httpClient.toBlocking();
    }

    private static Map<String, Object> joinBody(String name, String email, String priority) {
        Map<String, Object> body = new HashMap<>();
        body.put("name", name);
        body.put("phone", "+7 900 000-00-02");
        body.put("email", email);
        if (priority != null) {
            body.put("priority", priority);
        }
        return body;
    }

    private static String errorCode(HttpClientResponseException ex) {
        return ex.getResponse().getBody(Map.class).map(m -> (String) m.get("code")).orElse(null);
    }
}
