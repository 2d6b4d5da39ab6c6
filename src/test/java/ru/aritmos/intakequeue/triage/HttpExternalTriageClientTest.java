package ru.aritmos.intakequeue.triage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import ru.aritmos.intakequeue.config.IntakeQueueProperties;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpExternalTriageClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldPostSymptomsAndParseSnakeCaseResponse() throws Exception {
        AtomicReference<String> requestBody = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/triage", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String response = "{\"analysis\":{\"emergency_level\":\"high\",\"confidence\":0.82,\"triage_score\":7,"
                    + "\"department_recommendation\":\"Urgent Care\",\"estimated_wait_time\":20,"
                    + "\"recommended_actions\":[\"Monitor symptoms\"],\"risk_factors\":[\"Fever\"]}}";
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        try {
            HttpExternalTriageClient client = new HttpExternalTriageClient(
                    properties("http://localhost:" + server.getAddress().getPort() + "/triage"), objectMapper);

            ExternalTriageClient.Classification c = client.classify("fever and cough", TriageModels.AgeBracket.PEDIATRIC);

            assertTrue(c.available(), "TEST_EXPECTED: ответ должен быть принят, причина: " + c.reason());
            assertEquals(TriageModels.UrgencyLevel.HIGH, c.result().urgencyLevel());
            assertEquals(0.82, c.result().confidence(), 1e-9);
            assertEquals(7, c.result().triageScore());
            assertEquals(20, c.result().estimatedWaitMinutes());
            assertEquals("Fever", c.result().riskFactors().get(0));

            assertEquals("fever and cough", objectMapper.readTree(requestBody.get()).get("symptoms").asText());
            assertEquals("pediatric", objectMapper.readTree(requestBody.get()).get("ageBracket").asText());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void non2xx_shouldBeUnavailable() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/triage", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();
        try {
            HttpExternalTriageClient client = new HttpExternalTriageClient(
                    properties("http://localhost:" + server.getAddress().getPort() + "/triage"), objectMapper);

            ExternalTriageClient.Classification c = client.classify("fever", null);

            assertFalse(c.available());
            assertEquals("HTTP_503", c.reason());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void disabled_shouldNotCallNetwork() {
        HttpExternalTriageClient client = new HttpExternalTriageClient(new IntakeQueueProperties(), objectMapper);

        ExternalTriageClient.Classification c = client.classify("fever", null);

        assertFalse(c.available());
        assertEquals("DISABLED", c.reason());
    }

    @Test
    void parse_shouldRejectUnknownUrgencyAndOutOfRangeValues() throws Exception {
        HttpExternalTriageClient client = new HttpExternalTriageClient(new IntakeQueueProperties(), objectMapper);

        assertEquals("UNKNOWN_URGENCY",
                client.parse(objectMapper.readTree("{\"urgencyLevel\":\"apocalyptic\"}")).reason());
        assertEquals("CONFIDENCE_OUT_OF_RANGE",
                client.parse(objectMapper.readTree("{\"urgencyLevel\":\"low\",\"confidence\":1.7}")).reason());
        assertEquals("SCORE_OUT_OF_RANGE",
                client.parse(objectMapper.readTree("{\"urgencyLevel\":\"low\",\"triageScore\":42}")).reason());
    }

    @Test
    void parse_shouldFillDefaultsForMissingFields() throws Exception {
        HttpExternalTriageClient client = new HttpExternalTriageClient(new IntakeQueueProperties(), objectMapper);

        ExternalTriageClient.Classification c = client.parse(objectMapper.readTree("{\"result\":{\"urgencyLevel\":\"CRITICAL\"}}"));

        assertTrue(c.available());
        assertEquals(9, c.result().triageScore());
        assertEquals(TriageClassifier.EMERGENCY_CARE, c.result().recommendedDepartment());
        assertEquals(0, c.result().estimatedWaitMinutes());
    }

    private static IntakeQueueProperties properties(String url) {
        IntakeQueueProperties p = new IntakeQueueProperties();
        p.getTriage().getExternal().setEnabled(true);
        p.getTriage().getExternal().setUrl(url);
        p.getTriage().getExternal().setTimeoutMs(2000);
        return p;
    }
}
