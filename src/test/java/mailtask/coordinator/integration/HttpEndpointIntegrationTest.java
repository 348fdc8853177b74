package mailtask.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mailtask.coordinator.TestSupport;
import mailtask.coordinator.agent.MockAgent;
import mailtask.coordinator.config.CoordinatorConfig;
import mailtask.coordinator.config.Dependencies;
import mailtask.coordinator.report.TaskReporter;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the status API over HTTP.
 * Server binds an ephemeral port; the scheduler stays off so task states are predictable.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private Dependencies deps;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = TestSupport.fastConfig(dir)
                .withServerHost("127.0.0.1")
                .withServerPort(0)
                .withMaxRetries(2);
        deps = Dependencies.create(config, new MockAgent(Duration.ZERO), TaskReporter.NONE);
        deps.startServer();

        baseUrl = "http://127.0.0.1:" + deps.server().boundPort();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Enqueue over HTTP, then read the task, list and stats")
    void createAndInspectTask() throws Exception {
        HttpResponse<String> created = post("/api/v1/tasks", """
                {
                    "subject": "Quarterly report",
                    "from": "boss@example.com",
                    "text": "numbers please"
                }
                """);

        assertEquals(201, created.statusCode(), "Body: " + created.body());
        JsonNode task = MAPPER.readTree(created.body());
        String taskId = task.get("id").asText();
        assertEquals("pending", task.get("status").asText());
        assertEquals("Quarterly report", task.get("subject").asText());
        assertEquals("boss@example.com", task.get("reporterEmail").asText());
        assertEquals(2, task.get("maxRetries").asInt());

        // Lookup by short id includes logs
        HttpResponse<String> single = get("/api/v1/tasks/" + taskId.substring(0, 8));
        assertEquals(200, single.statusCode());
        JsonNode detail = MAPPER.readTree(single.body());
        assertEquals(taskId, detail.get("id").asText());
        assertEquals("Task created", detail.get("logs").get(0).get("message").asText());

        HttpResponse<String> list = get("/api/v1/tasks?status=pending&limit=5");
        assertEquals(200, list.statusCode());
        JsonNode listed = MAPPER.readTree(list.body());
        assertEquals(1, listed.get("count").asInt());
        assertFalse(listed.get("tasks").get(0).has("logs"));

        JsonNode stats = MAPPER.readTree(get("/api/v1/stats").body());
        assertEquals(1, stats.get("total").asInt());
        assertEquals(1, stats.get("pending").asInt());
    }

    @Test
    void healthReportsQueueAndVersion() throws Exception {
        deps.taskService().enqueue("A", "a@example.com", null, null);

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals("2.0.0", health.get("version").asText());
        assertEquals(1, health.get("queue").get("total").asInt());
    }

    @Test
    void cleanupRemovesFinishedTasks() throws Exception {
        String id = deps.taskService().enqueue("A", "a@example.com", null, null).id();
        deps.taskService().processNow(id, new MockAgent(Duration.ZERO));

        HttpResponse<String> response = post("/api/v1/tasks/cleanup?days=0", "");

        assertEquals(200, response.statusCode(), "Body: " + response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(1, body.get("removed").asInt());
        assertEquals(0, body.get("days").asInt());
        assertEquals(404, get("/api/v1/tasks/" + id).statusCode());
    }

    @Test
    void badRequestsAreRejected() throws Exception {
        HttpResponse<String> missingFrom = post("/api/v1/tasks", "{\"subject\":\"x\"}");
        assertEquals(400, missingFrom.statusCode());
        assertTrue(MAPPER.readTree(missingFrom.body()).has("error"));

        assertEquals(400, post("/api/v1/tasks", "{not json").statusCode());
        assertEquals(400, get("/api/v1/tasks?status=sleeping").statusCode());
        assertEquals(400, get("/api/v1/tasks?limit=abc").statusCode());
        assertEquals(404, get("/api/v1/tasks/does-not-exist").statusCode());
        assertEquals(404, get("/api/v1/unknown").statusCode());
    }
}
