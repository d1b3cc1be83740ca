package netops.gateway.integration;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.config.BackendService;
import netops.gateway.config.Dependencies;
import netops.gateway.config.GatewayConfig;
import netops.gateway.support.StubBackend;
import netops.gateway.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints of a running gateway:
 * API routes, the reverse proxy and the WebSocket event stream.
 */
class HttpEndpointIntegrationTest {

    private static final String SECRET = "integration-secret-long-enough-for-hs256";

    private StubBackend pihole;
    private Dependencies deps;
    private String baseUrl;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        pihole = new StubBackend()
                .respond("/health", 200, "{\"status\":\"ok\"}")
                .respond("/stats", 200, "{\"queries\":4200}")
                .respond("/lists", 201, "{\"added\":true}");

        deps = Dependencies.create(baseConfig());
        baseUrl = "http://127.0.0.1:" + deps.start();

        httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    private GatewayConfig baseConfig() {
        return GatewayConfig.defaults()
                .withServerHost("127.0.0.1")
                .withServerPort(0)
                .withJwtSecret(SECRET)
                .withHealthPollInterval(Duration.ofMinutes(10))
                .withWorkerThreads(2)
                .withRetryBackoff(Duration.ofMillis(50), Duration.ofMillis(200))
                .withoutServices()
                .withService(new BackendService("pihole", pihole.url()))
                .withService("agent", "http://127.0.0.1:1");
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
        pihole.close();
    }

    private HttpResponse<String> get(String path, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET();
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> send(String method, String path, String body, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) {
        return Jsons.readTree(response.body());
    }

    private String bearer(String userId) {
        return "Bearer " + deps.authenticator().issueToken(userId, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Health endpoint reports the gateway and its configured services")
    void healthEndpoint() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        JsonNode body = json(response);
        assertEquals("healthy", body.get("status").asText());
        assertEquals(2, body.get("services").size());
    }

    @Test
    @DisplayName("Full task flow: create, execute, read back, refuse cancel of a finished task")
    void taskLifecycleOverHttp() throws Exception {
        HttpResponse<String> created = send("POST", "/api/v1/tasks",
                "{\"type\":\"system_metric\",\"priority\":\"high\",\"data\":{}}");

        assertEquals(201, created.statusCode(), "Body: " + created.body());
        JsonNode createdBody = json(created);
        String taskId = createdBody.get("task_id").asText();
        assertEquals("pending", createdBody.get("status").asText());
        assertNotNull(createdBody.get("estimated_completion"));

        await().atMost(5, TimeUnit.SECONDS).until(
                () -> "completed".equals(json(get("/api/v1/tasks/" + taskId)).get("status").asText()));

        JsonNode task = json(get("/api/v1/tasks/" + taskId));
        assertEquals("system_metric", task.get("type").asText());
        assertEquals("high", task.get("priority").asText());
        assertTrue(task.get("result").has("cpu"));
        assertNotNull(task.get("completed_at"));

        JsonNode completed = json(get("/api/v1/tasks?status=completed"));
        assertEquals(1, completed.get("count").asInt());

        HttpResponse<String> cancel = send("DELETE", "/api/v1/tasks/" + taskId, null);
        assertEquals(409, cancel.statusCode());
        assertEquals(409, json(cancel).get("status_code").asInt());

        JsonNode metrics = json(get("/api/v1/metrics"));
        assertEquals(1, metrics.get("total_tasks").asInt());
        assertEquals(1, metrics.get("completed").asInt());
        assertEquals(1, metrics.get("by_type").get("system_metric").asInt());
    }

    @Test
    @DisplayName("DNS update runs against the dry-run edge provider")
    void dnsUpdateCompletes() throws Exception {
        HttpResponse<String> created = send("POST", "/api/v1/tasks",
                "{\"type\":\"dns_update\",\"priority\":\"high\","
                        + "\"data\":{\"record\":\"test.example.com\",\"type\":\"A\",\"content\":\"10.0.0.5\"}}");

        assertEquals(201, created.statusCode(), "Body: " + created.body());
        String taskId = json(created).get("task_id").asText();
        assertEquals("test.example.com", json(get("/api/v1/tasks/" + taskId)).get("data").get("record").asText());

        await().atMost(5, TimeUnit.SECONDS).until(
                () -> "completed".equals(json(get("/api/v1/tasks/" + taskId)).get("status").asText()));

        JsonNode result = json(get("/api/v1/tasks/" + taskId)).get("result");
        assertEquals("success", result.get("status").asText());
        assertTrue(result.get("dry_run").asBoolean());
        assertEquals("10.0.0.5", result.get("data").get("content").asText());
    }

    @Test
    @DisplayName("Bad requests get structured errors")
    void errorResponses() throws Exception {
        HttpResponse<String> badType = send("POST", "/api/v1/tasks", "{\"type\":\"teleport\"}");
        assertEquals(400, badType.statusCode());
        assertEquals("Invalid task type", json(badType).get("error").asText());

        HttpResponse<String> badJson = send("POST", "/api/v1/tasks", "{not json");
        assertEquals(400, badJson.statusCode());
        assertEquals("Invalid JSON", json(badJson).get("error").asText());

        HttpResponse<String> badPayload = send("POST", "/api/v1/tasks",
                "{\"type\":\"dns_update\",\"data\":{\"content\":\"1.2.3.4\"}}");
        assertEquals(400, badPayload.statusCode());
        assertTrue(json(badPayload).get("detail").asText().contains("data.record"));

        assertEquals(400, get("/api/v1/tasks?status=sleeping").statusCode());
        assertEquals(404, get("/api/v1/tasks/does-not-exist").statusCode());

        HttpResponse<String> noRoute = get("/nowhere");
        assertEquals(404, noRoute.statusCode());
        assertEquals("Not found", json(noRoute).get("error").asText());

        HttpResponse<String> forbidden = get("/api/v1/tasks", "Authorization", "Bearer forged");
        assertEquals(403, forbidden.statusCode());
    }

    @Test
    @DisplayName("Cancelling a pending task")
    void cancelPendingTask() throws Exception {
        deps.dispatcher().stop();
        String taskId = json(send("POST", "/api/v1/tasks", "{\"type\":\"backup\",\"priority\":\"low\"}"))
                .get("task_id").asText();

        HttpResponse<String> cancelled = send("DELETE", "/api/v1/tasks/" + taskId, null);

        assertEquals(200, cancelled.statusCode());
        assertEquals("cancelled", json(cancelled).get("status").asText());
    }

    @Test
    @DisplayName("Status endpoint probes every backend live")
    void statusProbesBackends() throws Exception {
        JsonNode status = json(get("/api/status"));

        assertEquals("online", status.get("gateway").asText());
        assertEquals("online", status.get("services").get("pihole").asText());
        assertEquals("offline", status.get("services").get("agent").asText());
    }

    @Test
    @DisplayName("A slow backend in /api/status does not stall other connections")
    void slowStatusCheckKeepsEventLoopFree() throws Exception {
        try (StubBackend slow = new StubBackend()
                .respondSlowly("/health", Duration.ofMillis(2500), 200, "{\"status\":\"ok\"}")) {
            deps.close();
            deps = Dependencies.create(baseConfig().withIoThreads(1).withService("slow", slow.url()));
            baseUrl = "http://127.0.0.1:" + deps.start();

            CompletableFuture<HttpResponse<String>> status = httpClient.sendAsync(
                    HttpRequest.newBuilder(URI.create(baseUrl + "/api/status")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            await().atMost(5, TimeUnit.SECONDS).until(() -> slow.requests().size() >= 2);

            long started = System.nanoTime();
            assertEquals(200, get("/health").statusCode());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            assertTrue(elapsedMs < 1000, "/health took " + elapsedMs + "ms while /api/status was probing");
            assertFalse(status.isDone());

            JsonNode services = json(status.get(10, TimeUnit.SECONDS)).get("services");
            assertEquals("online", services.get("slow").asText());
            assertEquals("online", services.get("pihole").asText());
        }
    }

    @Test
    @DisplayName("Proxy rewrites the path and asserts the caller's identity to the backend")
    void proxyForwardsToBackend() throws Exception {
        HttpResponse<String> response = get("/api/pihole/stats?window=1h",
                "Authorization", bearer("ops-1"),
                "X-User-Id", "someone-else",
                "X-Forwarded-For", "203.0.113.9");

        assertEquals(200, response.statusCode(), "Body: " + response.body());
        assertEquals(4200, json(response).get("queries").asInt());

        StubBackend.Recorded seen = pihole.lastRequest();
        assertEquals("/stats?window=1h", seen.uri());
        assertEquals("ops-1", seen.headers().getFirst("X-User-Id"));
        assertEquals("203.0.113.9, 127.0.0.1", seen.headers().getFirst("X-Forwarded-For"));
        assertEquals(pihole.url().substring("http://".length()), seen.headers().getFirst("Host"));

        HttpResponse<String> posted = send("POST", "/api/pihole/lists", "{\"domain\":\"ads.example\"}");
        assertEquals(201, posted.statusCode());
        assertEquals("{\"domain\":\"ads.example\"}", pihole.lastRequest().body());
        assertNull(pihole.lastRequest().headers().getFirst("X-User-Id"));
    }

    @Test
    @DisplayName("Backends registered at runtime are listed and proxied")
    void runtimeRegisteredBackend() throws Exception {
        try (StubBackend files = new StubBackend().respond("/tools", 200, "{\"tools\":[\"read\"]}")) {
            assertEquals(404, get("/api/files/tools").statusCode());

            HttpResponse<String> registered = send("POST", "/api/v1/services",
                    "{\"name\":\"files\",\"url\":\"" + files.url() + "\"}");
            assertEquals(201, registered.statusCode(), "Body: " + registered.body());
            assertEquals("registered", json(registered).get("status").asText());
            assertNotNull(json(registered).get("expires_at"));

            HttpResponse<String> proxied = get("/api/files/tools");
            assertEquals(200, proxied.statusCode());
            assertEquals("read", json(proxied).get("tools").get(0).asText());

            JsonNode listed = json(get("/api/v1/services"));
            assertEquals(3, listed.get("count").asInt());
            JsonNode last = listed.get("services").get(2);
            assertEquals("files", last.get("name").asText());
            assertEquals("registered", last.get("source").asText());

            assertEquals(409, send("POST", "/api/v1/services",
                    "{\"name\":\"pihole\",\"url\":\"http://10.0.0.1\"}").statusCode());
            assertEquals(400, send("POST", "/api/v1/services",
                    "{\"name\":\"v1\",\"url\":\"http://10.0.0.1\"}").statusCode());
        }
    }

    @Test
    @DisplayName("Proxy answers 502 for an unreachable backend and 404 for an unknown one")
    void proxyFailures() throws Exception {
        HttpResponse<String> unreachable = get("/api/agent/run");
        assertEquals(502, unreachable.statusCode());
        assertEquals("Service unavailable", json(unreachable).get("error").asText());

        assertEquals(404, get("/api/printer/queue").statusCode());

        HttpResponse<String> badToken = get("/api/pihole/stats", "Authorization", "Bearer forged");
        assertEquals(403, badToken.statusCode());
        assertTrue(pihole.requests().stream().noneMatch(r -> r.uri().startsWith("/stats")));
    }

    @Test
    @DisplayName("Critical service_down alert starts a remediation task")
    void alertTriggersRemediation() throws Exception {
        HttpResponse<String> response = send("POST", "/api/v1/alerts",
                "{\"type\":\"service_down\",\"severity\":\"critical\",\"service\":\"agent\",\"message\":\"gone\"}");

        assertEquals(202, response.statusCode(), "Body: " + response.body());
        JsonNode accepted = json(response);
        assertEquals("immediate", accepted.get("action").asText());
        String taskId = accepted.get("remediation_task_id").asText();

        JsonNode task = json(get("/api/v1/tasks/" + taskId));
        assertEquals("remediate", task.get("type").asText());
        assertEquals("critical", task.get("priority").asText());

        JsonNode alerts = json(get("/api/v1/alerts"));
        assertEquals(1, alerts.get("count").asInt());

        JsonNode report = json(get("/api/v1/report"));
        assertEquals(1, report.get("alerts").get("critical").asInt());
        assertEquals(1, report.get("tasks").get("total").asInt());
    }

    @Test
    @DisplayName("Capabilities list every task type and the edge mode")
    void capabilities() throws Exception {
        JsonNode caps = json(get("/api/v1/capabilities"));

        assertEquals(14, caps.get("task_types").size());
        assertEquals("dry-run", caps.get("edge_mode").asText());
        assertEquals(4, caps.get("priorities").size());
    }

    @Test
    @DisplayName("WebSocket clients receive task updates for subscribed channels")
    void webSocketEvents() throws Exception {
        BlockingQueue<JsonNode> events = new LinkedBlockingQueue<>();
        WebSocket ws = httpClient.newWebSocketBuilder()
                .buildAsync(URI.create(baseUrl.replace("http://", "ws://") + "/ws"), new WebSocket.Listener() {
                    private final StringBuilder partial = new StringBuilder();

                    @Override
                    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                        partial.append(data);
                        if (last) {
                            events.add(Jsons.readTree(partial.toString()));
                            partial.setLength(0);
                        }
                        webSocket.request(1);
                        return null;
                    }
                })
                .get(5, TimeUnit.SECONDS);

        try {
            assertNotNull(awaitEvent(events, "connected"));

            ws.sendText("{\"type\":\"subscribe\",\"channels\":[\"tasks\"]}", true).get(5, TimeUnit.SECONDS);
            JsonNode subscribed = awaitEvent(events, "subscribed");
            assertEquals("tasks", subscribed.get("data").get("channels").get(0).asText());

            ws.sendText("{\"type\":\"ping\"}", true).get(5, TimeUnit.SECONDS);
            assertNotNull(awaitEvent(events, "pong"));

            String taskId = json(send("POST", "/api/v1/tasks", "{\"type\":\"system_metric\"}")).get("task_id").asText();
            JsonNode update = awaitEvent(events, "task-update");
            assertEquals(taskId, update.get("data").get("task_id").asText());
            assertEquals(1, deps.broadcaster().clientCount());
        } finally {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "done");
        }
    }

    private static JsonNode awaitEvent(BlockingQueue<JsonNode> events, String type) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            JsonNode event = events.poll(100, TimeUnit.MILLISECONDS);
            if (event != null && type.equals(event.path("type").asText())) {
                return event;
            }
        }
        fail("No '" + type + "' event received");
        return null;
    }

    @Test
    @DisplayName("Rate limit covers API and proxy routes but not /health")
    void rateLimited() throws Exception {
        deps.close();
        deps = Dependencies.create(baseConfig().withRateLimit(3, Duration.ofMinutes(1)));
        baseUrl = "http://127.0.0.1:" + deps.start();

        assertEquals(200, get("/api/v1/metrics").statusCode());
        assertEquals(200, get("/api/pihole/stats").statusCode());
        assertEquals(200, get("/api/status").statusCode());

        HttpResponse<String> limited = get("/api/v1/metrics");
        assertEquals(429, limited.statusCode());
        assertTrue(limited.headers().firstValue("Retry-After").isPresent());
        assertEquals(429, get("/api/pihole/stats").statusCode());

        assertEquals(200, get("/health").statusCode());
    }

    @Test
    @DisplayName("Tasks survive in the JDBC store")
    void jdbcStorage() throws Exception {
        deps.close();
        deps = Dependencies.create(baseConfig()
                .withStorage(GatewayConfig.STORAGE_JDBC)
                .withDatabaseUrl("jdbc:h2:mem:gateway-it-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        baseUrl = "http://127.0.0.1:" + deps.start();

        String taskId = json(send("POST", "/api/v1/tasks", "{\"type\":\"system_metric\"}")).get("task_id").asText();

        await().atMost(5, TimeUnit.SECONDS).until(
                () -> "completed".equals(json(get("/api/v1/tasks/" + taskId)).get("status").asText()));
        assertEquals(1, deps.taskRepository().findAll().size());
        assertTrue(deps.database().isHealthy());
    }
}
