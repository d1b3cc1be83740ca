package netops.gateway.config;

import netops.gateway.model.AlertSeverity;
import netops.gateway.util.IniParser;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    @Test
    void defaults() {
        GatewayConfig config = GatewayConfig.defaults();

        assertEquals(8888, config.serverPort());
        assertEquals(100, config.rateLimitMaxRequests());
        assertEquals(Duration.ofMinutes(15), config.rateLimitWindow());
        assertEquals(Duration.ofSeconds(5), config.healthPollInterval());
        assertEquals(300, config.defaultTimeoutSeconds());
        assertEquals(3, config.defaultMaxRetries());
        assertFalse(config.usesJdbcStorage());
        assertFalse(config.hasEdgeApi());
        assertFalse(config.production());
        assertEquals(List.of("pihole", "cloudflare", "metrics", "agent"), List.copyOf(config.services().keySet()));
        assertEquals("/api/pihole/summary", config.service("pihole").orElseThrow().feedPath());
    }

    @Test
    void environmentOverrides() {
        GatewayConfig config = GatewayConfig.defaults().applyEnv(Map.of(
                "API_GATEWAY_PORT", "9000",
                "NODE_ENV", "production",
                "JWT_SECRET", "s3cret",
                "REQUIRE_AUTH", "true",
                "GATEWAY_STORAGE", "JDBC",
                "PIHOLE_SERVICE_URL", "http://10.0.0.2:80/",
                "EDGE_API_URL", "https://api.example.net",
                "GATEWAY_WORKERS", " "));

        assertEquals(9000, config.serverPort());
        assertTrue(config.production());
        assertTrue(config.hasJwtSecret());
        assertTrue(config.requireAuth());
        assertTrue(config.usesJdbcStorage());
        assertTrue(config.hasEdgeApi());
        assertEquals(8, config.workerThreads());

        BackendService pihole = config.service("pihole").orElseThrow();
        assertEquals("http://10.0.0.2:80", pihole.baseUrl());
        assertEquals("/api/pihole/summary", pihole.feedPath());
    }

    @Test
    void iniSettings() {
        GatewayConfig config = GatewayConfig.defaults().apply(IniParser.parse(List.of(
                "[server]", "port = 7000", "io_threads = 2",
                "[registry]", "ttl_seconds = 600",
                "[rate_limit]", "max_requests = 10", "window_seconds = 60",
                "[health]", "service_down_severity = warning",
                "[tasks]", "backoff_base_ms = 250", "backoff_max_ms = 4000",
                "[services]", "nas = http://10.0.0.9:5000/api",
                "[feeds]", "nas = /status")));

        assertEquals(7000, config.serverPort());
        assertEquals(2, config.ioThreads());
        assertEquals(Duration.ofMinutes(10), config.registrationTtl());
        assertEquals(10, config.rateLimitMaxRequests());
        assertEquals(Duration.ofSeconds(60), config.rateLimitWindow());
        assertEquals(AlertSeverity.WARNING, config.serviceDownSeverity());
        assertEquals(Duration.ofMillis(250), config.retryBackoffBase());
        assertEquals(Duration.ofMillis(4000), config.retryBackoffMax());

        BackendService nas = config.service("nas").orElseThrow();
        assertEquals("/api", nas.basePath());
        assertEquals("/status", nas.feedPath());
        assertEquals(5000, nas.port());
    }

    @Test
    void feedForUnknownServiceRejected() {
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.defaults()
                .apply(IniParser.parse(List.of("[feeds]", "nowhere = /x"))));
    }

    @Test
    void backendServiceNormalizes() {
        BackendService service = new BackendService(" Metrics ", "https://metrics.internal/");

        assertEquals("metrics", service.name());
        assertEquals("https://metrics.internal", service.baseUrl());
        assertEquals(443, service.port());
        assertTrue(service.isTls());
        assertEquals("", service.basePath());
        assertEquals("https://metrics.internal/health", service.healthUrl());
        assertNull(new BackendService("a", "http://a", " ").feedPath());
    }

    @Test
    void withersReplaceServices() {
        GatewayConfig config = GatewayConfig.defaults().withoutServices().withService("agent", "http://127.0.0.1:9");

        assertEquals(1, config.services().size());
        assertEquals(9, config.service("AGENT").orElseThrow().port());
    }
}
