package netops.gateway.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import netops.gateway.auth.RateLimiter;
import netops.gateway.auth.RequestGuard;
import netops.gateway.auth.TokenAuthenticator;
import netops.gateway.config.GatewayConfig;
import netops.gateway.service.BackendRegistry;
import netops.gateway.support.MutableClock;
import netops.gateway.util.Jsons;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProxyFrontHandlerTest {

    private static final String SECRET = "test-secret-that-is-long-enough-for-hs256";

    private EmbeddedChannel channel(int maxRequests, boolean requireAuth) {
        GatewayConfig config = GatewayConfig.defaults();
        RequestGuard guard = new RequestGuard(
                new RateLimiter(maxRequests, Duration.ofMinutes(1), new MutableClock()),
                new TokenAuthenticator(SECRET, requireAuth));
        ProxyConnector connector = new ProxyConnector(new ProxyRoutes(new BackendRegistry(config, new MutableClock())), guard, Duration.ofSeconds(1));
        return new EmbeddedChannel(new ProxyFrontHandler(connector));
    }

    private static FullHttpRequest get(String uri) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
        request.headers().set(HttpHeaderNames.HOST, "gateway.local");
        return request;
    }

    private static JsonNode body(FullHttpResponse response) {
        try {
            return Jsons.readTree(response.content().toString(StandardCharsets.UTF_8));
        } finally {
            response.release();
        }
    }

    @Test
    void gatewayRequestsPassThrough() {
        EmbeddedChannel channel = channel(10, true);

        assertTrue(channel.writeInbound(get("/api/v1/tasks")));
        FullHttpRequest passed = channel.readInbound();

        assertEquals("/api/v1/tasks", passed.uri());
        assertEquals(ProxyFrontHandler.Mode.PASS, channel.pipeline().get(ProxyFrontHandler.class).mode());
        assertNull(channel.readOutbound());
        passed.release();
    }

    @Test
    void missingTokenRejectedBeforeConnecting() {
        EmbeddedChannel channel = channel(10, true);

        assertFalse(channel.writeInbound(get("/api/pihole/summary")));

        FullHttpResponse response = channel.readOutbound();
        assertEquals(401, response.status().code());
        assertEquals("Unauthorized", body(response).get("error").asText());
        assertNull(channel.readInbound());
        assertTrue(channel.isActive());
    }

    @Test
    void rateLimitAppliesToProxiedRequests() {
        EmbeddedChannel channel = channel(1, true);

        channel.writeInbound(get("/api/metrics/cpu"));
        FullHttpResponse first = channel.readOutbound();
        assertEquals(401, first.status().code());
        first.release();

        channel.writeInbound(get("/api/metrics/cpu"));
        FullHttpResponse second = channel.readOutbound();
        assertEquals(429, second.status().code());
        assertNotNull(second.headers().get(HttpHeaderNames.RETRY_AFTER));
        assertEquals(429, body(second).get("status_code").asInt());
    }

    @Test
    void closeRequestedByClientIsHonoured() {
        EmbeddedChannel channel = channel(10, true);
        FullHttpRequest request = get("/api/agent/run");
        request.headers().set(HttpHeaderNames.CONNECTION, "close");

        channel.writeInbound(request);

        FullHttpResponse response = channel.readOutbound();
        assertEquals("close", response.headers().get(HttpHeaderNames.CONNECTION));
        response.release();
        assertFalse(channel.isActive());
    }

    @Test
    void backendThatCannotBeReachedAnswers502() {
        EmbeddedChannel channel = channel(10, false);

        // backend channels cannot attach to the embedded loop, so the connect fails right away
        channel.writeInbound(get("/api/pihole/summary"));

        FullHttpResponse response = channel.readOutbound();
        assertEquals(502, response.status().code());
        JsonNode error = body(response);
        assertEquals("Service unavailable", error.get("error").asText());
        assertTrue(error.get("detail").asText().startsWith("Cannot reach pihole"));
        assertNull(channel.readInbound());

        // the connection is reusable for the gateway's own routes
        channel.writeInbound(get("/health"));
        FullHttpRequest passed = channel.readInbound();
        assertEquals("/health", passed.uri());
        passed.release();
    }
}
