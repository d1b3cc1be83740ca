package netops.gateway.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import netops.gateway.api.Controller;
import netops.gateway.auth.RateLimiter;
import netops.gateway.auth.RequestGuard;
import netops.gateway.auth.TokenAuthenticator;
import netops.gateway.config.GatewayConfig;
import netops.gateway.error.NotFoundException;
import netops.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    private CompletableFuture<Controller.ControllerResponse> pending;
    private EmbeddedChannel channel;

    /** Answers /slow with whatever {@link #pending} completes to, /fast right away. */
    private class DeferredController implements Controller {

        @Override
        public boolean matches(HttpMethod method, String path) {
            return "/slow".equals(path) || "/fast".equals(path);
        }

        @Override
        public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
            return ControllerResponse.json(Map.of("path", path));
        }

        @Override
        public CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
                String path) {
            return "/slow".equals(path) ? pending : CompletableFuture.completedFuture(handle(ctx, req, path));
        }
    }

    @BeforeEach
    void setUp() {
        GatewayConfig config = GatewayConfig.defaults();
        RequestGuard guard = new RequestGuard(new RateLimiter(100, Duration.ofMinutes(1), new MutableClock()),
                new TokenAuthenticator(null, false));
        pending = new CompletableFuture<>();
        channel = new EmbeddedChannel(new RouterHandler(config, guard).registerController(new DeferredController()));
    }

    private static FullHttpRequest get(String uri) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
    }

    private static String body(FullHttpResponse response) {
        try {
            return response.content().toString(StandardCharsets.UTF_8);
        } finally {
            response.release();
        }
    }

    @Test
    void readyAnswerIsWrittenImmediately() {
        channel.writeInbound(get("/fast"));

        FullHttpResponse response = channel.readOutbound();
        assertEquals(HttpResponseStatus.OK, response.status());
        assertTrue(body(response).contains("/fast"));
        assertTrue(channel.config().isAutoRead());
    }

    @Test
    void deferredAnswerDoesNotHoldTheHandler() {
        channel.writeInbound(get("/slow"));

        // handler returned without an answer; reads are paused until it is written
        assertNull(channel.readOutbound());
        assertFalse(channel.config().isAutoRead());

        pending.complete(Controller.ControllerResponse.json(Map.of("done", true)));
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();
        assertEquals(HttpResponseStatus.OK, response.status());
        assertTrue(body(response).contains("\"done\":true"));
        assertTrue(channel.config().isAutoRead());
    }

    @Test
    void deferredGatewayErrorKeepsItsStatus() {
        channel.writeInbound(get("/slow"));

        pending.completeExceptionally(NotFoundException.task("t-1"));
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();
        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertTrue(body(response).contains("Task not found"));
    }

    @Test
    void deferredUnexpectedFailureIsInternalError() {
        channel.writeInbound(get("/slow"));

        pending.completeExceptionally(new IllegalStateException("boom"));
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();
        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        assertTrue(body(response).contains("Internal server error"));
    }

    @Test
    void unknownRouteIsNotFound() {
        channel.writeInbound(get("/nowhere"));

        FullHttpResponse response = channel.readOutbound();
        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        body(response);
    }
}
