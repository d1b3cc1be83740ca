package netops.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import netops.gateway.api.Controller;
import netops.gateway.api.v1.dto.HealthResponse;
import netops.gateway.api.v1.dto.StatusResponse;
import netops.gateway.config.GatewayConfig;
import netops.gateway.health.HealthPoller;
import netops.gateway.model.ServiceHealth;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Liveness and live backend reachability.
 * GET /health, GET /api/status
 */
public class HealthController implements Controller {

    private final GatewayConfig config;
    private final HealthPoller healthPoller;
    private final Clock clock;

    public HealthController(GatewayConfig config, HealthPoller healthPoller, Clock clock) {
        this.config = config;
        this.healthPoller = healthPoller;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && ("/health".equals(path) || "/api/status".equals(path));
    }

    /**
     * {@code /health} only; {@code /api/status} is answered through {@link #handleAsync}.
     */
    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        long uptime = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime()).toSeconds();
        return ControllerResponse.json(HealthResponse.healthy(clock.instant(), uptime,
                new ArrayList<>(config.services().keySet())));
    }

    @Override
    public CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        if (!"/api/status".equals(path)) {
            return CompletableFuture.completedFuture(handle(ctx, req, path));
        }
        // live probe, independent of the polled snapshot
        return healthPoller.probeAllAsync().thenApply(results -> {
            Map<String, String> services = new LinkedHashMap<>();
            for (ServiceHealth health : results) {
                services.put(health.name(), health.isOnline() ? "online" : "offline");
            }
            return ControllerResponse.json(new StatusResponse("online", services, clock.instant()));
        });
    }
}
