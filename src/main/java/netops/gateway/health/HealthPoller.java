package netops.gateway.health;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.broadcast.EventPublisher;
import netops.gateway.client.BackendClient;
import netops.gateway.config.BackendService;
import netops.gateway.config.GatewayConfig;
import netops.gateway.model.Alert;
import netops.gateway.model.HealthSnapshot;
import netops.gateway.model.ServiceHealth;
import netops.gateway.service.AlertService;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Periodic health probe of every configured backend ({@code GET {base}/health}).
 * <p>
 * Each poll replaces the snapshot, publishes it on the {@code monitor} channel, raises a
 * {@code service_down} alert for every service that stopped being online, and relays configured
 * feeds on the channel named after their service. Probe failures are recorded, never thrown.
 */
public class HealthPoller implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthPoller.class);

    public static final String CHANNEL = "monitor";

    private final GatewayConfig config;
    private final BackendClient client;
    private final EventPublisher publisher;
    private final AlertService alerts;
    private final Clock clock;

    private volatile HealthSnapshot snapshot = HealthSnapshot.empty();

    public HealthPoller(GatewayConfig config, BackendClient client, EventPublisher publisher, AlertService alerts,
            Clock clock) {
        this.config = config;
        this.client = client;
        this.publisher = publisher;
        this.alerts = alerts;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Health poll error", e);
        }
    }

    /**
     * Probe all services, replace and publish the snapshot, then raise alerts and relay feeds.
     */
    public HealthSnapshot pollOnce() {
        HealthSnapshot previous = snapshot;
        HealthSnapshot current = HealthSnapshot.of(probeAll(), clock.instant());
        snapshot = current;

        log.debug("Health poll: grade={}, services={}", current.grade().wireName(), current.services().size());
        publisher.publish(CHANNEL, "health-update", current);

        for (ServiceHealth health : current.services().values()) {
            if (previous.isOnline(health.name()) && !health.isOnline()) {
                alerts.raise(Alert.SERVICE_DOWN, config.serviceDownSeverity(), health.name(),
                        health.name() + " is " + health.status().wireName()
                                + (health.error() != null ? ": " + health.error() : ""));
            }
        }

        relayFeeds(current);
        return current;
    }

    /**
     * Live probe of every service in parallel, without touching the snapshot.
     */
    public List<ServiceHealth> probeAll() {
        return probeAllAsync().join();
    }

    /**
     * Same as {@link #probeAll()} without blocking the caller. Completes when the slowest probe does;
     * results keep the configured service order.
     */
    public CompletableFuture<List<ServiceHealth>> probeAllAsync() {
        List<CompletableFuture<ServiceHealth>> probes = new ArrayList<>();
        for (BackendService service : config.services().values()) {
            probes.add(probeAsync(service.name(), service.healthUrl()));
        }
        return CompletableFuture.allOf(probes.toArray(CompletableFuture[]::new))
                .thenApply(done -> probes.stream().map(CompletableFuture::join).toList());
    }

    public ServiceHealth probe(BackendService service) {
        return probeUrl(service.name(), service.healthUrl());
    }

    public ServiceHealth probeUrl(String name, String url) {
        return probeAsync(name, url).join();
    }

    private CompletableFuture<ServiceHealth> probeAsync(String name, String url) {
        Duration timeout = config.healthProbeTimeout();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET().build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ServiceHealth.error(name, url, "Invalid URL: " + e.getMessage()));
        }
        long started = System.nanoTime();
        return client.httpClient()
                .sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        if (cause instanceof IOException) {
                            return ServiceHealth.offline(name, url, null, BackendClient.describe(cause));
                        }
                        return ServiceHealth.error(name, url, BackendClient.describe(cause));
                    }
                    int status = response.statusCode();
                    if (status >= 200 && status < 300) {
                        long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
                        return ServiceHealth.online(name, url, status, latencyMs);
                    }
                    return ServiceHealth.offline(name, url, status, "HTTP " + status);
                });
    }

    private void relayFeeds(HealthSnapshot current) {
        for (BackendService service : config.services().values()) {
            if (service.feedPath() == null || !current.isOnline(service.name())) {
                continue;
            }
            String url = service.baseUrl() + service.feedPath();
            try {
                HttpResponse<String> response = client.get(url, config.healthProbeTimeout());
                if (response.statusCode() >= 200 && response.statusCode() < 300) {
                    JsonNode data = Jsons.readTree(response.body());
                    publisher.publish(service.name(), service.name() + "-update", data);
                } else {
                    log.debug("Feed {} answered HTTP {}", url, response.statusCode());
                }
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Feed {} unavailable: {}", url, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    public HealthSnapshot snapshot() {
        return snapshot;
    }

    public Instant lastCheckedAt() {
        return snapshot.checkedAt();
    }
}
