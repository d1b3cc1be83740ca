package netops.gateway.service;

import netops.gateway.config.BackendService;
import netops.gateway.config.GatewayConfig;
import netops.gateway.error.ConflictException;
import netops.gateway.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Backends the proxy can reach: the configured ones plus backends registered at runtime.
 * <p>
 * Runtime registrations expire after the configured TTL unless registered again. Configured names
 * cannot be taken over, and names used by the gateway's own API are never registrable.
 */
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    /** Path segments under {@code /api/} that belong to the gateway itself */
    public static final Set<String> RESERVED = Set.of("v1", "status");

    private static final Pattern NAME = Pattern.compile("[a-z0-9][a-z0-9_-]{0,62}");

    public record Registration(BackendService service, Instant registeredAt, Instant expiresAt) {

        boolean isLiveAt(Instant now) {
            return expiresAt.isAfter(now);
        }
    }

    private final GatewayConfig config;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Registration> registered = new ConcurrentHashMap<>();

    public BackendRegistry(GatewayConfig config, Clock clock) {
        this.config = config;
        this.ttl = config.registrationTtl();
        this.clock = clock;
    }

    /**
     * Configured backend of that name, else a live registration.
     */
    public Optional<BackendService> find(String name) {
        Optional<BackendService> configured = config.service(name);
        if (configured.isPresent() || name == null) {
            return configured;
        }
        Registration registration = registered.get(name.toLowerCase());
        if (registration == null) {
            return Optional.empty();
        }
        if (!registration.isLiveAt(clock.instant())) {
            registered.remove(registration.service().name(), registration);
            log.debug("Registration of {} expired", registration.service().name());
            return Optional.empty();
        }
        return Optional.of(registration.service());
    }

    /**
     * Register (or refresh) a runtime backend.
     *
     * @throws ValidationException if the name or URL is unusable
     * @throws ConflictException   if the name belongs to a configured backend
     */
    public Registration register(String name, String url) {
        String key = name == null ? "" : name.trim().toLowerCase();
        if (!NAME.matcher(key).matches()) {
            throw new ValidationException("Invalid service name",
                    "Name must be 1-63 lowercase letters, digits, '-' or '_'");
        }
        if (RESERVED.contains(key)) {
            throw new ValidationException("Invalid service name", "'" + key + "' is reserved by the gateway");
        }
        if (config.service(key).isPresent()) {
            throw new ConflictException("Service already configured",
                    "'" + key + "' is a configured backend and cannot be re-registered");
        }
        BackendService service = new BackendService(key, requireHttpUrl(url));

        Instant now = clock.instant();
        Registration registration = new Registration(service, now, now.plus(ttl));
        Registration previous = registered.put(key, registration);
        log.info("{} backend {} -> {} (expires {})", previous == null ? "Registered" : "Refreshed", key,
                service.baseUrl(), registration.expiresAt());
        return registration;
    }

    /**
     * Live registrations, by name.
     */
    public List<Registration> registrations() {
        Instant now = clock.instant();
        registered.values().removeIf(r -> !r.isLiveAt(now));
        List<Registration> live = new ArrayList<>(registered.values());
        live.sort(Comparator.comparing(r -> r.service().name()));
        return live;
    }

    public List<BackendService> configured() {
        return new ArrayList<>(config.services().values());
    }

    private static String requireHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Invalid URL", "Field 'url' is required");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid URL", e.getMessage());
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new ValidationException("Invalid URL", "Expected an http(s) URL with a host: " + url);
        }
        return url.trim();
    }
}
