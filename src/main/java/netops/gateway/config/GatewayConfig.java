package netops.gateway.config;

import netops.gateway.model.AlertSeverity;
import netops.gateway.util.IniConfig;
import netops.gateway.util.IniParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration holder for gateway settings.
 * All settings have sensible defaults; an INI file and then environment variables override them.
 */
public final class GatewayConfig {

    public static final String STORAGE_MEMORY = "memory";
    public static final String STORAGE_JDBC = "jdbc";

    // Server settings
    private int serverPort = 8888;
    private String serverHost = "0.0.0.0";
    private int maxContentLength = 1024 * 1024;
    private int ioThreads = 0; // 0 = Netty default (2 x cores)
    private boolean production = false;

    // Auth settings
    private String jwtSecret = null;
    private boolean requireAuth = false;
    private String backendToken = null; // bearer token the gateway presents to forwarded task backends

    // Rate limiting
    private int rateLimitMaxRequests = 100;
    private Duration rateLimitWindow = Duration.ofMinutes(15);

    // Health polling
    private Duration healthPollInterval = Duration.ofSeconds(5);
    private Duration healthProbeTimeout = Duration.ofSeconds(5);
    private AlertSeverity serviceDownSeverity = AlertSeverity.CRITICAL;

    // Task settings
    private int defaultTimeoutSeconds = 300;
    private int defaultMaxRetries = 3;
    private int workerThreads = 8;
    private Duration retryBackoffBase = Duration.ofSeconds(1);
    private Duration retryBackoffMax = Duration.ofSeconds(60);
    private Duration taskStuckGrace = Duration.ofSeconds(30);
    private Duration taskReaperInterval = Duration.ofSeconds(30);

    // Storage settings
    private String storage = STORAGE_MEMORY;
    private String databaseUrl = "jdbc:h2:file:./data/gateway;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Edge provider (DNS, cache, firewall); dry-run when no URL is set
    private String edgeApiUrl = null;
    private String edgeApiToken = null;
    private String edgeZoneId = null;

    // Backends registered at runtime expire unless registered again
    private Duration registrationTtl = Duration.ofHours(1);

    private final Map<String, BackendService> services = new LinkedHashMap<>();

    private GatewayConfig() {
        services.put("pihole", new BackendService("pihole", "http://localhost:8889", "/api/pihole/summary"));
        services.put("cloudflare", new BackendService("cloudflare", "http://localhost:8787"));
        services.put("metrics", new BackendService("metrics", "http://localhost:8000"));
        services.put("agent", new BackendService("agent", "http://localhost:8001"));
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig();
    }

    /**
     * Defaults, then the INI file named by {@code GATEWAY_CONFIG} (if any), then environment variables.
     */
    public static GatewayConfig fromEnv() {
        GatewayConfig config = new GatewayConfig();

        String iniPath = System.getenv("GATEWAY_CONFIG");
        if (iniPath != null && !iniPath.isBlank()) {
            Path path = Path.of(iniPath);
            if (Files.exists(path)) {
                try {
                    config.apply(IniParser.parse(path));
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read gateway config " + path, e);
                }
            }
        }

        config.applyEnv(System.getenv());
        return config;
    }

    /**
     * Apply INI settings. Keys: {@code server.port}, {@code server.host}, {@code server.production},
     * {@code server.io_threads},
     * {@code auth.jwt_secret}, {@code auth.required}, {@code auth.backend_token},
     * {@code rate_limit.max_requests}, {@code rate_limit.window_seconds},
     * {@code health.interval_seconds}, {@code health.timeout_seconds},
     * {@code tasks.timeout_seconds}, {@code tasks.max_retries}, {@code tasks.workers},
     * {@code tasks.backoff_base_ms}, {@code tasks.backoff_max_ms},
     * {@code storage.type}, {@code storage.url}, {@code storage.pool_size},
     * {@code edge.api_url}, {@code edge.api_token}, {@code edge.zone_id},
     * {@code registry.ttl_seconds}, {@code services.<name> = <url>}, {@code feeds.<name> = <path>}.
     */
    public GatewayConfig apply(IniConfig ini) {
        ini.getInt("server.port").ifPresent(v -> serverPort = v);
        ini.get("server.host").ifPresent(v -> serverHost = v);
        ini.getBoolean("server.production").ifPresent(v -> production = v);
        ini.getInt("server.io_threads").ifPresent(v -> ioThreads = v);

        ini.get("auth.jwt_secret").ifPresent(v -> jwtSecret = v);
        ini.getBoolean("auth.required").ifPresent(v -> requireAuth = v);
        ini.get("auth.backend_token").ifPresent(v -> backendToken = v);

        ini.getInt("rate_limit.max_requests").ifPresent(v -> rateLimitMaxRequests = v);
        ini.getInt("rate_limit.window_seconds").ifPresent(v -> rateLimitWindow = Duration.ofSeconds(v));

        ini.getInt("health.interval_seconds").ifPresent(v -> healthPollInterval = Duration.ofSeconds(v));
        ini.getInt("health.timeout_seconds").ifPresent(v -> healthProbeTimeout = Duration.ofSeconds(v));
        ini.get("health.service_down_severity")
                .ifPresent(v -> serviceDownSeverity = AlertSeverity.fromWireName(v));

        ini.getInt("tasks.timeout_seconds").ifPresent(v -> defaultTimeoutSeconds = v);
        ini.getInt("tasks.max_retries").ifPresent(v -> defaultMaxRetries = v);
        ini.getInt("tasks.workers").ifPresent(v -> workerThreads = v);
        ini.getInt("tasks.backoff_base_ms").ifPresent(v -> retryBackoffBase = Duration.ofMillis(v));
        ini.getInt("tasks.backoff_max_ms").ifPresent(v -> retryBackoffMax = Duration.ofMillis(v));

        ini.get("storage.type").ifPresent(v -> storage = v.toLowerCase());
        ini.get("storage.url").ifPresent(v -> databaseUrl = v);
        ini.getInt("storage.pool_size").ifPresent(v -> databasePoolSize = v);

        ini.get("edge.api_url").ifPresent(v -> edgeApiUrl = v);
        ini.get("edge.api_token").ifPresent(v -> edgeApiToken = v);
        ini.get("edge.zone_id").ifPresent(v -> edgeZoneId = v);

        ini.getInt("registry.ttl_seconds").ifPresent(v -> registrationTtl = Duration.ofSeconds(v));

        ini.section("services").forEach(this::putServiceUrl);
        ini.section("feeds").forEach(this::putFeed);
        return this;
    }

    GatewayConfig applyEnv(Map<String, String> env) {
        env("GATEWAY_PORT", env).ifPresent(v -> serverPort = Integer.parseInt(v));
        env("API_GATEWAY_PORT", env).ifPresent(v -> serverPort = Integer.parseInt(v));
        env("GATEWAY_HOST", env).ifPresent(v -> serverHost = v);
        env("NODE_ENV", env).ifPresent(v -> production = "production".equalsIgnoreCase(v));
        env("GATEWAY_PRODUCTION", env).ifPresent(v -> production = Boolean.parseBoolean(v));

        env("JWT_SECRET", env).ifPresent(v -> jwtSecret = v);
        env("REQUIRE_AUTH", env).ifPresent(v -> requireAuth = Boolean.parseBoolean(v));
        env("GATEWAY_BACKEND_TOKEN", env).ifPresent(v -> backendToken = v);

        env("GATEWAY_STORAGE", env).ifPresent(v -> storage = v.toLowerCase());
        env("GATEWAY_DB_URL", env).ifPresent(v -> databaseUrl = v);
        env("GATEWAY_MAX_RETRIES", env).ifPresent(v -> defaultMaxRetries = Integer.parseInt(v));
        env("GATEWAY_WORKERS", env).ifPresent(v -> workerThreads = Integer.parseInt(v));

        env("EDGE_API_URL", env).ifPresent(v -> edgeApiUrl = v);
        env("EDGE_API_TOKEN", env).ifPresent(v -> edgeApiToken = v);
        env("EDGE_ZONE_ID", env).ifPresent(v -> edgeZoneId = v);

        // PIHOLE_SERVICE_URL, CLOUDFLARE_SERVICE_URL, ... override known backends
        for (String name : services.keySet().toArray(new String[0])) {
            env(name.toUpperCase() + "_SERVICE_URL", env).ifPresent(v -> putServiceUrl(name, v));
        }
        return this;
    }

    private static Optional<String> env(String key, Map<String, String> env) {
        String v = env.get(key);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
    }

    private void putServiceUrl(String name, String url) {
        BackendService existing = services.get(name.toLowerCase());
        String feed = existing != null ? existing.feedPath() : null;
        BackendService service = new BackendService(name, url, feed);
        services.put(service.name(), service);
    }

    private void putFeed(String name, String path) {
        BackendService existing = services.get(name.toLowerCase());
        if (existing == null) {
            throw new IllegalArgumentException("Feed configured for unknown service: " + name);
        }
        services.put(existing.name(), existing.withFeedPath(path));
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxContentLength() {
        return maxContentLength;
    }

    public int ioThreads() {
        return ioThreads;
    }

    public boolean production() {
        return production;
    }

    public String jwtSecret() {
        return jwtSecret;
    }

    public boolean hasJwtSecret() {
        return jwtSecret != null && !jwtSecret.isBlank();
    }

    public boolean requireAuth() {
        return requireAuth;
    }

    public String backendToken() {
        return backendToken;
    }

    public int rateLimitMaxRequests() {
        return rateLimitMaxRequests;
    }

    public Duration rateLimitWindow() {
        return rateLimitWindow;
    }

    public Duration healthPollInterval() {
        return healthPollInterval;
    }

    public Duration healthProbeTimeout() {
        return healthProbeTimeout;
    }

    public AlertSeverity serviceDownSeverity() {
        return serviceDownSeverity;
    }

    public int defaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public Duration retryBackoffBase() {
        return retryBackoffBase;
    }

    public Duration retryBackoffMax() {
        return retryBackoffMax;
    }

    public Duration taskStuckGrace() {
        return taskStuckGrace;
    }

    public Duration taskReaperInterval() {
        return taskReaperInterval;
    }

    public String storage() {
        return storage;
    }

    public boolean usesJdbcStorage() {
        return STORAGE_JDBC.equals(storage);
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String edgeApiUrl() {
        return edgeApiUrl;
    }

    public boolean hasEdgeApi() {
        return edgeApiUrl != null && !edgeApiUrl.isBlank();
    }

    public String edgeApiToken() {
        return edgeApiToken;
    }

    public String edgeZoneId() {
        return edgeZoneId;
    }

    public Map<String, BackendService> services() {
        return Collections.unmodifiableMap(services);
    }

    public Duration registrationTtl() {
        return registrationTtl;
    }

    public Optional<BackendService> service(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(services.get(name.toLowerCase()));
    }

    // Fluent setters for testing/customization
    public GatewayConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public GatewayConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public GatewayConfig withIoThreads(int threads) {
        this.ioThreads = threads;
        return this;
    }

    public GatewayConfig withProduction(boolean production) {
        this.production = production;
        return this;
    }

    public GatewayConfig withJwtSecret(String secret) {
        this.jwtSecret = secret;
        return this;
    }

    public GatewayConfig withRequireAuth(boolean requireAuth) {
        this.requireAuth = requireAuth;
        return this;
    }

    public GatewayConfig withBackendToken(String token) {
        this.backendToken = token;
        return this;
    }

    public GatewayConfig withRateLimit(int maxRequests, Duration window) {
        this.rateLimitMaxRequests = maxRequests;
        this.rateLimitWindow = window;
        return this;
    }

    public GatewayConfig withHealthPollInterval(Duration interval) {
        this.healthPollInterval = interval;
        return this;
    }

    public GatewayConfig withHealthProbeTimeout(Duration timeout) {
        this.healthProbeTimeout = timeout;
        return this;
    }

    public GatewayConfig withDefaultTimeoutSeconds(int seconds) {
        this.defaultTimeoutSeconds = seconds;
        return this;
    }

    public GatewayConfig withMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public GatewayConfig withWorkerThreads(int workers) {
        this.workerThreads = workers;
        return this;
    }

    public GatewayConfig withRetryBackoff(Duration base, Duration max) {
        this.retryBackoffBase = base;
        this.retryBackoffMax = max;
        return this;
    }

    public GatewayConfig withTaskStuckGrace(Duration grace) {
        this.taskStuckGrace = grace;
        return this;
    }

    public GatewayConfig withStorage(String storage) {
        this.storage = storage;
        return this;
    }

    public GatewayConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public GatewayConfig withEdgeApi(String url, String token, String zoneId) {
        this.edgeApiUrl = url;
        this.edgeApiToken = token;
        this.edgeZoneId = zoneId;
        return this;
    }

    public GatewayConfig withService(String name, String url) {
        putServiceUrl(name, url);
        return this;
    }

    public GatewayConfig withService(BackendService service) {
        services.put(service.name(), service);
        return this;
    }

    public GatewayConfig withRegistrationTtl(Duration ttl) {
        this.registrationTtl = ttl;
        return this;
    }

    public GatewayConfig withoutServices() {
        services.clear();
        return this;
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
                "serverPort=" + serverPort +
                ", storage='" + storage + '\'' +
                ", requireAuth=" + requireAuth +
                ", jwtSecretSet=" + hasJwtSecret() +
                ", workers=" + workerThreads +
                ", services=" + services.keySet() +
                ", edgeApi=" + (hasEdgeApi() ? edgeApiUrl : "dry-run") +
                '}';
    }
}
