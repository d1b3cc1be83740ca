package netops.gateway.config;

import netops.gateway.api.v1.AlertController;
import netops.gateway.api.v1.HealthController;
import netops.gateway.api.v1.MetricsController;
import netops.gateway.api.v1.MonitorController;
import netops.gateway.api.v1.ServiceController;
import netops.gateway.api.v1.TaskController;
import netops.gateway.auth.RateLimiter;
import netops.gateway.auth.RequestGuard;
import netops.gateway.auth.TokenAuthenticator;
import netops.gateway.broadcast.EventBroadcaster;
import netops.gateway.broadcast.TaskEventPublisher;
import netops.gateway.client.BackendClient;
import netops.gateway.executor.DryRunEdgeProviderClient;
import netops.gateway.executor.EdgeApiHandler;
import netops.gateway.executor.EdgeProviderClient;
import netops.gateway.executor.ForwardingHandler;
import netops.gateway.executor.HandlerRegistry;
import netops.gateway.executor.HealthCheckHandler;
import netops.gateway.executor.HttpEdgeProviderClient;
import netops.gateway.executor.MonitorHandler;
import netops.gateway.executor.SslCheckHandler;
import netops.gateway.executor.SystemMetricHandler;
import netops.gateway.health.HealthPoller;
import netops.gateway.model.TaskType;
import netops.gateway.proxy.ProxyConnector;
import netops.gateway.proxy.ProxyRoutes;
import netops.gateway.repository.TaskRepository;
import netops.gateway.scheduler.RetryBackoff;
import netops.gateway.scheduler.Scheduler;
import netops.gateway.scheduler.TaskDispatcher;
import netops.gateway.scheduler.TaskReaper;
import netops.gateway.server.GatewayServer;
import netops.gateway.server.RouterHandler;
import netops.gateway.service.AlertService;
import netops.gateway.service.BackendRegistry;
import netops.gateway.service.TaskStore;
import netops.gateway.store.Database;
import netops.gateway.store.InMemoryTaskRepository;
import netops.gateway.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Manual dependency injection container and the process-wide gateway context.
 * Creates and wires every component; {@link #start()} brings up background work and the server,
 * {@link #close()} shuts everything down in reverse order.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(GatewayConfig.fromEnv());
 * deps.start();  // dispatcher, scheduler, HTTP server
 * TaskStore tasks = deps.taskStore();
 * // ... use services ...
 * deps.close();  // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final GatewayConfig config;
    private final Clock clock;

    // Infrastructure
    private final Database database;
    private final TaskRepository taskRepository;
    private final BackendClient backendClient;

    // Services
    private final EventBroadcaster broadcaster;
    private final HandlerRegistry handlers;
    private final EdgeProviderClient edgeClient;
    private final TaskStore taskStore;
    private final AlertService alertService;
    private final HealthPoller healthPoller;
    private final TaskDispatcher dispatcher;
    private final TaskReaper taskReaper;
    private final Scheduler scheduler;

    // Edge
    private final TokenAuthenticator authenticator;
    private final RateLimiter rateLimiter;
    private final RequestGuard guard;
    private final BackendRegistry backendRegistry;
    private final ProxyConnector proxyConnector;
    private final RouterHandler routerHandler;
    private final GatewayServer server;

    private Dependencies(GatewayConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        if (config.usesJdbcStorage()) {
            this.database = new Database(config);
            this.taskRepository = new JdbcTaskRepository(database);
        } else {
            this.database = null;
            this.taskRepository = new InMemoryTaskRepository();
        }
        this.backendClient = new BackendClient(CONNECT_TIMEOUT, REQUEST_TIMEOUT);

        // Task pipeline
        this.broadcaster = new EventBroadcaster(clock);
        this.handlers = new HandlerRegistry();
        this.edgeClient = config.hasEdgeApi()
                ? new HttpEdgeProviderClient(backendClient, config.edgeApiUrl(), config.edgeApiToken(),
                        config.edgeZoneId())
                : new DryRunEdgeProviderClient(clock);
        this.taskStore = new TaskStore(taskRepository, handlers,
                new RetryBackoff(config.retryBackoffBase(), config.retryBackoffMax()), clock);
        this.taskStore.addListener(new TaskEventPublisher(broadcaster));
        this.alertService = new AlertService(taskStore, broadcaster, clock);
        this.healthPoller = new HealthPoller(config, backendClient, broadcaster, alertService, clock);
        registerHandlers();

        this.dispatcher = new TaskDispatcher(taskStore, handlers, config.workerThreads());
        this.taskReaper = new TaskReaper(taskStore, config, dispatcher::isInFlight);
        this.scheduler = new Scheduler(healthPoller, taskReaper, config);

        // Request edge
        this.authenticator = new TokenAuthenticator(config);
        this.rateLimiter = new RateLimiter(config.rateLimitMaxRequests(), config.rateLimitWindow(), clock);
        this.guard = new RequestGuard(rateLimiter, authenticator);
        this.backendRegistry = new BackendRegistry(config, clock);
        this.proxyConnector = new ProxyConnector(new ProxyRoutes(backendRegistry), guard, CONNECT_TIMEOUT);
        this.routerHandler = new RouterHandler(config, guard)
                .registerController(new HealthController(config, healthPoller, clock))
                .registerController(new TaskController(taskStore, config))
                .registerController(new AlertController(alertService))
                .registerController(new ServiceController(backendRegistry))
                .registerController(new MonitorController(healthPoller, taskStore, alertService, clock))
                .registerController(new MetricsController(taskStore, dispatcher, broadcaster, handlers, config,
                        edgeClient.dryRun(), clock));
        log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        this.server = new GatewayServer(config, routerHandler, proxyConnector, broadcaster);

        log.info("Dependencies initialized successfully (auth {}, edge provider {})",
                authenticator.required() ? "required" : authenticator.enabled() ? "optional" : "disabled",
                edgeClient.dryRun() ? "dry-run" : "live");
    }

    private void registerHandlers() {
        for (TaskType type : EdgeApiHandler.EDGE_TYPES) {
            handlers.register(new EdgeApiHandler(type, edgeClient));
        }
        handlers.register(new SslCheckHandler(CONNECT_TIMEOUT, clock));
        handlers.register(new HealthCheckHandler(config, healthPoller));
        handlers.register(new SystemMetricHandler(clock));
        handlers.register(new MonitorHandler(healthPoller));
        handlers.register(ForwardingHandler.remediation(config, backendClient));
        for (TaskType type : List.of(TaskType.DEPLOY, TaskType.WORKER_DEPLOY, TaskType.ANALYTICS_QUERY,
                TaskType.BACKUP, TaskType.SECURITY_SCAN)) {
            handlers.register(new ForwardingHandler(type, config, backendClient));
        }
        log.debug("Registered handlers for {}", handlers.supportedTypes());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(GatewayConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    public static Dependencies create(GatewayConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(GatewayConfig.fromEnv());
    }

    /**
     * Start the dispatcher, the background scheduler and the HTTP server.
     *
     * @return the bound server port
     */
    public int start() throws InterruptedException {
        dispatcher.start();
        scheduler.start();
        return server.start();
    }

    /**
     * Clear tasks and alerts. Connections, listeners and background jobs stay up.
     */
    public void reset() {
        taskStore.reset();
        alertService.reset();
    }

    // Getters
    public GatewayConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public BackendClient backendClient() {
        return backendClient;
    }

    public EventBroadcaster broadcaster() {
        return broadcaster;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public AlertService alertService() {
        return alertService;
    }

    public HealthPoller healthPoller() {
        return healthPoller;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public BackendRegistry backendRegistry() {
        return backendRegistry;
    }

    public TokenAuthenticator authenticator() {
        return authenticator;
    }

    public RouterHandler routerHandler() {
        return routerHandler;
    }

    public GatewayServer server() {
        return server;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop intake and polling first, then running work, then storage
        try {
            server.stop();
        } catch (Exception e) {
            log.warn("Error stopping server: {}", e.getMessage());
        }
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }
        try {
            dispatcher.stop();
        } catch (Exception e) {
            log.warn("Error stopping dispatcher: {}", e.getMessage());
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
