package netops.gateway.scheduler;

import netops.gateway.config.GatewayConfig;
import netops.gateway.health.HealthPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background periodic jobs:
 * - HealthPoller: probes every backend and publishes the snapshot
 * - TaskReaper: recovers tasks stuck in processing
 * <p>
 * Uses a single-threaded executor with fixed delays, so a slow poll never overlaps the next one.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final HealthPoller healthPoller;
    private final TaskReaper taskReaper;
    private final GatewayConfig config;

    private volatile boolean running = false;
    private ScheduledFuture<?> healthJob;
    private ScheduledFuture<?> reaperJob;

    public Scheduler(HealthPoller healthPoller, TaskReaper taskReaper, GatewayConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.healthPoller = healthPoller;
        this.taskReaper = taskReaper;
        this.config = config;
    }

    /**
     * Start the scheduler. The first health poll runs immediately.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        long healthIntervalMs = config.healthPollInterval().toMillis();
        healthJob = executor.scheduleWithFixedDelay(healthPoller, 0, healthIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Health poller scheduled every {}ms", healthIntervalMs);

        long reaperIntervalMs = config.taskReaperInterval().toMillis();
        reaperJob = executor.scheduleWithFixedDelay(taskReaper, reaperIntervalMs, reaperIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Task reaper scheduled every {}ms", reaperIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (healthJob != null) {
            healthJob.cancel(false);
        }
        if (reaperJob != null) {
            reaperJob.cancel(false);
        }
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }
}
