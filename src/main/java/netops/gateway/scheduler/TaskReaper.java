package netops.gateway.scheduler;

import netops.gateway.config.GatewayConfig;
import netops.gateway.model.Task;
import netops.gateway.model.TaskFailResult;
import netops.gateway.service.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

/**
 * Background job that recovers tasks stuck in processing.
 * <p>
 * Tasks get stuck when the gateway stops while they execute (the JDBC store keeps them across the
 * restart) or when an outcome could not be recorded. A task is stuck once it has been processing
 * longer than its own timeout plus a grace period and no execution is in flight for it.
 * Stuck tasks are retried while their retry budget lasts and failed afterwards.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskStore store;
    private final GatewayConfig config;
    private final Predicate<String> inFlight;

    public TaskReaper(TaskStore store, GatewayConfig config, Predicate<String> inFlight) {
        this.store = store;
        this.config = config;
        this.inFlight = inFlight;
    }

    @Override
    public void run() {
        try {
            reapStuckTasks();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Find and recover stuck processing tasks.
     *
     * @return number of tasks recovered
     */
    public int reapStuckTasks() {
        Instant now = store.clock().instant();
        List<Task> candidates = store.findProcessingSince(now.minus(config.taskStuckGrace()));

        int retried = 0;
        int failed = 0;
        for (Task task : candidates) {
            Instant deadline = task.updatedAt() == null
                    ? Instant.MIN
                    : task.updatedAt().plus(task.timeout()).plus(config.taskStuckGrace());
            if (deadline.isAfter(now) || inFlight.test(task.id())) {
                continue;
            }
            try {
                String reason = "Task stuck in processing for more than " + task.timeoutSeconds() + "s + "
                        + config.taskStuckGrace().toSeconds() + "s grace";
                TaskFailResult outcome = store.markFailed(task.id(), reason, "stuck", true);
                if (outcome == TaskFailResult.RETRIED) {
                    retried++;
                    log.info("Reaped task {} for retry ({} of {})", task.id(), task.retryCount() + 1,
                            task.maxRetries());
                } else {
                    failed++;
                    log.warn("Task {} permanently failed after {} retries (stuck in processing)",
                            task.id(), task.retryCount());
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        if (retried + failed > 0) {
            log.info("Task reaper: {} retried, {} failed", retried, failed);
        } else {
            log.debug("No stuck tasks found");
        }
        return retried + failed;
    }
}
