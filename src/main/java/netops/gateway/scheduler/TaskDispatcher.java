package netops.gateway.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.error.GatewayException;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.error.TaskTimeoutException;
import netops.gateway.error.UpstreamUnavailableException;
import netops.gateway.error.ValidationException;
import netops.gateway.executor.HandlerRegistry;
import netops.gateway.model.Task;
import netops.gateway.service.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Takes ready tasks from the store and runs them on a bounded worker pool.
 * <p>
 * A task is claimed ({@code pending -> processing}) before it is submitted and stays in flight until
 * its handler has returned, so no task id is ever executing twice. A watchdog interrupts executions that
 * outlive their timeout. Each execution settles exactly once: whichever of handler outcome and timeout
 * comes first is recorded.
 * Critical tasks arrive through {@link #dispatchNow(Task)} and run on their own threads without
 * waiting for a worker.
 */
public class TaskDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    static final Duration IDLE_WAKEUP = Duration.ofMillis(500);

    private final TaskStore store;
    private final HandlerRegistry handlers;
    private final int workerThreads;

    private final Semaphore permits;
    private final ExecutorService workers;
    private final ExecutorService criticalWorkers;
    private final ScheduledExecutorService watchdog;
    private final Map<String, Execution> inFlight = new ConcurrentHashMap<>();

    private volatile boolean running = false;
    private Thread loop;

    public TaskDispatcher(TaskStore store, HandlerRegistry handlers, int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        this.store = store;
        this.handlers = handlers;
        this.workerThreads = workerThreads;
        this.permits = new Semaphore(workerThreads);
        this.workers = Executors.newFixedThreadPool(workerThreads, named("gateway-worker"));
        this.criticalWorkers = Executors.newCachedThreadPool(named("gateway-critical"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(named("gateway-task-watchdog"));
    }

    /**
     * Start the dispatch loop and accept critical tasks from the store.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Dispatcher already running");
            return;
        }
        running = true;
        store.setImmediateDispatch(this::dispatchNow);
        loop = new Thread(this::dispatchLoop, "gateway-dispatcher");
        loop.setDaemon(true);
        loop.start();
        log.info("Task dispatcher started with {} workers", workerThreads);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        store.setImmediateDispatch(null);
        loop.interrupt();
        try {
            loop.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        shutdown(workers, "worker pool");
        shutdown(criticalWorkers, "critical pool");
        watchdog.shutdownNow();
        log.info("Task dispatcher stopped ({} executions abandoned)", inFlight.size());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isInFlight(String taskId) {
        return inFlight.containsKey(taskId);
    }

    public int activeCount() {
        return inFlight.size();
    }

    private void dispatchLoop() {
        while (running) {
            try {
                permits.acquire();
                boolean launched = false;
                try {
                    var next = store.awaitNextReady(IDLE_WAKEUP);
                    if (next.isPresent()) {
                        launched = launch(next.get(), workers, true);
                    }
                } finally {
                    if (!launched) {
                        permits.release();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Dispatch loop error", e);
            }
        }
        log.debug("Dispatch loop exited");
    }

    /**
     * Claim and start a task right away, outside the worker budget.
     */
    public void dispatchNow(Task task) {
        if (!running) {
            return;
        }
        try {
            launch(task, criticalWorkers, false);
        } catch (RejectedExecutionException e) {
            log.warn("Immediate dispatch of {} rejected, dispatcher shutting down", task.id());
        }
    }

    /**
     * @return true if the task was claimed and submitted
     */
    private boolean launch(Task task, ExecutorService pool, boolean holdsPermit) {
        if (inFlight.containsKey(task.id()) || !store.markProcessing(task.id())) {
            return false;
        }
        Task claimed = store.find(task.id()).orElse(task);
        Execution execution = new Execution(claimed, holdsPermit);
        inFlight.put(claimed.id(), execution);
        try {
            execution.future = pool.submit(execution::run);
        } catch (RejectedExecutionException e) {
            inFlight.remove(claimed.id());
            store.markFailed(claimed.id(), "Dispatcher shutting down", "internal", true);
            throw e;
        }
        execution.timeoutFuture = watchdog.schedule(execution::timeout,
                claimed.timeout().toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Dispatched task {} ({}, {})", claimed.id(), claimed.type().wireName(),
                claimed.priority().wireName());
        return true;
    }

    /**
     * Network and transient errors are retryable; validation and programming errors are not.
     */
    static boolean isRetryable(Throwable error) {
        if (error instanceof TaskExecutionException e) {
            return e.retryable();
        }
        return error instanceof IOException
                || error instanceof UncheckedIOException
                || error instanceof TimeoutException;
    }

    static String kindOf(Throwable error) {
        if (error instanceof TaskTimeoutException) {
            return "timeout";
        }
        if (error instanceof UpstreamUnavailableException || error instanceof IOException
                || error instanceof UncheckedIOException) {
            return "upstream_unavailable";
        }
        if (error instanceof ValidationException) {
            return "validation";
        }
        if (error instanceof TaskExecutionException) {
            return "execution";
        }
        return "internal";
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * One claimed run of a task. It stays in flight until its worker thread is really done with the
     * handler, so a retry can never start while an earlier attempt still runs. A handler that ignores
     * the timeout interrupt keeps its task processing and its permit held until it returns; the timeout
     * is recorded then and the late result is dropped.
     */
    private final class Execution {
        private final Task task;
        private final boolean holdsPermit;
        private final AtomicBoolean started = new AtomicBoolean(false);
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private final AtomicBoolean timeoutRecorded = new AtomicBoolean(false);
        private volatile boolean timedOut = false;
        private volatile boolean finished = false;
        private volatile Future<?> future;
        private volatile ScheduledFuture<?> timeoutFuture;

        Execution(Task task, boolean holdsPermit) {
            this.task = task;
            this.holdsPermit = holdsPermit;
        }

        void run() {
            if (!started.compareAndSet(false, true)) {
                // timed out while still waiting for a worker
                return;
            }
            try {
                JsonNode result = handlers.require(task.type()).execute(task);
                if (settle()) {
                    record(() -> store.markCompleted(task.id(), result));
                } else {
                    log.debug("Task {} returned after its timeout, result dropped", task.id());
                }
            } catch (Throwable t) {
                fail(t);
            } finally {
                finished = true;
                if (timedOut) {
                    recordTimeout();
                }
                release();
            }
        }

        void timeout() {
            if (!settle()) {
                return;
            }
            timedOut = true;
            Future<?> work = future;
            if (started.compareAndSet(false, true)) {
                if (work != null) {
                    work.cancel(false);
                }
                log.debug("Task {} never reached a worker", task.id());
                recordTimeout();
                release();
                return;
            }
            if (work != null) {
                work.cancel(true);
            }
            if (finished) {
                recordTimeout();
            } else {
                log.warn("Task {} timed out after {}s, waiting for its handler to stop", task.id(),
                        task.timeoutSeconds());
            }
        }

        private void recordTimeout() {
            if (!timeoutRecorded.compareAndSet(false, true)) {
                return;
            }
            TaskTimeoutException timeout = new TaskTimeoutException(task.id(), task.timeout());
            log.warn("Task {} timed out after {}s", task.id(), task.timeoutSeconds());
            record(() -> store.markFailed(task.id(), timeout.getMessage(), kindOf(timeout), true));
        }

        private void fail(Throwable error) {
            if (!settle()) {
                log.debug("Task {} finished after it had already settled: {}", task.id(), messageOf(error));
                return;
            }
            boolean retryable = isRetryable(error);
            if (error instanceof GatewayException) {
                log.info("Task {} failed ({}): {}", task.id(), retryable ? "retryable" : "terminal", messageOf(error));
            } else {
                log.error("Task {} handler error", task.id(), error);
            }
            record(() -> store.markFailed(task.id(), messageOf(error), kindOf(error), retryable));
        }

        private boolean settle() {
            if (!settled.compareAndSet(false, true)) {
                return false;
            }
            ScheduledFuture<?> pending = timeoutFuture;
            if (pending != null) {
                pending.cancel(false);
            }
            return true;
        }

        private void release() {
            inFlight.remove(task.id(), this);
            if (holdsPermit) {
                permits.release();
            }
        }

        private void record(Runnable transition) {
            try {
                transition.run();
            } catch (GatewayException e) {
                // reaped or otherwise moved on while executing
                log.warn("Could not record outcome of task {}: {}", task.id(), e.getMessage());
            }
        }
    }

    private static void shutdown(ExecutorService pool, String name) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("Dispatcher {} forcefully stopped", name);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
