package netops.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.error.InvalidTransitionException;
import netops.gateway.error.NotFoundException;
import netops.gateway.error.ValidationException;
import netops.gateway.model.Task;
import netops.gateway.model.TaskFailResult;
import netops.gateway.model.TaskPriority;
import netops.gateway.model.TaskStatus;
import netops.gateway.model.TaskType;
import netops.gateway.repository.TaskRepository;
import netops.gateway.scheduler.ReadyQueue;
import netops.gateway.scheduler.RetryBackoff;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owner of all task state. Every lifecycle transition goes through here:
 * <pre>
 * pending -> processing -> completed | failed
 * processing -> pending        (retryable failure with budget left, after a backoff)
 * pending -> cancelled
 * </pre>
 * Mutations hold a short lock that is never held across network I/O or listener calls.
 */
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private final TaskRepository repository;
    private final PayloadValidator validator;
    private final RetryBackoff backoff;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition readyChanged = lock.newCondition();
    private final ReadyQueue queue = new ReadyQueue();
    private final AtomicLong sequence = new AtomicLong();

    private final List<TaskListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Consumer<Task> immediateDispatch;

    public TaskStore(TaskRepository repository, PayloadValidator validator, RetryBackoff backoff) {
        this(repository, validator, backoff, Clock.systemUTC());
    }

    public TaskStore(TaskRepository repository, PayloadValidator validator, RetryBackoff backoff, Clock clock) {
        this.repository = repository;
        this.validator = validator;
        this.backoff = backoff;
        this.clock = clock;
        recover();
    }

    /**
     * Rebuild the ready queue from pending tasks already in the repository (JDBC storage after a restart).
     */
    private void recover() {
        sequence.set(repository.maxSequence());
        List<Task> pending = repository.findByStatus(TaskStatus.PENDING);
        Instant now = clock.instant();
        for (Task task : pending) {
            queue.add(task, now);
        }
        if (!pending.isEmpty()) {
            log.info("Recovered {} pending tasks from storage", pending.size());
        }
    }

    // ---- creation ----

    /**
     * Enqueue from wire values. Unknown type or priority is a validation error.
     */
    public Task enqueue(String type, String priority, JsonNode payload, Integer timeoutSeconds, Integer maxRetries) {
        if (type == null || type.isBlank()) {
            throw new ValidationException("Field 'type' is required");
        }
        TaskType taskType = TaskType.find(type)
                .orElseThrow(() -> new ValidationException("Invalid task type", "Unknown task type: " + type));
        TaskPriority taskPriority;
        try {
            taskPriority = priority == null ? TaskPriority.MEDIUM : TaskPriority.fromWireName(priority);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid priority", e.getMessage());
        }
        return enqueue(taskType, taskPriority, payload, timeoutSeconds, maxRetries);
    }

    /**
     * Validate and persist a new pending task. Critical tasks are also handed straight to the
     * immediate-dispatch sink when one is registered; whichever side claims the task first runs it.
     *
     * @param timeoutSeconds null for the default (300)
     * @param maxRetries     null for the default (3)
     */
    public Task enqueue(TaskType type, TaskPriority priority, JsonNode payload, Integer timeoutSeconds,
            Integer maxRetries) {
        JsonNode data = payload == null || payload.isNull() ? Jsons.object() : payload;
        if (!data.isObject()) {
            throw new ValidationException("Field 'data' must be a JSON object");
        }
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new ValidationException("Field 'timeout' must be positive");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new ValidationException("Field 'retry_count' must not be negative");
        }
        validator.validate(type, data);

        Instant now = clock.instant();
        Task.Builder builder = Task.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .priority(priority != null ? priority : TaskPriority.MEDIUM)
                .payload(data.deepCopy())
                .status(TaskStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .sequence(sequence.incrementAndGet());
        if (timeoutSeconds != null) {
            builder.timeoutSeconds(timeoutSeconds);
        }
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        Task task = builder.build();

        Consumer<Task> sink = immediateDispatch;
        boolean immediate = task.priority() == TaskPriority.CRITICAL && sink != null;

        lock.lock();
        try {
            repository.save(task);
            queue.add(task, now);
            readyChanged.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Task {} created: type={}, priority={}", task.id(), type.wireName(), task.priority().wireName());
        fire(task);

        if (immediate) {
            sink.accept(task);
        }
        return task;
    }

    // ---- dispatch ----

    /**
     * Highest-priority, oldest eligible pending task. The task stays pending and queued until
     * {@link #markProcessing(String)} claims it.
     */
    public Optional<Task> nextReady() {
        lock.lock();
        try {
            return peekLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #nextReady()} but waits up to {@code maxWait} for a task to become eligible,
     * waking early on enqueue, retry or backoff expiry.
     */
    public Optional<Task> awaitNextReady(Duration maxWait) throws InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        lock.lock();
        try {
            while (true) {
                Optional<Task> head = peekLocked();
                if (head.isPresent()) {
                    return head;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                Optional<Instant> wakeup = queue.nextWakeup();
                if (wakeup.isPresent()) {
                    long untilEligible = Duration.between(clock.instant(), wakeup.get()).toNanos();
                    remaining = Math.max(1, Math.min(remaining, untilEligible));
                }
                readyChanged.await(remaining, TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    private Optional<Task> peekLocked() {
        Instant now = clock.instant();
        while (true) {
            Optional<Task> head = queue.peek(now);
            if (head.isEmpty()) {
                return head;
            }
            Task stored = repository.findById(head.get().id()).orElse(null);
            if (stored != null && stored.status() == TaskStatus.PENDING) {
                return Optional.of(stored);
            }
            queue.remove(head.get().id());
        }
    }

    /**
     * Atomically claim a pending, eligible task for execution.
     *
     * @return false if the task is not pending (already claimed, cancelled, finished) or still in backoff
     */
    public boolean markProcessing(String taskId) {
        Task updated;
        lock.lock();
        try {
            Task task = repository.findById(taskId).orElse(null);
            Instant now = clock.instant();
            if (task == null || task.status() != TaskStatus.PENDING || !task.isEligibleAt(now)) {
                return false;
            }
            updated = task.toBuilder()
                    .status(TaskStatus.PROCESSING)
                    .updatedAt(later(task.updatedAt(), now))
                    .notBefore(null)
                    .build();
            repository.update(updated);
            queue.remove(taskId);
        } finally {
            lock.unlock();
        }
        log.debug("Task {} processing", taskId);
        fire(updated);
        return true;
    }

    public Task markCompleted(String taskId, JsonNode result) {
        Task updated;
        lock.lock();
        try {
            Task task = requireProcessing(taskId, TaskStatus.COMPLETED);
            Instant now = later(task.updatedAt(), clock.instant());
            updated = task.toBuilder()
                    .status(TaskStatus.COMPLETED)
                    .result(result)
                    .error(null)
                    .updatedAt(now)
                    .completedAt(now)
                    .build();
            repository.update(updated);
        } finally {
            lock.unlock();
        }
        log.info("Task {} completed", taskId);
        fire(updated);
        return updated;
    }

    public TaskFailResult markFailed(String taskId, String error, boolean retryable) {
        return markFailed(taskId, error, "execution", retryable);
    }

    /**
     * Record a failed execution. A retryable failure with retries left goes back to pending behind a
     * backoff; anything else is a permanent failure carrying {@code {error, kind, retryable}} as result.
     */
    public TaskFailResult markFailed(String taskId, String error, String kind, boolean retryable) {
        Task updated;
        TaskFailResult outcome;
        lock.lock();
        try {
            Task task = requireProcessing(taskId, TaskStatus.FAILED);
            Instant now = later(task.updatedAt(), clock.instant());
            if (retryable && task.canRetry()) {
                int retry = task.retryCount() + 1;
                updated = task.toBuilder()
                        .status(TaskStatus.PENDING)
                        .retryCount(retry)
                        .error(error)
                        .updatedAt(now)
                        .notBefore(now.plus(backoff.delayFor(retry)))
                        .build();
                repository.update(updated);
                queue.add(updated, now);
                readyChanged.signalAll();
                outcome = TaskFailResult.RETRIED;
            } else {
                ObjectNode failure = Jsons.object();
                failure.put("error", error);
                failure.put("kind", kind);
                failure.put("retryable", retryable);
                updated = task.toBuilder()
                        .status(TaskStatus.FAILED)
                        .result(failure)
                        .error(error)
                        .updatedAt(now)
                        .completedAt(now)
                        .build();
                repository.update(updated);
                outcome = TaskFailResult.FAILED;
            }
        } finally {
            lock.unlock();
        }

        if (outcome == TaskFailResult.RETRIED) {
            log.info("Task {} will retry ({}/{}) after {}: {}", taskId, updated.retryCount(),
                    updated.maxRetries(), Duration.between(updated.updatedAt(), updated.notBefore()), error);
        } else {
            log.warn("Task {} failed permanently: {}", taskId, error);
        }
        fire(updated);
        return outcome;
    }

    /**
     * Cancel a task that has not started yet.
     *
     * @throws InvalidTransitionException if the task is not pending
     */
    public Task cancel(String taskId) {
        Task updated;
        lock.lock();
        try {
            Task task = repository.findById(taskId).orElseThrow(() -> NotFoundException.task(taskId));
            if (!task.status().canTransitionTo(TaskStatus.CANCELLED)) {
                throw new InvalidTransitionException(taskId, task.status(), TaskStatus.CANCELLED);
            }
            Instant now = later(task.updatedAt(), clock.instant());
            updated = task.toBuilder()
                    .status(TaskStatus.CANCELLED)
                    .updatedAt(now)
                    .completedAt(now)
                    .notBefore(null)
                    .build();
            repository.update(updated);
            queue.remove(taskId);
        } finally {
            lock.unlock();
        }
        log.info("Task {} cancelled", taskId);
        fire(updated);
        return updated;
    }

    private Task requireProcessing(String taskId, TaskStatus requested) {
        Task task = repository.findById(taskId).orElseThrow(() -> NotFoundException.task(taskId));
        if (task.status() != TaskStatus.PROCESSING) {
            throw new InvalidTransitionException(taskId, task.status(), requested);
        }
        return task;
    }

    // ---- queries ----

    public Task get(String taskId) {
        return repository.findById(taskId).orElseThrow(() -> NotFoundException.task(taskId));
    }

    public Optional<Task> find(String taskId) {
        return repository.findById(taskId);
    }

    /**
     * Tasks ordered by creation time, optionally filtered by status.
     */
    public List<Task> list(Optional<TaskStatus> status) {
        return status.map(repository::findByStatus).orElseGet(repository::findAll);
    }

    /** Tasks in processing whose last update is older than {@code cutoff} */
    public List<Task> findProcessingSince(Instant cutoff) {
        List<Task> stale = new ArrayList<>();
        for (Task task : repository.findByStatus(TaskStatus.PROCESSING)) {
            if (task.updatedAt() == null || task.updatedAt().isBefore(cutoff)) {
                stale.add(task);
            }
        }
        return stale;
    }

    public Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        for (Task task : repository.findAll()) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return counts;
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public Clock clock() {
        return clock;
    }

    // ---- wiring ----

    public void addListener(TaskListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TaskListener listener) {
        listeners.remove(listener);
    }

    /**
     * Register the sink that starts critical tasks as soon as they are created. They stay queued as well;
     * the first claim wins. Null turns immediate dispatch off.
     */
    public void setImmediateDispatch(Consumer<Task> sink) {
        this.immediateDispatch = sink;
    }

    /**
     * Drop every task and queue entry. Listeners and the dispatch sink stay registered.
     */
    public void reset() {
        lock.lock();
        try {
            repository.deleteAll();
            queue.clear();
            sequence.set(0);
            readyChanged.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Task store reset");
    }

    private void fire(Task task) {
        for (TaskListener listener : listeners) {
            try {
                listener.onTaskChanged(task);
            } catch (Exception e) {
                log.warn("Task listener failed for {}: {}", task.id(), e.getMessage(), e);
            }
        }
    }

    // Timestamps never go backwards per task even if the clock does
    private static Instant later(Instant previous, Instant now) {
        return previous != null && previous.isAfter(now) ? previous : now;
    }
}
