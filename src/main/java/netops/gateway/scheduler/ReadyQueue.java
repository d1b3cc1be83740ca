package netops.gateway.scheduler;

import netops.gateway.model.Task;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Pending tasks ordered for dispatch: priority class first, then creation time, then arrival sequence.
 * Tasks waiting out a retry backoff sit in a deferred set ordered by {@code notBefore} and are promoted
 * once their backoff expires.
 * <p>
 * Not thread-safe; the task store guards it with its own lock.
 */
public class ReadyQueue {

    public static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparing(Task::priority)
            .thenComparing(Task::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(Task::sequence);

    private static final Comparator<Task> BACKOFF_ORDER = Comparator
            .comparing(Task::notBefore)
            .thenComparing(DISPATCH_ORDER);

    private final TreeSet<Task> ready = new TreeSet<>(DISPATCH_ORDER);
    private final TreeSet<Task> deferred = new TreeSet<>(BACKOFF_ORDER);
    private final Map<String, Task> byId = new HashMap<>();

    /**
     * Add (or replace) a task.
     */
    public void add(Task task, Instant now) {
        remove(task.id());
        if (task.isEligibleAt(now)) {
            ready.add(task);
        } else {
            deferred.add(task);
        }
        byId.put(task.id(), task);
    }

    public boolean remove(String taskId) {
        Task task = byId.remove(taskId);
        if (task == null) {
            return false;
        }
        return ready.remove(task) || deferred.remove(task);
    }

    public boolean contains(String taskId) {
        return byId.containsKey(taskId);
    }

    /**
     * Head of the ready set after promoting every expired backoff; the task stays queued.
     */
    public Optional<Task> peek(Instant now) {
        promote(now);
        return ready.isEmpty() ? Optional.empty() : Optional.of(ready.first());
    }

    /** Earliest instant a deferred task becomes eligible */
    public Optional<Instant> nextWakeup() {
        return deferred.isEmpty() ? Optional.empty() : Optional.of(deferred.first().notBefore());
    }

    public int size() {
        return byId.size();
    }

    public int deferredCount() {
        return deferred.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    public void clear() {
        ready.clear();
        deferred.clear();
        byId.clear();
    }

    private void promote(Instant now) {
        while (!deferred.isEmpty() && deferred.first().isEligibleAt(now)) {
            ready.add(deferred.pollFirst());
        }
    }
}
