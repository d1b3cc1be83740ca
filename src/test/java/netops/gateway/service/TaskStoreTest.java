package netops.gateway.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import netops.gateway.error.InvalidTransitionException;
import netops.gateway.error.NotFoundException;
import netops.gateway.error.ValidationException;
import netops.gateway.model.Task;
import netops.gateway.model.TaskFailResult;
import netops.gateway.model.TaskPriority;
import netops.gateway.model.TaskStatus;
import netops.gateway.model.TaskType;
import netops.gateway.scheduler.RetryBackoff;
import netops.gateway.store.InMemoryTaskRepository;
import netops.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskStoreTest {

    private MutableClock clock;
    private InMemoryTaskRepository repository;
    private TaskStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        repository = new InMemoryTaskRepository();
        store = new TaskStore(repository, (type, payload) -> {
        }, new RetryBackoff(Duration.ofSeconds(10), Duration.ofSeconds(10)), clock);
    }

    private Task enqueue(TaskPriority priority) {
        return store.enqueue(TaskType.MONITOR, priority, null, null, null);
    }

    private Task claimNext() {
        Task next = store.nextReady().orElseThrow();
        assertTrue(store.markProcessing(next.id()));
        return next;
    }

    @Test
    void dispatchesByPriorityThenCreation() {
        Task low = enqueue(TaskPriority.LOW);
        Task medium = enqueue(TaskPriority.MEDIUM);
        clock.advance(Duration.ofSeconds(1));
        Task critical = enqueue(TaskPriority.CRITICAL);
        Task high = enqueue(TaskPriority.HIGH);
        Task secondHigh = enqueue(TaskPriority.HIGH);

        assertEquals(critical.id(), claimNext().id());
        assertEquals(high.id(), claimNext().id());
        assertEquals(secondHigh.id(), claimNext().id());
        assertEquals(medium.id(), claimNext().id());
        assertEquals(low.id(), claimNext().id());
        assertTrue(store.nextReady().isEmpty());
    }

    @Test
    void newTaskDefaults() {
        Task task = enqueue(null);

        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(TaskPriority.MEDIUM, task.priority());
        assertEquals(300, task.timeoutSeconds());
        assertEquals(3, task.maxRetries());
        assertEquals(clock.instant(), task.createdAt());
        assertTrue(task.payload().isObject());
        assertEquals(task, store.get(task.id()));
    }

    @Test
    void nextReadyNeverReturnsClaimedTask() {
        Task first = enqueue(TaskPriority.HIGH);
        Task second = enqueue(TaskPriority.LOW);

        assertTrue(store.markProcessing(first.id()));
        assertFalse(store.markProcessing(first.id()));
        assertEquals(second.id(), store.nextReady().orElseThrow().id());
        assertEquals(TaskStatus.PROCESSING, store.get(first.id()).status());
    }

    @Test
    void completeRecordsResult() {
        Task task = enqueue(TaskPriority.MEDIUM);
        claimNext();
        clock.advance(Duration.ofSeconds(2));

        Task done = store.markCompleted(task.id(), JsonNodeFactory.instance.objectNode().put("ok", true));

        assertEquals(TaskStatus.COMPLETED, done.status());
        assertTrue(done.result().get("ok").asBoolean());
        assertEquals(clock.instant(), done.completedAt());
        assertNull(done.error());
    }

    @Test
    void retryableFailureWaitsOutBackoff() {
        Task task = enqueue(TaskPriority.HIGH);
        claimNext();

        TaskFailResult outcome = store.markFailed(task.id(), "connection refused", true);

        assertEquals(TaskFailResult.RETRIED, outcome);
        Task retried = store.get(task.id());
        assertEquals(TaskStatus.PENDING, retried.status());
        assertEquals(1, retried.retryCount());
        assertEquals("connection refused", retried.error());
        assertNotNull(retried.notBefore());
        assertTrue(store.nextReady().isEmpty());
        assertFalse(store.markProcessing(task.id()));

        clock.advance(Duration.ofSeconds(13));
        assertEquals(task.id(), store.nextReady().orElseThrow().id());
        assertTrue(store.markProcessing(task.id()));
        assertNull(store.get(task.id()).notBefore());
    }

    @Test
    void failsPermanentlyWhenRetriesExhausted() {
        Task task = store.enqueue(TaskType.BACKUP, TaskPriority.MEDIUM, null, null, 1);
        claimNext();
        assertEquals(TaskFailResult.RETRIED, store.markFailed(task.id(), "timeout", true));

        clock.advance(Duration.ofSeconds(15));
        claimNext();
        assertEquals(TaskFailResult.FAILED, store.markFailed(task.id(), "timeout again", "timeout", true));

        Task failed = store.get(task.id());
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(1, failed.retryCount());
        assertEquals("timeout", failed.result().get("kind").asText());
        assertTrue(failed.result().get("retryable").asBoolean());
        assertNotNull(failed.completedAt());
        assertTrue(store.nextReady().isEmpty());
    }

    @Test
    void nonRetryableFailureIsFinal() {
        Task task = enqueue(TaskPriority.MEDIUM);
        claimNext();

        assertEquals(TaskFailResult.FAILED, store.markFailed(task.id(), "bad zone", "validation", false));
        assertEquals(0, store.get(task.id()).retryCount());
        assertEquals("bad zone", store.get(task.id()).error());
    }

    @Test
    void illegalTransitionsRejected() {
        Task task = enqueue(TaskPriority.MEDIUM);

        assertThrows(InvalidTransitionException.class, () -> store.markCompleted(task.id(), null));
        assertThrows(InvalidTransitionException.class, () -> store.markFailed(task.id(), "x", true));

        claimNext();
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> store.cancel(task.id()));
        assertEquals(409, e.statusCode());
        assertEquals(TaskStatus.PROCESSING, e.current());

        store.markCompleted(task.id(), null);
        assertThrows(InvalidTransitionException.class, () -> store.markCompleted(task.id(), null));
    }

    @Test
    void cancelRemovesFromQueue() {
        Task task = enqueue(TaskPriority.CRITICAL);

        Task cancelled = store.cancel(task.id());

        assertEquals(TaskStatus.CANCELLED, cancelled.status());
        assertNotNull(cancelled.completedAt());
        assertTrue(store.nextReady().isEmpty());
        assertFalse(store.markProcessing(task.id()));
        assertEquals(0, store.queuedCount());
    }

    @Test
    void unknownTaskIsNotFound() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> store.get("missing"));
        assertEquals(404, e.statusCode());
        assertThrows(NotFoundException.class, () -> store.cancel("missing"));
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(ValidationException.class, () -> store.enqueue("teleport", "high", null, null, null));
        assertThrows(ValidationException.class, () -> store.enqueue("monitor", "urgent", null, null, null));
        assertThrows(ValidationException.class, () -> store.enqueue(" ", null, null, null, null));
        assertThrows(ValidationException.class,
                () -> store.enqueue(TaskType.MONITOR, TaskPriority.LOW, null, 0, null));
        assertThrows(ValidationException.class,
                () -> store.enqueue(TaskType.MONITOR, TaskPriority.LOW, null, null, -1));
        assertThrows(ValidationException.class, () -> store.enqueue(TaskType.MONITOR, TaskPriority.LOW,
                JsonNodeFactory.instance.arrayNode(), null, null));
        assertTrue(store.list(Optional.empty()).isEmpty());
    }

    @Test
    void validatorRunsBeforeAnythingIsStored() {
        TaskStore strict = new TaskStore(repository, (type, payload) -> {
            throw new ValidationException("Field 'data.record' is required and must be a non-empty string");
        }, new RetryBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1)), clock);

        assertThrows(ValidationException.class,
                () -> strict.enqueue(TaskType.DNS_UPDATE, TaskPriority.HIGH, null, null, null));
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    void wireValuesAccepted() {
        Task task = store.enqueue("ssl_check", "critical", JsonNodeFactory.instance.objectNode().put("domain", "a.io"),
                60, 0);

        assertEquals(TaskType.SSL_CHECK, task.type());
        assertEquals(TaskPriority.CRITICAL, task.priority());
        assertEquals(60, task.timeoutSeconds());
        assertEquals(0, task.maxRetries());
    }

    @Test
    void criticalTasksGoToImmediateSinkAndStayQueued() {
        List<Task> immediate = new ArrayList<>();
        store.setImmediateDispatch(immediate::add);

        enqueue(TaskPriority.HIGH);
        Task critical = enqueue(TaskPriority.CRITICAL);

        assertEquals(1, immediate.size());
        assertEquals(critical.id(), immediate.get(0).id());
        // whichever side claims first wins
        assertTrue(store.markProcessing(critical.id()));
        assertNotEquals(critical.id(), store.nextReady().orElseThrow().id());
    }

    @Test
    void listenersSeeEveryChange() {
        List<TaskStatus> seen = new ArrayList<>();
        store.addListener(task -> seen.add(task.status()));
        store.addListener(task -> {
            throw new IllegalStateException("listener failure is contained");
        });

        Task task = enqueue(TaskPriority.MEDIUM);
        claimNext();
        store.markCompleted(task.id(), null);

        assertEquals(List.of(TaskStatus.PENDING, TaskStatus.PROCESSING, TaskStatus.COMPLETED), seen);
    }

    @Test
    void countsAndFilters() {
        Task a = enqueue(TaskPriority.MEDIUM);
        enqueue(TaskPriority.MEDIUM);
        Task c = enqueue(TaskPriority.MEDIUM);
        store.cancel(c.id());
        claimNext();
        store.markCompleted(a.id(), null);

        assertEquals(1, store.countByStatus().get(TaskStatus.PENDING));
        assertEquals(1, store.countByStatus().get(TaskStatus.COMPLETED));
        assertEquals(1, store.countByStatus().get(TaskStatus.CANCELLED));
        assertEquals(0, store.countByStatus().get(TaskStatus.FAILED));
        assertEquals(1, store.list(Optional.of(TaskStatus.PENDING)).size());
        assertEquals(3, store.list(Optional.empty()).size());
    }

    @Test
    void findsStaleProcessingTasks() {
        Task task = enqueue(TaskPriority.MEDIUM);
        claimNext();
        clock.advance(Duration.ofMinutes(10));

        assertEquals(1, store.findProcessingSince(clock.instant().minusSeconds(60)).size());
        assertTrue(store.findProcessingSince(clock.instant().minus(Duration.ofMinutes(11))).isEmpty());
        assertEquals(task.id(), store.findProcessingSince(clock.instant()).get(0).id());
    }

    @Test
    void recoversPendingTasksOnRestart() {
        Task first = enqueue(TaskPriority.LOW);
        Task second = enqueue(TaskPriority.HIGH);

        TaskStore restarted = new TaskStore(repository, (type, payload) -> {
        }, new RetryBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1)), clock);

        assertEquals(2, restarted.queuedCount());
        assertEquals(second.id(), restarted.nextReady().orElseThrow().id());
        Task third = restarted.enqueue(TaskType.MONITOR, TaskPriority.LOW, null, null, null);
        assertTrue(third.sequence() > first.sequence());
    }

    @Test
    void awaitNextReadyTimesOutWhenEmpty() throws InterruptedException {
        assertTrue(store.awaitNextReady(Duration.ofMillis(50)).isEmpty());
        Task task = enqueue(TaskPriority.LOW);
        assertEquals(task.id(), store.awaitNextReady(Duration.ofMillis(50)).orElseThrow().id());
    }

    @Test
    void resetDropsEverything() {
        enqueue(TaskPriority.LOW);
        enqueue(TaskPriority.CRITICAL);

        store.reset();

        assertEquals(0, store.queuedCount());
        assertTrue(store.list(Optional.empty()).isEmpty());
        assertTrue(store.nextReady().isEmpty());
    }
}
