package netops.gateway.scheduler;

import netops.gateway.config.GatewayConfig;
import netops.gateway.model.Task;
import netops.gateway.model.TaskPriority;
import netops.gateway.model.TaskStatus;
import netops.gateway.model.TaskType;
import netops.gateway.service.TaskStore;
import netops.gateway.store.InMemoryTaskRepository;
import netops.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskReaper functionality.
 */
class TaskReaperTest {

    private MutableClock clock;
    private TaskStore store;
    private GatewayConfig config;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new TaskStore(new InMemoryTaskRepository(), (type, payload) -> {
        }, new RetryBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1)), clock);
        config = GatewayConfig.defaults().withTaskStuckGrace(Duration.ofSeconds(30));
    }

    private Task startTask(int timeoutSeconds, int maxRetries) {
        Task task = store.enqueue(TaskType.BACKUP, TaskPriority.MEDIUM, null, timeoutSeconds, maxRetries);
        assertTrue(store.markProcessing(task.id()));
        return task;
    }

    @Test
    void reapsStuckTaskWithRetryAvailable() {
        Task task = startTask(10, 3);
        clock.advance(Duration.ofSeconds(41));

        int reaped = new TaskReaper(store, config, id -> false).reapStuckTasks();

        assertEquals(1, reaped);
        Task updated = store.get(task.id());
        assertEquals(TaskStatus.PENDING, updated.status());
        assertEquals(1, updated.retryCount());
        assertTrue(updated.error().contains("stuck"));
    }

    @Test
    void reapsStuckTaskWithNoRetryLeft() {
        Task task = startTask(10, 0);
        clock.advance(Duration.ofMinutes(5));

        assertEquals(1, new TaskReaper(store, config, id -> false).reapStuckTasks());

        Task updated = store.get(task.id());
        assertEquals(TaskStatus.FAILED, updated.status());
        assertEquals("stuck", updated.result().get("kind").asText());
    }

    @Test
    void leavesTasksWithinTimeoutPlusGrace() {
        Task task = startTask(10, 3);
        clock.advance(Duration.ofSeconds(35));

        assertEquals(0, new TaskReaper(store, config, id -> false).reapStuckTasks());
        assertEquals(TaskStatus.PROCESSING, store.get(task.id()).status());
    }

    @Test
    void skipsTasksStillExecuting() {
        Task task = startTask(10, 3);
        clock.advance(Duration.ofHours(1));

        assertEquals(0, new TaskReaper(store, config, task.id()::equals).reapStuckTasks());
        assertEquals(TaskStatus.PROCESSING, store.get(task.id()).status());
    }

    @Test
    void ignoresTasksNotProcessing() {
        store.enqueue(TaskType.BACKUP, TaskPriority.MEDIUM, null, 1, 3);
        clock.advance(Duration.ofHours(1));

        TaskReaper reaper = new TaskReaper(store, config, id -> false);
        assertEquals(0, reaper.reapStuckTasks());
        reaper.run();
    }
}
