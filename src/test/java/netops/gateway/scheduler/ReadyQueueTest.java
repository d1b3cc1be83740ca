package netops.gateway.scheduler;

import netops.gateway.model.Task;
import netops.gateway.model.TaskPriority;
import netops.gateway.model.TaskType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ReadyQueueTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static Task task(String id, TaskPriority priority, Instant createdAt, long seq) {
        return Task.builder()
                .id(id)
                .type(TaskType.MONITOR)
                .priority(priority)
                .createdAt(createdAt)
                .sequence(seq)
                .build();
    }

    @Test
    void priorityBeatsAge() {
        ReadyQueue queue = new ReadyQueue();
        queue.add(task("old-low", TaskPriority.LOW, NOW.minusSeconds(60), 1), NOW);
        queue.add(task("new-high", TaskPriority.HIGH, NOW, 2), NOW);

        assertEquals("new-high", queue.peek(NOW).orElseThrow().id());
    }

    @Test
    void sameInstantFallsBackToArrivalOrder() {
        ReadyQueue queue = new ReadyQueue();
        queue.add(task("second", TaskPriority.MEDIUM, NOW, 2), NOW);
        queue.add(task("first", TaskPriority.MEDIUM, NOW, 1), NOW);

        assertEquals("first", queue.peek(NOW).orElseThrow().id());
        queue.remove("first");
        assertEquals("second", queue.peek(NOW).orElseThrow().id());
    }

    @Test
    void deferredTaskWaitsForBackoff() {
        ReadyQueue queue = new ReadyQueue();
        Task retry = task("retry", TaskPriority.CRITICAL, NOW.minusSeconds(10), 1).toBuilder()
                .notBefore(NOW.plusSeconds(5))
                .build();
        queue.add(retry, NOW);
        queue.add(task("plain", TaskPriority.LOW, NOW, 2), NOW);

        assertEquals(1, queue.deferredCount());
        assertEquals(NOW.plusSeconds(5), queue.nextWakeup().orElseThrow());
        assertEquals("plain", queue.peek(NOW).orElseThrow().id());

        // once eligible the critical retry jumps ahead again
        assertEquals("retry", queue.peek(NOW.plusSeconds(5)).orElseThrow().id());
        assertEquals(0, queue.deferredCount());
        assertTrue(queue.nextWakeup().isEmpty());
    }

    @Test
    void addReplacesExistingEntry() {
        ReadyQueue queue = new ReadyQueue();
        Task original = task("t", TaskPriority.LOW, NOW, 1);
        queue.add(original, NOW);
        queue.add(original.toBuilder().notBefore(NOW.plusSeconds(30)).build(), NOW);

        assertEquals(1, queue.size());
        assertTrue(queue.peek(NOW).isEmpty());
        assertTrue(queue.contains("t"));
    }

    @Test
    void removeAndClear() {
        ReadyQueue queue = new ReadyQueue();
        queue.add(task("a", TaskPriority.HIGH, NOW, 1), NOW);
        queue.add(task("b", TaskPriority.HIGH, NOW, 2), NOW);

        assertTrue(queue.remove("a"));
        assertFalse(queue.remove("a"));
        assertFalse(queue.contains("a"));
        assertEquals(1, queue.size());

        queue.clear();
        assertTrue(queue.isEmpty());
        assertTrue(queue.peek(NOW).isEmpty());
    }
}
