package netops.gateway.store;

import netops.gateway.model.Task;
import netops.gateway.model.TaskStatus;
import netops.gateway.repository.TaskRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default task repository: a concurrent id index held in process memory.
 */
public class InMemoryTaskRepository implements TaskRepository {

    static final Comparator<Task> CREATION_ORDER = Comparator
            .comparing(Task::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(Task::sequence);

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new IllegalStateException("Task already exists: " + task.id());
        }
    }

    @Override
    public boolean update(Task task) {
        return tasks.replace(task.id(), task) != null;
    }

    @Override
    public Optional<Task> findById(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findAll() {
        return tasks.values().stream().sorted(CREATION_ORDER).toList();
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(t -> t.status() == status)
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public long maxSequence() {
        return tasks.values().stream().mapToLong(Task::sequence).max().orElse(0L);
    }

    @Override
    public void deleteAll() {
        tasks.clear();
    }
}
