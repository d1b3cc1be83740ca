package netops.gateway.repository;

import netops.gateway.model.Task;
import netops.gateway.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Implementations keep an id index; lifecycle rules live in the task store, not here.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Replace the stored version of an existing task.
     *
     * @param task the new version
     * @return true if the task existed and was updated
     */
    boolean update(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * All tasks ordered by creation (created_at, then arrival sequence).
     */
    List<Task> findAll();

    /**
     * Tasks with the given status ordered by creation.
     *
     * @param status the status to filter by
     */
    List<Task> findByStatus(TaskStatus status);

    /**
     * Highest arrival sequence stored so far, 0 when empty. Lets a restarted store keep FIFO order.
     */
    long maxSequence();

    /**
     * Remove every task.
     */
    void deleteAll();
}
