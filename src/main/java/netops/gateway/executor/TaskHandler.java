package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.model.Task;
import netops.gateway.model.TaskType;

/**
 * Performs the work for one task type.
 * <p>
 * Implementations must be thread-safe: the dispatcher runs distinct tasks of the same type concurrently.
 * Blocking I/O is fine; a timed-out execution is interrupted.
 */
public interface TaskHandler {

    TaskType type();

    /**
     * Shape check run at enqueue time.
     *
     * @throws netops.gateway.error.ValidationException if the payload cannot be executed
     */
    void validate(JsonNode payload);

    JsonNode execute(JsonNode payload) throws TaskExecutionException;

    /**
     * Entry point used by the dispatcher. Handlers that need more than the payload override this.
     */
    default JsonNode execute(Task task) throws TaskExecutionException {
        return execute(task.payload());
    }
}
