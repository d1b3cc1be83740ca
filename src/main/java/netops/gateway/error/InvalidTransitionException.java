package netops.gateway.error;

import netops.gateway.model.TaskStatus;

/**
 * Requested lifecycle transition is not allowed from the task's current status.
 */
public class InvalidTransitionException extends GatewayException {

    private final TaskStatus current;
    private final TaskStatus requested;

    public InvalidTransitionException(String taskId, TaskStatus current, TaskStatus requested) {
        super(409, "Invalid transition",
                "Task " + taskId + " cannot move from " + current.wireName() + " to " + requested.wireName());
        this.current = current;
        this.requested = requested;
    }

    public TaskStatus current() {
        return current;
    }

    public TaskStatus requested() {
        return requested;
    }
}
