package netops.gateway.error;

import java.time.Duration;

/**
 * Task exceeded its declared timeout and its execution was cancelled.
 */
public class TaskTimeoutException extends TaskExecutionException {

    public TaskTimeoutException(String taskId, Duration timeout) {
        super(504, "Timeout", "Task " + taskId + " exceeded its timeout of " + timeout.toSeconds() + "s",
                true, null);
    }
}
