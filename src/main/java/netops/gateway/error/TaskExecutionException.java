package netops.gateway.error;

/**
 * A handler failed to perform its task. Recorded on the task, never returned to the HTTP caller.
 */
public class TaskExecutionException extends GatewayException {

    private final boolean retryable;

    public TaskExecutionException(String detail, boolean retryable) {
        super(500, "Execution failed", detail);
        this.retryable = retryable;
    }

    public TaskExecutionException(String detail, boolean retryable, Throwable cause) {
        super(500, "Execution failed", detail, cause);
        this.retryable = retryable;
    }

    protected TaskExecutionException(int statusCode, String error, String detail, boolean retryable, Throwable cause) {
        super(statusCode, error, detail, cause);
        this.retryable = retryable;
    }

    public static TaskExecutionException transientFailure(String detail, Throwable cause) {
        return new TaskExecutionException(detail, true, cause);
    }

    public static TaskExecutionException permanent(String detail) {
        return new TaskExecutionException(detail, false);
    }

    public boolean retryable() {
        return retryable;
    }
}
