package netops.gateway.model;

/**
 * Outcome of reporting a task failure to the store.
 */
public enum TaskFailResult {
    /** Task went back to pending and will be dispatched again after its backoff */
    RETRIED,

    /** Task failed permanently (non-retryable error or retry budget exhausted) */
    FAILED
}
