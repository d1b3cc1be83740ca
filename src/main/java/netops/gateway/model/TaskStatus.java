package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task lifecycle status.
 *
 * pending -> processing -> {completed, failed}; cancelled only from pending.
 */
public enum TaskStatus {
    /** Task accepted, waiting to be dispatched (or waiting out a retry backoff) */
    PENDING("pending"),
    /** Task claimed by the dispatcher and executing */
    PROCESSING("processing"),
    /** Task finished successfully */
    COMPLETED("completed"),
    /** Task failed permanently */
    FAILED("failed"),
    /** Task cancelled before it was dispatched */
    CANCELLED("cancelled");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether the state machine allows moving from this status to {@code next}.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == CANCELLED;
            case PROCESSING -> next == COMPLETED || next == FAILED || next == PENDING;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    public static TaskStatus fromWireName(String value) {
        if (value != null) {
            for (TaskStatus status : values()) {
                if (status.wireName.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
