package netops.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of an operational task.
 * State changes produce a new instance through {@link #toBuilder()}; only the task store does that.
 */
public final class Task {
    private final String id;
    private final TaskType type;
    private final TaskPriority priority;
    private final JsonNode payload;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;
    private final JsonNode result;
    private final String error;
    private final int retryCount;
    private final int maxRetries;
    private final int timeoutSeconds;
    private final Instant notBefore;
    private final long sequence;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.payload = builder.payload != null ? builder.payload : JsonNodeFactory.instance.objectNode();
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.completedAt = builder.completedAt;
        this.result = builder.result;
        this.error = builder.error;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.notBefore = builder.notBefore;
        this.sequence = builder.sequence;
    }

    public String id() {
        return id;
    }

    public TaskType type() {
        return type;
    }

    public TaskPriority priority() {
        return priority;
    }

    public JsonNode payload() {
        return payload;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public JsonNode result() {
        return result;
    }

    public String error() {
        return error;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    /** Earliest instant the task may be dispatched again after a retry; null when eligible immediately */
    public Instant notBefore() {
        return notBefore;
    }

    /** Store-assigned arrival counter, tiebreaker for tasks created within the same instant */
    public long sequence() {
        return sequence;
    }

    /** Check if another attempt is allowed after a retryable failure */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isEligibleAt(Instant now) {
        return notBefore == null || !notBefore.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .priority(priority)
                .payload(payload)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .completedAt(completedAt)
                .result(result)
                .error(error)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .timeoutSeconds(timeoutSeconds)
                .notBefore(notBefore)
                .sequence(sequence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskType type;
        private TaskPriority priority = TaskPriority.MEDIUM;
        private JsonNode payload;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant completedAt;
        private JsonNode result;
        private String error;
        private int retryCount = 0;
        private int maxRetries = 3;
        private int timeoutSeconds = 300;
        private Instant notBefore;
        private long sequence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type=" + type.wireName() + ", priority=" + priority.wireName()
                + ", status=" + status.wireName() + ", retry=" + retryCount + "/" + maxRetries + "}";
    }
}
