package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.model.Task;

import java.time.Instant;

/**
 * Full view of a task.
 * GET /api/v1/tasks/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("type") String type,
        @JsonProperty("priority") String priority,
        @JsonProperty("status") String status,
        @JsonProperty("data") JsonNode data,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("timeout") int timeout,
        @JsonProperty("not_before") Instant notBefore) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.type().wireName(),
                task.priority().wireName(),
                task.status().wireName(),
                task.payload(),
                task.createdAt(),
                task.updatedAt(),
                task.completedAt(),
                task.result(),
                task.error(),
                task.retryCount(),
                task.maxRetries(),
                task.timeoutSeconds(),
                task.notBefore());
    }
}
