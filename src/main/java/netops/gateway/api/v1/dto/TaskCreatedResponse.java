package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.model.Task;

import java.time.Instant;

/**
 * Response DTO for an accepted task.
 */
public record TaskCreatedResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("estimated_completion") Instant estimatedCompletion) {

    public static TaskCreatedResponse from(Task task) {
        return new TaskCreatedResponse(task.id(), task.status().wireName(),
                "Task " + task.type().wireName() + " queued with " + task.priority().wireName() + " priority",
                task.createdAt(), task.createdAt().plus(task.timeout()));
    }
}
