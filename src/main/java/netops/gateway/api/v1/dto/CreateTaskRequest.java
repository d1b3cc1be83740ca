package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for creating a task.
 * POST /api/v1/tasks
 *
 * @param retryCount retry budget for the task (its maximum number of retries)
 */
public record CreateTaskRequest(
        @JsonProperty("type") String type,
        @JsonProperty("priority") String priority,
        @JsonProperty("data") JsonNode data,
        @JsonProperty("timeout") Integer timeout,
        @JsonProperty("retry_count") Integer retryCount) {
}
