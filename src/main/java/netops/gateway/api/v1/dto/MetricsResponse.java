package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record MetricsResponse(
        @JsonProperty("total_tasks") int totalTasks,
        @JsonProperty("pending") int pending,
        @JsonProperty("processing") int processing,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("cancelled") int cancelled,
        @JsonProperty("by_type") Map<String, Integer> byType,
        @JsonProperty("active_tasks") int activeTasks,
        @JsonProperty("queued") int queued,
        @JsonProperty("websocket_clients") int websocketClients,
        @JsonProperty("timestamp") Instant timestamp) {
}
