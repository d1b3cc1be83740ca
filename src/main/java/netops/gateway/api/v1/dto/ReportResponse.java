package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.model.Alert;
import netops.gateway.model.HealthSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operational summary.
 * GET /api/v1/report
 */
public record ReportResponse(
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("health") HealthSnapshot health,
        @JsonProperty("tasks") TaskSummary tasks,
        @JsonProperty("alerts") AlertSummary alerts,
        @JsonProperty("recent_tasks") List<TaskResponse> recentTasks,
        @JsonProperty("recent_alerts") List<Alert> recentAlerts) {

    public record TaskSummary(
            @JsonProperty("total") int total,
            @JsonProperty("by_status") Map<String, Integer> byStatus) {
    }

    public record AlertSummary(
            @JsonProperty("total") int total,
            @JsonProperty("critical") long critical) {
    }
}
