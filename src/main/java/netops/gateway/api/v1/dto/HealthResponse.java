package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the liveness check.
 * GET /health
 *
 * @param uptime seconds since the gateway started
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("uptime") long uptime,
        @JsonProperty("services") List<String> services) {

    public static HealthResponse healthy(Instant now, long uptimeSeconds, List<String> services) {
        return new HealthResponse("healthy", now, uptimeSeconds, services);
    }
}
