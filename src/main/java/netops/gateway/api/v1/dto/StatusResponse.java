package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Live reachability of every backend.
 * GET /api/status
 */
public record StatusResponse(
        @JsonProperty("gateway") String gateway,
        @JsonProperty("services") Map<String, String> services,
        @JsonProperty("timestamp") Instant timestamp) {
}
