package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for recording an alert.
 * POST /api/v1/alerts
 */
public record CreateAlertRequest(
        @JsonProperty("type") String type,
        @JsonProperty("severity") String severity,
        @JsonProperty("service") String service,
        @JsonProperty("message") String message) {
}
