package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for registering a backend at runtime.
 * POST /api/v1/services
 */
public record RegisterServiceRequest(
        @JsonProperty("name") String name,
        @JsonProperty("url") String url) {
}
