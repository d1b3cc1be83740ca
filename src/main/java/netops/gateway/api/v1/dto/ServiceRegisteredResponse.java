package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.service.BackendRegistry.Registration;

import java.time.Instant;

/**
 * Response for POST /api/v1/services
 */
public record ServiceRegisteredResponse(
        @JsonProperty("status") String status,
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("expires_at") Instant expiresAt) {

    public static ServiceRegisteredResponse from(Registration registration) {
        return new ServiceRegisteredResponse("registered", registration.service().name(),
                registration.service().baseUrl(), registration.expiresAt());
    }
}
