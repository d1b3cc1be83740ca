package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Out-of-band signal about a degraded or failed service. Immutable once recorded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Alert(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("severity") AlertSeverity severity,
        @JsonProperty("service") String service,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") Instant timestamp) {

    /** Alert type that asks for the affected service to be restarted */
    public static final String SERVICE_DOWN = "service_down";

    public Alert {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public boolean isCritical() {
        return severity == AlertSeverity.CRITICAL;
    }

    public boolean requestsRemediation() {
        return isCritical() && SERVICE_DOWN.equals(type) && service != null && !service.isBlank();
    }
}
