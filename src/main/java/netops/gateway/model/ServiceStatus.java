package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one health probe against a backend service.
 */
public enum ServiceStatus {
    /** Probe answered with a 2xx status */
    ONLINE("online"),
    /** Connection refused, timed out, or answered with a non-2xx status */
    OFFLINE("offline"),
    /** Probe failed for any other reason */
    ERROR("error");

    private final String wireName;

    ServiceStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
