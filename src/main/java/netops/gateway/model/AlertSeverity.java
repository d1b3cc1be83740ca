package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String wireName;

    AlertSeverity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static AlertSeverity fromWireName(String value) {
        if (value != null) {
            for (AlertSeverity severity : values()) {
                if (severity.wireName.equalsIgnoreCase(value.trim())) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: " + value);
    }
}
