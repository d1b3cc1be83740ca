package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority class. Declaration order is the scheduling order: lower ordinal is served first.
 */
public enum TaskPriority {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    TaskPriority(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static TaskPriority fromWireName(String value) {
        if (value != null) {
            for (TaskPriority priority : values()) {
                if (priority.wireName.equalsIgnoreCase(value.trim())) {
                    return priority;
                }
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
