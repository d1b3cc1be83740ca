package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate system health derived from the share of healthy backends.
 */
public enum HealthGrade {
    EXCELLENT("excellent"),
    GOOD("good"),
    DEGRADED("degraded"),
    CRITICAL("critical"),
    UNKNOWN("unknown");

    private final String wireName;

    HealthGrade(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 100% healthy is excellent, at least 90% good, at least 70% degraded, anything less critical.
     * No checks at all is unknown.
     */
    public static HealthGrade of(int healthy, int total) {
        if (total <= 0) {
            return UNKNOWN;
        }
        double percentage = healthy * 100.0 / total;
        if (percentage >= 100.0) {
            return EXCELLENT;
        }
        if (percentage >= 90.0) {
            return GOOD;
        }
        if (percentage >= 70.0) {
            return DEGRADED;
        }
        return CRITICAL;
    }
}
