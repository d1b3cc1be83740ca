package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one health poll over all backends. Replaced, never accumulated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthSnapshot(
        @JsonProperty("grade") HealthGrade grade,
        @JsonProperty("services") Map<String, ServiceHealth> services,
        @JsonProperty("checked_at") Instant checkedAt) {

    public static HealthSnapshot empty() {
        return new HealthSnapshot(HealthGrade.UNKNOWN, Map.of(), null);
    }

    public static HealthSnapshot of(List<ServiceHealth> results, Instant checkedAt) {
        Map<String, ServiceHealth> byName = new LinkedHashMap<>();
        int healthy = 0;
        for (ServiceHealth health : results) {
            byName.put(health.name(), health);
            if (health.isOnline()) {
                healthy++;
            }
        }
        return new HealthSnapshot(HealthGrade.of(healthy, results.size()),
                Collections.unmodifiableMap(byName), checkedAt);
    }

    public boolean isOnline(String service) {
        ServiceHealth health = services.get(service);
        return health != null && health.isOnline();
    }
}
