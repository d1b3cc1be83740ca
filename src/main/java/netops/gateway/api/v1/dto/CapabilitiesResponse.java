package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What this gateway can run.
 * GET /api/v1/capabilities
 */
public record CapabilitiesResponse(
        @JsonProperty("task_types") List<TaskTypeInfo> taskTypes,
        @JsonProperty("priorities") List<String> priorities,
        @JsonProperty("services") List<String> services,
        @JsonProperty("edge_mode") String edgeMode) {

    public record TaskTypeInfo(
            @JsonProperty("type") String type,
            @JsonProperty("description") String description,
            @JsonProperty("service") String service,
            @JsonProperty("available") boolean available) {
    }
}
