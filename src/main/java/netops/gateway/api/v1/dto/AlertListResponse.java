package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.model.Alert;

import java.util.List;

public record AlertListResponse(
        @JsonProperty("alerts") List<Alert> alerts,
        @JsonProperty("count") int count) {

    public static AlertListResponse of(List<Alert> alerts) {
        return new AlertListResponse(alerts, alerts.size());
    }
}
