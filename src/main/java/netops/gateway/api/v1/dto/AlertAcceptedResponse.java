package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.service.AlertService;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertAcceptedResponse(
        @JsonProperty("message") String message,
        @JsonProperty("alert_id") String alertId,
        @JsonProperty("action") String action,
        @JsonProperty("remediation_task_id") String remediationTaskId) {

    public static AlertAcceptedResponse from(AlertService.Raised raised) {
        String taskId = raised.remediation().map(t -> t.id()).orElse(null);
        String message = taskId != null
                ? "Alert received, remediation started"
                : "Alert received";
        return new AlertAcceptedResponse(message, raised.alert().id(), raised.action(), taskId);
    }
}
