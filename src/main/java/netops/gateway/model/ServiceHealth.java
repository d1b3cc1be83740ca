package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceHealth(
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("status") ServiceStatus status,
        @JsonProperty("http_status") Integer httpStatus,
        @JsonProperty("latency_ms") Long latencyMs,
        @JsonProperty("error") String error) {

    public static ServiceHealth online(String name, String url, int httpStatus, long latencyMs) {
        return new ServiceHealth(name, url, ServiceStatus.ONLINE, httpStatus, latencyMs, null);
    }

    public static ServiceHealth offline(String name, String url, Integer httpStatus, String error) {
        return new ServiceHealth(name, url, ServiceStatus.OFFLINE, httpStatus, null, error);
    }

    public static ServiceHealth error(String name, String url, String error) {
        return new ServiceHealth(name, url, ServiceStatus.ERROR, null, null, error);
    }

    public boolean isOnline() {
        return status == ServiceStatus.ONLINE;
    }
}
