package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.config.BackendService;
import netops.gateway.service.BackendRegistry.Registration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record ServiceListResponse(
        @JsonProperty("services") List<ServiceView> services,
        @JsonProperty("count") int count) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ServiceView(
            @JsonProperty("name") String name,
            @JsonProperty("url") String url,
            @JsonProperty("source") String source,
            @JsonProperty("expires_at") Instant expiresAt) {

        public static ServiceView configured(BackendService service) {
            return new ServiceView(service.name(), service.baseUrl(), "config", null);
        }

        public static ServiceView registered(Registration registration) {
            return new ServiceView(registration.service().name(), registration.service().baseUrl(), "registered",
                    registration.expiresAt());
        }
    }

    public static ServiceListResponse of(List<BackendService> configured, List<Registration> registered) {
        List<ServiceView> views = new ArrayList<>();
        configured.forEach(s -> views.add(ServiceView.configured(s)));
        registered.forEach(r -> views.add(ServiceView.registered(r)));
        return new ServiceListResponse(views, views.size());
    }
}
