package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.config.BackendService;
import netops.gateway.config.GatewayConfig;
import netops.gateway.error.ValidationException;
import netops.gateway.health.HealthPoller;
import netops.gateway.model.ServiceHealth;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;

/**
 * Probes one backend, by registered name ({@code data.service}) or explicit URL ({@code data.url}).
 * An offline backend is a result, not a failure.
 */
public class HealthCheckHandler implements TaskHandler {

    private final GatewayConfig config;
    private final HealthPoller poller;

    public HealthCheckHandler(GatewayConfig config, HealthPoller poller) {
        this.config = config;
        this.poller = poller;
    }

    @Override
    public TaskType type() {
        return TaskType.HEALTH_CHECK;
    }

    @Override
    public void validate(JsonNode payload) {
        Payloads.optionalText(payload, "service");
        Payloads.optionalText(payload, "url");
        String service = Payloads.text(payload, "service", null);
        String url = Payloads.text(payload, "url", null);
        if (service == null && url == null) {
            throw new ValidationException("Health check needs 'data.service' or 'data.url'");
        }
        if (service != null && config.service(service).isEmpty()) {
            throw new ValidationException("Unknown service: " + service);
        }
        if (url != null && !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new ValidationException("Field 'data.url' must be an http(s) URL");
        }
    }

    @Override
    public JsonNode execute(JsonNode payload) {
        String url = Payloads.text(payload, "url", null);
        ServiceHealth health;
        if (url != null) {
            health = poller.probeUrl(Payloads.text(payload, "service", url), url);
        } else {
            BackendService service = config.service(Payloads.text(payload, "service", null))
                    .orElseThrow(() -> new ValidationException("Unknown service"));
            health = poller.probe(service);
        }
        return Jsons.mapper().valueToTree(health);
    }
}
