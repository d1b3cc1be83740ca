package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Edge client used when no provider API is configured. Reports the change it would have applied.
 */
public class DryRunEdgeProviderClient implements EdgeProviderClient {

    private static final Logger log = LoggerFactory.getLogger(DryRunEdgeProviderClient.class);

    private final Clock clock;

    public DryRunEdgeProviderClient() {
        this(Clock.systemUTC());
    }

    public DryRunEdgeProviderClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public JsonNode apply(TaskType type, JsonNode payload) {
        String now = clock.instant().toString();
        ObjectNode data = Jsons.object();
        switch (type) {
            case DNS_UPDATE -> {
                data.put("record", Payloads.text(payload, "record", null));
                data.put("type", Payloads.text(payload, "type", "A"));
                data.put("content", Payloads.text(payload, "content", null));
                data.put("updated_at", now);
            }
            case CACHE_PURGE -> {
                ArrayNode urls = data.putArray("purged_urls");
                JsonNode requested = payload.get("urls");
                if (requested != null && requested.isArray()) {
                    requested.forEach(urls::add);
                }
                data.put("purge_everything", payload.path("purge_everything").asBoolean(false));
                data.put("purged_at", now);
            }
            case FIREWALL_RULE -> {
                data.put("action", Payloads.text(payload, "action", null));
                if (payload.has("ip")) {
                    data.put("ip", Payloads.text(payload, "ip", null));
                }
                if (payload.has("expression")) {
                    data.put("expression", Payloads.text(payload, "expression", null));
                }
                data.put("applied_at", now);
            }
            case RATE_LIMIT -> {
                data.put("threshold", payload.path("threshold").asInt());
                data.put("period", payload.path("period").asInt());
                data.put("mode", Payloads.text(payload, "mode", "simulate"));
                data.put("applied_at", now);
            }
            default -> throw TaskExecutionException.permanent("Not an edge task: " + type.wireName());
        }
        log.info("Dry-run {}: {}", type.wireName(), data);
        return EdgeApiHandler.envelope(type, data, true);
    }

    @Override
    public boolean dryRun() {
        return true;
    }
}
