package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.error.ValidationException;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;

import java.util.EnumSet;
import java.util.Set;

/**
 * DNS update, cache purge, firewall rule and rate limit tasks. Validation is per type;
 * execution is delegated to the configured {@link EdgeProviderClient}.
 */
public class EdgeApiHandler implements TaskHandler {

    public static final Set<TaskType> EDGE_TYPES =
            EnumSet.of(TaskType.DNS_UPDATE, TaskType.CACHE_PURGE, TaskType.FIREWALL_RULE, TaskType.RATE_LIMIT);

    private static final Set<String> DNS_RECORD_TYPES = Set.of("A", "AAAA", "CNAME", "TXT", "MX", "NS", "SRV", "CAA");
    private static final Set<String> FIREWALL_ACTIONS = Set.of("block_ip", "create_rule", "list");

    private final TaskType type;
    private final EdgeProviderClient edge;

    public EdgeApiHandler(TaskType type, EdgeProviderClient edge) {
        if (!EDGE_TYPES.contains(type)) {
            throw new IllegalArgumentException("Not an edge task type: " + type.wireName());
        }
        this.type = type;
        this.edge = edge;
    }

    @Override
    public TaskType type() {
        return type;
    }

    @Override
    public void validate(JsonNode payload) {
        switch (type) {
            case DNS_UPDATE -> {
                Payloads.requireText(payload, "record");
                Payloads.requireText(payload, "content");
                Payloads.optionalText(payload, "type");
                String recordType = Payloads.text(payload, "type", "A").toUpperCase();
                if (!DNS_RECORD_TYPES.contains(recordType)) {
                    throw new ValidationException("Unsupported DNS record type: " + recordType);
                }
            }
            case CACHE_PURGE -> {
                boolean everything = payload.path("purge_everything").asBoolean(false);
                JsonNode urls = payload.get("urls");
                JsonNode tags = payload.get("tags");
                boolean hasUrls = urls != null && urls.isArray() && !urls.isEmpty();
                boolean hasTags = tags != null && tags.isArray() && !tags.isEmpty();
                if (!everything && !hasUrls && !hasTags) {
                    throw new ValidationException(
                            "Cache purge needs 'data.purge_everything', a non-empty 'data.urls' or 'data.tags'");
                }
            }
            case FIREWALL_RULE -> {
                String action = Payloads.requireText(payload, "action");
                if (!FIREWALL_ACTIONS.contains(action)) {
                    throw new ValidationException("Unknown firewall action '" + action + "', expected one of "
                            + FIREWALL_ACTIONS);
                }
                if (action.equals("block_ip")) {
                    Payloads.requireText(payload, "ip");
                } else if (action.equals("create_rule")) {
                    Payloads.requireText(payload, "expression");
                }
            }
            case RATE_LIMIT -> {
                Payloads.requirePositiveInt(payload, "threshold");
                Payloads.requirePositiveInt(payload, "period");
                Payloads.optionalText(payload, "mode");
            }
            default -> throw new IllegalStateException("Unexpected edge type " + type);
        }
    }

    @Override
    public JsonNode execute(JsonNode payload) {
        return edge.apply(type, payload);
    }

    static ObjectNode envelope(TaskType type, JsonNode data, boolean dryRun) {
        ObjectNode result = Jsons.object();
        result.put("service", HttpEdgeProviderClient.SERVICE);
        result.put("task_type", type.wireName());
        result.put("status", "success");
        if (dryRun) {
            result.put("dry_run", true);
        }
        result.set("data", data);
        return result;
    }
}
