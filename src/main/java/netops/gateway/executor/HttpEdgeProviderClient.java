package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.client.BackendClient;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;

/**
 * Edge client speaking a Cloudflare-style zone API:
 * {@code /zones/{zone}/dns_records}, {@code /purge_cache}, {@code /firewall/...}, {@code /rate_limits}.
 * Responses carry {@code {success, errors, result}}; {@code success:false} is a permanent failure.
 */
public class HttpEdgeProviderClient implements EdgeProviderClient {

    static final String SERVICE = "cloudflare";

    private final BackendClient client;
    private final String apiUrl;
    private final String apiToken;
    private final String zoneId;

    public HttpEdgeProviderClient(BackendClient client, String apiUrl, String apiToken, String zoneId) {
        this.client = client;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.apiToken = apiToken;
        this.zoneId = zoneId;
    }

    @Override
    public JsonNode apply(TaskType type, JsonNode payload) {
        if (zoneId == null || zoneId.isBlank()) {
            throw TaskExecutionException.permanent("Edge zone id is not configured");
        }
        String zone = apiUrl + "/zones/" + zoneId;
        JsonNode response = switch (type) {
            case DNS_UPDATE -> updateDns(zone, payload);
            case CACHE_PURGE -> purgeCache(zone, payload);
            case FIREWALL_RULE -> firewall(zone, payload);
            case RATE_LIMIT -> rateLimit(zone, payload);
            default -> throw TaskExecutionException.permanent("Not an edge task: " + type.wireName());
        };

        if (response.has("success") && !response.path("success").asBoolean()) {
            throw TaskExecutionException.permanent("Edge API rejected " + type.wireName() + ": "
                    + response.path("errors"));
        }
        JsonNode result = response.has("result") ? response.get("result") : response;
        return EdgeApiHandler.envelope(type, result, false);
    }

    private JsonNode updateDns(String zone, JsonNode payload) {
        ObjectNode body = Jsons.object();
        body.put("type", Payloads.text(payload, "type", "A"));
        body.put("name", Payloads.text(payload, "record", null));
        body.put("content", Payloads.text(payload, "content", null));
        body.put("proxied", payload.path("proxied").asBoolean(true));
        if (payload.has("ttl")) {
            body.put("ttl", payload.path("ttl").asInt());
        }
        String recordId = Payloads.text(payload, "id", null);
        if (recordId != null) {
            return client.send(SERVICE, "PUT", zone + "/dns_records/" + recordId, body, apiToken);
        }
        return client.send(SERVICE, "POST", zone + "/dns_records", body, apiToken);
    }

    private JsonNode purgeCache(String zone, JsonNode payload) {
        ObjectNode body = Jsons.object();
        if (payload.path("purge_everything").asBoolean(false)) {
            body.put("purge_everything", true);
        } else if (payload.has("urls")) {
            body.set("files", payload.get("urls"));
        } else {
            body.set("tags", payload.get("tags"));
        }
        return client.send(SERVICE, "POST", zone + "/purge_cache", body, apiToken);
    }

    private JsonNode firewall(String zone, JsonNode payload) {
        String action = Payloads.text(payload, "action", "");
        switch (action) {
            case "block_ip" -> {
                ObjectNode body = Jsons.object();
                body.put("mode", "block");
                ObjectNode configuration = body.putObject("configuration");
                configuration.put("target", "ip");
                configuration.put("value", Payloads.text(payload, "ip", null));
                body.put("notes", "Blocked by gateway: " + Payloads.text(payload, "reason", "security"));
                return client.send(SERVICE, "POST", zone + "/firewall/access_rules/rules", body, apiToken);
            }
            case "create_rule" -> {
                ArrayNode body = Jsons.mapper().createArrayNode();
                ObjectNode rule = body.addObject();
                rule.putObject("filter").put("expression", Payloads.text(payload, "expression", null));
                rule.put("action", Payloads.text(payload, "mode", "block"));
                rule.put("description", Payloads.text(payload, "description", ""));
                return client.send(SERVICE, "POST", zone + "/firewall/rules", body, apiToken);
            }
            case "list" -> {
                return client.send(SERVICE, "GET", zone + "/firewall/rules", null, apiToken);
            }
            default -> throw TaskExecutionException.permanent("Unknown firewall action: " + action);
        }
    }

    private JsonNode rateLimit(String zone, JsonNode payload) {
        ObjectNode body = Jsons.object();
        body.put("threshold", payload.path("threshold").asInt());
        body.put("period", payload.path("period").asInt());
        body.putObject("action").put("mode", Payloads.text(payload, "mode", "simulate"));
        String expression = Payloads.text(payload, "url", null);
        if (expression != null) {
            body.putObject("match").putObject("request").put("url", expression);
        }
        return client.send(SERVICE, "POST", zone + "/rate_limits", body, apiToken);
    }

    @Override
    public boolean dryRun() {
        return false;
    }
}
