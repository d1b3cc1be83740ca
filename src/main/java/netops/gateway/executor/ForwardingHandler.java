package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.client.BackendClient;
import netops.gateway.config.BackendService;
import netops.gateway.config.GatewayConfig;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.model.Task;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;

import java.util.function.Consumer;

/**
 * Hands the task to the backend that performs it: {@code POST {base}/tasks} with
 * {@code {type, priority, data}} and the gateway's bearer token. The backend's answer is the result.
 */
public class ForwardingHandler implements TaskHandler {

    private final TaskType type;
    private final GatewayConfig config;
    private final BackendClient client;
    private final Consumer<JsonNode> validator;

    public ForwardingHandler(TaskType type, GatewayConfig config, BackendClient client) {
        this(type, config, client, payload -> {
        });
    }

    public ForwardingHandler(TaskType type, GatewayConfig config, BackendClient client,
            Consumer<JsonNode> validator) {
        this.type = type;
        this.config = config;
        this.client = client;
        this.validator = validator;
    }

    /**
     * Remediation requires {@code data.issue}; {@code data.service} names the affected backend.
     */
    public static ForwardingHandler remediation(GatewayConfig config, BackendClient client) {
        return new ForwardingHandler(TaskType.REMEDIATE, config, client, payload -> {
            Payloads.requireText(payload, "issue");
            Payloads.optionalText(payload, "service");
        });
    }

    @Override
    public TaskType type() {
        return type;
    }

    @Override
    public void validate(JsonNode payload) {
        validator.accept(payload);
    }

    @Override
    public JsonNode execute(JsonNode payload) throws TaskExecutionException {
        return forward(null, payload);
    }

    @Override
    public JsonNode execute(Task task) throws TaskExecutionException {
        return forward(task.priority().wireName(), task.payload());
    }

    private JsonNode forward(String priority, JsonNode payload) {
        BackendService target = config.service(type.service())
                .orElseThrow(() -> TaskExecutionException.permanent(
                        "No backend configured for " + type.wireName() + " (service '" + type.service() + "')"));

        ObjectNode body = Jsons.object();
        body.put("type", type.wireName());
        if (priority != null) {
            body.put("priority", priority);
        }
        body.set("data", payload);
        return client.postJson(target.name(), target.baseUrl() + "/tasks", body, config.backendToken());
    }
}
