package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.health.HealthPoller;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;

/**
 * Runs one full health poll on demand and returns the resulting snapshot.
 */
public class MonitorHandler implements TaskHandler {

    private final HealthPoller poller;

    public MonitorHandler(HealthPoller poller) {
        this.poller = poller;
    }

    @Override
    public TaskType type() {
        return TaskType.MONITOR;
    }

    @Override
    public void validate(JsonNode payload) {
        // no parameters
    }

    @Override
    public JsonNode execute(JsonNode payload) {
        return Jsons.mapper().valueToTree(poller.pollOnce());
    }
}
