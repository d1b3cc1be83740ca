package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.model.TaskType;

/**
 * Applies a DNS, cache, firewall or rate-limit change at the edge provider.
 * Results share one envelope: {@code {service, task_type, status, data}}.
 */
public interface EdgeProviderClient {

    JsonNode apply(TaskType type, JsonNode payload) throws TaskExecutionException;

    /** True when no change actually leaves the gateway */
    boolean dryRun();
}
