package netops.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.model.TaskType;

/**
 * Shape check applied to a task payload before it is accepted.
 */
@FunctionalInterface
public interface PayloadValidator {

    /**
     * @throws netops.gateway.error.ValidationException if no handler serves the type or the payload is malformed
     */
    void validate(TaskType type, JsonNode payload);
}
