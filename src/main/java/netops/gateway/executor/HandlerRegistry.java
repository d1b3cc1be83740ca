package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.error.ValidationException;
import netops.gateway.model.TaskType;
import netops.gateway.service.PayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Task type to handler mapping. One handler per type; registration happens at startup.
 */
public class HandlerRegistry implements PayloadValidator {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);

    public synchronized HandlerRegistry register(TaskHandler handler) {
        TaskHandler previous = handlers.putIfAbsent(handler.type(), handler);
        if (previous != null) {
            throw new IllegalStateException("Handler already registered for " + handler.type().wireName()
                    + ": " + previous.getClass().getSimpleName());
        }
        log.debug("Registered handler {} for {}", handler.getClass().getSimpleName(), handler.type().wireName());
        return this;
    }

    public synchronized Optional<TaskHandler> find(TaskType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /**
     * Handler for a task about to execute. A missing handler is a permanent failure.
     */
    public TaskHandler require(TaskType type) {
        return find(type).orElseThrow(
                () -> TaskExecutionException.permanent("No handler registered for " + type.wireName()));
    }

    public synchronized Set<TaskType> supportedTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    @Override
    public void validate(TaskType type, JsonNode payload) {
        TaskHandler handler = find(type).orElseThrow(
                () -> new ValidationException("Invalid task type", "No handler for task type " + type.wireName()));
        handler.validate(payload);
    }
}
