package netops.gateway.broadcast;

/**
 * Fan-out of typed events to subscribed observers.
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * @param channel channel name, or null to reach every connected client
     * @param type    event type, e.g. {@code task-update}
     * @param data    JSON-serializable payload
     */
    void publish(String channel, String type, Object data);
}
