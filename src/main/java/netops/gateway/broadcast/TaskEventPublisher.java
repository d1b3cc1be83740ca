package netops.gateway.broadcast;

import netops.gateway.api.v1.dto.TaskResponse;
import netops.gateway.model.Task;
import netops.gateway.service.TaskListener;

/**
 * Publishes every task transition as {@code task-update} on the {@code tasks} channel.
 */
public class TaskEventPublisher implements TaskListener {

    public static final String CHANNEL = "tasks";

    private final EventPublisher publisher;

    public TaskEventPublisher(EventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void onTaskChanged(Task task) {
        publisher.publish(CHANNEL, "task-update", TaskResponse.from(task));
    }
}
