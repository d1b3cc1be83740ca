package netops.gateway.error;

public class NotFoundException extends GatewayException {

    public NotFoundException(String error, String detail) {
        super(404, error, detail);
    }

    public static NotFoundException task(String taskId) {
        return new NotFoundException("Task not found", "No task with id '" + taskId + "'");
    }
}
