package netops.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import netops.gateway.api.Controller;
import netops.gateway.api.RequestBodies;
import netops.gateway.api.v1.dto.CreateTaskRequest;
import netops.gateway.api.v1.dto.TaskCreatedResponse;
import netops.gateway.api.v1.dto.TaskListResponse;
import netops.gateway.api.v1.dto.TaskResponse;
import netops.gateway.config.GatewayConfig;
import netops.gateway.error.ValidationException;
import netops.gateway.model.Task;
import netops.gateway.model.TaskStatus;
import netops.gateway.service.TaskStore;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task endpoints:
 * - POST   /api/v1/tasks       - Create a task
 * - GET    /api/v1/tasks       - List tasks (?status= filter)
 * - GET    /api/v1/tasks/{id}  - Get task details
 * - DELETE /api/v1/tasks/{id}  - Cancel a pending task
 */
public class TaskController implements Controller {

    private static final String TASKS = "/api/v1/tasks";
    private static final Pattern TASK_BY_ID = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final TaskStore taskStore;
    private final GatewayConfig config;

    public TaskController(TaskStore taskStore, GatewayConfig config) {
        this.taskStore = taskStore;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS.equals(path)) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        return TASK_BY_ID.matcher(path).matches()
                && (method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        if (TASKS.equals(path)) {
            return method.equals(HttpMethod.POST) ? create(req) : list(req);
        }

        Matcher m = TASK_BY_ID.matcher(path);
        if (!m.matches()) {
            throw new ValidationException("Invalid task path: " + path);
        }
        String taskId = m.group(1);
        if (method.equals(HttpMethod.DELETE)) {
            return ControllerResponse.json(TaskResponse.from(taskStore.cancel(taskId)));
        }
        return ControllerResponse.json(TaskResponse.from(taskStore.get(taskId)));
    }

    private ControllerResponse create(FullHttpRequest req) {
        CreateTaskRequest request = RequestBodies.readJson(req, CreateTaskRequest.class);
        Task task = taskStore.enqueue(
                request.type(),
                request.priority(),
                request.data(),
                request.timeout() != null ? request.timeout() : config.defaultTimeoutSeconds(),
                request.retryCount() != null ? request.retryCount() : config.defaultMaxRetries());
        return ControllerResponse.json(HttpResponseStatus.CREATED, TaskCreatedResponse.from(task));
    }

    private ControllerResponse list(FullHttpRequest req) {
        Optional<TaskStatus> status;
        try {
            status = RequestBodies.queryParam(req, "status").map(TaskStatus::fromWireName);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid status", e.getMessage());
        }
        return ControllerResponse.json(TaskListResponse.from(taskStore.list(status)));
    }
}
