package netops.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import netops.gateway.api.Controller;
import netops.gateway.api.v1.dto.CapabilitiesResponse;
import netops.gateway.api.v1.dto.MetricsResponse;
import netops.gateway.broadcast.EventBroadcaster;
import netops.gateway.config.GatewayConfig;
import netops.gateway.executor.HandlerRegistry;
import netops.gateway.model.Task;
import netops.gateway.model.TaskPriority;
import netops.gateway.model.TaskStatus;
import netops.gateway.model.TaskType;
import netops.gateway.scheduler.TaskDispatcher;
import netops.gateway.service.TaskStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Counters and supported work:
 * - GET /api/v1/metrics
 * - GET /api/v1/capabilities
 */
public class MetricsController implements Controller {

    private final TaskStore taskStore;
    private final TaskDispatcher dispatcher;
    private final EventBroadcaster broadcaster;
    private final HandlerRegistry handlers;
    private final GatewayConfig config;
    private final boolean edgeDryRun;
    private final Clock clock;

    public MetricsController(TaskStore taskStore, TaskDispatcher dispatcher, EventBroadcaster broadcaster,
            HandlerRegistry handlers, GatewayConfig config, boolean edgeDryRun, Clock clock) {
        this.taskStore = taskStore;
        this.dispatcher = dispatcher;
        this.broadcaster = broadcaster;
        this.handlers = handlers;
        this.config = config;
        this.edgeDryRun = edgeDryRun;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/metrics".equals(path) || "/api/v1/capabilities".equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return "/api/v1/metrics".equals(path)
                ? ControllerResponse.json(metrics())
                : ControllerResponse.json(capabilities());
    }

    MetricsResponse metrics() {
        List<Task> tasks = taskStore.list(Optional.empty());
        Map<TaskStatus, Integer> counts = taskStore.countByStatus();
        Map<String, Integer> byType = new TreeMap<>();
        for (Task task : tasks) {
            byType.merge(task.type().wireName(), 1, Integer::sum);
        }
        return new MetricsResponse(
                tasks.size(),
                counts.get(TaskStatus.PENDING),
                counts.get(TaskStatus.PROCESSING),
                counts.get(TaskStatus.COMPLETED),
                counts.get(TaskStatus.FAILED),
                counts.get(TaskStatus.CANCELLED),
                byType,
                dispatcher.activeCount(),
                taskStore.queuedCount(),
                broadcaster.clientCount(),
                clock.instant());
    }

    CapabilitiesResponse capabilities() {
        Set<TaskType> supported = handlers.supportedTypes();
        List<CapabilitiesResponse.TaskTypeInfo> types = new ArrayList<>();
        for (TaskType type : TaskType.values()) {
            types.add(new CapabilitiesResponse.TaskTypeInfo(type.wireName(), type.description(), type.service(),
                    supported.contains(type)));
        }
        List<String> priorities = Arrays.stream(TaskPriority.values()).map(TaskPriority::wireName).toList();
        return new CapabilitiesResponse(types, priorities, new ArrayList<>(config.services().keySet()),
                edgeDryRun ? "dry-run" : "live");
    }
}
