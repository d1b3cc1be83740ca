package netops.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import netops.gateway.api.Controller;
import netops.gateway.api.v1.dto.ReportResponse;
import netops.gateway.api.v1.dto.TaskResponse;
import netops.gateway.health.HealthPoller;
import netops.gateway.model.Task;
import netops.gateway.model.TaskStatus;
import netops.gateway.service.AlertService;
import netops.gateway.service.TaskStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Monitoring views:
 * - GET /api/v1/monitor - latest polled health snapshot
 * - GET /api/v1/report  - health, task and alert summary
 */
public class MonitorController implements Controller {

    static final int RECENT_TASKS = 10;
    static final int RECENT_ALERTS = 5;

    private final HealthPoller healthPoller;
    private final TaskStore taskStore;
    private final AlertService alertService;
    private final Clock clock;

    public MonitorController(HealthPoller healthPoller, TaskStore taskStore, AlertService alertService, Clock clock) {
        this.healthPoller = healthPoller;
        this.taskStore = taskStore;
        this.alertService = alertService;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/monitor".equals(path) || "/api/v1/report".equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if ("/api/v1/monitor".equals(path)) {
            return ControllerResponse.json(healthPoller.snapshot());
        }

        List<Task> tasks = taskStore.list(Optional.empty());
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (Map.Entry<TaskStatus, Integer> e : taskStore.countByStatus().entrySet()) {
            byStatus.put(e.getKey().wireName(), e.getValue());
        }
        List<TaskResponse> recentTasks = tasks.subList(Math.max(0, tasks.size() - RECENT_TASKS), tasks.size())
                .stream()
                .map(TaskResponse::from)
                .toList();

        ReportResponse report = new ReportResponse(
                clock.instant(),
                healthPoller.snapshot(),
                new ReportResponse.TaskSummary(tasks.size(), byStatus),
                new ReportResponse.AlertSummary(alertService.list().size(), alertService.criticalCount()),
                recentTasks,
                alertService.recent(RECENT_ALERTS));
        return ControllerResponse.json(report);
    }
}
