package netops.gateway.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.broadcast.EventPublisher;
import netops.gateway.error.ValidationException;
import netops.gateway.model.Alert;
import netops.gateway.model.AlertSeverity;
import netops.gateway.model.Task;
import netops.gateway.model.TaskPriority;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records alerts, publishes them on the {@code alerts} channel and turns a critical
 * {@code service_down} alert into a critical remediation task.
 */
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    public static final String CHANNEL = "alerts";
    static final int MAX_RETAINED = 1000;

    private final TaskStore taskStore;
    private final EventPublisher publisher;
    private final Clock clock;

    private final List<Alert> alerts = new ArrayList<>();

    public AlertService(TaskStore taskStore, EventPublisher publisher, Clock clock) {
        this.taskStore = taskStore;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Outcome of recording an alert: the alert itself and the remediation task it triggered, if any.
     */
    public record Raised(Alert alert, Optional<Task> remediation) {

        /** "immediate" when a remediation task was started, "queued" otherwise */
        public String action() {
            return remediation.isPresent() ? "immediate" : "queued";
        }
    }

    public Raised raise(String type, String severity, String service, String message) {
        if (type == null || type.isBlank()) {
            throw new ValidationException("Field 'type' is required");
        }
        AlertSeverity level;
        try {
            level = severity == null ? AlertSeverity.WARNING : AlertSeverity.fromWireName(severity);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid severity", e.getMessage());
        }
        return raise(type, level, service, message);
    }

    public Raised raise(String type, AlertSeverity severity, String service, String message) {
        Alert alert = new Alert(UUID.randomUUID().toString(), type.trim(), severity,
                service == null || service.isBlank() ? null : service.trim().toLowerCase(),
                message, clock.instant());

        synchronized (alerts) {
            alerts.add(alert);
            if (alerts.size() > MAX_RETAINED) {
                alerts.remove(0);
            }
        }

        if (alert.isCritical()) {
            log.warn("Critical alert {}: {} {} {}", alert.id(), alert.type(), alert.service(), alert.message());
        } else {
            log.info("Alert {}: {} ({}) {}", alert.id(), alert.type(), alert.severity().wireName(), alert.message());
        }
        publisher.publish(CHANNEL, "alert", alert);

        Optional<Task> remediation = Optional.empty();
        if (alert.requestsRemediation()) {
            ObjectNode payload = Jsons.object();
            payload.put("issue", Alert.SERVICE_DOWN);
            payload.put("service", alert.service());
            payload.put("alert_id", alert.id());
            Task task = taskStore.enqueue(TaskType.REMEDIATE, TaskPriority.CRITICAL, payload, null, null);
            log.info("Remediation task {} started for {}", task.id(), alert.service());
            remediation = Optional.of(task);
        }
        return new Raised(alert, remediation);
    }

    /** Recorded alerts, oldest first */
    public List<Alert> list() {
        synchronized (alerts) {
            return List.copyOf(alerts);
        }
    }

    public List<Alert> recent(int limit) {
        synchronized (alerts) {
            int from = Math.max(0, alerts.size() - limit);
            return List.copyOf(alerts.subList(from, alerts.size()));
        }
    }

    public long criticalCount() {
        synchronized (alerts) {
            return alerts.stream().filter(Alert::isCritical).count();
        }
    }

    public void reset() {
        synchronized (alerts) {
            alerts.clear();
        }
    }
}
