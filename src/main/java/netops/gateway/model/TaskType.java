package netops.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Recognized task types. Each type is served by exactly one registered handler.
 */
public enum TaskType {
    DNS_UPDATE("dns_update", "Update DNS records at the edge provider", "cloudflare"),
    CACHE_PURGE("cache_purge", "Purge CDN cache", "cloudflare"),
    SSL_CHECK("ssl_check", "Verify SSL certificate status", "gateway"),
    FIREWALL_RULE("firewall_rule", "Manage firewall rules", "cloudflare"),
    RATE_LIMIT("rate_limit", "Configure rate limiting", "cloudflare"),
    HEALTH_CHECK("health_check", "Backend health check", "gateway"),
    SYSTEM_METRIC("system_metric", "Collect gateway host metrics", "gateway"),
    DEPLOY("deploy", "Deploy application updates", "agent"),
    WORKER_DEPLOY("worker_deploy", "Deploy edge workers", "cloudflare"),
    ANALYTICS_QUERY("analytics_query", "Query analytics data", "cloudflare"),
    MONITOR("monitor", "Run an infrastructure health poll", "gateway"),
    REMEDIATE("remediate", "Automated remediation", "agent"),
    BACKUP("backup", "Perform backup operations", "agent"),
    SECURITY_SCAN("security_scan", "Run security scan", "agent");

    private final String wireName;
    private final String description;
    private final String service;

    TaskType(String wireName, String description, String service) {
        this.wireName = wireName;
        this.description = description;
        this.service = service;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    /** Name of the service that ultimately performs this kind of work. */
    public String service() {
        return service;
    }

    public static Optional<TaskType> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        for (TaskType type : values()) {
            if (type.wireName.equalsIgnoreCase(v)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
