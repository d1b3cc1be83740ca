package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;

/**
 * Host and JVM metrics of the gateway process.
 */
public class SystemMetricHandler implements TaskHandler {

    private final Clock clock;

    public SystemMetricHandler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public TaskType type() {
        return TaskType.SYSTEM_METRIC;
    }

    @Override
    public void validate(JsonNode payload) {
        // any payload accepted
    }

    @Override
    public JsonNode execute(JsonNode payload) {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        Runtime runtime = Runtime.getRuntime();

        ObjectNode result = Jsons.object();

        ObjectNode cpu = result.putObject("cpu");
        cpu.put("available_processors", os.getAvailableProcessors());
        cpu.put("load_average", os.getSystemLoadAverage());

        ObjectNode mem = result.putObject("memory");
        mem.put("heap_used", memory.getHeapMemoryUsage().getUsed());
        mem.put("heap_committed", memory.getHeapMemoryUsage().getCommitted());
        mem.put("heap_max", runtime.maxMemory());
        mem.put("non_heap_used", memory.getNonHeapMemoryUsage().getUsed());

        File root = new File(File.separator);
        ObjectNode disk = result.putObject("disk");
        disk.put("total", root.getTotalSpace());
        disk.put("free", root.getUsableSpace());

        ObjectNode jvm = result.putObject("jvm");
        jvm.put("uptime_ms", ManagementFactory.getRuntimeMXBean().getUptime());
        jvm.put("threads", ManagementFactory.getThreadMXBean().getThreadCount());
        jvm.put("version", System.getProperty("java.version"));

        result.put("os", os.getName() + " " + os.getVersion() + " (" + os.getArch() + ")");
        result.put("collected_at", clock.instant().toString());
        return result;
    }
}
