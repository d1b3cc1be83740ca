package netops;

import netops.gateway.config.Dependencies;
import netops.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Gateway entry point.
 * <p>
 * Wires the gateway from environment configuration, starts it and blocks until the JVM is asked
 * to shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        GatewayConfig config = GatewayConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping gateway...");
            deps.close();
            stopped.countDown();
        }, "gateway-shutdown"));

        try {
            int port = deps.start();
            log.info("Gateway started on port {}", port);
        } catch (Exception e) {
            log.error("Failed to start gateway", e);
            deps.close();
            System.exit(1);
        }

        stopped.await();
    }
}
