package com.phillippitts.streamwatch.service.monitor;

import com.phillippitts.streamwatch.config.properties.MonitorProperties;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.time.Duration;

/**
 * Runs the {@link MonitorLoop} on the main thread once the context is up, and stops it when the
 * context closes (Ctrl+C, SIGTERM).
 */
public class MonitorRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(MonitorRunner.class);

    private final MonitorLoop loop;
    private final Duration shutdownTimeout;
    private volatile boolean started;

    public MonitorRunner(MonitorLoop loop, MonitorProperties properties) {
        this.loop = loop;
        this.shutdownTimeout = Duration.ofSeconds(properties.getShutdownTimeoutSeconds());
    }

    @Override
    public void run(ApplicationArguments args) {
        started = true;
        loop.run();
    }

    @PreDestroy
    void stop() {
        if (!started) {
            return;
        }
        loop.requestStop();
        try {
            if (!loop.awaitTermination(shutdownTimeout)) {
                LOG.warn("Monitor did not stop within {}s", shutdownTimeout.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for monitor shutdown");
        }
    }
}
