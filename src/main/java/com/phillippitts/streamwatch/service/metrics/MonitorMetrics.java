package com.phillippitts.streamwatch.service.metrics;

import com.phillippitts.streamwatch.persistence.EventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the monitor.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Liveness probe outcomes (live, offline, failed)</li>
 *   <li>Confirmed-live decisions and admission rejections</li>
 *   <li>Sessions started and stopped, tagged by stop reason</li>
 *   <li>Captured events per kind and poll cycle duration</li>
 * </ul>
 *
 * <p><b>Null Safety:</b> constructed with a {@code null} registry (see {@link #NOOP}) every method
 * is a no-op, so components can be unit-tested without Micrometer wiring.
 */
public class MonitorMetrics {

    private static final String METRIC_PREFIX = "streamwatch";

    /**
     * No-op instance for tests and manual wiring.
     */
    public static final MonitorMetrics NOOP = new MonitorMetrics(null);

    private final MeterRegistry registry;

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public boolean isEnabled() {
        return registry != null;
    }

    /**
     * @param outcome {@code live}, {@code offline} or {@code failed}
     */
    public void recordProbe(String outcome) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".probe")
                .description("Liveness probe results")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementConfirmedLive() {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".stability.confirmed")
                .description("Debounced confirmed-live decisions")
                .register(registry)
                .increment();
    }

    /**
     * @param reason {@code cap}, {@code duplicate} or {@code start-failed}
     */
    public void incrementAdmissionRejected(String reason) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".admission.rejected")
                .description("Recording sessions refused or aborted at admission")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSessionStarted() {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".session.started")
                .description("Recording sessions started")
                .register(registry)
                .increment();
    }

    public void recordSessionStopped(String reason, Duration duration) {
        if (registry == null) {
            return;
        }
        Timer.builder(METRIC_PREFIX + ".session.duration")
                .description("Recording session duration by stop reason")
                .tag("reason", reason)
                .register(registry)
                .record(duration);
    }

    public void incrementEvent(EventKind kind) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".events")
                .description("Captured live events")
                .tag("kind", kind.fileSuffix())
                .register(registry)
                .increment();
    }

    public void recordCycle(Duration duration) {
        if (registry == null) {
            return;
        }
        Timer.builder(METRIC_PREFIX + ".poll.cycle")
                .description("Time taken by one poll cycle")
                .register(registry)
                .record(duration);
    }

    /**
     * Registers a gauge reporting the number of active recording sessions.
     */
    public void registerActiveSessionsGauge(Supplier<Number> activeSessions) {
        if (registry == null) {
            return;
        }
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions)
                .description("Active recording sessions")
                .register(registry);
    }

    public void registerPendingDisconnectsGauge(Supplier<Number> pending) {
        if (registry == null) {
            return;
        }
        Gauge.builder(METRIC_PREFIX + ".disconnects.pending", pending)
                .description("Disconnects awaiting grace-period confirmation")
                .register(registry);
    }
}
