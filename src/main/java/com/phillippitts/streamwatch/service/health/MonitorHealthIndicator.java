package com.phillippitts.streamwatch.service.health;

import com.phillippitts.streamwatch.service.disconnect.DisconnectConfirmationService;
import com.phillippitts.streamwatch.service.monitor.MonitorLoop;
import com.phillippitts.streamwatch.service.monitor.MonitorState;
import com.phillippitts.streamwatch.service.recording.RecordingOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the control loop.
 *
 * <ul>
 *   <li>UP: loop starting or running</li>
 *   <li>PAUSED: polling suspended by the pause file; sessions keep recording</li>
 *   <li>DOWN: loop stopping or stopped</li>
 * </ul>
 */
@Component
public class MonitorHealthIndicator implements HealthIndicator {

    private final MonitorLoop loop;
    private final RecordingOrchestrator orchestrator;
    private final DisconnectConfirmationService disconnects;

    public MonitorHealthIndicator(MonitorLoop loop,
                                  RecordingOrchestrator orchestrator,
                                  DisconnectConfirmationService disconnects) {
        this.loop = loop;
        this.orchestrator = orchestrator;
        this.disconnects = disconnects;
    }

    @Override
    public Health health() {
        MonitorState state = loop.state();
        Health.Builder builder = switch (state) {
            case STARTING, RUNNING -> Health.up();
            case PAUSED -> Health.status("PAUSED").withDetail("pausedUntil", String.valueOf(loop.pausedUntil()));
            case STOPPING, STOPPED -> Health.down();
        };
        return builder
                .withDetail("state", state.name())
                .withDetail("cycle", loop.cycle())
                .withDetail("activeRecordings", orchestrator.activeCount())
                .withDetail("recording", orchestrator.activeUsernames())
                .withDetail("pendingDisconnects", disconnects.pendingCount())
                .build();
    }
}
