package com.phillippitts.streamwatch.service.health;

import com.phillippitts.streamwatch.service.disconnect.DisconnectConfirmationService;
import com.phillippitts.streamwatch.service.monitor.MonitorLoop;
import com.phillippitts.streamwatch.service.monitor.MonitorState;
import com.phillippitts.streamwatch.service.recording.RecordingOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MonitorHealthIndicatorTest {

    private MonitorLoop loop;
    private MonitorHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        loop = mock(MonitorLoop.class);
        RecordingOrchestrator orchestrator = mock(RecordingOrchestrator.class);
        DisconnectConfirmationService disconnects = mock(DisconnectConfirmationService.class);
        when(orchestrator.activeCount()).thenReturn(2);
        when(orchestrator.activeUsernames()).thenReturn(List.of("@alice", "@bob"));
        when(disconnects.pendingCount()).thenReturn(1);
        when(loop.cycle()).thenReturn(17L);
        indicator = new MonitorHealthIndicator(loop, orchestrator, disconnects);
    }

    @Test
    void shouldReportUpWhileRunning() {
        when(loop.state()).thenReturn(MonitorState.RUNNING);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("state", "RUNNING")
                .containsEntry("cycle", 17L)
                .containsEntry("activeRecordings", 2)
                .containsEntry("pendingDisconnects", 1);
    }

    @Test
    void shouldReportPausedStatusWithPauseEnd() {
        when(loop.state()).thenReturn(MonitorState.PAUSED);
        when(loop.pausedUntil()).thenReturn(Instant.parse("2025-07-01T08:00:00Z"));

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("PAUSED");
        assertThat(health.getDetails()).containsEntry("pausedUntil", "2025-07-01T08:00:00Z");
    }

    @Test
    void shouldReportDownOnceStopped() {
        when(loop.state()).thenReturn(MonitorState.STOPPED);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
