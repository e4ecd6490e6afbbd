package com.phillippitts.streamwatch.service.disconnect;

import com.phillippitts.streamwatch.config.roster.SettingsSource;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import com.phillippitts.streamwatch.service.probe.LivenessProber;
import com.phillippitts.streamwatch.service.recording.RecordingOrchestrator;
import com.phillippitts.streamwatch.service.recording.RecordingSession;
import com.phillippitts.streamwatch.service.recording.StopReason;
import com.phillippitts.streamwatch.service.recording.event.RecordingStoppedEvent;
import com.phillippitts.streamwatch.service.recording.event.StreamDisconnectedEvent;
import com.phillippitts.streamwatch.service.recording.event.StreamEndedEvent;
import com.phillippitts.streamwatch.service.recording.event.StreamReconnectedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns connection drops of active sessions into stops, but only after a grace period.
 *
 * <p><b>Flow:</b>
 * <ol>
 *   <li>{@link StreamDisconnectedEvent}: record a {@link PendingDisconnect} and schedule a
 *       confirmation {@code disconnect_grace_seconds} later. A second drop while one is pending is
 *       ignored.</li>
 *   <li>Confirmation: re-probe. Offline: stop with {@link StopReason#DISCONNECT_CONFIRMED}. Live:
 *       keep recording, reconnecting the client if it is still down
 *       ({@link StopReason#RECONNECT_FAILED} if that fails).</li>
 *   <li>{@link StreamEndedEvent}: cancel any pending confirmation and stop with
 *       {@link StopReason#OFFICIAL_END}.</li>
 *   <li>{@link StreamReconnectedEvent} or {@link RecordingStoppedEvent}: cancel any pending
 *       confirmation.</li>
 * </ol>
 *
 * <p>Cancellation always cancels the scheduled future; a timer that fires anyway finds its record
 * gone (or replaced) and does nothing.
 *
 * <p>Stops triggered by client events are handed to the scheduler so the client's own callback
 * thread never blocks on its disconnect.
 */
public class DisconnectConfirmationService {

    private static final Logger LOG = LogManager.getLogger(DisconnectConfirmationService.class);

    private final RecordingOrchestrator orchestrator;
    private final LivenessProber prober;
    private final SettingsSource settingsSource;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Map<String, PendingDisconnect> pending = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();

    public DisconnectConfirmationService(RecordingOrchestrator orchestrator,
                                         LivenessProber prober,
                                         SettingsSource settingsSource,
                                         TaskScheduler scheduler,
                                         Clock clock,
                                         MonitorMetrics metrics) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        (metrics == null ? MonitorMetrics.NOOP : metrics).registerPendingDisconnectsGauge(this::pendingCount);
    }

    @EventListener
    public void onDisconnected(StreamDisconnectedEvent event) {
        String username = event.username();
        if (!orchestrator.isRecording(username)) {
            return;
        }
        synchronized (pending) {
            if (pending.containsKey(username)) {
                LOG.debug("Disconnect for {} already pending confirmation", username);
                return;
            }
            Duration grace = settingsSource.settings().disconnectGrace();
            Instant now = clock.instant();
            Instant due = now.plus(grace);
            long id = ids.incrementAndGet();
            ScheduledFuture<?> task = scheduler.schedule(() -> confirm(username, id), due);
            pending.put(username, new PendingDisconnect(id, username, event.at(), event.reason(), due, task));
            LOG.info("Disconnect detected for {}; confirming in {}s", username, grace.toSeconds());
        }
        // A stop that landed before the put has already run its cancel
        if (!orchestrator.isRecording(username)) {
            cancel(username, "session stopped while scheduling");
        }
    }

    @EventListener
    public void onStreamEnded(StreamEndedEvent event) {
        String username = event.username();
        cancel(username, "official end");
        LOG.info("Official stream end for {}", username);
        scheduler.schedule(() -> stopWithContext(username, StopReason.OFFICIAL_END), clock.instant());
    }

    @EventListener
    public void onReconnected(StreamReconnectedEvent event) {
        if (cancel(event.username(), "reconnected")) {
            LOG.info("{} reconnected (room {}); recording continues", event.username(), event.roomId());
        }
    }

    @EventListener
    public void onRecordingStopped(RecordingStoppedEvent event) {
        cancel(event.username(), "session stopped: " + event.reason());
    }

    void confirm(String username, long id) {
        synchronized (pending) {
            PendingDisconnect current = pending.get(username);
            if (current == null || current.id() != id) {
                return;
            }
            pending.remove(username);
        }
        ThreadContext.put("streamer", username);
        try {
            Optional<RecordingSession> session = orchestrator.session(username);
            if (session.isEmpty()) {
                return;
            }
            boolean live = prober.isLive(session.get().streamer());
            if (!live) {
                LOG.info("{} still offline after grace period", username);
                orchestrator.stop(username, StopReason.DISCONNECT_CONFIRMED);
                return;
            }
            LOG.info("{} is live again after disconnect; keeping recording", username);
            if (!orchestrator.reconnect(username) && session.get().isRecording()) {
                orchestrator.stop(username, StopReason.RECONNECT_FAILED);
            }
        } catch (RuntimeException e) {
            LOG.error("Disconnect confirmation for {} failed", username, e);
        } finally {
            ThreadContext.remove("streamer");
        }
    }

    private void stopWithContext(String username, StopReason reason) {
        ThreadContext.put("streamer", username);
        try {
            if (orchestrator.isRecording(username)) {
                orchestrator.stop(username, reason);
            }
        } finally {
            ThreadContext.remove("streamer");
        }
    }

    /**
     * @return {@code true} if a pending confirmation was cancelled
     */
    private boolean cancel(String username, String why) {
        PendingDisconnect removed;
        synchronized (pending) {
            removed = pending.remove(username);
        }
        if (removed == null) {
            return false;
        }
        removed.task().cancel(false);
        LOG.debug("Cancelled pending disconnect for {} ({})", username, why);
        return true;
    }

    /**
     * Cancels every pending confirmation.
     *
     * @return number cancelled
     */
    public int cancelAll() {
        List<PendingDisconnect> all;
        synchronized (pending) {
            all = new ArrayList<>(pending.values());
            pending.clear();
        }
        all.forEach(p -> p.task().cancel(false));
        if (!all.isEmpty()) {
            LOG.info("Cancelled {} pending disconnect confirmation(s)", all.size());
        }
        return all.size();
    }

    public boolean isPending(String username) {
        synchronized (pending) {
            return pending.containsKey(username);
        }
    }

    public int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }
}
