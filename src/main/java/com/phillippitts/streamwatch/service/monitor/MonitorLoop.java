package com.phillippitts.streamwatch.service.monitor;

import com.phillippitts.streamwatch.config.roster.ConfigurationWatcher;
import com.phillippitts.streamwatch.config.roster.RosterDiff;
import com.phillippitts.streamwatch.config.roster.RosterSnapshot;
import com.phillippitts.streamwatch.config.roster.StreamerConfig;
import com.phillippitts.streamwatch.persistence.MonitorStatus;
import com.phillippitts.streamwatch.persistence.StatusFileWriter;
import com.phillippitts.streamwatch.service.control.ControlSignal;
import com.phillippitts.streamwatch.service.control.ControlSignalChannel;
import com.phillippitts.streamwatch.service.disconnect.DisconnectConfirmationService;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import com.phillippitts.streamwatch.service.probe.ParallelPollEngine;
import com.phillippitts.streamwatch.service.recording.RecordingOrchestrator;
import com.phillippitts.streamwatch.service.recording.StopReason;
import com.phillippitts.streamwatch.service.stability.StabilityDecision;
import com.phillippitts.streamwatch.service.stability.StabilityTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single control loop.
 *
 * <p>Each cycle: read control signals, reload the roster if it changed, then (unless paused) probe
 * every enabled streamer in parallel, feed the results to the {@link StabilityTracker}, and hand
 * confirmed-live streamers to the session executor for admission. The status file is rewritten at
 * the end of every cycle.
 *
 * <p>Between cycles the loop sleeps {@code max(min-sleep, interval - cycle time)}; after an
 * unexpected error it backs off for {@code error-backoff-seconds}. {@link #requestStop()} wakes it
 * immediately.
 *
 * <p>On exit it cancels pending disconnect confirmations, stops every session with reason
 * {@link StopReason#SHUTDOWN} and writes a final {@link MonitorState#STOPPED} status.
 */
public class MonitorLoop {

    private static final Logger LOG = LogManager.getLogger(MonitorLoop.class);

    private static final double SLOW_CYCLE_RATIO = 0.8;

    private final ConfigurationWatcher watcher;
    private final ParallelPollEngine pollEngine;
    private final StabilityTracker tracker;
    private final RecordingOrchestrator orchestrator;
    private final DisconnectConfirmationService disconnects;
    private final ControlSignalChannel control;
    private final StatusFileWriter statusWriter;
    private final Executor sessionExecutor;
    private final Duration minSleep;
    private final Duration errorBackoff;
    private final MonitorMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final AtomicBoolean shutdownDone = new AtomicBoolean();
    private final CountDownLatch wakeUp = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile MonitorState state = MonitorState.STARTING;
    private volatile Instant pausedUntil;
    private volatile long cycle;

    public MonitorLoop(ConfigurationWatcher watcher,
                       ParallelPollEngine pollEngine,
                       StabilityTracker tracker,
                       RecordingOrchestrator orchestrator,
                       DisconnectConfirmationService disconnects,
                       ControlSignalChannel control,
                       StatusFileWriter statusWriter,
                       Executor sessionExecutor,
                       Duration minSleep,
                       Duration errorBackoff,
                       MonitorMetrics metrics,
                       Clock clock) {
        this.watcher = Objects.requireNonNull(watcher, "watcher");
        this.pollEngine = Objects.requireNonNull(pollEngine, "pollEngine");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.disconnects = Objects.requireNonNull(disconnects, "disconnects");
        this.control = Objects.requireNonNull(control, "control");
        this.statusWriter = Objects.requireNonNull(statusWriter, "statusWriter");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.minSleep = Objects.requireNonNull(minSleep, "minSleep");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff");
        this.metrics = metrics == null ? MonitorMetrics.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs cycles until a stop is requested, then shuts down. Blocks the calling thread.
     */
    public void run() {
        RosterSnapshot roster = watcher.current();
        LOG.info("Monitoring {} enabled streamer(s), checking every {}s, max {} concurrent recording(s)",
                roster.enabledStreamers().size(), roster.settings().checkIntervalSeconds(),
                roster.settings().maxConcurrentRecordings());
        LOG.info("Control files: create {} to stop, {} to pause", control.stopFile(), control.pauseFile());
        state = MonitorState.RUNNING;
        try {
            while (!stopRequested.get()) {
                Instant started = clock.instant();
                Duration sleep;
                try {
                    if (!runCycle()) {
                        break;
                    }
                    Duration remaining = watcher.settings().checkInterval()
                            .minus(Duration.between(started, clock.instant()));
                    sleep = remaining.compareTo(minSleep) > 0 ? remaining : minSleep;
                } catch (RuntimeException e) {
                    LOG.error("Error in monitoring loop; retrying in {}s", errorBackoff.toSeconds(), e);
                    sleep = errorBackoff;
                }
                if (sleepUnlessStopped(sleep)) {
                    break;
                }
            }
        } finally {
            shutdown();
        }
    }

    /**
     * Executes one cycle.
     *
     * @return {@code false} if a stop signal was received
     */
    public boolean runCycle() {
        long n = ++cycle;
        Instant started = clock.instant();

        ControlSignal signal = control.check();
        if (signal.isStop()) {
            LOG.info("Stopping monitor: {}", signal.reason());
            stopRequested.set(true);
            return false;
        }
        if (signal.isPause()) {
            pausedUntil = started.plus(signal.pause());
            LOG.info("Polling paused until {}", LocalDateTime.ofInstant(pausedUntil, clock.getZone()));
        }

        watcher.refresh().ifPresent(this::applyRosterChanges);

        if (pausedUntil != null) {
            if (started.isBefore(pausedUntil)) {
                state = MonitorState.PAUSED;
                writeStatus();
                return true;
            }
            pausedUntil = null;
            LOG.info("Pause expired; resuming polling");
        }
        state = MonitorState.RUNNING;

        List<StreamerConfig> enabled = watcher.current().enabledStreamers();
        Map<String, Boolean> results = pollEngine.pollAll(enabled);
        int transitions = 0;
        for (StreamerConfig streamer : enabled) {
            boolean live = results.getOrDefault(streamer.username(), Boolean.FALSE);
            StabilityDecision decision = tracker.record(streamer.username(), live,
                    orchestrator.isRecording(streamer.username()));
            if (decision == StabilityDecision.CONFIRMED_LIVE) {
                transitions++;
                submitStart(streamer);
            } else if (decision == StabilityDecision.OFFLINE_OBSERVED) {
                transitions++;
            }
        }

        Duration took = Duration.between(started, clock.instant());
        metrics.recordCycle(took);
        Duration interval = watcher.settings().checkInterval();
        if (took.toMillis() > interval.toMillis() * SLOW_CYCLE_RATIO) {
            LOG.warn("Check cycle took {} ms, close to the {}s interval; consider a longer interval",
                    took.toMillis(), interval.toSeconds());
        }
        int every = watcher.settings().statusEveryCycles();
        if (transitions > 0 || n % every == 0) {
            logStatus(results);
        }
        writeStatus();
        return true;
    }

    private void applyRosterChanges(RosterDiff diff) {
        RosterSnapshot current = watcher.current();
        for (StreamerConfig gone : diff.toStop()) {
            String username = gone.username();
            boolean stillEnabled = current.enabledStreamers().stream()
                    .anyMatch(s -> s.username().equals(username));
            if (stillEnabled) {
                continue;
            }
            tracker.forget(username);
            if (orchestrator.isRecording(username)) {
                orchestrator.stop(username, StopReason.REMOVED_FROM_CONFIGURATION);
            }
        }
        for (StreamerConfig removed : diff.removed()) {
            if (current.byUsername(removed.username()).isEmpty()) {
                tracker.forget(removed.username());
            }
        }
        for (StreamerConfig added : diff.added()) {
            LOG.info("Now monitoring {}", added.username());
        }
        for (StreamerConfig enabled : diff.enabled()) {
            LOG.info("Re-enabled {}", enabled.username());
        }
    }

    private void submitStart(StreamerConfig streamer) {
        try {
            sessionExecutor.execute(() -> {
                try {
                    orchestrator.start(streamer);
                } catch (RuntimeException e) {
                    LOG.error("Unexpected error starting recording for {}", streamer.username(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Session executor rejected start for {}: {}", streamer.username(), e.toString());
        }
    }

    private void logStatus(Map<String, Boolean> results) {
        long live = results.values().stream().filter(Boolean::booleanValue).count();
        LOG.info("Status: {} live of {} checked, {} recording {}, {} pending disconnect(s)",
                live, results.size(), orchestrator.activeCount(), orchestrator.activeUsernames(),
                disconnects.pendingCount());
        if (LOG.isDebugEnabled()) {
            results.forEach((username, isLive) -> tracker.state(username).ifPresent(s -> {
                ThreadContext.put("streamer", username);
                LOG.debug("{}: live={} state={} consecutiveLive={} consecutiveOffline={}",
                        username, isLive, s.state(), s.consecutiveLive(), s.consecutiveOffline());
                ThreadContext.remove("streamer");
            }));
        }
    }

    void writeStatus() {
        Instant paused = pausedUntil;
        statusWriter.write(new MonitorStatus(
                LocalDateTime.ofInstant(clock.instant(), clock.getZone()).toString(),
                state.name(),
                paused == null ? null : LocalDateTime.ofInstant(paused, clock.getZone()).toString(),
                orchestrator.activeCount(),
                orchestrator.activeUsernames(),
                disconnects.pendingCount(),
                watcher.current().enabledStreamers().size(),
                cycle,
                ProcessHandle.current().pid()));
    }

    /**
     * @return {@code true} if woken by a stop request
     */
    private boolean sleepUnlessStopped(Duration sleep) {
        try {
            return wakeUp.await(sleep.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Monitor interrupted; shutting down");
            return true;
        }
    }

    /**
     * Cancels pending confirmations, stops every session and writes the final status. Runs once.
     */
    public void shutdown() {
        if (!shutdownDone.compareAndSet(false, true)) {
            return;
        }
        state = MonitorState.STOPPING;
        LOG.info("Shutting down monitor");
        try {
            disconnects.cancelAll();
            orchestrator.stopAll(StopReason.SHUTDOWN);
        } finally {
            state = MonitorState.STOPPED;
            writeStatus();
            terminated.countDown();
            LOG.info("Monitor stopped");
        }
    }

    /**
     * Asks the loop to exit after the current cycle; wakes it if sleeping.
     */
    public void requestStop() {
        stopRequested.set(true);
        wakeUp.countDown();
    }

    /**
     * @return {@code true} if shutdown completed within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public MonitorState state() {
        return state;
    }

    /**
     * @return end of the current pause, or {@code null} when not paused
     */
    public Instant pausedUntil() {
        return pausedUntil;
    }

    public long cycle() {
        return cycle;
    }
}
