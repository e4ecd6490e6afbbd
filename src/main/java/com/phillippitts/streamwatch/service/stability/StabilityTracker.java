package com.phillippitts.streamwatch.service.stability;

import com.phillippitts.streamwatch.config.roster.MonitorSettings;
import com.phillippitts.streamwatch.config.roster.SettingsSource;
import com.phillippitts.streamwatch.service.metrics.MonitorMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debounces raw poll results into confirmed-live decisions.
 *
 * <p><b>Rules</b> (applied per sample, per streamer):
 * <ol>
 *   <li>The sample is appended to a trailing window that keeps {@code stability_window_seconds} of
 *       history, so the debounce does not depend on cycle latency.</li>
 *   <li>A live sample increments {@code consecutiveLive} and zeroes {@code consecutiveOffline};
 *       an offline sample does the reverse.</li>
 *   <li>{@link StabilityDecision#CONFIRMED_LIVE} is returned only when the streamer is not being
 *       recorded, {@code consecutiveLive >= stability_threshold}, and at least
 *       {@code cooldown_seconds} have passed since the last confirmation. Returning it records the
 *       confirmation time, which gates the next one.</li>
 *   <li>Offline runs never produce a stop. Reaching the threshold yields
 *       {@link StabilityDecision#OFFLINE_OBSERVED} once per run, for logging only.</li>
 * </ol>
 *
 * <p><b>Threading:</b> {@link #record} is called by the control loop only. Read accessors are safe
 * from any thread but may observe a state mid-update.
 */
public class StabilityTracker {

    private static final Logger LOG = LogManager.getLogger(StabilityTracker.class);

    private final SettingsSource settingsSource;
    private final Clock clock;
    private final MonitorMetrics metrics;
    private final Map<String, StabilityState> states = new ConcurrentHashMap<>();

    public StabilityTracker(SettingsSource settingsSource, Clock clock, MonitorMetrics metrics) {
        this.settingsSource = Objects.requireNonNull(settingsSource, "settingsSource");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics == null ? MonitorMetrics.NOOP : metrics;
    }

    /**
     * Feeds one poll result.
     *
     * @param username streamer
     * @param live poll result
     * @param recording whether a session for the streamer is currently active
     * @return decision for the control loop
     */
    public StabilityDecision record(String username, boolean live, boolean recording) {
        MonitorSettings settings = settingsSource.settings();
        int threshold = settings.stabilityThreshold();
        Instant now = clock.instant();

        StabilityState s = states.computeIfAbsent(username, StabilityState::new);
        s.append(new StabilityState.Sample(now, live), settings.stabilityWindow());

        if (live) {
            return onLive(s, threshold, settings.cooldown(), now, recording);
        }
        return onOffline(s, threshold);
    }

    private StabilityDecision onLive(StabilityState s, int threshold, Duration cooldown,
                                     Instant now, boolean recording) {
        if (s.consecutiveLive() < threshold) {
            s.setState(LivenessState.UNCONFIRMED);
            return StabilityDecision.NONE;
        }
        s.setState(LivenessState.CONFIRMED_LIVE);
        if (recording) {
            return StabilityDecision.NONE;
        }
        if (s.lastAction() != null) {
            Duration since = Duration.between(s.lastAction(), now);
            if (since.compareTo(cooldown) < 0) {
                LOG.debug("{} live but in cooldown ({}s of {}s)", s.username(),
                        since.toSeconds(), cooldown.toSeconds());
                return StabilityDecision.NONE;
            }
        }
        s.markAction(now);
        metrics.incrementConfirmedLive();
        LOG.info("{} confirmed live ({} consecutive checks)", s.username(), s.consecutiveLive());
        return StabilityDecision.CONFIRMED_LIVE;
    }

    private StabilityDecision onOffline(StabilityState s, int threshold) {
        if (s.consecutiveOffline() < threshold) {
            s.setState(LivenessState.UNCONFIRMED);
            return StabilityDecision.NONE;
        }
        s.setState(LivenessState.CONFIRMED_OFFLINE);
        if (s.consecutiveOffline() == threshold) {
            LOG.debug("{} appears offline ({} consecutive checks); waiting for disconnect or end signal",
                    s.username(), s.consecutiveOffline());
            return StabilityDecision.OFFLINE_OBSERVED;
        }
        return StabilityDecision.NONE;
    }

    public Optional<StabilityState> state(String username) {
        return Optional.ofNullable(states.get(username));
    }

    /**
     * Drops all state for a streamer, so that a later re-add starts a fresh debounce cycle.
     */
    public void forget(String username) {
        if (states.remove(username) != null) {
            LOG.debug("Dropped stability state for {}", username);
        }
    }

    public int trackedCount() {
        return states.size();
    }
}
