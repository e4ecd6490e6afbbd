package com.phillippitts.streamwatch.service.stability;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-streamer debounce state: the trailing sample window, the two consecutive-result counters
 * and the time of the last confirmed action.
 *
 * <p>Mutated only by {@link StabilityTracker}; readers outside the package get the accessors.
 * At most one of the two counters is non-zero at any time.
 */
public final class StabilityState {

    /**
     * One poll observation.
     */
    public record Sample(Instant at, boolean live) {
    }

    private final String username;
    private final Deque<Sample> window = new ArrayDeque<>();
    private int consecutiveLive;
    private int consecutiveOffline;
    private Instant lastAction;
    private LivenessState state = LivenessState.UNCONFIRMED;

    StabilityState(String username) {
        this.username = username;
    }

    void append(Sample sample, Duration retention) {
        window.addLast(sample);
        Instant cutoff = sample.at().minus(retention);
        while (!window.isEmpty() && window.peekFirst().at().isBefore(cutoff)) {
            window.removeFirst();
        }
        if (sample.live()) {
            consecutiveLive++;
            consecutiveOffline = 0;
        } else {
            consecutiveOffline++;
            consecutiveLive = 0;
        }
    }

    void markAction(Instant at) {
        this.lastAction = at;
    }

    void setState(LivenessState state) {
        this.state = state;
    }

    public String username() {
        return username;
    }

    public int consecutiveLive() {
        return consecutiveLive;
    }

    public int consecutiveOffline() {
        return consecutiveOffline;
    }

    /**
     * @return time of the last confirmed-live signal, or {@code null} if never confirmed
     */
    public Instant lastAction() {
        return lastAction;
    }

    public LivenessState state() {
        return state;
    }

    public int windowSize() {
        return window.size();
    }

    /**
     * @return fraction of live samples in the trailing window, 0 when empty
     */
    public double liveRatio() {
        if (window.isEmpty()) {
            return 0.0;
        }
        long live = window.stream().filter(Sample::live).count();
        return (double) live / window.size();
    }

    @Override
    public String toString() {
        return "StabilityState{" + username + ", state=" + state + ", live=" + consecutiveLive
                + ", offline=" + consecutiveOffline + ", lastAction=" + lastAction + '}';
    }
}
