package com.phillippitts.streamwatch.service.stability;

/**
 * Outcome of feeding one sample to the {@link StabilityTracker}.
 */
public enum StabilityDecision {
    /** Nothing to act on. */
    NONE,
    /** One-shot signal: the streamer is durably live and a recording should be started. */
    CONFIRMED_LIVE,
    /**
     * The streamer has just reached the offline threshold. Telemetry only; sessions are never
     * stopped on polling evidence.
     */
    OFFLINE_OBSERVED
}
