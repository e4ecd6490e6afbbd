package com.phillippitts.streamwatch.service.stability;

/**
 * Debounced view of one streamer's on-air status.
 */
public enum LivenessState {
    /** Not enough identical samples yet, or the last run was broken. */
    UNCONFIRMED,
    /** At least {@code stability_threshold} consecutive offline samples. */
    CONFIRMED_OFFLINE,
    /** At least {@code stability_threshold} consecutive live samples. */
    CONFIRMED_LIVE
}
