package com.phillippitts.streamwatch.service.recording;

/**
 * Outcome of {@link RecordingOrchestrator#start}.
 */
public enum AdmissionResult {
    /** Session admitted and running. */
    STARTED,
    /** A session for the streamer already exists. */
    DUPLICATE,
    /** The concurrent-recording cap is reached. */
    CAP_REACHED,
    /** Admitted, but bringing the session up failed and was rolled back. */
    FAILED;

    public boolean isStarted() {
        return this == STARTED;
    }

    /**
     * @return tag used for metrics and log throttling keys
     */
    public String tag() {
        return switch (this) {
            case STARTED -> "started";
            case DUPLICATE -> "duplicate";
            case CAP_REACHED -> "cap";
            case FAILED -> "start-failed";
        };
    }
}
