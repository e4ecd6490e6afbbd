package com.phillippitts.streamwatch.service.recording;

/**
 * Why a recording session ended. The label appears in logs and, with spaces replaced by
 * underscores, in the summary log action ({@code recording_stopped_<label>}).
 */
public enum StopReason {
    DISCONNECT_CONFIRMED("disconnect confirmed"),
    OFFICIAL_END("official end"),
    REMOVED_FROM_CONFIGURATION("removed from configuration"),
    SHUTDOWN("shutdown"),
    RECONNECT_FAILED("reconnect failed"),
    MANUAL("manual");

    private final String label;

    StopReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String actionSuffix() {
        return label.replace(' ', '_');
    }

    @Override
    public String toString() {
        return label;
    }
}
