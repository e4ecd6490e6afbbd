package com.phillippitts.streamwatch.exception;

/**
 * Thrown when a recording session cannot be brought up (sink creation, connect or capture start).
 * Partially opened resources are rolled back before this is surfaced.
 */
public class RecordingStartException extends StreamWatchException {

    private final String username;
    private final String stage;

    public RecordingStartException(String username, String stage, Throwable cause) {
        super("Failed to start recording for " + username + " (stage: " + stage + "): "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.username = username;
        this.stage = stage;
    }

    public String getUsername() {
        return username;
    }

    public String getStage() {
        return stage;
    }
}
