package com.phillippitts.streamwatch.exception;

/**
 * Thrown when a single liveness probe attempt fails (timeout, transport error, malformed response).
 * Never escapes the prober: failures are retried and finally collapse to "not live".
 */
public class ProbeException extends StreamWatchException {

    private final String username;
    private final int attempt;

    public ProbeException(String username, int attempt, String message, Throwable cause) {
        super("Probe attempt " + attempt + " for " + username + " failed: " + message, cause);
        this.username = username;
        this.attempt = attempt;
    }

    public String getUsername() {
        return username;
    }

    public int getAttempt() {
        return attempt;
    }
}
