package com.phillippitts.streamwatch.exception;

/**
 * Thrown by live-stream client implementations when connecting, probing or disconnecting fails.
 */
public class LiveClientException extends StreamWatchException {

    public LiveClientException(String message) {
        super(message);
    }

    public LiveClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
