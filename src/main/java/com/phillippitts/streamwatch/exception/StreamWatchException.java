package com.phillippitts.streamwatch.exception;

/**
 * Base exception for all StreamWatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StreamWatchException extends RuntimeException {

    public StreamWatchException(String message) {
        super(message);
    }

    public StreamWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamWatchException(Throwable cause) {
        super(cause);
    }
}
