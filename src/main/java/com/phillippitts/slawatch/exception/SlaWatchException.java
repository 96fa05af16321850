package com.phillippitts.slawatch.exception;

/**
 * Base exception for all slawatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SlaWatchException extends RuntimeException {

    public SlaWatchException(String message) {
        super(message);
    }

    public SlaWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlaWatchException(Throwable cause) {
        super(cause);
    }
}
