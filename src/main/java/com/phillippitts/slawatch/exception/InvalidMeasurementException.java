package com.phillippitts.slawatch.exception;

/**
 * Thrown when a response-time measurement cannot be recorded (blank channel, negative or
 * non-finite elapsed time).
 */
public class InvalidMeasurementException extends SlaWatchException {

    public InvalidMeasurementException(String message) {
        super(message);
    }
}
