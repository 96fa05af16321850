package com.phillippitts.slawatch.exception;

/**
 * Thrown when the local backlog cannot be written, read or updated (disk full, permissions).
 *
 * <p>This is the one failure the telemetry client surfaces to callers: the backlog is the last
 * line of durability, so losing it must be visible.
 */
public class LocalStorageException extends SlaWatchException {

    private final String location;

    public LocalStorageException(String message, String location) {
        super(message + " (location: " + location + ")");
        this.location = location;
    }

    public LocalStorageException(String message, String location, Throwable cause) {
        super(message + " (location: " + location + ")", cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
