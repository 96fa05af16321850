package com.phillippitts.slawatch.service.telemetry;

/**
 * Outcome of one backlog resync cycle.
 *
 * @param delivered  records delivered and marked synced in this cycle
 * @param discarded  records tombstoned because the backend rejected them as invalid
 * @param remaining  unsynced records left in the backlog afterwards
 * @param stopReason why the cycle ended before the backlog was empty, or null
 * @param skipped    true when another resync was already running and this one did nothing
 */
public record ResyncReport(
        int delivered,
        int discarded,
        int remaining,
        String stopReason,
        boolean skipped
) {

    public static ResyncReport skipped(int remaining) {
        return new ResyncReport(0, 0, remaining, "resync-in-progress", true);
    }

    public boolean drained() {
        return remaining == 0;
    }
}
