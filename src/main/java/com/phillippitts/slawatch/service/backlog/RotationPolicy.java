package com.phillippitts.slawatch.service.backlog;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Decides when the active backlog segment is complete.
 *
 * <p>The day boundary is UTC midnight. With {@link Mode#DAILY_OR_SIZE} whichever limit is reached
 * first wins.
 */
public final class RotationPolicy {

    public enum Mode { DAILY, SIZE, DAILY_OR_SIZE }

    private final Mode mode;
    private final long maxBytes;

    public RotationPolicy(Mode mode, long maxBytes) {
        this.mode = Objects.requireNonNull(mode, "mode");
        if (mode != Mode.DAILY && maxBytes <= 0) {
            throw new IllegalArgumentException("Max segment size must be positive, got: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    /**
     * @param active      the segment currently receiving appends
     * @param activeBytes current size of the active segment
     * @param today       current UTC date
     * @return true if the next append must go to a new segment
     */
    public boolean shouldRotate(BacklogSegment active, long activeBytes, LocalDate today) {
        boolean dayChanged = !active.day().equals(today);
        boolean full = activeBytes >= maxBytes;
        return switch (mode) {
            case DAILY -> dayChanged;
            case SIZE -> full;
            case DAILY_OR_SIZE -> dayChanged || full;
        };
    }

    public Mode getMode() {
        return mode;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
