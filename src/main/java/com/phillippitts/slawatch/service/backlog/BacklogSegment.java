package com.phillippitts.slawatch.service.backlog;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One backlog file: a UTC calendar day plus a sequence number within that day.
 *
 * <p>File names look like {@code telemetry-backlog-20240131-002.jsonl}; the name encodes the
 * rotation date so segments sort chronologically.
 */
public record BacklogSegment(LocalDate day, int sequence) implements Comparable<BacklogSegment> {

    static final String PREFIX = "telemetry-backlog-";
    static final String SUFFIX = ".jsonl";

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern NAME = Pattern.compile("telemetry-backlog-(\\d{8})-(\\d{3,})\\.jsonl");

    public BacklogSegment {
        Objects.requireNonNull(day, "day");
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be >= 1, got: " + sequence);
        }
    }

    public String fileName() {
        return PREFIX + DAY_FORMAT.format(day) + '-' + String.format("%03d", sequence) + SUFFIX;
    }

    /**
     * Returns the segment that follows this one: the next sequence on the same day, or the first
     * sequence of {@code today} when the day has changed.
     */
    public BacklogSegment next(LocalDate today) {
        return day.equals(today) ? new BacklogSegment(day, sequence + 1) : new BacklogSegment(today, 1);
    }

    public static Optional<BacklogSegment> parse(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher m = NAME.matcher(fileName.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new BacklogSegment(LocalDate.parse(m.group(1), DAY_FORMAT), Integer.parseInt(m.group(2))));
    }

    @Override
    public int compareTo(BacklogSegment other) {
        int byDay = day.compareTo(other.day);
        return byDay != 0 ? byDay : Integer.compare(sequence, other.sequence);
    }
}
