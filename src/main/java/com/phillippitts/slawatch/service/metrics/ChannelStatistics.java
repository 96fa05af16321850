package com.phillippitts.slawatch.service.metrics;

import com.phillippitts.slawatch.util.TimeUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running response-time aggregates for one channel. Thread-safe.
 */
public final class ChannelStatistics {

    private long count;
    private double sumSeconds;
    private double minSeconds;
    private double maxSeconds;
    private long violations;

    synchronized Snapshot record(Duration elapsed, boolean violation) {
        double seconds = TimeUtils.toSeconds(elapsed);
        if (count == 0) {
            minSeconds = seconds;
            maxSeconds = seconds;
        } else {
            minSeconds = Math.min(minSeconds, seconds);
            maxSeconds = Math.max(maxSeconds, seconds);
        }
        count++;
        sumSeconds += seconds;
        if (violation) {
            violations++;
        }
        return snapshot();
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(count, count == 0 ? 0.0 : sumSeconds / count,
                minSeconds, maxSeconds, violations);
    }

    /**
     * Point-in-time view of a channel's aggregates. All times are in seconds; an empty channel
     * reports zeros.
     */
    public record Snapshot(long count, double mean, double min, double max, long slaViolations) {

        Map<String, Object> toPayload() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("mean", mean);
            m.put("min", min);
            m.put("max", max);
            m.put("count", count);
            m.put("sla_violations", slaViolations);
            return m;
        }
    }
}
