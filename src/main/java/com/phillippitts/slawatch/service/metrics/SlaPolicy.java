package com.phillippitts.slawatch.service.metrics;

import java.time.Duration;

/** SLA rule: a response violates the SLA when it takes strictly longer than the threshold. */
public final class SlaPolicy {
    private SlaPolicy() {}

    public static boolean isViolation(Duration elapsed, Duration threshold) {
        return elapsed.compareTo(threshold) > 0;
    }
}
