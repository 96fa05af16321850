package com.phillippitts.slawatch.domain;

/**
 * Kind of telemetry event shipped to the ingestion backend.
 */
public enum EventKind {
    /** A single response-time measurement for a channel. */
    MEASUREMENT,
    /** An SLA violation raised alongside the measurement that caused it. */
    ALERT
}
