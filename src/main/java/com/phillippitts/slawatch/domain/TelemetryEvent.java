package com.phillippitts.slawatch.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable structured event produced by the metrics collector and shipped by the telemetry client.
 *
 * <p>The {@code id} is an opaque unique token; it is the dedup hint used by the backlog when the
 * same event is delivered more than once (delivery is at-least-once).
 *
 * @param id        unique event id
 * @param channel   support channel the event belongs to (e.g. "chat")
 * @param kind      measurement or alert
 * @param timestamp when the event was created
 * @param payload   event attributes; copied on construction and never modified afterwards
 */
public record TelemetryEvent(
        String id,
        String channel,
        EventKind kind,
        Instant timestamp,
        Map<String, Object> payload
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if any component is null
     * @throws IllegalArgumentException if id or channel is blank
     */
    public TelemetryEvent {
        Objects.requireNonNull(id, "Event id must not be null");
        Objects.requireNonNull(channel, "Channel must not be null");
        Objects.requireNonNull(kind, "Event kind must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(payload, "Payload must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Event id must not be blank");
        }
        if (channel.isBlank()) {
            throw new IllegalArgumentException("Channel must not be blank");
        }
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Creates an event with a random id and the current time.
     *
     * @param channel channel name
     * @param kind    event kind
     * @param payload event attributes
     * @return new event
     */
    public static TelemetryEvent of(String channel, EventKind kind, Map<String, Object> payload) {
        return new TelemetryEvent(UUID.randomUUID().toString(), channel, kind, Instant.now(), payload);
    }
}
