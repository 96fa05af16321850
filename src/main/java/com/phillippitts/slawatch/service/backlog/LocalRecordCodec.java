package com.phillippitts.slawatch.service.backlog;

import com.phillippitts.slawatch.domain.EventKind;
import com.phillippitts.slawatch.domain.LocalRecord;
import com.phillippitts.slawatch.domain.TelemetryEvent;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Converts backlog records to and from single-line JSON.
 *
 * <p>Line format (one object per line, stable across restarts):
 * {@code {"id","channel","kind","timestamp","payload","synced","attempt_count","saved_at","reason"}}.
 */
final class LocalRecordCodec {

    static final String ID = "id";
    static final String CHANNEL = "channel";
    static final String KIND = "kind";
    static final String TIMESTAMP = "timestamp";
    static final String PAYLOAD = "payload";
    static final String SYNCED = "synced";
    static final String ATTEMPT_COUNT = "attempt_count";
    static final String SAVED_AT = "saved_at";
    static final String REASON = "reason";

    private LocalRecordCodec() {}

    /**
     * Encodes a record as one JSON line without the trailing newline.
     */
    static String encode(LocalRecord record, Instant savedAt) {
        TelemetryEvent event = record.event();
        JSONObject obj = new JSONObject();
        obj.put(ID, event.id());
        obj.put(CHANNEL, event.channel());
        obj.put(KIND, event.kind().name());
        obj.put(TIMESTAMP, event.timestamp().toString());
        obj.put(PAYLOAD, new JSONObject(event.payload()));
        obj.put(SYNCED, record.synced());
        obj.put(ATTEMPT_COUNT, record.attemptCount());
        obj.put(SAVED_AT, savedAt.toString());
        obj.put(REASON, record.reason());
        // org.json never emits raw newlines inside strings, so the line stays self-delimited
        return obj.toString();
    }

    /**
     * Decodes one line.
     *
     * @throws IllegalArgumentException if the line is not a valid record
     */
    static LocalRecord decode(String line) {
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("Blank backlog line");
        }
        try {
            JSONObject obj = new JSONObject(line);
            JSONObject payload = obj.optJSONObject(PAYLOAD);
            Map<String, Object> payloadMap = payload == null ? Map.of() : payload.toMap();
            TelemetryEvent event = new TelemetryEvent(
                    obj.getString(ID),
                    obj.getString(CHANNEL),
                    EventKind.valueOf(obj.getString(KIND)),
                    Instant.parse(obj.getString(TIMESTAMP)),
                    payloadMap
            );
            return new LocalRecord(event, obj.optBoolean(SYNCED, false), obj.optInt(ATTEMPT_COUNT, 0),
                    obj.optString(REASON, "unknown"));
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed backlog line: " + e.getMessage(), e);
        }
    }
}
