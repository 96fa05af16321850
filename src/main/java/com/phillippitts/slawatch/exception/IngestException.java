package com.phillippitts.slawatch.exception;

import java.util.Objects;

/**
 * Thrown by an ingestion client when the remote backend does not acknowledge an event.
 *
 * <p>Only {@link Kind#NETWORK}, {@link Kind#SERVER} and {@link Kind#RATE_LIMIT} are retriable and
 * count toward the circuit breaker. {@link Kind#AUTH} and {@link Kind#VALIDATION} are reported
 * without retry.
 */
public class IngestException extends SlaWatchException {

    public enum Kind {
        NETWORK(true),
        SERVER(true),
        RATE_LIMIT(true),
        AUTH(false),
        VALIDATION(false);

        private final boolean retriable;

        Kind(boolean retriable) {
            this.retriable = retriable;
        }

        public boolean isRetriable() {
            return retriable;
        }
    }

    private final Kind kind;

    public IngestException(Kind kind, String message) {
        super(message + " (kind: " + kind + ")");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public IngestException(Kind kind, String message, Throwable cause) {
        super(message + " (kind: " + kind + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetriable() {
        return kind.isRetriable();
    }
}
