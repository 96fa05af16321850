package com.phillippitts.slawatch.service.backlog;

import com.phillippitts.slawatch.domain.LocalRecord;
import com.phillippitts.slawatch.exception.LocalStorageException;

import java.util.stream.Stream;

/**
 * Durable, append-only backlog of telemetry events that could not be delivered.
 *
 * <p>Implementations must be safe for concurrent use by multiple senders within one process.
 * Access from several processes at once is not supported.
 */
public interface LocalStore {

    /**
     * Appends a record. The record is durable when this method returns.
     * Appending an id that is already stored is a no-op.
     *
     * @throws LocalStorageException if the record could not be persisted
     */
    void append(LocalRecord record);

    /**
     * Lazily streams unsynced records in stored order (older segments first, append order within
     * a segment). Each call re-reads persisted segments. Callers must close the stream.
     *
     * @throws LocalStorageException if the backlog cannot be read
     */
    Stream<LocalRecord> scanUnsynced();

    /**
     * Marks a record as delivered so later scans skip it. Idempotent.
     *
     * @throws LocalStorageException if the tombstone could not be persisted
     */
    void markSynced(String id);

    /**
     * Starts a new segment when the rotation policy says the active one is complete.
     * Called before every append.
     */
    void rotateIfNeeded();

    /**
     * Deletes closed segments that are fully synced and older than the retention period.
     */
    void purgeExpired();

    /**
     * Number of records currently awaiting resync.
     */
    int unsyncedCount();
}
