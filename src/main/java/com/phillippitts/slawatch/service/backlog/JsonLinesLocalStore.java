package com.phillippitts.slawatch.service.backlog;

import com.phillippitts.slawatch.domain.LocalRecord;
import com.phillippitts.slawatch.exception.LocalStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * {@link LocalStore} backed by JSON-lines segment files in one directory.
 *
 * <p>Files:
 * <ul>
 *   <li>{@code telemetry-backlog-YYYYMMDD-NNN.jsonl} - segments, one record per line</li>
 *   <li>{@code backlog.index} - live segment names in creation order; replaced atomically</li>
 *   <li>{@code synced.log} - ids of delivered records, one per line (tombstones)</li>
 * </ul>
 *
 * <p>Every write opens the target file, writes one complete line, forces it to disk and closes
 * the file before returning. Writes are serialized by a single lock; encoding happens before the
 * lock is taken.
 *
 * <p>The in-memory index (segment of each id, unsynced count per segment) is rebuilt from disk on
 * construction, so a restarted process resumes the same backlog.
 */
public class JsonLinesLocalStore implements LocalStore {

    private static final Logger LOG = LogManager.getLogger(JsonLinesLocalStore.class);

    static final String INDEX_FILE = "backlog.index";
    static final String SYNCED_FILE = "synced.log";

    private final Path directory;
    private final RotationPolicy rotationPolicy;
    private final Duration retention;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();

    // Guarded by lock
    private final List<BacklogSegment> segments = new ArrayList<>();
    private final Map<String, BacklogSegment> segmentOf = new HashMap<>();
    private final Map<BacklogSegment, Integer> unsyncedPerSegment = new HashMap<>();
    private long activeBytes;

    // Read without the lock by lazy scans
    private final Set<String> syncedIds = ConcurrentHashMap.newKeySet();

    public JsonLinesLocalStore(Path directory, RotationPolicy rotationPolicy, Duration retention, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.rotationPolicy = Objects.requireNonNull(rotationPolicy, "rotationPolicy");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    @Override
    public void append(LocalRecord record) {
        Objects.requireNonNull(record, "record");
        String line = LocalRecordCodec.encode(record, clock.instant()) + '\n';
        byte[] bytes = line.getBytes(StandardCharsets.UTF_8);

        lock.lock();
        try {
            if (segmentOf.containsKey(record.id())) {
                LOG.debug("Record {} already in backlog; skipping duplicate append", record.id());
                return;
            }
            rotateIfNeeded();
            BacklogSegment target = activeSegment().orElseGet(this::startSegment);
            Path file = directory.resolve(target.fileName());
            writeDurably(file, bytes);
            activeBytes += bytes.length;
            segmentOf.put(record.id(), target);
            if (record.synced()) {
                syncedIds.add(record.id());
            } else {
                unsyncedPerSegment.merge(target, 1, Integer::sum);
            }
            LOG.debug("Appended record {} (channel={}, kind={}) to {}",
                    record.id(), record.event().channel(), record.event().kind(), file.getFileName());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Stream<LocalRecord> scanUnsynced() {
        List<BacklogSegment> pending;
        lock.lock();
        try {
            // Segments without unsynced records are skipped entirely
            pending = segments.stream()
                    .filter(s -> unsyncedPerSegment.getOrDefault(s, 0) > 0)
                    .toList();
        } finally {
            lock.unlock();
        }
        Set<String> seen = new HashSet<>();
        return pending.stream()
                .flatMap(this::readSegment)
                .filter(r -> !r.synced())
                .filter(r -> !syncedIds.contains(r.id()))
                .filter(r -> seen.add(r.id()));
    }

    @Override
    public void markSynced(String id) {
        Objects.requireNonNull(id, "id");
        lock.lock();
        try {
            if (syncedIds.contains(id)) {
                return;
            }
            BacklogSegment segment = segmentOf.get(id);
            if (segment == null) {
                LOG.debug("markSynced for unknown record {}; ignoring", id);
                return;
            }
            byte[] tombstone = (id + '\n').getBytes(StandardCharsets.UTF_8);
            writeDurably(directory.resolve(SYNCED_FILE), tombstone);
            syncedIds.add(id);
            unsyncedPerSegment.computeIfPresent(segment, (s, n) -> n > 1 ? n - 1 : null);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void rotateIfNeeded() {
        lock.lock();
        try {
            Optional<BacklogSegment> active = activeSegment();
            if (active.isEmpty()) {
                return;
            }
            if (rotationPolicy.shouldRotate(active.get(), activeBytes, today())) {
                BacklogSegment previous = active.get();
                BacklogSegment next = previous.next(today());
                writeDurably(directory.resolve(next.fileName()), new byte[0]);
                segments.add(next);
                writeIndex();
                activeBytes = 0L;
                LOG.info("Rotated backlog segment {} -> {} (policy={})",
                        previous.fileName(), next.fileName(), rotationPolicy.getMode());
                purgeExpiredLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void purgeExpired() {
        lock.lock();
        try {
            purgeExpiredLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int unsyncedCount() {
        lock.lock();
        try {
            return unsyncedPerSegment.values().stream().mapToInt(Integer::intValue).sum();
        } finally {
            lock.unlock();
        }
    }

    /** Visible for tests */
    List<BacklogSegment> segments() {
        lock.lock();
        try {
            return List.copyOf(segments);
        } finally {
            lock.unlock();
        }
    }

    Path directory() {
        return directory;
    }

    private void purgeExpiredLocked() {
        LocalDate cutoff = today().minusDays(Math.max(retention.toDays(), 0));
        Optional<BacklogSegment> active = activeSegment();
        List<BacklogSegment> expired = new ArrayList<>();
        for (BacklogSegment segment : segments) {
            if (active.isPresent() && segment.equals(active.get())) {
                continue;
            }
            if (!segment.day().isBefore(cutoff)) {
                continue;
            }
            int unsynced = unsyncedPerSegment.getOrDefault(segment, 0);
            if (unsynced > 0) {
                LOG.warn("Backlog segment {} is past retention but still holds {} unsynced records; keeping it",
                        segment.fileName(), unsynced);
                continue;
            }
            expired.add(segment);
        }
        if (expired.isEmpty()) {
            return;
        }
        segments.removeAll(expired);
        writeIndex();
        Set<BacklogSegment> expiredSet = Set.copyOf(expired);
        segmentOf.entrySet().removeIf(e -> {
            if (expiredSet.contains(e.getValue())) {
                syncedIds.remove(e.getKey());
                return true;
            }
            return false;
        });
        rewriteSyncedLog();
        for (BacklogSegment segment : expired) {
            try {
                Files.deleteIfExists(directory.resolve(segment.fileName()));
                LOG.info("Removed expired backlog segment {}", segment.fileName());
            } catch (IOException e) {
                LOG.error("Could not delete expired backlog segment {}: {}", segment.fileName(), e.toString());
            }
        }
    }

    private Stream<LocalRecord> readSegment(BacklogSegment segment) {
        Path file = directory.resolve(segment.fileName());
        try {
            return Files.lines(file, StandardCharsets.UTF_8)
                    .filter(line -> !line.isBlank())
                    .map(line -> decodeOrNull(line, segment))
                    .filter(Objects::nonNull);
        } catch (NoSuchFileException e) {
            LOG.warn("Backlog segment {} disappeared during scan", segment.fileName());
            return Stream.empty();
        } catch (IOException e) {
            throw new LocalStorageException("Cannot read backlog segment", file.toString(), e);
        }
    }

    private static LocalRecord decodeOrNull(String line, BacklogSegment segment) {
        try {
            return LocalRecordCodec.decode(line);
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping malformed line in {}: {}", segment.fileName(), e.getMessage());
            return null;
        }
    }

    private Optional<BacklogSegment> activeSegment() {
        return segments.isEmpty() ? Optional.empty() : Optional.of(segments.get(segments.size() - 1));
    }

    // Caller must hold the lock
    private BacklogSegment startSegment() {
        BacklogSegment first = new BacklogSegment(today(), 1);
        writeDurably(directory.resolve(first.fileName()), new byte[0]);
        segments.add(first);
        writeIndex();
        activeBytes = 0L;
        LOG.info("Started backlog segment {}", first.fileName());
        return first;
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private void writeDurably(Path file, byte[] bytes) {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException e) {
            LOG.error("CRITICAL: backlog write failed for {}: {}", file, e.toString());
            throw new LocalStorageException("Cannot write backlog file", file.toString(), e);
        }
    }

    private void writeIndex() {
        StringBuilder sb = new StringBuilder();
        for (BacklogSegment segment : segments) {
            sb.append(segment.fileName()).append('\n');
        }
        replaceAtomically(directory.resolve(INDEX_FILE), sb.toString());
    }

    private void rewriteSyncedLog() {
        StringBuilder sb = new StringBuilder();
        for (String id : syncedIds) {
            sb.append(id).append('\n');
        }
        replaceAtomically(directory.resolve(SYNCED_FILE), sb.toString());
    }

    private void replaceAtomically(Path target, String content) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            LOG.error("CRITICAL: could not replace {}: {}", target, e.toString());
            throw new LocalStorageException("Cannot update backlog metadata", target.toString(), e);
        }
    }

    private void recover() {
        try {
            Files.createDirectories(directory);
            Path syncedFile = directory.resolve(SYNCED_FILE);
            if (Files.exists(syncedFile)) {
                try (Stream<String> lines = Files.lines(syncedFile, StandardCharsets.UTF_8)) {
                    lines.map(String::trim).filter(s -> !s.isEmpty()).forEach(syncedIds::add);
                }
            }
            Path indexFile = directory.resolve(INDEX_FILE);
            if (Files.exists(indexFile)) {
                try (BufferedReader reader = Files.newBufferedReader(indexFile, StandardCharsets.UTF_8)) {
                    String name;
                    while ((name = reader.readLine()) != null) {
                        Optional<BacklogSegment> parsed = BacklogSegment.parse(name);
                        if (parsed.isEmpty()) {
                            if (!name.isBlank()) {
                                LOG.warn("Ignoring unrecognized backlog index entry '{}'", name);
                            }
                            continue;
                        }
                        if (!Files.exists(directory.resolve(parsed.get().fileName()))) {
                            LOG.warn("Backlog segment {} listed in index is missing", name);
                            continue;
                        }
                        segments.add(parsed.get());
                    }
                }
            }
            for (BacklogSegment segment : segments) {
                loadSegment(segment);
            }
            Optional<BacklogSegment> active = activeSegment();
            if (active.isPresent()) {
                Path activeFile = directory.resolve(active.get().fileName());
                repairTrailingNewline(activeFile);
                activeBytes = Files.size(activeFile);
            }
            writeIndex();
        } catch (IOException | UncheckedIOException e) {
            throw new LocalStorageException("Cannot open backlog", directory.toString(), e);
        }
        int unsynced = unsyncedPerSegment.values().stream().mapToInt(Integer::intValue).sum();
        LOG.info("Backlog opened at {} (segments={}, unsynced={})", directory, segments.size(), unsynced);
    }

    private void loadSegment(BacklogSegment segment) throws IOException {
        try (Stream<LocalRecord> records = Files.lines(directory.resolve(segment.fileName()), StandardCharsets.UTF_8)
                .filter(line -> !line.isBlank())
                .map(line -> decodeOrNull(line, segment))
                .filter(Objects::nonNull)) {
            records.forEach(r -> {
                if (segmentOf.putIfAbsent(r.id(), segment) != null) {
                    return;
                }
                if (r.synced()) {
                    syncedIds.add(r.id());
                } else if (!syncedIds.contains(r.id())) {
                    unsyncedPerSegment.merge(segment, 1, Integer::sum);
                }
            });
        }
    }

    // A crash mid-write can leave a partial last line; terminate it so the next append starts clean
    private static void repairTrailingNewline(Path file) throws IOException {
        long size = Files.size(file);
        if (size == 0) {
            return;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last, size - 1);
            if (last.get(0) != '\n') {
                LOG.warn("Backlog segment {} ends with a partial line; terminating it", file.getFileName());
                channel.write(ByteBuffer.wrap(new byte[]{'\n'}), size);
                channel.force(true);
            }
        }
    }
}
