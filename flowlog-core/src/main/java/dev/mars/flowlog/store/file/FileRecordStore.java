/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.flowlog.store.file;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.model.SnapshotMeta;
import dev.mars.flowlog.model.StatePointer;
import dev.mars.flowlog.store.ChildLineagePolicy;
import dev.mars.flowlog.store.FlowStoreConfig;
import dev.mars.flowlog.store.LineageTable;
import dev.mars.flowlog.store.Mutation;
import dev.mars.flowlog.store.NotFoundException;
import dev.mars.flowlog.store.RecordSequence;
import dev.mars.flowlog.store.RecordStore;
import dev.mars.flowlog.store.ReplayStart;
import dev.mars.flowlog.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.zip.CRC32C;

/**
 * Durable {@link RecordStore} backed by an append-only journal.
 * <p>
 * Every accepted write is one journal entry describing the {@link Mutation} it made.
 * The in-memory {@link LineageTable} is the read model; on {@link #open()} it is
 * rebuilt by replaying the journal from the start.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ flowlog.lock     // exclusive process lock
 *  └─ flowlog.journal  // append-only: one entry per accepted write
 * </pre>
 * <p>
 * <b>Entry format:</b>
 * <pre>
 * MAGIC(4) VERSION(2) TYPE(1) SEQUENCE(8) PAYLOAD_LEN(4) PAYLOAD(var, JSON) CRC32C(4)
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * All write operations are serialized through a single-threaded executor, so
 * journal order is apply order. Reads are answered from the table on the caller's
 * thread without waiting for writers.
 * <p>
 * <b>Durability:</b> a write's future completes only after its entry is written and,
 * with sync enabled, forced to disk. If writing fails, nothing is applied and the
 * partial entry is cut off again.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock prevents two processes from writing the same journal.</li>
 *   <li><b>Disk Space Checking:</b> Checked on open and before large writes.</li>
 *   <li><b>Read-After-Write Verification:</b> Optional CRC check of every entry just written.</li>
 *   <li><b>Torn-tail recovery:</b> Replay stops at the first incomplete or corrupt entry and truncates the rest.</li>
 * </ul>
 *
 * @see RecordStore
 */
public final class FileRecordStore implements RecordStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileRecordStore.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Magic number: 'FLOW' in ASCII */
    private static final int MAGIC = 0x464C4F57;

    /** Entry format version */
    private static final short VERSION = 1;

    /** Header size: MAGIC(4) + VERSION(2) + TYPE(1) + SEQUENCE(8) + PAYLOAD_LEN(4) */
    private static final int HEADER_SIZE = 4 + 2 + 1 + 8 + 4;

    /** CRC size */
    private static final int CRC_SIZE = 4;

    /** Lock file name */
    private static final String LOCK_FILE = "flowlog.lock";

    /** Journal file name */
    private static final String JOURNAL_FILE = "flowlog.journal";

    /** How long close() waits for pending writes */
    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Single-threaded executor for all journal operations.
     * <p>
     * <b>INVARIANT:</b> open, replay and every write run here, one at a time, so the
     * journal channel position is always the end of the last complete entry.
     * <b>DO NOT</b> increase the pool size or add parallel write paths.
     */
    private final ExecutorService walExecutor;
    private final FlowStoreConfig config;
    private final ChildLineagePolicy childPolicy;
    private final Clock clock;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int maxPayloadSize;
    private final long minFreeSpace;

    private final LineageTable table = new LineageTable();

    private Path dataDir;
    private FileChannel journalChannel;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private long nextSequence = 1;
    private volatile boolean opened = false;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a store with configuration loaded from system properties, environment
     * variables, properties file, or defaults.
     *
     * @see FlowStoreConfig
     */
    public FileRecordStore() {
        this(FlowStoreConfig.load());
    }

    public FileRecordStore(FlowStoreConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config storage configuration
     * @param clock  source of creation timestamps
     */
    public FileRecordStore(FlowStoreConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.childPolicy = config.childPolicy();
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.maxPayloadSize = config.maxPayloadSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();

        this.walExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "flowlog-journal");
            t.setDaemon(true);
            return t;
        });

        LOG.info("FileRecordStore initialized: syncEnabled={}, verifyWrites={}, maxPayloadSize={} MB, minFreeSpace={} MB, childPolicy={}",
                syncEnabled, verifyWrites, maxPayloadSize / 1024 / 1024, minFreeSpace / 1024 / 1024, childPolicy);

        if (!syncEnabled) {
            LOG.warn("FileRecordStore created with fsync DISABLED. Do NOT use in production!");
        }
        if (verifyWrites) {
            LOG.info("Write verification enabled (slower but safer)");
        }
    }

    public FlowStoreConfig config() {
        return config;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the store in the data directory from the configuration.
     *
     * @return a future that completes when the journal has been replayed
     */
    public CompletableFuture<Void> open() {
        return open(config.dataDir());
    }

    /**
     * Locks {@code dataDir}, replays its journal (truncating a torn tail) and readies
     * the store for writes.
     */
    public CompletableFuture<Void> open(Path dataDir) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Store is closed"));
        }
        return CompletableFuture.runAsync(() -> {
            if (opened) {
                throw new StorageException("Store already open at " + this.dataDir);
            }
            try {
                LOG.info("Opening journal at: {}", dataDir);
                this.dataDir = dataDir;
                Files.createDirectories(dataDir);
                LOG.debug("Created/verified data directory: {}", dataDir);

                acquireExclusiveLock();
                checkDiskSpace();

                Path journalPath = dataDir.resolve(JOURNAL_FILE);
                this.journalChannel = FileChannel.open(journalPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.READ,
                        StandardOpenOption.WRITE);

                replayJournal(journalPath);

                journalChannel.position(journalChannel.size());
                opened = true;
                LOG.info("Journal opened successfully: path={}, size={} bytes, lineages={}",
                        journalPath, journalChannel.size(), table.lineageCount());

            } catch (IOException e) {
                LOG.error("Failed to open journal at {}: {}", dataDir, e.getMessage(), e);
                closeJournalChannel();
                releaseExclusiveLock();
                throw new StorageException("Failed to open journal at " + dataDir, e);
            } catch (RuntimeException e) {
                LOG.error("Failed to open journal at {}: {}", dataDir, e.getMessage(), e);
                closeJournalChannel();
                releaseExclusiveLock();
                throw e;
            }
        }, walExecutor);
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing journal at: {}", dataDir);

        walExecutor.execute(() -> {
            opened = false;
            closeJournalChannel();
            releaseExclusiveLock();
        });

        walExecutor.shutdown();
        try {
            // the lock must be released before close() returns, so the directory can be reopened at once
            if (!walExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Journal executor did not stop within {} s", CLOSE_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the journal to close");
        }
        LOG.info("Journal closed");
    }

    // ========================================================================
    // Lineages
    // ========================================================================

    @Override
    public CompletableFuture<UUID> createLineage(String name, String status, String createdBy, JsonNode metadata) {
        return write(() -> table.create(
                LineageMeta.root(UUID.randomUUID(), name, status, createdBy, metadata, clock.instant()),
                this::writeEntry).id());
    }

    @Override
    public CompletableFuture<LineageMeta> getLineage(UUID lineageId) {
        return read(() -> table.find(lineageId).orElseThrow(() -> NotFoundException.lineage(lineageId)));
    }

    @Override
    public CompletableFuture<Optional<LineageMeta>> findLineage(UUID lineageId) {
        return read(() -> table.find(lineageId));
    }

    @Override
    public CompletableFuture<Boolean> lineageExists(UUID lineageId) {
        return read(() -> table.find(lineageId).isPresent());
    }

    @Override
    public CompletableFuture<Long> countRecords(UUID lineageId) {
        return read(() -> table.countRecords(lineageId));
    }

    @Override
    public CompletableFuture<LineageMeta> setStatus(UUID lineageId, Optional<String> status) {
        return write(() -> table.setStatus(lineageId, status, this::writeEntry));
    }

    @Override
    public CompletableFuture<Boolean> checkVersion(UUID lineageId, long expectedVersion) {
        return read(() -> table.find(lineageId)
                .orElseThrow(() -> NotFoundException.lineage(lineageId))
                .version() == expectedVersion);
    }

    @Override
    public CompletableFuture<List<UUID>> listChildren(UUID lineageId) {
        return read(() -> table.children(lineageId));
    }

    // ========================================================================
    // Records
    // ========================================================================

    @Override
    public CompletableFuture<PersistOutcome> append(NewRecord record, long expectedVersion) {
        return write(() -> table.append(record, expectedVersion, UUID.randomUUID(), clock.instant(),
                this::writeEntry));
    }

    @Override
    public CompletableFuture<RecordSequence> readRecords(UUID lineageId, long fromCursor) {
        return read(() -> table.records(lineageId, fromCursor));
    }

    @Override
    public CompletableFuture<ReplayStart> readForReplay(UUID lineageId, ReplayStart.From from) {
        return read(() -> table.replayStart(lineageId, from));
    }

    @Override
    public CompletableFuture<Void> pruneFrom(UUID lineageId, long fromCursor) {
        return write(() -> {
            table.prune(lineageId, fromCursor, childPolicy, this::writeEntry);
            return null;
        });
    }

    // ========================================================================
    // Branching & deletion
    // ========================================================================

    @Override
    public CompletableFuture<UUID> branch(UUID parentLineageId, String name, String status,
                                          long parentCursor, JsonNode metadata) {
        return write(() -> table.branch(new Mutation.Branch(parentLineageId, UUID.randomUUID(), parentCursor,
                Optional.ofNullable(name), Optional.ofNullable(status), metadata, clock.instant()),
                this::writeEntry).id());
    }

    @Override
    public CompletableFuture<Void> deleteLineage(UUID lineageId) {
        return write(() -> {
            table.delete(lineageId, childPolicy, this::writeEntry);
            return null;
        });
    }

    // ========================================================================
    // Snapshots
    // ========================================================================

    @Override
    public CompletableFuture<UUID> saveSnapshot(UUID lineageId, long cursor, StatePointer statePointer,
                                                JsonNode metadata) {
        return write(() -> table.saveSnapshot(
                new SnapshotMeta(UUID.randomUUID(), lineageId, cursor, statePointer, metadata, clock.instant()),
                this::writeEntry).id());
    }

    @Override
    public CompletableFuture<SnapshotMeta> loadSnapshot(UUID snapshotId) {
        return read(() -> table.snapshot(snapshotId).orElseThrow(() -> NotFoundException.snapshot(snapshotId)));
    }

    @Override
    public CompletableFuture<Optional<SnapshotMeta>> loadLatestSnapshot(UUID lineageId) {
        return read(() -> table.latestSnapshot(lineageId));
    }

    @Override
    public CompletableFuture<List<SnapshotMeta>> listSnapshots(UUID lineageId) {
        return read(() -> table.snapshots(lineageId));
    }

    @Override
    public CompletableFuture<Void> deleteSnapshot(UUID snapshotId) {
        return write(() -> {
            table.deleteSnapshot(snapshotId, this::writeEntry);
            return null;
        });
    }

    // ========================================================================
    // Replay
    // ========================================================================

    /**
     * Rebuilds the table from the journal. Must be called from the walExecutor thread.
     * <p>
     * Stops at the first entry that is incomplete, has a bad header, a bad CRC or an
     * out-of-order sequence number, and truncates the file there. An entry that passes
     * its CRC but cannot be decoded or applied is not a torn write: open fails instead
     * of discarding it.
     */
    private void replayJournal(Path journalPath) throws IOException {
        long startTime = System.currentTimeMillis();
        long fileSize = journalChannel.size();
        if (fileSize == 0) {
            LOG.debug("Empty journal, nothing to replay");
            return;
        }
        LOG.info("Replaying journal from: {} ({} bytes)", journalPath, fileSize);

        long pos = 0;
        long lastGoodPos = 0;
        int applied = 0;
        ByteBuffer headerBuf = ByteBuffer.allocate(HEADER_SIZE);

        while (true) {
            headerBuf.clear();
            int headerRead = journalChannel.read(headerBuf, pos);
            if (headerRead < HEADER_SIZE) {
                if (headerRead > 0) {
                    LOG.debug("Incomplete header at pos {}: read {} bytes, expected {}",
                            pos, headerRead, HEADER_SIZE);
                }
                break;
            }
            headerBuf.flip();

            int magic = headerBuf.getInt();
            short version = headerBuf.getShort();
            byte type = headerBuf.get();
            long sequence = headerBuf.getLong();
            int payloadLen = headerBuf.getInt();

            if (magic != MAGIC || version != VERSION) {
                LOG.warn("Invalid header at pos {}: magic=0x{}, version={}",
                        pos, Integer.toHexString(magic), version);
                break;
            }
            if (payloadLen < 0 || payloadLen > maxPayloadSize) {
                LOG.warn("Invalid payload length at pos {}: {}", pos, payloadLen);
                break;
            }

            ByteBuffer payloadBuf = ByteBuffer.allocate(payloadLen);
            int payloadRead = payloadLen == 0 ? 0 : journalChannel.read(payloadBuf, pos + HEADER_SIZE);
            if (payloadRead < payloadLen) {
                LOG.debug("Incomplete payload at pos {}: read {} bytes, expected {}",
                        pos, payloadRead, payloadLen);
                break;
            }
            payloadBuf.flip();

            ByteBuffer crcBuf = ByteBuffer.allocate(CRC_SIZE);
            int crcRead = journalChannel.read(crcBuf, pos + HEADER_SIZE + payloadLen);
            if (crcRead < CRC_SIZE) {
                LOG.debug("Incomplete CRC at pos {}", pos);
                break;
            }
            crcBuf.flip();
            int expectedCrc = crcBuf.getInt();

            CRC32C crc = new CRC32C();
            headerBuf.rewind();
            crc.update(headerBuf);
            crc.update(payloadBuf.duplicate());
            if ((int) crc.getValue() != expectedCrc) {
                LOG.warn("CRC mismatch at pos {}: expected={}, computed={}",
                        pos, expectedCrc, (int) crc.getValue());
                break;
            }

            if (sequence != nextSequence) {
                LOG.warn("Out-of-order sequence at pos {}: expected {}, found {}", pos, nextSequence, sequence);
                break;
            }

            byte[] payload = new byte[payloadLen];
            payloadBuf.get(payload);
            Mutation mutation;
            try {
                mutation = JournalCodec.decode(type, payload);
                table.replay(mutation);
            } catch (IOException | RuntimeException e) {
                LOG.error("Journal entry {} ({}) at pos {} cannot be applied: {}",
                        sequence, JournalCodec.typeName(type), pos, e.getMessage());
                throw new StorageException("Journal entry " + sequence + " at pos " + pos
                        + " cannot be applied", e);
            }
            LOG.trace("Replayed {} entry: sequence={}, target={}",
                    JournalCodec.typeName(type), sequence, mutation.target());

            applied++;
            nextSequence++;
            lastGoodPos = pos + HEADER_SIZE + payloadLen + CRC_SIZE;
            pos = lastGoodPos;
        }

        if (lastGoodPos < fileSize) {
            LOG.warn("Truncating torn tail: {} bytes removed (file was {} bytes, valid data {} bytes)",
                    fileSize - lastGoodPos, fileSize, lastGoodPos);
            journalChannel.truncate(lastGoodPos);
            if (syncEnabled) {
                journalChannel.force(true);
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        LOG.info("Journal replay complete: {} entries applied, {} lineages recovered, {} ms",
                applied, table.lineageCount(), elapsed);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private <T> CompletableFuture<T> write(Supplier<T> operation) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Store is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                ensureOpen();
                return operation.get();
            }, walExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new StorageException("Store is closed", e));
        }
    }

    private <T> CompletableFuture<T> read(Supplier<T> operation) {
        try {
            ensureOpen();
            return CompletableFuture.completedFuture(operation.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Store is closed");
        }
        if (!opened) {
            throw new StorageException("Store is not open");
        }
    }

    /**
     * Journals one mutation. Called by the table while the affected lineages are
     * locked, on the walExecutor thread. Throwing here keeps the mutation unapplied.
     */
    private void writeEntry(Mutation mutation) {
        byte type = JournalCodec.typeOf(mutation);
        byte[] payload = JournalCodec.encode(mutation);
        if (payload.length > maxPayloadSize) {
            LOG.error("Journal entry too large: {} bytes (max: {})", payload.length, maxPayloadSize);
            throw new StorageException("Payload too large: " + payload.length
                    + " bytes (max: " + maxPayloadSize + ")");
        }

        long writePosition = -1;
        try {
            writePosition = journalChannel.position();
            writeFrame(type, nextSequence, payload, writePosition);
            LOG.debug("Journaled {} entry: sequence={}, target={}, {} bytes",
                    JournalCodec.typeName(type), nextSequence, mutation.target(), payload.length);
            nextSequence++;
        } catch (IOException e) {
            LOG.error("Failed to write {} entry: {}", JournalCodec.typeName(type), e.getMessage(), e);
            cutTail(writePosition);
            throw new StorageException("Failed to write " + JournalCodec.typeName(type) + " entry", e);
        } catch (StorageException e) {
            cutTail(writePosition);
            throw e;
        }
    }

    private void writeFrame(byte type, long sequence, byte[] payload, long writePosition) throws IOException {
        int payloadLen = payload.length;
        int entrySize = HEADER_SIZE + payloadLen + CRC_SIZE;

        if (entrySize > 1024 * 1024) {
            LOG.debug("Large write detected ({} bytes), checking disk space", entrySize);
            checkDiskSpace();
        }

        ByteBuffer buf = ByteBuffer.allocate(entrySize);
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put(type);
        buf.putLong(sequence);
        buf.putInt(payloadLen);
        buf.put(payload);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + payloadLen);
        int crcValue = (int) crc.getValue();
        buf.putInt(crcValue);
        buf.flip();

        LOG.trace("Writing {} bytes at position {}", entrySize, writePosition);
        while (buf.hasRemaining()) {
            journalChannel.write(buf);
        }

        if (syncEnabled) {
            journalChannel.force(true);
        }
        if (verifyWrites) {
            verifyWrittenEntry(writePosition, entrySize, crcValue);
        }
    }

    /**
     * Removes a partially written entry so the next write starts on an entry boundary.
     */
    private void cutTail(long writePosition) {
        if (writePosition < 0) {
            return;
        }
        try {
            journalChannel.truncate(writePosition);
            journalChannel.position(writePosition);
        } catch (IOException e) {
            LOG.warn("Could not cut journal back to {}: {}", writePosition, e.getMessage());
        }
    }

    /**
     * Reads back an entry just written and compares its CRC.
     *
     * @throws StorageException if the stored bytes do not match what was written
     */
    private void verifyWrittenEntry(long position, int entrySize, int expectedCrc) throws IOException {
        journalChannel.force(true);

        ByteBuffer readBuf = ByteBuffer.allocate(entrySize);
        int bytesRead = journalChannel.read(readBuf, position);
        if (bytesRead != entrySize) {
            LOG.error("Write verification failed: expected {} bytes, read {} bytes", entrySize, bytesRead);
            throw new StorageException("Write verification failed: expected to read " + entrySize
                    + " bytes but got " + bytesRead);
        }
        readBuf.flip();

        CRC32C verifyCrc = new CRC32C();
        verifyCrc.update(readBuf.array(), 0, entrySize - CRC_SIZE);
        int actualCrc = (int) verifyCrc.getValue();
        int storedCrc = readBuf.getInt(entrySize - CRC_SIZE);

        if (storedCrc != expectedCrc || actualCrc != expectedCrc) {
            LOG.error("Write verification CRC mismatch: written={}, stored={}, computed={}",
                    expectedCrc, storedCrc, actualCrc);
            throw new StorageException("Write verification failed: CRC mismatch. Written=" + expectedCrc
                    + ", Stored=" + storedCrc + ", Computed=" + actualCrc
                    + ". Possible silent data corruption!");
        }
        LOG.trace("Write verification passed at position {}", position);
    }

    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException("Cannot acquire exclusive lock on data directory: " + dataDir
                        + ". Another process may be using this store.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException("Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
                LOG.trace("Lock channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    private void closeJournalChannel() {
        try {
            if (journalChannel != null && journalChannel.isOpen()) {
                journalChannel.close();
                LOG.debug("Journal channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing journal channel: {}", e.getMessage());
        }
    }

    /**
     * @throws StorageException if disk space is below the configured minimum
     */
    private void checkDiskSpace() throws IOException {
        FileStore store = Files.getFileStore(dataDir);
        long usableSpace = store.getUsableSpace();
        long usableSpaceMb = usableSpace / 1024 / 1024;
        long minFreeSpaceMb = minFreeSpace / 1024 / 1024;

        LOG.trace("Disk space check: {} MB available, {} MB required", usableSpaceMb, minFreeSpaceMb);

        if (usableSpace < minFreeSpace) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new StorageException("Insufficient disk space: " + usableSpaceMb + " MB available, "
                    + "need at least " + minFreeSpaceMb + " MB.");
        }
    }
}
