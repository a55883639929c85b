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

import dev.mars.flowlog.model.Documents;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.model.SnapshotMeta;
import dev.mars.flowlog.store.ChildLineagePolicy;
import dev.mars.flowlog.store.FlowStoreConfig;
import dev.mars.flowlog.store.RecordStore;
import dev.mars.flowlog.store.RecordStoreContract;
import dev.mars.flowlog.store.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.RandomAccessFile;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.zip.CRC32C;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against {@link FileRecordStore}, then its durability behaviour.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>State survives close and reopen, branch ids and snapshot ids included</li>
 *   <li>Torn or corrupt journal tails are truncated on open</li>
 *   <li>An entry that passes its CRC but cannot be decoded fails the open</li>
 *   <li>Exclusive locking, payload limits and write verification</li>
 * </ul>
 */
class FileRecordStoreTest extends RecordStoreContract {

    private static final String JOURNAL_FILE = "flowlog.journal";

    @TempDir
    Path tempDir;

    private int storeCount = 0;

    @Override
    protected RecordStore openStore(ChildLineagePolicy policy) throws Exception {
        return openAt(tempDir.resolve("store-" + (++storeCount)), policy);
    }

    private static FlowStoreConfig configFor(Path dir, ChildLineagePolicy policy) {
        return FlowStoreConfig.builder()
                .dataDir(dir)
                .syncEnabled(false)
                .minFreeSpaceMb(1)
                .childPolicy(policy)
                .build();
    }

    private static FileRecordStore openAt(Path dir, ChildLineagePolicy policy) throws Exception {
        FileRecordStore fileStore = new FileRecordStore(configFor(dir, policy));
        fileStore.open().get(5, TimeUnit.SECONDS);
        return fileStore;
    }

    private Path dataDir() {
        return ((FileRecordStore) store).config().dataDir();
    }

    // ========================================================================
    // Restart
    // ========================================================================

    @Test
    void testRestart_RecoversLineagesRecordsAndSnapshots() throws Exception {
        UUID flow = newLineage(store);
        UUID commandId = UUID.randomUUID();
        await(store.append(record(flow, "a", 1).withCommandId(commandId), 0));
        appendN(store, flow, 3);
        UUID branch = await(store.branch(flow, "fork", "queued", 2, null));
        UUID snapshotId = await(store.saveSnapshot(flow, 3, inline("state@3"), null));
        await(store.setStatus(flow, Optional.of("paused")));
        await(store.pruneFrom(flow, 4));

        LineageMeta flowBefore = await(store.getLineage(flow));
        LineageMeta branchBefore = await(store.getLineage(branch));
        List<FlowRecord> recordsBefore = await(store.readRecords(flow, 0)).toList();
        List<FlowRecord> branchRecordsBefore = await(store.readRecords(branch, 0)).toList();
        Path dir = dataDir();
        store.close();

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            assertEquals(flowBefore, await(store.getLineage(flow)));
            assertEquals(branchBefore, await(store.getLineage(branch)));
            assertEquals(recordsBefore, await(store.readRecords(flow, 0)).toList());
            assertEquals(branchRecordsBefore, await(store.readRecords(branch, 0)).toList());
            assertEquals(3, await(store.loadSnapshot(snapshotId)).cursor());
            assertEquals(List.of(branch), await(store.listChildren(flow)));

            // the command id survived the restart
            assertEquals(PersistOutcome.replayed(1, 1),
                    await(store.append(record(flow, "a", 1).withCommandId(commandId), 5)));
            assertEquals(PersistOutcome.ok(6, 4), await(store.append(record(flow, "next", 1), 5)));
        } finally {
            store.close();
        }
    }

    @Test
    void testRestart_DecimalPayloadsKeepEveryDigit() throws Exception {
        UUID flow = newLineage(store);
        BigDecimal amount = new BigDecimal("0.10000000000000000001");
        BigDecimal total = new BigDecimal("123456789012345678901234567890.125");
        await(store.append(NewRecord.of(flow, "charge", Documents.emptyObject().put("amount", amount))
                .withMetadata(Documents.emptyObject().put("total", total)), 0));
        List<FlowRecord> before = await(store.readRecords(flow, 0)).toList();
        Path dir = dataDir();
        store.close();

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            List<FlowRecord> after = await(store.readRecords(flow, 0)).toList();
            assertEquals(before, after);
            assertEquals(amount, after.get(0).payload().path("amount").decimalValue());
            assertEquals(total, after.get(0).metadata().path("total").decimalValue());
        } finally {
            store.close();
        }
    }

    @Test
    void testRestart_DeletesStayDeleted() throws Exception {
        UUID parent = newLineage(store);
        appendN(store, parent, 2);
        UUID child = await(store.branch(parent, null, null, 1, null));
        await(store.deleteLineage(parent));
        Path dir = dataDir();
        store.close();

        store = openAt(dir, ChildLineagePolicy.CASCADE);
        try {
            assertEquals(-1L, await(store.countRecords(parent)));
            // the journal carries the policy the delete ran with, not the reopening store's
            assertEquals(1L, await(store.countRecords(child)));
            assertFalse(await(store.getLineage(child)).hasParent());
        } finally {
            store.close();
        }
    }

    @Test
    void testRestart_EmptyJournal() throws Exception {
        Path dir = dataDir();
        store.close();

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            assertEquals(-1L, await(store.countRecords(UUID.randomUUID())));
            UUID id = newLineage(store);
            assertEquals(0L, await(store.countRecords(id)));
        } finally {
            store.close();
        }
    }

    // ========================================================================
    // Torn tails and corruption
    // ========================================================================

    @Test
    void testOpen_GarbageTail_TruncatedAndWritable() throws Exception {
        UUID flow = newLineage(store);
        appendN(store, flow, 3);
        Path dir = dataDir();
        store.close();

        Path journal = dir.resolve(JOURNAL_FILE);
        long goodSize = Files.size(journal);
        Files.write(journal, new byte[]{0x13, 0x37, 0x00, 0x42, 0x7f}, StandardOpenOption.APPEND);

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            assertEquals(goodSize, Files.size(journal));
            assertEquals(3L, await(store.countRecords(flow)));
            assertEquals(PersistOutcome.ok(4, 4), await(store.append(record(flow, "after", 4), 3)));
        } finally {
            store.close();
        }

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            assertEquals(4L, await(store.countRecords(flow)));
        } finally {
            store.close();
        }
    }

    @Test
    void testOpen_PartialLastEntry_LastWriteLost() throws Exception {
        UUID flow = newLineage(store);
        appendN(store, flow, 3);
        Path dir = dataDir();
        store.close();

        Path journal = dir.resolve(JOURNAL_FILE);
        try (RandomAccessFile raf = new RandomAccessFile(journal.toFile(), "rw")) {
            raf.setLength(raf.length() - 3);
        }

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            assertEquals(2L, await(store.countRecords(flow)));
            assertEquals(2, await(store.getLineage(flow)).version());
        } finally {
            store.close();
        }
    }

    @Test
    void testOpen_CorruptLastEntry_DiscardedByCrc() throws Exception {
        UUID flow = newLineage(store);
        appendN(store, flow, 2);
        Path dir = dataDir();
        store.close();

        Path journal = dir.resolve(JOURNAL_FILE);
        try (RandomAccessFile raf = new RandomAccessFile(journal.toFile(), "rw")) {
            // a byte inside the last entry's payload
            long pos = raf.length() - 10;
            raf.seek(pos);
            int b = raf.read();
            raf.seek(pos);
            raf.write(b ^ 0xFF);
        }

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            assertEquals(1L, await(store.countRecords(flow)));
        } finally {
            store.close();
        }
    }

    @Test
    void testOpen_UndecodableEntryWithValidCrc_Fails() throws Exception {
        newLineage(store);
        Path dir = dataDir();
        store.close();

        // sequence 2, type APPEND, a payload that is valid JSON but not an append
        Path journal = dir.resolve(JOURNAL_FILE);
        Files.write(journal, frame(JournalCodec.TYPE_APPEND, 2, "{}".getBytes(StandardCharsets.UTF_8)),
                StandardOpenOption.APPEND);
        long sizeWithEntry = Files.size(journal);

        FileRecordStore reopened = new FileRecordStore(configFor(dir, ChildLineagePolicy.ORPHAN));
        try {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> reopened.open().get(5, TimeUnit.SECONDS));
            assertInstanceOf(StorageException.class, e.getCause());
        } finally {
            reopened.close();
        }
        assertEquals(sizeWithEntry, Files.size(journal));
    }

    @Test
    void testOpen_OutOfOrderSequence_TruncatedThere() throws Exception {
        UUID flow = newLineage(store);
        Path dir = dataDir();
        store.close();

        Path journal = dir.resolve(JOURNAL_FILE);
        long goodSize = Files.size(journal);
        Files.write(journal, frame(JournalCodec.TYPE_SET_STATUS, 7,
                        ("{\"lineageId\":\"" + flow + "\",\"status\":\"ghost\"}").getBytes(StandardCharsets.UTF_8)),
                StandardOpenOption.APPEND);

        store = openAt(dir, ChildLineagePolicy.ORPHAN);
        try {
            assertEquals(goodSize, Files.size(journal));
            assertEquals(Optional.of("running"), await(store.getLineage(flow)).status());
        } finally {
            store.close();
        }
    }

    // ========================================================================
    // Protection
    // ========================================================================

    @Test
    void testOpen_SecondStoreOnSameDirectory_Rejected() throws Exception {
        FileRecordStore second = new FileRecordStore(configFor(dataDir(), ChildLineagePolicy.ORPHAN));
        try {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> second.open().get(5, TimeUnit.SECONDS));
            assertInstanceOf(StorageException.class, e.getCause());
        } finally {
            second.close();
        }

        // the first store is unaffected
        UUID id = newLineage(store);
        assertEquals(0L, await(store.countRecords(id)));
    }

    @Test
    void testOpen_Twice_Rejected() throws Exception {
        FileRecordStore fileStore = (FileRecordStore) store;
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> fileStore.open().get(5, TimeUnit.SECONDS));
        assertInstanceOf(StorageException.class, e.getCause());
    }

    @Test
    void testNotOpened_OperationsFail() {
        try (FileRecordStore unopened = new FileRecordStore(configFor(tempDir.resolve("never"),
                ChildLineagePolicy.ORPHAN))) {
            assertInstanceOf(StorageException.class, failureOf(unopened.countRecords(UUID.randomUUID())));
            assertInstanceOf(StorageException.class, failureOf(unopened.createLineage("x", null, null)));
        }
    }

    @Test
    void testClosed_OperationsFail() throws Exception {
        UUID id = newLineage(store);
        store.close();

        assertInstanceOf(StorageException.class, failureOf(store.countRecords(id)));
        assertInstanceOf(StorageException.class, failureOf(store.append(record(id, "x", 1), 0)));
    }

    @Test
    void testAppend_PayloadTooLarge_RejectedAndNothingApplied() throws Exception {
        Path dir = tempDir.resolve("small");
        FlowStoreConfig config = FlowStoreConfig.builder()
                .dataDir(dir)
                .syncEnabled(false)
                .minFreeSpaceMb(1)
                .maxPayloadSizeMb(1)
                .build();
        try (FileRecordStore small = new FileRecordStore(config)) {
            small.open().get(5, TimeUnit.SECONDS);
            UUID id = await(small.createLineage("big", null, null));
            long sizeBefore = Files.size(dir.resolve(JOURNAL_FILE));

            String huge = "x".repeat(2 * 1024 * 1024);
            NewRecord tooBig = NewRecord.of(id, "blob", Documents.valueOf(huge));
            assertInstanceOf(StorageException.class, failureOf(small.append(tooBig, 0)));

            assertEquals(0L, await(small.countRecords(id)));
            assertEquals(sizeBefore, Files.size(dir.resolve(JOURNAL_FILE)));
            assertEquals(PersistOutcome.ok(1, 1), await(small.append(record(id, "small", 1), 0)));
        }
    }

    @Test
    void testVerifyWrites_EnabledStoreWorks() throws Exception {
        Path dir = tempDir.resolve("verified");
        FlowStoreConfig config = FlowStoreConfig.builder()
                .dataDir(dir)
                .syncEnabled(true)
                .verifyWrites(true)
                .minFreeSpaceMb(1)
                .build();
        UUID id;
        try (FileRecordStore verified = new FileRecordStore(config)) {
            verified.open().get(5, TimeUnit.SECONDS);
            id = await(verified.createLineage("verified", null, null));
            appendN(verified, id, 3);
            await(verified.saveSnapshot(id, 3, inline("s"), null));
        }
        try (FileRecordStore reopened = new FileRecordStore(config)) {
            reopened.open().get(5, TimeUnit.SECONDS);
            assertEquals(3L, await(reopened.countRecords(id)));
            assertEquals(Optional.of(3L), await(reopened.loadLatestSnapshot(id)).map(SnapshotMeta::cursor));
        }
    }

    @Test
    void testOpen_InsufficientDiskSpace_Fails() throws Exception {
        FlowStoreConfig config = FlowStoreConfig.builder()
                .dataDir(tempDir.resolve("full"))
                .syncEnabled(false)
                .minFreeSpaceMb(Integer.MAX_VALUE)
                .build();
        try (FileRecordStore greedy = new FileRecordStore(config)) {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> greedy.open().get(5, TimeUnit.SECONDS));
            assertInstanceOf(StorageException.class, e.getCause());
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /** One journal entry in the on-disk format. */
    private static byte[] frame(byte type, long sequence, byte[] payload) {
        ByteBuffer buf = ByteBuffer.allocate(19 + payload.length + 4);
        buf.putInt(0x464C4F57);
        buf.putShort((short) 1);
        buf.put(type);
        buf.putLong(sequence);
        buf.putInt(payload.length);
        buf.put(payload);
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, 19 + payload.length);
        buf.putInt((int) crc.getValue());
        return buf.array();
    }
}
