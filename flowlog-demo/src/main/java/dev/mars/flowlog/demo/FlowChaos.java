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
package dev.mars.flowlog.demo;

import dev.mars.flowlog.model.Documents;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.store.ChildLineagePolicy;
import dev.mars.flowlog.store.CursorOutOfRangeException;
import dev.mars.flowlog.store.FlowStoreConfig;
import dev.mars.flowlog.store.file.FileRecordStore;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chaos testing for the journal-backed record store.
 * <p>
 * Throws concurrent writers, retries, forks, prunes and damaged journals at a
 * {@link FileRecordStore} and checks that the lineage invariants still hold:
 * <ul>
 *   <li>Concurrent appenders with conflict retries</li>
 *   <li>Idempotent retry storms</li>
 *   <li>Branching racing a prune of the parent</li>
 *   <li>Deleting a parent while its children are written to</li>
 *   <li>Torn tails and bit flips in the journal</li>
 *   <li>Restart equivalence</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Run all chaos tests
 * java ... dev.mars.flowlog.demo.FlowChaos
 *
 * # Run specific group
 * java ... dev.mars.flowlog.demo.FlowChaos concurrent
 * java ... dev.mars.flowlog.demo.FlowChaos corruption
 * </pre>
 *
 * @see FileRecordStore
 */
public class FlowChaos {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final String JOURNAL_FILE = "flowlog.journal";

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public FlowChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║              FLOWLOG CHAOS TESTING SUITE                      ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("flowlog-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());
        System.out.println();

        FlowChaos chaos = new FlowChaos(chaosDir);
        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "corruption" -> chaos.runCorruptionTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runCorruptionTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, corruption, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY CHAOS
    // =========================================================================

    private void runConcurrencyTests() {
        printSection("CONCURRENCY CHAOS");

        chaosTest("Appender Storm with Retries (8 threads × 50)", this::appenderStormWithRetries);
        chaosTest("Idempotent Retry Storm (16 threads, 1 command)", this::idempotentRetryStorm);
        chaosTest("Branch Storm racing a Prune", this::branchStormRacingPrune);
        chaosTest("Parent Delete during Child Appends", this::parentDeleteDuringChildAppends);
    }

    private void appenderStormWithRetries() throws Exception {
        int numThreads = 8;
        int recordsPerThread = 50;
        AtomicInteger conflicts = new AtomicInteger(0);
        Path dir = createTestDir("appender-storm");

        UUID lineageId;
        try (FileRecordStore store = openStore(dir)) {
            lineageId = store.createLineage("storm", null, null).join();

            runConcurrently(numThreads, threadId -> {
                for (int i = 0; i < recordsPerThread; i++) {
                    NewRecord record = NewRecord.of(lineageId, "t" + threadId,
                            Documents.valueOf("t" + threadId + "-r" + i)).withCommandId(UUID.randomUUID());
                    while (true) {
                        long version = store.getLineage(lineageId).join().version();
                        PersistOutcome outcome = store.append(record, version).join();
                        if (outcome.isOk()) {
                            break;
                        }
                        conflicts.incrementAndGet();
                    }
                }
            });

            verifyContiguous(store, lineageId, (long) numThreads * recordsPerThread);
        }

        // The journal must rebuild exactly the same history
        try (FileRecordStore reopened = openStore(dir)) {
            verifyContiguous(reopened, lineageId, (long) numThreads * recordsPerThread);
        }
        System.out.printf("(%d conflicts retried) ", conflicts.get());
    }

    private void idempotentRetryStorm() throws Exception {
        int numThreads = 16;
        UUID commandId = UUID.randomUUID();
        Set<Long> reportedCursors = ConcurrentHashMap.newKeySet();

        try (FileRecordStore store = openStore(createTestDir("retry-storm"))) {
            UUID lineageId = store.createLineage("retry", null, null).join();
            NewRecord record = NewRecord.of(lineageId, "charge", Documents.valueOf(100)).withCommandId(commandId);

            runConcurrently(numThreads, threadId -> {
                while (true) {
                    long version = store.getLineage(lineageId).join().version();
                    PersistOutcome outcome = store.append(record, version).join();
                    if (outcome instanceof PersistOutcome.Ok ok) {
                        reportedCursors.add(ok.cursor());
                        return;
                    }
                }
            });

            long count = store.countRecords(lineageId).join();
            if (count != 1) {
                throw new AssertionError("Expected exactly 1 record for one command id, got " + count);
            }
            if (!reportedCursors.equals(Set.of(1L))) {
                throw new AssertionError("All attempts must report cursor 1, got " + reportedCursors);
            }
        }
    }

    private void branchStormRacingPrune() throws Exception {
        int parentRecords = 50;
        long pruneFrom = 25;
        Path dir = createTestDir("branch-prune");
        UUID parentId;

        try (FileRecordStore store = openStore(dir)) {
            parentId = store.createLineage("parent", null, null).join();
            for (int i = 0; i < parentRecords; i++) {
                store.append(NewRecord.of(parentId, "step", Documents.valueOf(i)), i).join();
            }

            runConcurrently(9, threadId -> {
                if (threadId == 0) {
                    store.pruneFrom(parentId, pruneFrom).join();
                    return;
                }
                for (int i = 0; i < 10; i++) {
                    long at = ThreadLocalRandom.current().nextLong(0, parentRecords + 1);
                    try {
                        store.branch(parentId, "b" + threadId + "-" + i, null, at, null).join();
                    } catch (CompletionException e) {
                        if (!(e.getCause() instanceof CursorOutOfRangeException)) {
                            throw e;
                        }
                    }
                }
            });

            LineageMeta parent = store.getLineage(parentId).join();
            if (parent.cursor() != pruneFrom - 1) {
                throw new AssertionError("Parent cursor should be " + (pruneFrom - 1) + ", was " + parent.cursor());
            }
            List<FlowRecord> parentHistory = store.readRecords(parentId, 0).join().toList();
            for (UUID childId : store.listChildren(parentId).join()) {
                LineageMeta child = store.getLineage(childId).join();
                long at = child.parentCursor().orElseThrow();
                if (at > parent.cursor()) {
                    throw new AssertionError("Child " + childId + " forked at " + at
                            + " survived a prune to " + parent.cursor());
                }
                List<FlowRecord> copied = store.readRecords(childId, 0).join().toList();
                if (copied.size() != at) {
                    throw new AssertionError("Child " + childId + " has " + copied.size() + " records, forked at " + at);
                }
                for (int i = 0; i < copied.size(); i++) {
                    if (!copied.get(i).payload().equals(parentHistory.get(i).payload())) {
                        throw new AssertionError("Child " + childId + " diverges from parent at cursor " + (i + 1));
                    }
                }
            }
        }
        verifyRestartEquivalence(dir, List.of(parentId));
    }

    private void parentDeleteDuringChildAppends() throws Exception {
        Path dir = createTestDir("delete-parent");
        List<UUID> children = new ArrayList<>();

        try (FileRecordStore store = openStore(dir)) {
            UUID parentId = store.createLineage("parent", null, null).join();
            store.append(NewRecord.of(parentId, "seed", Documents.valueOf(0)), 0).join();
            for (int i = 0; i < 4; i++) {
                children.add(store.branch(parentId, "child-" + i, null, 1, null).join());
            }

            runConcurrently(5, threadId -> {
                if (threadId == 4) {
                    store.deleteLineage(parentId).join();
                    return;
                }
                UUID childId = children.get(threadId);
                for (int i = 0; i < 20; i++) {
                    long version = store.getLineage(childId).join().version();
                    store.append(NewRecord.of(childId, "work", Documents.valueOf(i)), version).join();
                }
            });

            if (store.countRecords(parentId).join() != -1) {
                throw new AssertionError("Deleted parent must report -1 records");
            }
            for (UUID childId : children) {
                LineageMeta child = store.getLineage(childId).join();
                if (child.hasParent()) {
                    throw new AssertionError("Child " + childId + " still references deleted parent");
                }
                if (child.cursor() != 21) {
                    throw new AssertionError("Child " + childId + " expected 21 records, has " + child.cursor());
                }
            }
        }
        verifyRestartEquivalence(dir, children);
    }

    // =========================================================================
    // CORRUPTION CHAOS
    // =========================================================================

    private void runCorruptionTests() {
        printSection("CORRUPTION CHAOS");

        chaosTest("Torn Tail (random garbage appended)", this::tornTailGarbage);
        chaosTest("Partial Last Entry (power cut mid-write)", this::partialLastEntry);
        chaosTest("Bit Flip in Last Entry", this::bitFlipInLastEntry);
    }

    private void tornTailGarbage() throws Exception {
        Path dir = createTestDir("torn-tail");
        UUID lineageId = writeRecords(dir, 20);

        byte[] garbage = new byte[1 + SECURE_RANDOM.nextInt(200)];
        SECURE_RANDOM.nextBytes(garbage);
        try (FileChannel ch = FileChannel.open(dir.resolve(JOURNAL_FILE), StandardOpenOption.APPEND)) {
            ch.write(ByteBuffer.wrap(garbage));
        }

        expectRecordsAfterReopen(dir, lineageId, 20);
        try (FileRecordStore store = openStore(dir)) {
            PersistOutcome outcome = store.append(NewRecord.of(lineageId, "after", Documents.valueOf("ok")), 20).join();
            if (!outcome.isOk()) {
                throw new AssertionError("Append after recovery failed: " + outcome);
            }
        }
        expectRecordsAfterReopen(dir, lineageId, 21);
    }

    private void partialLastEntry() throws Exception {
        Path dir = createTestDir("partial-entry");
        UUID lineageId = writeRecords(dir, 10);

        Path journal = dir.resolve(JOURNAL_FILE);
        long size = Files.size(journal);
        try (FileChannel ch = FileChannel.open(journal, StandardOpenOption.WRITE)) {
            ch.truncate(size - 1 - SECURE_RANDOM.nextInt(8));
        }
        expectRecordsAfterReopen(dir, lineageId, 9);
    }

    private void bitFlipInLastEntry() throws Exception {
        Path dir = createTestDir("bit-flip");
        UUID lineageId = writeRecords(dir, 10);

        Path journal = dir.resolve(JOURNAL_FILE);
        long flipAt = Files.size(journal) - 6;
        try (FileChannel ch = FileChannel.open(journal, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ByteBuffer one = ByteBuffer.allocate(1);
            ch.read(one, flipAt);
            one.flip();
            byte flipped = (byte) (one.get() ^ 0x10);
            ch.write(ByteBuffer.wrap(new byte[]{flipped}), flipAt);
        }
        expectRecordsAfterReopen(dir, lineageId, 9);
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    private FileRecordStore openStore(Path dir) {
        FileRecordStore store = new FileRecordStore(FlowStoreConfig.builder()
                .dataDir(dir)
                .syncEnabled(false)
                .minFreeSpaceMb(1)
                .childPolicy(ChildLineagePolicy.ORPHAN)
                .build());
        store.open().join();
        return store;
    }

    private UUID writeRecords(Path dir, int count) {
        try (FileRecordStore store = openStore(dir)) {
            UUID lineageId = store.createLineage("victim", null, null).join();
            for (int i = 0; i < count; i++) {
                store.append(NewRecord.of(lineageId, "step", Documents.valueOf(i)), i).join();
            }
            return lineageId;
        }
    }

    private void expectRecordsAfterReopen(Path dir, UUID lineageId, long expected) {
        try (FileRecordStore store = openStore(dir)) {
            verifyContiguous(store, lineageId, expected);
        }
    }

    private static void verifyContiguous(FileRecordStore store, UUID lineageId, long expected) {
        List<FlowRecord> records = store.readRecords(lineageId, 0).join().toList();
        if (records.size() != expected) {
            throw new AssertionError("Expected " + expected + " records, got " + records.size());
        }
        Set<UUID> commandIds = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            FlowRecord record = records.get(i);
            if (record.cursor() != i + 1 || record.version() != i + 1) {
                throw new AssertionError("Record " + i + " has cursor " + record.cursor()
                        + " and version " + record.version());
            }
            record.commandId().ifPresent(id -> {
                if (!commandIds.add(id)) {
                    throw new AssertionError("Command id " + id + " stored twice");
                }
            });
        }
        LineageMeta meta = store.getLineage(lineageId).join();
        if (meta.cursor() != expected) {
            throw new AssertionError("Lineage cursor " + meta.cursor() + " but " + expected + " records");
        }
    }

    /**
     * Reopens the journal and checks that the given lineages and all their descendants
     * look exactly as they did before.
     */
    private void verifyRestartEquivalence(Path dir, List<UUID> roots) {
        Map<UUID, List<FlowRecord>> before = new HashMap<>();
        Map<UUID, LineageMeta> metaBefore = new HashMap<>();
        List<UUID> ids = new ArrayList<>();
        try (FileRecordStore store = openStore(dir)) {
            ids.addAll(collectLineages(store, roots));
            for (UUID id : ids) {
                metaBefore.put(id, store.getLineage(id).join());
                before.put(id, store.readRecords(id, 0).join().toList());
            }
        }
        try (FileRecordStore store = openStore(dir)) {
            for (UUID id : ids) {
                Optional<LineageMeta> meta = store.findLineage(id).join();
                if (meta.isEmpty() || !meta.get().equals(metaBefore.get(id))) {
                    throw new AssertionError("Lineage " + id + " changed across restart");
                }
                if (!store.readRecords(id, 0).join().toList().equals(before.get(id))) {
                    throw new AssertionError("Records of lineage " + id + " changed across restart");
                }
            }
        }
    }

    /**
     * The roots plus everything reachable from them through the children relation.
     */
    private static List<UUID> collectLineages(FileRecordStore store, List<UUID> roots) {
        List<UUID> ids = new ArrayList<>(roots);
        List<UUID> frontier = new ArrayList<>(roots);
        while (!frontier.isEmpty()) {
            UUID next = frontier.remove(frontier.size() - 1);
            for (UUID child : store.listChildren(next).join()) {
                if (!ids.contains(child)) {
                    ids.add(child);
                    frontier.add(child);
                }
            }
        }
        return ids;
    }

    private void runConcurrently(int numThreads, ThreadBody body) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        List<Throwable> failures = new ArrayList<>();

        for (int t = 0; t < numThreads; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    body.run(threadId);
                } catch (Throwable e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        boolean finished = doneLatch.await(60, TimeUnit.SECONDS);
        executor.shutdownNow();
        if (!finished) {
            throw new AssertionError("Threads did not finish within 60s");
        }
        if (!failures.isEmpty()) {
            AssertionError error = new AssertionError(failures.size() + " thread(s) failed");
            failures.forEach(error::addSuppressed);
            throw error;
        }
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-50s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(FlowChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Could not delete " + path + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }

    @FunctionalInterface
    interface ThreadBody {
        void run(int threadId) throws Exception;
    }
}
