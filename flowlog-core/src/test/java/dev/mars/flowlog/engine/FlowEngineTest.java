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
package dev.mars.flowlog.engine;

import dev.mars.flowlog.artifact.ArtifactStore;
import dev.mars.flowlog.artifact.InMemoryArtifactStore;
import dev.mars.flowlog.model.Documents;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.model.SnapshotMeta;
import dev.mars.flowlog.rehydrate.JsonStateCodec;
import dev.mars.flowlog.rehydrate.Rehydrated;
import dev.mars.flowlog.rehydrate.Rehydrator;
import dev.mars.flowlog.rehydrate.SnapshotPolicy;
import dev.mars.flowlog.store.StorageException;
import dev.mars.flowlog.store.memory.InMemoryRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FlowEngine}.
 */
class FlowEngineTest {

    /** Keys seen so far, in order. */
    public record Trail(List<String> keys) {
        static Trail empty() {
            return new Trail(List.of());
        }

        Trail add(FlowRecord record) {
            List<String> next = new ArrayList<>(keys);
            next.add(record.key());
            return new Trail(List.copyOf(next));
        }
    }

    private InMemoryRecordStore store;
    private InMemoryArtifactStore artifacts;
    private FlowEngine<Trail> engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        artifacts = new InMemoryArtifactStore();
        engine = engineWith(SnapshotPolicy.everyRecords(2));
    }

    @AfterEach
    void tearDown() {
        store.close();
        artifacts.close();
    }

    private FlowEngine<Trail> engineWith(SnapshotPolicy policy) {
        Rehydrator<Trail> rehydrator = new Rehydrator<>(store, artifacts, new JsonStateCodec<>(Trail.class),
                Trail::empty, Trail::add, 4096);
        return new FlowEngine<>(store, rehydrator, policy);
    }

    private UUID startFlow() throws Exception {
        return engine.startFlow("ingest", "queued", "tests", null).get(5, TimeUnit.SECONDS);
    }

    // ========================================================================
    // Flows
    // ========================================================================

    @Test
    void testStartFlow_AndStatus() throws Exception {
        UUID flow = startFlow();

        assertEquals(Optional.of("queued"), engine.status(flow).get(5, TimeUnit.SECONDS));
        engine.setStatus(flow, "running").get(5, TimeUnit.SECONDS);
        assertEquals(Optional.of("running"), engine.status(flow).get(5, TimeUnit.SECONDS));
        engine.setStatus(flow, null).get(5, TimeUnit.SECONDS);
        assertEquals(Optional.empty(), engine.status(flow).get(5, TimeUnit.SECONDS));
        assertSame(store, engine.store());
    }

    @Test
    void testStepStateKey() {
        assertEquals("step_state:fetch", FlowEngine.stepStateKey("fetch"));
        assertThrows(IllegalArgumentException.class, () -> FlowEngine.stepStateKey(" "));
        assertThrows(IllegalArgumentException.class, () -> FlowEngine.stepStateKey(null));
    }

    // ========================================================================
    // Records
    // ========================================================================

    @Test
    void testAppend_ConflictIsReturnedNotRetried() throws Exception {
        UUID flow = startFlow();
        engine.append(flow, "a", null, null, null, 0).get(5, TimeUnit.SECONDS);

        PersistOutcome stale = engine.append(flow, "b", null, null, null, 0).get(5, TimeUnit.SECONDS);

        assertEquals(PersistOutcome.conflict(0, 1), stale);
        assertEquals(1L, engine.countRecords(flow).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testLatestStepState_NewestRecordOfStep() throws Exception {
        UUID flow = startFlow();
        engine.appendStepState(flow, "fetch", Documents.valueOf("first"), null, null, 0).get(5, TimeUnit.SECONDS);
        engine.appendStepState(flow, "parse", Documents.valueOf("other"), null, null, 1).get(5, TimeUnit.SECONDS);
        engine.appendStepState(flow, "fetch", Documents.valueOf("second"), null, null, 2).get(5, TimeUnit.SECONDS);

        Optional<FlowRecord> latest = engine.latestStepState(flow, "fetch").get(5, TimeUnit.SECONDS);

        assertTrue(latest.isPresent());
        assertEquals("second", latest.get().payload().asText());
        assertEquals(3, latest.get().cursor());
        assertTrue(engine.latestStepState(flow, "store").get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testRecords_FromCursor() throws Exception {
        UUID flow = startFlow();
        for (int i = 0; i < 3; i++) {
            engine.append(flow, "k" + i, null, null, null, i).get(5, TimeUnit.SECONDS);
        }

        List<String> keys = engine.records(flow, 1).get(5, TimeUnit.SECONDS).stream().map(FlowRecord::key).toList();

        assertEquals(List.of("k1", "k2"), keys);
    }

    @Test
    void testCountRecords_UnknownFlow() throws Exception {
        assertEquals(-1L, engine.countRecords(UUID.randomUUID()).get(5, TimeUnit.SECONDS));
    }

    // ========================================================================
    // State
    // ========================================================================

    @Test
    void testAppendAndSnapshot_FollowsPolicy() throws Exception {
        UUID flow = startFlow();

        engine.appendAndSnapshot(NewRecord.of(flow, "a", null), 0).get(5, TimeUnit.SECONDS);
        assertTrue(engine.snapshots(flow).get(5, TimeUnit.SECONDS).isEmpty());

        engine.appendAndSnapshot(NewRecord.of(flow, "b", null), 1).get(5, TimeUnit.SECONDS);
        List<SnapshotMeta> snapshots = engine.snapshots(flow).get(5, TimeUnit.SECONDS);
        assertEquals(1, snapshots.size());
        assertEquals(2, snapshots.get(0).cursor());

        engine.appendAndSnapshot(NewRecord.of(flow, "c", null), 2).get(5, TimeUnit.SECONDS);
        assertEquals(1, engine.snapshots(flow).get(5, TimeUnit.SECONDS).size());

        Rehydrated<Trail> state = engine.rehydrate(flow).get(5, TimeUnit.SECONDS);
        assertEquals(List.of("a", "b", "c"), state.state().keys());
        assertEquals(2, state.snapshotCursor());
    }

    @Test
    void testAppendAndSnapshot_ReplayAndConflictNeverSnapshot() throws Exception {
        UUID flow = startFlow();
        NewRecord first = NewRecord.of(flow, "a", null).withCommandId(UUID.randomUUID());
        engine.appendAndSnapshot(first, 0).get(5, TimeUnit.SECONDS);
        engine.appendAndSnapshot(NewRecord.of(flow, "b", null), 1).get(5, TimeUnit.SECONDS);
        engine.pruneFrom(flow, 2).get(5, TimeUnit.SECONDS);
        // version is now 3, cursor 1, no snapshots left

        PersistOutcome replay = engine.appendAndSnapshot(first, 3).get(5, TimeUnit.SECONDS);
        PersistOutcome conflict = engine.appendAndSnapshot(NewRecord.of(flow, "x", null), 0)
                .get(5, TimeUnit.SECONDS);

        assertTrue(((PersistOutcome.Ok) replay).replayed());
        assertTrue(conflict.isConflict());
        assertTrue(engine.snapshots(flow).get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testAppendAndSnapshot_SnapshotFailure_AppendOutcomeStillReturned() throws Exception {
        ArtifactStore failingPuts = new ArtifactStore() {
            @Override
            public CompletableFuture<String> put(byte[] content) {
                return CompletableFuture.failedFuture(new StorageException("blob store down"));
            }

            @Override
            public CompletableFuture<byte[]> get(String key) {
                return artifacts.get(key);
            }

            @Override
            public void close() {
                artifacts.close();
            }
        };
        // inline limit 0 sends every snapshot to the failing store
        FlowEngine<Trail> flaky = new FlowEngine<>(store, new Rehydrator<>(store, failingPuts,
                new JsonStateCodec<>(Trail.class), Trail::empty, Trail::add, 0), SnapshotPolicy.everyRecords(1));
        UUID flow = flaky.startFlow("ingest", null, null, null).get(5, TimeUnit.SECONDS);

        PersistOutcome first = flaky.appendAndSnapshot(NewRecord.of(flow, "a", null), 0).get(5, TimeUnit.SECONDS);
        PersistOutcome second = flaky.appendAndSnapshot(NewRecord.of(flow, "b", null), 1).get(5, TimeUnit.SECONDS);

        assertEquals(PersistOutcome.ok(1, 1), first);
        assertEquals(PersistOutcome.ok(2, 2), second);
        assertEquals(2L, flaky.countRecords(flow).get(5, TimeUnit.SECONDS));
        assertTrue(flaky.snapshots(flow).get(5, TimeUnit.SECONDS).isEmpty());
        assertEquals(List.of("a", "b"), flaky.rehydrate(flow).get(5, TimeUnit.SECONDS).state().keys());
    }

    @Test
    void testSaveSnapshot_AtCurrentCursor() throws Exception {
        UUID flow = startFlow();
        engine.append(flow, "a", null, null, null, 0).get(5, TimeUnit.SECONDS);

        UUID snapshotId = engine.saveSnapshot(flow, Documents.emptyObject().put("manual", true))
                .get(5, TimeUnit.SECONDS);

        SnapshotMeta snapshot = store.loadSnapshot(snapshotId).get(5, TimeUnit.SECONDS);
        assertEquals(1, snapshot.cursor());
        assertTrue(snapshot.metadata().path("manual").asBoolean());
    }

    // ========================================================================
    // Branch / delete / prune
    // ========================================================================

    @Test
    void testBranch_ThenDeleteParent() throws Exception {
        UUID flow = startFlow();
        engine.append(flow, "a", null, null, null, 0).get(5, TimeUnit.SECONDS);
        engine.append(flow, "b", null, null, null, 1).get(5, TimeUnit.SECONDS);

        UUID retry = engine.branch(flow, "retry", "queued", 1, null).get(5, TimeUnit.SECONDS);
        engine.delete(flow).get(5, TimeUnit.SECONDS);

        assertEquals(-1L, engine.countRecords(flow).get(5, TimeUnit.SECONDS));
        assertEquals(List.of("a"), engine.rehydrate(retry).get(5, TimeUnit.SECONDS).state().keys());
    }

    @Test
    void testNeverPolicy_NoSnapshots() throws Exception {
        FlowEngine<Trail> plain = new FlowEngine<>(store, new Rehydrator<>(store, artifacts,
                new JsonStateCodec<>(Trail.class), Trail::empty, Trail::add, 4096));
        UUID flow = plain.startFlow(null, null, null, null).get(5, TimeUnit.SECONDS);
        for (int i = 0; i < 5; i++) {
            plain.appendAndSnapshot(NewRecord.of(flow, "k", null), i).get(5, TimeUnit.SECONDS);
        }

        assertTrue(plain.snapshots(flow).get(5, TimeUnit.SECONDS).isEmpty());
        assertEquals(5, plain.rehydrate(flow).get(5, TimeUnit.SECONDS).state().keys().size());
    }
}
