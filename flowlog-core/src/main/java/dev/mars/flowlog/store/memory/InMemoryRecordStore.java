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
package dev.mars.flowlog.store.memory;

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
import dev.mars.flowlog.store.MutationLog;
import dev.mars.flowlog.store.NotFoundException;
import dev.mars.flowlog.store.RecordSequence;
import dev.mars.flowlog.store.RecordStore;
import dev.mars.flowlog.store.ReplayStart;
import dev.mars.flowlog.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Volatile {@link RecordStore}, for tests, demos and single-process embedding.
 * <p>
 * Create one instance at process start and {@link #close()} it at the end; every
 * component that needs a store is handed that instance. There is no hidden global.
 * <p>
 * Operations run on the calling thread and return already-completed futures.
 * Readers never block: see {@link LineageTable} for the concurrency model.
 */
public final class InMemoryRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private final LineageTable table = new LineageTable();
    private final ChildLineagePolicy childPolicy;
    private final Clock clock;
    private volatile boolean closed = false;

    public InMemoryRecordStore() {
        this(ChildLineagePolicy.ORPHAN, Clock.systemUTC());
    }

    public InMemoryRecordStore(FlowStoreConfig config) {
        this(config.childPolicy(), Clock.systemUTC());
    }

    public InMemoryRecordStore(ChildLineagePolicy childPolicy, Clock clock) {
        this.childPolicy = Objects.requireNonNull(childPolicy, "childPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOG.debug("InMemoryRecordStore created: childPolicy={}", childPolicy);
    }

    public ChildLineagePolicy childPolicy() {
        return childPolicy;
    }

    @Override
    public CompletableFuture<UUID> createLineage(String name, String status, String createdBy, JsonNode metadata) {
        return call(() -> table.create(
                LineageMeta.root(UUID.randomUUID(), name, status, createdBy, metadata, clock.instant()),
                MutationLog.NONE).id());
    }

    @Override
    public CompletableFuture<LineageMeta> getLineage(UUID lineageId) {
        return call(() -> table.find(lineageId).orElseThrow(() -> NotFoundException.lineage(lineageId)));
    }

    @Override
    public CompletableFuture<Optional<LineageMeta>> findLineage(UUID lineageId) {
        return call(() -> table.find(lineageId));
    }

    @Override
    public CompletableFuture<Boolean> lineageExists(UUID lineageId) {
        return call(() -> table.find(lineageId).isPresent());
    }

    @Override
    public CompletableFuture<Long> countRecords(UUID lineageId) {
        return call(() -> table.countRecords(lineageId));
    }

    @Override
    public CompletableFuture<LineageMeta> setStatus(UUID lineageId, Optional<String> status) {
        return call(() -> table.setStatus(lineageId, status, MutationLog.NONE));
    }

    @Override
    public CompletableFuture<Boolean> checkVersion(UUID lineageId, long expectedVersion) {
        return call(() -> table.find(lineageId)
                .orElseThrow(() -> NotFoundException.lineage(lineageId))
                .version() == expectedVersion);
    }

    @Override
    public CompletableFuture<List<UUID>> listChildren(UUID lineageId) {
        return call(() -> table.children(lineageId));
    }

    @Override
    public CompletableFuture<PersistOutcome> append(NewRecord record, long expectedVersion) {
        return call(() -> table.append(record, expectedVersion, UUID.randomUUID(), clock.instant(),
                MutationLog.NONE));
    }

    @Override
    public CompletableFuture<RecordSequence> readRecords(UUID lineageId, long fromCursor) {
        return call(() -> table.records(lineageId, fromCursor));
    }

    @Override
    public CompletableFuture<ReplayStart> readForReplay(UUID lineageId, ReplayStart.From from) {
        return call(() -> table.replayStart(lineageId, from));
    }

    @Override
    public CompletableFuture<Void> pruneFrom(UUID lineageId, long fromCursor) {
        return call(() -> {
            table.prune(lineageId, fromCursor, childPolicy, MutationLog.NONE);
            return null;
        });
    }

    @Override
    public CompletableFuture<UUID> branch(UUID parentLineageId, String name, String status,
                                          long parentCursor, JsonNode metadata) {
        return call(() -> table.branch(new Mutation.Branch(parentLineageId, UUID.randomUUID(), parentCursor,
                Optional.ofNullable(name), Optional.ofNullable(status), metadata, clock.instant()),
                MutationLog.NONE).id());
    }

    @Override
    public CompletableFuture<Void> deleteLineage(UUID lineageId) {
        return call(() -> {
            table.delete(lineageId, childPolicy, MutationLog.NONE);
            return null;
        });
    }

    @Override
    public CompletableFuture<UUID> saveSnapshot(UUID lineageId, long cursor, StatePointer statePointer,
                                                JsonNode metadata) {
        return call(() -> table.saveSnapshot(
                new SnapshotMeta(UUID.randomUUID(), lineageId, cursor, statePointer, metadata, clock.instant()),
                MutationLog.NONE).id());
    }

    @Override
    public CompletableFuture<SnapshotMeta> loadSnapshot(UUID snapshotId) {
        return call(() -> table.snapshot(snapshotId).orElseThrow(() -> NotFoundException.snapshot(snapshotId)));
    }

    @Override
    public CompletableFuture<Optional<SnapshotMeta>> loadLatestSnapshot(UUID lineageId) {
        return call(() -> table.latestSnapshot(lineageId));
    }

    @Override
    public CompletableFuture<List<SnapshotMeta>> listSnapshots(UUID lineageId) {
        return call(() -> table.snapshots(lineageId));
    }

    @Override
    public CompletableFuture<Void> deleteSnapshot(UUID snapshotId) {
        return call(() -> {
            table.deleteSnapshot(snapshotId, MutationLog.NONE);
            return null;
        });
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.debug("InMemoryRecordStore closed ({} lineages discarded)", table.lineageCount());
    }

    private <T> CompletableFuture<T> call(Supplier<T> operation) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Store is closed"));
        }
        try {
            return CompletableFuture.completedFuture(operation.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
