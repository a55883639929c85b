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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.model.SnapshotMeta;
import dev.mars.flowlog.rehydrate.Rehydrated;
import dev.mars.flowlog.rehydrate.Rehydrator;
import dev.mars.flowlog.rehydrate.SnapshotPolicy;
import dev.mars.flowlog.store.RecordSequence;
import dev.mars.flowlog.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for flow runtimes: one object that starts flows, appends their
 * records, forks and trims them, and loads their state.
 * <p>
 * Appends are single attempts. A {@link PersistOutcome.Conflict} is handed back to
 * the caller, who re-reads (e.g. {@link #rehydrate}) and decides whether to retry; a
 * retry that reuses the command id never writes the record twice.
 * <p>
 * Step state uses the key convention {@code step_state:{stepName}}: the latest
 * record with that key holds the step's current state.
 *
 * @param <S> aggregate state type
 */
public final class FlowEngine<S> {

    private static final Logger LOG = LoggerFactory.getLogger(FlowEngine.class);

    /** Key prefix of step-state records. */
    public static final String STEP_STATE_PREFIX = "step_state:";

    private final RecordStore store;
    private final Rehydrator<S> rehydrator;
    private final SnapshotPolicy snapshotPolicy;

    public FlowEngine(RecordStore store, Rehydrator<S> rehydrator) {
        this(store, rehydrator, SnapshotPolicy.never());
    }

    public FlowEngine(RecordStore store, Rehydrator<S> rehydrator, SnapshotPolicy snapshotPolicy) {
        this.store = Objects.requireNonNull(store, "store");
        this.rehydrator = Objects.requireNonNull(rehydrator, "rehydrator");
        this.snapshotPolicy = Objects.requireNonNull(snapshotPolicy, "snapshotPolicy");
    }

    public RecordStore store() {
        return store;
    }

    public static String stepStateKey(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName must not be blank");
        }
        return STEP_STATE_PREFIX + stepName;
    }

    // ========================================================================
    // Flows
    // ========================================================================

    public CompletableFuture<UUID> startFlow(String name, String status, String createdBy, JsonNode metadata) {
        return store.createLineage(name, status, createdBy, metadata)
                .thenApply(id -> {
                    LOG.info("Started flow {} (name={})", id, name);
                    return id;
                });
    }

    public CompletableFuture<Optional<String>> status(UUID lineageId) {
        return store.getLineage(lineageId).thenApply(LineageMeta::status);
    }

    public CompletableFuture<Void> setStatus(UUID lineageId, String status) {
        return store.setStatus(lineageId, Optional.ofNullable(status)).thenApply(meta -> null);
    }

    public CompletableFuture<UUID> branch(UUID lineageId, String name, String status, long atCursor,
                                          JsonNode metadata) {
        return store.branch(lineageId, name, status, atCursor, metadata)
                .thenApply(branchId -> {
                    LOG.info("Branched flow {} from {} at cursor {}", branchId, lineageId, atCursor);
                    return branchId;
                });
    }

    public CompletableFuture<Void> delete(UUID lineageId) {
        return store.deleteLineage(lineageId);
    }

    public CompletableFuture<Void> pruneFrom(UUID lineageId, long fromCursor) {
        return store.pruneFrom(lineageId, fromCursor);
    }

    // ========================================================================
    // Records
    // ========================================================================

    /**
     * @param commandId idempotency key, may be null
     */
    public CompletableFuture<PersistOutcome> append(UUID lineageId, String key, JsonNode payload, JsonNode metadata,
                                                    UUID commandId, long expectedVersion) {
        return store.append(new NewRecord(lineageId, key, payload, metadata, Optional.ofNullable(commandId)),
                expectedVersion);
    }

    public CompletableFuture<PersistOutcome> appendStepState(UUID lineageId, String stepName, JsonNode payload,
                                                             JsonNode metadata, UUID commandId,
                                                             long expectedVersion) {
        return append(lineageId, stepStateKey(stepName), payload, metadata, commandId, expectedVersion);
    }

    /**
     * The most recent step-state record of a step, empty if the step never recorded state.
     */
    public CompletableFuture<Optional<FlowRecord>> latestStepState(UUID lineageId, String stepName) {
        String key = stepStateKey(stepName);
        return store.readRecords(lineageId, 0L).thenApply(records -> {
            FlowRecord latest = null;
            for (FlowRecord record : records) {
                if (record.key().equals(key)) {
                    latest = record;
                }
            }
            return Optional.ofNullable(latest);
        });
    }

    public CompletableFuture<RecordSequence> records(UUID lineageId, long fromCursor) {
        return store.readRecords(lineageId, fromCursor);
    }

    /**
     * @return a Future with the record count, -1 if the flow does not exist
     */
    public CompletableFuture<Long> countRecords(UUID lineageId) {
        return store.countRecords(lineageId);
    }

    // ========================================================================
    // State
    // ========================================================================

    public CompletableFuture<Rehydrated<S>> rehydrate(UUID lineageId) {
        return rehydrator.rehydrate(lineageId);
    }

    /**
     * Rehydrates the flow and stores a snapshot of the result.
     */
    public CompletableFuture<UUID> saveSnapshot(UUID lineageId, JsonNode metadata) {
        return rehydrator.rehydrate(lineageId)
                .thenCompose(state -> rehydrator.snapshot(lineageId, state, metadata));
    }

    public CompletableFuture<List<SnapshotMeta>> snapshots(UUID lineageId) {
        return store.listSnapshots(lineageId);
    }

    /**
     * Appends, then takes a snapshot if the {@link SnapshotPolicy} asks for one. The
     * outcome is the append's; idempotent replays and conflicts never snapshot.
     * <p>
     * Once the record is written the outcome is always returned: a failed snapshot is
     * logged and left for the next append to retry.
     */
    public CompletableFuture<PersistOutcome> appendAndSnapshot(NewRecord record, long expectedVersion) {
        return store.append(record, expectedVersion).thenCompose(outcome -> {
            if (!(outcome instanceof PersistOutcome.Ok ok) || ok.replayed()) {
                return CompletableFuture.completedFuture(outcome);
            }
            return snapshotIfDue(record.lineageId(), ok.cursor()).handle((snapshotted, e) -> {
                if (e != null) {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    LOG.warn("Flow {}: record at cursor {} is stored but the policy snapshot failed",
                            record.lineageId(), ok.cursor(), cause);
                }
                return outcome;
            });
        });
    }

    private CompletableFuture<Boolean> snapshotIfDue(UUID lineageId, long cursor) {
        return store.loadLatestSnapshot(lineageId).thenCompose(latest -> {
            long lastSnapshotCursor = latest.map(SnapshotMeta::cursor).orElse(0L);
            if (!snapshotPolicy.shouldSnapshot(cursor, lastSnapshotCursor)) {
                return CompletableFuture.completedFuture(false);
            }
            LOG.debug("Snapshot policy triggered for flow {} at cursor {} (last snapshot at {})",
                    lineageId, cursor, lastSnapshotCursor);
            return saveSnapshot(lineageId, null).thenApply(snapshotId -> true);
        });
    }
}
