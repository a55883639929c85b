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
package dev.mars.flowlog.store;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.model.SnapshotMeta;
import dev.mars.flowlog.model.StatePointer;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Lineage Record Store.
 * <p>
 * The only component allowed to create, mutate or delete persisted lineages, records
 * and snapshots. Backends (in-memory, file journal, ...) implement exactly this
 * contract; the rehydration engine, the engine facade and all collaborators depend on
 * it and never on a concrete backend.
 * <p>
 * <b>Atomicity:</b> every operation touching more than one entry (append, branch,
 * delete, prune) is applied fully or not at all, and concurrent readers never observe
 * a partially applied write.
 * <p>
 * <b>Outcomes:</b> version conflicts are a normal {@link PersistOutcome}. Futures
 * complete exceptionally with {@link NotFoundException}, {@link StorageException},
 * {@link NotImplementedException} or {@link CursorOutOfRangeException}.
 *
 * @see dev.mars.flowlog.store.memory.InMemoryRecordStore
 * @see dev.mars.flowlog.store.file.FileRecordStore
 */
public interface RecordStore extends Closeable {

    // ========================================================================
    // Lineages
    // ========================================================================

    /**
     * Allocates a new root lineage with cursor 0, version 0 and no parent.
     *
     * @param name     optional name
     * @param status   optional status label
     * @param metadata schema-free metadata ({@code null} means {@code {}})
     * @return a Future with the generated lineage id
     */
    default CompletableFuture<UUID> createLineage(String name, String status, JsonNode metadata) {
        return createLineage(name, status, null, metadata);
    }

    /**
     * As {@link #createLineage(String, String, JsonNode)}, with a creator tag.
     */
    CompletableFuture<UUID> createLineage(String name, String status, String createdBy, JsonNode metadata);

    /**
     * Loads lineage metadata.
     *
     * @return a Future failing with {@link NotFoundException} if the lineage does not exist
     */
    CompletableFuture<LineageMeta> getLineage(UUID lineageId);

    /**
     * Loads lineage metadata, empty if it does not exist.
     */
    CompletableFuture<Optional<LineageMeta>> findLineage(UUID lineageId);

    CompletableFuture<Boolean> lineageExists(UUID lineageId);

    /**
     * Counts the records of a lineage.
     * <p>
     * Returns <b>-1</b>, not an error, when the lineage does not exist, so callers can
     * tell "no such lineage" from "lineage with zero records".
     */
    CompletableFuture<Long> countRecords(UUID lineageId);

    /**
     * Replaces the status label. Cursor and version are unchanged.
     *
     * @return a Future with the updated metadata
     */
    CompletableFuture<LineageMeta> setStatus(UUID lineageId, Optional<String> status);

    /**
     * Lightweight pre-check of a caller's expected version. Advisory only: the
     * authoritative check is the one {@link #append} performs atomically.
     *
     * @return a Future with true if the lineage's version currently equals {@code expectedVersion}
     */
    CompletableFuture<Boolean> checkVersion(UUID lineageId, long expectedVersion);

    /**
     * Ids of lineages whose parent reference points at {@code lineageId}.
     */
    CompletableFuture<List<UUID>> listChildren(UUID lineageId);

    // ========================================================================
    // Records
    // ========================================================================

    /**
     * Appends a record, atomically:
     * <ol>
     *   <li>if the lineage's version differs from {@code expectedVersion}, returns
     *       {@code Conflict} and writes nothing;</li>
     *   <li>if the record's command id is already stored for the lineage, returns the
     *       prior {@code Ok} (flagged {@code replayed}) and writes nothing;</li>
     *   <li>otherwise inserts the record at cursor {@code cursor + 1}, increments cursor
     *       and version, and returns {@code Ok(newVersion)}.</li>
     * </ol>
     * No two concurrent appends can both succeed against the same expected version.
     *
     * @return a Future with the outcome, failing with {@link NotFoundException} if the
     * lineage does not exist
     */
    CompletableFuture<PersistOutcome> append(NewRecord record, long expectedVersion);

    /**
     * Reads the records with cursor strictly greater than {@code fromCursor}, ascending.
     * {@code fromCursor = 0} reads the whole history. An unknown lineage or an empty
     * range yields an empty sequence.
     */
    CompletableFuture<RecordSequence> readRecords(UUID lineageId, long fromCursor);

    /**
     * Reads the starting snapshot and the records after it from a single version of
     * the lineage, so that a concurrent prune or snapshot delete cannot leave the two
     * out of step.
     *
     * @return a Future failing with {@link NotFoundException} for an unknown lineage,
     * or for a requested snapshot the lineage does not (or no longer) hold
     */
    CompletableFuture<ReplayStart> readForReplay(UUID lineageId, ReplayStart.From from);

    /**
     * Removes every record with cursor {@code >= fromCursor} and every snapshot taken at
     * such a cursor. The lineage cursor becomes {@code fromCursor - 1}; the version moves
     * forward by one so writers holding the old version conflict. Lineages branched from
     * this one at a cursor {@code >= fromCursor} no longer have a fork point and are
     * deleted through {@link #deleteLineage}, their own children following the store's
     * {@link ChildLineagePolicy}.
     *
     * @param fromCursor first cursor to remove, in {@code 1..cursor + 1}
     * @return a Future failing with {@link CursorOutOfRangeException} outside that range
     */
    CompletableFuture<Void> pruneFrom(UUID lineageId, long fromCursor);

    // ========================================================================
    // Branching & deletion
    // ========================================================================

    /**
     * Forks a new lineage whose history is the parent's prefix up to and including
     * {@code parentCursor}. Records and snapshots at or below the fork point are copied
     * with their cursors; the branch starts with cursor = version = {@code parentCursor}.
     * Name, status and metadata default to the parent's when not given.
     *
     * @param parentCursor fork point, in {@code 0..parent cursor}
     * @return a Future with the new lineage id; failing with {@link NotFoundException}
     * for an unknown parent and {@link CursorOutOfRangeException} for a fork point
     * beyond the parent's cursor
     */
    CompletableFuture<UUID> branch(UUID parentLineageId, String name, String status,
                                   long parentCursor, JsonNode metadata);

    /**
     * Deletes a lineage with all its records and snapshots. Children are orphaned or
     * deleted according to the store's {@link ChildLineagePolicy}.
     *
     * @return a Future failing with {@link NotFoundException} if the lineage does not exist
     */
    CompletableFuture<Void> deleteLineage(UUID lineageId);

    // ========================================================================
    // Snapshots
    // ========================================================================

    /**
     * Records a snapshot of a lineage's state at {@code cursor}.
     *
     * @param cursor in {@code 0..lineage cursor}
     * @return a Future with the snapshot id
     */
    CompletableFuture<UUID> saveSnapshot(UUID lineageId, long cursor, StatePointer statePointer,
                                         JsonNode metadata);

    /**
     * @return a Future failing with {@link NotFoundException} for an unknown snapshot
     */
    CompletableFuture<SnapshotMeta> loadSnapshot(UUID snapshotId);

    /**
     * The snapshot with the highest cursor not exceeding the lineage's current cursor;
     * empty (not an error) when there is none.
     */
    CompletableFuture<Optional<SnapshotMeta>> loadLatestSnapshot(UUID lineageId);

    /**
     * All snapshots of a lineage, ascending by cursor.
     */
    CompletableFuture<List<SnapshotMeta>> listSnapshots(UUID lineageId);

    /**
     * Deletes one snapshot. Records are not affected.
     */
    CompletableFuture<Void> deleteSnapshot(UUID snapshotId);

    /**
     * Releases all resources. After close, no other methods should be called.
     */
    @Override
    void close();
}
