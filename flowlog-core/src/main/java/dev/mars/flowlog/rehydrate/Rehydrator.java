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
package dev.mars.flowlog.rehydrate;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.flowlog.artifact.ArtifactStore;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.SnapshotMeta;
import dev.mars.flowlog.model.StatePointer;
import dev.mars.flowlog.store.NotFoundException;
import dev.mars.flowlog.store.NotImplementedException;
import dev.mars.flowlog.store.RecordSequence;
import dev.mars.flowlog.store.RecordStore;
import dev.mars.flowlog.store.ReplayStart;
import dev.mars.flowlog.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Rebuilds a lineage's state from its latest snapshot and the records after it.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>Read the snapshot with the highest cursor not beyond the lineage's cursor, and
 *       the records after it, from one version of the lineage
 *       ({@link RecordStore#readForReplay})</li>
 *   <li>If there is one, decode its state (inline, or fetched from the
 *       {@link ArtifactStore}); otherwise start from the initial state at cursor 0</li>
 *   <li>Fold every record with a greater cursor into the state, in cursor order</li>
 * </ol>
 * The applier is pure, so the result equals {@link #rehydrateFromScratch} for any
 * valid snapshot.
 *
 * @param <S> state type
 */
public final class Rehydrator<S> {

    private static final Logger LOG = LoggerFactory.getLogger(Rehydrator.class);

    private final RecordStore store;
    private final ArtifactStore artifacts;
    private final StateCodec<S> codec;
    private final Supplier<S> initialState;
    private final RecordApplier<S> applier;
    private final int inlineSnapshotMaxBytes;

    /**
     * @param store                  source of records and snapshots
     * @param artifacts              blob store for large snapshot state; {@link ArtifactStore#unsupported()} keeps everything inline
     * @param codec                  state serialization
     * @param initialState           state before the first record
     * @param applier                pure fold of one record into the state
     * @param inlineSnapshotMaxBytes encoded states up to this size are stored inside the snapshot
     */
    public Rehydrator(RecordStore store,
                      ArtifactStore artifacts,
                      StateCodec<S> codec,
                      Supplier<S> initialState,
                      RecordApplier<S> applier,
                      int inlineSnapshotMaxBytes) {
        this.store = Objects.requireNonNull(store, "store");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.initialState = Objects.requireNonNull(initialState, "initialState");
        this.applier = Objects.requireNonNull(applier, "applier");
        if (inlineSnapshotMaxBytes < 0) {
            throw new IllegalArgumentException("inlineSnapshotMaxBytes must be >= 0, was " + inlineSnapshotMaxBytes);
        }
        this.inlineSnapshotMaxBytes = inlineSnapshotMaxBytes;
    }

    /**
     * Rehydrates from the latest usable snapshot.
     *
     * @return a Future failing with {@link NotFoundException} for an unknown lineage
     */
    public CompletableFuture<Rehydrated<S>> rehydrate(UUID lineageId) {
        return replay(lineageId, ReplayStart.From.latestSnapshot());
    }

    /**
     * Rehydrates from the initial state, ignoring snapshots.
     */
    public CompletableFuture<Rehydrated<S>> rehydrateFromScratch(UUID lineageId) {
        return replay(lineageId, ReplayStart.From.scratch());
    }

    /**
     * Rehydrates starting from a specific snapshot of the lineage.
     *
     * @return a Future failing with {@link NotFoundException} if the snapshot does not
     * belong to the lineage
     */
    public CompletableFuture<Rehydrated<S>> rehydrateFrom(UUID lineageId, UUID snapshotId) {
        return replay(lineageId, ReplayStart.From.snapshot(snapshotId));
    }

    /**
     * Stores a snapshot of a rehydrated state at its cursor. States up to the inline
     * limit are kept in the snapshot; larger ones go to the artifact store and are
     * referenced. A backend without artifact support gets the state inline.
     *
     * @return a Future with the snapshot id
     */
    public CompletableFuture<UUID> snapshot(UUID lineageId, Rehydrated<S> rehydrated, JsonNode metadata) {
        byte[] encoded;
        try {
            encoded = codec.encode(rehydrated.state());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return pointerFor(encoded)
                .thenCompose(pointer -> store.saveSnapshot(lineageId, rehydrated.cursor(), pointer, metadata))
                .thenApply(snapshotId -> {
                    LOG.debug("Snapshot {} of lineage {} at cursor {} ({} bytes)",
                            snapshotId, lineageId, rehydrated.cursor(), encoded.length);
                    return snapshotId;
                });
    }

    /**
     * Decodes the state a snapshot points to.
     */
    public CompletableFuture<S> loadState(SnapshotMeta snapshot) {
        StatePointer pointer = snapshot.statePointer();
        CompletableFuture<byte[]> bytes;
        if (pointer instanceof StatePointer.Inline inline) {
            bytes = CompletableFuture.completedFuture(inline.state());
        } else {
            bytes = artifacts.get(((StatePointer.Reference) pointer).key());
        }
        return bytes.thenApply(raw -> decode(snapshot, raw));
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private CompletableFuture<Rehydrated<S>> replay(UUID lineageId, ReplayStart.From from) {
        return store.readForReplay(lineageId, from).thenCompose(start -> {
            CompletableFuture<S> initial = start.snapshot()
                    .map(this::loadState)
                    .orElseGet(() -> CompletableFuture.completedFuture(initialState.get()));
            Optional<UUID> snapshotId = start.snapshot().map(SnapshotMeta::id);
            return initial.thenApply(state -> {
                Rehydrated<S> result = fold(lineageId, state, start.startCursor(), snapshotId, start.records());
                LOG.debug("Rehydrated lineage {} to cursor {} (start={}, snapshot={}, replayed={})",
                        lineageId, result.cursor(), start.startCursor(),
                        snapshotId.map(UUID::toString).orElse("(none)"), result.replayedCount());
                return result;
            });
        });
    }

    private Rehydrated<S> fold(UUID lineageId, S start, long startCursor, Optional<UUID> snapshotId,
                               RecordSequence records) {
        S state = start;
        long cursor = startCursor;
        long replayed = 0;
        for (FlowRecord record : records) {
            if (record.cursor() != cursor + 1) {
                throw new StorageException("Lineage " + lineageId + " has a gap: expected cursor "
                        + (cursor + 1) + " but read " + record.cursor());
            }
            state = applier.apply(state, record);
            cursor = record.cursor();
            replayed++;
        }
        return new Rehydrated<>(state, cursor, snapshotId, startCursor, replayed);
    }

    private S decode(SnapshotMeta snapshot, byte[] raw) {
        try {
            return codec.decode(raw);
        } catch (IOException e) {
            throw new StorageException("State of snapshot " + snapshot.id() + " cannot be decoded", e);
        }
    }

    private CompletableFuture<StatePointer> pointerFor(byte[] encoded) {
        if (encoded.length <= inlineSnapshotMaxBytes) {
            return CompletableFuture.completedFuture(StatePointer.inline(encoded));
        }
        return artifacts.put(encoded)
                .thenApply(StatePointer::reference)
                .exceptionallyCompose(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof NotImplementedException) {
                        LOG.debug("Artifact store unsupported, keeping {} byte state inline", encoded.length);
                        return CompletableFuture.completedFuture(StatePointer.inline(encoded));
                    }
                    return CompletableFuture.failedFuture(cause);
                });
    }
}
