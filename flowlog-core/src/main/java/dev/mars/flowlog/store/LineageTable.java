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

import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.model.SnapshotMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The lineage/record/snapshot tables every {@link RecordStore} backend is built on.
 * <p>
 * <b>Concurrency model:</b>
 * <ul>
 *   <li>Each lineage has its own lock. Writers to different lineages never contend.</li>
 *   <li>Readers take no lock: they read the lineage's current {@link LineageView},
 *       an immutable handle published with a volatile write after the change is complete.</li>
 *   <li>Operations that touch several lineages (delete, prune with children) lock them
 *       parent before child. Parent links only change under the parent's lock, so the
 *       order is the same for every thread and cannot deadlock.</li>
 * </ul>
 * <p>
 * <b>Write path:</b> validate and plan under the lock, hand the resulting
 * {@link Mutation} to the {@link MutationLog}, and only if that returns apply it.
 * Conflicts and idempotent replays are not mutations and are never logged.
 * <p>
 * Ids and timestamps are supplied by the caller, so that {@link #replay} of a logged
 * mutation reproduces exactly what the live call did.
 */
public final class LineageTable {

    private static final Logger LOG = LoggerFactory.getLogger(LineageTable.class);

    private final ConcurrentMap<UUID, Slot> lineages = new ConcurrentHashMap<>();
    private final ConcurrentMap<UUID, UUID> snapshotOwners = new ConcurrentHashMap<>();

    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        volatile LineageView view;
        // guarded by lock
        boolean removed;

        Slot(LineageView view) {
            this.view = view;
        }
    }

    // ========================================================================
    // Reads (lock-free)
    // ========================================================================

    public Optional<LineageMeta> find(UUID lineageId) {
        Slot slot = lineages.get(lineageId);
        return slot == null ? Optional.empty() : Optional.of(slot.view.meta());
    }

    public Optional<LineageView> view(UUID lineageId) {
        Slot slot = lineages.get(lineageId);
        return slot == null ? Optional.empty() : Optional.of(slot.view);
    }

    /**
     * Record count, or -1 if the lineage does not exist.
     */
    public long countRecords(UUID lineageId) {
        Slot slot = lineages.get(lineageId);
        return slot == null ? -1L : slot.view.meta().cursor();
    }

    public RecordSequence records(UUID lineageId, long fromCursor) {
        Slot slot = lineages.get(lineageId);
        if (slot == null) {
            return RecordSequence.empty();
        }
        return RecordSequence.of(slot.view.recordsAfter(Math.max(0L, fromCursor)));
    }

    /**
     * Snapshot and records taken from one {@link LineageView}.
     *
     * @throws NotFoundException for an unknown lineage, or a snapshot the view does not hold
     */
    public ReplayStart replayStart(UUID lineageId, ReplayStart.From from) {
        LineageView view = require(lineageId).view;
        Optional<SnapshotMeta> snapshot = Optional.empty();
        if (from.snapshotId().isPresent()) {
            UUID snapshotId = from.snapshotId().get();
            snapshot = Optional.of(view.snapshot(snapshotId)
                    .filter(s -> s.cursor() <= view.meta().cursor())
                    .orElseThrow(() -> new NotFoundException("Snapshot " + snapshotId
                            + " does not belong to lineage " + lineageId)));
        } else if (from.useSnapshot()) {
            snapshot = view.latestSnapshot();
        }
        long start = snapshot.map(SnapshotMeta::cursor).orElse(0L);
        return new ReplayStart(view.meta(), snapshot, RecordSequence.of(view.recordsAfter(start)));
    }

    public Optional<SnapshotMeta> latestSnapshot(UUID lineageId) {
        Slot slot = lineages.get(lineageId);
        return slot == null ? Optional.empty() : slot.view.latestSnapshot();
    }

    public List<SnapshotMeta> snapshots(UUID lineageId) {
        Slot slot = lineages.get(lineageId);
        return slot == null ? List.of() : slot.view.snapshots();
    }

    public Optional<SnapshotMeta> snapshot(UUID snapshotId) {
        UUID owner = snapshotOwners.get(snapshotId);
        if (owner == null) {
            return Optional.empty();
        }
        Slot slot = lineages.get(owner);
        return slot == null ? Optional.empty() : slot.view.snapshot(snapshotId);
    }

    /**
     * Lineages whose parent reference is {@code lineageId}, ordered by creation time.
     */
    public List<UUID> children(UUID lineageId) {
        List<LineageMeta> found = new ArrayList<>();
        for (Slot slot : lineages.values()) {
            LineageMeta meta = slot.view.meta();
            if (meta.isChildOf(lineageId)) {
                found.add(meta);
            }
        }
        found.sort((a, b) -> {
            int byTime = a.createdAt().compareTo(b.createdAt());
            return byTime != 0 ? byTime : a.id().compareTo(b.id());
        });
        return found.stream().map(LineageMeta::id).toList();
    }

    public int lineageCount() {
        return lineages.size();
    }

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Registers a new root lineage.
     */
    public LineageMeta create(LineageMeta meta, MutationLog log) {
        if (meta.hasParent() || meta.cursor() != 0 || meta.version() != 0) {
            throw new IllegalArgumentException("A new lineage must be a root with cursor 0 and version 0: " + meta);
        }
        if (lineages.containsKey(meta.id())) {
            throw new StorageException("Lineage id already in use: " + meta.id());
        }
        log.write(new Mutation.CreateLineage(meta));
        lineages.put(meta.id(), new Slot(LineageView.empty(meta)));
        LOG.debug("Created lineage {}", meta.id());
        return meta;
    }

    /**
     * Conditional append, see {@link AppendPlan}.
     *
     * @throws NotFoundException if the lineage does not exist
     */
    public PersistOutcome append(NewRecord request, long expectedVersion, UUID recordId, Instant now,
                                 MutationLog log) {
        Slot slot = require(request.lineageId());
        slot.lock.lock();
        try {
            ensureLive(slot, request.lineageId());
            AppendPlan plan = AppendPlan.from(slot.view, request, expectedVersion, recordId, now);
            if (plan.requiresPersistence()) {
                log.write(new Mutation.Append(plan.recordToInsert()));
                slot.view = plan.applyTo(slot.view);
            }
            return plan.outcome();
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Forks a lineage, see {@link BranchPlan}.
     *
     * @throws NotFoundException         if the parent does not exist
     * @throws CursorOutOfRangeException if the fork point is outside the parent's history
     */
    public LineageMeta branch(Mutation.Branch request, MutationLog log) {
        Slot parent = require(request.parentLineageId());
        parent.lock.lock();
        try {
            ensureLive(parent, request.parentLineageId());
            BranchPlan plan = BranchPlan.from(parent.view, request);
            if (lineages.containsKey(request.branchId())) {
                throw new StorageException("Lineage id already in use: " + request.branchId());
            }
            log.write(request);
            lineages.put(request.branchId(), new Slot(plan.toView()));
            for (SnapshotMeta copy : plan.snapshots()) {
                snapshotOwners.put(copy.id(), request.branchId());
            }
            LOG.debug("Branched lineage {} from {} at cursor {} ({} records copied)",
                    request.branchId(), request.parentLineageId(), request.parentCursor(), plan.records().size());
            return plan.branchMeta();
        } finally {
            parent.lock.unlock();
        }
    }

    /**
     * Deletes a lineage with its records and snapshots; children follow {@code policy}.
     *
     * @return ids of every lineage removed, the requested one first
     * @throws NotFoundException if the lineage does not exist
     */
    public List<UUID> delete(UUID lineageId, ChildLineagePolicy policy, MutationLog log) {
        Slot slot = require(lineageId);
        Removal removal = new Removal(policy);
        try {
            removal.lock(slot);
            ensureLive(slot, lineageId);
            removal.collect(lineageId, slot);
            log.write(new Mutation.Delete(lineageId, policy));
            removal.apply();
            LOG.debug("Deleted lineage {} (removed={}, orphaned={})",
                    lineageId, removal.deletedIds(), removal.orphanedCount());
            return removal.deletedIds();
        } finally {
            removal.unlockAll();
        }
    }

    /**
     * Removes records and snapshots at cursors {@code >= fromCursor}, see {@link PrunePlan}.
     * Children forked at or beyond {@code fromCursor} are deleted, their own children
     * following {@code policy}.
     *
     * @throws NotFoundException         if the lineage does not exist
     * @throws CursorOutOfRangeException if {@code fromCursor} is not in {@code 1..cursor + 1}
     */
    public PrunePlan prune(UUID lineageId, long fromCursor, ChildLineagePolicy policy, MutationLog log) {
        Slot slot = require(lineageId);
        Removal removal = new Removal(policy);
        try {
            removal.lock(slot);
            ensureLive(slot, lineageId);
            PrunePlan plan = PrunePlan.from(slot.view, fromCursor);

            for (UUID childId : children(lineageId)) {
                Slot child = lineages.get(childId);
                // parentCursor is fixed for the life of the link, and the link only changes under our lock
                if (child == null || child.view.meta().parentCursor().orElse(-1L) < fromCursor) {
                    continue;
                }
                removal.lock(child);
                if (!child.removed && child.view.meta().isChildOf(lineageId)) {
                    removal.collect(childId, child);
                }
            }

            log.write(new Mutation.Prune(lineageId, fromCursor, policy));
            slot.view = plan.applyTo(slot.view);
            for (SnapshotMeta dropped : plan.removedSnapshots()) {
                snapshotOwners.remove(dropped.id());
            }
            removal.apply();
            LOG.debug("Pruned lineage {} from cursor {} ({} records, {} snapshots, {} lineages removed)",
                    lineageId, fromCursor, plan.removedRecords(), plan.removedSnapshots().size(),
                    removal.deletedIds().size());
            return plan;
        } finally {
            removal.unlockAll();
        }
    }

    /**
     * @throws NotFoundException         if the lineage does not exist
     * @throws CursorOutOfRangeException if the snapshot's cursor is beyond the lineage's cursor
     */
    public SnapshotMeta saveSnapshot(SnapshotMeta snapshot, MutationLog log) {
        Slot slot = require(snapshot.lineageId());
        slot.lock.lock();
        try {
            ensureLive(slot, snapshot.lineageId());
            long cursor = slot.view.meta().cursor();
            if (snapshot.cursor() > cursor) {
                throw new CursorOutOfRangeException(snapshot.lineageId(), snapshot.cursor(), cursor, "Snapshot");
            }
            if (snapshotOwners.containsKey(snapshot.id())) {
                throw new StorageException("Snapshot id already in use: " + snapshot.id());
            }
            log.write(new Mutation.SaveSnapshot(snapshot));
            slot.view = slot.view.withSnapshot(snapshot);
            snapshotOwners.put(snapshot.id(), snapshot.lineageId());
            return snapshot;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * @throws NotFoundException if the snapshot does not exist
     */
    public void deleteSnapshot(UUID snapshotId, MutationLog log) {
        UUID owner = snapshotOwners.get(snapshotId);
        Slot slot = owner == null ? null : lineages.get(owner);
        if (slot == null) {
            throw NotFoundException.snapshot(snapshotId);
        }
        slot.lock.lock();
        try {
            if (slot.removed || slot.view.snapshot(snapshotId).isEmpty()) {
                throw NotFoundException.snapshot(snapshotId);
            }
            log.write(new Mutation.DeleteSnapshot(owner, snapshotId));
            slot.view = slot.view.withoutSnapshot(snapshotId);
            snapshotOwners.remove(snapshotId);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * @throws NotFoundException if the lineage does not exist
     */
    public LineageMeta setStatus(UUID lineageId, Optional<String> status, MutationLog log) {
        Slot slot = require(lineageId);
        slot.lock.lock();
        try {
            ensureLive(slot, lineageId);
            log.write(new Mutation.SetStatus(lineageId, status));
            slot.view = slot.view.withMeta(slot.view.meta().withStatus(status));
            return slot.view.meta();
        } finally {
            slot.lock.unlock();
        }
    }

    // ========================================================================
    // Replay
    // ========================================================================

    /**
     * Re-applies a logged mutation without logging it again.
     *
     * @throws StorageException if the mutation does not reproduce what was logged
     */
    public void replay(Mutation mutation) {
        if (mutation instanceof Mutation.CreateLineage m) {
            create(m.meta(), MutationLog.NONE);
        } else if (mutation instanceof Mutation.Append m) {
            FlowRecord record = m.record();
            NewRecord request = new NewRecord(record.lineageId(), record.key(), record.payload(),
                    record.metadata(), record.commandId());
            PersistOutcome outcome = append(request, record.version() - 1, record.id(), record.createdAt(),
                    MutationLog.NONE);
            if (!(outcome instanceof PersistOutcome.Ok ok) || ok.replayed() || ok.cursor() != record.cursor()) {
                throw new StorageException("Replayed append of record " + record.id() + " to lineage "
                        + record.lineageId() + " at cursor " + record.cursor() + " produced " + outcome);
            }
        } else if (mutation instanceof Mutation.Branch m) {
            branch(m, MutationLog.NONE);
        } else if (mutation instanceof Mutation.Delete m) {
            delete(m.lineageId(), m.policy(), MutationLog.NONE);
        } else if (mutation instanceof Mutation.Prune m) {
            prune(m.lineageId(), m.fromCursor(), m.policy(), MutationLog.NONE);
        } else if (mutation instanceof Mutation.SaveSnapshot m) {
            saveSnapshot(m.snapshot(), MutationLog.NONE);
        } else if (mutation instanceof Mutation.DeleteSnapshot m) {
            deleteSnapshot(m.snapshotId(), MutationLog.NONE);
        } else if (mutation instanceof Mutation.SetStatus m) {
            setStatus(m.lineageId(), m.status(), MutationLog.NONE);
        } else {
            throw new IllegalArgumentException("Unknown mutation: " + mutation);
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Slot require(UUID lineageId) {
        Slot slot = lineages.get(lineageId);
        if (slot == null) {
            throw NotFoundException.lineage(lineageId);
        }
        return slot;
    }

    private static void ensureLive(Slot slot, UUID lineageId) {
        if (slot.removed) {
            throw NotFoundException.lineage(lineageId);
        }
    }

    /**
     * The set of lineages one delete or prune removes or orphans, with the locks it holds.
     * Locks are taken top-down and released in reverse.
     */
    private final class Removal {
        private final ChildLineagePolicy policy;
        private final Deque<Slot> held = new ArrayDeque<>();
        private final List<Map.Entry<UUID, Slot>> deleted = new ArrayList<>();
        private final List<Slot> orphaned = new ArrayList<>();

        Removal(ChildLineagePolicy policy) {
            this.policy = policy;
        }

        void lock(Slot slot) {
            slot.lock.lock();
            held.push(slot);
        }

        /**
         * Marks a locked, live lineage for deletion and walks its children.
         */
        void collect(UUID lineageId, Slot slot) {
            deleted.add(Map.entry(lineageId, slot));
            for (UUID childId : children(lineageId)) {
                Slot child = lineages.get(childId);
                if (child == null) {
                    continue;
                }
                lock(child);
                if (child.removed || !child.view.meta().isChildOf(lineageId)) {
                    continue;
                }
                if (policy == ChildLineagePolicy.CASCADE) {
                    collect(childId, child);
                } else {
                    orphaned.add(child);
                }
            }
        }

        void apply() {
            for (Map.Entry<UUID, Slot> entry : deleted) {
                Slot slot = entry.getValue();
                slot.removed = true;
                lineages.remove(entry.getKey(), slot);
                for (SnapshotMeta snapshot : slot.view.snapshots()) {
                    snapshotOwners.remove(snapshot.id());
                }
            }
            for (Slot child : orphaned) {
                child.view = child.view.withMeta(child.view.meta().orphaned());
            }
        }

        List<UUID> deletedIds() {
            return deleted.stream().map(Map.Entry::getKey).toList();
        }

        int orphanedCount() {
            return orphaned.size();
        }

        void unlockAll() {
            while (!held.isEmpty()) {
                held.pop().lock.unlock();
            }
        }
    }
}
