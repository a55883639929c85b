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
import dev.mars.flowlog.model.SnapshotMeta;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * An immutable handle on one lineage's state: metadata, records and snapshots.
 * <p>
 * <b>Visibility rule:</b> record reads are bounded by {@code meta().cursor()}. Appends
 * add the new record to the shared record map <i>before</i> the handle carrying the
 * bumped cursor is published, so a reader holding any handle sees exactly the records
 * its metadata accounts for. Pruning never edits a shared map; it builds new ones.
 * Only {@link LineageTable} creates handles, always under the lineage's lock.
 */
public final class LineageView {

    static final Comparator<SnapshotMeta> SNAPSHOT_ORDER =
            Comparator.comparingLong(SnapshotMeta::cursor).thenComparing(SnapshotMeta::createdAt);

    private final LineageMeta meta;
    private final ConcurrentNavigableMap<Long, FlowRecord> records;
    private final Map<UUID, FlowRecord> byCommandId;
    private final List<SnapshotMeta> snapshots;

    private LineageView(LineageMeta meta,
                        ConcurrentNavigableMap<Long, FlowRecord> records,
                        Map<UUID, FlowRecord> byCommandId,
                        List<SnapshotMeta> snapshots) {
        this.meta = meta;
        this.records = records;
        this.byCommandId = byCommandId;
        this.snapshots = snapshots;
    }

    static LineageView empty(LineageMeta meta) {
        return new LineageView(meta, new ConcurrentSkipListMap<>(), new ConcurrentHashMap<>(), List.of());
    }

    static LineageView of(LineageMeta meta, Collection<FlowRecord> records, Collection<SnapshotMeta> snapshots) {
        ConcurrentNavigableMap<Long, FlowRecord> byCursor = new ConcurrentSkipListMap<>();
        Map<UUID, FlowRecord> byCommand = new ConcurrentHashMap<>();
        for (FlowRecord record : records) {
            byCursor.put(record.cursor(), record);
            record.commandId().ifPresent(id -> byCommand.put(id, record));
        }
        List<SnapshotMeta> sorted = new ArrayList<>(snapshots);
        sorted.sort(SNAPSHOT_ORDER);
        return new LineageView(meta, byCursor, byCommand, List.copyOf(sorted));
    }

    public LineageMeta meta() {
        return meta;
    }

    /** Records with {@code fromCursor < cursor <= meta().cursor()}, ascending. Live view. */
    public Collection<FlowRecord> recordsAfter(long fromCursor) {
        if (fromCursor >= meta.cursor()) {
            return List.of();
        }
        return records.subMap(fromCursor, false, meta.cursor(), true).values();
    }

    /** Records with {@code cursor <= upTo}, ascending. */
    public Collection<FlowRecord> recordsUpTo(long upTo) {
        return records.headMap(Math.min(upTo, meta.cursor()), true).values();
    }

    /** The record an earlier append with this command id wrote, if any. */
    public Optional<FlowRecord> recordByCommandId(UUID commandId) {
        FlowRecord record = byCommandId.get(commandId);
        return record != null && record.cursor() <= meta.cursor() ? Optional.of(record) : Optional.empty();
    }

    /** All snapshots, ascending by cursor then creation time. */
    public List<SnapshotMeta> snapshots() {
        return snapshots;
    }

    public List<SnapshotMeta> snapshotsUpTo(long upTo) {
        return snapshots.stream().filter(s -> s.cursor() <= upTo).toList();
    }

    public Optional<SnapshotMeta> snapshot(UUID snapshotId) {
        return snapshots.stream().filter(s -> s.id().equals(snapshotId)).findFirst();
    }

    /** Highest cursor not exceeding the current cursor; the newest wins a tie. */
    public Optional<SnapshotMeta> latestSnapshot() {
        SnapshotMeta latest = null;
        for (SnapshotMeta s : snapshots) {
            if (s.cursor() <= meta.cursor()) {
                latest = s;
            }
        }
        return Optional.ofNullable(latest);
    }

    // ========================================================================
    // Transitions (LineageTable only, lineage lock held)
    // ========================================================================

    LineageView withMeta(LineageMeta newMeta) {
        return new LineageView(newMeta, records, byCommandId, snapshots);
    }

    /**
     * Adds the record to the shared maps, then returns the handle that makes it visible.
     */
    LineageView withAppended(FlowRecord record, LineageMeta newMeta) {
        records.put(record.cursor(), record);
        record.commandId().ifPresent(id -> byCommandId.put(id, record));
        return new LineageView(newMeta, records, byCommandId, snapshots);
    }

    LineageView withSnapshot(SnapshotMeta snapshot) {
        List<SnapshotMeta> updated = new ArrayList<>(snapshots);
        updated.add(snapshot);
        updated.sort(SNAPSHOT_ORDER);
        return new LineageView(meta, records, byCommandId, List.copyOf(updated));
    }

    LineageView withoutSnapshot(UUID snapshotId) {
        return new LineageView(meta, records, byCommandId,
                snapshots.stream().filter(s -> !s.id().equals(snapshotId)).toList());
    }

    /**
     * Fresh maps holding only records below {@code fromCursor}; snapshots at or beyond it dropped.
     */
    LineageView prunedFrom(long fromCursor, LineageMeta newMeta) {
        return of(newMeta, records.headMap(fromCursor, false).values(),
                snapshots.stream().filter(s -> s.cursor() < fromCursor).toList());
    }
}
