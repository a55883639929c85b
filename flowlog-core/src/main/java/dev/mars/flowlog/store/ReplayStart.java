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

import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.SnapshotMeta;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything a rehydration needs, read from one version of a lineage: its metadata,
 * the snapshot to start from (if any) and the records after that snapshot.
 * <p>
 * The three parts always agree with each other. A prune or delete that lands after
 * the read does not change them.
 *
 * @param lineage  lineage metadata at the time of the read
 * @param snapshot the snapshot to start from, empty to start from the initial state
 * @param records  records with cursor greater than {@link #startCursor()}, up to {@code lineage.cursor()}
 */
public record ReplayStart(
        LineageMeta lineage,
        Optional<SnapshotMeta> snapshot,
        RecordSequence records
) {

    public ReplayStart {
        Objects.requireNonNull(lineage, "lineage");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(records, "records");
    }

    /**
     * @return the snapshot's cursor, or 0 when replay starts from the initial state
     */
    public long startCursor() {
        return snapshot.map(SnapshotMeta::cursor).orElse(0L);
    }

    /**
     * Which snapshot a replay starts from.
     *
     * @param useSnapshot false to ignore snapshots and replay the whole history
     * @param snapshotId  a specific snapshot; empty for the latest usable one
     */
    public record From(boolean useSnapshot, Optional<UUID> snapshotId) {

        private static final From LATEST = new From(true, Optional.empty());
        private static final From SCRATCH = new From(false, Optional.empty());

        public From {
            Objects.requireNonNull(snapshotId, "snapshotId");
            if (!useSnapshot && snapshotId.isPresent()) {
                throw new IllegalArgumentException("A snapshot id requires useSnapshot");
            }
        }

        /** The snapshot with the highest cursor not beyond the lineage's cursor. */
        public static From latestSnapshot() {
            return LATEST;
        }

        public static From scratch() {
            return SCRATCH;
        }

        public static From snapshot(UUID snapshotId) {
            return new From(true, Optional.of(Objects.requireNonNull(snapshotId, "snapshotId")));
        }
    }
}
