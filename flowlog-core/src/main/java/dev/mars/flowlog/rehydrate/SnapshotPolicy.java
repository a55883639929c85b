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

/**
 * Decides when a new snapshot is worth taking. Snapshots are an optimisation:
 * whatever the policy, rehydration yields the same state.
 */
@FunctionalInterface
public interface SnapshotPolicy {

    /**
     * @param cursor             the lineage's cursor after the latest append
     * @param lastSnapshotCursor cursor of the latest snapshot, 0 if there is none
     */
    boolean shouldSnapshot(long cursor, long lastSnapshotCursor);

    static SnapshotPolicy never() {
        return (cursor, lastSnapshotCursor) -> false;
    }

    /**
     * Snapshot once at least {@code interval} records have accumulated since the last one.
     */
    static SnapshotPolicy everyRecords(long interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be >= 1, was " + interval);
        }
        return (cursor, lastSnapshotCursor) -> cursor - lastSnapshotCursor >= interval;
    }
}
