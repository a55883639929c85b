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

import java.util.List;

/**
 * Pure calculation of a prune: which snapshots go and what the lineage looks like after.
 *
 * @param fromCursor       first cursor removed
 * @param updatedMeta      metadata after the prune (cursor {@code fromCursor - 1}, version + 1)
 * @param removedRecords   number of records removed
 * @param removedSnapshots snapshots taken at a removed cursor
 */
public record PrunePlan(
        long fromCursor,
        LineageMeta updatedMeta,
        long removedRecords,
        List<SnapshotMeta> removedSnapshots
) {

    public PrunePlan {
        removedSnapshots = List.copyOf(removedSnapshots);
    }

    /**
     * @throws CursorOutOfRangeException unless {@code 1 <= fromCursor <= cursor + 1}
     */
    public static PrunePlan from(LineageView current, long fromCursor) {
        LineageMeta meta = current.meta();
        if (fromCursor < 1 || fromCursor > meta.cursor() + 1) {
            throw new CursorOutOfRangeException(meta.id(), fromCursor, meta.cursor(), "Prune");
        }
        List<SnapshotMeta> dropped = current.snapshots().stream()
                .filter(s -> s.cursor() >= fromCursor)
                .toList();
        return new PrunePlan(fromCursor, meta.prunedTo(fromCursor - 1),
                meta.cursor() - (fromCursor - 1), dropped);
    }

    /**
     * <b>CALL THIS ONLY AFTER PERSISTENCE IS SUCCESSFUL.</b>
     */
    LineageView applyTo(LineageView current) {
        return current.prunedFrom(fromCursor, updatedMeta);
    }
}
