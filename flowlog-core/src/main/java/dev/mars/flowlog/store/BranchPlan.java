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
import dev.mars.flowlog.model.Documents;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.SnapshotMeta;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Pure calculation of the lineage a branch request produces: its metadata and copies
 * of the parent's records and snapshots at or below the fork point.
 * <p>
 * Copies get ids derived from the branch id and the source id, so planning the same
 * {@link Mutation.Branch} twice (once live, once during journal replay) yields the same
 * lineage. A copied record's version is its cursor: the branch's history reads as if
 * it had been appended record by record from version 0.
 *
 * @param branchMeta metadata of the new lineage
 * @param records    copied records, ascending by cursor
 * @param snapshots  copied snapshots
 */
public record BranchPlan(
        LineageMeta branchMeta,
        List<FlowRecord> records,
        List<SnapshotMeta> snapshots
) {

    public BranchPlan {
        records = List.copyOf(records);
        snapshots = List.copyOf(snapshots);
    }

    /**
     * @throws CursorOutOfRangeException if the fork point is negative or beyond the parent's cursor
     */
    public static BranchPlan from(LineageView parent, Mutation.Branch request) {
        LineageMeta parentMeta = parent.meta();
        long forkAt = request.parentCursor();
        if (forkAt < 0 || forkAt > parentMeta.cursor()) {
            throw new CursorOutOfRangeException(parentMeta.id(), forkAt, parentMeta.cursor(), "Branch");
        }

        UUID branchId = request.branchId();
        Optional<String> name = nonBlank(request.name()).or(parentMeta::name);
        Optional<String> status = nonBlank(request.status()).or(parentMeta::status);
        JsonNode metadata = Documents.isEmpty(request.metadata()) ? parentMeta.metadata() : request.metadata();

        LineageMeta meta = new LineageMeta(branchId, name, status, request.createdAt(),
                parentMeta.createdBy(), forkAt, forkAt,
                Optional.of(parentMeta.id()), OptionalLong.of(forkAt), metadata);

        List<FlowRecord> copies = new ArrayList<>();
        for (FlowRecord source : parent.recordsUpTo(forkAt)) {
            copies.add(source.copyTo(branchId, copyId(branchId, source.id()), source.cursor()));
        }
        List<SnapshotMeta> snapshotCopies = parent.snapshotsUpTo(forkAt).stream()
                .map(s -> s.copyTo(branchId, copyId(branchId, s.id())))
                .toList();
        return new BranchPlan(meta, copies, snapshotCopies);
    }

    static UUID copyId(UUID branchId, UUID sourceId) {
        return UUID.nameUUIDFromBytes((branchId + "/" + sourceId).getBytes(StandardCharsets.UTF_8));
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value.filter(v -> !v.isBlank());
    }

    LineageView toView() {
        return LineageView.of(branchMeta, records, snapshots);
    }
}
