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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A state change of a {@link LineageTable}, carrying every generated value (ids,
 * timestamps, policy) so that applying the same sequence of mutations to an empty
 * table always rebuilds the same state. Durable backends journal these.
 */
public sealed interface Mutation {

    /** Lineage this mutation is addressed to (the owning lineage for snapshot deletes is looked up). */
    UUID target();

    record CreateLineage(LineageMeta meta) implements Mutation {
        public CreateLineage {
            Objects.requireNonNull(meta, "meta");
        }

        @Override
        public UUID target() {
            return meta.id();
        }
    }

    record Append(FlowRecord record) implements Mutation {
        public Append {
            Objects.requireNonNull(record, "record");
        }

        @Override
        public UUID target() {
            return record.lineageId();
        }
    }

    record Branch(UUID parentLineageId,
                  UUID branchId,
                  long parentCursor,
                  Optional<String> name,
                  Optional<String> status,
                  JsonNode metadata,
                  Instant createdAt) implements Mutation {
        public Branch {
            Objects.requireNonNull(parentLineageId, "parentLineageId");
            Objects.requireNonNull(branchId, "branchId");
            Objects.requireNonNull(createdAt, "createdAt");
            name = name == null ? Optional.empty() : name;
            status = status == null ? Optional.empty() : status;
            metadata = Documents.copyMetadata(metadata);
        }

        @Override
        public JsonNode metadata() {
            return metadata.deepCopy();
        }

        @Override
        public UUID target() {
            return parentLineageId;
        }
    }

    record Delete(UUID lineageId, ChildLineagePolicy policy) implements Mutation {
        public Delete {
            Objects.requireNonNull(lineageId, "lineageId");
            Objects.requireNonNull(policy, "policy");
        }

        @Override
        public UUID target() {
            return lineageId;
        }
    }

    record Prune(UUID lineageId, long fromCursor, ChildLineagePolicy policy) implements Mutation {
        public Prune {
            Objects.requireNonNull(lineageId, "lineageId");
            Objects.requireNonNull(policy, "policy");
        }

        @Override
        public UUID target() {
            return lineageId;
        }
    }

    record SaveSnapshot(SnapshotMeta snapshot) implements Mutation {
        public SaveSnapshot {
            Objects.requireNonNull(snapshot, "snapshot");
        }

        @Override
        public UUID target() {
            return snapshot.lineageId();
        }
    }

    record DeleteSnapshot(UUID lineageId, UUID snapshotId) implements Mutation {
        public DeleteSnapshot {
            Objects.requireNonNull(lineageId, "lineageId");
            Objects.requireNonNull(snapshotId, "snapshotId");
        }

        @Override
        public UUID target() {
            return lineageId;
        }
    }

    record SetStatus(UUID lineageId, Optional<String> status) implements Mutation {
        public SetStatus {
            Objects.requireNonNull(lineageId, "lineageId");
            status = status == null ? Optional.empty() : status;
        }

        @Override
        public UUID target() {
            return lineageId;
        }
    }
}
