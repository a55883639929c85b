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
package dev.mars.flowlog.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A point-in-time capture of a lineage's reconstructed state, used to bound replay.
 * <p>
 * A snapshot at cursor {@code c} holds the state after records {@code 1..c} were
 * applied; replay resumes with the record at {@code c + 1}.
 *
 * @param id           snapshot identifier
 * @param lineageId    owning lineage
 * @param cursor       cursor the state corresponds to
 * @param statePointer the state inline, or a key into an artifact store
 * @param metadata     structured metadata
 * @param createdAt    creation timestamp
 */
public record SnapshotMeta(
        UUID id,
        UUID lineageId,
        long cursor,
        StatePointer statePointer,
        JsonNode metadata,
        Instant createdAt
) {

    public SnapshotMeta {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(lineageId, "lineageId");
        Objects.requireNonNull(statePointer, "statePointer");
        Objects.requireNonNull(createdAt, "createdAt");
        if (cursor < 0) {
            throw new IllegalArgumentException("cursor must be >= 0, was " + cursor);
        }
        metadata = Documents.copyMetadata(metadata);
    }

    @Override
    public JsonNode metadata() {
        return metadata.deepCopy();
    }

    /** Copy of this snapshot under another lineage, cursor preserved. */
    public SnapshotMeta copyTo(UUID newLineageId, UUID newId) {
        return new SnapshotMeta(newId, newLineageId, cursor, statePointer, metadata, createdAt);
    }
}
