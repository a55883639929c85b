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
import java.util.Optional;
import java.util.UUID;

/**
 * One immutable, self-contained unit of a lineage's history.
 * <p>
 * Cursors within a lineage start at 1 and are contiguous: the n-th record has
 * cursor n. {@code version} is the lineage version this record's append produced;
 * an idempotent replay of the same command returns it unchanged.
 *
 * @param id        record identifier, independent of position
 * @param lineageId owning lineage
 * @param cursor    position within the lineage (1-based)
 * @param key       free-form classification of the record's purpose
 * @param payload   structured payload
 * @param metadata  structured metadata
 * @param commandId optional idempotency token
 * @param version   lineage version after this record was written
 * @param createdAt creation timestamp
 */
public record FlowRecord(
        UUID id,
        UUID lineageId,
        long cursor,
        String key,
        JsonNode payload,
        JsonNode metadata,
        Optional<UUID> commandId,
        long version,
        Instant createdAt
) {

    public FlowRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(lineageId, "lineageId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(createdAt, "createdAt");
        if (cursor < 1) {
            throw new IllegalArgumentException("cursor must be >= 1, was " + cursor);
        }
        commandId = commandId == null ? Optional.empty() : commandId;
        payload = Documents.copyPayload(payload);
        metadata = Documents.copyMetadata(metadata);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    @Override
    public JsonNode metadata() {
        return metadata.deepCopy();
    }

    /**
     * Copy of this record under another lineage, as made when branching.
     * Position, key, payload, metadata and command id are preserved.
     */
    public FlowRecord copyTo(UUID newLineageId, UUID newId, long newVersion) {
        return new FlowRecord(newId, newLineageId, cursor, key, payload, metadata, commandId,
                newVersion, createdAt);
    }
}
