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
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Metadata of a lineage (a "flow"): an independently addressable, ordered history.
 * <p>
 * {@code cursor} is the number of records currently stored and equals the cursor of
 * the newest record. {@code version} grows by exactly one per successful append and
 * is the token for optimistic concurrency. {@code parentLineageId} and
 * {@code parentCursor} are present only for lineages created by branching, and are
 * cleared when the parent is deleted (the lineage is then "orphaned").
 *
 * @param id              globally unique, immutable identifier
 * @param name            optional human-readable name
 * @param status          optional free-form status label ("queued", "running", ...)
 * @param createdAt       creation timestamp
 * @param createdBy       optional creator tag
 * @param cursor          count of records stored
 * @param version         optimistic-concurrency counter
 * @param parentLineageId lineage this one was branched from, if any
 * @param parentCursor    cursor of the parent at which the branch was taken, if any
 * @param metadata        schema-free metadata document
 */
public record LineageMeta(
        UUID id,
        Optional<String> name,
        Optional<String> status,
        Instant createdAt,
        Optional<String> createdBy,
        long cursor,
        long version,
        Optional<UUID> parentLineageId,
        OptionalLong parentCursor,
        JsonNode metadata
) {

    public LineageMeta {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        name = name == null ? Optional.empty() : name;
        status = status == null ? Optional.empty() : status;
        createdBy = createdBy == null ? Optional.empty() : createdBy;
        parentLineageId = parentLineageId == null ? Optional.empty() : parentLineageId;
        parentCursor = parentCursor == null ? OptionalLong.empty() : parentCursor;
        if (parentLineageId.isPresent() != parentCursor.isPresent()) {
            throw new IllegalArgumentException("parentLineageId and parentCursor must be set together");
        }
        if (cursor < 0 || version < 0) {
            throw new IllegalArgumentException("cursor and version must be >= 0 (cursor=" + cursor
                    + ", version=" + version + ")");
        }
        metadata = Documents.copyMetadata(metadata);
    }

    /**
     * A root lineage: cursor 0, version 0, no parent.
     */
    public static LineageMeta root(UUID id, String name, String status, String createdBy,
                                   JsonNode metadata, Instant createdAt) {
        return new LineageMeta(id, Optional.ofNullable(name), Optional.ofNullable(status), createdAt,
                Optional.ofNullable(createdBy), 0L, 0L, Optional.empty(), OptionalLong.empty(), metadata);
    }

    @Override
    public JsonNode metadata() {
        return metadata.deepCopy();
    }

    /** True if this lineage currently references a parent. */
    public boolean hasParent() {
        return parentLineageId.isPresent();
    }

    /** True if this lineage was branched from {@code lineageId}. */
    public boolean isChildOf(UUID lineageId) {
        return parentLineageId.filter(lineageId::equals).isPresent();
    }

    /** Copy after one successful append. */
    public LineageMeta appended() {
        return new LineageMeta(id, name, status, createdAt, createdBy, cursor + 1, version + 1,
                parentLineageId, parentCursor, metadata);
    }

    /** Copy after pruning down to {@code newCursor} records; the version still moves forward. */
    public LineageMeta prunedTo(long newCursor) {
        return new LineageMeta(id, name, status, createdAt, createdBy, newCursor, version + 1,
                parentLineageId, parentCursor, metadata);
    }

    /** Copy with a different status label. */
    public LineageMeta withStatus(Optional<String> newStatus) {
        return new LineageMeta(id, name, newStatus, createdAt, createdBy, cursor, version,
                parentLineageId, parentCursor, metadata);
    }

    /** Copy with the parent reference cleared. */
    public LineageMeta orphaned() {
        return new LineageMeta(id, name, status, createdAt, createdBy, cursor, version,
                Optional.empty(), OptionalLong.empty(), metadata);
    }
}
