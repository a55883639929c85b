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
package dev.mars.flowlog.store.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowlog.model.Documents;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.SnapshotMeta;
import dev.mars.flowlog.model.StatePointer;
import dev.mars.flowlog.store.ChildLineagePolicy;
import dev.mars.flowlog.store.Mutation;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Maps {@link Mutation}s to journal entry types and JSON payloads and back.
 * <p>
 * Payloads are plain Jackson trees: ids as strings, timestamps as ISO-8601, absent
 * optionals as missing fields, documents embedded as-is.
 */
final class JournalCodec {

    static final byte TYPE_CREATE_LINEAGE = 1;
    static final byte TYPE_APPEND = 2;
    static final byte TYPE_BRANCH = 3;
    static final byte TYPE_DELETE = 4;
    static final byte TYPE_PRUNE = 5;
    static final byte TYPE_SAVE_SNAPSHOT = 6;
    static final byte TYPE_DELETE_SNAPSHOT = 7;
    static final byte TYPE_SET_STATUS = 8;

    private JournalCodec() {
    }

    static byte typeOf(Mutation mutation) {
        if (mutation instanceof Mutation.CreateLineage) {
            return TYPE_CREATE_LINEAGE;
        } else if (mutation instanceof Mutation.Append) {
            return TYPE_APPEND;
        } else if (mutation instanceof Mutation.Branch) {
            return TYPE_BRANCH;
        } else if (mutation instanceof Mutation.Delete) {
            return TYPE_DELETE;
        } else if (mutation instanceof Mutation.Prune) {
            return TYPE_PRUNE;
        } else if (mutation instanceof Mutation.SaveSnapshot) {
            return TYPE_SAVE_SNAPSHOT;
        } else if (mutation instanceof Mutation.DeleteSnapshot) {
            return TYPE_DELETE_SNAPSHOT;
        } else if (mutation instanceof Mutation.SetStatus) {
            return TYPE_SET_STATUS;
        }
        throw new IllegalArgumentException("Unknown mutation: " + mutation);
    }

    static String typeName(byte type) {
        return switch (type) {
            case TYPE_CREATE_LINEAGE -> "CREATE_LINEAGE";
            case TYPE_APPEND -> "APPEND";
            case TYPE_BRANCH -> "BRANCH";
            case TYPE_DELETE -> "DELETE";
            case TYPE_PRUNE -> "PRUNE";
            case TYPE_SAVE_SNAPSHOT -> "SAVE_SNAPSHOT";
            case TYPE_DELETE_SNAPSHOT -> "DELETE_SNAPSHOT";
            case TYPE_SET_STATUS -> "SET_STATUS";
            default -> "UNKNOWN(" + type + ")";
        };
    }

    // ========================================================================
    // Encode
    // ========================================================================

    static byte[] encode(Mutation mutation) {
        ObjectNode node = Documents.emptyObject();
        if (mutation instanceof Mutation.CreateLineage m) {
            node.set("lineage", lineage(m.meta()));
        } else if (mutation instanceof Mutation.Append m) {
            node.set("record", record(m.record()));
        } else if (mutation instanceof Mutation.Branch m) {
            node.put("parentLineageId", m.parentLineageId().toString());
            node.put("branchId", m.branchId().toString());
            node.put("parentCursor", m.parentCursor());
            m.name().ifPresent(v -> node.put("name", v));
            m.status().ifPresent(v -> node.put("status", v));
            node.set("metadata", m.metadata());
            node.put("createdAt", m.createdAt().toString());
        } else if (mutation instanceof Mutation.Delete m) {
            node.put("lineageId", m.lineageId().toString());
            node.put("policy", m.policy().name());
        } else if (mutation instanceof Mutation.Prune m) {
            node.put("lineageId", m.lineageId().toString());
            node.put("fromCursor", m.fromCursor());
            node.put("policy", m.policy().name());
        } else if (mutation instanceof Mutation.SaveSnapshot m) {
            node.set("snapshot", snapshot(m.snapshot()));
        } else if (mutation instanceof Mutation.DeleteSnapshot m) {
            node.put("lineageId", m.lineageId().toString());
            node.put("snapshotId", m.snapshotId().toString());
        } else if (mutation instanceof Mutation.SetStatus m) {
            node.put("lineageId", m.lineageId().toString());
            m.status().ifPresent(v -> node.put("status", v));
        } else {
            throw new IllegalArgumentException("Unknown mutation: " + mutation);
        }
        return Documents.toBytes(node);
    }

    private static ObjectNode lineage(LineageMeta meta) {
        ObjectNode node = Documents.emptyObject();
        node.put("id", meta.id().toString());
        meta.name().ifPresent(v -> node.put("name", v));
        meta.status().ifPresent(v -> node.put("status", v));
        node.put("createdAt", meta.createdAt().toString());
        meta.createdBy().ifPresent(v -> node.put("createdBy", v));
        node.set("metadata", meta.metadata());
        return node;
    }

    private static ObjectNode record(FlowRecord record) {
        ObjectNode node = Documents.emptyObject();
        node.put("id", record.id().toString());
        node.put("lineageId", record.lineageId().toString());
        node.put("cursor", record.cursor());
        node.put("key", record.key());
        node.set("payload", record.payload());
        node.set("metadata", record.metadata());
        record.commandId().ifPresent(v -> node.put("commandId", v.toString()));
        node.put("version", record.version());
        node.put("createdAt", record.createdAt().toString());
        return node;
    }

    private static ObjectNode snapshot(SnapshotMeta snapshot) {
        ObjectNode node = Documents.emptyObject();
        node.put("id", snapshot.id().toString());
        node.put("lineageId", snapshot.lineageId().toString());
        node.put("cursor", snapshot.cursor());
        node.put("statePointer", snapshot.statePointer().encode());
        node.set("metadata", snapshot.metadata());
        node.put("createdAt", snapshot.createdAt().toString());
        return node;
    }

    // ========================================================================
    // Decode
    // ========================================================================

    /**
     * @throws IOException if the payload is not a well-formed entry of the given type
     */
    static Mutation decode(byte type, byte[] payload) throws IOException {
        JsonNode node = Documents.fromBytes(payload);
        try {
            return switch (type) {
                case TYPE_CREATE_LINEAGE -> new Mutation.CreateLineage(toLineage(required(node, "lineage")));
                case TYPE_APPEND -> new Mutation.Append(toRecord(required(node, "record")));
                case TYPE_BRANCH -> new Mutation.Branch(
                        uuid(node, "parentLineageId"),
                        uuid(node, "branchId"),
                        required(node, "parentCursor").asLong(),
                        text(node, "name"),
                        text(node, "status"),
                        node.path("metadata"),
                        instant(node, "createdAt"));
                case TYPE_DELETE -> new Mutation.Delete(uuid(node, "lineageId"), policy(node));
                case TYPE_PRUNE -> new Mutation.Prune(uuid(node, "lineageId"),
                        required(node, "fromCursor").asLong(), policy(node));
                case TYPE_SAVE_SNAPSHOT -> new Mutation.SaveSnapshot(toSnapshot(required(node, "snapshot")));
                case TYPE_DELETE_SNAPSHOT -> new Mutation.DeleteSnapshot(uuid(node, "lineageId"),
                        uuid(node, "snapshotId"));
                case TYPE_SET_STATUS -> new Mutation.SetStatus(uuid(node, "lineageId"), text(node, "status"));
                default -> throw new IOException("Unknown journal entry type " + type);
            };
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IOException("Malformed " + typeName(type) + " entry: " + e.getMessage(), e);
        }
    }

    private static LineageMeta toLineage(JsonNode node) throws IOException {
        return new LineageMeta(uuid(node, "id"), text(node, "name"), text(node, "status"),
                instant(node, "createdAt"), text(node, "createdBy"), 0L, 0L,
                Optional.empty(), OptionalLong.empty(), node.path("metadata"));
    }

    private static FlowRecord toRecord(JsonNode node) throws IOException {
        JsonNode payload = node.has("payload") ? node.get("payload") : NullNode.getInstance();
        return new FlowRecord(uuid(node, "id"), uuid(node, "lineageId"), required(node, "cursor").asLong(),
                required(node, "key").asText(), payload, node.path("metadata"),
                text(node, "commandId").map(UUID::fromString), required(node, "version").asLong(),
                instant(node, "createdAt"));
    }

    private static SnapshotMeta toSnapshot(JsonNode node) throws IOException {
        return new SnapshotMeta(uuid(node, "id"), uuid(node, "lineageId"), required(node, "cursor").asLong(),
                StatePointer.parse(required(node, "statePointer").asText()), node.path("metadata"),
                instant(node, "createdAt"));
    }

    private static JsonNode required(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Missing field '" + field + "'");
        }
        return value;
    }

    private static UUID uuid(JsonNode node, String field) throws IOException {
        return UUID.fromString(required(node, field).asText());
    }

    private static Instant instant(JsonNode node, String field) throws IOException {
        return Instant.parse(required(node, field).asText());
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value.asText());
    }

    private static ChildLineagePolicy policy(JsonNode node) throws IOException {
        return ChildLineagePolicy.valueOf(required(node, "policy").asText());
    }
}
