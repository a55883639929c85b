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

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An append request: everything about a record except what the store assigns
 * (id, cursor, version, timestamp).
 *
 * @param lineageId target lineage
 * @param key       free-form classification
 * @param payload   structured payload
 * @param metadata  structured metadata
 * @param commandId optional idempotency token
 */
public record NewRecord(
        UUID lineageId,
        String key,
        JsonNode payload,
        JsonNode metadata,
        Optional<UUID> commandId
) {

    public NewRecord {
        Objects.requireNonNull(lineageId, "lineageId");
        Objects.requireNonNull(key, "key");
        commandId = commandId == null ? Optional.empty() : commandId;
        payload = Documents.copyPayload(payload);
        metadata = Documents.copyMetadata(metadata);
    }

    public static NewRecord of(UUID lineageId, String key, JsonNode payload) {
        return new NewRecord(lineageId, key, payload, null, Optional.empty());
    }

    public NewRecord withMetadata(JsonNode newMetadata) {
        return new NewRecord(lineageId, key, payload, newMetadata, commandId);
    }

    public NewRecord withCommandId(UUID newCommandId) {
        return new NewRecord(lineageId, key, payload, metadata, Optional.of(newCommandId));
    }
}
