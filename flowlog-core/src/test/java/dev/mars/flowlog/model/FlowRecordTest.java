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

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that records and lineage metadata cannot be changed through the documents they hold.
 */
class FlowRecordTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void testPayload_CallerMutationDoesNotLeakIn() {
        ObjectNode payload = Documents.emptyObject().put("n", 1);
        FlowRecord record = new FlowRecord(UUID.randomUUID(), UUID.randomUUID(), 1, "k", payload, null,
                Optional.empty(), 1, NOW);

        payload.put("n", 2);
        ((ObjectNode) record.payload()).put("n", 3);

        assertEquals(1, record.payload().path("n").asInt());
    }

    @Test
    void testMetadata_DefaultsToEmptyObject() {
        FlowRecord record = new FlowRecord(UUID.randomUUID(), UUID.randomUUID(), 1, "k", null, null,
                null, 1, NOW);

        assertTrue(record.metadata().isObject());
        assertTrue(record.payload().isNull());
        assertTrue(record.commandId().isEmpty());
    }

    @Test
    void testCursorMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new FlowRecord(UUID.randomUUID(), UUID.randomUUID(),
                0, "k", null, null, Optional.empty(), 0, NOW));
    }

    @Test
    void testCopyTo_KeepsPositionAndContent() {
        UUID commandId = UUID.randomUUID();
        FlowRecord source = new FlowRecord(UUID.randomUUID(), UUID.randomUUID(), 4, "k",
                Documents.valueOf("p"), null, Optional.of(commandId), 12, NOW);
        UUID branch = UUID.randomUUID();
        UUID copyId = UUID.randomUUID();

        FlowRecord copy = source.copyTo(branch, copyId, 4);

        assertEquals(copyId, copy.id());
        assertEquals(branch, copy.lineageId());
        assertEquals(4, copy.cursor());
        assertEquals(4, copy.version());
        assertEquals(source.payload(), copy.payload());
        assertEquals(Optional.of(commandId), copy.commandId());
    }

    @Test
    void testLineageMeta_ParentFieldsTravelTogether() {
        assertThrows(IllegalArgumentException.class, () -> new LineageMeta(UUID.randomUUID(), Optional.empty(),
                Optional.empty(), NOW, Optional.empty(), 0, 0, Optional.of(UUID.randomUUID()),
                OptionalLong.empty(), null));
    }

    @Test
    void testLineageMeta_Transitions() {
        UUID parent = UUID.randomUUID();
        LineageMeta meta = new LineageMeta(UUID.randomUUID(), Optional.of("n"), Optional.empty(), NOW,
                Optional.empty(), 3, 5, Optional.of(parent), OptionalLong.of(3), null);

        assertTrue(meta.isChildOf(parent));
        assertEquals(4, meta.appended().cursor());
        assertEquals(6, meta.appended().version());
        assertEquals(1, meta.prunedTo(1).cursor());
        assertEquals(6, meta.prunedTo(1).version());
        assertFalse(meta.orphaned().hasParent());
        assertEquals(Optional.of("done"), meta.withStatus(Optional.of("done")).status());
    }
}
