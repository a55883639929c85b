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

import dev.mars.flowlog.model.Documents;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AppendPlan}.
 * <p>
 * These tests verify the plan calculation for:
 * <ul>
 *   <li>Appending to an empty and a non-empty lineage</li>
 *   <li>Stale expected versions</li>
 *   <li>Command ids already stored, with and without a matching version</li>
 * </ul>
 */
class AppendPlanTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final UUID LINEAGE = UUID.fromString("00000000-0000-0000-0000-00000000000a");

    private static LineageView lineageWith(int records, UUID... commandIds) {
        LineageMeta meta = LineageMeta.root(LINEAGE, "flow", null, null, null, NOW);
        List<FlowRecord> stored = new ArrayList<>();
        for (int i = 1; i <= records; i++) {
            Optional<UUID> commandId = i <= commandIds.length ? Optional.of(commandIds[i - 1]) : Optional.empty();
            stored.add(new FlowRecord(UUID.randomUUID(), LINEAGE, i, "k" + i, Documents.valueOf(i), null,
                    commandId, i, NOW));
            meta = meta.appended();
        }
        return LineageView.of(meta, stored, List.of());
    }

    private static NewRecord request(String key) {
        return NewRecord.of(LINEAGE, key, Documents.emptyObject().put("key", key));
    }

    // ========================================================================
    // Successful Appends
    // ========================================================================

    @Test
    void testFrom_EmptyLineage_InsertsAtCursorOne() {
        UUID recordId = UUID.randomUUID();

        AppendPlan plan = AppendPlan.from(lineageWith(0), request("first"), 0, recordId, NOW);

        assertTrue(plan.requiresPersistence());
        assertEquals(PersistOutcome.ok(1, 1), plan.outcome());
        FlowRecord inserted = plan.recordToInsert();
        assertEquals(recordId, inserted.id());
        assertEquals(1, inserted.cursor());
        assertEquals(1, inserted.version());
        assertEquals("first", inserted.key());
        assertEquals(NOW, inserted.createdAt());
        assertEquals(1, plan.updatedMeta().cursor());
        assertEquals(1, plan.updatedMeta().version());
    }

    @Test
    void testFrom_ExistingRecords_InsertsAfterLast() {
        AppendPlan plan = AppendPlan.from(lineageWith(3), request("next"), 3, UUID.randomUUID(), NOW);

        assertEquals(PersistOutcome.ok(4, 4), plan.outcome());
        assertEquals(4, plan.recordToInsert().cursor());
    }

    @Test
    void testApplyTo_MakesRecordVisible() {
        LineageView before = lineageWith(1);
        AppendPlan plan = AppendPlan.from(before, request("next"), 1, UUID.randomUUID(), NOW);

        LineageView after = plan.applyTo(before);

        assertEquals(2, after.meta().cursor());
        assertEquals(List.of(2L), after.recordsAfter(1).stream().map(FlowRecord::cursor).toList());
        // the old handle still ends at its own cursor
        assertTrue(before.recordsAfter(1).isEmpty());
    }

    // ========================================================================
    // Conflicts
    // ========================================================================

    @Test
    void testFrom_StaleVersion_Conflict() {
        AppendPlan plan = AppendPlan.from(lineageWith(2), request("late"), 1, UUID.randomUUID(), NOW);

        assertFalse(plan.requiresPersistence());
        assertEquals(PersistOutcome.conflict(1, 2), plan.outcome());
        assertNull(plan.recordToInsert());
        assertNull(plan.updatedMeta());
    }

    @Test
    void testFrom_FutureVersion_Conflict() {
        AppendPlan plan = AppendPlan.from(lineageWith(2), request("ahead"), 5, UUID.randomUUID(), NOW);

        assertEquals(PersistOutcome.conflict(5, 2), plan.outcome());
    }

    @Test
    void testApplyTo_ConflictLeavesViewUnchanged() {
        LineageView view = lineageWith(2);
        AppendPlan plan = AppendPlan.from(view, request("late"), 0, UUID.randomUUID(), NOW);

        assertSame(view, plan.applyTo(view));
    }

    // ========================================================================
    // Idempotency
    // ========================================================================

    @Test
    void testFrom_KnownCommandId_ReplaysOriginalResult() {
        UUID commandId = UUID.randomUUID();
        LineageView view = lineageWith(3, UUID.randomUUID(), commandId);

        AppendPlan plan = AppendPlan.from(view, request("retry").withCommandId(commandId), 3,
                UUID.randomUUID(), NOW);

        assertFalse(plan.requiresPersistence());
        assertEquals(PersistOutcome.replayed(2, 2), plan.outcome());
    }

    @Test
    void testFrom_KnownCommandIdWithStaleVersion_Conflict() {
        UUID commandId = UUID.randomUUID();
        LineageView view = lineageWith(3, UUID.randomUUID(), commandId);

        AppendPlan plan = AppendPlan.from(view, request("retry").withCommandId(commandId), 1,
                UUID.randomUUID(), NOW);

        assertFalse(plan.requiresPersistence());
        assertEquals(PersistOutcome.conflict(1, 3), plan.outcome());
    }

    @Test
    void testFrom_KnownCommandIdWithCurrentVersion_StillReplayed() {
        UUID commandId = UUID.randomUUID();
        LineageView view = lineageWith(1, commandId);

        AppendPlan plan = AppendPlan.from(view, request("retry").withCommandId(commandId), 1,
                UUID.randomUUID(), NOW);

        assertEquals(PersistOutcome.replayed(1, 1), plan.outcome());
    }

    @Test
    void testFrom_NewCommandId_Inserted() {
        UUID commandId = UUID.randomUUID();

        AppendPlan plan = AppendPlan.from(lineageWith(1), request("fresh").withCommandId(commandId), 1,
                UUID.randomUUID(), NOW);

        assertEquals(PersistOutcome.ok(2, 2), plan.outcome());
        assertEquals(Optional.of(commandId), plan.recordToInsert().commandId());
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Test
    void testFrom_RecordForOtherLineage_Rejected() {
        NewRecord elsewhere = NewRecord.of(UUID.randomUUID(), "k", null);

        assertThrows(IllegalArgumentException.class,
                () -> AppendPlan.from(lineageWith(0), elsewhere, 0, UUID.randomUUID(), NOW));
    }

    @Test
    void testConstructor_RecordWithoutMeta_Rejected() {
        FlowRecord record = new FlowRecord(UUID.randomUUID(), LINEAGE, 1, "k", null, null,
                Optional.empty(), 1, NOW);

        assertThrows(IllegalArgumentException.class,
                () -> new AppendPlan(PersistOutcome.ok(1, 1), record, null));
    }
}
