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

import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides what an append does to a lineage before anything is persisted.
 * <p>
 * This is a <b>pure, side-effect-free</b> calculator. Given the lineage as it is
 * under its lock, it yields the outcome the caller will see and, when something must
 * be written, the record to insert and the metadata that results.
 * <p>
 * <b>Usage Pattern (Prepare → Persist → Apply):</b>
 * <pre>{@code
 * // 1. Calculate the plan (no mutations)
 * AppendPlan plan = AppendPlan.from(view, request, expectedVersion, recordId, now);
 *
 * // 2. Persist
 * if (plan.requiresPersistence()) {
 *     log.write(new Mutation.Append(plan.recordToInsert()));  // DURABILITY BARRIER
 *     // 3. Apply (only after the write succeeded)
 *     view = plan.applyTo(view);
 * }
 * return plan.outcome();
 * }</pre>
 *
 * @param outcome        what the caller is told
 * @param recordToInsert the record to store, null when nothing is written
 * @param updatedMeta    lineage metadata after the insert, null when nothing is written
 */
public record AppendPlan(
        PersistOutcome outcome,
        FlowRecord recordToInsert,
        LineageMeta updatedMeta
) {

    public AppendPlan {
        Objects.requireNonNull(outcome, "outcome");
        if ((recordToInsert == null) != (updatedMeta == null)) {
            throw new IllegalArgumentException("recordToInsert and updatedMeta must be set together");
        }
    }

    /**
     * Calculates the plan.
     * <p>
     * Algorithm:
     * <ol>
     *   <li>If the lineage's version is not {@code expectedVersion}, answer
     *       {@code Conflict}; nothing is written</li>
     *   <li>If the request carries a command id the lineage already holds a record for,
     *       answer with that record's original result; nothing is written</li>
     *   <li>Otherwise the record goes to {@code cursor + 1} and cursor and version both
     *       move forward by one</li>
     * </ol>
     * A retry that still presents the version it originally sent conflicts once other
     * writers have moved the lineage on; a retry presenting the current version gets
     * its earlier result back.
     *
     * @param current         the lineage as seen under its lock
     * @param request         the record to append
     * @param expectedVersion the version the caller last observed
     * @param recordId        id to give the new record
     * @param now             creation timestamp for the new record
     * @return the calculated plan
     */
    public static AppendPlan from(LineageView current,
                                  NewRecord request,
                                  long expectedVersion,
                                  UUID recordId,
                                  Instant now) {
        LineageMeta meta = current.meta();
        if (!meta.id().equals(request.lineageId())) {
            throw new IllegalArgumentException("Record addressed to " + request.lineageId()
                    + " planned against lineage " + meta.id());
        }

        if (meta.version() != expectedVersion) {
            return new AppendPlan(PersistOutcome.conflict(expectedVersion, meta.version()), null, null);
        }

        if (request.commandId().isPresent()) {
            Optional<FlowRecord> earlier = current.recordByCommandId(request.commandId().get());
            if (earlier.isPresent()) {
                return new AppendPlan(
                        PersistOutcome.replayed(earlier.get().version(), earlier.get().cursor()), null, null);
            }
        }

        LineageMeta next = meta.appended();
        FlowRecord record = new FlowRecord(recordId, meta.id(), next.cursor(), request.key(),
                request.payload(), request.metadata(), request.commandId(), next.version(), now);
        return new AppendPlan(PersistOutcome.ok(next.version(), next.cursor()), record, next);
    }

    /**
     * Applies this plan.
     * <p>
     * <b>CALL THIS ONLY AFTER PERSISTENCE IS SUCCESSFUL.</b>
     *
     * @return the lineage handle that makes the new record visible
     */
    LineageView applyTo(LineageView current) {
        if (!requiresPersistence()) {
            return current;
        }
        return current.withAppended(recordToInsert, updatedMeta);
    }

    /**
     * @return true if this plan writes a record
     */
    public boolean requiresPersistence() {
        return recordToInsert != null;
    }
}
