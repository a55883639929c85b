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

/**
 * Result of an append attempt.
 * <p>
 * {@link Ok} means the record is durable in the lineage: either it was written by
 * this call, or ({@code replayed == true}) an earlier append with the same command id
 * already wrote it and nothing new was written. {@link Conflict} means nothing was
 * written because the caller's expected version was stale; the caller re-reads and
 * retries. Storage failures are never an outcome, they complete the call exceptionally.
 */
public sealed interface PersistOutcome permits PersistOutcome.Ok, PersistOutcome.Conflict {

    static PersistOutcome ok(long newVersion, long cursor) {
        return new Ok(newVersion, cursor, false);
    }

    static PersistOutcome replayed(long version, long cursor) {
        return new Ok(version, cursor, true);
    }

    static PersistOutcome conflict(long expectedVersion, long actualVersion) {
        return new Conflict(expectedVersion, actualVersion);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isConflict() {
        return this instanceof Conflict;
    }

    /**
     * @param newVersion lineage version produced by the (original) append
     * @param cursor     cursor of the record
     * @param replayed   true if this is an idempotent replay and nothing was written
     */
    record Ok(long newVersion, long cursor, boolean replayed) implements PersistOutcome {
    }

    /**
     * @param expectedVersion the version the caller presented
     * @param actualVersion   the lineage's version at the time of the attempt
     */
    record Conflict(long expectedVersion, long actualVersion) implements PersistOutcome {
    }
}
