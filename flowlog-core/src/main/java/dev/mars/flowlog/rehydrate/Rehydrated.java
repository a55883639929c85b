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
package dev.mars.flowlog.rehydrate;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Result of rehydrating a lineage.
 *
 * @param state          the reconstructed state
 * @param cursor         cursor of the last record folded in (the state reflects records {@code 1..cursor})
 * @param snapshotId     snapshot the replay started from, empty when it started from the initial state
 * @param snapshotCursor cursor of that snapshot, 0 without one
 * @param replayedCount  records applied on top of the starting point
 * @param <S>            state type
 */
public record Rehydrated<S>(
        S state,
        long cursor,
        Optional<UUID> snapshotId,
        long snapshotCursor,
        long replayedCount
) {

    public Rehydrated {
        Objects.requireNonNull(snapshotId, "snapshotId");
    }

    public boolean fromSnapshot() {
        return snapshotId.isPresent();
    }
}
