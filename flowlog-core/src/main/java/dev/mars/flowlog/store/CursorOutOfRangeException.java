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

import java.util.UUID;

/**
 * A cursor argument (branch point, prune point, snapshot cursor) lies outside the
 * lineage's current history. Nothing was written.
 */
public class CursorOutOfRangeException extends FlowStoreException {

    private final UUID lineageId;
    private final long requested;
    private final long current;

    public CursorOutOfRangeException(UUID lineageId, long requested, long current, String operation) {
        super(operation + " cursor " + requested + " is out of range for lineage " + lineageId
                + " (current cursor " + current + ")");
        this.lineageId = lineageId;
        this.requested = requested;
        this.current = current;
    }

    public UUID lineageId() {
        return lineageId;
    }

    public long requested() {
        return requested;
    }

    public long current() {
        return current;
    }
}
