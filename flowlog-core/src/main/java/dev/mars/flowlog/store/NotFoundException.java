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
 * The referenced lineage, snapshot or artifact does not exist.
 */
public class NotFoundException extends FlowStoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException lineage(UUID lineageId) {
        return new NotFoundException("Lineage not found: " + lineageId);
    }

    public static NotFoundException snapshot(UUID snapshotId) {
        return new NotFoundException("Snapshot not found: " + snapshotId);
    }

    public static NotFoundException artifact(String key) {
        return new NotFoundException("Artifact not found: " + key);
    }
}
