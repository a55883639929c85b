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
package dev.mars.flowlog.store.memory;

import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.store.ChildLineagePolicy;
import dev.mars.flowlog.store.FlowStoreConfig;
import dev.mars.flowlog.store.RecordStore;
import dev.mars.flowlog.store.RecordStoreContract;
import dev.mars.flowlog.store.StorageException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against {@link InMemoryRecordStore}, plus its lifecycle.
 */
class InMemoryRecordStoreTest extends RecordStoreContract {

    private static final Instant FIXED = Instant.parse("2026-01-15T10:00:00Z");

    @Override
    protected RecordStore openStore(ChildLineagePolicy policy) {
        return new InMemoryRecordStore(policy, Clock.systemUTC());
    }

    @Test
    void testClosedStore_FailsWithStorageException() throws Exception {
        InMemoryRecordStore local = new InMemoryRecordStore();
        UUID id = await(local.createLineage("x", null, null));
        local.close();

        assertInstanceOf(StorageException.class, failureOf(local.countRecords(id)));
        assertInstanceOf(StorageException.class, failureOf(local.createLineage("y", null, null)));

        // second close is harmless
        local.close();
    }

    @Test
    void testInstancesDoNotShareState() throws Exception {
        try (InMemoryRecordStore first = new InMemoryRecordStore();
             InMemoryRecordStore second = new InMemoryRecordStore()) {
            UUID id = await(first.createLineage("only-in-first", null, null));

            assertEquals(0L, await(first.countRecords(id)));
            assertEquals(-1L, await(second.countRecords(id)));
        }
    }

    @Test
    void testTimestampsComeFromClock() throws Exception {
        try (InMemoryRecordStore fixed = new InMemoryRecordStore(ChildLineagePolicy.ORPHAN,
                Clock.fixed(FIXED, ZoneOffset.UTC))) {
            UUID id = await(fixed.createLineage("clocked", null, null));
            assertEquals(PersistOutcome.ok(1, 1), await(fixed.append(record(id, "a", 1), 0)));

            assertEquals(FIXED, await(fixed.getLineage(id)).createdAt());
            assertEquals(FIXED, await(fixed.readRecords(id, 0)).toList().get(0).createdAt());
        }
    }

    @Test
    void testConfigSuppliesChildPolicy() {
        FlowStoreConfig config = FlowStoreConfig.builder().childPolicy(ChildLineagePolicy.CASCADE).build();
        try (InMemoryRecordStore configured = new InMemoryRecordStore(config)) {
            assertEquals(ChildLineagePolicy.CASCADE, configured.childPolicy());
        }
    }
}
