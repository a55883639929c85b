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
package dev.mars.flowlog.demo;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowlog.artifact.FileArtifactStore;
import dev.mars.flowlog.engine.FlowEngine;
import dev.mars.flowlog.model.Documents;
import dev.mars.flowlog.model.FlowRecord;
import dev.mars.flowlog.model.LineageMeta;
import dev.mars.flowlog.model.NewRecord;
import dev.mars.flowlog.model.PersistOutcome;
import dev.mars.flowlog.rehydrate.JsonStateCodec;
import dev.mars.flowlog.rehydrate.Rehydrated;
import dev.mars.flowlog.rehydrate.Rehydrator;
import dev.mars.flowlog.rehydrate.SnapshotPolicy;
import dev.mars.flowlog.store.FlowStoreConfig;
import dev.mars.flowlog.store.file.FileRecordStore;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Demo entry point for the flowlog record store.
 * <p>
 * This demonstrates the basic flow lifecycle:
 * <ul>
 *   <li>Opening a journal-backed store (and recovering it on restart)</li>
 *   <li>Appending records with expected versions and command ids</li>
 *   <li>An idempotent retry and a stale-version conflict</li>
 *   <li>Policy-driven snapshots and rehydration</li>
 *   <li>Branching at an earlier cursor</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link FlowStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dflowlog.dataDir=/path -Dflowlog.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code FLOWLOG_DATA_DIR, FLOWLOG_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code flowlog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl flowlog-demo -am
 *
 * # Run with default configuration
 * java -cp "flowlog-demo/target/flowlog-demo-1.0-SNAPSHOT.jar:..." dev.mars.flowlog.demo.FlowDemo
 *
 * # Run with CLI data directory override
 * java ... dev.mars.flowlog.demo.FlowDemo /path/to/data
 * </pre>
 *
 * @see FlowStoreConfig
 */
public class FlowDemo {

    /** File in the data directory remembering which lineage the demo works on. */
    private static final String LINEAGE_ID_FILE = "demo-lineage.id";

    /** Aggregate the demo rebuilds: how many records of each key it has seen. */
    public record Tally(long records, Map<String, Long> byKey) {
        static Tally empty() {
            return new Tally(0, Map.of());
        }

        Tally add(FlowRecord record) {
            Map<String, Long> next = new TreeMap<>(byKey);
            next.merge(record.key(), 1L, Long::sum);
            return new Tally(records + 1, next);
        }
    }

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|           Flowlog Demo                |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        FlowStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? FlowStoreConfig.builder().dataDir(args[0]).build()
                : FlowStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (FileRecordStore store = new FileRecordStore(config);
             FileArtifactStore artifacts = new FileArtifactStore(config.dataDir().resolve("artifacts"),
                     config.syncEnabled())) {
            store.open().join();
            System.out.println("[OK] Store opened at: " + config.dataDir().toAbsolutePath());

            Rehydrator<Tally> rehydrator = new Rehydrator<>(store, artifacts, new JsonStateCodec<>(Tally.class),
                    Tally::empty, Tally::add, config.inlineSnapshotMaxBytes());
            FlowEngine<Tally> engine = new FlowEngine<>(store, rehydrator, SnapshotPolicy.everyRecords(3));

            UUID flowId = findOrStartFlow(engine, config.dataDir());
            LineageMeta meta = store.getLineage(flowId).join();
            System.out.println("[OK] Flow " + flowId + ": cursor=" + meta.cursor() + ", version=" + meta.version());

            List<FlowRecord> existing = engine.records(flowId, Math.max(0, meta.cursor() - 3)).join().toList();
            if (!existing.isEmpty()) {
                System.out.println("\n  Last records in flow:");
                for (FlowRecord record : existing) {
                    System.out.printf("    [%d] v%d %s: %s%n",
                            record.cursor(), record.version(), record.key(), record.payload());
                }
            }

            // Append two step records with command ids
            long version = meta.version();
            for (String step : List.of("fetch", "transform")) {
                ObjectNode payload = Documents.emptyObject().put("step", step).put("run", version + 1);
                PersistOutcome outcome = engine.appendAndSnapshot(
                        NewRecord.of(flowId, FlowEngine.stepStateKey(step), payload).withCommandId(UUID.randomUUID()),
                        version).join();
                version = ((PersistOutcome.Ok) outcome).newVersion();
                System.out.println("[OK] Appended " + step + ": " + outcome);
            }

            // Retry with a reused command id at the current version: replayed, nothing written
            UUID commandId = UUID.randomUUID();
            NewRecord load = NewRecord.of(flowId, FlowEngine.stepStateKey("load"),
                    Documents.emptyObject().put("rows", 42)).withCommandId(commandId);
            PersistOutcome first = engine.appendAndSnapshot(load, version).join();
            version = ((PersistOutcome.Ok) first).newVersion();
            PersistOutcome retry = engine.appendAndSnapshot(load, version).join();
            System.out.println("[OK] First attempt: " + first);
            System.out.println("[OK] Retry:         " + retry);

            // Writer holding a stale version
            PersistOutcome stale = engine.append(flowId, "note", Documents.valueOf("late"), null, null, 0).join();
            System.out.println("[OK] Stale writer:  " + stale);

            Rehydrated<Tally> state = engine.rehydrate(flowId).join();
            System.out.println("\n  Rehydrated: cursor=" + state.cursor()
                    + ", from snapshot=" + state.snapshotId().map(UUID::toString).orElse("(none)")
                    + " at " + state.snapshotCursor() + ", replayed " + state.replayedCount());
            System.out.println("  State: " + state.state());

            // Branch from the middle of the history
            long forkAt = Math.max(0, state.cursor() / 2);
            UUID branchId = engine.branch(flowId, "demo-branch", null, forkAt, null).join();
            System.out.println("\n[OK] Branched " + branchId + " at cursor " + forkAt
                    + " (" + engine.countRecords(branchId).join() + " records)");
            Optional<FlowRecord> latestLoad = engine.latestStepState(branchId, "load").join();
            System.out.println("  Branch sees step 'load': " + latestLoad.isPresent());

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Flowlog demo complete!               |");
            System.out.println("|  Run again to see the flow recovered. |");
            System.out.println("+---------------------------------------+");
        }
    }

    private static UUID findOrStartFlow(FlowEngine<Tally> engine, Path dataDir) throws Exception {
        Path idFile = dataDir.resolve(LINEAGE_ID_FILE);
        if (Files.exists(idFile)) {
            UUID id = UUID.fromString(Files.readString(idFile, StandardCharsets.UTF_8).trim());
            if (engine.countRecords(id).join() >= 0) {
                return id;
            }
            System.out.println("[..] Remembered flow " + id + " no longer exists, starting a new one");
        }
        UUID id = engine.startFlow("demo", "running", "flow-demo", Documents.emptyObject().put("demo", true)).join();
        Files.writeString(idFile, id.toString(), StandardCharsets.UTF_8);
        System.out.println("[OK] Started new flow " + id);
        return id;
    }
}
