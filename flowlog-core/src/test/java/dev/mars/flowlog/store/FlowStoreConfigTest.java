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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FlowStoreConfig resolution: programmatic values, system properties and defaults.
 */
class FlowStoreConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("flowlog.dataDir");
        System.clearProperty("flowlog.syncEnabled");
        System.clearProperty("flowlog.verifyWrites");
        System.clearProperty("flowlog.minFreeSpaceMb");
        System.clearProperty("flowlog.maxPayloadSizeMb");
        System.clearProperty("flowlog.childPolicy");
        System.clearProperty("flowlog.inlineSnapshotMaxKb");
    }

    // ========================================================================
    // Defaults
    // ========================================================================

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Unset values fall back to defaults")
        void testDefaults() {
            FlowStoreConfig config = FlowStoreConfig.load();

            assertTrue(config.syncEnabled());
            assertFalse(config.verifyWrites());
            assertEquals(64, config.minFreeSpaceMb());
            assertEquals(16, config.maxPayloadSizeMb());
            assertEquals(ChildLineagePolicy.ORPHAN, config.childPolicy());
            assertEquals(64, config.inlineSnapshotMaxKb());
            assertTrue(config.dataDir().endsWith(Path.of(".flowlog", "data")));
        }

        @Test
        @DisplayName("Derived byte sizes")
        void testByteSizes() {
            FlowStoreConfig config = FlowStoreConfig.builder()
                    .minFreeSpaceMb(3)
                    .maxPayloadSizeMb(2)
                    .inlineSnapshotMaxKb(5)
                    .build();

            assertEquals(3L * 1024 * 1024, config.minFreeSpaceBytes());
            assertEquals(2 * 1024 * 1024, config.maxPayloadSizeBytes());
            assertEquals(5 * 1024, config.inlineSnapshotMaxBytes());
        }

        @Test
        @DisplayName("toString lists every setting")
        void testToString() {
            String text = FlowStoreConfig.builder().dataDir(tempDir).build().toString();

            assertTrue(text.contains("dataDir=" + tempDir));
            assertTrue(text.contains("childPolicy=ORPHAN"));
            assertTrue(text.contains("inlineSnapshotMaxKb=64"));
        }
    }

    // ========================================================================
    // System Property Resolution
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property dataDir is respected")
        void testDataDirSystemProperty() {
            Path customDir = tempDir.resolve("custom-data");
            System.setProperty("flowlog.dataDir", customDir.toString());

            assertEquals(customDir, FlowStoreConfig.builder().build().dataDir());
        }

        @Test
        @DisplayName("System property syncEnabled=false is respected")
        void testSyncEnabledSystemProperty() {
            System.setProperty("flowlog.syncEnabled", "false");

            assertFalse(FlowStoreConfig.builder().build().syncEnabled());
        }

        @Test
        @DisplayName("System property verifyWrites=true is respected")
        void testVerifyWritesSystemProperty() {
            System.setProperty("flowlog.verifyWrites", "true");

            assertTrue(FlowStoreConfig.builder().build().verifyWrites());
        }

        @Test
        @DisplayName("Integer system properties are respected")
        void testIntegerSystemProperties() {
            System.setProperty("flowlog.minFreeSpaceMb", "128");
            System.setProperty("flowlog.maxPayloadSizeMb", "32");
            System.setProperty("flowlog.inlineSnapshotMaxKb", "8");

            FlowStoreConfig config = FlowStoreConfig.builder().build();
            assertEquals(128, config.minFreeSpaceMb());
            assertEquals(32, config.maxPayloadSizeMb());
            assertEquals(8, config.inlineSnapshotMaxKb());
        }

        @Test
        @DisplayName("Child policy is parsed case-insensitively")
        void testChildPolicySystemProperty() {
            System.setProperty("flowlog.childPolicy", " cascade ");

            assertEquals(ChildLineagePolicy.CASCADE, FlowStoreConfig.builder().build().childPolicy());
        }

        @Test
        @DisplayName("Invalid integer system property falls back to default")
        void testInvalidIntSystemProperty() {
            System.setProperty("flowlog.minFreeSpaceMb", "not-a-number");

            assertEquals(64, FlowStoreConfig.builder().build().minFreeSpaceMb());
        }

        @Test
        @DisplayName("Unknown child policy falls back to default")
        void testInvalidChildPolicy() {
            System.setProperty("flowlog.childPolicy", "adopt");

            assertEquals(ChildLineagePolicy.ORPHAN, FlowStoreConfig.builder().build().childPolicy());
        }

        @Test
        @DisplayName("Blank system property is ignored")
        void testBlankSystemProperty() {
            System.setProperty("flowlog.maxPayloadSizeMb", "   ");

            assertEquals(16, FlowStoreConfig.builder().build().maxPayloadSizeMb());
        }
    }

    // ========================================================================
    // Programmatic Configuration
    // ========================================================================

    @Nested
    @DisplayName("Programmatic Configuration")
    class ProgrammaticTests {

        @Test
        @DisplayName("Builder values override system properties")
        void testBuilderOverridesSystemProperties() {
            System.setProperty("flowlog.syncEnabled", "false");
            System.setProperty("flowlog.childPolicy", "CASCADE");
            Path dir = tempDir.resolve("explicit");

            FlowStoreConfig config = FlowStoreConfig.builder()
                    .dataDir(dir)
                    .syncEnabled(true)
                    .childPolicy(ChildLineagePolicy.ORPHAN)
                    .build();

            assertEquals(dir, config.dataDir());
            assertTrue(config.syncEnabled());
            assertEquals(ChildLineagePolicy.ORPHAN, config.childPolicy());
        }

        @Test
        @DisplayName("String data directory is converted to a path")
        void testDataDirString() {
            FlowStoreConfig config = FlowStoreConfig.builder().dataDir(tempDir.toString()).build();

            assertEquals(tempDir, config.dataDir());
        }
    }

    @Test
    void testChildLineagePolicyParse_Unknown() {
        assertThrows(IllegalArgumentException.class, () -> ChildLineagePolicy.parse("keep"));
    }
}
