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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Function;

/**
 * Settings shared by the record stores and the rehydrator.
 * <p>
 * {@link dev.mars.flowlog.store.file.FileRecordStore} reads the journal settings
 * (directory, fsync, verification, disk-space floor, entry size limit). Both backends
 * read {@code childPolicy}, which decides what deleting a lineage does to the
 * lineages branched from it. {@code inlineSnapshotMaxKb} is the size up to which a
 * snapshot's state is kept inside the snapshot instead of the artifact store.
 * <p>
 * Each setting is taken from the first source that has a usable value: the
 * {@link Builder}, a {@code flowlog.*} system property, a {@code FLOWLOG_*}
 * environment variable, {@code flowlog.properties} (classpath, then working
 * directory), then the default. Unparseable values are logged and skipped.
 *
 * <table border="1">
 *   <tr><th>Setting</th><th>Property / env</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>flowlog.dataDir / FLOWLOG_DATA_DIR</td><td>~/.flowlog/data</td></tr>
 *   <tr><td>syncEnabled</td><td>flowlog.syncEnabled / FLOWLOG_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>flowlog.verifyWrites / FLOWLOG_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>flowlog.minFreeSpaceMb / FLOWLOG_MIN_FREE_SPACE_MB</td><td>64</td></tr>
 *   <tr><td>maxPayloadSizeMb</td><td>flowlog.maxPayloadSizeMb / FLOWLOG_MAX_PAYLOAD_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>childPolicy</td><td>flowlog.childPolicy / FLOWLOG_CHILD_POLICY</td><td>ORPHAN</td></tr>
 *   <tr><td>inlineSnapshotMaxKb</td><td>flowlog.inlineSnapshotMaxKb / FLOWLOG_INLINE_SNAPSHOT_MAX_KB</td><td>64</td></tr>
 * </table>
 *
 * <pre>
 * FileRecordStore store = new FileRecordStore(FlowStoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/flowlog"))
 *     .childPolicy(ChildLineagePolicy.CASCADE)
 *     .build());
 * store.open().join();
 * </pre>
 */
public final class FlowStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(FlowStoreConfig.class);

    private static final String PROPERTIES_FILE = "flowlog.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "flowlog.dataDir";
    private static final String PROP_SYNC_ENABLED = "flowlog.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "flowlog.verifyWrites";
    private static final String PROP_MIN_FREE_SPACE_MB = "flowlog.minFreeSpaceMb";
    private static final String PROP_MAX_PAYLOAD_SIZE_MB = "flowlog.maxPayloadSizeMb";
    private static final String PROP_CHILD_POLICY = "flowlog.childPolicy";
    private static final String PROP_INLINE_SNAPSHOT_MAX_KB = "flowlog.inlineSnapshotMaxKb";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "FLOWLOG_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "FLOWLOG_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "FLOWLOG_VERIFY_WRITES";
    private static final String ENV_MIN_FREE_SPACE_MB = "FLOWLOG_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_PAYLOAD_SIZE_MB = "FLOWLOG_MAX_PAYLOAD_SIZE_MB";
    private static final String ENV_CHILD_POLICY = "FLOWLOG_CHILD_POLICY";
    private static final String ENV_INLINE_SNAPSHOT_MAX_KB = "FLOWLOG_INLINE_SNAPSHOT_MAX_KB";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".flowlog", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;
    private static final int DEFAULT_MAX_PAYLOAD_SIZE_MB = 16;
    private static final ChildLineagePolicy DEFAULT_CHILD_POLICY = ChildLineagePolicy.ORPHAN;
    private static final int DEFAULT_INLINE_SNAPSHOT_MAX_KB = 64;

    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;
    private final int maxPayloadSizeMb;
    private final ChildLineagePolicy childPolicy;
    private final int inlineSnapshotMaxKb;

    private FlowStoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxPayloadSizeMb = builder.maxPayloadSizeMb;
        this.childPolicy = builder.childPolicy;
        this.inlineSnapshotMaxKb = builder.inlineSnapshotMaxKb;
    }

    /** Data directory for the journal, lock file and artifacts. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether to verify journal writes by reading back and checking CRC. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum encoded size in MB of a single journal entry. */
    public int maxPayloadSizeMb() {
        return maxPayloadSizeMb;
    }

    /** What deleting a lineage does to its children. */
    public ChildLineagePolicy childPolicy() {
        return childPolicy;
    }

    /** Snapshots up to this many KB are stored inline, larger ones go to the artifact store. */
    public int inlineSnapshotMaxKb() {
        return inlineSnapshotMaxKb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum journal entry size in bytes. */
    public int maxPayloadSizeBytes() {
        return maxPayloadSizeMb * 1024 * 1024;
    }

    /** Inline snapshot threshold in bytes. */
    public int inlineSnapshotMaxBytes() {
        return inlineSnapshotMaxKb * 1024;
    }

    @Override
    public String toString() {
        return "FlowStoreConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxPayloadSizeMb=" + maxPayloadSizeMb +
                ", childPolicy=" + childPolicy +
                ", inlineSnapshotMaxKb=" + inlineSnapshotMaxKb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code FlowStoreConfig.builder().build()}.
     */
    public static FlowStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link FlowStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;
        private Integer maxPayloadSizeMb;
        private ChildLineagePolicy childPolicy;
        private Integer inlineSnapshotMaxKb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 64). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum journal entry size in MB (default: 16). */
        public Builder maxPayloadSizeMb(int maxPayloadSizeMb) {
            this.maxPayloadSizeMb = maxPayloadSizeMb;
            return this;
        }

        /** Sets the child lineage policy for deletes (default: ORPHAN). */
        public Builder childPolicy(ChildLineagePolicy childPolicy) {
            this.childPolicy = childPolicy;
            return this;
        }

        /** Sets the inline snapshot threshold in KB (default: 64). */
        public Builder inlineSnapshotMaxKb(int inlineSnapshotMaxKb) {
            this.inlineSnapshotMaxKb = inlineSnapshotMaxKb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public FlowStoreConfig build() {
            if (dataDir == null) {
                dataDir = resolve(PROP_DATA_DIR, ENV_DATA_DIR, Path::of, DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolve(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, Boolean::parseBoolean, DEFAULT_VERIFY_WRITES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolve(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, Integer::parseInt,
                        DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxPayloadSizeMb == null) {
                maxPayloadSizeMb = resolve(PROP_MAX_PAYLOAD_SIZE_MB, ENV_MAX_PAYLOAD_SIZE_MB, Integer::parseInt,
                        DEFAULT_MAX_PAYLOAD_SIZE_MB);
            }
            if (childPolicy == null) {
                childPolicy = resolve(PROP_CHILD_POLICY, ENV_CHILD_POLICY, ChildLineagePolicy::parse,
                        DEFAULT_CHILD_POLICY);
            }
            if (inlineSnapshotMaxKb == null) {
                inlineSnapshotMaxKb = resolve(PROP_INLINE_SNAPSHOT_MAX_KB, ENV_INLINE_SNAPSHOT_MAX_KB,
                        Integer::parseInt, DEFAULT_INLINE_SNAPSHOT_MAX_KB);
            }

            return new FlowStoreConfig(this);
        }

        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            T value = parse(sysProp, "system property", System.getProperty(sysProp), parser);
            if (value == null) {
                value = parse(envVar, "environment variable", System.getenv(envVar), parser);
            }
            if (value == null) {
                value = parse(sysProp, PROPERTIES_FILE, fileProperties.getProperty(sysProp), parser);
            }
            return value != null ? value : defaultValue;
        }

        private static <T> T parse(String name, String source, String raw, Function<String, T> parser) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                return parser.apply(raw.trim());
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring invalid value '{}' for {} from {}: {}", raw, name, source, e.getMessage());
                return null;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = FlowStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
