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
package dev.mars.flowlog.artifact;

import dev.mars.flowlog.store.NotFoundException;
import dev.mars.flowlog.store.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileArtifactStore}.
 */
class FileArtifactStoreTest {

    private static final byte[] BLOB = "{\"records\":42}".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private FileArtifactStore artifacts;

    @BeforeEach
    void setUp() {
        artifacts = new FileArtifactStore(tempDir.resolve("artifacts"), false);
    }

    @AfterEach
    void tearDown() {
        artifacts.close();
    }

    @Test
    void testPut_WritesFanOutFile() throws Exception {
        String key = artifacts.put(BLOB).get(5, TimeUnit.SECONDS);

        Path file = tempDir.resolve("artifacts").resolve(key.substring(0, 2)).resolve(key);
        assertTrue(Files.exists(file));
        assertArrayEquals(BLOB, Files.readAllBytes(file));
        try (Stream<Path> siblings = Files.list(file.getParent())) {
            assertEquals(1, siblings.count(), "no temp files left behind");
        }
    }

    @Test
    void testGet_SurvivesNewInstance() throws Exception {
        String key = artifacts.put(BLOB).get(5, TimeUnit.SECONDS);
        artifacts.close();

        artifacts = new FileArtifactStore(tempDir.resolve("artifacts"), false);
        assertArrayEquals(BLOB, artifacts.get(key).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testPut_Twice_SameKey() throws Exception {
        String first = artifacts.put(BLOB).get(5, TimeUnit.SECONDS);
        String second = artifacts.put(BLOB).get(5, TimeUnit.SECONDS);

        assertEquals(first, second);
        assertEquals(ContentKeys.of(BLOB), first);
    }

    @Test
    void testGet_UnknownKey_NotFound() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> artifacts.get(ContentKeys.of(new byte[]{1})).get(5, TimeUnit.SECONDS));
        assertInstanceOf(NotFoundException.class, e.getCause());
    }

    @Test
    void testGet_MalformedKey_NotFound() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> artifacts.get("../escape").get(5, TimeUnit.SECONDS));
        assertInstanceOf(NotFoundException.class, e.getCause());
    }

    @Test
    void testClosed_Fails() {
        artifacts.close();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> artifacts.put(BLOB).get(5, TimeUnit.SECONDS));
        assertInstanceOf(StorageException.class, e.getCause());
    }
}
