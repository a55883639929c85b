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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Content-addressed {@link ArtifactStore} on the local file system.
 * <p>
 * <b>Files:</b>
 * <pre>
 * artifacts/
 *  └─ ab/
 *      └─ ab12...ef   // SHA-256 of the content, written once (atomic replace)
 * </pre>
 * A blob is written to a temp file, forced to disk, and renamed into place, so a
 * key either resolves to the complete blob or not at all.
 */
public final class FileArtifactStore implements ArtifactStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileArtifactStore.class);

    private static final String TMP_SUFFIX = ".tmp";

    private final Path root;
    private final boolean syncEnabled;
    private final ExecutorService ioExecutor;
    private volatile boolean closed = false;

    /**
     * @param root        directory holding the blobs (created on first write)
     * @param syncEnabled if false, fsync is skipped (ONLY for testing!)
     */
    public FileArtifactStore(Path root, boolean syncEnabled) {
        this.root = Objects.requireNonNull(root, "root");
        this.syncEnabled = syncEnabled;
        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "flowlog-artifacts");
            t.setDaemon(true);
            return t;
        });
        LOG.info("FileArtifactStore initialized: root={}, syncEnabled={}", root, syncEnabled);
    }

    public Path root() {
        return root;
    }

    @Override
    public CompletableFuture<String> put(byte[] content) {
        Objects.requireNonNull(content, "content");
        byte[] copy = content.clone();
        return submit(() -> {
            String key = ContentKeys.of(copy);
            Path target = pathOf(key);
            if (Files.exists(target)) {
                LOG.debug("Artifact {} already stored", key);
                return key;
            }
            try {
                Files.createDirectories(target.getParent());
                Path tmp = target.resolveSibling(key + TMP_SUFFIX);
                try (FileChannel ch = FileChannel.open(tmp,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE)) {
                    ByteBuffer buf = ByteBuffer.wrap(copy);
                    while (buf.hasRemaining()) {
                        ch.write(buf);
                    }
                    if (syncEnabled) {
                        ch.force(true);
                    }
                }
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                if (syncEnabled) {
                    syncDirectory(target.getParent());
                }
                LOG.debug("Stored artifact {} ({} bytes)", key, copy.length);
                return key;
            } catch (IOException e) {
                LOG.error("Failed to store artifact {}: {}", key, e.getMessage(), e);
                throw new StorageException("Failed to store artifact " + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<byte[]> get(String key) {
        if (!ContentKeys.isValid(key)) {
            return CompletableFuture.failedFuture(NotFoundException.artifact(key));
        }
        return submit(() -> {
            try {
                return Files.readAllBytes(pathOf(key));
            } catch (NoSuchFileException e) {
                throw NotFoundException.artifact(key);
            } catch (IOException e) {
                LOG.error("Failed to read artifact {}: {}", key, e.getMessage(), e);
                throw new StorageException("Failed to read artifact " + key, e);
            }
        });
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        ioExecutor.shutdown();
        LOG.debug("FileArtifactStore closed: {}", root);
    }

    private Path pathOf(String key) {
        return root.resolve(key.substring(0, 2)).resolve(key);
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Artifact store is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(task, ioExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new StorageException("Artifact store is closed", e));
        }
    }

    private static void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
