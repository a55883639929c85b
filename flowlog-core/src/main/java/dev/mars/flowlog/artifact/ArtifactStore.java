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
import dev.mars.flowlog.store.NotImplementedException;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * Blob storage for serialized state too large to keep inline in a snapshot.
 * <p>
 * Two operations: store bytes and get back an opaque key, fetch bytes by key. Keys
 * are recorded in {@link dev.mars.flowlog.model.StatePointer.Reference}s and must stay
 * valid for as long as any snapshot refers to them.
 */
public interface ArtifactStore extends Closeable {

    /**
     * Stores a blob.
     *
     * @return a Future with the key to fetch it by
     */
    CompletableFuture<String> put(byte[] content);

    /**
     * Fetches a blob.
     *
     * @return a Future failing with {@link NotFoundException} for an unknown key
     */
    CompletableFuture<byte[]> get(String key);

    @Override
    void close();

    /**
     * A store for backends without blob support. Every call fails with
     * {@link NotImplementedException}, so callers can tell "not supported" from a
     * storage failure and fall back to inline state.
     */
    static ArtifactStore unsupported() {
        return Unsupported.INSTANCE;
    }

    /**
     * Backing instance of {@link #unsupported()}.
     */
    final class Unsupported implements ArtifactStore {
        static final Unsupported INSTANCE = new Unsupported();

        private Unsupported() {
        }

        @Override
        public CompletableFuture<String> put(byte[] content) {
            return CompletableFuture.failedFuture(
                    new NotImplementedException("Artifact storage is not supported by this backend"));
        }

        @Override
        public CompletableFuture<byte[]> get(String key) {
            return CompletableFuture.failedFuture(
                    new NotImplementedException("Artifact storage is not supported by this backend"));
        }

        @Override
        public void close() {
        }
    }
}
