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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile, content-addressed {@link ArtifactStore}.
 */
public final class InMemoryArtifactStore implements ArtifactStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<String> put(byte[] content) {
        Objects.requireNonNull(content, "content");
        String key = ContentKeys.of(content);
        blobs.putIfAbsent(key, content.clone());
        return CompletableFuture.completedFuture(key);
    }

    @Override
    public CompletableFuture<byte[]> get(String key) {
        byte[] blob = key == null ? null : blobs.get(key);
        if (blob == null) {
            return CompletableFuture.failedFuture(NotFoundException.artifact(key));
        }
        return CompletableFuture.completedFuture(blob.clone());
    }

    public int size() {
        return blobs.size();
    }

    @Override
    public void close() {
        blobs.clear();
    }
}
