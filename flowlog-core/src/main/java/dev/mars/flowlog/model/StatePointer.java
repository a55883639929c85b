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
package dev.mars.flowlog.model;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Where a snapshot's serialized state lives: inline in the snapshot itself, or
 * behind a key in an {@link dev.mars.flowlog.artifact.ArtifactStore}.
 * <p>
 * The string form ({@link #encode()}) is what backends persist:
 * <pre>
 * inline:&lt;base64 state&gt;
 * ref:&lt;artifact key&gt;
 * </pre>
 */
public sealed interface StatePointer permits StatePointer.Inline, StatePointer.Reference {

    String INLINE_PREFIX = "inline:";
    String REFERENCE_PREFIX = "ref:";

    /** Persistable string form. */
    String encode();

    static StatePointer inline(byte[] state) {
        return new Inline(state);
    }

    static StatePointer reference(String key) {
        return new Reference(key);
    }

    /**
     * Parses the output of {@link #encode()}.
     *
     * @throws IllegalArgumentException for an unknown scheme or bad base64
     */
    static StatePointer parse(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        if (encoded.startsWith(INLINE_PREFIX)) {
            return new Inline(Base64.getDecoder().decode(encoded.substring(INLINE_PREFIX.length())));
        }
        if (encoded.startsWith(REFERENCE_PREFIX)) {
            return new Reference(encoded.substring(REFERENCE_PREFIX.length()));
        }
        throw new IllegalArgumentException("Unknown state pointer scheme: " + encoded);
    }

    /**
     * State embedded in the snapshot.
     */
    record Inline(byte[] state) implements StatePointer {

        public Inline {
            Objects.requireNonNull(state, "state");
            state = state.clone();
        }

        @Override
        public byte[] state() {
            return state.clone();
        }

        @Override
        public String encode() {
            return INLINE_PREFIX + Base64.getEncoder().encodeToString(state);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Inline other && Arrays.equals(state, other.state);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(state);
        }

        @Override
        public String toString() {
            return "Inline[" + state.length + " bytes]";
        }
    }

    /**
     * State stored externally under an opaque key.
     */
    record Reference(String key) implements StatePointer {

        public Reference {
            Objects.requireNonNull(key, "key");
            if (key.isBlank()) {
                throw new IllegalArgumentException("artifact key must not be blank");
            }
        }

        @Override
        public String encode() {
            return REFERENCE_PREFIX + key;
        }
    }
}
