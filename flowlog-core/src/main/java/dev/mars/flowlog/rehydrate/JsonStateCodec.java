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
package dev.mars.flowlog.rehydrate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowlog.model.Documents;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link StateCodec} writing state as JSON with Jackson data binding.
 *
 * @param <S> state type; must be serializable by the mapper
 */
public final class JsonStateCodec<S> implements StateCodec<S> {

    private final ObjectMapper mapper;
    private final Class<S> type;

    public JsonStateCodec(Class<S> type) {
        this(Documents.MAPPER, type);
    }

    public JsonStateCodec(ObjectMapper mapper, Class<S> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public byte[] encode(S state) {
        try {
            return mapper.writeValueAsBytes(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("State of type " + type.getName() + " is not serializable: "
                    + e.getOriginalMessage(), e);
        }
    }

    @Override
    public S decode(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, type);
    }
}
