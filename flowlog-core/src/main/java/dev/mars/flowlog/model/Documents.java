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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Helpers for the schema-free documents carried by lineages, records and snapshots.
 * <p>
 * Payloads and metadata are Jackson {@link JsonNode} trees: a tagged union of
 * null, boolean, number, string, array and object. Stores keep their own deep
 * copies so a caller mutating a node it passed in (or got back) never changes
 * persisted history.
 * <p>
 * Numbers with a fraction come back from storage as decimal nodes. A payload built
 * with {@code double} values therefore reads back numerically equal but as a
 * different node type; build payloads with {@link java.math.BigDecimal} where node
 * equality across a restart matters.
 */
public final class Documents {

    /**
     * Shared mapper. Thread-safe once configured. Fractional numbers are read as exact
     * {@link java.math.BigDecimal} values, so a decimal payload survives a journal
     * round-trip digit for digit.
     */
    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .build();

    private Documents() {
    }

    /** A fresh, empty object document ({@code {}}). */
    public static ObjectNode emptyObject() {
        return MAPPER.getNodeFactory().objectNode();
    }

    /**
     * Deep copy of a payload document; {@code null} and missing become JSON {@code null}.
     */
    public static JsonNode copyPayload(JsonNode node) {
        return node == null || node.isMissingNode() ? NullNode.getInstance() : node.deepCopy();
    }

    /**
     * Deep copy of a metadata document; {@code null}, JSON null and missing become {@code {}}.
     */
    public static JsonNode copyMetadata(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? emptyObject() : node.deepCopy();
    }

    /** True for {@code null}, JSON null and {@code {}}. */
    public static boolean isEmpty(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() || (node.isObject() && node.isEmpty());
    }

    /** Serializes a document to compact UTF-8 JSON. */
    public static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses UTF-8 JSON into a document. */
    public static JsonNode fromBytes(byte[] json) throws IOException {
        return MAPPER.readTree(json);
    }

    /** Converts any Jackson-serializable value to a document. */
    public static JsonNode valueOf(Object value) {
        return MAPPER.valueToTree(value);
    }
}
