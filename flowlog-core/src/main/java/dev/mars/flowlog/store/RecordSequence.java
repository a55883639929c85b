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

import dev.mars.flowlog.model.FlowRecord;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Records of one lineage in ascending cursor order.
 * <p>
 * Lazy and restartable: every {@link #iterator()} call walks the range again from the
 * start. The range is fixed when the sequence is created, so a sequence never shows a
 * record appended (or drops one pruned) after that point.
 */
public final class RecordSequence implements Iterable<FlowRecord> {

    private static final RecordSequence EMPTY = new RecordSequence(Collections.emptyList());

    private final Iterable<FlowRecord> source;

    private RecordSequence(Iterable<FlowRecord> source) {
        this.source = source;
    }

    public static RecordSequence empty() {
        return EMPTY;
    }

    public static RecordSequence of(Iterable<FlowRecord> source) {
        return new RecordSequence(source);
    }

    @Override
    public Iterator<FlowRecord> iterator() {
        return source.iterator();
    }

    public Stream<FlowRecord> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /** Materializes the sequence. */
    public List<FlowRecord> toList() {
        return stream().toList();
    }

    public boolean isEmpty() {
        return !iterator().hasNext();
    }
}
