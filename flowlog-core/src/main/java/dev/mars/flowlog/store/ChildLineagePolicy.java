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

import java.util.Locale;

/**
 * What happens to lineages branched from a lineage that is deleted.
 */
public enum ChildLineagePolicy {

    /** Children survive; their parent reference is cleared. */
    ORPHAN,

    /** Children and all their descendants are deleted with the parent. */
    CASCADE;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ChildLineagePolicy parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
