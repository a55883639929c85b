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

import dev.mars.flowlog.model.FlowRecord;

/**
 * Folds one record into the state. Must be deterministic and free of side effects:
 * rehydration calls it again for the same records every time a lineage is loaded.
 *
 * @param <S> state type
 */
@FunctionalInterface
public interface RecordApplier<S> {

    S apply(S state, FlowRecord record);
}
