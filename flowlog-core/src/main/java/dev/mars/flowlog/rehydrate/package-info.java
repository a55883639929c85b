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
/**
 * Rehydration: rebuilding aggregate state from the latest snapshot plus the records
 * appended after it.
 * <p>
 * The result is the same whether or not a snapshot is used, so snapshots can be
 * taken, dropped or pruned at any time without changing what callers observe.
 *
 * @see dev.mars.flowlog.rehydrate.Rehydrator
 */
package dev.mars.flowlog.rehydrate;
