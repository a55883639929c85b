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
 * Data model of the lineage record store.
 * <ul>
 *   <li>{@link dev.mars.flowlog.model.LineageMeta} - a lineage (flow) and its counters</li>
 *   <li>{@link dev.mars.flowlog.model.FlowRecord} - one immutable history record</li>
 *   <li>{@link dev.mars.flowlog.model.SnapshotMeta} - a point-in-time state capture</li>
 *   <li>{@link dev.mars.flowlog.model.PersistOutcome} - result of an append</li>
 * </ul>
 * Pure data, no behaviour beyond copy helpers.
 */
package dev.mars.flowlog.model;
