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
 * Lineage Record Store - the only layer that creates, mutates or deletes lineages,
 * records and snapshots.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link dev.mars.flowlog.store.RecordStore} - The storage contract every backend implements</li>
 *   <li>{@link dev.mars.flowlog.store.LineageTable} - Lock-per-lineage tables backends are built on</li>
 *   <li>{@link dev.mars.flowlog.store.AppendPlan}, {@link dev.mars.flowlog.store.BranchPlan},
 *       {@link dev.mars.flowlog.store.PrunePlan} - Pure planners for multi-step writes</li>
 *   <li>{@link dev.mars.flowlog.store.FlowStoreConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Persist-before-apply:</b> a change is journaled before readers can see it</li>
 *   <li><b>Optimistic concurrency:</b> appends name the version they expect; stale writers get a conflict</li>
 *   <li><b>Idempotent commands:</b> a repeated command id returns the original result</li>
 *   <li><b>Non-blocking reads:</b> readers see a consistent handle without taking locks</li>
 * </ul>
 *
 * @see dev.mars.flowlog.store.RecordStore
 */
package dev.mars.flowlog.store;
