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
 * Durable record store backend: a CRC-protected, append-only journal of store
 * mutations, replayed into memory on open.
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ flowlog.lock     // exclusive process lock
 *  └─ flowlog.journal  // CREATE_LINEAGE, APPEND, BRANCH, DELETE, PRUNE,
 *                      // SAVE_SNAPSHOT, DELETE_SNAPSHOT, SET_STATUS entries
 * </pre>
 *
 * @see dev.mars.flowlog.store.file.FileRecordStore
 */
package dev.mars.flowlog.store.file;
