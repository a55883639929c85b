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
 * Demo applications for the flowlog record store.
 * <p>
 * This package contains:
 * <ul>
 *   <li>{@link dev.mars.flowlog.demo.FlowDemo} - Walks through a flow's lifecycle on a journal-backed store</li>
 *   <li>{@link dev.mars.flowlog.demo.FlowChaos} - Concurrency and corruption chaos runs against the journal</li>
 * </ul>
 */
package dev.mars.flowlog.demo;
