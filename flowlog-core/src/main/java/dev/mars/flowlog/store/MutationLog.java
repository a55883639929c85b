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

/**
 * Write-ahead hook of a {@link LineageTable}.
 * <p>
 * Called after a mutation has been validated and while the affected lineages are
 * still locked, before anything becomes visible. If {@link #write} throws, the table
 * applies nothing: a durable backend makes the mutation durable here
 * (persist-before-apply).
 */
@FunctionalInterface
public interface MutationLog {

    /** For purely in-memory tables and for journal replay. */
    MutationLog NONE = mutation -> { };

    /**
     * @throws StorageException if the mutation could not be made durable
     */
    void write(Mutation mutation);
}
