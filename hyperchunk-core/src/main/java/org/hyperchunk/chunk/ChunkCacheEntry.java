/*
 * ChunkCacheEntry.java
 *
 * This source file is part of the Hyperchunk open source project
 *
 * Copyright 2026 the Hyperchunk project authors
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

package org.hyperchunk.chunk;

import org.hyperchunk.annotation.API;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.plan.CompiledPlan;

import javax.annotation.Nonnull;

/**
 * The result of {@link ChunkInsertPlanner#getChunkCacheEntry}: the chunk that covers the requested time point and
 * the compiled plan that moves its rows. The plan is owned by the cache.
 */
@API(API.Status.EXPERIMENTAL)
public final class ChunkCacheEntry {
    @Nonnull
    private final ChunkRow chunk;
    @Nonnull
    private final CompiledPlan plan;

    public ChunkCacheEntry(@Nonnull ChunkRow chunk, @Nonnull CompiledPlan plan) {
        this.chunk = chunk;
        this.plan = plan;
    }

    @Nonnull
    public ChunkRow getChunk() {
        return chunk;
    }

    @Nonnull
    public CompiledPlan getPlan() {
        return plan;
    }

    @Override
    public String toString() {
        return "ChunkCacheEntry{" + chunk + "}";
    }
}
