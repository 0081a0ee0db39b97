/*
 * ChunkPlanCacheEntry.java
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
import org.hyperchunk.metadata.TimeRange;
import org.hyperchunk.plan.CompiledPlan;

import javax.annotation.Nonnull;

/**
 * An entry of the {@link ChunkPlanCache}: the compiled move plan of a chunk and the range it was built for.
 * The plan is valid for exactly that range. Entries are owned by the cache, which updates them in place.
 */
@API(API.Status.EXPERIMENTAL)
public final class ChunkPlanCacheEntry {
    private final int chunkId;
    @Nonnull
    private TimeRange range;
    @Nonnull
    private CompiledPlan plan;

    ChunkPlanCacheEntry(int chunkId, @Nonnull TimeRange range, @Nonnull CompiledPlan plan) {
        this.chunkId = chunkId;
        this.range = range;
        this.plan = plan;
    }

    public int getChunkId() {
        return chunkId;
    }

    @Nonnull
    public TimeRange getRange() {
        return range;
    }

    @Nonnull
    public CompiledPlan getPlan() {
        return plan;
    }

    void replace(@Nonnull TimeRange newRange, @Nonnull CompiledPlan newPlan) {
        this.range = newRange;
        this.plan = newPlan;
    }

    @Override
    public String toString() {
        return "ChunkPlanCacheEntry{chunk=" + chunkId + ", " + range + "}";
    }
}
