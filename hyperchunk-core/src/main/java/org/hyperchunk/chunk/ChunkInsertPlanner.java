/*
 * ChunkInsertPlanner.java
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
import org.hyperchunk.catalog.ChunkCatalog;
import org.hyperchunk.catalog.ChunkReplicaResolver;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.metadata.Hypertable;
import org.hyperchunk.metadata.Partition;
import org.hyperchunk.metadata.PartitionEpoch;
import org.hyperchunk.plan.StatementCompiler;
import org.hyperchunk.timer.CacheTimer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The entry point for inserting rows into a hypertable: resolves the chunk that covers a time point and returns
 * it with a compiled plan that moves the chunk's rows from the copy table into its replica tables.
 *
 * <p>
 * A planner owns a {@link ChunkPlanCache}. Register {@link #getInvalidator()} with the catalog so that metadata
 * changes reach the cache, and {@link #close()} the planner at shutdown to release every cached plan.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class ChunkInsertPlanner implements AutoCloseable {
    @Nonnull
    private final ChunkLookup lookup;
    @Nonnull
    private final ChunkPlanCache planCache;
    @Nonnull
    private final ChunkCacheInvalidator invalidator;
    @Nonnull
    private final ChunkCacheProperties properties;

    public ChunkInsertPlanner(@Nonnull ChunkCatalog catalog, @Nonnull ChunkReplicaResolver replicaResolver,
                              @Nonnull StatementCompiler compiler) {
        this(catalog, replicaResolver, compiler, ChunkCacheProperties.DEFAULT, null);
    }

    public ChunkInsertPlanner(@Nonnull ChunkCatalog catalog, @Nonnull ChunkReplicaResolver replicaResolver,
                              @Nonnull StatementCompiler compiler, @Nonnull ChunkCacheProperties properties,
                              @Nullable CacheTimer timer) {
        this.lookup = new ChunkLookup(catalog, timer);
        this.planCache = new ChunkPlanCache(compiler, replicaResolver, properties, timer);
        this.invalidator = new ChunkCacheInvalidator(planCache, timer);
        this.properties = properties;
    }

    /**
     * Get the chunk covering a time point and its move plan, using the configured row locking.
     *
     * @param hypertable the hypertable
     * @param epoch the partition epoch in effect
     * @param partition the partition of the epoch the row belongs to
     * @param timePoint the row's time
     * @return the chunk and its plan
     * @see #getChunkCacheEntry(Hypertable, PartitionEpoch, Partition, long, boolean)
     */
    @Nonnull
    public ChunkCacheEntry getChunkCacheEntry(@Nonnull Hypertable hypertable, @Nonnull PartitionEpoch epoch,
                                              @Nonnull Partition partition, long timePoint) {
        return getChunkCacheEntry(hypertable, epoch, partition, timePoint, properties.isLockRows());
    }

    /**
     * Get the chunk covering a time point and its move plan. The chunk is created if needed, and the plan is
     * compiled or rebuilt if the cache has none valid for the chunk's current range.
     *
     * @param hypertable the hypertable
     * @param epoch the partition epoch in effect
     * @param partition the partition of the epoch the row belongs to
     * @param timePoint the row's time
     * @param lock whether to share-lock the chunk rows read
     * @return the chunk and its plan
     */
    @Nonnull
    public ChunkCacheEntry getChunkCacheEntry(@Nonnull Hypertable hypertable, @Nonnull PartitionEpoch epoch,
                                              @Nonnull Partition partition, long timePoint, boolean lock) {
        final ChunkRow chunk = lookup.resolveOrCreate(hypertable, partition, timePoint, lock);
        final ChunkPlanCacheEntry entry = planCache.fetch(ChunkCacheQuery.forChunk(hypertable, epoch, partition, chunk));
        return new ChunkCacheEntry(chunk, entry.getPlan());
    }

    @Nonnull
    public ChunkPlanCache getPlanCache() {
        return planCache;
    }

    @Nonnull
    public ChunkCacheInvalidator getInvalidator() {
        return invalidator;
    }

    @Override
    public void close() {
        planCache.close();
    }
}
