/*
 * ChunkCacheQuery.java
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
import org.hyperchunk.metadata.Hypertable;
import org.hyperchunk.metadata.Partition;
import org.hyperchunk.metadata.PartitionEpoch;
import org.hyperchunk.metadata.TimeRange;

import javax.annotation.Nonnull;

/**
 * A request to the {@link ChunkPlanCache}: the chunk whose move plan is wanted, its current range, and the
 * metadata needed to build the plan if the cache has to.
 */
@API(API.Status.EXPERIMENTAL)
public final class ChunkCacheQuery {
    @Nonnull
    private final Hypertable hypertable;
    @Nonnull
    private final PartitionEpoch epoch;
    @Nonnull
    private final Partition partition;
    private final int chunkId;
    @Nonnull
    private final TimeRange range;

    public ChunkCacheQuery(@Nonnull Hypertable hypertable, @Nonnull PartitionEpoch epoch, @Nonnull Partition partition,
                           int chunkId, @Nonnull TimeRange range) {
        this.hypertable = hypertable;
        this.epoch = epoch;
        this.partition = partition;
        this.chunkId = chunkId;
        this.range = range;
    }

    @Nonnull
    public static ChunkCacheQuery forChunk(@Nonnull Hypertable hypertable, @Nonnull PartitionEpoch epoch,
                                           @Nonnull Partition partition, @Nonnull ChunkRow chunk) {
        return new ChunkCacheQuery(hypertable, epoch, partition, chunk.getId(), chunk.getRange());
    }

    @Nonnull
    public Hypertable getHypertable() {
        return hypertable;
    }

    @Nonnull
    public PartitionEpoch getEpoch() {
        return epoch;
    }

    @Nonnull
    public Partition getPartition() {
        return partition;
    }

    public int getChunkId() {
        return chunkId;
    }

    @Nonnull
    public TimeRange getRange() {
        return range;
    }

    @Override
    public String toString() {
        return "ChunkCacheQuery{chunk=" + chunkId + ", " + range + ", partition=" + partition.getId() + "}";
    }
}
