/*
 * ChunkRow.java
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

package org.hyperchunk.metadata;

import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A row of the chunk catalog: a chunk's identity, the partition it belongs to, and the time range it covers.
 * The id never changes; the range may be changed by catalog operations.
 */
@API(API.Status.UNSTABLE)
public final class ChunkRow {
    private final int id;
    private final int partitionId;
    @Nonnull
    private final TimeRange range;

    public ChunkRow(int id, int partitionId, @Nonnull TimeRange range) {
        this.id = id;
        this.partitionId = partitionId;
        this.range = range;
    }

    public int getId() {
        return id;
    }

    public int getPartitionId() {
        return partitionId;
    }

    @Nonnull
    public TimeRange getRange() {
        return range;
    }

    @Nonnull
    public ChunkRow withRange(@Nonnull TimeRange newRange) {
        return new ChunkRow(id, partitionId, newRange);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ChunkRow chunkRow = (ChunkRow)o;
        return id == chunkRow.id && partitionId == chunkRow.partitionId && range.equals(chunkRow.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, partitionId, range);
    }

    @Override
    public String toString() {
        return "ChunkRow{" + id + ", partition=" + partitionId + ", " + range + "}";
    }
}
