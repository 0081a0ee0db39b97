/*
 * ChunkCatalog.java
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

package org.hyperchunk.catalog;

import org.hyperchunk.annotation.API;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.metadata.TimeRange;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Access to the rows of the chunk catalog.
 *
 * <p>
 * An implementation must guarantee that chunk ids are unique and that the ranges of the chunks of one partition
 * never overlap. Lookups rely on this and do not deduplicate concurrent creations themselves, so
 * {@link #insertChunk} must fail rather than create a chunk overlapping one that already exists, including one
 * created concurrently by another transaction.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface ChunkCatalog {
    /**
     * Scan the chunks of a partition through the <code>(partition_id, start_time, end_time)</code> index.
     *
     * @param partitionId the partition to scan
     * @param lockMode the row lock to take on the returned rows
     * @return the partition's chunks, ordered by start and then end time, open starts first
     * @throws ChunkCatalogException if the scan fails
     */
    @Nonnull
    List<ChunkRow> scanPartition(int partitionId, @Nonnull RowLockMode lockMode);

    /**
     * Create a chunk.
     *
     * @param partitionId the partition the chunk belongs to
     * @param range the chunk's time range
     * @return the new row, with the id the catalog assigned
     * @throws ChunkCatalogException if the row cannot be created, including when it would overlap another chunk
     */
    @Nonnull
    ChunkRow insertChunk(int partitionId, @Nonnull TimeRange range);
}
