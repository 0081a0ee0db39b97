/*
 * ChunkLookup.java
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
import org.hyperchunk.catalog.RowLockMode;
import org.hyperchunk.logging.KeyValueLogMessage;
import org.hyperchunk.logging.LogMessageKeys;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.metadata.Hypertable;
import org.hyperchunk.metadata.Partition;
import org.hyperchunk.metadata.TimeRange;
import org.hyperchunk.timer.CacheTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds the chunk of a partition that covers a time point, creating it if there is none.
 *
 * <p>
 * The catalog scan returns every chunk of the partition and each is checked against the time point, so open
 * bounds match everything on their side. Finding more than one covering chunk means the catalog is corrupt and
 * fails with a {@link ChunkOverlapException}. When no chunk covers the point, a new one is sized by
 * {@link ChunkBoundaries} and inserted. Two lookups racing to create the same chunk are resolved by the
 * catalog's constraints, not here: the loser gets a {@link org.hyperchunk.catalog.ChunkCatalogException}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class ChunkLookup {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkLookup.class);

    @Nonnull
    private final ChunkCatalog catalog;
    @Nullable
    private final CacheTimer timer;

    public ChunkLookup(@Nonnull ChunkCatalog catalog) {
        this(catalog, null);
    }

    public ChunkLookup(@Nonnull ChunkCatalog catalog, @Nullable CacheTimer timer) {
        this.catalog = catalog;
        this.timer = timer;
    }

    /**
     * Get the chunk covering a time point, creating it if needed.
     *
     * @param hypertable the hypertable, supplying the chunk time interval
     * @param partition the partition to look in
     * @param timePoint the time point the chunk must cover
     * @param lockRow whether to share-lock the chunk rows read
     * @return the covering chunk
     * @throws ChunkOverlapException if several chunks cover the time point
     * @throws org.hyperchunk.catalog.ChunkCatalogException if the catalog cannot be read or the chunk inserted
     */
    @Nonnull
    public ChunkRow resolveOrCreate(@Nonnull Hypertable hypertable, @Nonnull Partition partition, long timePoint,
                                   boolean lockRow) {
        final RowLockMode lockMode = lockRow ? RowLockMode.SHARE : RowLockMode.NONE;
        final List<ChunkRow> rows = scan(partition.getId(), lockMode);
        final List<ChunkRow> matches = new ArrayList<>(1);
        for (ChunkRow row : rows) {
            if (row.getRange().contains(timePoint)) {
                matches.add(row);
            }
        }
        if (matches.size() > 1) {
            throw new ChunkOverlapException("more than one chunk covers time point",
                    LogMessageKeys.HYPERTABLE_ID, hypertable.getId(),
                    LogMessageKeys.PARTITION_ID, partition.getId(),
                    LogMessageKeys.TIME_POINT, timePoint,
                    LogMessageKeys.MATCH_COUNT, matches.size(),
                    LogMessageKeys.CHUNK_ID, matches.get(0).getId(),
                    LogMessageKeys.OTHER_CHUNK_ID, matches.get(1).getId());
        }
        if (matches.size() == 1) {
            if (timer != null) {
                timer.increment(CacheTimer.Counts.CHUNK_FOUND);
            }
            return matches.get(0);
        }
        final TimeRange range = ChunkBoundaries.calculate(timePoint, hypertable.getChunkTimeInterval(),
                hypertable.getTimeColumnType(), rows);
        final ChunkRow created = catalog.insertChunk(partition.getId(), range);
        if (timer != null) {
            timer.increment(CacheTimer.Counts.CHUNK_CREATED);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("created chunk",
                    LogMessageKeys.HYPERTABLE_ID, hypertable.getId(),
                    LogMessageKeys.PARTITION_ID, partition.getId(),
                    LogMessageKeys.CHUNK_ID, created.getId(),
                    LogMessageKeys.TIME_POINT, timePoint,
                    LogMessageKeys.CHUNK_TIME_INTERVAL, hypertable.getChunkTimeInterval(),
                    LogMessageKeys.LOCK_MODE, lockMode,
                    LogMessageKeys.START_TIME, range.getNullableStartTime(),
                    LogMessageKeys.END_TIME, range.getNullableEndTime()));
        }
        return created;
    }

    @Nonnull
    private List<ChunkRow> scan(int partitionId, @Nonnull RowLockMode lockMode) {
        if (timer == null) {
            return catalog.scanPartition(partitionId, lockMode);
        }
        return timer.time(CacheTimer.Events.CHUNK_SCAN, () -> catalog.scanPartition(partitionId, lockMode));
    }
}
