/*
 * InMemoryChunkCatalog.java
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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import org.hyperchunk.annotation.API;
import org.hyperchunk.logging.KeyValueLogMessage;
import org.hyperchunk.logging.LogMessageKeys;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.metadata.QualifiedTableName;
import org.hyperchunk.metadata.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A chunk catalog held in memory, for embedding and for tests.
 *
 * <p>
 * The catalog enforces the constraints a real catalog is required to: ids are unique and the chunks of a
 * partition never overlap, so a racing creation of an overlapping chunk fails with a
 * {@link ChunkCatalogException}. Changes that can make a compiled move plan stale (changing or deleting a
 * chunk's range, adding a replica table) are reported to every registered {@link ChunkMetadataListener} once
 * they are applied. Creating a chunk is not reported, as it does not affect existing chunks.
 * </p>
 *
 * <p>
 * Row locks are not enforced; share-mode scans are only counted, see {@link #getSharedRowLockCount()}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class InMemoryChunkCatalog implements ChunkCatalog, ChunkReplicaResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryChunkCatalog.class);

    // The order of the (partition_id, start_time, end_time) index. Open starts sort first, open ends last.
    private static final Comparator<ChunkRow> INDEX_ORDER = Comparator
            .comparingLong((ChunkRow row) -> row.getRange().getStartTime())
            .thenComparingLong(row -> row.getRange().getEndTime())
            .thenComparingInt(ChunkRow::getId);

    @Nonnull
    private final Map<Integer, ChunkRow> chunksById = new HashMap<>();
    @Nonnull
    private final Map<Integer, NavigableSet<ChunkRow>> chunksByPartition = new HashMap<>();
    @Nonnull
    private final ListMultimap<Integer, QualifiedTableName> replicaTables = ArrayListMultimap.create();
    @Nonnull
    private final List<ChunkMetadataListener> listeners = new CopyOnWriteArrayList<>();
    private int nextChunkId = 1;
    private long sharedRowLockCount;

    @Nonnull
    @Override
    public synchronized List<ChunkRow> scanPartition(int partitionId, @Nonnull RowLockMode lockMode) {
        final NavigableSet<ChunkRow> rows = chunksByPartition.get(partitionId);
        if (rows == null) {
            return ImmutableList.of();
        }
        if (lockMode == RowLockMode.SHARE) {
            sharedRowLockCount += rows.size();
        }
        return ImmutableList.copyOf(rows);
    }

    @Nonnull
    @Override
    public ChunkRow insertChunk(int partitionId, @Nonnull TimeRange range) {
        final ChunkRow row;
        synchronized (this) {
            checkNoOverlap(partitionId, range, null);
            row = new ChunkRow(nextChunkId++, partitionId, range);
            chunksById.put(row.getId(), row);
            chunksByPartition.computeIfAbsent(partitionId, ignore -> new TreeSet<>(INDEX_ORDER)).add(row);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("inserted chunk row",
                    LogMessageKeys.CHUNK_ID, row.getId(),
                    LogMessageKeys.PARTITION_ID, partitionId,
                    LogMessageKeys.START_TIME, range.getNullableStartTime(),
                    LogMessageKeys.END_TIME, range.getNullableEndTime()));
        }
        return row;
    }

    /**
     * Change the range of a chunk and notify the listeners.
     *
     * @param chunkId the chunk to change
     * @param newRange the new range
     * @return the updated row
     * @throws ChunkCatalogException if the chunk does not exist or the new range overlaps another chunk
     */
    @Nonnull
    public ChunkRow updateChunkRange(int chunkId, @Nonnull TimeRange newRange) {
        final ChunkRow updated;
        synchronized (this) {
            final ChunkRow existing = getExisting(chunkId);
            checkNoOverlap(existing.getPartitionId(), newRange, existing);
            updated = existing.withRange(newRange);
            final NavigableSet<ChunkRow> rows = chunksByPartition.get(existing.getPartitionId());
            rows.remove(existing);
            rows.add(updated);
            chunksById.put(chunkId, updated);
        }
        notifyListeners();
        return updated;
    }

    /**
     * Delete a chunk and its replica table registrations, and notify the listeners.
     *
     * @param chunkId the chunk to delete
     * @throws ChunkCatalogException if the chunk does not exist
     */
    public void deleteChunk(int chunkId) {
        synchronized (this) {
            final ChunkRow existing = getExisting(chunkId);
            chunksById.remove(chunkId);
            chunksByPartition.get(existing.getPartitionId()).remove(existing);
            replicaTables.removeAll(chunkId);
        }
        notifyListeners();
    }

    /**
     * Register a table the chunk's rows are written to, and notify the listeners.
     *
     * @param chunkId the chunk
     * @param table the replica table
     * @throws ChunkCatalogException if the chunk does not exist
     */
    public void addReplicaTable(int chunkId, @Nonnull QualifiedTableName table) {
        synchronized (this) {
            getExisting(chunkId);
            replicaTables.put(chunkId, table);
        }
        notifyListeners();
    }

    @Nonnull
    @Override
    public synchronized List<QualifiedTableName> getReplicaTables(int chunkId) {
        return ImmutableList.copyOf(replicaTables.get(chunkId));
    }

    @Nonnull
    public synchronized Optional<ChunkRow> getChunk(int chunkId) {
        return Optional.ofNullable(chunksById.get(chunkId));
    }

    public synchronized int getChunkCount() {
        return chunksById.size();
    }

    /**
     * Get the number of rows returned by share-mode scans so far.
     * @return the number of share-mode row locks taken
     */
    public synchronized long getSharedRowLockCount() {
        return sharedRowLockCount;
    }

    public void addListener(@Nonnull ChunkMetadataListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@Nonnull ChunkMetadataListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners() {
        for (ChunkMetadataListener listener : listeners) {
            listener.onChunkMetadataChanged();
        }
    }

    @Nonnull
    private ChunkRow getExisting(int chunkId) {
        final ChunkRow existing = chunksById.get(chunkId);
        if (existing == null) {
            throw new ChunkCatalogException("chunk does not exist",
                    LogMessageKeys.CHUNK_ID, chunkId);
        }
        return existing;
    }

    private void checkNoOverlap(int partitionId, @Nonnull TimeRange range, @Nullable ChunkRow ignored) {
        final NavigableSet<ChunkRow> rows = chunksByPartition.get(partitionId);
        if (rows == null) {
            return;
        }
        for (ChunkRow row : rows) {
            if (!row.equals(ignored) && row.getRange().overlaps(range)) {
                throw new ChunkCatalogException("chunk range overlaps an existing chunk",
                        LogMessageKeys.PARTITION_ID, partitionId,
                        LogMessageKeys.OTHER_CHUNK_ID, row.getId(),
                        LogMessageKeys.START_TIME, range.getNullableStartTime(),
                        LogMessageKeys.END_TIME, range.getNullableEndTime());
            }
        }
    }
}
