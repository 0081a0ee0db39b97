/*
 * PartitionEpoch.java
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

import com.google.common.collect.ImmutableList;
import org.hyperchunk.HyperchunkArgumentException;
import org.hyperchunk.annotation.API;
import org.hyperchunk.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.List;

/**
 * A partitioning configuration of a hypertable that is in effect over a range of time.
 *
 * <p>
 * An epoch with a single partition needs no partitioning function. An epoch with several partitions must have
 * one, and the partitions' keyspace slices must not overlap. Partitions are kept sorted by keyspace start.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class PartitionEpoch {
    private final int id;
    private final int hypertableId;
    @Nonnull
    private final TimeRange timeRange;
    @Nullable
    private final Partitioning partitioning;
    @Nonnull
    private final List<Partition> partitions;

    public PartitionEpoch(int id, int hypertableId, @Nonnull TimeRange timeRange,
                          @Nullable Partitioning partitioning, @Nonnull List<Partition> partitions) {
        if (partitions.isEmpty()) {
            throw new HyperchunkArgumentException("epoch has no partitions",
                    LogMessageKeys.EPOCH_ID, id);
        }
        if (partitions.size() > 1 && partitioning == null) {
            throw new HyperchunkArgumentException("epoch with several partitions has no partitioning function",
                    LogMessageKeys.EPOCH_ID, id,
                    LogMessageKeys.NUM_PARTITIONS, partitions.size());
        }
        final List<Partition> sorted = ImmutableList.sortedCopyOf(Comparator.comparingInt(Partition::getKeyspaceStart), partitions);
        for (int i = 0; i < sorted.size(); i++) {
            final Partition partition = sorted.get(i);
            if (partition.getEpochId() != id) {
                throw new HyperchunkArgumentException("partition belongs to another epoch",
                        LogMessageKeys.EPOCH_ID, id,
                        LogMessageKeys.PARTITION_ID, partition.getId());
            }
            if (i > 0 && sorted.get(i - 1).getKeyspaceEnd() >= partition.getKeyspaceStart()) {
                throw new HyperchunkArgumentException("partition keyspaces overlap",
                        LogMessageKeys.EPOCH_ID, id,
                        LogMessageKeys.PARTITION_ID, partition.getId(),
                        LogMessageKeys.KEYSPACE_START, partition.getKeyspaceStart());
            }
        }
        this.id = id;
        this.hypertableId = hypertableId;
        this.timeRange = timeRange;
        this.partitioning = partitioning;
        this.partitions = sorted;
    }

    public int getId() {
        return id;
    }

    public int getHypertableId() {
        return hypertableId;
    }

    @Nonnull
    public TimeRange getTimeRange() {
        return timeRange;
    }

    @Nullable
    public Partitioning getPartitioning() {
        return partitioning;
    }

    @Nonnull
    public List<Partition> getPartitions() {
        return partitions;
    }

    public int getNumPartitions() {
        return partitions.size();
    }

    /**
     * Find the partition whose keyspace slice holds a value of the partitioning function.
     *
     * @param keyspaceValue the output of the partitioning function
     * @return the partition covering the value
     * @throws HyperchunkArgumentException if no partition covers the value
     */
    @Nonnull
    public Partition findPartition(int keyspaceValue) {
        for (Partition partition : partitions) {
            if (partition.containsKeyspaceValue(keyspaceValue)) {
                return partition;
            }
        }
        throw new HyperchunkArgumentException("no partition covers keyspace value",
                LogMessageKeys.EPOCH_ID, id,
                LogMessageKeys.KEYSPACE_VALUE, keyspaceValue);
    }

    @Override
    public String toString() {
        return "PartitionEpoch{" + id + ", hypertable=" + hypertableId + ", " + timeRange
                + ", partitions=" + partitions.size() + "}";
    }
}
