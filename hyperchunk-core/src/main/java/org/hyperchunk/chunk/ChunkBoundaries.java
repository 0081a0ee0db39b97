/*
 * ChunkBoundaries.java
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

import com.google.common.base.Verify;
import org.hyperchunk.annotation.API;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.metadata.TimeColumnType;
import org.hyperchunk.metadata.TimeRange;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Computes the range of a new chunk.
 *
 * <p>
 * A new chunk covering time point {@code t} is aligned to the hypertable's chunk time interval {@code i}: it
 * starts at the largest multiple of {@code i} not after {@code t} and ends {@code i - 1} later. The range is
 * then shrunk so that it does not overlap any existing chunk of the partition. A non-positive interval gives an
 * unbounded range before shrinking. Bounds that would overflow, or that fall outside what the time column's type
 * can hold, become open.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class ChunkBoundaries {

    private ChunkBoundaries() {
    }

    /**
     * Compute the range of a new chunk covering a time point.
     *
     * @param timePoint the time the chunk must cover
     * @param chunkTimeInterval the hypertable's chunk time interval
     * @param timeColumnType the type of the hypertable's time column
     * @param existing the chunks already in the partition, none of which may cover {@code timePoint}
     * @return a range containing {@code timePoint} that overlaps none of {@code existing}
     */
    @Nonnull
    public static TimeRange calculate(long timePoint, long chunkTimeInterval, @Nonnull TimeColumnType timeColumnType,
                                      @Nonnull List<ChunkRow> existing) {
        long start = TimeRange.OPEN_START_TIME;
        long end = TimeRange.OPEN_END_TIME;
        if (chunkTimeInterval > 0) {
            final long offset = Math.floorMod(timePoint, chunkTimeInterval);
            final long remaining = chunkTimeInterval - 1 - offset;
            if (timePoint >= TimeRange.OPEN_START_TIME + offset && timePoint - offset >= timeColumnType.getMinValue()) {
                start = timePoint - offset;
            }
            if (timePoint <= TimeRange.OPEN_END_TIME - remaining && timePoint + remaining <= timeColumnType.getMaxValue()) {
                end = timePoint + remaining;
            }
        }
        for (ChunkRow row : existing) {
            final TimeRange other = row.getRange();
            Verify.verify(!other.contains(timePoint), "chunk %s already covers %s", row.getId(), timePoint);
            if (other.getEndTime() < timePoint) {
                start = Math.max(start, other.getEndTime() + 1);
            } else if (other.getStartTime() > timePoint) {
                end = Math.min(end, other.getStartTime() - 1);
            }
        }
        return TimeRange.of(start, end);
    }
}
