/*
 * TimeRange.java
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

import org.hyperchunk.HyperchunkArgumentException;
import org.hyperchunk.annotation.API;
import org.hyperchunk.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * An inclusive range of internal time values, either end of which may be open.
 *
 * <p>
 * Open ends are stored as the sentinels {@link #OPEN_START_TIME} and {@link #OPEN_END_TIME}, which never denote a
 * real boundary. The catalog stores them as {@code NULL}; see {@link #fromNullable(Long, Long)}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class TimeRange {
    public static final long OPEN_START_TIME = Long.MIN_VALUE;
    public static final long OPEN_END_TIME = Long.MAX_VALUE;

    /**
     * The range that is open at both ends.
     */
    public static final TimeRange ALL = new TimeRange(OPEN_START_TIME, OPEN_END_TIME);

    private final long startTime;
    private final long endTime;

    private TimeRange(long startTime, long endTime) {
        if (startTime > endTime) {
            throw new HyperchunkArgumentException("time range start is after its end",
                    LogMessageKeys.START_TIME, startTime,
                    LogMessageKeys.END_TIME, endTime);
        }
        this.startTime = startTime;
        this.endTime = endTime;
    }

    @Nonnull
    public static TimeRange of(long startTime, long endTime) {
        if (startTime == OPEN_START_TIME && endTime == OPEN_END_TIME) {
            return ALL;
        }
        return new TimeRange(startTime, endTime);
    }

    @Nonnull
    public static TimeRange openStart(long endTime) {
        return of(OPEN_START_TIME, endTime);
    }

    @Nonnull
    public static TimeRange openEnd(long startTime) {
        return of(startTime, OPEN_END_TIME);
    }

    /**
     * Build a range from nullable catalog columns, where {@code null} means open.
     *
     * @param startTime the start column
     * @param endTime the end column
     * @return the corresponding range
     */
    @Nonnull
    public static TimeRange fromNullable(@Nullable Long startTime, @Nullable Long endTime) {
        return of(startTime == null ? OPEN_START_TIME : startTime, endTime == null ? OPEN_END_TIME : endTime);
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public boolean isOpenStart() {
        return startTime == OPEN_START_TIME;
    }

    public boolean isOpenEnd() {
        return endTime == OPEN_END_TIME;
    }

    @Nullable
    public Long getNullableStartTime() {
        return isOpenStart() ? null : startTime;
    }

    @Nullable
    public Long getNullableEndTime() {
        return isOpenEnd() ? null : endTime;
    }

    /**
     * Whether a time point lies in this range. An open end matches everything on its side.
     *
     * @param timePoint the time point to test
     * @return whether the time point is covered
     */
    public boolean contains(long timePoint) {
        return (isOpenStart() || timePoint >= startTime)
                && (isOpenEnd() || timePoint <= endTime);
    }

    public boolean overlaps(@Nonnull TimeRange other) {
        return startTime <= other.endTime && other.startTime <= endTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TimeRange timeRange = (TimeRange)o;
        return startTime == timeRange.startTime && endTime == timeRange.endTime;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, endTime);
    }

    @Override
    public String toString() {
        return "[" + (isOpenStart() ? "-inf" : Long.toString(startTime))
                + ", " + (isOpenEnd() ? "+inf" : Long.toString(endTime)) + "]";
    }
}
