/*
 * TimeColumnType.java
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
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * The SQL type of a hypertable's time column, and how internal time values are written as literals of that type.
 *
 * <p>
 * Internal time is a {@code long}. For the integer types it is the column value itself. For the date and time
 * types it is the number of microseconds since the Unix epoch, in UTC.
 * </p>
 */
@API(API.Status.UNSTABLE)
public enum TimeColumnType {
    SMALLINT(Short.MIN_VALUE, Short.MAX_VALUE),
    INTEGER(Integer.MIN_VALUE, Integer.MAX_VALUE),
    BIGINT(Long.MIN_VALUE, Long.MAX_VALUE),
    TIMESTAMP(Long.MIN_VALUE, Long.MAX_VALUE),
    TIMESTAMPTZ(Long.MIN_VALUE, Long.MAX_VALUE),
    DATE(Long.MIN_VALUE, Long.MAX_VALUE),
    ;

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withZone(ZoneOffset.UTC);

    private final long minValue;
    private final long maxValue;

    TimeColumnType(long minValue, long maxValue) {
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /**
     * Get the smallest internal time value a column of this type can hold.
     * @return the minimum internal time value
     */
    public long getMinValue() {
        return minValue;
    }

    /**
     * Get the largest internal time value a column of this type can hold.
     * @return the maximum internal time value
     */
    public long getMaxValue() {
        return maxValue;
    }

    /**
     * Render an internal time value as a SQL literal of this type.
     *
     * @param internalTime the internal time value
     * @return a literal that can be compared with the time column
     * @throws HyperchunkArgumentException if the value cannot be represented in this type
     */
    @Nonnull
    public String toLiteralSql(long internalTime) {
        if (internalTime < minValue || internalTime > maxValue) {
            throw outOfRange(internalTime, null);
        }
        switch (this) {
            case SMALLINT:
            case INTEGER:
            case BIGINT:
                return Long.toString(internalTime);
            case TIMESTAMP:
                return "'" + TIMESTAMP_FORMAT.format(toInstant(internalTime)) + "'::TIMESTAMP";
            case TIMESTAMPTZ:
                return "'" + TIMESTAMP_FORMAT.format(toInstant(internalTime)) + "+00'::TIMESTAMPTZ";
            case DATE:
                return "'" + DATE_FORMAT.format(toInstant(internalTime)) + "'::DATE";
            default:
                throw new HyperchunkArgumentException("unknown time column type",
                        LogMessageKeys.TIME_COLUMN_TYPE, this);
        }
    }

    @Nonnull
    private Instant toInstant(long micros) {
        try {
            return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
        } catch (DateTimeException | ArithmeticException e) {
            throw outOfRange(micros, e);
        }
    }

    @Nonnull
    private HyperchunkArgumentException outOfRange(long internalTime, Throwable cause) {
        final HyperchunkArgumentException ex = cause == null
                ? new HyperchunkArgumentException("time value out of range for time column type")
                : new HyperchunkArgumentException("time value out of range for time column type", cause);
        ex.addLogInfo(LogMessageKeys.TIME_COLUMN_TYPE.toString(), this);
        ex.addLogInfo(LogMessageKeys.TIME_VALUE.toString(), internalTime);
        return ex;
    }
}
