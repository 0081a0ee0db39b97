/*
 * Hypertable.java
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

import com.google.common.base.Preconditions;
import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The catalog description of a hypertable: the table rows are written to, partitioned by time into chunks.
 */
@API(API.Status.UNSTABLE)
public class Hypertable {
    /**
     * Chunk time interval meaning that new chunks are not bounded in time.
     */
    public static final long UNBOUNDED_CHUNK_INTERVAL = 0L;

    private final int id;
    @Nonnull
    private final QualifiedTableName tableName;
    @Nonnull
    private final String timeColumnName;
    @Nonnull
    private final TimeColumnType timeColumnType;
    private final long chunkTimeInterval;

    private Hypertable(int id, @Nonnull QualifiedTableName tableName, @Nonnull String timeColumnName,
                       @Nonnull TimeColumnType timeColumnType, long chunkTimeInterval) {
        this.id = id;
        this.tableName = tableName;
        this.timeColumnName = timeColumnName;
        this.timeColumnType = timeColumnType;
        this.chunkTimeInterval = chunkTimeInterval;
    }

    public int getId() {
        return id;
    }

    @Nonnull
    public QualifiedTableName getTableName() {
        return tableName;
    }

    @Nonnull
    public String getTimeColumnName() {
        return timeColumnName;
    }

    @Nonnull
    public TimeColumnType getTimeColumnType() {
        return timeColumnType;
    }

    /**
     * Get the width, in internal time units, of newly created chunks.
     * @return the chunk time interval, or {@link #UNBOUNDED_CHUNK_INTERVAL}
     */
    public long getChunkTimeInterval() {
        return chunkTimeInterval;
    }

    /**
     * Get the name of the staging table rows are copied into before being moved to their chunks.
     * @return the unqualified copy table name
     */
    @Nonnull
    public String getCopyTableName() {
        return "_copy_temp_" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Hypertable that = (Hypertable)o;
        return id == that.id
                && chunkTimeInterval == that.chunkTimeInterval
                && tableName.equals(that.tableName)
                && timeColumnName.equals(that.timeColumnName)
                && timeColumnType == that.timeColumnType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tableName, timeColumnName, timeColumnType, chunkTimeInterval);
    }

    @Override
    public String toString() {
        return "Hypertable{" + id + ":" + tableName + ", time=" + timeColumnName + " " + timeColumnType + "}";
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * A builder for {@link Hypertable}.
     */
    public static class Builder {
        private int id;
        @Nullable
        private QualifiedTableName tableName;
        @Nullable
        private String timeColumnName;
        @Nonnull
        private TimeColumnType timeColumnType = TimeColumnType.TIMESTAMPTZ;
        private long chunkTimeInterval = UNBOUNDED_CHUNK_INTERVAL;

        private Builder() {
        }

        @Nonnull
        public Builder setId(int id) {
            this.id = id;
            return this;
        }

        @Nonnull
        public Builder setTableName(@Nonnull QualifiedTableName tableName) {
            this.tableName = tableName;
            return this;
        }

        @Nonnull
        public Builder setTimeColumnName(@Nonnull String timeColumnName) {
            this.timeColumnName = timeColumnName;
            return this;
        }

        @Nonnull
        public Builder setTimeColumnType(@Nonnull TimeColumnType timeColumnType) {
            this.timeColumnType = timeColumnType;
            return this;
        }

        @Nonnull
        public Builder setChunkTimeInterval(long chunkTimeInterval) {
            this.chunkTimeInterval = chunkTimeInterval;
            return this;
        }

        @Nonnull
        public Hypertable build() {
            Preconditions.checkState(tableName != null, "table name must be set");
            Preconditions.checkState(timeColumnName != null, "time column name must be set");
            Preconditions.checkState(chunkTimeInterval >= 0, "chunk time interval must not be negative");
            return new Hypertable(id, tableName, timeColumnName, timeColumnType, chunkTimeInterval);
        }
    }
}
