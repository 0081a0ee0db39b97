/*
 * ChunkCacheProperties.java
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

import org.hyperchunk.HyperchunkArgumentException;
import org.hyperchunk.annotation.API;
import org.hyperchunk.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings for the {@link ChunkPlanCache} and the {@link ChunkInsertPlanner} built around it.
 * <ul>
 * <li>the cache name, used in log messages</li>
 * <li>the initial capacity of the cache table</li>
 * <li>whether chunk lookups lock the rows they find when the caller does not say</li>
 * </ul>
 */
@API(API.Status.UNSTABLE)
public class ChunkCacheProperties {
    public static final String PROPERTY_PREFIX = "org.hyperchunk.chunk_cache.";
    public static final String NAME_PROPERTY = PROPERTY_PREFIX + "name";
    public static final String INITIAL_CAPACITY_PROPERTY = PROPERTY_PREFIX + "initial_capacity";
    public static final String LOCK_ROWS_PROPERTY = PROPERTY_PREFIX + "lock_rows";

    public static final String DEFAULT_NAME = "chunk_insert_plan_cache";
    public static final int DEFAULT_INITIAL_CAPACITY = 16;

    /**
     * The default settings.
     */
    public static final ChunkCacheProperties DEFAULT = newBuilder().build();

    @Nonnull
    private final String name;
    private final int initialCapacity;
    private final boolean lockRows;

    private ChunkCacheProperties(@Nonnull String name, int initialCapacity, boolean lockRows) {
        this.name = name;
        this.initialCapacity = initialCapacity;
        this.lockRows = lockRows;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public boolean isLockRows() {
        return lockRows;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Read settings from properties, using the defaults for any that are absent.
     *
     * @param properties properties with keys starting with {@value #PROPERTY_PREFIX}
     * @return the settings
     * @throws HyperchunkArgumentException if a property has an invalid value
     */
    @Nonnull
    public static ChunkCacheProperties fromProperties(@Nonnull Properties properties) {
        final Builder builder = newBuilder();
        final String name = properties.getProperty(NAME_PROPERTY);
        if (name != null) {
            builder.setName(name.trim());
        }
        final String initialCapacity = properties.getProperty(INITIAL_CAPACITY_PROPERTY);
        if (initialCapacity != null) {
            try {
                builder.setInitialCapacity(Integer.parseInt(initialCapacity.trim()));
            } catch (NumberFormatException e) {
                throw invalidProperty(INITIAL_CAPACITY_PROPERTY, initialCapacity, e);
            }
        }
        final String lockRows = properties.getProperty(LOCK_ROWS_PROPERTY);
        if (lockRows != null) {
            final String value = lockRows.trim().toLowerCase(Locale.ROOT);
            if (!value.equals("true") && !value.equals("false")) {
                throw invalidProperty(LOCK_ROWS_PROPERTY, lockRows, null);
            }
            builder.setLockRows(Boolean.parseBoolean(value));
        }
        return builder.build();
    }

    @Nonnull
    private static HyperchunkArgumentException invalidProperty(@Nonnull String property, @Nonnull String value,
                                                               @Nullable Throwable cause) {
        final HyperchunkArgumentException ex = cause == null
                ? new HyperchunkArgumentException("invalid chunk cache property")
                : new HyperchunkArgumentException("invalid chunk cache property", cause);
        ex.addLogInfo(LogMessageKeys.PROPERTY.toString(), property);
        ex.addLogInfo(LogMessageKeys.VALUE.toString(), value);
        return ex;
    }

    @Override
    public String toString() {
        return "ChunkCacheProperties{name=" + name + ", initialCapacity=" + initialCapacity + ", lockRows=" + lockRows + "}";
    }

    /**
     * A builder for {@link ChunkCacheProperties}.
     */
    public static class Builder {
        @Nonnull
        private String name = DEFAULT_NAME;
        private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
        private boolean lockRows = false;

        private Builder() {
        }

        private Builder(@Nonnull ChunkCacheProperties properties) {
            this.name = properties.name;
            this.initialCapacity = properties.initialCapacity;
            this.lockRows = properties.lockRows;
        }

        @Nonnull
        public Builder setName(@Nonnull String name) {
            this.name = name;
            return this;
        }

        @Nonnull
        public Builder setInitialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        @Nonnull
        public Builder setLockRows(boolean lockRows) {
            this.lockRows = lockRows;
            return this;
        }

        @Nonnull
        public ChunkCacheProperties build() {
            if (name.isEmpty()) {
                throw new HyperchunkArgumentException("chunk cache name must not be empty");
            }
            if (initialCapacity < 0) {
                throw new HyperchunkArgumentException("chunk cache initial capacity must not be negative",
                        LogMessageKeys.INITIAL_CAPACITY, initialCapacity);
            }
            return new ChunkCacheProperties(name, initialCapacity, lockRows);
        }
    }
}
