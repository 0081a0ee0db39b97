/*
 * LogMessageKeys.java
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

package org.hyperchunk.logging;

import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by Hyperchunk.
 * All keys live here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // cache keys
    CACHE_NAME,
    CACHE_SIZE,
    INITIAL_CAPACITY,
    // catalog keys
    HYPERTABLE_ID,
    EPOCH_ID,
    PARTITION_ID,
    CHUNK_ID,
    OTHER_CHUNK_ID,
    TIME_POINT,
    START_TIME,
    END_TIME,
    OLD_START_TIME,
    OLD_END_TIME,
    CHUNK_TIME_INTERVAL,
    KEYSPACE_START,
    KEYSPACE_END,
    KEYSPACE_VALUE,
    NUM_PARTITIONS,
    LOCK_MODE,
    MATCH_COUNT,
    // statement keys
    TIME_COLUMN_TYPE,
    TIME_VALUE,
    SQL,
    PROPERTY,
    VALUE,
    ;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
