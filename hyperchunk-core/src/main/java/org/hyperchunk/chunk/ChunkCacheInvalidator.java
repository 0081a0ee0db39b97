/*
 * ChunkCacheInvalidator.java
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
import org.hyperchunk.catalog.ChunkMetadataListener;
import org.hyperchunk.logging.KeyValueLogMessage;
import org.hyperchunk.logging.LogMessageKeys;
import org.hyperchunk.timer.CacheTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Invalidates a whole {@link ChunkPlanCache} whenever chunk or partition metadata changes. When given a
 * {@link CacheTimer}, the invalidation message also carries the timer's counts so far.
 */
@API(API.Status.EXPERIMENTAL)
public class ChunkCacheInvalidator implements ChunkMetadataListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkCacheInvalidator.class);

    @Nonnull
    private final ChunkPlanCache planCache;
    @Nullable
    private final CacheTimer timer;

    public ChunkCacheInvalidator(@Nonnull ChunkPlanCache planCache) {
        this(planCache, null);
    }

    public ChunkCacheInvalidator(@Nonnull ChunkPlanCache planCache, @Nullable CacheTimer timer) {
        this.planCache = planCache;
        this.timer = timer;
    }

    @Override
    public void onChunkMetadataChanged() {
        if (LOGGER.isInfoEnabled()) {
            final KeyValueLogMessage message = KeyValueLogMessage.build("invalidating chunk insert plan cache",
                    LogMessageKeys.CACHE_NAME, planCache.getName(),
                    LogMessageKeys.CACHE_SIZE, planCache.size());
            if (timer != null) {
                message.addKeysAndValues(timer.getKeysAndValues());
            }
            LOGGER.info(message.toString());
        }
        planCache.invalidate();
    }
}
