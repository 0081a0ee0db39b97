/*
 * ChunkCacheInvalidatorTest.java
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

import org.hyperchunk.catalog.InMemoryChunkCatalog;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.metadata.TimeRange;
import org.hyperchunk.plan.RecordingStatementCompiler;
import org.hyperchunk.timer.CacheTimer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hyperchunk.TestHelpers.assertLogs;
import static org.hyperchunk.chunk.ChunkFixtures.EPOCH;
import static org.hyperchunk.chunk.ChunkFixtures.HYPERTABLE;
import static org.hyperchunk.chunk.ChunkFixtures.PARTITION;
import static org.hyperchunk.chunk.ChunkFixtures.T1;
import static org.hyperchunk.chunk.ChunkFixtures.T2;

class ChunkCacheInvalidatorTest {
    private InMemoryChunkCatalog catalog;
    private RecordingStatementCompiler compiler;
    private ChunkPlanCache cache;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryChunkCatalog();
        compiler = new RecordingStatementCompiler();
        cache = new ChunkPlanCache(compiler, catalog);
        catalog.addListener(new ChunkCacheInvalidator(cache));
    }

    private ChunkRow cachedChunk(long start, long end) {
        ChunkRow row = catalog.insertChunk(PARTITION.getId(), TimeRange.of(start, end));
        catalog.addReplicaTable(row.getId(), T1);
        cache.fetch(ChunkCacheQuery.forChunk(HYPERTABLE, EPOCH, PARTITION, row));
        return row;
    }

    @Test
    void rangeChangeInvalidatesWholeCache() {
        ChunkRow a = cachedChunk(0, 999);
        cachedChunk(1000, 1999);
        assertThat(cache.size(), is(2));

        catalog.updateChunkRange(a.getId(), TimeRange.of(0, 499));

        assertThat(cache.size(), is(0));
        assertThat(compiler.getOpenPlans(), empty());
    }

    @Test
    void replicaChangeInvalidates() {
        ChunkRow a = cachedChunk(0, 999);
        catalog.addReplicaTable(a.getId(), T2);
        assertThat(cache.size(), is(0));

        String sql = cache.fetch(ChunkCacheQuery.forChunk(HYPERTABLE, EPOCH, PARTITION, a)).getPlan().getStatementText();
        assertThat("rebuilt plan sees the new replica", sql.contains("INSERT INTO public.t2"), is(true));
    }

    @Test
    void chunkDeletionInvalidates() {
        ChunkRow a = cachedChunk(0, 999);
        catalog.deleteChunk(a.getId());
        assertThat(cache.size(), is(0));
        assertThat(compiler.getOpenPlans(), empty());
    }

    @Test
    void chunkCreationDoesNotInvalidate() {
        cachedChunk(0, 999);
        catalog.insertChunk(PARTITION.getId(), TimeRange.of(1000, 1999));
        assertThat(cache.size(), is(1));
    }

    @Test
    void invalidationIsLogged() {
        cachedChunk(0, 999);
        assertLogs(ChunkCacheInvalidator.class, "invalidating chunk insert plan cache", () -> {
            new ChunkCacheInvalidator(cache).onChunkMetadataChanged();
            return null;
        });
    }

    @Test
    void invalidationLogsTimerCounts() {
        CacheTimer timer = new CacheTimer();
        ChunkPlanCache timed = new ChunkPlanCache(compiler, catalog, ChunkCacheProperties.DEFAULT, timer);
        ChunkRow a = catalog.insertChunk(PARTITION.getId(), TimeRange.of(0, 999));
        catalog.addReplicaTable(a.getId(), T1);
        ChunkCacheQuery query = ChunkCacheQuery.forChunk(HYPERTABLE, EPOCH, PARTITION, a);
        timed.fetch(query);
        timed.fetch(query);

        assertLogs(ChunkCacheInvalidator.class,
                Pattern.compile("invalidating chunk insert plan cache .*plan_cache_hit_count=\"1\".*"), () -> {
                    new ChunkCacheInvalidator(timed, timer).onChunkMetadataChanged();
                    return null;
                });
        assertThat(timed.size(), is(0));
    }
}
