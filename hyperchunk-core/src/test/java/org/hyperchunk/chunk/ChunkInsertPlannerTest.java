/*
 * ChunkInsertPlannerTest.java
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

import com.google.common.collect.ImmutableList;
import org.hyperchunk.catalog.InMemoryChunkCatalog;
import org.hyperchunk.metadata.ChunkRow;
import org.hyperchunk.metadata.Hypertable;
import org.hyperchunk.metadata.TimeColumnType;
import org.hyperchunk.metadata.TimeRange;
import org.hyperchunk.plan.CompiledPlan;
import org.hyperchunk.plan.RecordingStatementCompiler;
import org.hyperchunk.timer.CacheTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.hyperchunk.chunk.ChunkFixtures.EPOCH;
import static org.hyperchunk.chunk.ChunkFixtures.HIGH_PARTITION;
import static org.hyperchunk.chunk.ChunkFixtures.HYPERTABLE;
import static org.hyperchunk.chunk.ChunkFixtures.PARTITION;
import static org.hyperchunk.chunk.ChunkFixtures.SPLIT_EPOCH;
import static org.hyperchunk.chunk.ChunkFixtures.T1;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkInsertPlannerTest {
    private InMemoryChunkCatalog catalog;
    private RecordingStatementCompiler compiler;
    private CacheTimer timer;
    private ChunkInsertPlanner planner;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryChunkCatalog();
        compiler = new RecordingStatementCompiler();
        timer = new CacheTimer();
        planner = new ChunkInsertPlanner(catalog, catalog, compiler,
                ChunkCacheProperties.newBuilder().setLockRows(true).build(), timer);
        catalog.addListener(planner.getInvalidator());
    }

    @AfterEach
    void tearDown() {
        planner.close();
        assertThat("every plan is released at shutdown", compiler.getOpenPlans(), empty());
    }

    @Test
    void movesRowsOfChunkWithChangedBounds() {
        ChunkRow a = catalog.insertChunk(PARTITION.getId(), TimeRange.of(1000, 2000));
        catalog.addReplicaTable(a.getId(), T1);

        ChunkCacheEntry first = planner.getChunkCacheEntry(HYPERTABLE, EPOCH, PARTITION, 1500L, false);
        assertThat(first.getChunk(), is(a));
        String sql = first.getPlan().getStatementText();
        assertThat(sql, containsString("DELETE FROM ONLY _copy_temp_1 WHERE TRUE"
                + " AND (\"time\" >= 1000) AND (\"time\" <= 2000) RETURNING *"));
        assertThat(sql, containsString("INSERT INTO public.t1 SELECT * FROM selected"));

        catalog.updateChunkRange(a.getId(), TimeRange.of(1000, 3000));
        ChunkCacheEntry second = planner.getChunkCacheEntry(HYPERTABLE, EPOCH, PARTITION, 1500L, false);

        assertThat(second.getChunk().getRange(), is(TimeRange.of(1000, 3000)));
        assertThat(second.getPlan().getStatementText(), containsString("(\"time\" <= 3000)"));
        assertTrue(((RecordingStatementCompiler.RecordingPlan)first.getPlan()).isReleased());
    }

    @Test
    void repeatedInsertsReuseThePlan() {
        ChunkRow a = catalog.insertChunk(PARTITION.getId(), TimeRange.of(0, 999));
        catalog.addReplicaTable(a.getId(), T1);

        CompiledPlan plan = planner.getChunkCacheEntry(HYPERTABLE, EPOCH, PARTITION, 1L).getPlan();
        for (long t = 2; t < 10; t++) {
            assertThat(planner.getChunkCacheEntry(HYPERTABLE, EPOCH, PARTITION, t).getPlan(), sameInstance(plan));
        }
        assertThat(compiler.getPreparedCount(), is(1));
        assertThat("configured row locking is used", catalog.getSharedRowLockCount(), is(9L));
    }

    @Test
    void differentChunksGetDifferentPlans() {
        ChunkRow a = catalog.insertChunk(PARTITION.getId(), TimeRange.of(0, 999));
        ChunkRow b = catalog.insertChunk(PARTITION.getId(), TimeRange.of(1000, 1999));
        catalog.addReplicaTable(a.getId(), T1);
        catalog.addReplicaTable(b.getId(), T1);

        CompiledPlan planA = planner.getChunkCacheEntry(HYPERTABLE, EPOCH, PARTITION, 10L, false).getPlan();
        CompiledPlan planB = planner.getChunkCacheEntry(HYPERTABLE, EPOCH, PARTITION, 1010L, false).getPlan();
        assertThat(planB, not(sameInstance(planA)));
        assertThat(planner.getPlanCache().size(), is(2));
    }

    @Test
    void splitEpochAddsKeyspacePredicate() {
        ChunkRow a = catalog.insertChunk(HIGH_PARTITION.getId(), TimeRange.of(0, 999));
        catalog.addReplicaTable(a.getId(), T1);

        String sql = planner.getChunkCacheEntry(HYPERTABLE, SPLIT_EPOCH, HIGH_PARTITION, 5L, false)
                .getPlan().getStatementText();
        assertThat(sql, containsString("WHERE TRUE AND (_timescaledb_catalog.get_partition_for_key(device_id::TEXT, 32768)"
                + " BETWEEN 16384 AND 32767) AND (\"time\" >= 0) AND (\"time\" <= 999)"));
    }

    @Test
    void metadataChangeReleasesAllPlans() {
        ChunkRow a = catalog.insertChunk(PARTITION.getId(), TimeRange.of(0, 999));
        catalog.addReplicaTable(a.getId(), T1);
        planner.getChunkCacheEntry(HYPERTABLE, EPOCH, PARTITION, 10L, false);

        catalog.updateChunkRange(a.getId(), TimeRange.of(0, 1999));

        assertThat(compiler.getOpenPlans(), empty());
        assertThat(planner.getPlanCache().size(), is(0));
        assertThat(timer.getCount(CacheTimer.Counts.PLAN_CACHE_INVALIDATE), is(2));
    }

    @Test
    void newChunkNearTopOfIntegerColumnIsUsable() {
        Hypertable narrow = Hypertable.newBuilder()
                .setId(2)
                .setTableName(HYPERTABLE.getTableName())
                .setTimeColumnName("time")
                .setTimeColumnType(TimeColumnType.INTEGER)
                .setChunkTimeInterval(1000L)
                .build();
        try (ChunkInsertPlanner everyChunkInT1 = new ChunkInsertPlanner(catalog, chunkId -> ImmutableList.of(T1),
                compiler)) {
            ChunkCacheEntry entry = everyChunkInT1.getChunkCacheEntry(narrow, EPOCH, PARTITION,
                    Integer.MAX_VALUE - 10, false);

            assertThat(entry.getChunk().getRange(), is(TimeRange.openEnd(2147483000L)));
            String sql = entry.getPlan().getStatementText();
            assertThat(sql, containsString("(\"time\" >= 2147483000) RETURNING *"));
            assertThat("the top of the type falls in the same chunk",
                    everyChunkInT1.getChunkCacheEntry(narrow, EPOCH, PARTITION, Integer.MAX_VALUE, false).getChunk(),
                    is(entry.getChunk()));
        }
    }
}
