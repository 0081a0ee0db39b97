/*
 * ChunkPlanCache.java
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
import org.hyperchunk.cache.CacheHooks;
import org.hyperchunk.cache.KeyedCache;
import org.hyperchunk.catalog.ChunkReplicaResolver;
import org.hyperchunk.logging.KeyValueLogMessage;
import org.hyperchunk.logging.LogMessageKeys;
import org.hyperchunk.metadata.QualifiedTableName;
import org.hyperchunk.metadata.TimeRange;
import org.hyperchunk.plan.CompiledPlan;
import org.hyperchunk.plan.MoveStatementBuilder;
import org.hyperchunk.plan.PlanCompilationException;
import org.hyperchunk.plan.StatementCompiler;
import org.hyperchunk.timer.CacheTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A cache of compiled move plans, one per chunk.
 *
 * <p>
 * The move statement of a chunk embeds the chunk's time range as literals, so a cached plan is only valid while
 * the chunk keeps that range. Every {@link #fetch(ChunkCacheQuery)} passes the chunk's current range; if it
 * differs from the range the plan was built for, the plan is rebuilt and the entry updated in place. The new
 * plan is compiled before the old one is released, so a compilation failure leaves the previous entry usable.
 * </p>
 *
 * <p>
 * Changes to other metadata (replica tables, partitions) are not detected here. They are handled by
 * invalidating the whole cache, see {@link ChunkCacheInvalidator}. Invalidation releases every cached plan.
 * </p>
 *
 * <p>
 * Plans returned by {@link #fetch(ChunkCacheQuery)} remain owned by the cache and must not be closed by the
 * caller. Like {@link KeyedCache}, this class is not thread-safe.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class ChunkPlanCache implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanCache.class);

    // Move statements bind every value as a literal.
    private static final int MOVE_STATEMENT_PARAMETER_COUNT = 0;

    @Nonnull
    private final StatementCompiler compiler;
    @Nonnull
    private final ChunkReplicaResolver replicaResolver;
    @Nullable
    private final CacheTimer timer;
    @Nonnull
    private final KeyedCache<ChunkCacheQuery, Integer, ChunkPlanCacheEntry> cache;

    public ChunkPlanCache(@Nonnull StatementCompiler compiler, @Nonnull ChunkReplicaResolver replicaResolver) {
        this(compiler, replicaResolver, ChunkCacheProperties.DEFAULT, null);
    }

    public ChunkPlanCache(@Nonnull StatementCompiler compiler, @Nonnull ChunkReplicaResolver replicaResolver,
                          @Nonnull ChunkCacheProperties properties, @Nullable CacheTimer timer) {
        this.compiler = compiler;
        this.replicaResolver = replicaResolver;
        this.timer = timer;
        this.cache = new KeyedCache<>(properties.getName(), properties.getInitialCapacity(), new Hooks());
    }

    /**
     * Get the entry holding a plan valid for the chunk's current range, compiling one if needed.
     *
     * @param query the chunk and its current range
     * @return the cache's entry for the chunk
     * @throws org.hyperchunk.plan.PlanCompilationException if the move statement cannot be compiled
     * @throws org.hyperchunk.HyperchunkArgumentException if the chunk has no replica tables
     * @throws org.hyperchunk.HyperchunkException if the cache has been closed
     */
    @Nonnull
    public ChunkPlanCacheEntry fetch(@Nonnull ChunkCacheQuery query) {
        return cache.fetch(query);
    }

    /**
     * Release every cached plan and empty the cache. The cache can be used again afterwards.
     */
    public void invalidate() {
        if (timer != null) {
            timer.increment(CacheTimer.Counts.PLAN_CACHE_INVALIDATE);
        }
        cache.invalidate();
    }

    public int size() {
        return cache.size();
    }

    public boolean contains(int chunkId) {
        return cache.contains(chunkId);
    }

    @Nonnull
    public String getName() {
        return cache.getName();
    }

    /**
     * Release every cached plan. The cache cannot be used afterwards.
     */
    @Override
    public void close() {
        cache.close();
    }

    @Nonnull
    private CompiledPlan compile(@Nonnull ChunkCacheQuery query) {
        final List<QualifiedTableName> replicaTables = replicaResolver.getReplicaTables(query.getChunkId());
        final String sql = MoveStatementBuilder.buildMoveStatement(query.getHypertable(), query.getEpoch(),
                query.getPartition(), query.getRange(), replicaTables);
        try {
            if (timer == null) {
                return compiler.prepare(sql, MOVE_STATEMENT_PARAMETER_COUNT);
            }
            return timer.time(CacheTimer.Events.PLAN_COMPILE, () -> compiler.prepare(sql, MOVE_STATEMENT_PARAMETER_COUNT));
        } catch (PlanCompilationException e) {
            e.addLogInfo(LogMessageKeys.CACHE_NAME.toString(), cache.getName());
            e.addLogInfo(LogMessageKeys.CHUNK_ID.toString(), query.getChunkId());
            e.addLogInfo(LogMessageKeys.SQL.toString(), sql);
            throw e;
        }
    }

    private void release(@Nonnull CompiledPlan plan) {
        plan.close();
        if (timer != null) {
            timer.increment(CacheTimer.Counts.PLAN_RELEASED);
        }
    }

    private void count(@Nonnull CacheTimer.Count event) {
        if (timer != null) {
            timer.increment(event);
        }
    }

    private class Hooks implements CacheHooks<ChunkCacheQuery, Integer, ChunkPlanCacheEntry> {
        @Nonnull
        @Override
        public Integer keyOf(@Nonnull ChunkCacheQuery query) {
            return query.getChunkId();
        }

        @Nonnull
        @Override
        public ChunkPlanCacheEntry createEntry(@Nonnull ChunkCacheQuery query) {
            final CompiledPlan plan = compile(query);
            count(CacheTimer.Counts.PLAN_CACHE_MISS);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("compiled chunk move plan",
                        LogMessageKeys.CACHE_NAME, cache.getName(),
                        LogMessageKeys.CHUNK_ID, query.getChunkId(),
                        LogMessageKeys.START_TIME, query.getRange().getNullableStartTime(),
                        LogMessageKeys.END_TIME, query.getRange().getNullableEndTime()));
            }
            return new ChunkPlanCacheEntry(query.getChunkId(), query.getRange(), plan);
        }

        @Nonnull
        @Override
        public ChunkPlanCacheEntry updateEntry(@Nonnull ChunkPlanCacheEntry entry, @Nonnull ChunkCacheQuery query) {
            final TimeRange oldRange = entry.getRange();
            if (oldRange.equals(query.getRange())) {
                count(CacheTimer.Counts.PLAN_CACHE_HIT);
                return entry;
            }
            final CompiledPlan newPlan = compile(query);
            final CompiledPlan oldPlan = entry.getPlan();
            entry.replace(query.getRange(), newPlan);
            release(oldPlan);
            count(CacheTimer.Counts.PLAN_CACHE_REBUILD);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("rebuilt chunk move plan for changed range",
                        LogMessageKeys.CACHE_NAME, cache.getName(),
                        LogMessageKeys.CHUNK_ID, entry.getChunkId(),
                        LogMessageKeys.OLD_START_TIME, oldRange.getNullableStartTime(),
                        LogMessageKeys.OLD_END_TIME, oldRange.getNullableEndTime(),
                        LogMessageKeys.START_TIME, query.getRange().getNullableStartTime(),
                        LogMessageKeys.END_TIME, query.getRange().getNullableEndTime()));
            }
            return entry;
        }

        @Override
        public void preInvalidate(@Nonnull KeyedCache<ChunkCacheQuery, Integer, ChunkPlanCacheEntry> keyedCache) {
            // An entry leaves the table before its plan is closed, so a failed close is never retried.
            keyedCache.removeEach(entry -> release(entry.getPlan()));
        }
    }
}
