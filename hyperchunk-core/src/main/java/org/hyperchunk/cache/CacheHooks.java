/*
 * CacheHooks.java
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

package org.hyperchunk.cache;

import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;

/**
 * The operations a {@link KeyedCache} delegates to its specialization.
 *
 * <p>
 * The cache itself only knows how to look up and store entries. Everything that depends on what an entry is
 * (how its key is derived from a query, how it is built, when it is stale, and which resources it owns) is
 * supplied through this interface. Exceptions thrown by {@link #createEntry} or {@link #updateEntry} propagate
 * out of {@link KeyedCache#fetch(Object)} and leave the cache as it was.
 * </p>
 *
 * @param <Q> the type of the query context passed to {@link KeyedCache#fetch(Object)}
 * @param <K> the type of the cache key
 * @param <E> the type of the cache entries
 */
@API(API.Status.EXPERIMENTAL)
public interface CacheHooks<Q, K, E> {
    /**
     * Extract the cache key from a query.
     *
     * @param query the query being answered
     * @return the key under which the entry for this query is stored
     */
    @Nonnull
    K keyOf(@Nonnull Q query);

    /**
     * Build a new entry for a query whose key is not in the cache.
     *
     * @param query the query being answered
     * @return a fully built entry
     */
    @Nonnull
    E createEntry(@Nonnull Q query);

    /**
     * Bring an existing entry up to date with a query. An implementation may return the entry unchanged, modify
     * it in place, or return a replacement. It must not leave the entry half modified if it throws.
     *
     * @param entry the entry currently stored under the query's key
     * @param query the query being answered
     * @return the entry to return to the caller and keep in the cache
     */
    @Nonnull
    E updateEntry(@Nonnull E entry, @Nonnull Q query);

    /**
     * Release whatever resources the live entries own. Called at the start of {@link KeyedCache#invalidate()},
     * while every entry is still in the table. Implementations that release per entry should do so through
     * {@link KeyedCache#removeEach(java.util.function.Consumer)}, so that a release failure never leaves an
     * already released entry in the table.
     *
     * @param cache the cache being invalidated
     */
    default void preInvalidate(@Nonnull KeyedCache<Q, K, E> cache) {
    }

    /**
     * Called once the table has been cleared. The default makes the cache ready for use again.
     *
     * @param cache the cache that was invalidated
     */
    default void postInvalidate(@Nonnull KeyedCache<Q, K, E> cache) {
        cache.init();
    }
}
