/*
 * KeyedCache.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import org.hyperchunk.HyperchunkException;
import org.hyperchunk.annotation.API;
import org.hyperchunk.logging.KeyValueLogMessage;
import org.hyperchunk.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A table of entries, keyed by a value derived from a query, whose entries are built, refreshed and released by
 * a set of {@link CacheHooks}.
 *
 * <p>
 * {@link #fetch(Object)} is the only way to read or write the table: it creates the entry for a query's key if
 * there is none and otherwise lets the hooks refresh the existing one. There is no per-entry eviction; entries
 * only leave the table all together through {@link #invalidate()}, which first lets the hooks release what the
 * entries own.
 * </p>
 *
 * <p>
 * The table is allocated when the cache is constructed and re-allocated after each invalidation by the
 * post-invalidate hook. {@link #close()} disarms that hook and invalidates one last time, after which the cache
 * cannot be used.
 * </p>
 *
 * <p>
 * This class is not thread-safe. Callers that share a cache between threads must serialize access to it.
 * </p>
 *
 * @param <Q> the type of the query context
 * @param <K> the type of the cache key
 * @param <E> the type of the cache entries
 */
@API(API.Status.EXPERIMENTAL)
public class KeyedCache<Q, K, E> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyedCache.class);

    @Nonnull
    private final String name;
    private final int initialCapacity;
    @Nonnull
    private final CacheHooks<Q, K, E> hooks;
    @Nullable
    private Map<K, E> table;
    private boolean postInvalidateArmed;

    public KeyedCache(@Nonnull String name, int initialCapacity, @Nonnull CacheHooks<Q, K, E> hooks) {
        Preconditions.checkArgument(initialCapacity >= 0, "initial capacity must not be negative");
        this.name = name;
        this.initialCapacity = initialCapacity;
        this.hooks = hooks;
        this.postInvalidateArmed = true;
        init();
    }

    /**
     * Allocate an empty table if there is none. Called on construction and, by default, after each invalidation.
     */
    public void init() {
        if (table == null) {
            table = Maps.newHashMapWithExpectedSize(initialCapacity);
        }
    }

    /**
     * Get the entry for a query, building or refreshing it as needed.
     *
     * @param query the query to answer
     * @return the entry stored under the query's key after any creation or update
     * @throws HyperchunkException if the cache is not initialized
     */
    @Nonnull
    public E fetch(@Nonnull Q query) {
        final Map<K, E> current = checkInitialized();
        final K key = hooks.keyOf(query);
        final E existing = current.get(key);
        if (existing == null) {
            final E created = hooks.createEntry(query);
            current.put(key, created);
            return created;
        }
        final E updated = hooks.updateEntry(existing, query);
        if (updated != existing) {
            current.put(key, updated);
        }
        return updated;
    }

    /**
     * Release every entry's resources, drop all entries, and run the post-invalidate hook. Does nothing if the
     * table has not been allocated. If the pre-invalidate hook fails, the failure propagates and the entries it
     * had not yet removed stay in the table.
     */
    public void invalidate() {
        if (table == null) {
            return;
        }
        final int size = table.size();
        hooks.preInvalidate(this);
        table.clear();
        table = null;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("invalidated keyed cache",
                    LogMessageKeys.CACHE_NAME, name,
                    LogMessageKeys.CACHE_SIZE, size));
        }
        if (postInvalidateArmed) {
            hooks.postInvalidate(this);
        }
    }

    /**
     * Invalidate the cache for the last time. The post-invalidate hook is not run, so the cache stays
     * uninitialized.
     */
    @Override
    public void close() {
        postInvalidateArmed = false;
        invalidate();
    }

    /**
     * Take the entries out of the table one at a time, passing each to {@code release} once it has been removed.
     * Used by the pre-invalidate hook. If {@code release} throws, the exception propagates and only entries that
     * were never handed to {@code release} remain in the table.
     *
     * @param release what to do with each removed entry
     */
    public void removeEach(@Nonnull Consumer<? super E> release) {
        if (table == null) {
            return;
        }
        final Iterator<E> iterator = table.values().iterator();
        while (iterator.hasNext()) {
            final E entry = iterator.next();
            iterator.remove();
            release.accept(entry);
        }
    }

    public boolean contains(@Nonnull K key) {
        return table != null && table.containsKey(key);
    }

    public int size() {
        return table == null ? 0 : table.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isInitialized() {
        return table != null;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    @Nonnull
    private Map<K, E> checkInitialized() {
        if (table == null) {
            throw new HyperchunkException("cache is not initialized",
                    LogMessageKeys.CACHE_NAME, name);
        }
        return table;
    }

    @Override
    public String toString() {
        return "KeyedCache{" + name + ", size=" + size() + "}";
    }
}
