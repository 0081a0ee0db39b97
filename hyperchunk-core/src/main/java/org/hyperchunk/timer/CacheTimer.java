/*
 * CacheTimer.java
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

package org.hyperchunk.timer;

import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * A process-wide accumulator of counts and timings for the chunk plan cache and chunk lookups.
 * <p>
 * A cache timer is a thread-safe record of occurrence counts and nanosecond call times, classified by an
 * {@link Event}. Components that are given a timer record into it; it is up to the owner to forward the
 * values to a monitoring system, for instance by logging {@link #getKeysAndValues()}.
 */
@API(API.Status.MAINTAINED)
public class CacheTimer {
    @Nonnull
    private final Map<Event, Counter> counters = new ConcurrentHashMap<>();

    /**
     * An identifier for occurrences that need to be timed.
     */
    public interface Event {
        /**
         * Get the name of this event for machine processing.
         *
         * @return the name
         */
        String name();

        /**
         * Get the title of this event for user displays.
         *
         * @return the user-visible title
         */
        String title();

        /**
         * Get the key of this event for logging with {@link org.hyperchunk.logging.KeyValueLogMessage}.
         *
         * @return the key to use for logging
         */
        default String logKey() {
            return this.name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * {@link Event}s that only count occurrences. There is no time associated with them.
     */
    public interface Count extends Event {
    }

    /**
     * Standard timed events.
     */
    public enum Events implements Event {
        /** The amount of time spent compiling move statements. */
        PLAN_COMPILE("compile chunk move statement"),
        /** The amount of time spent scanning the chunk catalog for a covering chunk. */
        CHUNK_SCAN("scan chunk catalog"),
        ;

        private final String title;

        Events(String title) {
            this.title = title;
        }

        @Override
        public String title() {
            return title;
        }
    }

    /**
     * Standard {@link Count} events.
     */
    public enum Counts implements Count {
        /** The number of fetches answered by an entry whose range was unchanged. */
        PLAN_CACHE_HIT("chunk plan cache hit"),
        /** The number of fetches for a chunk that had no entry. */
        PLAN_CACHE_MISS("chunk plan cache miss"),
        /** The number of entries rebuilt because the chunk's range had changed. */
        PLAN_CACHE_REBUILD("chunk plan cache rebuild"),
        /** The number of full invalidations of the plan cache. */
        PLAN_CACHE_INVALIDATE("chunk plan cache invalidation"),
        /** The number of compiled plans released. */
        PLAN_RELEASED("compiled plan released"),
        /** The number of lookups answered by an existing chunk. */
        CHUNK_FOUND("existing chunk found"),
        /** The number of chunks created because none covered the time point. */
        CHUNK_CREATED("chunk created"),
        ;

        private final String title;

        Counts(String title) {
            this.title = title;
        }

        @Override
        public String title() {
            return title;
        }
    }

    /**
     * Contains the number of occurrences and the cumulative time of all occurrences of an {@link Event}.
     */
    public static class Counter {
        private final AtomicLong timeNanos = new AtomicLong();
        private final AtomicInteger count = new AtomicInteger();

        public int getCount() {
            return count.get();
        }

        public long getTimeNanos() {
            return timeNanos.get();
        }

        public void record(long occurrenceNanos) {
            timeNanos.addAndGet(occurrenceNanos);
            count.incrementAndGet();
        }

        public void increment(int amount) {
            count.addAndGet(amount);
        }
    }

    @Nonnull
    private Counter getCounter(@Nonnull Event event) {
        return counters.computeIfAbsent(event, ignore -> new Counter());
    }

    /**
     * Record the amount of time an event took.
     *
     * @param event the event being recorded
     * @param timeDifferenceNanos the time that the event took
     */
    public void record(@Nonnull Event event, long timeDifferenceNanos) {
        getCounter(event).record(timeDifferenceNanos);
    }

    /**
     * Record the time since the given {@code System.nanoTime()}.
     *
     * @param event the event being recorded
     * @param startTime the {@code System.nanoTime()} when the event started
     */
    public void recordSinceNanoTime(@Nonnull Event event, long startTime) {
        record(event, System.nanoTime() - startTime);
    }

    /**
     * Record that an event occurred once.
     *
     * @param event the event being recorded
     */
    public void increment(@Nonnull Count event) {
        increment(event, 1);
    }

    /**
     * Record that an event occurred <code>amount</code> times.
     *
     * @param event the event being recorded
     * @param amount the number of occurrences
     */
    public void increment(@Nonnull Count event, int amount) {
        getCounter(event).increment(amount);
    }

    /**
     * Run an operation and record its duration, whether or not it completes normally.
     *
     * @param event the event to record
     * @param operation the operation to time
     * @param <T> the result type of the operation
     * @return the operation's result
     */
    public <T> T time(@Nonnull Event event, @Nonnull Supplier<T> operation) {
        final long startTime = System.nanoTime();
        try {
            return operation.get();
        } finally {
            recordSinceNanoTime(event, startTime);
        }
    }

    public int getCount(@Nonnull Event event) {
        @Nullable Counter counter = counters.get(event);
        return counter == null ? 0 : counter.getCount();
    }

    public long getTimeNanos(@Nonnull Event event) {
        @Nullable Counter counter = counters.get(event);
        return counter == null ? 0L : counter.getTimeNanos();
    }

    @Nonnull
    public Collection<Event> getEvents() {
        return counters.keySet();
    }

    /**
     * Suitable for {@link org.hyperchunk.logging.KeyValueLogMessage}.
     *
     * @return a map of recorded times and counts for logging
     */
    @Nonnull
    public Map<String, Number> getKeysAndValues() {
        final Map<String, Number> result = new HashMap<>(counters.size() * 2);
        for (Map.Entry<Event, Counter> entry : counters.entrySet()) {
            final Event event = entry.getKey();
            result.put(event.logKey() + "_count", entry.getValue().getCount());
            if (!(event instanceof Count)) {
                result.put(event.logKey() + "_micros", entry.getValue().getTimeNanos() / 1000L);
            }
        }
        return result;
    }

    /**
     * Clear all recorded information.
     */
    public void reset() {
        counters.clear();
    }
}
