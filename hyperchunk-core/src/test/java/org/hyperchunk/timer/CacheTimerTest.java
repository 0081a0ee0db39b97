/*
 * CacheTimerTest.java
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

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CacheTimerTest {

    @Test
    void countsAndTimes() {
        CacheTimer timer = new CacheTimer();
        timer.increment(CacheTimer.Counts.PLAN_CACHE_HIT);
        timer.increment(CacheTimer.Counts.PLAN_CACHE_HIT, 2);
        timer.record(CacheTimer.Events.PLAN_COMPILE, 5_000L);
        timer.record(CacheTimer.Events.PLAN_COMPILE, 7_000L);

        assertThat(timer.getCount(CacheTimer.Counts.PLAN_CACHE_HIT), is(3));
        assertThat(timer.getCount(CacheTimer.Events.PLAN_COMPILE), is(2));
        assertThat(timer.getTimeNanos(CacheTimer.Events.PLAN_COMPILE), is(12_000L));
        assertThat(timer.getCount(CacheTimer.Counts.CHUNK_CREATED), is(0));
        assertThat(timer.getEvents(), Matchers.<CacheTimer.Event>containsInAnyOrder(
                CacheTimer.Counts.PLAN_CACHE_HIT, CacheTimer.Events.PLAN_COMPILE));
    }

    @Test
    void keysAndValuesForLogging() {
        CacheTimer timer = new CacheTimer();
        timer.increment(CacheTimer.Counts.PLAN_CACHE_MISS);
        timer.record(CacheTimer.Events.CHUNK_SCAN, 3_000L);

        Map<String, Number> keysAndValues = timer.getKeysAndValues();
        assertThat(keysAndValues, hasEntry("plan_cache_miss_count", (Number)1));
        assertThat(keysAndValues, not(hasKey("plan_cache_miss_micros")));
        assertThat(keysAndValues, hasEntry("chunk_scan_count", (Number)1));
        assertThat(keysAndValues, hasEntry("chunk_scan_micros", (Number)3L));
    }

    @Test
    void timeRecordsFailures() {
        CacheTimer timer = new CacheTimer();
        assertThat(timer.time(CacheTimer.Events.PLAN_COMPILE, () -> "done"), is("done"));
        assertThrows(IllegalStateException.class, () -> timer.time(CacheTimer.Events.PLAN_COMPILE, () -> {
            throw new IllegalStateException("compile failed");
        }));
        assertThat(timer.getCount(CacheTimer.Events.PLAN_COMPILE), is(2));
    }

    @Test
    void concurrentIncrements() {
        CacheTimer timer = new CacheTimer();
        IntStream.range(0, 1000).parallel().forEach(i -> timer.increment(CacheTimer.Counts.CHUNK_FOUND));
        assertThat(timer.getCount(CacheTimer.Counts.CHUNK_FOUND), is(1000));
    }

    @Test
    void reset() {
        CacheTimer timer = new CacheTimer();
        timer.increment(CacheTimer.Counts.PLAN_RELEASED);
        timer.reset();
        assertThat(timer.getEvents(), empty());
        assertThat(timer.getCount(CacheTimer.Counts.PLAN_RELEASED), is(0));
    }

    @Test
    void titles() {
        assertThat(CacheTimer.Counts.PLAN_CACHE_REBUILD.title(), is("chunk plan cache rebuild"));
        assertThat(CacheTimer.Events.PLAN_COMPILE.logKey(), is("plan_compile"));
    }
}
