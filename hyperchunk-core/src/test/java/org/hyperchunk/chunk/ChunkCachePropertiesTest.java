/*
 * ChunkCachePropertiesTest.java
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
import org.hyperchunk.logging.LogMessageKeys;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hyperchunk.TestHelpers.assertThrows;

class ChunkCachePropertiesTest {

    @Test
    void defaults() {
        ChunkCacheProperties properties = ChunkCacheProperties.fromProperties(new Properties());
        assertThat(properties.getName(), is("chunk_insert_plan_cache"));
        assertThat(properties.getInitialCapacity(), is(16));
        assertThat(properties.isLockRows(), is(false));
    }

    @Test
    void readsProperties() {
        Properties props = new Properties();
        props.setProperty(ChunkCacheProperties.NAME_PROPERTY, " insert_plans ");
        props.setProperty(ChunkCacheProperties.INITIAL_CAPACITY_PROPERTY, "128");
        props.setProperty(ChunkCacheProperties.LOCK_ROWS_PROPERTY, "TRUE");

        ChunkCacheProperties properties = ChunkCacheProperties.fromProperties(props);
        assertThat(properties.getName(), is("insert_plans"));
        assertThat(properties.getInitialCapacity(), is(128));
        assertThat(properties.isLockRows(), is(true));
    }

    @Test
    void invalidCapacity() throws Exception {
        Properties props = new Properties();
        props.setProperty(ChunkCacheProperties.INITIAL_CAPACITY_PROPERTY, "lots");
        assertThrows(HyperchunkArgumentException.class, () -> ChunkCacheProperties.fromProperties(props),
                LogMessageKeys.PROPERTY.toString(), ChunkCacheProperties.INITIAL_CAPACITY_PROPERTY,
                LogMessageKeys.VALUE.toString(), "lots");

        props.setProperty(ChunkCacheProperties.INITIAL_CAPACITY_PROPERTY, "-1");
        assertThrows(HyperchunkArgumentException.class, () -> ChunkCacheProperties.fromProperties(props),
                LogMessageKeys.INITIAL_CAPACITY.toString(), -1);
    }

    @Test
    void invalidLockRows() throws Exception {
        Properties props = new Properties();
        props.setProperty(ChunkCacheProperties.LOCK_ROWS_PROPERTY, "maybe");
        assertThrows(HyperchunkArgumentException.class, () -> ChunkCacheProperties.fromProperties(props),
                LogMessageKeys.PROPERTY.toString(), ChunkCacheProperties.LOCK_ROWS_PROPERTY);
    }

    @Test
    void emptyNameRejected() throws Exception {
        assertThrows(HyperchunkArgumentException.class, () -> ChunkCacheProperties.newBuilder().setName("").build());
    }

    @Test
    void toBuilderCopiesSettings() {
        ChunkCacheProperties original = ChunkCacheProperties.newBuilder()
                .setName("plans")
                .setInitialCapacity(4)
                .build();
        ChunkCacheProperties copy = original.toBuilder().setLockRows(true).build();
        assertThat(copy.getName(), is("plans"));
        assertThat(copy.getInitialCapacity(), is(4));
        assertThat(copy.isLockRows(), is(true));
        assertThat(original.isLockRows(), is(false));
    }
}
