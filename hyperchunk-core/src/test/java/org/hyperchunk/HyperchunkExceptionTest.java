/*
 * HyperchunkExceptionTest.java
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

package org.hyperchunk;

import org.hyperchunk.logging.LogMessageKeys;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HyperchunkExceptionTest {

    @Test
    void logInfoKeepsInsertionOrder() {
        HyperchunkException ex = new HyperchunkException("chunk lookup failed",
                LogMessageKeys.PARTITION_ID, 4,
                LogMessageKeys.TIME_POINT, 1500L);
        ex.addLogInfo(LogMessageKeys.CHUNK_ID.toString(), 9);

        assertThat(ex.getLogInfo(), hasEntry("partition_id", (Object)4));
        assertThat(ex.exportLogInfo(), is(new Object[] {"partition_id", 4, "time_point", 1500L, "chunk_id", 9}));
    }

    @Test
    void causeOnly() {
        IllegalStateException cause = new IllegalStateException("boom");
        HyperchunkException ex = new HyperchunkException("wrapped", cause);
        assertThat(ex.getCause(), is(cause));
        assertThat(ex.getLogInfo(), anEmptyMap());
        assertThat(ex.exportLogInfo().length, is(0));
    }

    @Test
    void unbalancedLogInfoRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HyperchunkException("bad", LogMessageKeys.CHUNK_ID));
    }
}
