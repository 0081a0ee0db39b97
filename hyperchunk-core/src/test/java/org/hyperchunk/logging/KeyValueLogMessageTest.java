/*
 * KeyValueLogMessageTest.java
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

package org.hyperchunk.logging;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class KeyValueLogMessageTest {

    @Test
    void formatsSortedKeys() {
        String message = KeyValueLogMessage.of("created chunk",
                LogMessageKeys.PARTITION_ID, 3,
                LogMessageKeys.CHUNK_ID, 12,
                LogMessageKeys.START_TIME, null);
        assertThat(message, is("created chunk chunk_id=\"12\" partition_id=\"3\" start_time=\"null\""));
    }

    @Test
    void escapesQuotesAndEquals() {
        KeyValueLogMessage message = KeyValueLogMessage.build("plan rejected")
                .addKeyAndValue("a=b", "say \"hi\"");
        assertThat(message.getKeyValueMap(), hasEntry("ab", "say 'hi'"));
        assertThat(message.toString(), is("plan rejected ab=\"say 'hi'\""));
    }

    @Test
    void addsMaps() {
        KeyValueLogMessage message = KeyValueLogMessage.build("timer")
                .addKeysAndValues(ImmutableMap.of("plan_cache_hit_count", 4));
        assertThat(message.getStaticMessage(), is("timer"));
        assertThat(message.toString(), is("timer plan_cache_hit_count=\"4\""));
    }

    @Test
    void unbalancedKeysRejected() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("oops", LogMessageKeys.CHUNK_ID));
    }

    @Test
    void keysAreLowerCase() {
        assertThat(LogMessageKeys.OLD_START_TIME.toString(), is("old_start_time"));
    }
}
