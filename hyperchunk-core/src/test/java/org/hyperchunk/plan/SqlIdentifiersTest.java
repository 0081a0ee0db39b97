/*
 * SqlIdentifiersTest.java
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

package org.hyperchunk.plan;

import org.hyperchunk.HyperchunkArgumentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SqlIdentifiersTest {

    @ParameterizedTest
    @CsvSource(value = {
            "conditions|conditions",
            "_copy_temp_1|_copy_temp_1",
            "device_id2|device_id2",
            "time|\"time\"",
            "select|\"select\"",
            "Conditions|\"Conditions\"",
            "2fast|\"2fast\"",
            "with space|\"with space\"",
            "say \"hi\"|\"say \"\"hi\"\"\"",
            "location|location",
    }, delimiter = '|')
    void quotesOnlyWhenNeeded(String identifier, String expected) {
        assertThat(SqlIdentifiers.quoteIdentifier(identifier), is(expected));
    }

    @Test
    void emptyIdentifierRejected() {
        assertThrows(HyperchunkArgumentException.class, () -> SqlIdentifiers.quoteIdentifier(""));
    }
}
