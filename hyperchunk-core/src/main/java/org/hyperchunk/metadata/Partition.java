/*
 * Partition.java
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

package org.hyperchunk.metadata;

import org.hyperchunk.HyperchunkArgumentException;
import org.hyperchunk.annotation.API;
import org.hyperchunk.logging.LogMessageKeys;

import java.util.Objects;

/**
 * A slice <code>[keyspaceStart, keyspaceEnd]</code> of an epoch's partitioning keyspace.
 */
@API(API.Status.UNSTABLE)
public final class Partition {
    private final int id;
    private final int epochId;
    private final int keyspaceStart;
    private final int keyspaceEnd;

    public Partition(int id, int epochId, int keyspaceStart, int keyspaceEnd) {
        if (keyspaceStart > keyspaceEnd) {
            throw new HyperchunkArgumentException("partition keyspace start is after its end",
                    LogMessageKeys.PARTITION_ID, id,
                    LogMessageKeys.KEYSPACE_START, keyspaceStart,
                    LogMessageKeys.KEYSPACE_END, keyspaceEnd);
        }
        this.id = id;
        this.epochId = epochId;
        this.keyspaceStart = keyspaceStart;
        this.keyspaceEnd = keyspaceEnd;
    }

    public int getId() {
        return id;
    }

    public int getEpochId() {
        return epochId;
    }

    public int getKeyspaceStart() {
        return keyspaceStart;
    }

    public int getKeyspaceEnd() {
        return keyspaceEnd;
    }

    public boolean containsKeyspaceValue(int keyspaceValue) {
        return keyspaceValue >= keyspaceStart && keyspaceValue <= keyspaceEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Partition partition = (Partition)o;
        return id == partition.id && epochId == partition.epochId
                && keyspaceStart == partition.keyspaceStart && keyspaceEnd == partition.keyspaceEnd;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, epochId, keyspaceStart, keyspaceEnd);
    }

    @Override
    public String toString() {
        return "Partition{" + id + ", keyspace=[" + keyspaceStart + ", " + keyspaceEnd + "]}";
    }
}
