/*
 * Partitioning.java
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

import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * How an epoch spreads rows over its partitions: a partitioning function applied to a column.
 */
@API(API.Status.UNSTABLE)
public final class Partitioning {
    @Nonnull
    private final PartitioningFunction function;
    @Nonnull
    private final String columnName;

    public Partitioning(@Nonnull PartitioningFunction function, @Nonnull String columnName) {
        this.function = function;
        this.columnName = columnName;
    }

    @Nonnull
    public PartitioningFunction getFunction() {
        return function;
    }

    @Nonnull
    public String getColumnName() {
        return columnName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Partitioning that = (Partitioning)o;
        return function.equals(that.function) && columnName.equals(that.columnName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, columnName);
    }

    @Override
    public String toString() {
        return function + "(" + columnName + ")";
    }
}
