/*
 * PartitioningFunction.java
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
import org.hyperchunk.plan.SqlIdentifiers;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A SQL function mapping the text of a partitioning column value into the keyspace <code>[0, modulus)</code>.
 */
@API(API.Status.UNSTABLE)
public final class PartitioningFunction {
    @Nonnull
    private final String schemaName;
    @Nonnull
    private final String functionName;
    private final int modulus;

    public PartitioningFunction(@Nonnull String schemaName, @Nonnull String functionName, int modulus) {
        this.schemaName = schemaName;
        this.functionName = functionName;
        this.modulus = modulus;
    }

    @Nonnull
    public String getSchemaName() {
        return schemaName;
    }

    @Nonnull
    public String getFunctionName() {
        return functionName;
    }

    public int getModulus() {
        return modulus;
    }

    /**
     * Render a call of this function on a column.
     *
     * @param columnName the partitioning column
     * @return <code>schema.function(column::TEXT, modulus)</code> with identifiers quoted as needed
     */
    @Nonnull
    public String toCallSql(@Nonnull String columnName) {
        return SqlIdentifiers.quoteIdentifier(schemaName) + "." + SqlIdentifiers.quoteIdentifier(functionName)
                + "(" + SqlIdentifiers.quoteIdentifier(columnName) + "::TEXT, " + modulus + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PartitioningFunction that = (PartitioningFunction)o;
        return modulus == that.modulus && schemaName.equals(that.schemaName) && functionName.equals(that.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, functionName, modulus);
    }

    @Override
    public String toString() {
        return schemaName + "." + functionName + "/" + modulus;
    }
}
