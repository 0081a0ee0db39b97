/*
 * QualifiedTableName.java
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
 * A schema-qualified table name.
 */
@API(API.Status.UNSTABLE)
public final class QualifiedTableName {
    @Nonnull
    private final String schemaName;
    @Nonnull
    private final String tableName;

    private QualifiedTableName(@Nonnull String schemaName, @Nonnull String tableName) {
        this.schemaName = schemaName;
        this.tableName = tableName;
    }

    @Nonnull
    public static QualifiedTableName of(@Nonnull String schemaName, @Nonnull String tableName) {
        return new QualifiedTableName(schemaName, tableName);
    }

    @Nonnull
    public String getSchemaName() {
        return schemaName;
    }

    @Nonnull
    public String getTableName() {
        return tableName;
    }

    /**
     * Render as <code>schema.table</code>, quoting each part as needed.
     * @return the SQL form of this name
     */
    @Nonnull
    public String toSql() {
        return SqlIdentifiers.quoteIdentifier(schemaName) + "." + SqlIdentifiers.quoteIdentifier(tableName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QualifiedTableName that = (QualifiedTableName)o;
        return schemaName.equals(that.schemaName) && tableName.equals(that.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, tableName);
    }

    @Override
    public String toString() {
        return schemaName + "." + tableName;
    }
}
