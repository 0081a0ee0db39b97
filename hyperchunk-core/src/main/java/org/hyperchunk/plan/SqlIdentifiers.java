/*
 * SqlIdentifiers.java
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

import com.google.common.collect.ImmutableSet;
import org.hyperchunk.HyperchunkArgumentException;
import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Set;

/**
 * Quoting of SQL identifiers, following PostgreSQL's <code>quote_identifier</code>.
 *
 * <p>
 * An identifier is left bare only if it is made of lower case letters, digits and underscores, does not start
 * with a digit, and is not a keyword that would be parsed as something other than a name. Everything else is
 * wrapped in double quotes with embedded double quotes doubled.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class SqlIdentifiers {
    // Reserved, column-name and type/function-name keywords. Unreserved keywords are safe as bare names.
    private static final Set<String> KEYWORDS = ImmutableSet.of(
            "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric", "authorization",
            "between", "bigint", "binary", "bit", "boolean", "both", "case", "cast", "char", "character", "check",
            "coalesce", "collate", "collation", "column", "concurrently", "constraint", "create", "cross",
            "current_catalog", "current_date", "current_role", "current_schema", "current_time",
            "current_timestamp", "current_user", "dec", "decimal", "default", "deferrable", "desc", "distinct",
            "do", "else", "end", "except", "exists", "extract", "false", "fetch", "float", "for", "foreign",
            "freeze", "from", "full", "grant", "greatest", "group", "grouping", "having", "ilike", "in",
            "initially", "inner", "inout", "int", "integer", "intersect", "interval", "into", "is", "isnull",
            "join", "lateral", "leading", "least", "left", "like", "limit", "localtime", "localtimestamp",
            "national", "natural", "nchar", "none", "normalize", "not", "notnull", "null", "nullif", "numeric",
            "offset", "on", "only", "or", "order", "out", "outer", "overlaps", "overlay", "placing", "position",
            "precision", "primary", "real", "references", "returning", "right", "row", "select", "session_user",
            "setof", "similar", "smallint", "some", "substring", "symmetric", "system_user", "table",
            "tablesample", "then", "time", "timestamp", "to", "trailing", "treat", "trim", "true", "union",
            "unique", "user", "using", "values", "varchar", "variadic", "verbose", "when", "where", "window",
            "with");

    private SqlIdentifiers() {
    }

    /**
     * Quote an identifier if it could not be used bare.
     *
     * @param identifier the identifier
     * @return the identifier as it should appear in SQL text
     * @throws HyperchunkArgumentException if the identifier is empty
     */
    @Nonnull
    public static String quoteIdentifier(@Nonnull String identifier) {
        if (identifier.isEmpty()) {
            throw new HyperchunkArgumentException("empty SQL identifier");
        }
        if (isSafe(identifier)) {
            return identifier;
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static boolean isSafe(@Nonnull String identifier) {
        final char first = identifier.charAt(0);
        if (!((first >= 'a' && first <= 'z') || first == '_')) {
            return false;
        }
        for (int i = 1; i < identifier.length(); i++) {
            final char c = identifier.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_')) {
                return false;
            }
        }
        return !KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT));
    }
}
