/*
 * MoveStatementBuilder.java
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

import com.google.common.base.Verify;
import org.hyperchunk.HyperchunkArgumentException;
import org.hyperchunk.annotation.API;
import org.hyperchunk.logging.LogMessageKeys;
import org.hyperchunk.metadata.Hypertable;
import org.hyperchunk.metadata.Partition;
import org.hyperchunk.metadata.PartitionEpoch;
import org.hyperchunk.metadata.Partitioning;
import org.hyperchunk.metadata.QualifiedTableName;
import org.hyperchunk.metadata.TimeRange;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Builds the statement that moves the rows of one chunk out of a hypertable's copy table and into each of the
 * chunk's replica tables.
 *
 * <p>
 * The statement deletes, from the copy table only, the rows that fall in the chunk: those whose partitioning
 * value lies in the partition's keyspace slice (checked only when the epoch has more than one partition) and
 * whose time lies in the chunk's range (checked only for finite bounds). The deleted rows are then inserted into
 * every replica table, one insert per table, and the statement returns a single constant:
 * </p>
 *
 * <pre>
 * WITH selected AS (DELETE FROM ONLY copy_table WHERE TRUE AND (...) RETURNING *),
 *      i_1 AS (INSERT INTO schema.table SELECT * FROM selected), ...
 * SELECT 1
 * </pre>
 *
 * <p>
 * The output depends only on the arguments: predicates are always in the order partition, start, end, and
 * replica tables in the order given. Bound values appear as literals, so a plan built from this text is only
 * valid for the range it was built for.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class MoveStatementBuilder {

    private MoveStatementBuilder() {
    }

    /**
     * Build the move statement for a chunk.
     *
     * @param hypertable the hypertable, supplying the copy table and the time column
     * @param epoch the epoch the partition belongs to
     * @param partition the partition the chunk belongs to
     * @param range the chunk's time range
     * @param replicaTables the tables the chunk's rows are written to
     * @return the statement text
     * @throws HyperchunkArgumentException if there are no replica tables or a bound cannot be rendered
     */
    @Nonnull
    public static String buildMoveStatement(@Nonnull Hypertable hypertable, @Nonnull PartitionEpoch epoch,
                                            @Nonnull Partition partition, @Nonnull TimeRange range,
                                            @Nonnull List<QualifiedTableName> replicaTables) {
        if (replicaTables.isEmpty()) {
            throw new HyperchunkArgumentException("chunk has no replica tables to move rows into",
                    LogMessageKeys.HYPERTABLE_ID, hypertable.getId(),
                    LogMessageKeys.PARTITION_ID, partition.getId());
        }
        final StringBuilder sql = new StringBuilder(256);
        sql.append("WITH selected AS (DELETE FROM ONLY ")
                .append(SqlIdentifiers.quoteIdentifier(hypertable.getCopyTableName()))
                .append(' ');
        appendWhereClause(sql, hypertable, epoch, partition, range);
        sql.append(" RETURNING *)");
        for (int i = 0; i < replicaTables.size(); i++) {
            sql.append(", i_").append(i + 1)
                    .append(" AS (INSERT INTO ").append(replicaTables.get(i).toSql())
                    .append(" SELECT * FROM selected)");
        }
        sql.append(" SELECT 1");
        return sql.toString();
    }

    private static void appendWhereClause(@Nonnull StringBuilder sql, @Nonnull Hypertable hypertable,
                                          @Nonnull PartitionEpoch epoch, @Nonnull Partition partition,
                                          @Nonnull TimeRange range) {
        sql.append("WHERE TRUE");
        if (epoch.getNumPartitions() > 1) {
            final Partitioning partitioning = epoch.getPartitioning();
            Verify.verify(partitioning != null, "epoch with several partitions must have a partitioning");
            sql.append(" AND (").append(partitioning.getFunction().toCallSql(partitioning.getColumnName()))
                    .append(" BETWEEN ").append(partition.getKeyspaceStart())
                    .append(" AND ").append(partition.getKeyspaceEnd())
                    .append(')');
        }
        final String timeColumn = SqlIdentifiers.quoteIdentifier(hypertable.getTimeColumnName());
        if (!range.isOpenStart()) {
            sql.append(" AND (").append(timeColumn).append(" >= ")
                    .append(hypertable.getTimeColumnType().toLiteralSql(range.getStartTime()))
                    .append(')');
        }
        if (!range.isOpenEnd()) {
            sql.append(" AND (").append(timeColumn).append(" <= ")
                    .append(hypertable.getTimeColumnType().toLiteralSql(range.getEndTime()))
                    .append(')');
        }
    }
}
