/*
 * ChunkReplicaResolver.java
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

package org.hyperchunk.catalog;

import org.hyperchunk.annotation.API;
import org.hyperchunk.metadata.QualifiedTableName;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Resolves the tables a chunk's rows are stored in.
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface ChunkReplicaResolver {
    /**
     * Get the replica tables of a chunk.
     *
     * @param chunkId the chunk
     * @return the schema-qualified replica tables, in a stable order
     * @throws ChunkCatalogException if the lookup fails
     */
    @Nonnull
    List<QualifiedTableName> getReplicaTables(int chunkId);
}
