/*
 * package-info.java
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

/**
 * Resolving the chunk a row belongs to and caching the compiled plans that move rows into chunks.
 *
 * <p>
 * {@link org.hyperchunk.chunk.ChunkInsertPlanner} ties the pieces together: {@link org.hyperchunk.chunk.ChunkLookup}
 * finds or creates the covering chunk and {@link org.hyperchunk.chunk.ChunkPlanCache} supplies a plan that is
 * valid for the chunk's current range. {@link org.hyperchunk.chunk.ChunkCacheInvalidator} drops every cached plan
 * when the catalog reports a metadata change.
 * </p>
 */
package org.hyperchunk.chunk;
