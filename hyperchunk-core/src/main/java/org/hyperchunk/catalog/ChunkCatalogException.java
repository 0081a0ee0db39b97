/*
 * ChunkCatalogException.java
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

import org.hyperchunk.HyperchunkException;
import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when the chunk catalog cannot scan or create chunk rows.
 */
@API(API.Status.UNSTABLE)
public class ChunkCatalogException extends HyperchunkException {
    private static final long serialVersionUID = 1;

    public ChunkCatalogException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public ChunkCatalogException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
