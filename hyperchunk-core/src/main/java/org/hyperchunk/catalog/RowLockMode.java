/*
 * RowLockMode.java
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

/**
 * The row lock a catalog scan takes on the rows it returns.
 */
@API(API.Status.UNSTABLE)
public enum RowLockMode {
    /**
     * Rows are read without a row lock.
     */
    NONE,
    /**
     * Rows are locked in share mode for the rest of the enclosing transaction, which blocks concurrent changes
     * to their ranges but not other share-mode readers.
     */
    SHARE
}
