/*
 * CompiledPlan.java
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

import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;

/**
 * An opaque handle on a statement prepared by a {@link StatementCompiler}.
 *
 * <p>
 * The handle owns resources on the compiler's side and must be released with {@link #close()} exactly once by
 * whoever owns it. A plan held by the chunk plan cache is owned by the cache; callers must not close it.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface CompiledPlan extends AutoCloseable {
    /**
     * Get the statement text this plan was prepared from.
     * @return the statement text
     */
    @Nonnull
    String getStatementText();

    /**
     * Get the number of bound parameters the plan was prepared with.
     * @return the parameter count
     */
    int getParameterCount();

    /**
     * Release the plan.
     */
    @Override
    void close();
}
