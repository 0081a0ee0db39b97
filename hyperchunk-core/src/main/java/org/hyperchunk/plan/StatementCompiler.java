/*
 * StatementCompiler.java
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
 * The service that turns statement text into a reusable {@link CompiledPlan}.
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface StatementCompiler {
    /**
     * Parse and analyze a statement.
     *
     * @param sql the statement text
     * @param parameterCount the number of bound parameters the statement takes
     * @return a plan owned by the caller, which must eventually {@linkplain CompiledPlan#close() release} it
     * @throws PlanCompilationException if the statement is rejected
     */
    @Nonnull
    CompiledPlan prepare(@Nonnull String sql, int parameterCount);
}
