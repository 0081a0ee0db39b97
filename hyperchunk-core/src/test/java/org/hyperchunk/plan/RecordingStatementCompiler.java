/*
 * RecordingStatementCompiler.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A {@link StatementCompiler} for tests that remembers every plan it hands out and whether each was released.
 * Releasing a plan twice fails. Releases can also be made to fail on purpose.
 */
public class RecordingStatementCompiler implements StatementCompiler {
    @Nonnull
    private final List<RecordingPlan> prepared = new ArrayList<>();
    @Nullable
    private Predicate<String> rejecting;
    @Nullable
    private Predicate<String> failingRelease;

    @Nonnull
    @Override
    public CompiledPlan prepare(@Nonnull String sql, int parameterCount) {
        if (rejecting != null && rejecting.test(sql)) {
            throw new PlanCompilationException("statement rejected by test compiler");
        }
        final RecordingPlan plan = new RecordingPlan(this, sql, parameterCount);
        prepared.add(plan);
        return plan;
    }

    /**
     * Make {@link #prepare} fail for statements matching a predicate.
     * @param rejecting statements to reject, or {@code null} to accept everything
     */
    public void setRejecting(@Nullable Predicate<String> rejecting) {
        this.rejecting = rejecting;
    }

    /**
     * Make {@link CompiledPlan#close()} throw for plans whose statement matches a predicate. A failed release
     * still counts as the plan's one release.
     * @param failingRelease statements whose release fails, or {@code null} to let every release succeed
     */
    public void setFailingRelease(@Nullable Predicate<String> failingRelease) {
        this.failingRelease = failingRelease;
    }

    @Nonnull
    public List<RecordingPlan> getPrepared() {
        return prepared;
    }

    public int getPreparedCount() {
        return prepared.size();
    }

    @Nonnull
    public List<RecordingPlan> getOpenPlans() {
        return prepared.stream().filter(plan -> !plan.isReleased()).collect(Collectors.toList());
    }

    /**
     * A plan that only records its statement and its release.
     */
    public static class RecordingPlan implements CompiledPlan {
        @Nonnull
        private final RecordingStatementCompiler compiler;
        @Nonnull
        private final String statementText;
        private final int parameterCount;
        private boolean released;

        RecordingPlan(@Nonnull RecordingStatementCompiler compiler, @Nonnull String statementText, int parameterCount) {
            this.compiler = compiler;
            this.statementText = statementText;
            this.parameterCount = parameterCount;
        }

        @Nonnull
        @Override
        public String getStatementText() {
            return statementText;
        }

        @Override
        public int getParameterCount() {
            return parameterCount;
        }

        public boolean isReleased() {
            return released;
        }

        @Override
        public void close() {
            if (released) {
                throw new IllegalStateException("plan released twice: " + statementText);
            }
            released = true;
            if (compiler.failingRelease != null && compiler.failingRelease.test(statementText)) {
                throw new IllegalStateException("release failed: " + statementText);
            }
        }
    }
}
