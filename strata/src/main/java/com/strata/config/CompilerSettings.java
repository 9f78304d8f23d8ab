/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.strata.config;

import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Limits and output hints that apply to one compilation.
 *
 * @param maxLimit                row-limit ceiling of the top-level SELECT
 * @param maxAstDepth             deepest tree accepted by the guard
 * @param maxAstSize              largest node count accepted by the guard
 * @param maxSubqueryDepth        deepest SELECT nesting accepted by the resolver
 * @param maxExecutionTimeSeconds resource budget printed into the ClickHouse SETTINGS clause
 * @param outputFormat            ClickHouse FORMAT clause, null for none
 * @param sessionLookback         widening window for approximate session timestamp bounds
 * @param timezone                timezone used when parsing datetime properties
 */
public record CompilerSettings(int maxLimit, int maxAstDepth, int maxAstSize, int maxSubqueryDepth,
                               int maxExecutionTimeSeconds, @Nullable String outputFormat,
                               Duration sessionLookback, ZoneId timezone) {

    public CompilerSettings {
        Preconditions.checkArgument(maxLimit > 0, "maxLimit must be positive");
        Preconditions.checkArgument(maxAstDepth > 0, "maxAstDepth must be positive");
        Preconditions.checkArgument(maxAstSize > 0, "maxAstSize must be positive");
        Preconditions.checkArgument(maxSubqueryDepth > 0, "maxSubqueryDepth must be positive");
        Preconditions.checkArgument(maxExecutionTimeSeconds > 0, "maxExecutionTimeSeconds must be positive");
        Objects.requireNonNull(sessionLookback, "sessionLookback must not be null");
        Objects.requireNonNull(timezone, "timezone must not be null");
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(50000, 200, 20000, 16, 60, null, Duration.ofDays(1), ZoneId.of("UTC"));
    }

    public CompilerSettings withMaxLimit(int value) {
        return new CompilerSettings(value, maxAstDepth, maxAstSize, maxSubqueryDepth, maxExecutionTimeSeconds,
                outputFormat, sessionLookback, timezone);
    }

    public CompilerSettings withOutputFormat(@Nullable String value) {
        return new CompilerSettings(maxLimit, maxAstDepth, maxAstSize, maxSubqueryDepth, maxExecutionTimeSeconds,
                value, sessionLookback, timezone);
    }

    public CompilerSettings withMaxAstDepth(int value) {
        return new CompilerSettings(maxLimit, value, maxAstSize, maxSubqueryDepth, maxExecutionTimeSeconds,
                outputFormat, sessionLookback, timezone);
    }

    public CompilerSettings withMaxAstSize(int value) {
        return new CompilerSettings(maxLimit, maxAstDepth, value, maxSubqueryDepth, maxExecutionTimeSeconds,
                outputFormat, sessionLookback, timezone);
    }

    public CompilerSettings withMaxSubqueryDepth(int value) {
        return new CompilerSettings(maxLimit, maxAstDepth, maxAstSize, value, maxExecutionTimeSeconds,
                outputFormat, sessionLookback, timezone);
    }
}
