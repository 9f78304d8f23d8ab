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

package com.strata.properties;

import com.strata.ast.CompareOperator;
import com.strata.ast.Expr;
import com.strata.compiler.CompileContext;

import javax.annotation.Nullable;

/**
 * One physical representation a property can be read from. Strategies are tried in priority order and
 * the first one that applies wins.
 */
public interface PropertyAccessStrategy {

    /**
     * Expression reading the property's value, typed per the catalog.
     */
    Expr read(PropertyAccess access, CompileContext context);

    /**
     * Specialized form of {@code property op other}, or null when the generic comparison over
     * {@link #read} should be used.
     */
    @Nullable
    default Expr compare(PropertyAccess access, CompareOperator op, Expr other, CompileContext context) {
        return null;
    }

    /**
     * Get the name of this strategy.
     *
     * @return strategy name for logging
     */
    String getName();

    /**
     * Get the priority of this strategy. Higher priority strategies are tried first.
     *
     * @return priority value (higher values = higher priority)
     */
    int getPriority();

    /**
     * Whether this strategy can serve the given access.
     */
    boolean canApply(PropertyAccess access, CompileContext context);
}
