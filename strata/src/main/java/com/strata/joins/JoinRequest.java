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

package com.strata.joins;

import com.strata.ast.Expr;
import com.strata.ast.types.LazyJoinType;

import java.util.Objects;

/**
 * A join to splice into a SELECT: the lazy join that asked for it and its resolved ON expression.
 */
public record JoinRequest(LazyJoinType lazyJoinType, Expr constraint) {
    public JoinRequest {
        Objects.requireNonNull(lazyJoinType, "lazyJoinType must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
    }

    public String alias() {
        return lazyJoinType.alias();
    }
}
