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

package com.strata.ast;

import com.strata.ast.types.ResolvedType;

import javax.annotation.Nullable;
import java.util.Objects;

public record CompareOperation(CompareOperator op, Expr left, Expr right,
                               @Nullable ResolvedType type) implements Expr {
    public CompareOperation {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    public CompareOperation(CompareOperator op, Expr left, Expr right) {
        this(op, left, right, null);
    }

    @Override
    public CompareOperation withType(@Nullable ResolvedType type) {
        return new CompareOperation(op, left, right, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCompareOperation(this);
    }
}
