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

import com.google.common.collect.ImmutableList;
import com.strata.ast.types.ResolvedType;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

public record WindowFunction(String name, List<Expr> args, WindowExpr over,
                             @Nullable ResolvedType type) implements Expr {
    public WindowFunction {
        Objects.requireNonNull(name, "name must not be null");
        args = ImmutableList.copyOf(args);
        Objects.requireNonNull(over, "over must not be null");
    }

    public WindowFunction(String name, List<Expr> args, WindowExpr over) {
        this(name, args, over, null);
    }

    @Override
    public WindowFunction withType(@Nullable ResolvedType type) {
        return new WindowFunction(name, args, over, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitWindowFunction(this);
    }
}
