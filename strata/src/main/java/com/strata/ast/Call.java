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

/**
 * Function or aggregation call. {@code params} holds the parameter list of parametric aggregations
 * such as {@code quantile(0.9)(x)}; it is null for ordinary calls.
 */
public record Call(String name, List<Expr> args, @Nullable List<Expr> params, boolean distinct,
                   @Nullable ResolvedType type) implements Expr {
    public Call {
        Objects.requireNonNull(name, "name must not be null");
        args = ImmutableList.copyOf(args);
        params = params == null ? null : ImmutableList.copyOf(params);
    }

    public Call(String name, List<Expr> args) {
        this(name, args, null, false, null);
    }

    public Call withArgs(List<Expr> newArgs) {
        return new Call(name, newArgs, params, distinct, type);
    }

    @Override
    public Call withType(@Nullable ResolvedType type) {
        return new Call(name, args, params, distinct, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
