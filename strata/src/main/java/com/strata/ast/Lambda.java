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

public record Lambda(List<String> args, Expr expr, @Nullable ResolvedType type) implements Expr {
    public Lambda {
        args = ImmutableList.copyOf(args);
        Objects.requireNonNull(expr, "expr must not be null");
    }

    public Lambda(List<String> args, Expr expr) {
        this(args, expr, null);
    }

    @Override
    public Lambda withType(@Nullable ResolvedType type) {
        return new Lambda(args, expr, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
