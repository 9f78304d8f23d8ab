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

/**
 * Names an expression. A hidden alias is visible to name resolution but never printed, which lets
 * passes give names to generated columns without changing the output shape.
 */
public record Alias(String alias, Expr expr, boolean hidden, @Nullable ResolvedType type) implements Expr {
    public Alias {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }

    public Alias(String alias, Expr expr) {
        this(alias, expr, false, null);
    }

    public static Alias hidden(String alias, Expr expr) {
        return new Alias(alias, expr, true, null);
    }

    public Alias withExpr(Expr newExpr) {
        return new Alias(alias, newExpr, hidden, type);
    }

    @Override
    public Alias withType(@Nullable ResolvedType type) {
        return new Alias(alias, expr, hidden, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAlias(this);
    }
}
