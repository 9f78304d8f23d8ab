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

public record OrderExpr(Expr expr, Order order, @Nullable ResolvedType type) implements Expr {
    public enum Order {
        ASC,
        DESC
    }

    public OrderExpr {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(order, "order must not be null");
    }

    public OrderExpr(Expr expr, Order order) {
        this(expr, order, null);
    }

    public OrderExpr withExpr(Expr newExpr) {
        return new OrderExpr(newExpr, order, type);
    }

    @Override
    public OrderExpr withType(@Nullable ResolvedType type) {
        return new OrderExpr(expr, order, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOrderExpr(this);
    }
}
