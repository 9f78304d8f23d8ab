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

/**
 * A literal value. {@code inline} forces the printer to emit the literal text instead of a bound
 * parameter, which index hints need.
 */
public record Constant(@Nullable Object value, boolean inline, @Nullable ResolvedType type) implements Expr {
    public static final Constant NULL = new Constant(null, false, null);
    public static final Constant TRUE = new Constant(Boolean.TRUE, false, null);
    public static final Constant FALSE = new Constant(Boolean.FALSE, false, null);

    public Constant(@Nullable Object value) {
        this(value, false, null);
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    public boolean isFalse() {
        return Boolean.FALSE.equals(value);
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public Constant withType(@Nullable ResolvedType type) {
        return new Constant(value, inline, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
