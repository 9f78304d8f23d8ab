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
 * Closed union of every expression node the compiler understands.
 * <p>
 * Nodes are immutable. A pass that needs a different tree builds a new one, usually through
 * {@link CloningVisitor} or {@link RewritingVisitor}. The resolved type is null until the resolver
 * has annotated the node.
 */
public sealed interface Expr permits Constant, Field, CompareOperation, And, Or, Not, Call, ArrayExpr, TupleExpr,
        Alias, Lambda, SelectQuery, JoinExpr, OrderExpr, WindowFunction {

    @Nullable
    ResolvedType type();

    /**
     * Returns a copy of this node carrying the given resolved type.
     */
    Expr withType(@Nullable ResolvedType type);

    <R> R accept(ExprVisitor<R> visitor);
}
