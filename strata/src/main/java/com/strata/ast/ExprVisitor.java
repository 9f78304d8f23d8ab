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

/**
 * One method per node kind. Adding a node kind to {@link Expr} breaks every visitor at compile time,
 * which is how passes stay exhaustive.
 *
 * @param <R> result of visiting a node
 */
public interface ExprVisitor<R> {
    R visitConstant(Constant node);

    R visitField(Field node);

    R visitCompareOperation(CompareOperation node);

    R visitAnd(And node);

    R visitOr(Or node);

    R visitNot(Not node);

    R visitCall(Call node);

    R visitArray(ArrayExpr node);

    R visitTuple(TupleExpr node);

    R visitAlias(Alias node);

    R visitLambda(Lambda node);

    R visitSelectQuery(SelectQuery node);

    R visitJoinExpr(JoinExpr node);

    R visitOrderExpr(OrderExpr node);

    R visitWindowFunction(WindowFunction node);
}
