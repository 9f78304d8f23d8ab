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
import java.util.ArrayList;
import java.util.List;

/**
 * Deep-copies a tree. With {@link CloneOptions#clearTypes()} the copy carries no resolved types, which
 * makes two trees built by different passes comparable with {@code equals}.
 */
public class CloningVisitor implements ExprVisitor<Expr> {
    private final CloneOptions options;

    public CloningVisitor(CloneOptions options) {
        this.options = options;
    }

    public static Expr cloneExpr(Expr node, CloneOptions options) {
        return node.accept(new CloningVisitor(options));
    }

    @Nullable
    private ResolvedType type(Expr node) {
        return options.retainTypes() ? node.type() : null;
    }

    @Nullable
    protected Expr copy(@Nullable Expr node) {
        return node == null ? null : node.accept(this);
    }

    protected List<Expr> copyAll(List<Expr> nodes) {
        List<Expr> result = new ArrayList<>(nodes.size());
        for (Expr node : nodes) {
            result.add(copy(node));
        }
        return result;
    }

    private List<OrderExpr> copyOrder(List<OrderExpr> nodes) {
        List<OrderExpr> result = new ArrayList<>(nodes.size());
        for (OrderExpr node : nodes) {
            result.add((OrderExpr) copy(node));
        }
        return result;
    }

    @Override
    public Expr visitConstant(Constant node) {
        return new Constant(node.value(), node.inline(), type(node));
    }

    @Override
    public Expr visitField(Field node) {
        return new Field(node.chain(), type(node));
    }

    @Override
    public Expr visitCompareOperation(CompareOperation node) {
        return new CompareOperation(node.op(), copy(node.left()), copy(node.right()), type(node));
    }

    @Override
    public Expr visitAnd(And node) {
        return new And(copyAll(node.exprs()), type(node));
    }

    @Override
    public Expr visitOr(Or node) {
        return new Or(copyAll(node.exprs()), type(node));
    }

    @Override
    public Expr visitNot(Not node) {
        return new Not(copy(node.expr()), type(node));
    }

    @Override
    public Expr visitCall(Call node) {
        List<Expr> params = node.params() == null ? null : copyAll(node.params());
        return new Call(node.name(), copyAll(node.args()), params, node.distinct(), type(node));
    }

    @Override
    public Expr visitArray(ArrayExpr node) {
        return new ArrayExpr(copyAll(node.exprs()), type(node));
    }

    @Override
    public Expr visitTuple(TupleExpr node) {
        return new TupleExpr(copyAll(node.exprs()), type(node));
    }

    @Override
    public Expr visitAlias(Alias node) {
        return new Alias(node.alias(), copy(node.expr()), node.hidden(), type(node));
    }

    @Override
    public Expr visitLambda(Lambda node) {
        return new Lambda(node.args(), copy(node.expr()), type(node));
    }

    @Override
    public Expr visitSelectQuery(SelectQuery node) {
        LimitBy limitBy = null;
        if (node.limitBy() != null) {
            limitBy = new LimitBy(copy(node.limitBy().n()), copy(node.limitBy().offset()),
                    copyAll(node.limitBy().exprs()));
        }
        ArrayJoin arrayJoin = null;
        if (node.arrayJoin() != null) {
            arrayJoin = new ArrayJoin(node.arrayJoin().kind(), copyAll(node.arrayJoin().exprs()));
        }
        return SelectQuery.builder()
                .select(copyAll(node.select()))
                .distinct(node.distinct())
                .selectFrom((JoinExpr) copy(node.selectFrom()))
                .arrayJoin(arrayJoin)
                .prewhere(copy(node.prewhere()))
                .where(copy(node.where()))
                .groupBy(copyAll(node.groupBy()))
                .having(copy(node.having()))
                .orderBy(copyOrder(node.orderBy()))
                .limit(copy(node.limit()))
                .offset(copy(node.offset()))
                .limitBy(limitBy)
                .type(type(node))
                .build();
    }

    @Override
    public Expr visitJoinExpr(JoinExpr node) {
        JoinConstraint constraint = node.constraint() == null ? null : node.constraint().withExpr(copy(node.constraint().expr()));
        return new JoinExpr(node.joinType(), copy(node.table()), node.alias(), constraint, node.sample(),
                (JoinExpr) copy(node.nextJoin()), type(node));
    }

    @Override
    public Expr visitOrderExpr(OrderExpr node) {
        return new OrderExpr(copy(node.expr()), node.order(), type(node));
    }

    @Override
    public Expr visitWindowFunction(WindowFunction node) {
        WindowExpr over = new WindowExpr(copyAll(node.over().partitionBy()), copyOrder(node.over().orderBy()),
                node.over().frame());
        return new WindowFunction(node.name(), copyAll(node.args()), over, type(node));
    }
}
