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

import com.strata.errors.ImpossibleAstError;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a new tree from an old one. Subclasses override the node kinds they rewrite; every other node
 * is rebuilt from its rewritten children with its type kept.
 * <p>
 * Returning {@link Optional#empty()} removes a subtree. A removed element of a list (AND/OR operands,
 * call arguments, array or tuple items, SELECT columns, GROUP BY and ORDER BY items) is dropped. A
 * removed optional clause (WHERE, HAVING, LIMIT ...) is cleared. A removed required child removes its
 * parent, and an AND/OR left with no operands is removed as well.
 */
public class RewritingVisitor implements ExprVisitor<Optional<Expr>> {

    public Optional<Expr> rewrite(Expr node) {
        return node.accept(this);
    }

    /**
     * Rewrites a child whose removal is not allowed by the caller.
     */
    public Expr rewriteRequired(Expr node) {
        return rewrite(node).orElseThrow(
                () -> new ImpossibleAstError("Required " + node.getClass().getSimpleName() + " node was removed"));
    }

    @Nullable
    protected Expr rewriteOptional(@Nullable Expr node) {
        if (node == null) {
            return null;
        }
        return rewrite(node).orElse(null);
    }

    protected List<Expr> rewriteAll(List<Expr> nodes) {
        List<Expr> result = new ArrayList<>(nodes.size());
        for (Expr node : nodes) {
            rewrite(node).ifPresent(result::add);
        }
        return result;
    }

    protected List<OrderExpr> rewriteOrder(List<OrderExpr> nodes) {
        List<OrderExpr> result = new ArrayList<>(nodes.size());
        for (OrderExpr node : nodes) {
            Optional<Expr> rewritten = rewrite(node);
            if (rewritten.isEmpty()) {
                continue;
            }
            if (!(rewritten.get() instanceof OrderExpr orderExpr)) {
                throw new ImpossibleAstError("ORDER BY item rewritten into " + rewritten.get().getClass().getSimpleName());
            }
            result.add(orderExpr);
        }
        return result;
    }

    @Override
    public Optional<Expr> visitConstant(Constant node) {
        return Optional.of(node);
    }

    @Override
    public Optional<Expr> visitField(Field node) {
        return Optional.of(node);
    }

    @Override
    public Optional<Expr> visitCompareOperation(CompareOperation node) {
        Optional<Expr> left = rewrite(node.left());
        Optional<Expr> right = rewrite(node.right());
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CompareOperation(node.op(), left.get(), right.get(), node.type()));
    }

    @Override
    public Optional<Expr> visitAnd(And node) {
        List<Expr> exprs = rewriteAll(node.exprs());
        if (exprs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new And(exprs, node.type()));
    }

    @Override
    public Optional<Expr> visitOr(Or node) {
        List<Expr> exprs = rewriteAll(node.exprs());
        if (exprs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Or(exprs, node.type()));
    }

    @Override
    public Optional<Expr> visitNot(Not node) {
        return rewrite(node.expr()).map(expr -> new Not(expr, node.type()));
    }

    @Override
    public Optional<Expr> visitCall(Call node) {
        List<Expr> params = node.params() == null ? null : rewriteAll(node.params());
        return Optional.of(new Call(node.name(), rewriteAll(node.args()), params, node.distinct(), node.type()));
    }

    @Override
    public Optional<Expr> visitArray(ArrayExpr node) {
        return Optional.of(new ArrayExpr(rewriteAll(node.exprs()), node.type()));
    }

    @Override
    public Optional<Expr> visitTuple(TupleExpr node) {
        return Optional.of(new TupleExpr(rewriteAll(node.exprs()), node.type()));
    }

    @Override
    public Optional<Expr> visitAlias(Alias node) {
        return rewrite(node.expr()).map(expr -> new Alias(node.alias(), expr, node.hidden(), node.type()));
    }

    @Override
    public Optional<Expr> visitLambda(Lambda node) {
        return rewrite(node.expr()).map(expr -> new Lambda(node.args(), expr, node.type()));
    }

    @Override
    public Optional<Expr> visitSelectQuery(SelectQuery node) {
        List<Expr> select = rewriteAll(node.select());
        if (select.isEmpty()) {
            return Optional.empty();
        }
        JoinExpr selectFrom = null;
        if (node.selectFrom() != null) {
            Optional<Expr> rewritten = rewrite(node.selectFrom());
            if (rewritten.isPresent()) {
                if (!(rewritten.get() instanceof JoinExpr joinExpr)) {
                    throw new ImpossibleAstError("FROM clause rewritten into " + rewritten.get().getClass().getSimpleName());
                }
                selectFrom = joinExpr;
            }
        }
        ArrayJoin arrayJoin = null;
        if (node.arrayJoin() != null) {
            List<Expr> exprs = rewriteAll(node.arrayJoin().exprs());
            if (!exprs.isEmpty()) {
                arrayJoin = new ArrayJoin(node.arrayJoin().kind(), exprs);
            }
        }
        LimitBy limitBy = null;
        if (node.limitBy() != null) {
            Expr n = rewriteOptional(node.limitBy().n());
            if (n != null) {
                limitBy = new LimitBy(n, rewriteOptional(node.limitBy().offset()), rewriteAll(node.limitBy().exprs()));
            }
        }
        return Optional.of(SelectQuery.builder()
                .select(select)
                .distinct(node.distinct())
                .selectFrom(selectFrom)
                .arrayJoin(arrayJoin)
                .prewhere(rewriteOptional(node.prewhere()))
                .where(rewriteOptional(node.where()))
                .groupBy(rewriteAll(node.groupBy()))
                .having(rewriteOptional(node.having()))
                .orderBy(rewriteOrder(node.orderBy()))
                .limit(rewriteOptional(node.limit()))
                .offset(rewriteOptional(node.offset()))
                .limitBy(limitBy)
                .type(node.type())
                .build());
    }

    @Override
    public Optional<Expr> visitJoinExpr(JoinExpr node) {
        Optional<Expr> table = rewrite(node.table());
        if (table.isEmpty()) {
            return Optional.empty();
        }
        JoinConstraint constraint = null;
        if (node.constraint() != null) {
            Expr expr = rewriteOptional(node.constraint().expr());
            if (expr != null) {
                constraint = node.constraint().withExpr(expr);
            }
        }
        JoinExpr nextJoin = null;
        if (node.nextJoin() != null) {
            Optional<Expr> next = rewrite(node.nextJoin());
            if (next.isPresent()) {
                nextJoin = (JoinExpr) next.get();
            }
        }
        return Optional.of(new JoinExpr(node.joinType(), table.get(), node.alias(), constraint, node.sample(),
                nextJoin, node.type()));
    }

    @Override
    public Optional<Expr> visitOrderExpr(OrderExpr node) {
        return rewrite(node.expr()).map(expr -> new OrderExpr(expr, node.order(), node.type()));
    }

    @Override
    public Optional<Expr> visitWindowFunction(WindowFunction node) {
        WindowExpr over = new WindowExpr(rewriteAll(node.over().partitionBy()), rewriteOrder(node.over().orderBy()),
                node.over().frame());
        return Optional.of(new WindowFunction(node.name(), rewriteAll(node.args()), over, node.type()));
    }
}
