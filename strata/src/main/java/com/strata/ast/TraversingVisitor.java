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

import javax.annotation.Nullable;
import java.util.List;

/**
 * Visits every node of a tree and returns nothing. Collectors extend it and override the node kinds
 * they care about, calling {@code super} to keep descending.
 */
public class TraversingVisitor implements ExprVisitor<Void> {

    public void traverse(@Nullable Expr node) {
        if (node != null) {
            node.accept(this);
        }
    }

    protected void traverseAll(List<? extends Expr> nodes) {
        for (Expr node : nodes) {
            traverse(node);
        }
    }

    @Override
    public Void visitConstant(Constant node) {
        return null;
    }

    @Override
    public Void visitField(Field node) {
        return null;
    }

    @Override
    public Void visitCompareOperation(CompareOperation node) {
        traverse(node.left());
        traverse(node.right());
        return null;
    }

    @Override
    public Void visitAnd(And node) {
        traverseAll(node.exprs());
        return null;
    }

    @Override
    public Void visitOr(Or node) {
        traverseAll(node.exprs());
        return null;
    }

    @Override
    public Void visitNot(Not node) {
        traverse(node.expr());
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        traverseAll(node.args());
        if (node.params() != null) {
            traverseAll(node.params());
        }
        return null;
    }

    @Override
    public Void visitArray(ArrayExpr node) {
        traverseAll(node.exprs());
        return null;
    }

    @Override
    public Void visitTuple(TupleExpr node) {
        traverseAll(node.exprs());
        return null;
    }

    @Override
    public Void visitAlias(Alias node) {
        traverse(node.expr());
        return null;
    }

    @Override
    public Void visitLambda(Lambda node) {
        traverse(node.expr());
        return null;
    }

    @Override
    public Void visitSelectQuery(SelectQuery node) {
        traverse(node.selectFrom());
        if (node.arrayJoin() != null) {
            traverseAll(node.arrayJoin().exprs());
        }
        traverseAll(node.select());
        traverse(node.prewhere());
        traverse(node.where());
        traverseAll(node.groupBy());
        traverse(node.having());
        traverseAll(node.orderBy());
        traverse(node.limit());
        traverse(node.offset());
        if (node.limitBy() != null) {
            traverse(node.limitBy().n());
            traverse(node.limitBy().offset());
            traverseAll(node.limitBy().exprs());
        }
        return null;
    }

    @Override
    public Void visitJoinExpr(JoinExpr node) {
        traverse(node.table());
        if (node.constraint() != null) {
            traverse(node.constraint().expr());
        }
        traverse(node.nextJoin());
        return null;
    }

    @Override
    public Void visitOrderExpr(OrderExpr node) {
        traverse(node.expr());
        return null;
    }

    @Override
    public Void visitWindowFunction(WindowFunction node) {
        traverseAll(node.args());
        traverseAll(node.over().partitionBy());
        traverseAll(node.over().orderBy());
        return null;
    }
}
