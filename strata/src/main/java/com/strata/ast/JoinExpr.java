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
import java.util.Objects;

/**
 * One element of the FROM chain. {@code table} is a {@link Field} naming a table or a
 * {@link SelectQuery}. The first element has no join type and no constraint; each following
 * element hangs off {@code nextJoin}.
 */
public record JoinExpr(@Nullable String joinType, Expr table, @Nullable String alias,
                       @Nullable JoinConstraint constraint, @Nullable SampleExpr sample,
                       @Nullable JoinExpr nextJoin, @Nullable ResolvedType type) implements Expr {
    public JoinExpr {
        Objects.requireNonNull(table, "table must not be null");
    }

    public static JoinExpr from(Expr table, @Nullable String alias) {
        return new JoinExpr(null, table, alias, null, null, null, null);
    }

    public JoinExpr withNextJoin(@Nullable JoinExpr next) {
        return new JoinExpr(joinType, table, alias, constraint, sample, next, type);
    }

    public JoinExpr withTable(Expr newTable) {
        return new JoinExpr(joinType, newTable, alias, constraint, sample, nextJoin, type);
    }

    public JoinExpr withConstraint(@Nullable JoinConstraint newConstraint) {
        return new JoinExpr(joinType, table, alias, newConstraint, sample, nextJoin, type);
    }

    /**
     * Returns a new chain with {@code join} appended after the last element. Existing elements keep
     * their order.
     */
    public JoinExpr append(JoinExpr join) {
        if (nextJoin == null) {
            return withNextJoin(join);
        }
        return withNextJoin(nextJoin.append(join));
    }

    /**
     * Flattens the chain into a list, first element first.
     */
    public List<JoinExpr> toList() {
        List<JoinExpr> result = new ArrayList<>();
        JoinExpr current = this;
        while (current != null) {
            result.add(current);
            current = current.nextJoin();
        }
        return result;
    }

    /**
     * Rebuilds a chain from a list produced by {@link #toList()} (possibly edited).
     */
    public static JoinExpr chain(List<JoinExpr> joins) {
        if (joins.isEmpty()) {
            throw new IllegalArgumentException("join chain must not be empty");
        }
        JoinExpr next = null;
        for (int i = joins.size() - 1; i >= 0; i--) {
            next = joins.get(i).withNextJoin(next);
        }
        return next;
    }

    @Override
    public JoinExpr withType(@Nullable ResolvedType type) {
        return new JoinExpr(joinType, table, alias, constraint, sample, nextJoin, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitJoinExpr(this);
    }
}
