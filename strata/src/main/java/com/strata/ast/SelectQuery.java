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
import java.util.ArrayList;
import java.util.List;

/**
 * A single SELECT. Every clause except {@code select} is optional. Use {@link #builder()} to
 * construct and {@link #toBuilder()} to derive a modified copy.
 */
public record SelectQuery(List<Expr> select, boolean distinct, @Nullable JoinExpr selectFrom,
                          @Nullable ArrayJoin arrayJoin, @Nullable Expr prewhere, @Nullable Expr where,
                          List<Expr> groupBy, @Nullable Expr having, List<OrderExpr> orderBy,
                          @Nullable Expr limit, @Nullable Expr offset, @Nullable LimitBy limitBy,
                          @Nullable ResolvedType type) implements Expr {
    public SelectQuery {
        select = ImmutableList.copyOf(select);
        groupBy = ImmutableList.copyOf(groupBy);
        orderBy = ImmutableList.copyOf(orderBy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.select = new ArrayList<>(select);
        builder.distinct = distinct;
        builder.selectFrom = selectFrom;
        builder.arrayJoin = arrayJoin;
        builder.prewhere = prewhere;
        builder.where = where;
        builder.groupBy = new ArrayList<>(groupBy);
        builder.having = having;
        builder.orderBy = new ArrayList<>(orderBy);
        builder.limit = limit;
        builder.offset = offset;
        builder.limitBy = limitBy;
        builder.type = type;
        return builder;
    }

    public SelectQuery withWhere(@Nullable Expr newWhere) {
        return toBuilder().where(newWhere).build();
    }

    public SelectQuery withSelectFrom(@Nullable JoinExpr newSelectFrom) {
        return toBuilder().selectFrom(newSelectFrom).build();
    }

    public SelectQuery withLimit(@Nullable Expr newLimit) {
        return toBuilder().limit(newLimit).build();
    }

    @Override
    public SelectQuery withType(@Nullable ResolvedType type) {
        return toBuilder().type(type).build();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSelectQuery(this);
    }

    public static final class Builder {
        private List<Expr> select = new ArrayList<>();
        private boolean distinct;
        private JoinExpr selectFrom;
        private ArrayJoin arrayJoin;
        private Expr prewhere;
        private Expr where;
        private List<Expr> groupBy = new ArrayList<>();
        private Expr having;
        private List<OrderExpr> orderBy = new ArrayList<>();
        private Expr limit;
        private Expr offset;
        private LimitBy limitBy;
        private ResolvedType type;

        private Builder() {
        }

        public Builder select(List<Expr> select) {
            this.select = new ArrayList<>(select);
            return this;
        }

        public Builder select(Expr... select) {
            return select(List.of(select));
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder selectFrom(@Nullable JoinExpr selectFrom) {
            this.selectFrom = selectFrom;
            return this;
        }

        public Builder arrayJoin(@Nullable ArrayJoin arrayJoin) {
            this.arrayJoin = arrayJoin;
            return this;
        }

        public Builder prewhere(@Nullable Expr prewhere) {
            this.prewhere = prewhere;
            return this;
        }

        public Builder where(@Nullable Expr where) {
            this.where = where;
            return this;
        }

        public Builder groupBy(List<Expr> groupBy) {
            this.groupBy = new ArrayList<>(groupBy);
            return this;
        }

        public Builder having(@Nullable Expr having) {
            this.having = having;
            return this;
        }

        public Builder orderBy(List<OrderExpr> orderBy) {
            this.orderBy = new ArrayList<>(orderBy);
            return this;
        }

        public Builder limit(@Nullable Expr limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(@Nullable Expr offset) {
            this.offset = offset;
            return this;
        }

        public Builder limitBy(@Nullable LimitBy limitBy) {
            this.limitBy = limitBy;
            return this;
        }

        public Builder type(@Nullable ResolvedType type) {
            this.type = type;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(select, distinct, selectFrom, arrayJoin, prewhere, where, groupBy, having,
                    orderBy, limit, offset, limitBy, type);
        }
    }
}
