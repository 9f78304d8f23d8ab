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

package com.strata.database;

import com.google.common.collect.ImmutableList;
import com.strata.ast.Expr;

import java.util.List;
import java.util.Objects;

/**
 * A field that joins another table on demand.
 *
 * @param joinTable  the joined table, physical or lazy
 * @param joinType   printed join keyword, e.g. {@code LEFT JOIN}
 * @param fromFields fields of the source table the constraint reads
 * @param toFields   fields of the joined table the constraint reads
 * @param constraint builds the unresolved ON expression from the two aliases
 */
public record LazyJoin(String name, Table joinTable, String joinType, List<String> fromFields, List<String> toFields,
                       ConstraintFactory constraint, boolean hidden) implements DatabaseField {

    @FunctionalInterface
    public interface ConstraintFactory {
        Expr build(String fromAlias, String toAlias);
    }

    public LazyJoin {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(joinTable, "joinTable must not be null");
        Objects.requireNonNull(joinType, "joinType must not be null");
        fromFields = ImmutableList.copyOf(fromFields);
        toFields = ImmutableList.copyOf(toFields);
        Objects.requireNonNull(constraint, "constraint must not be null");
    }

    public boolean isLeftJoin() {
        return joinType.startsWith("LEFT");
    }

    @Override
    public String toString() {
        return "LazyJoin[" + name + " -> " + joinTable.name() + "]";
    }
}
