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

import com.strata.ast.Expr;
import com.strata.ast.SelectQuery;
import com.strata.ast.types.TableOrSelectType;
import com.strata.compiler.CompileContext;
import com.strata.pushdown.PushdownTarget;

import javax.annotation.Nullable;
import java.util.Set;

/**
 * A virtual table with no physical counterpart. Before printing, every use is replaced by the subquery
 * {@link #materialize} builds over raw tables.
 */
public abstract class LazyTable extends Table {

    protected LazyTable(String name) {
        super(name);
    }

    /**
     * Builds the unresolved subquery selecting {@code requestedFields}, each under its own name.
     *
     * @param pushedFilter a filter in the subquery's own names, already proven safe to apply to its source
     *                     rows, or null
     */
    public abstract SelectQuery materialize(Set<String> requestedFields, @Nullable Expr pushedFilter,
                                            CompileContext context);

    /**
     * Describes which fields of this table a pushed-down filter may reference when the table is used as
     * {@code scope}. Null when the table accepts no pushdown.
     */
    @Nullable
    public PushdownTarget pushdownTarget(TableOrSelectType scope, CompileContext context) {
        return null;
    }
}
