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

import com.google.common.collect.ImmutableMap;
import com.strata.ast.Expr;
import com.strata.ast.JoinExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.types.TableOrSelectType;
import com.strata.ast.types.ValueKind;
import com.strata.compiler.CompileContext;
import com.strata.pushdown.PushdownTarget;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.strata.ast.Exprs.*;

/**
 * Latest version of every non-deleted person. Raw person rows are versioned, so every column is read
 * with {@code argMax(column, version)} grouped by {@code id}.
 */
public class PersonsTable extends LazyTable {
    public static final String NAME = "persons";
    public static final String CATALOG_TABLE = "person";

    private final PhysicalTable rawTable;

    PersonsTable(PhysicalTable rawTable) {
        super(NAME);
        this.rawTable = rawTable;
        addField(ColumnField.of("id", ValueKind.UUID));
        addField(ColumnField.of("created_at", ValueKind.DATETIME));
        addField(JsonPropertiesField.of("properties", CATALOG_TABLE));
        addField(ColumnField.of("is_identified", ValueKind.BOOLEAN));
    }

    @Override
    public String entityIdField() {
        return "id";
    }

    @Override
    public SelectQuery materialize(Set<String> requestedFields, @Nullable Expr pushedFilter, CompileContext context) {
        String raw = rawTable.name();
        List<Expr> select = new ArrayList<>();
        select.add(field(raw, "id"));
        for (String name : requestedFields) {
            if (name.equals("id")) {
                continue;
            }
            select.add(alias(name, call("argMax", field(raw, name), field(raw, "version"))));
        }

        Expr where = null;
        if (pushedFilter != null) {
            SelectQuery matching = SelectQuery.builder()
                    .select(field("id"))
                    .selectFrom(JoinExpr.from(field(raw), null))
                    .where(pushedFilter)
                    .build();
            where = call("in", field(raw, "id"), matching);
        }

        return SelectQuery.builder()
                .select(select)
                .selectFrom(JoinExpr.from(field(raw), null))
                .where(where)
                .groupBy(List.of(field(raw, "id")))
                .having(eq(call("argMax", field(raw, "is_deleted"), field(raw, "version")), constant(0)))
                .build();
    }

    @Override
    public PushdownTarget pushdownTarget(TableOrSelectType scope, CompileContext context) {
        Map<String, Expr> exact = new LinkedHashMap<>();
        for (DatabaseField databaseField : fields().values()) {
            if (databaseField instanceof ColumnField || databaseField instanceof JsonPropertiesField) {
                exact.put(databaseField.name(), field(databaseField.name()));
            }
        }
        return new PushdownTarget(scope, exact, ImmutableMap.of());
    }
}
