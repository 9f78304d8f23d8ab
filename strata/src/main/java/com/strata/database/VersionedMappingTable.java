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
import com.strata.ast.JoinExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.types.ValueKind;
import com.strata.compiler.CompileContext;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.strata.ast.Exprs.*;

/**
 * Latest {@code distinct_id -> person_id} mapping of a versioned raw mapping table, either the full
 * distinct id table or the override table. Rows whose last version is deleted are dropped.
 */
public class VersionedMappingTable extends LazyTable {
    private final PhysicalTable rawTable;

    VersionedMappingTable(String name, PhysicalTable rawTable) {
        super(name);
        this.rawTable = rawTable;
        addField(ColumnField.of("distinct_id", ValueKind.STRING));
        addField(ColumnField.of("person_id", ValueKind.UUID));
    }

    void addPersonJoin(PersonsTable persons) {
        addField(new LazyJoin("person", persons, "LEFT JOIN", List.of("person_id"), List.of("id"),
                (from, to) -> eq(field(from, "person_id"), field(to, "id")), false));
    }

    @Override
    public SelectQuery materialize(Set<String> requestedFields, @Nullable Expr pushedFilter, CompileContext context) {
        String raw = rawTable.name();
        List<Expr> select = new ArrayList<>();
        select.add(field(raw, "distinct_id"));
        for (String name : requestedFields) {
            if (name.equals("distinct_id")) {
                continue;
            }
            select.add(alias(name, call("argMax", field(raw, name), field(raw, "version"))));
        }
        return SelectQuery.builder()
                .select(select)
                .selectFrom(JoinExpr.from(field(raw), null))
                .where(pushedFilter)
                .groupBy(List.of(field(raw, "distinct_id")))
                .having(eq(call("argMax", field(raw, "is_deleted"), field(raw, "version")), constant(0)))
                .build();
    }
}
