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

package com.strata.properties;

import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.LazyJoinType;
import com.strata.ast.types.Types;
import com.strata.catalog.MaterializedProperty;
import com.strata.catalog.PropertyStorage;
import com.strata.compiler.CompileContext;
import com.strata.database.Database;
import com.strata.database.LazyJoin;
import com.strata.database.Table;

import java.util.List;

/**
 * Reads a property from its slot in the typed side table. The read goes through the table's hidden
 * slot join, which the join materializer turns into a {@code LEFT JOIN property_slots}. Values are
 * already typed, so no conversion is applied.
 */
public class SideTableSlotStrategy implements PropertyAccessStrategy {

    @Override
    public Expr read(PropertyAccess access, CompileContext context) {
        MaterializedProperty entry = access.entry(PropertyStorage.SIDE_TABLE_SLOT).orElseThrow();
        String joinField = Database.slotFieldName(entry.slot());
        LazyJoin slotJoin = (LazyJoin) Types.tableOf(access.tableType()).getField(joinField);
        String valueColumn = entry.valueType().slotValueColumn();
        LazyJoinType joinType = new LazyJoinType(access.tableType(), joinField, slotJoin);
        return new Field(List.of(joinType.alias(), valueColumn), new FieldType(valueColumn, joinType));
    }

    @Override
    public String getName() {
        return "SideTableSlot";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public boolean canApply(PropertyAccess access, CompileContext context) {
        if (access.isNested()) {
            return false;
        }
        return access.entry(PropertyStorage.SIDE_TABLE_SLOT)
                .map(entry -> {
                    Table table = Types.tableOf(access.tableType());
                    return table != null && table.getField(Database.slotFieldName(entry.slot())) instanceof LazyJoin;
                })
                .orElse(false);
    }
}
