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
import com.strata.ast.types.FieldType;
import com.strata.ast.types.Types;
import com.strata.catalog.MaterializedProperty;
import com.strata.catalog.PropertyStorage;
import com.strata.compiler.CompileContext;

/**
 * Reads a property promoted to its own column. A nullable column keeps the JSON null normalization,
 * a non-nullable one is read bare.
 */
public class DedicatedColumnStrategy implements PropertyAccessStrategy {

    @Override
    public Expr read(PropertyAccess access, CompileContext context) {
        MaterializedProperty entry = access.entry(PropertyStorage.DEDICATED_COLUMN).orElseThrow();
        FieldType columnType = new FieldType(entry.column(), access.tableType());
        Expr column = PropertyExprs.column(columnType);
        Expr raw;
        if (access.isNested()) {
            raw = PropertyExprs.extractJson(column, access.nestedChain(), !access.isReserved());
        } else if (Types.isNullable(columnType) && !access.isReserved()) {
            raw = PropertyExprs.normalizeNulls(column);
        } else {
            raw = column;
        }
        return PropertyExprs.typed(raw, access.valueType(), context.settings().timezone());
    }

    @Override
    public String getName() {
        return "DedicatedColumn";
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public boolean canApply(PropertyAccess access, CompileContext context) {
        return access.entry(PropertyStorage.DEDICATED_COLUMN)
                .map(entry -> {
                    var table = Types.tableOf(access.tableType());
                    return table != null && table.hasField(entry.column());
                })
                .orElse(false);
    }
}
