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

package com.strata.ast.types;

import com.strata.database.ColumnField;
import com.strata.database.DatabaseField;
import com.strata.database.ExpressionField;
import com.strata.database.Table;

import javax.annotation.Nullable;

/**
 * Lookups over resolved types shared by the passes and the printers.
 */
public final class Types {

    private Types() {
    }

    /**
     * Name under which a table-like type is referenced in printed SQL. Unaliased subqueries have none.
     */
    @Nullable
    public static String aliasOf(TableOrSelectType type) {
        if (type instanceof TableType tableType) {
            return tableType.table().name();
        }
        if (type instanceof TableAliasType aliasType) {
            return aliasType.alias();
        }
        if (type instanceof LazyTableType lazyTableType) {
            return lazyTableType.alias();
        }
        if (type instanceof LazyJoinType lazyJoinType) {
            return lazyJoinType.alias();
        }
        if (type instanceof SelectQueryAliasType aliasType) {
            return aliasType.alias();
        }
        return null;
    }

    /**
     * Underlying table of a table or table alias type, null for subqueries and lazy joins.
     */
    @Nullable
    public static Table tableOf(TableOrSelectType type) {
        if (type instanceof TableType tableType) {
            return tableType.table();
        }
        if (type instanceof TableAliasType aliasType) {
            return aliasType.tableType().table();
        }
        if (type instanceof LazyTableType lazyTableType) {
            return lazyTableType.table();
        }
        if (type instanceof LazyJoinType lazyJoinType) {
            return lazyJoinType.lazyJoin().joinTable();
        }
        return null;
    }

    /**
     * Schema field behind a field type, when the field belongs to a table rather than a subquery.
     */
    @Nullable
    public static DatabaseField databaseFieldOf(FieldType fieldType) {
        Table table = tableOf(fieldType.tableType());
        if (table == null) {
            return null;
        }
        return table.getField(fieldType.name());
    }

    /**
     * Strips column alias references down to the type they point at.
     */
    public static ResolvedType unwrapAliases(ResolvedType type) {
        ResolvedType current = type;
        while (current instanceof FieldAliasType aliasType) {
            current = aliasType.type();
        }
        return current;
    }

    /**
     * Whether a value of this type may be NULL at runtime. Unknown cases are treated as nullable.
     */
    public static boolean isNullable(@Nullable ResolvedType type) {
        if (type == null) {
            return true;
        }
        ResolvedType unwrapped = unwrapAliases(type);
        if (unwrapped instanceof ConstantType constantType) {
            return constantType.nullable();
        }
        if (unwrapped instanceof CallType callType) {
            return callType.returnType().nullable();
        }
        if (unwrapped instanceof AsteriskType) {
            return false;
        }
        if (unwrapped instanceof FieldType fieldType) {
            return isFieldNullable(fieldType);
        }
        return true;
    }

    private static boolean isFieldNullable(FieldType fieldType) {
        TableOrSelectType tableType = fieldType.tableType();
        if (tableType instanceof SelectQueryAliasType aliasType) {
            return isNullable(aliasType.selectQueryType().columns().get(fieldType.name()));
        }
        if (tableType instanceof SelectQueryType selectQueryType) {
            return isNullable(selectQueryType.columns().get(fieldType.name()));
        }
        DatabaseField field = databaseFieldOf(fieldType);
        if (field instanceof ColumnField columnField) {
            return columnField.nullable();
        }
        if (field instanceof ExpressionField) {
            return true;
        }
        return field == null;
    }

    /**
     * Value kind carried by a type, {@link ValueKind#UNKNOWN} when the resolver could not tell.
     */
    public static ValueKind kindOf(@Nullable ResolvedType type) {
        if (type == null) {
            return ValueKind.UNKNOWN;
        }
        ResolvedType unwrapped = unwrapAliases(type);
        if (unwrapped instanceof ConstantType constantType) {
            return constantType.kind();
        }
        if (unwrapped instanceof CallType callType) {
            return callType.returnType().kind();
        }
        if (unwrapped instanceof FieldType fieldType) {
            if (databaseFieldOf(fieldType) instanceof ColumnField columnField) {
                return columnField.kind();
            }
            TableOrSelectType tableType = fieldType.tableType();
            if (tableType instanceof SelectQueryAliasType aliasType) {
                return kindOf(aliasType.selectQueryType().columns().get(fieldType.name()));
            }
        }
        if (unwrapped instanceof PropertyType) {
            return ValueKind.STRING;
        }
        return ValueKind.UNKNOWN;
    }
}
