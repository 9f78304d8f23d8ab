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

import com.strata.ast.And;
import com.strata.ast.ArrayExpr;
import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Not;
import com.strata.ast.TupleExpr;
import com.strata.ast.types.ConstantType;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.Types;
import com.strata.ast.types.ValueKind;
import com.strata.catalog.MaterializedProperty;
import com.strata.catalog.PropertyStorage;
import com.strata.catalog.PropertyValueType;
import com.strata.compiler.CompileContext;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Reads a property bucketed into a grouped map column. A missing key reads as the empty string, so the
 * generic read guards with {@code has}. Under {@link MapColumnMode#OPTIMIZED} equality, IN and null
 * checks are rewritten into forms the map's key index can serve. The key literal inside {@code has} is
 * printed inline for that reason.
 */
public class MapColumnStrategy implements PropertyAccessStrategy {

    @Override
    public Expr read(PropertyAccess access, CompileContext context) {
        Expr element = element(access);
        if (access.isReserved()) {
            return element;
        }
        Expr raw = PropertyExprs.call("if", ValueKind.STRING, true, has(access), element, PropertyExprs.nullConstant());
        return PropertyExprs.typed(raw, access.valueType(), context.settings().timezone());
    }

    @Nullable
    @Override
    public Expr compare(PropertyAccess access, CompareOperator op, Expr other, CompileContext context) {
        if (context.modifiers().mapColumnMode() != MapColumnMode.OPTIMIZED
                || access.valueType() != PropertyValueType.STRING) {
            return null;
        }
        if (op == CompareOperator.EQ && other instanceof Constant constant) {
            if (constant.isNull()) {
                return new Not(has(access), ConstantType.BOOLEAN);
            }
            if (!(constant.value() instanceof String value)) {
                return null;
            }
            Expr equals = new CompareOperation(CompareOperator.EQ, element(access), other, ConstantType.BOOLEAN);
            if (value.isEmpty()) {
                return new And(List.of(has(access), equals), ConstantType.BOOLEAN);
            }
            return equals;
        }
        if (op == CompareOperator.NOT_EQ && other instanceof Constant constant && constant.isNull()) {
            return has(access);
        }
        if (op == CompareOperator.IN) {
            List<Expr> values = valuesOf(other);
            if (values == null) {
                return null;
            }
            boolean containsEmpty = false;
            for (Expr value : values) {
                if (!(value instanceof Constant constant) || !(constant.value() instanceof String)) {
                    return null;
                }
                if (((String) constant.value()).isEmpty()) {
                    containsEmpty = true;
                }
            }
            Expr in = new CompareOperation(CompareOperator.IN, element(access),
                    new TupleExpr(values, ConstantType.of(ValueKind.TUPLE, false)), ConstantType.BOOLEAN);
            if (containsEmpty) {
                return new And(List.of(has(access), in), ConstantType.BOOLEAN);
            }
            return in;
        }
        return null;
    }

    @Nullable
    private List<Expr> valuesOf(Expr other) {
        if (other instanceof TupleExpr tuple) {
            return tuple.exprs();
        }
        if (other instanceof ArrayExpr array) {
            return array.exprs();
        }
        return null;
    }

    private FieldType mapColumn(PropertyAccess access) {
        MaterializedProperty entry = access.entry(PropertyStorage.MAP_COLUMN).orElseThrow();
        return new FieldType(entry.column(), access.tableType());
    }

    private Expr has(PropertyAccess access) {
        return PropertyExprs.call("has", ValueKind.BOOLEAN, false, PropertyExprs.column(mapColumn(access)),
                PropertyExprs.inlined(access.property()));
    }

    private Expr element(PropertyAccess access) {
        return PropertyExprs.call("arrayElement", ValueKind.STRING, false, PropertyExprs.column(mapColumn(access)),
                PropertyExprs.constant(access.property()));
    }

    @Override
    public String getName() {
        return "MapColumn";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public boolean canApply(PropertyAccess access, CompileContext context) {
        if (context.modifiers().mapColumnMode() == MapColumnMode.DISABLED || access.isNested()) {
            return false;
        }
        return access.entry(PropertyStorage.MAP_COLUMN)
                .map(entry -> {
                    var table = Types.tableOf(access.tableType());
                    return table != null && table.hasField(entry.column());
                })
                .orElse(false);
    }
}
