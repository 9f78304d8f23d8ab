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

import com.strata.ast.ArrayExpr;
import com.strata.ast.Call;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.types.CallType;
import com.strata.ast.types.ConstantType;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.ValueKind;
import com.strata.catalog.PropertyValueType;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for the typed expressions property reads are replaced with. The selector runs after the
 * resolver, so everything it emits carries a type.
 */
final class PropertyExprs {
    private static final String QUOTE_PATTERN = "^\"|\"$";

    private PropertyExprs() {
    }

    static Call call(String name, ValueKind kind, boolean nullable, Expr... args) {
        return call(name, kind, nullable, Arrays.asList(args));
    }

    static Call call(String name, ValueKind kind, boolean nullable, List<Expr> args) {
        return new Call(name, args, null, false, new CallType(name, ConstantType.of(kind, nullable)));
    }

    static Constant constant(Object value) {
        return new Constant(value, false, ConstantType.of(kindOf(value), value == null));
    }

    static Constant inlined(Object value) {
        return new Constant(value, true, ConstantType.of(kindOf(value), false));
    }

    static Constant nullConstant() {
        return new Constant(null, false, ConstantType.UNKNOWN);
    }

    static Field column(FieldType fieldType) {
        return new Field(List.of(fieldType.name()), fieldType);
    }

    private static ValueKind kindOf(Object value) {
        if (value instanceof Boolean) {
            return ValueKind.BOOLEAN;
        }
        if (value instanceof Long || value instanceof Integer) {
            return ValueKind.INTEGER;
        }
        if (value instanceof String) {
            return ValueKind.STRING;
        }
        return ValueKind.UNKNOWN;
    }

    /**
     * {@code replaceRegexpAll(nullIf(nullIf(JSONExtractRaw(blob, keys...), ''), 'null'), '^"|"$', '')}.
     * Without null normalization the {@code nullIf} pair is left out and the result is non-nullable.
     */
    static Expr extractJson(Expr blob, List<String> keys, boolean normalizeNulls) {
        List<Expr> args = new ArrayList<>();
        args.add(blob);
        for (String key : keys) {
            args.add(constant(key));
        }
        Expr raw = call("JSONExtractRaw", ValueKind.STRING, normalizeNulls, args);
        if (normalizeNulls) {
            raw = normalizeNulls(raw);
        }
        return call("replaceRegexpAll", ValueKind.STRING, normalizeNulls, raw, constant(QUOTE_PATTERN), constant(""));
    }

    /**
     * {@code nullIf(nullIf(value, ''), 'null')}.
     */
    static Expr normalizeNulls(Expr value) {
        return call("nullIf", ValueKind.STRING, true,
                call("nullIf", ValueKind.STRING, true, value, constant("")), constant("null"));
    }

    /**
     * Converts a string read into the property's declared type.
     */
    static Expr typed(Expr raw, PropertyValueType valueType, ZoneId timezone) {
        switch (valueType) {
            case BOOLEAN:
                return call("transform", ValueKind.BOOLEAN, true,
                        call("toString", ValueKind.STRING, true, raw),
                        new ArrayExpr(List.of(constant("true"), constant("false")), ConstantType.of(ValueKind.ARRAY, false)),
                        new ArrayExpr(List.of(constant(true), constant(false)), ConstantType.of(ValueKind.ARRAY, false)),
                        nullConstant());
            case NUMERIC:
                return call("toFloat64OrNull", ValueKind.FLOAT, true, raw);
            case DATETIME:
                return call("parseDateTime64BestEffortOrNull", ValueKind.DATETIME, true, raw, constant(6L),
                        constant(timezone.getId()));
            default:
                return raw;
        }
    }
}
