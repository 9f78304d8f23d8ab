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

package com.strata.pushdown;

import com.google.common.collect.ImmutableMap;
import com.strata.ast.Expr;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.TableOrSelectType;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * The scope a filter is pushed into. A field is reachable when it belongs to {@code scope}. Reachable
 * fields are either exact, rewritten to an equivalent expression in the target's own names, or
 * approximate, rewritten to an expression that only bounds the logical value within the lookback
 * window. Reachable fields in neither map are undecidable.
 */
public final class PushdownTarget {
    private final TableOrSelectType scope;
    private final Map<String, Expr> exactFields;
    private final Map<String, Expr> approximateFields;

    public PushdownTarget(TableOrSelectType scope, Map<String, Expr> exactFields, Map<String, Expr> approximateFields) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.exactFields = ImmutableMap.copyOf(exactFields);
        this.approximateFields = ImmutableMap.copyOf(approximateFields);
    }

    public TableOrSelectType scope() {
        return scope;
    }

    public boolean isReachable(FieldType fieldType) {
        return scope.equals(fieldType.tableType());
    }

    /**
     * Local expression equivalent to the field, null when the field is not exact in this target.
     */
    @Nullable
    public Expr exactField(FieldType fieldType) {
        return isReachable(fieldType) ? exactFields.get(fieldType.name()) : null;
    }

    /**
     * Local expression approximating the field, null when the field is not approximate in this target.
     */
    @Nullable
    public Expr approximateField(FieldType fieldType) {
        return isReachable(fieldType) ? approximateFields.get(fieldType.name()) : null;
    }
}
