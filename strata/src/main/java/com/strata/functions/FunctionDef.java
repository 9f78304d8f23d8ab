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

package com.strata.functions;

import com.strata.ast.types.ValueKind;
import com.strata.printer.Dialect;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A function or aggregation known to the compiler.
 *
 * @param maxArgs     upper arity bound, -1 for variadic
 * @param nullability how the result's nullability follows from the arguments
 * @param clickhouse  ClickHouse function name
 * @param postgres    Postgres function name or template, null when Postgres has no equivalent. A template
 *                    contains {@code {N}} for argument N, {@code {N*}} for arguments from N joined by
 *                    commas and {@code {N*:SEP}} joined by SEP
 */
public record FunctionDef(String name, int minArgs, int maxArgs, boolean aggregate, ValueKind returnKind,
                          Nullability nullability, String clickhouse, @Nullable String postgres) {

    public enum Nullability {
        NEVER,
        ALWAYS,
        FROM_ARGS
    }

    public FunctionDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(returnKind, "returnKind must not be null");
        Objects.requireNonNull(nullability, "nullability must not be null");
        Objects.requireNonNull(clickhouse, "clickhouse must not be null");
    }

    public boolean acceptsArity(int arity) {
        return arity >= minArgs && (maxArgs < 0 || arity <= maxArgs);
    }

    public String arityDescription() {
        if (maxArgs < 0) {
            return "at least " + minArgs;
        }
        if (minArgs == maxArgs) {
            return String.valueOf(minArgs);
        }
        return minArgs + " to " + maxArgs;
    }

    /**
     * Name or template for the dialect, null when the dialect has none.
     */
    @Nullable
    public String nameFor(Dialect dialect) {
        switch (dialect) {
            case CLICKHOUSE:
                return clickhouse;
            case POSTGRES:
                return postgres;
            default:
                return name;
        }
    }
}
