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

import com.strata.ast.types.ValueKind;

import java.util.Objects;

/**
 * A physical column. {@code physicalName} differs from {@code name} when the logical name is taken by a
 * derived field, e.g. the raw {@code person_id} of events under the override join strategy.
 */
public record ColumnField(String name, String physicalName, ValueKind kind, boolean nullable,
                          boolean hidden) implements DatabaseField {
    public ColumnField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(physicalName, "physicalName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ColumnField of(String name, ValueKind kind) {
        return new ColumnField(name, name, kind, false, false);
    }

    public static ColumnField nullable(String name, ValueKind kind) {
        return new ColumnField(name, name, kind, true, false);
    }

    public static ColumnField hidden(String name, ValueKind kind, boolean nullable) {
        return new ColumnField(name, name, kind, nullable, true);
    }
}
