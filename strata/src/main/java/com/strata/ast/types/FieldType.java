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

import java.util.Objects;

/**
 * A column {@code name} of a table-like type.
 */
public record FieldType(String name, TableOrSelectType tableType) implements ResolvedType {
    public FieldType {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(tableType, "tableType must not be null");
    }

    public FieldType withTableType(TableOrSelectType newTableType) {
        return new FieldType(name, newTableType);
    }
}
