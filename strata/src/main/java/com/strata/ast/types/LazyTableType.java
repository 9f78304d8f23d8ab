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

import com.strata.database.LazyTable;

import java.util.Objects;

/**
 * A virtual table used directly in FROM. It is replaced by a subquery before printing.
 */
public record LazyTableType(LazyTable table, String alias) implements TableOrSelectType {
    public LazyTableType {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(alias, "alias must not be null");
    }
}
