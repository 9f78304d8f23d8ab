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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The scope of one SELECT: its output columns and the tables registered in its FROM chain, both in
 * declaration order.
 */
public record SelectQueryType(Map<String, ResolvedType> columns, Map<String, TableOrSelectType> tables)
        implements TableOrSelectType {
    public SelectQueryType {
        columns = ImmutableMap.copyOf(columns);
        tables = ImmutableMap.copyOf(tables);
    }

    public SelectQueryType withTable(String alias, TableOrSelectType table) {
        return new SelectQueryType(columns, ImmutableMap.<String, TableOrSelectType>builder()
                .putAll(tables).put(alias, table).buildKeepingLast());
    }

    // Records with deeply nested types produce very large strings
    @Override
    public String toString() {
        return "SelectQueryType[columns=" + columns.keySet() + ", tables=" + tables.keySet() + "]";
    }
}
