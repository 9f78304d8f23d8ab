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

import com.strata.database.LazyJoin;

import java.util.Objects;

/**
 * A join that exists only because a field chain walked through a {@link LazyJoin}. The join
 * materializer turns it into a concrete join aliased {@link #alias()}.
 */
public record LazyJoinType(TableOrSelectType sourceType, String field, LazyJoin lazyJoin) implements TableOrSelectType {
    public LazyJoinType {
        Objects.requireNonNull(sourceType, "sourceType must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(lazyJoin, "lazyJoin must not be null");
    }

    /**
     * Alias of the materialized join, the source alias and every traversed field joined by
     * {@code __}, e.g. {@code events__pdi__person}.
     */
    public String alias() {
        return Types.aliasOf(sourceType) + "__" + field;
    }
}
