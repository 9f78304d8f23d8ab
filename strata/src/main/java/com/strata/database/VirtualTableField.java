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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * Groups fields of the owning table under a prefix. Its members are {@link FieldTraverser}s relative to
 * the owning table, so {@code person.id} can read {@code events.person_id} without a join.
 */
public record VirtualTableField(String name, Map<String, FieldTraverser> fields, boolean hidden)
        implements DatabaseField {
    public VirtualTableField {
        Objects.requireNonNull(name, "name must not be null");
        fields = ImmutableMap.copyOf(fields);
    }
}
