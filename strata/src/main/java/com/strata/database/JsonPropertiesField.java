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

import java.util.Objects;

/**
 * A JSON blob of properties. {@code catalogTable} is the key under which the materialization catalog
 * describes this blob's properties.
 */
public record JsonPropertiesField(String name, String physicalName, String catalogTable,
                                  boolean hidden) implements DatabaseField {
    public JsonPropertiesField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(physicalName, "physicalName must not be null");
        Objects.requireNonNull(catalogTable, "catalogTable must not be null");
    }

    public static JsonPropertiesField of(String name, String catalogTable) {
        return new JsonPropertiesField(name, name, catalogTable, false);
    }
}
