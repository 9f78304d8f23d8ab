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

package com.strata.catalog;

import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One catalog entry: how {@code property} of catalog table {@code table} is stored.
 *
 * @param column physical column for dedicated and map storage, null otherwise
 * @param slot   side-table slot number, -1 unless the storage is {@link PropertyStorage#SIDE_TABLE_SLOT}
 */
public record MaterializedProperty(String table, String property, PropertyStorage storage, @Nullable String column,
                                   int slot, PropertyValueType valueType, boolean nullable) {

    public MaterializedProperty {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(property, "property must not be null");
        Objects.requireNonNull(storage, "storage must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
        switch (storage) {
            case DEDICATED_COLUMN:
            case MAP_COLUMN:
                Preconditions.checkArgument(column != null && !column.isEmpty(),
                        "%s storage of %s.%s requires a column", storage, table, property);
                break;
            case SIDE_TABLE_SLOT:
                Preconditions.checkArgument(slot >= 0, "side table slot of %s.%s must not be negative", table, property);
                break;
            default:
                break;
        }
    }
}
