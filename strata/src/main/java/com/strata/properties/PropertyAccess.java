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

package com.strata.properties;

import com.google.common.collect.ImmutableList;
import com.strata.ast.Field;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.PropertyType;
import com.strata.ast.types.TableOrSelectType;
import com.strata.catalog.MaterializedProperty;
import com.strata.catalog.PropertyStorage;
import com.strata.catalog.PropertyValueType;
import com.strata.catalog.ReservedProperties;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * One {@code entity.properties.key[.nested...]} read, with everything the catalog knows about the key.
 *
 * @param catalogTable catalog table of the properties blob, null when the blob comes from a subquery
 * @param entries      storages of the property, empty when the catalog has none or materialization is off
 */
public record PropertyAccess(Field node, PropertyType type, @Nullable String catalogTable, String property,
                             List<String> nestedChain, List<MaterializedProperty> entries,
                             PropertyValueType valueType) {

    public PropertyAccess {
        nestedChain = ImmutableList.copyOf(nestedChain);
        entries = ImmutableList.copyOf(entries);
    }

    public FieldType propertiesField() {
        return type.fieldType();
    }

    public TableOrSelectType tableType() {
        return type.fieldType().tableType();
    }

    public boolean isNested() {
        return !nestedChain.isEmpty();
    }

    public boolean isReserved() {
        return ReservedProperties.isReserved(property);
    }

    public Optional<MaterializedProperty> entry(PropertyStorage storage) {
        for (MaterializedProperty entry : entries) {
            if (entry.storage() == storage) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
