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

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only snapshot mapping (catalog table, property) to its physical storages. A property may be
 * stored in more than one place at once, e.g. promoted to a column while also kept in a map bucket; the
 * property access selector decides which one to read. A property with no entry is stored in JSON and
 * typed as a string.
 */
public final class MaterializationCatalog {
    private static final MaterializationCatalog EMPTY = new MaterializationCatalog(Map.of());

    private final Map<Key, MaterializedProperty> entries;

    private MaterializationCatalog(Map<Key, MaterializedProperty> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    public static MaterializationCatalog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Every storage of the property, in no particular order.
     */
    public List<MaterializedProperty> lookup(String table, String property) {
        List<MaterializedProperty> result = new ArrayList<>();
        for (PropertyStorage storage : PropertyStorage.values()) {
            MaterializedProperty entry = entries.get(new Key(table, property, storage));
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }

    public Optional<MaterializedProperty> lookup(String table, String property, PropertyStorage storage) {
        return Optional.ofNullable(entries.get(new Key(table, property, storage)));
    }

    /**
     * Declared value type of the property. The first non-string type among its entries wins.
     */
    public PropertyValueType valueTypeOf(String table, String property) {
        for (MaterializedProperty entry : lookup(table, property)) {
            if (entry.valueType() != PropertyValueType.STRING) {
                return entry.valueType();
            }
        }
        return PropertyValueType.STRING;
    }

    public Collection<MaterializedProperty> entries() {
        return entries.values();
    }

    public List<MaterializedProperty> forTable(String table) {
        return entries.values().stream()
                .filter(entry -> entry.table().equals(table))
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    private record Key(String table, String property, PropertyStorage storage) {
    }

    public static final class Builder {
        private final Map<Key, MaterializedProperty> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds an entry. A later entry for the same (table, property, storage) replaces the earlier one.
         */
        public Builder add(MaterializedProperty property) {
            entries.put(new Key(property.table(), property.property(), property.storage()), property);
            return this;
        }

        public Builder json(String table, String property, PropertyValueType valueType) {
            return add(new MaterializedProperty(table, property, PropertyStorage.JSON, null, -1, valueType, true));
        }

        public Builder dedicatedColumn(String table, String property, String column, boolean nullable) {
            return add(new MaterializedProperty(table, property, PropertyStorage.DEDICATED_COLUMN, column, -1,
                    PropertyValueType.STRING, nullable));
        }

        public Builder sideTableSlot(String table, String property, int slot, PropertyValueType valueType) {
            return add(new MaterializedProperty(table, property, PropertyStorage.SIDE_TABLE_SLOT, null, slot,
                    valueType, true));
        }

        public Builder mapColumn(String table, String property, String column) {
            return add(new MaterializedProperty(table, property, PropertyStorage.MAP_COLUMN, column, -1,
                    PropertyValueType.STRING, true));
        }

        public MaterializationCatalog build() {
            return new MaterializationCatalog(entries);
        }
    }
}
