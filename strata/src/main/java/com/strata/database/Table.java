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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named collection of fields in the logical schema. Fields are registered while the {@link Database}
 * is assembled and never change afterwards.
 */
public abstract class Table {
    private final String name;
    private final Map<String, DatabaseField> fields = new LinkedHashMap<>();

    protected Table(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Map<String, DatabaseField> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Nullable
    public DatabaseField getField(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    protected void addField(DatabaseField field) {
        fields.put(field.name(), field);
    }

    void addFieldIfAbsent(DatabaseField field) {
        fields.putIfAbsent(field.name(), field);
    }

    /**
     * Field identifying one entity row, used as the key of side-table joins. Null when the table has no
     * per-entity properties.
     */
    @Nullable
    public String entityIdField() {
        return null;
    }

    /**
     * Catalog tables described by this table's JSON properties fields.
     */
    public List<String> catalogTables() {
        List<String> result = new ArrayList<>();
        for (DatabaseField field : fields.values()) {
            if (field instanceof JsonPropertiesField json && !result.contains(json.catalogTable())) {
                result.add(json.catalogTable());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
