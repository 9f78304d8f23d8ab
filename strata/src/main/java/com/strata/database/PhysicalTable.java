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

/**
 * A table that exists in the backend under {@code physicalName}.
 */
public class PhysicalTable extends Table {
    private final String physicalName;
    private final String entityIdField;

    public PhysicalTable(String name, String physicalName, @Nullable String entityIdField) {
        super(name);
        this.physicalName = physicalName;
        this.entityIdField = entityIdField;
    }

    public String physicalName() {
        return physicalName;
    }

    /**
     * Physical tables carrying a {@code team_id} column are shared between tenants and get a tenant guard
     * when printed.
     */
    public boolean isTenantScoped() {
        return hasField("team_id");
    }

    @Nullable
    @Override
    public String entityIdField() {
        return entityIdField;
    }
}
