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

package com.strata.compiler;

import com.strata.catalog.MaterializationCatalog;
import com.strata.config.CompilerSettings;
import com.strata.config.Modifiers;
import com.strata.database.Database;
import com.strata.functions.FunctionRegistry;
import com.strata.printer.Dialect;

import java.util.Objects;

/**
 * Everything a compilation reads, captured once before the first pass and passed explicitly to every
 * pass. Nothing in it changes while a query compiles.
 */
public record CompileContext(Database database, MaterializationCatalog catalog, Modifiers modifiers,
                             CompilerSettings settings, Dialect dialect, long teamId, FunctionRegistry functions) {

    public CompileContext {
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        Objects.requireNonNull(modifiers, "modifiers must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        Objects.requireNonNull(functions, "functions must not be null");
    }

    public static CompileContext create(MaterializationCatalog catalog, Modifiers modifiers, CompilerSettings settings,
                                        Dialect dialect, long teamId) {
        return new CompileContext(Database.create(modifiers, catalog), catalog, modifiers, settings, dialect, teamId,
                FunctionRegistry.standard());
    }

    public CompileContext withDialect(Dialect newDialect) {
        return new CompileContext(database, catalog, modifiers, settings, newDialect, teamId, functions);
    }
}
