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

package com.strata.resolver;

import com.strata.ast.types.ResolvedType;
import com.strata.ast.types.TableOrSelectType;
import com.strata.errors.QueryError;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names visible inside one SELECT, one lambda or one table-relative expression. Scopes are stacked;
 * an inner scope shadows the outer ones.
 */
public final class Scope {
    public enum Kind {
        SELECT,
        LAMBDA,
        TABLE
    }

    private final Kind kind;
    private final Map<String, TableOrSelectType> tables = new LinkedHashMap<>();
    private final Map<String, ResolvedType> columnAliases = new LinkedHashMap<>();
    private final Set<String> lambdaArguments = new HashSet<>();
    private final Set<String> aliasesInProgress = new HashSet<>();

    Scope(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    void addTable(String alias, TableOrSelectType type) {
        if (tables.containsKey(alias)) {
            throw new QueryError("Duplicate table alias '" + alias + "' in the same SELECT", alias, null);
        }
        tables.put(alias, type);
    }

    void addColumnAlias(String alias, ResolvedType type) {
        columnAliases.put(alias, type);
    }

    void addLambdaArgument(String name) {
        lambdaArguments.add(name);
    }

    void beginAlias(String alias) {
        aliasesInProgress.add(alias);
    }

    void endAlias(String alias) {
        aliasesInProgress.remove(alias);
    }

    boolean isAliasVisible(String alias) {
        return columnAliases.containsKey(alias) && !aliasesInProgress.contains(alias);
    }

    boolean hasLambdaArgument(String name) {
        return lambdaArguments.contains(name);
    }

    public Map<String, TableOrSelectType> tables() {
        return Collections.unmodifiableMap(tables);
    }

    public Map<String, ResolvedType> columnAliases() {
        return Collections.unmodifiableMap(columnAliases);
    }
}
