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

package com.strata.printer;

import com.google.common.collect.ImmutableSet;
import com.strata.errors.QueryError;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Identifier quoting and validation. Safe identifiers print bare; anything else is quoted with the
 * dialect's quote character.
 */
public final class Identifiers {
    private static final Pattern SAFE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> RESERVED = ImmutableSet.of(
            "all", "and", "array", "as", "asc", "between", "by", "case", "cross", "desc", "distinct", "else",
            "end", "false", "format", "from", "full", "group", "having", "ilike", "in", "inner", "is", "join",
            "left", "like", "limit", "not", "null", "offset", "on", "or", "order", "outer", "over", "partition",
            "prewhere", "range", "right", "rows", "sample", "select", "settings", "then", "true", "union",
            "using", "when", "where", "with");

    private Identifiers() {
    }

    public static boolean isReserved(String identifier) {
        return RESERVED.contains(identifier.toLowerCase(Locale.ROOT));
    }

    /**
     * Rejects an alias a query defines when it would collide with a keyword.
     */
    public static void checkAlias(String alias) {
        if (isReserved(alias)) {
            throw new QueryError("Alias '" + alias + "' is a reserved keyword", alias, null);
        }
        validate(alias);
    }

    public static String quote(String identifier, Dialect dialect) {
        validate(identifier);
        if (SAFE.matcher(identifier).matches() && !isReserved(identifier)) {
            return identifier;
        }
        if (dialect == Dialect.POSTGRES) {
            return "\"" + identifier.replace("\"", "\"\"") + "\"";
        }
        return "`" + identifier.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }

    private static void validate(String identifier) {
        if (identifier.isEmpty()) {
            throw new QueryError("Empty identifier");
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (Character.isISOControl(c)) {
                throw new QueryError("Identifier contains a control character", identifier, null);
            }
            if (c == '%') {
                throw new QueryError("Identifier '" + identifier + "' contains '%'", identifier, null);
            }
        }
    }
}
