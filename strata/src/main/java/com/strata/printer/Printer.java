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

import com.strata.ast.Expr;
import com.strata.compiler.CompileContext;
import com.strata.config.CompilerSettings;
import com.strata.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for SQL generation. Checks dialect capabilities over the whole tree first, then prints
 * with a fresh dialect printer.
 */
public final class Printer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Printer.class);

    private Printer() {
    }

    public static PrintedQuery print(Expr node, CompileContext context) {
        return print(node, context.dialect(), context.settings(), context.teamId(), context.functions());
    }

    public static PrintedQuery print(Expr node, Dialect dialect, CompilerSettings settings, long teamId) {
        return print(node, dialect, settings, teamId, FunctionRegistry.standard());
    }

    public static PrintedQuery print(Expr node, Dialect dialect, CompilerSettings settings, long teamId,
                                     FunctionRegistry functions) {
        CapabilityChecker.check(node, dialect);
        PrintedQuery printed = printerFor(dialect, settings, teamId, functions).print(node);
        LOGGER.debug("Printed {} query with {} parameter(s)", dialect, printed.params().size());
        return printed;
    }

    static SqlPrinter printerFor(Dialect dialect, CompilerSettings settings, long teamId, FunctionRegistry functions) {
        switch (dialect) {
            case CLICKHOUSE:
                return new ClickHousePrinter(settings, teamId, functions);
            case POSTGRES:
                return new PostgresPrinter(settings, teamId, functions);
            default:
                return new StrataQLPrinter(settings, functions);
        }
    }
}
