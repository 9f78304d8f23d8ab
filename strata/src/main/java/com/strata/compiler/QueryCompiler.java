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

import com.google.common.collect.ImmutableList;
import com.strata.ast.Expr;
import com.strata.joins.LazyJoinMaterializer;
import com.strata.printer.PrintedQuery;
import com.strata.printer.Printer;
import com.strata.properties.PropertyAccessSelector;
import com.strata.resolver.Resolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Compiles a parsed query into SQL for the dialect of the context.
 * <p>
 * The pipeline is fixed: guard, resolve, select property access, materialize joins, print. Each pass
 * returns a new tree. The compiler holds no per-query state and can be shared.
 */
public class QueryCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCompiler.class);

    private final List<CompilerPass> passes;

    public QueryCompiler() {
        this.passes = ImmutableList.of(
                new AstGuard(),
                new Resolver(),
                new PropertyAccessSelector(),
                new LazyJoinMaterializer()
        );
    }

    public List<CompilerPass> passes() {
        return passes;
    }

    /**
     * Runs every pass over the tree and returns the tree the printer would receive.
     */
    public Expr prepare(Expr node, CompileContext context) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Expr current = node;
        for (CompilerPass pass : passes) {
            long start = System.nanoTime();
            current = pass.apply(current, context);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{} finished in {} us", pass.getName(), (System.nanoTime() - start) / 1000);
            }
        }
        return current;
    }

    public CompiledQuery compile(Expr node, CompileContext context) {
        Expr prepared = prepare(node, context);
        long start = System.nanoTime();
        PrintedQuery printed = Printer.print(prepared, context);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Printer finished in {} us", (System.nanoTime() - start) / 1000);
        }
        return new CompiledQuery(printed.sql(), printed.params(), context.dialect());
    }
}
