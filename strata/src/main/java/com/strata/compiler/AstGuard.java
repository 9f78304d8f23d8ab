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

import com.strata.ast.And;
import com.strata.ast.Expr;
import com.strata.ast.Or;
import com.strata.ast.TraversingVisitor;
import com.strata.config.CompilerSettings;
import com.strata.errors.ImpossibleAstError;
import com.strata.errors.QueryError;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Validates the raw tree before any other pass runs.
 *
 * <p>Checks:
 * <ul>
 *   <li><b>Size</b>: more than {@code maxAstSize} nodes is a {@link QueryError}</li>
 *   <li><b>Depth</b>: nesting deeper than {@code maxAstDepth} is a {@link QueryError}</li>
 *   <li><b>Structure</b>: an AND or OR without operands is an {@link ImpossibleAstError}</li>
 * </ul>
 * The tree is returned unchanged.
 */
public final class AstGuard implements CompilerPass {

    @Override
    public Expr apply(Expr node, CompileContext context) {
        Objects.requireNonNull(node, "node must not be null");
        measure(node, context.settings());
        return node;
    }

    @Override
    public String getName() {
        return "AstGuard";
    }

    /**
     * Counts nodes and the deepest nesting level of a tree. The walk stops at the first node past
     * either limit, so its own recursion never goes deeper than {@code maxAstDepth}.
     *
     * @throws QueryError         when the tree is larger or deeper than the settings allow
     * @throws ImpossibleAstError for an AND or OR without operands
     */
    public static Measure measure(Expr node, CompilerSettings settings) {
        MeasuringVisitor visitor = new MeasuringVisitor(settings.maxAstSize(), settings.maxAstDepth());
        visitor.traverse(node);
        return new Measure(visitor.size, visitor.maxDepth);
    }

    public record Measure(int size, int depth) {
    }

    private static final class MeasuringVisitor extends TraversingVisitor {
        private final int sizeLimit;
        private final int depthLimit;
        private int size;
        private int depth;
        private int maxDepth;

        private MeasuringVisitor(int sizeLimit, int depthLimit) {
            this.sizeLimit = sizeLimit;
            this.depthLimit = depthLimit;
        }

        @Override
        public void traverse(@Nullable Expr node) {
            if (node == null) {
                return;
            }
            size++;
            depth++;
            maxDepth = Math.max(maxDepth, depth);
            if (size > sizeLimit) {
                throw new QueryError("Query is too large: more than " + sizeLimit + " nodes");
            }
            if (depth > depthLimit) {
                throw new QueryError("Query is nested too deeply: more than " + depthLimit + " levels");
            }
            try {
                super.traverse(node);
            } finally {
                depth--;
            }
        }

        @Override
        public Void visitAnd(And node) {
            if (node.exprs().isEmpty()) {
                throw new ImpossibleAstError("AND without operands");
            }
            return super.visitAnd(node);
        }

        @Override
        public Void visitOr(Or node) {
            if (node.exprs().isEmpty()) {
                throw new ImpossibleAstError("OR without operands");
            }
            return super.visitOr(node);
        }
    }
}
