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

package com.strata.pushdown;

import com.google.common.collect.ImmutableMap;
import com.strata.ast.Alias;
import com.strata.ast.And;
import com.strata.ast.CloneOptions;
import com.strata.ast.CloningVisitor;
import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.Not;
import com.strata.ast.Or;
import com.strata.ast.RewritingVisitor;
import com.strata.ast.SelectQuery;
import com.strata.ast.TraversingVisitor;
import com.strata.ast.types.FieldAliasType;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.LambdaArgumentType;
import com.strata.ast.types.PropertyType;
import com.strata.ast.types.ResolvedType;
import com.strata.ast.types.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.strata.ast.Exprs.*;

/**
 * Extracts from a WHERE clause the part that can be applied inside a pushdown target.
 * <p>
 * The result is implied by the whole WHERE and reads only the target's own names, so applying it to
 * the target's source rows never drops a row the outer query keeps. It may be weaker than the WHERE:
 * undecidable AND operands are dropped and approximate timestamp bounds are widened by the lookback.
 * An OR survives only when every operand is decidable, and a NOT only over an exact operand.
 */
public class WherePushdownOptimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(WherePushdownOptimizer.class);

    private final PredicateNormalizer normalizer = new PredicateNormalizer();
    private final Duration lookback;

    public WherePushdownOptimizer(Duration lookback) {
        this.lookback = lookback;
    }

    public Optional<Expr> pushdown(Expr where, PushdownTarget target) {
        return pushdown(where, target, Map.of());
    }

    /**
     * @param selectAliases expressions of the SELECT's column aliases, used to see through alias references
     * @return the pushable filter in the target's names, empty when nothing can be pushed
     */
    public Optional<Expr> pushdown(Expr where, PushdownTarget target, Map<String, Expr> selectAliases) {
        Expr normalized = normalizer.normalize(where);
        Reduction reduction = new Reducer(target, ImmutableMap.copyOf(selectAliases)).reduce(normalized);
        if (reduction.status() == Status.UNKNOWN) {
            LOGGER.debug("Nothing to push into {}", target.scope());
            return Optional.empty();
        }
        Expr result = normalizer.normalize(reduction.expr());
        if (result instanceof Constant constant && constant.isTrue()) {
            return Optional.empty();
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Pushing {} filter into {}", reduction.status(), Types.aliasOf(target.scope()));
        }
        return Optional.of(result);
    }

    enum Status {
        UNKNOWN,
        EXACT,
        WEAKENED
    }

    record Reduction(Status status, @Nullable Expr expr) {
        static final Reduction UNKNOWN = new Reduction(Status.UNKNOWN, null);

        static Reduction exact(Expr expr) {
            return new Reduction(Status.EXACT, expr);
        }

        static Reduction weakened(Expr expr) {
            return new Reduction(Status.WEAKENED, expr);
        }
    }

    private final class Reducer {
        private final PushdownTarget target;
        private final Map<String, Expr> selectAliases;

        Reducer(PushdownTarget target, Map<String, Expr> selectAliases) {
            this.target = target;
            this.selectAliases = selectAliases;
        }

        Reduction reduce(Expr node) {
            if (node instanceof Alias alias) {
                return reduce(alias.expr());
            }
            if (node instanceof Field field && field.type() instanceof FieldAliasType aliasType
                    && selectAliases.containsKey(aliasType.alias())) {
                return reduce(selectAliases.get(aliasType.alias()));
            }
            if (node instanceof And and) {
                return reduceAnd(and);
            }
            if (node instanceof Or or) {
                return reduceOr(or);
            }
            if (node instanceof Not not) {
                Reduction child = reduce(not.expr());
                if (child.status() != Status.EXACT) {
                    return Reduction.UNKNOWN;
                }
                return Reduction.exact(not(child.expr()));
            }
            if (node instanceof CompareOperation compare) {
                Reduction widened = widen(compare);
                if (widened != null) {
                    return widened;
                }
            }
            return reduceLeaf(node);
        }

        private Reduction reduceAnd(And and) {
            List<Expr> kept = new ArrayList<>();
            boolean weakened = false;
            for (Expr child : and.exprs()) {
                Reduction reduction = reduce(child);
                if (reduction.status() == Status.UNKNOWN) {
                    weakened = true;
                    continue;
                }
                if (reduction.status() == Status.WEAKENED) {
                    weakened = true;
                }
                kept.add(reduction.expr());
            }
            if (kept.isEmpty()) {
                return Reduction.UNKNOWN;
            }
            Expr result = and(kept);
            return weakened ? Reduction.weakened(result) : Reduction.exact(result);
        }

        private Reduction reduceOr(Or or) {
            List<Expr> kept = new ArrayList<>();
            boolean weakened = false;
            for (Expr child : or.exprs()) {
                Reduction reduction = reduce(child);
                if (reduction.status() == Status.UNKNOWN) {
                    return Reduction.UNKNOWN;
                }
                if (reduction.status() == Status.WEAKENED) {
                    weakened = true;
                }
                kept.add(reduction.expr());
            }
            Expr result = or(kept);
            return weakened ? Reduction.weakened(result) : Reduction.exact(result);
        }

        /**
         * Widens {@code approximate op X} into a bound on the approximation. Null when the comparison
         * does not have that shape.
         */
        @Nullable
        private Reduction widen(CompareOperation compare) {
            CompareOperator op = compare.op();
            if (op != CompareOperator.EQ && !op.isOrdering()) {
                return null;
            }
            Expr approximate = approximateOf(compare.left());
            Expr bound = compare.right();
            if (approximate == null) {
                approximate = approximateOf(compare.right());
                bound = compare.left();
                op = op.flip();
            }
            if (approximate == null || !isFieldFree(bound)) {
                return null;
            }
            Expr value = CloningVisitor.cloneExpr(bound, CloneOptions.clearTypes());
            Expr lower = compare(CompareOperator.GT_EQ, approximate, shift("minus", value));
            Expr upper = compare(CompareOperator.LT_EQ, approximate, shift("plus", value));
            switch (op) {
                case EQ:
                    return Reduction.weakened(and(lower, upper));
                case GT:
                case GT_EQ:
                    return Reduction.weakened(lower);
                default:
                    return Reduction.weakened(upper);
            }
        }

        private Expr shift(String function, Expr value) {
            return call(function, call("toDateTime", value), call("toIntervalSecond", constant(lookback.getSeconds())));
        }

        @Nullable
        private Expr approximateOf(Expr expr) {
            FieldType fieldType = fieldTypeOf(expr);
            return fieldType == null ? null : target.approximateField(fieldType);
        }

        @Nullable
        private FieldType fieldTypeOf(Expr expr) {
            Expr current = expr;
            while (current instanceof Alias alias) {
                current = alias.expr();
            }
            if (!(current instanceof Field field) || field.type() == null) {
                return null;
            }
            if (field.type() instanceof FieldAliasType aliasType && selectAliases.containsKey(aliasType.alias())) {
                return fieldTypeOf(selectAliases.get(aliasType.alias()));
            }
            ResolvedType type = Types.unwrapAliases(field.type());
            return type instanceof FieldType fieldType ? fieldType : null;
        }

        private Reduction reduceLeaf(Expr leaf) {
            LocalRewriter rewriter = new LocalRewriter(target, selectAliases);
            Optional<Expr> rewritten = rewriter.rewrite(leaf);
            if (!rewriter.decidable || rewritten.isEmpty()) {
                return Reduction.UNKNOWN;
            }
            return Reduction.exact(CloningVisitor.cloneExpr(rewritten.get(), CloneOptions.clearTypes()));
        }
    }

    private static boolean isFieldFree(Expr expr) {
        FieldFinder finder = new FieldFinder();
        finder.traverse(expr);
        return !finder.found;
    }

    private static final class FieldFinder extends TraversingVisitor {
        private boolean found;

        @Override
        public Void visitField(Field node) {
            found = true;
            return null;
        }

        @Override
        public Void visitSelectQuery(SelectQuery node) {
            found = true;
            return null;
        }
    }

    /**
     * Rewrites a leaf into the target's names. Any field the target cannot answer exactly, and any
     * subquery, makes the leaf undecidable.
     */
    private static final class LocalRewriter extends RewritingVisitor {
        private final PushdownTarget target;
        private final Map<String, Expr> selectAliases;
        private final Set<String> expanding = new HashSet<>();
        private boolean decidable = true;

        LocalRewriter(PushdownTarget target, Map<String, Expr> selectAliases) {
            this.target = target;
            this.selectAliases = selectAliases;
        }

        @Override
        public Optional<Expr> visitAlias(Alias node) {
            return rewrite(node.expr());
        }

        @Override
        public Optional<Expr> visitSelectQuery(SelectQuery node) {
            decidable = false;
            return Optional.of(node);
        }

        @Override
        public Optional<Expr> visitField(Field node) {
            ResolvedType type = node.type();
            if (type instanceof LambdaArgumentType) {
                return Optional.of(node);
            }
            if (type instanceof FieldAliasType aliasType) {
                Expr aliased = selectAliases.get(aliasType.alias());
                if (aliased != null && expanding.add(aliasType.alias())) {
                    Optional<Expr> result = rewrite(aliased);
                    expanding.remove(aliasType.alias());
                    return result;
                }
                type = Types.unwrapAliases(type);
            }
            if (type instanceof FieldType fieldType) {
                Expr local = target.exactField(fieldType);
                if (local != null) {
                    return Optional.of(local);
                }
            }
            if (type instanceof PropertyType propertyType) {
                Expr local = target.exactField(propertyType.fieldType());
                if (local instanceof Field localField) {
                    List<String> chain = new ArrayList<>(localField.chain());
                    chain.addAll(propertyType.chain());
                    return Optional.of(field(chain));
                }
            }
            decidable = false;
            return Optional.of(node);
        }
    }
}
