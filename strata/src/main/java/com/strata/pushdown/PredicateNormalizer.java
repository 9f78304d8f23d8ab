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

import com.strata.ast.And;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Not;
import com.strata.ast.Or;
import com.strata.errors.ImpossibleAstError;

import java.util.ArrayList;
import java.util.List;

/**
 * Semantics-preserving cleanup of the boolean structure of a predicate. Leaves are never looked into.
 */
public class PredicateNormalizer {
    private final List<PredicateTransform> pipeline = List.of(
            new FlattenAndOrTransform(),
            new RemoveDoubleNotTransform(),
            new ConstantFoldingTransform()
    );

    public Expr normalize(Expr predicate) {
        Expr current = predicate;
        for (PredicateTransform transform : pipeline) {
            current = transform.transform(current);
        }
        return current;
    }

    public interface PredicateTransform {
        Expr transform(Expr root);
    }

    private static List<Expr> requireOperands(List<Expr> operands, String kind) {
        if (operands.isEmpty()) {
            throw new ImpossibleAstError(kind + " without operands");
        }
        return operands;
    }

    /**
     * {@code a AND (b AND c)} becomes {@code a AND b AND c}, likewise for OR.
     */
    private static final class FlattenAndOrTransform implements PredicateTransform {
        @Override
        public Expr transform(Expr root) {
            return rewrite(root);
        }

        private Expr rewrite(Expr n) {
            if (n instanceof And and) {
                List<Expr> flat = new ArrayList<>();
                for (Expr child : requireOperands(and.exprs(), "AND")) {
                    Expr r = rewrite(child);
                    if (r instanceof And nested) flat.addAll(nested.exprs());
                    else flat.add(r);
                }
                return new And(flat, and.type());
            }
            if (n instanceof Or or) {
                List<Expr> flat = new ArrayList<>();
                for (Expr child : requireOperands(or.exprs(), "OR")) {
                    Expr r = rewrite(child);
                    if (r instanceof Or nested) flat.addAll(nested.exprs());
                    else flat.add(r);
                }
                return new Or(flat, or.type());
            }
            if (n instanceof Not not) {
                return new Not(rewrite(not.expr()), not.type());
            }
            return n;
        }
    }

    /**
     * {@code NOT NOT a} becomes {@code a}.
     */
    private static final class RemoveDoubleNotTransform implements PredicateTransform {
        @Override
        public Expr transform(Expr root) {
            return rewrite(root);
        }

        private Expr rewrite(Expr n) {
            if (n instanceof Not outer && outer.expr() instanceof Not inner) {
                return rewrite(inner.expr());
            }
            if (n instanceof Not not) {
                return new Not(rewrite(not.expr()), not.type());
            }
            if (n instanceof And and) {
                return new And(rewriteAll(and.exprs()), and.type());
            }
            if (n instanceof Or or) {
                return new Or(rewriteAll(or.exprs()), or.type());
            }
            return n;
        }

        private List<Expr> rewriteAll(List<Expr> children) {
            List<Expr> result = new ArrayList<>(children.size());
            for (Expr child : children) {
                result.add(rewrite(child));
            }
            return result;
        }
    }

    /**
     * Folds literal TRUE and FALSE through AND, OR and NOT. NULL literals are left alone.
     */
    private static final class ConstantFoldingTransform implements PredicateTransform {
        @Override
        public Expr transform(Expr root) {
            return rewrite(root);
        }

        private static boolean isTrue(Expr e) {
            return e instanceof Constant c && c.isTrue();
        }

        private static boolean isFalse(Expr e) {
            return e instanceof Constant c && c.isFalse();
        }

        private Expr rewrite(Expr n) {
            if (n instanceof And and) {
                List<Expr> kept = new ArrayList<>();
                for (Expr child : and.exprs()) {
                    Expr r = rewrite(child);
                    if (isFalse(r)) return Constant.FALSE;
                    if (!isTrue(r)) kept.add(r);
                }
                if (kept.isEmpty()) return Constant.TRUE;
                if (kept.size() == 1) return kept.get(0);
                return new And(kept, and.type());
            }
            if (n instanceof Or or) {
                List<Expr> kept = new ArrayList<>();
                for (Expr child : or.exprs()) {
                    Expr r = rewrite(child);
                    if (isTrue(r)) return Constant.TRUE;
                    if (!isFalse(r)) kept.add(r);
                }
                if (kept.isEmpty()) return Constant.FALSE;
                if (kept.size() == 1) return kept.get(0);
                return new Or(kept, or.type());
            }
            if (n instanceof Not not) {
                Expr r = rewrite(not.expr());
                if (isTrue(r)) return Constant.FALSE;
                if (isFalse(r)) return Constant.TRUE;
                return new Not(r, not.type());
            }
            return n;
        }
    }
}
