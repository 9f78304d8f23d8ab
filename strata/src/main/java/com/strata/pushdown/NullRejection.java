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

import com.google.common.collect.ImmutableSet;
import com.strata.ast.And;
import com.strata.ast.Call;
import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.Or;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a pushed filter can never hold for a row whose target columns are all NULL. Such a
 * filter may be pushed into the right side of a LEFT JOIN: a row losing its match reads NULLs, and the
 * outer WHERE, which implies the filter, rejects it just as it rejected the original match.
 * <p>
 * Answers are conservative. {@code false} only means rejection could not be shown.
 */
public final class NullRejection {
    private static final Set<CompareOperator> REJECTING_OPERATORS = EnumSet.of(
            CompareOperator.EQ, CompareOperator.GT, CompareOperator.GT_EQ, CompareOperator.LT,
            CompareOperator.LT_EQ, CompareOperator.LIKE, CompareOperator.ILIKE, CompareOperator.IN,
            CompareOperator.REGEX, CompareOperator.IREGEX);

    // Calls that can turn a NULL argument into a non-NULL result.
    private static final Set<String> NULL_ABSORBING = ImmutableSet.of(
            "ifNull", "coalesce", "isNull", "isNotNull", "if", "multiIf", "transform", "has", "empty", "notEmpty",
            "toString", "assumeNotNull", "count");

    private NullRejection() {
    }

    public static boolean isNullRejecting(Expr predicate) {
        if (predicate instanceof Constant constant) {
            return constant.isFalse() || constant.isNull();
        }
        if (predicate instanceof And and) {
            for (Expr child : and.exprs()) {
                if (isNullRejecting(child)) {
                    return true;
                }
            }
            return false;
        }
        if (predicate instanceof Or or) {
            for (Expr child : or.exprs()) {
                if (!isNullRejecting(child)) {
                    return false;
                }
            }
            return !or.exprs().isEmpty();
        }
        if (predicate instanceof CompareOperation compare) {
            if (!REJECTING_OPERATORS.contains(compare.op())) {
                return false;
            }
            if (isNullConstant(compare.left()) || isNullConstant(compare.right())) {
                return false;
            }
            return propagatesNull(compare.left()) || propagatesNull(compare.right());
        }
        if (predicate instanceof Call call && call.name().equals("isNotNull") && call.args().size() == 1) {
            return propagatesNull(call.args().get(0));
        }
        return false;
    }

    private static boolean isNullConstant(Expr expr) {
        return expr instanceof Constant constant && constant.isNull();
    }

    /**
     * Whether the expression is NULL whenever the fields it reads are.
     */
    static boolean propagatesNull(Expr expr) {
        if (expr instanceof Field) {
            return true;
        }
        if (expr instanceof Call call) {
            if (NULL_ABSORBING.contains(call.name())) {
                return false;
            }
            for (Expr arg : call.args()) {
                if (propagatesNull(arg)) {
                    return true;
                }
            }
        }
        return false;
    }
}
