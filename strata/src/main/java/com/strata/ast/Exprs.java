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

package com.strata.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Static builders for untyped trees.
 */
public final class Exprs {

    private Exprs() {
    }

    public static Field field(String... chain) {
        return new Field(Arrays.asList(chain));
    }

    public static Field field(List<String> chain) {
        return new Field(chain);
    }

    public static Constant constant(Object value) {
        return new Constant(value);
    }

    /**
     * A constant the printer must emit as literal text instead of a bound parameter.
     */
    public static Constant inlined(Object value) {
        return new Constant(value, true, null);
    }

    public static Expr and(Expr... exprs) {
        return and(Arrays.asList(exprs));
    }

    /**
     * AND of the given operands, or the single operand itself.
     */
    public static Expr and(List<Expr> exprs) {
        if (exprs.size() == 1) {
            return exprs.get(0);
        }
        return new And(exprs);
    }

    public static Expr or(Expr... exprs) {
        return or(Arrays.asList(exprs));
    }

    public static Expr or(List<Expr> exprs) {
        if (exprs.size() == 1) {
            return exprs.get(0);
        }
        return new Or(exprs);
    }

    public static Not not(Expr expr) {
        return new Not(expr);
    }

    public static CompareOperation eq(Expr left, Expr right) {
        return new CompareOperation(CompareOperator.EQ, left, right);
    }

    public static CompareOperation compare(CompareOperator op, Expr left, Expr right) {
        return new CompareOperation(op, left, right);
    }

    public static Call call(String name, Expr... args) {
        return new Call(name, Arrays.asList(args));
    }

    public static Call call(String name, List<Expr> args) {
        return new Call(name, args);
    }

    public static Alias alias(String alias, Expr expr) {
        return new Alias(alias, expr);
    }

    public static TupleExpr tuple(List<Expr> exprs) {
        return new TupleExpr(exprs);
    }

    public static ArrayExpr array(List<Expr> exprs) {
        return new ArrayExpr(exprs);
    }
}
