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

import com.google.common.base.Joiner;
import com.strata.ast.Call;
import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Expr;
import com.strata.ast.Lambda;
import com.strata.config.CompilerSettings;
import com.strata.errors.ImpossibleAstError;
import com.strata.errors.UnsupportedFeatureError;
import com.strata.functions.FunctionDef;
import com.strata.functions.FunctionRegistry;

import javax.annotation.Nullable;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Postgres output. Null-safe equality uses {@code IS [NOT] DISTINCT FROM}; other comparisons on nullable
 * operands are wrapped in {@code COALESCE}. Functions are printed through the templates of the registry.
 */
public class PostgresPrinter extends SqlPrinter {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)(\\*(?::([^}]*))?)?}");

    public PostgresPrinter(CompilerSettings settings, long teamId, FunctionRegistry functions) {
        super(Dialect.POSTGRES, settings, teamId, functions);
    }

    @Override
    protected String placeholder(String name) {
        return ":" + name;
    }

    @Override
    protected String escapeString(String value) {
        return value.replace("'", "''");
    }

    @Override
    protected String printEquals(String left, String right) {
        return "(" + left + " = " + right + ")";
    }

    @Override
    protected String printBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    protected String printArray(List<String> items) {
        return "ARRAY[" + join(items) + "]";
    }

    @Override
    public String visitLambda(Lambda node) {
        throw new UnsupportedFeatureError(dialect, "Lambda expressions");
    }

    @Override
    protected String printCall(Call node, @Nullable FunctionDef def, List<String> args) {
        if (def == null) {
            throw new UnsupportedFeatureError(dialect, "Function '" + node.name() + "'");
        }
        String template = def.nameFor(dialect);
        if (template == null) {
            throw new UnsupportedFeatureError(dialect, "Function '" + node.name() + "'");
        }
        if (node.params() != null) {
            throw new UnsupportedFeatureError(dialect, "Parametric aggregation '" + node.name() + "'");
        }
        if (template.indexOf('{') < 0) {
            if (args.isEmpty() && template.equals("count")) {
                return "count(*)";
            }
            return template + "(" + (node.distinct() ? "DISTINCT " : "") + join(args) + ")";
        }
        return expand(template, args);
    }

    static String expand(String template, List<String> args) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sql = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            String replacement;
            if (matcher.group(2) == null) {
                if (index >= args.size()) {
                    throw new ImpossibleAstError("Template " + template + " needs argument " + index);
                }
                replacement = args.get(index);
            } else {
                String separator = matcher.group(3) == null ? ", " : matcher.group(3);
                replacement = Joiner.on(separator).join(args.subList(Math.min(index, args.size()), args.size()));
            }
            matcher.appendReplacement(sql, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sql);
        return sql.toString();
    }

    @Override
    public String visitCompareOperation(CompareOperation node) {
        CompareOperator op = node.op();
        Expr left = node.left();
        Expr right = node.right();
        if (op.isCohort()) {
            throw new UnsupportedFeatureError(dialect, "IN COHORT");
        }
        if (op == CompareOperator.EQ || op == CompareOperator.NOT_EQ) {
            boolean negated = op == CompareOperator.NOT_EQ;
            if (isNullConstant(right) || isNullConstant(left)) {
                Expr other = isNullConstant(right) ? left : right;
                return "(" + visit(other) + (negated ? " IS NOT NULL)" : " IS NULL)");
            }
            String l = visit(left);
            String r = visit(right);
            if (isNullable(left) && isNullable(right)) {
                return "(" + l + (negated ? " IS DISTINCT FROM " : " IS NOT DISTINCT FROM ") + r + ")";
            }
            String base = "(" + l + (negated ? " <> " : " = ") + r + ")";
            if (isNullable(left) || isNullable(right)) {
                return "COALESCE(" + base + (negated ? ", TRUE)" : ", FALSE)");
            }
            return base;
        }

        String l = visit(left);
        String r = visit(right);
        String base = "(" + l + " " + operatorSymbol(op) + " " + r + ")";
        boolean nullable = isNullable(left)
                || op != CompareOperator.IN && op != CompareOperator.NOT_IN && isNullable(right);
        if (!nullable) {
            return base;
        }
        return "COALESCE(" + base + (isNegated(op) ? ", TRUE)" : ", FALSE)");
    }

    private static boolean isNegated(CompareOperator op) {
        return op == CompareOperator.NOT_LIKE || op == CompareOperator.NOT_ILIKE || op == CompareOperator.NOT_IN
                || op == CompareOperator.NOT_REGEX || op == CompareOperator.NOT_IREGEX;
    }

    private static String operatorSymbol(CompareOperator op) {
        switch (op) {
            case REGEX:
                return "~";
            case IREGEX:
                return "~*";
            case NOT_REGEX:
                return "!~";
            case NOT_IREGEX:
                return "!~*";
            default:
                return op.symbol();
        }
    }
}
