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

import com.strata.ast.Call;
import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Lambda;
import com.strata.config.CompilerSettings;
import com.strata.errors.ImpossibleAstError;
import com.strata.functions.FunctionDef;
import com.strata.functions.FunctionRegistry;

import javax.annotation.Nullable;
import java.util.List;

/**
 * ClickHouse output. Comparisons become function calls, and comparisons on nullable operands are wrapped
 * in {@code ifNull} so that a NULL operand yields a definite boolean with the query language's semantics.
 */
public class ClickHousePrinter extends SqlPrinter {

    public ClickHousePrinter(CompilerSettings settings, long teamId, FunctionRegistry functions) {
        super(Dialect.CLICKHOUSE, settings, teamId, functions);
    }

    @Override
    protected String placeholder(String name) {
        return "%(" + name + ")s";
    }

    @Override
    protected String escapeString(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    @Override
    protected String printEquals(String left, String right) {
        return "equals(" + left + ", " + right + ")";
    }

    @Override
    protected String printAnd(List<String> operands) {
        return operands.size() == 1 ? operands.get(0) : "and(" + join(operands) + ")";
    }

    @Override
    protected String printOr(List<String> operands) {
        return operands.size() == 1 ? operands.get(0) : "or(" + join(operands) + ")";
    }

    @Override
    protected String printNot(String operand) {
        return "not(" + operand + ")";
    }

    @Override
    protected String printTuple(List<String> items) {
        return "tuple(" + join(items) + ")";
    }

    @Override
    protected String trailingClauses() {
        // outer joins pad unmatched rows with NULL instead of column defaults
        StringBuilder sql = new StringBuilder(" SETTINGS max_execution_time=")
                .append(settings.maxExecutionTimeSeconds())
                .append(", join_use_nulls=1");
        if (settings.outputFormat() != null) {
            sql.append(" FORMAT ").append(settings.outputFormat());
        }
        return sql.toString();
    }

    @Override
    protected String printCall(Call node, @Nullable FunctionDef def, List<String> args) {
        if (node.name().equals("arrayElement") && args.size() == 2) {
            return args.get(0) + "[" + args.get(1) + "]";
        }
        return super.printCall(node, def, args);
    }

    @Override
    public String visitLambda(Lambda node) {
        return "(" + super.visitLambda(node) + ")";
    }

    @Override
    public String visitCompareOperation(CompareOperation node) {
        CompareOperator op = node.op();
        Expr left = node.left();
        Expr right = node.right();
        if (op.isCohort()) {
            return printCohort(node);
        }
        if (op == CompareOperator.EQ || op == CompareOperator.NOT_EQ) {
            boolean negated = op == CompareOperator.NOT_EQ;
            if (isNullConstant(right) || isNullConstant(left)) {
                Expr other = isNullConstant(right) ? left : right;
                if (isNullConstant(other)) {
                    return negated ? "0" : "1";
                }
                return (negated ? "isNotNull(" : "isNull(") + visit(other) + ")";
            }
        }

        String l = visit(left);
        String r = visit(right);
        String base = printOperator(op, l, r);
        boolean leftNullable = isNullable(left);
        boolean rightNullable = op != CompareOperator.IN && op != CompareOperator.NOT_IN && isNullable(right);
        if (!leftNullable && !rightNullable) {
            return base;
        }
        switch (op) {
            case EQ:
                if (leftNullable && rightNullable) {
                    return "ifNull(" + base + ", and(isNull(" + l + "), isNull(" + r + ")))";
                }
                return "ifNull(" + base + ", 0)";
            case NOT_EQ:
                if (leftNullable && rightNullable) {
                    return "ifNull(" + base + ", or(isNotNull(" + l + "), isNotNull(" + r + ")))";
                }
                return "ifNull(" + base + ", 1)";
            case NOT_LIKE:
            case NOT_ILIKE:
            case NOT_IN:
            case NOT_REGEX:
            case NOT_IREGEX:
                return "ifNull(" + base + ", 1)";
            default:
                return "ifNull(" + base + ", 0)";
        }
    }

    private static String printOperator(CompareOperator op, String l, String r) {
        switch (op) {
            case EQ:
                return "equals(" + l + ", " + r + ")";
            case NOT_EQ:
                return "notEquals(" + l + ", " + r + ")";
            case GT:
                return "greater(" + l + ", " + r + ")";
            case GT_EQ:
                return "greaterOrEquals(" + l + ", " + r + ")";
            case LT:
                return "less(" + l + ", " + r + ")";
            case LT_EQ:
                return "lessOrEquals(" + l + ", " + r + ")";
            case LIKE:
                return "like(" + l + ", " + r + ")";
            case NOT_LIKE:
                return "notLike(" + l + ", " + r + ")";
            case ILIKE:
                return "ilike(" + l + ", " + r + ")";
            case NOT_ILIKE:
                return "notILike(" + l + ", " + r + ")";
            case IN:
                return "in(" + l + ", " + r + ")";
            case NOT_IN:
                return "notIn(" + l + ", " + r + ")";
            case REGEX:
                return "match(" + l + ", " + r + ")";
            case NOT_REGEX:
                return "not(match(" + l + ", " + r + "))";
            case IREGEX:
                return "match(" + l + ", concat('(?i)', " + r + "))";
            case NOT_IREGEX:
                return "not(match(" + l + ", concat('(?i)', " + r + ")))";
            default:
                throw new ImpossibleAstError("Operator " + op + " has no ClickHouse function");
        }
    }

    private String printCohort(CompareOperation node) {
        if (!(node.right() instanceof Constant cohort) || !(cohort.value() instanceof Number cohortId)) {
            throw new ImpossibleAstError("Cohort membership needs a numeric cohort id");
        }
        String members = "(SELECT person_id FROM cohort_people WHERE and(equals(team_id, " + teamId
                + "), equals(cohort_id, " + cohortId.longValue() + ")))";
        String function = node.op() == CompareOperator.IN_COHORT ? "in" : "notIn";
        return function + "(" + visit(node.left()) + ", " + members + ")";
    }
}
