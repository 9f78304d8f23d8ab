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

package com.strata.functions;

import com.google.common.collect.ImmutableMap;
import com.strata.ast.types.ValueKind;
import com.strata.common.utils.NearestMatch;
import com.strata.errors.ResolutionError;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.strata.ast.types.ValueKind.*;
import static com.strata.functions.FunctionDef.Nullability.ALWAYS;
import static com.strata.functions.FunctionDef.Nullability.FROM_ARGS;
import static com.strata.functions.FunctionDef.Nullability.NEVER;

/**
 * Functions and aggregations the query language accepts, and what each dialect calls them.
 */
public final class FunctionRegistry {
    private static final FunctionRegistry STANDARD = buildStandard();

    private final Map<String, FunctionDef> functions;

    private FunctionRegistry(Map<String, FunctionDef> functions) {
        this.functions = ImmutableMap.copyOf(functions);
    }

    public static FunctionRegistry standard() {
        return STANDARD;
    }

    public Optional<FunctionDef> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean isAggregate(String name) {
        FunctionDef def = functions.get(name);
        return def != null && def.aggregate();
    }

    public Set<String> names() {
        return functions.keySet();
    }

    /**
     * Looks up a function and checks the call's arity.
     *
     * @throws ResolutionError for an unknown function, naming the nearest known one, or a wrong arity
     */
    public FunctionDef require(String name, int arity) {
        FunctionDef def = functions.get(name);
        if (def == null) {
            String suggestion = NearestMatch.find(name, functions.keySet());
            throw new ResolutionError("Unknown function '" + name + "'", name, suggestion);
        }
        if (!def.acceptsArity(arity)) {
            throw new ResolutionError("Function '" + name + "' expects " + def.arityDescription()
                    + " arguments, got " + arity, name, null);
        }
        return def;
    }

    private static FunctionRegistry buildStandard() {
        Definitions d = new Definitions();

        // Comparison and logic
        d.scalar("equals", 2, 2, BOOLEAN, FROM_ARGS, "({0} = {1})");
        d.scalar("notEquals", 2, 2, BOOLEAN, FROM_ARGS, "({0} <> {1})");
        d.scalar("less", 2, 2, BOOLEAN, FROM_ARGS, "({0} < {1})");
        d.scalar("greater", 2, 2, BOOLEAN, FROM_ARGS, "({0} > {1})");
        d.scalar("lessOrEquals", 2, 2, BOOLEAN, FROM_ARGS, "({0} <= {1})");
        d.scalar("greaterOrEquals", 2, 2, BOOLEAN, FROM_ARGS, "({0} >= {1})");
        d.scalar("like", 2, 2, BOOLEAN, FROM_ARGS, "({0} LIKE {1})");
        d.scalar("ilike", 2, 2, BOOLEAN, FROM_ARGS, "({0} ILIKE {1})");
        d.scalar("notLike", 2, 2, BOOLEAN, FROM_ARGS, "({0} NOT LIKE {1})");
        d.scalar("match", 2, 2, BOOLEAN, FROM_ARGS, "({0} ~ {1})");
        d.scalar("in", 2, 2, BOOLEAN, FROM_ARGS, "({0} IN {1})");
        d.scalar("notIn", 2, 2, BOOLEAN, FROM_ARGS, "({0} NOT IN {1})");
        d.scalar("and", 2, -1, BOOLEAN, FROM_ARGS, "({0*: AND })");
        d.scalar("or", 2, -1, BOOLEAN, FROM_ARGS, "({0*: OR })");
        d.scalar("not", 1, 1, BOOLEAN, FROM_ARGS, "(NOT {0})");
        d.scalar("if", 3, 3, UNKNOWN, FROM_ARGS, "CASE WHEN {0} THEN {1} ELSE {2} END");
        d.scalar("multiIf", 3, -1, UNKNOWN, FROM_ARGS, null);
        d.scalar("ifNull", 2, 2, UNKNOWN, NEVER, "COALESCE");
        d.scalar("coalesce", 1, -1, UNKNOWN, FROM_ARGS, "COALESCE");
        d.scalar("nullIf", 2, 2, UNKNOWN, ALWAYS, "NULLIF");
        d.scalar("isNull", 1, 1, BOOLEAN, NEVER, "({0} IS NULL)");
        d.scalar("isNotNull", 1, 1, BOOLEAN, NEVER, "({0} IS NOT NULL)");
        d.scalar("has", 2, 2, BOOLEAN, NEVER, null);
        d.scalar("empty", 1, 1, BOOLEAN, FROM_ARGS, "({0} = '')");
        d.scalar("notEmpty", 1, 1, BOOLEAN, FROM_ARGS, "({0} <> '')");

        // Arithmetic
        d.scalar("plus", 2, 2, UNKNOWN, FROM_ARGS, "({0} + {1})");
        d.scalar("minus", 2, 2, UNKNOWN, FROM_ARGS, "({0} - {1})");
        d.scalar("multiply", 2, 2, UNKNOWN, FROM_ARGS, "({0} * {1})");
        d.scalar("divide", 2, 2, FLOAT, FROM_ARGS, "({0} / {1})");
        d.scalar("modulo", 2, 2, INTEGER, FROM_ARGS, "({0} % {1})");
        d.scalar("abs", 1, 1, UNKNOWN, FROM_ARGS, "abs");
        d.scalar("round", 1, 2, FLOAT, FROM_ARGS, "round");
        d.scalar("min2", 2, 2, UNKNOWN, FROM_ARGS, "LEAST");
        d.scalar("max2", 2, 2, UNKNOWN, FROM_ARGS, "GREATEST");

        // Strings
        d.scalar("length", 1, 1, INTEGER, FROM_ARGS, "length");
        d.scalar("lower", 1, 1, STRING, FROM_ARGS, "lower");
        d.scalar("upper", 1, 1, STRING, FROM_ARGS, "upper");
        d.scalar("concat", 1, -1, STRING, FROM_ARGS, "concat");
        d.scalar("substring", 2, 3, STRING, FROM_ARGS, "substring");
        d.scalar("trim", 1, 1, STRING, FROM_ARGS, "trim");
        d.scalar("replaceRegexpAll", 3, 3, STRING, FROM_ARGS, "regexp_replace({0}, {1}, {2}, 'g')");
        d.scalar("toString", 1, 1, STRING, FROM_ARGS, "CAST({0} AS TEXT)");
        d.scalar("transform", 3, 4, UNKNOWN, ALWAYS, null);
        d.scalar("arrayElement", 2, 2, STRING, FROM_ARGS, null);

        // Conversions
        d.scalar("toInt", 1, 1, INTEGER, FROM_ARGS, "CAST({0} AS BIGINT)");
        d.scalar("toFloat", 1, 1, FLOAT, FROM_ARGS, "CAST({0} AS DOUBLE PRECISION)");
        d.scalar("toFloat64OrNull", 1, 1, FLOAT, ALWAYS, null);
        d.scalar("toUInt64", 1, 1, INTEGER, FROM_ARGS, null);
        d.scalar("toUInt128", 1, 1, INTEGER, FROM_ARGS, null);
        d.scalar("toUUID", 1, 1, ValueKind.UUID, FROM_ARGS, "CAST({0} AS UUID)");
        d.scalar("accurateCast", 2, 2, UNKNOWN, FROM_ARGS, null);
        d.scalar("accurateCastOrNull", 2, 2, UNKNOWN, ALWAYS, null);
        d.scalar("reinterpretAsUUID", 1, 1, ValueKind.UUID, FROM_ARGS, null);
        d.scalar("bitOr", 2, 2, INTEGER, FROM_ARGS, "({0} | {1})");
        d.scalar("bitShiftLeft", 2, 2, INTEGER, FROM_ARGS, "({0} << {1})");
        d.scalar("bitShiftRight", 2, 2, INTEGER, FROM_ARGS, "({0} >> {1})");

        // Dates
        d.scalar("now", 0, 0, DATETIME, NEVER, "now");
        d.scalar("today", 0, 0, DATE, NEVER, "CURRENT_DATE");
        d.scalar("toDate", 1, 1, DATE, FROM_ARGS, "CAST({0} AS DATE)");
        d.scalar("toDateTime", 1, 2, DATETIME, FROM_ARGS, "CAST({0} AS TIMESTAMP)");
        d.scalar("parseDateTime64BestEffortOrNull", 1, 3, DATETIME, ALWAYS, null);
        d.scalar("fromUnixTimestamp64Milli", 1, 1, DATETIME, FROM_ARGS, null);
        d.scalar("toStartOfDay", 1, 1, DATETIME, FROM_ARGS, "date_trunc('day', {0})");
        d.scalar("toStartOfHour", 1, 1, DATETIME, FROM_ARGS, "date_trunc('hour', {0})");
        d.scalar("toStartOfWeek", 1, 2, DATETIME, FROM_ARGS, "date_trunc('week', {0})");
        d.scalar("toStartOfMonth", 1, 1, DATETIME, FROM_ARGS, "date_trunc('month', {0})");
        d.scalar("toIntervalSecond", 1, 1, UNKNOWN, FROM_ARGS, "make_interval(secs => {0})");
        d.scalar("toIntervalDay", 1, 1, UNKNOWN, FROM_ARGS, "make_interval(days => {0})");
        d.scalar("dateDiff", 3, 3, INTEGER, FROM_ARGS, null);

        // JSON, arrays, tuples
        d.scalar("JSONExtractRaw", 1, -1, STRING, ALWAYS, "jsonb_extract_path_text(CAST({0} AS JSONB), {1*})");
        d.scalar("JSONExtractString", 1, -1, STRING, FROM_ARGS, "jsonb_extract_path_text(CAST({0} AS JSONB), {1*})");
        d.scalar("tuple", 0, -1, TUPLE, NEVER, "ROW");
        d.scalar("array", 0, -1, ARRAY, NEVER, "ARRAY[{0*}]");
        d.scalar("arrayMap", 2, -1, ARRAY, NEVER, null);
        d.scalar("arrayFilter", 2, -1, ARRAY, NEVER, null);

        // Aggregations
        d.aggregate("count", 0, 1, INTEGER, NEVER, "count");
        d.aggregate("countIf", 1, 2, INTEGER, NEVER, "count(*) FILTER (WHERE {0})");
        d.aggregate("sum", 1, 1, UNKNOWN, NEVER, "sum");
        d.aggregate("sumIf", 2, 2, UNKNOWN, NEVER, "sum({0}) FILTER (WHERE {1})");
        d.aggregate("avg", 1, 1, FLOAT, ALWAYS, "avg");
        d.aggregate("min", 1, 1, UNKNOWN, FROM_ARGS, "min");
        d.aggregate("max", 1, 1, UNKNOWN, FROM_ARGS, "max");
        d.aggregate("any", 1, 1, UNKNOWN, FROM_ARGS, null);
        d.aggregate("argMax", 2, 2, UNKNOWN, FROM_ARGS, null);
        d.aggregate("argMin", 2, 2, UNKNOWN, FROM_ARGS, null);
        d.aggregate("uniq", 1, -1, INTEGER, NEVER, "count(DISTINCT {0*})");
        d.aggregate("uniqExact", 1, -1, INTEGER, NEVER, "count(DISTINCT {0*})");
        d.aggregate("quantile", 1, 1, FLOAT, ALWAYS, null);
        d.aggregate("groupArray", 1, 1, ARRAY, NEVER, "array_agg");

        // Window functions
        d.window("lag", 1, 3, "lagInFrame", "lag");
        d.window("lead", 1, 3, "leadInFrame", "lead");
        d.window("lagInFrame", 1, 3, "lagInFrame", null);
        d.window("leadInFrame", 1, 3, "leadInFrame", null);
        d.window("row_number", 0, 0, "row_number", "row_number");
        d.window("rank", 0, 0, "rank", "rank");
        d.window("dense_rank", 0, 0, "dense_rank", "dense_rank");
        d.window("first_value", 1, 1, "first_value", "first_value");
        d.window("last_value", 1, 1, "last_value", "last_value");

        return new FunctionRegistry(d.functions);
    }

    private static final class Definitions {
        private final Map<String, FunctionDef> functions = new LinkedHashMap<>();

        void scalar(String name, int min, int max, ValueKind kind, FunctionDef.Nullability nullability,
                    @Nullable String postgres) {
            functions.put(name, new FunctionDef(name, min, max, false, kind, nullability, name, postgres));
        }

        void aggregate(String name, int min, int max, ValueKind kind, FunctionDef.Nullability nullability,
                       @Nullable String postgres) {
            functions.put(name, new FunctionDef(name, min, max, true, kind, nullability, name, postgres));
        }

        void window(String name, int min, int max, String clickhouse, @Nullable String postgres) {
            functions.put(name, new FunctionDef(name, min, max, false, UNKNOWN, ALWAYS, clickhouse, postgres));
        }
    }
}
