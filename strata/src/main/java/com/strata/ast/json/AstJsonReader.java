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

package com.strata.ast.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.strata.JSONUtils;
import com.strata.ast.Alias;
import com.strata.ast.And;
import com.strata.ast.ArrayExpr;
import com.strata.ast.ArrayJoin;
import com.strata.ast.Call;
import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.JoinConstraint;
import com.strata.ast.JoinExpr;
import com.strata.ast.Lambda;
import com.strata.ast.LimitBy;
import com.strata.ast.Not;
import com.strata.ast.Or;
import com.strata.ast.OrderExpr;
import com.strata.ast.RatioExpr;
import com.strata.ast.SampleExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.TupleExpr;
import com.strata.ast.WindowExpr;
import com.strata.ast.WindowFrame;
import com.strata.ast.WindowFunction;
import com.strata.errors.ImpossibleAstError;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads the parser's JSON payload into an {@link Expr} tree.
 * <p>
 * Every node is an object with a {@code "node"} member naming its kind, e.g.
 * <pre>{@code {"node": "CompareOperation", "op": "EQ", "left": {...}, "right": {...}}}</pre>
 * Member names follow the record components in snake case. Anything the parser would never produce,
 * such as an unknown kind or a missing required member, is an {@link ImpossibleAstError}.
 */
public final class AstJsonReader {

    private AstJsonReader() {
    }

    public static Expr read(String json) {
        return read(JSONUtils.readTree(json));
    }

    public static Expr read(JsonNode root) {
        Objects.requireNonNull(root, "root must not be null");
        return readExpr(root);
    }

    private static Expr readExpr(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ImpossibleAstError("Expected an AST node object, got " + node);
        }
        String kind = requireText(node, "node");
        switch (kind) {
            case "Constant":
                return new Constant(readValue(node.get("value")), node.path("inline").asBoolean(false), null);
            case "Field":
                return new Field(readStrings(require(node, "chain")));
            case "CompareOperation":
                return new CompareOperation(readOperator(requireText(node, "op")),
                        readExpr(require(node, "left")), readExpr(require(node, "right")));
            case "And":
                return new And(readExprs(require(node, "exprs")));
            case "Or":
                return new Or(readExprs(require(node, "exprs")));
            case "Not":
                return new Not(readExpr(require(node, "expr")), null);
            case "Call":
                return new Call(requireText(node, "name"), readExprs(node.path("args")),
                        node.hasNonNull("params") ? readExprs(node.get("params")) : null,
                        node.path("distinct").asBoolean(false), null);
            case "Array":
                return new ArrayExpr(readExprs(require(node, "exprs")));
            case "Tuple":
                return new TupleExpr(readExprs(require(node, "exprs")));
            case "Alias":
                return new Alias(requireText(node, "alias"), readExpr(require(node, "expr")),
                        node.path("hidden").asBoolean(false), null);
            case "Lambda":
                return new Lambda(readStrings(require(node, "args")), readExpr(require(node, "expr")));
            case "SelectQuery":
                return readSelect(node);
            case "JoinExpr":
                return readJoin(node);
            case "OrderExpr":
                return readOrder(node);
            case "WindowFunction":
                return new WindowFunction(requireText(node, "name"), readExprs(node.path("args")),
                        readWindow(node.path("over")));
            default:
                throw new ImpossibleAstError("Unknown AST node kind '" + kind + "'");
        }
    }

    private static SelectQuery readSelect(JsonNode node) {
        SelectQuery.Builder builder = SelectQuery.builder()
                .select(readExprs(require(node, "select")))
                .distinct(node.path("distinct").asBoolean(false))
                .selectFrom(node.hasNonNull("select_from") ? readJoin(node.get("select_from")) : null)
                .prewhere(readOptional(node, "prewhere"))
                .where(readOptional(node, "where"))
                .groupBy(readExprs(node.path("group_by")))
                .having(readOptional(node, "having"))
                .limit(readOptional(node, "limit"))
                .offset(readOptional(node, "offset"));
        List<OrderExpr> orderBy = new ArrayList<>();
        for (JsonNode item : node.path("order_by")) {
            orderBy.add(readOrder(item));
        }
        builder.orderBy(orderBy);
        if (node.hasNonNull("array_join")) {
            JsonNode arrayJoin = node.get("array_join");
            ArrayJoin.Kind kind = ArrayJoin.Kind.valueOf(arrayJoin.path("kind").asText("INNER").toUpperCase(Locale.ROOT));
            builder.arrayJoin(new ArrayJoin(kind, readExprs(require(arrayJoin, "exprs"))));
        }
        if (node.hasNonNull("limit_by")) {
            JsonNode limitBy = node.get("limit_by");
            builder.limitBy(new LimitBy(readExpr(require(limitBy, "n")), readOptional(limitBy, "offset"),
                    readExprs(require(limitBy, "exprs"))));
        }
        return builder.build();
    }

    private static JoinExpr readJoin(JsonNode node) {
        if (!"JoinExpr".equals(node.path("node").asText())) {
            throw new ImpossibleAstError("Expected a JoinExpr, got " + node.path("node").asText());
        }
        JoinConstraint constraint = null;
        if (node.hasNonNull("constraint")) {
            JsonNode c = node.get("constraint");
            JoinConstraint.ConstraintType type = JoinConstraint.ConstraintType.valueOf(
                    c.path("constraint_type").asText("ON").toUpperCase(Locale.ROOT));
            constraint = new JoinConstraint(readExpr(require(c, "expr")), type);
        }
        SampleExpr sample = null;
        if (node.hasNonNull("sample")) {
            JsonNode s = node.get("sample");
            sample = new SampleExpr(readRatio(require(s, "sample_value")),
                    s.hasNonNull("offset_value") ? readRatio(s.get("offset_value")) : null);
        }
        JoinExpr next = node.hasNonNull("next_join") ? readJoin(node.get("next_join")) : null;
        return new JoinExpr(textOrNull(node, "join_type"), readExpr(require(node, "table")),
                textOrNull(node, "alias"), constraint, sample, next, null);
    }

    private static RatioExpr readRatio(JsonNode node) {
        Constant left = new Constant(readValue(require(node, "left")));
        Constant right = node.hasNonNull("right") ? new Constant(readValue(node.get("right"))) : null;
        return new RatioExpr(left, right);
    }

    private static OrderExpr readOrder(JsonNode node) {
        OrderExpr.Order order = OrderExpr.Order.valueOf(node.path("order").asText("ASC").toUpperCase(Locale.ROOT));
        return new OrderExpr(readExpr(require(node, "expr")), order);
    }

    private static WindowExpr readWindow(JsonNode node) {
        List<OrderExpr> orderBy = new ArrayList<>();
        for (JsonNode item : node.path("order_by")) {
            orderBy.add(readOrder(item));
        }
        WindowFrame frame = null;
        if (node.hasNonNull("frame")) {
            JsonNode f = node.get("frame");
            WindowFrame.Method method = WindowFrame.Method.valueOf(f.path("method").asText("ROWS")
                    .toUpperCase(Locale.ROOT));
            frame = new WindowFrame(method, readBound(require(f, "start")),
                    f.hasNonNull("end") ? readBound(f.get("end")) : null);
        }
        return new WindowExpr(readExprs(node.path("partition_by")), orderBy, frame);
    }

    private static WindowFrame.Bound readBound(JsonNode node) {
        WindowFrame.BoundKind kind = WindowFrame.BoundKind.valueOf(requireText(node, "kind").toUpperCase(Locale.ROOT));
        Integer offset = node.hasNonNull("offset") ? node.get("offset").asInt() : null;
        return new WindowFrame.Bound(kind, offset);
    }

    private static CompareOperator readOperator(String op) {
        for (CompareOperator operator : CompareOperator.values()) {
            if (operator.name().equals(op) || operator.symbol().equalsIgnoreCase(op)) {
                return operator;
            }
        }
        throw new ImpossibleAstError("Unknown comparison operator '" + op + "'");
    }

    @Nullable
    private static Object readValue(@Nullable JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? (Object) value.longValue() : value.decimalValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        throw new ImpossibleAstError("Unsupported constant value " + value);
    }

    @Nullable
    private static Expr readOptional(JsonNode node, String member) {
        return node.hasNonNull(member) ? readExpr(node.get(member)) : null;
    }

    private static List<Expr> readExprs(JsonNode array) {
        List<Expr> result = new ArrayList<>();
        if (array == null || array.isMissingNode() || array.isNull()) {
            return result;
        }
        if (!array.isArray()) {
            throw new ImpossibleAstError("Expected an array of AST nodes, got " + array);
        }
        for (JsonNode item : array) {
            result.add(readExpr(item));
        }
        return result;
    }

    private static List<String> readStrings(JsonNode array) {
        if (!array.isArray()) {
            throw new ImpossibleAstError("Expected an array of strings, got " + array);
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : array) {
            result.add(item.asText());
        }
        return result;
    }

    private static JsonNode require(JsonNode node, String member) {
        JsonNode value = node.get(member);
        if (value == null || value.isNull()) {
            throw new ImpossibleAstError(node.path("node").asText("node") + " is missing '" + member + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String member) {
        return require(node, member).asText();
    }

    @Nullable
    private static String textOrNull(JsonNode node, String member) {
        return node.hasNonNull(member) ? node.get(member).asText() : null;
    }
}
