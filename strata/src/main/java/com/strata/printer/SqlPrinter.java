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
import com.strata.ast.Alias;
import com.strata.ast.And;
import com.strata.ast.ArrayExpr;
import com.strata.ast.ArrayJoin;
import com.strata.ast.Call;
import com.strata.ast.CompareOperation;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.ExprVisitor;
import com.strata.ast.Field;
import com.strata.ast.JoinConstraint;
import com.strata.ast.JoinExpr;
import com.strata.ast.Lambda;
import com.strata.ast.Not;
import com.strata.ast.Or;
import com.strata.ast.OrderExpr;
import com.strata.ast.RatioExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.TupleExpr;
import com.strata.ast.WindowExpr;
import com.strata.ast.WindowFrame;
import com.strata.ast.WindowFunction;
import com.strata.ast.types.AsteriskType;
import com.strata.ast.types.FieldAliasType;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.LambdaArgumentType;
import com.strata.ast.types.LazyJoinType;
import com.strata.ast.types.LazyTableType;
import com.strata.ast.types.PropertyType;
import com.strata.ast.types.ResolvedType;
import com.strata.ast.types.TableOrSelectType;
import com.strata.ast.types.Types;
import com.strata.config.CompilerSettings;
import com.strata.database.ColumnField;
import com.strata.database.DatabaseField;
import com.strata.database.JsonPropertiesField;
import com.strata.database.LazyTable;
import com.strata.database.PhysicalTable;
import com.strata.database.Table;
import com.strata.errors.ImpossibleAstError;
import com.strata.errors.UnsupportedFeatureError;
import com.strata.functions.FunctionDef;
import com.strata.functions.FunctionRegistry;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared printing of a resolved tree into SQL text. Dialects override the hooks for operators,
 * literals, parameters and null-safety; clause layout, join chains, tenant guards and limits are common.
 * <p>
 * A printer instance prints one query. Parameters are numbered in visit order, so printing the same tree
 * twice with fresh printers gives identical output.
 */
public abstract class SqlPrinter implements ExprVisitor<String> {
    protected static final String PARAM_PREFIX = "strata_val_";

    protected final Dialect dialect;
    protected final CompilerSettings settings;
    protected final long teamId;
    protected final FunctionRegistry functions;

    private final Map<String, Object> params = new LinkedHashMap<>();
    private final Deque<Set<String>> nullExtendedAliases = new ArrayDeque<>();
    private int selectDepth;

    protected SqlPrinter(Dialect dialect, CompilerSettings settings, long teamId, FunctionRegistry functions) {
        this.dialect = dialect;
        this.settings = settings;
        this.teamId = teamId;
        this.functions = functions;
    }

    public PrintedQuery print(Expr node) {
        String sql = visit(node);
        if (node instanceof SelectQuery) {
            sql = sql + trailingClauses();
        }
        return new PrintedQuery(sql, params);
    }

    protected String visit(Expr node) {
        return node.accept(this);
    }

    protected List<String> visitAll(List<? extends Expr> nodes) {
        List<String> result = new ArrayList<>(nodes.size());
        for (Expr node : nodes) {
            result.add(visit(node));
        }
        return result;
    }

    protected static String join(List<String> parts) {
        return Joiner.on(", ").join(parts);
    }

    // Dialect hooks

    protected abstract String placeholder(String name);

    protected abstract String escapeString(String value);

    /**
     * {@code left = right} for generated conditions such as tenant guards, whose operands are never NULL.
     */
    protected abstract String printEquals(String left, String right);

    protected String printBoolean(boolean value) {
        return value ? "true" : "false";
    }

    protected String printAnd(List<String> operands) {
        return "(" + Joiner.on(" AND ").join(operands) + ")";
    }

    protected String printOr(List<String> operands) {
        return "(" + Joiner.on(" OR ").join(operands) + ")";
    }

    protected String printNot(String operand) {
        return "(NOT " + operand + ")";
    }

    protected String printArray(List<String> items) {
        return "[" + join(items) + "]";
    }

    protected String printTuple(List<String> items) {
        return "(" + join(items) + ")";
    }

    protected String quote(String identifier) {
        return Identifiers.quote(identifier, dialect);
    }

    /**
     * Whether physical tables get the {@code team_id} guard.
     */
    protected boolean guardsTenants() {
        return true;
    }

    /**
     * Whether the top-level limit is capped at the configured ceiling.
     */
    protected boolean capsLimit() {
        return true;
    }

    /**
     * Text appended after the top-level SELECT.
     */
    protected String trailingClauses() {
        return "";
    }

    protected boolean isTopLevel() {
        return selectDepth == 1;
    }

    // Literals

    protected String bind(Object value) {
        String name = PARAM_PREFIX + params.size();
        params.put(name, value);
        return placeholder(name);
    }

    protected String inlineLiteral(Object value) {
        return "'" + escapeString(value.toString()) + "'";
    }

    @Override
    public String visitConstant(Constant node) {
        Object value = node.value();
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean bool) {
            return printBoolean(bool);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number number && isFinite(number)) {
            return number.toString();
        }
        if (node.inline()) {
            return inlineLiteral(value);
        }
        return bind(value);
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double d) {
            return Double.isFinite(d);
        }
        if (number instanceof Float f) {
            return Float.isFinite(f);
        }
        return true;
    }

    protected static boolean isNullConstant(Expr expr) {
        return expr instanceof Constant constant && constant.isNull();
    }

    /**
     * Whether the operand may be NULL at runtime. A field of a table on the outer side of a LEFT, RIGHT or
     * FULL join of the SELECT being printed is nullable whatever its column type says.
     */
    protected boolean isNullable(Expr expr) {
        if (expr instanceof Constant constant) {
            return constant.isNull();
        }
        if (expr instanceof SelectQuery || expr instanceof TupleExpr || expr instanceof ArrayExpr) {
            return false;
        }
        if (expr instanceof Alias alias) {
            return isNullable(alias.expr());
        }
        if (expr.type() instanceof FieldType fieldType && isNullExtended(fieldType.tableType())) {
            return true;
        }
        return Types.isNullable(expr.type());
    }

    private boolean isNullExtended(TableOrSelectType tableType) {
        Set<String> aliases = nullExtendedAliases.peek();
        if (aliases == null || aliases.isEmpty()) {
            return false;
        }
        String alias = Types.aliasOf(tableType);
        return alias != null && aliases.contains(alias);
    }

    // Fields

    @Override
    public String visitField(Field node) {
        ResolvedType type = node.type();
        if (type == null) {
            List<String> parts = new ArrayList<>();
            for (String element : node.chain()) {
                parts.add(element.equals("*") ? "*" : quote(element));
            }
            return Joiner.on('.').join(parts);
        }
        if (type instanceof AsteriskType) {
            return "*";
        }
        if (type instanceof FieldAliasType aliasType) {
            return quote(aliasType.alias());
        }
        if (type instanceof LambdaArgumentType argumentType) {
            return quote(argumentType.name());
        }
        if (type instanceof PropertyType) {
            throw new ImpossibleAstError("Property access '" + node.dotted() + "' reached the printer unselected");
        }
        if (type instanceof FieldType fieldType) {
            return printFieldType(fieldType);
        }
        throw new ImpossibleAstError("Cannot print field '" + node.dotted() + "' of type "
                + type.getClass().getSimpleName());
    }

    protected String printFieldType(FieldType fieldType) {
        TableOrSelectType tableType = fieldType.tableType();
        if (tableType instanceof LazyJoinType || tableType instanceof LazyTableType) {
            throw new ImpossibleAstError("Unresolved lazy table " + Types.aliasOf(tableType)
                    + " reached the printer");
        }
        String column = fieldType.name();
        DatabaseField field = Types.databaseFieldOf(fieldType);
        if (field instanceof ColumnField columnField) {
            column = columnField.physicalName();
        } else if (field instanceof JsonPropertiesField propertiesField) {
            column = propertiesField.physicalName();
        }
        String alias = Types.aliasOf(tableType);
        return alias == null ? quote(column) : quote(alias) + "." + quote(column);
    }

    // Boolean structure

    @Override
    public String visitAnd(And node) {
        if (node.exprs().isEmpty()) {
            throw new ImpossibleAstError("AND without operands");
        }
        return printAnd(visitAll(node.exprs()));
    }

    @Override
    public String visitOr(Or node) {
        if (node.exprs().isEmpty()) {
            throw new ImpossibleAstError("OR without operands");
        }
        return printOr(visitAll(node.exprs()));
    }

    @Override
    public String visitNot(Not node) {
        return printNot(visit(node.expr()));
    }

    @Override
    public String visitCompareOperation(CompareOperation node) {
        return "(" + visit(node.left()) + " " + node.op().symbol() + " " + visit(node.right()) + ")";
    }

    // Calls

    @Override
    public String visitCall(Call node) {
        FunctionDef def = functions.lookup(node.name()).orElse(null);
        List<String> args = visitAll(node.args());
        return printCall(node, def, args);
    }

    protected String printCall(Call node, @Nullable FunctionDef def, List<String> args) {
        String name = def == null ? node.name() : def.nameFor(dialect);
        if (name == null) {
            throw new UnsupportedFeatureError(dialect, "Function '" + node.name() + "'");
        }
        StringBuilder sql = new StringBuilder(name);
        if (node.params() != null) {
            sql.append('(').append(join(visitAll(node.params()))).append(')');
        }
        sql.append('(');
        if (node.distinct()) {
            sql.append("DISTINCT ");
        }
        return sql.append(join(args)).append(')').toString();
    }

    @Override
    public String visitArray(ArrayExpr node) {
        return printArray(visitAll(node.exprs()));
    }

    @Override
    public String visitTuple(TupleExpr node) {
        return printTuple(visitAll(node.exprs()));
    }

    @Override
    public String visitAlias(Alias node) {
        return visit(node.expr());
    }

    @Override
    public String visitLambda(Lambda node) {
        List<String> args = new ArrayList<>();
        for (String arg : node.args()) {
            args.add(quote(arg));
        }
        String head = args.size() == 1 ? args.get(0) : "(" + join(args) + ")";
        return head + " -> " + visit(node.expr());
    }

    @Override
    public String visitOrderExpr(OrderExpr node) {
        return visit(node.expr()) + " " + node.order().name();
    }

    // Window functions

    /**
     * Name of the window function in this dialect, also telling whether an explicit frame is required.
     */
    protected String windowFunctionName(WindowFunction node) {
        FunctionDef def = functions.lookup(node.name()).orElse(null);
        String name = def == null ? node.name() : def.nameFor(dialect);
        if (name == null) {
            throw new UnsupportedFeatureError(dialect, "Window function '" + node.name() + "'");
        }
        return name;
    }

    @Override
    public String visitWindowFunction(WindowFunction node) {
        String name = windowFunctionName(node);
        WindowExpr over = node.over();
        if (over.frame() == null && !dialect.capabilities().nativeWindowOffsets() && name.endsWith("InFrame")) {
            over = over.withFrame(WindowFrame.unbounded());
        }
        return name + "(" + join(visitAll(node.args())) + ") OVER (" + printWindow(over) + ")";
    }

    protected String printWindow(WindowExpr over) {
        List<String> parts = new ArrayList<>();
        if (!over.partitionBy().isEmpty()) {
            parts.add("PARTITION BY " + join(visitAll(over.partitionBy())));
        }
        if (!over.orderBy().isEmpty()) {
            parts.add("ORDER BY " + join(visitAll(over.orderBy())));
        }
        if (over.frame() != null) {
            parts.add(printFrame(over.frame()));
        }
        return Joiner.on(' ').join(parts);
    }

    private String printFrame(WindowFrame frame) {
        if (frame.end() == null) {
            return frame.method().name() + " " + printBound(frame.start());
        }
        return frame.method().name() + " BETWEEN " + printBound(frame.start()) + " AND " + printBound(frame.end());
    }

    private String printBound(WindowFrame.Bound bound) {
        switch (bound.kind()) {
            case CURRENT_ROW:
                return "CURRENT ROW";
            case PRECEDING:
                return (bound.offset() == null ? "UNBOUNDED" : bound.offset().toString()) + " PRECEDING";
            default:
                return (bound.offset() == null ? "UNBOUNDED" : bound.offset().toString()) + " FOLLOWING";
        }
    }

    // SELECT

    @Override
    public String visitSelectQuery(SelectQuery node) {
        selectDepth++;
        nullExtendedAliases.push(nullExtendedAliasesOf(node.selectFrom()));
        try {
            boolean topLevel = isTopLevel();
            StringBuilder sql = new StringBuilder("SELECT ");
            if (node.distinct()) {
                sql.append("DISTINCT ");
            }
            List<String> columns = new ArrayList<>();
            for (Expr column : node.select()) {
                columns.add(printColumn(column));
            }
            sql.append(join(columns));

            List<String> conditions = new ArrayList<>();
            if (node.selectFrom() != null) {
                sql.append(" FROM ").append(printJoinChain(node.selectFrom(), conditions));
            }
            if (node.arrayJoin() != null) {
                List<String> items = new ArrayList<>();
                for (Expr expr : node.arrayJoin().exprs()) {
                    items.add(printColumn(expr));
                }
                sql.append(node.arrayJoin().kind() == ArrayJoin.Kind.LEFT ? " LEFT ARRAY JOIN " : " ARRAY JOIN ")
                        .append(join(items));
            }
            if (node.prewhere() != null) {
                sql.append(" PREWHERE ").append(visit(node.prewhere()));
            }
            if (node.where() != null) {
                conditions.add(visit(node.where()));
            }
            if (!conditions.isEmpty()) {
                sql.append(" WHERE ").append(conditions.size() == 1 ? conditions.get(0) : printAnd(conditions));
            }
            if (!node.groupBy().isEmpty()) {
                sql.append(" GROUP BY ").append(join(visitAll(node.groupBy())));
            }
            if (node.having() != null) {
                sql.append(" HAVING ").append(visit(node.having()));
            }
            if (!node.orderBy().isEmpty()) {
                sql.append(" ORDER BY ").append(join(visitAll(node.orderBy())));
            }
            if (node.limitBy() != null) {
                sql.append(" LIMIT ").append(visit(node.limitBy().n()));
                if (node.limitBy().offset() != null) {
                    sql.append(" OFFSET ").append(visit(node.limitBy().offset()));
                }
                sql.append(" BY ").append(join(visitAll(node.limitBy().exprs())));
            }
            String limit = printLimit(node.limit(), topLevel);
            if (limit != null) {
                sql.append(" LIMIT ").append(limit);
            }
            if (node.offset() != null) {
                sql.append(" OFFSET ").append(visit(node.offset()));
            }
            return topLevel ? sql.toString() : "(" + sql + ")";
        } finally {
            nullExtendedAliases.pop();
            selectDepth--;
        }
    }

    /**
     * Aliases of the FROM chain whose rows may be padded with NULLs by an outer join.
     */
    private Set<String> nullExtendedAliasesOf(@Nullable JoinExpr first) {
        Set<String> aliases = new HashSet<>();
        if (first == null) {
            return aliases;
        }
        List<JoinExpr> elements = first.toList();
        for (int i = 1; i < elements.size(); i++) {
            String joinType = elements.get(i).joinType();
            if (joinType == null) {
                continue;
            }
            if (joinType.contains("LEFT") || joinType.contains("FULL")) {
                addAlias(aliases, elements.get(i));
            }
            if (joinType.contains("RIGHT") || joinType.contains("FULL")) {
                for (int j = 0; j < i; j++) {
                    addAlias(aliases, elements.get(j));
                }
            }
        }
        return aliases;
    }

    private void addAlias(Set<String> aliases, JoinExpr join) {
        if (join.alias() != null) {
            aliases.add(join.alias());
            return;
        }
        TableOrSelectType tableType = tableTypeOf(join);
        String alias = tableType == null ? null : Types.aliasOf(tableType);
        if (alias != null) {
            aliases.add(alias);
        }
    }

    private String printColumn(Expr column) {
        if (column instanceof Alias alias && !alias.hidden()) {
            Identifiers.checkAlias(alias.alias());
            return visit(alias.expr()) + " AS " + quote(alias.alias());
        }
        return visit(column);
    }

    @Nullable
    private String printLimit(@Nullable Expr limit, boolean topLevel) {
        if (!topLevel || !capsLimit()) {
            return limit == null ? null : visit(limit);
        }
        long max = settings.maxLimit();
        if (limit == null) {
            return String.valueOf(max);
        }
        if (limit instanceof Constant constant && constant.value() instanceof Number number) {
            return String.valueOf(Math.min(number.longValue(), max));
        }
        return visit(new Call("min2", List.of(new Constant(max), limit)));
    }

    // FROM

    @Override
    public String visitJoinExpr(JoinExpr node) {
        throw new ImpossibleAstError("JOIN printed outside of a SELECT");
    }

    /**
     * Prints the FROM chain. Tenant guards of inner tables are added to {@code conditions}, the WHERE
     * conditions of the SELECT; those of LEFT-joined tables go into the ON clause.
     */
    private String printJoinChain(JoinExpr first, List<String> conditions) {
        StringBuilder sql = new StringBuilder();
        List<JoinExpr> elements = first.toList();
        for (int i = 0; i < elements.size(); i++) {
            JoinExpr join = elements.get(i);
            if (i > 0) {
                sql.append(' ').append(join.joinType() == null ? "JOIN" : join.joinType()).append(' ');
            }
            sql.append(printJoinTable(join));
            if (join.sample() != null) {
                sql.append(" SAMPLE ").append(printRatio(join.sample().sampleValue()));
                if (join.sample().offsetValue() != null) {
                    sql.append(" OFFSET ").append(printRatio(join.sample().offsetValue()));
                }
            }
            String constraint = join.constraint() == null ? null : printConstraint(join.constraint());
            String guard = tenantGuard(join);
            boolean leftJoin = i > 0 && join.joinType() != null && join.joinType().startsWith("LEFT");
            if (guard != null && leftJoin) {
                constraint = constraint == null ? guard : printAnd(List.of(constraint, guard));
            } else if (guard != null) {
                conditions.add(guard);
            }
            if (constraint != null) {
                boolean using = join.constraint() != null
                        && join.constraint().constraintType() == JoinConstraint.ConstraintType.USING;
                sql.append(using ? " USING " : " ON ").append(constraint);
            }
        }
        return sql.toString();
    }

    private String printConstraint(JoinConstraint constraint) {
        // ON compares matched rows only
        nullExtendedAliases.push(Set.of());
        try {
            return visit(constraint.expr());
        } finally {
            nullExtendedAliases.pop();
        }
    }

    private String printRatio(RatioExpr ratio) {
        String left = visit(ratio.left());
        return ratio.right() == null ? left : left + "/" + visit(ratio.right());
    }

    @Nullable
    private TableOrSelectType tableTypeOf(JoinExpr join) {
        if (join.type() instanceof TableOrSelectType tableType) {
            return tableType;
        }
        if (join.table().type() instanceof TableOrSelectType tableType) {
            return tableType;
        }
        return null;
    }

    protected String printJoinTable(JoinExpr join) {
        Expr table = join.table();
        if (table instanceof SelectQuery) {
            String subquery = visit(table);
            if (join.alias() == null) {
                return subquery;
            }
            Identifiers.checkAlias(join.alias());
            return subquery + " AS " + quote(join.alias());
        }
        if (!(table instanceof Field field)) {
            throw new ImpossibleAstError("Unsupported FROM element " + table.getClass().getSimpleName());
        }
        TableOrSelectType tableType = tableTypeOf(join);
        if (tableType == null) {
            String name = visit(field);
            return join.alias() == null ? name : name + " AS " + quote(join.alias());
        }
        Table databaseTable = Types.tableOf(tableType);
        if (databaseTable == null) {
            throw new ImpossibleAstError("FROM element without a table: " + tableType);
        }
        if (databaseTable instanceof LazyTable) {
            throw new ImpossibleAstError("Unresolved lazy table " + databaseTable.name() + " reached the printer");
        }
        String name = tableName(databaseTable);
        String alias = join.alias() != null ? join.alias() : Types.aliasOf(tableType);
        if (alias == null || alias.equals(name)) {
            return quote(name);
        }
        Identifiers.checkAlias(alias);
        return quote(name) + " AS " + quote(alias);
    }

    protected String tableName(Table table) {
        return table instanceof PhysicalTable physicalTable ? physicalTable.physicalName() : table.name();
    }

    @Nullable
    private String tenantGuard(JoinExpr join) {
        if (!guardsTenants() || !(join.table() instanceof Field)) {
            return null;
        }
        TableOrSelectType tableType = tableTypeOf(join);
        if (tableType == null) {
            return null;
        }
        Table table = Types.tableOf(tableType);
        if (!(table instanceof PhysicalTable physicalTable) || !physicalTable.isTenantScoped()) {
            return null;
        }
        String alias = join.alias() != null ? join.alias() : Types.aliasOf(tableType);
        return printEquals(quote(alias) + "." + quote("team_id"), String.valueOf(teamId));
    }
}
