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

package com.strata.resolver;

import com.google.common.base.Joiner;
import com.strata.ast.*;
import com.strata.ast.types.*;
import com.strata.common.utils.NearestMatch;
import com.strata.compiler.CompileContext;
import com.strata.compiler.CompilerPass;
import com.strata.database.*;
import com.strata.errors.ImpossibleAstError;
import com.strata.errors.QueryError;
import com.strata.errors.ResolutionError;
import com.strata.functions.FunctionDef;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.Temporal;
import java.util.*;

/**
 * Binds every field, table and call of a tree to a {@link ResolvedType}.
 * <p>
 * Unqualified names are looked up in the innermost scope first: column aliases of the same SELECT, then
 * the tables of its FROM chain, then enclosing lambda and table scopes up to the nearest SELECT. A name
 * found only in an enclosing SELECT would be a correlated reference and is rejected. A name found in
 * more than one table of the same scope is ambiguous. Anything that does not resolve aborts the compile with a
 * {@link ResolutionError} naming the closest candidate.
 */
public final class Resolver implements CompilerPass {
    @Override
    public Expr apply(Expr node, CompileContext context) {
        return analyze(node, context).expr();
    }

    @Override
    public String getName() {
        return "Resolver";
    }

    /**
     * Resolves a tree and returns it with the scopes of every SELECT it contains, innermost first.
     */
    public Resolution analyze(Expr node, CompileContext context) {
        ResolvingVisitor visitor = new ResolvingVisitor(context);
        Expr resolved = node.accept(visitor);
        return new Resolution(resolved, List.copyOf(visitor.closedScopes));
    }

    /**
     * Resolves an expression against the given tables only, e.g. the ON clause of a join being spliced
     * into an already resolved SELECT.
     */
    public Expr resolveInTables(Expr node, Map<String, TableOrSelectType> tables, CompileContext context) {
        ResolvingVisitor visitor = new ResolvingVisitor(context);
        Scope scope = new Scope(Scope.Kind.SELECT);
        for (Map.Entry<String, TableOrSelectType> entry : tables.entrySet()) {
            scope.addTable(entry.getKey(), entry.getValue());
        }
        visitor.scopes.push(scope);
        try {
            return node.accept(visitor);
        } finally {
            visitor.scopes.pop();
        }
    }

    public record Resolution(Expr expr, List<Scope> scopes) {
    }

    private static final class ResolvingVisitor implements ExprVisitor<Expr> {
        private final CompileContext context;
        private final Deque<Scope> scopes = new ArrayDeque<>();
        private final List<Scope> closedScopes = new ArrayList<>();
        private int aggregateDepth;

        ResolvingVisitor(CompileContext context) {
            this.context = context;
        }

        private Expr resolve(Expr node) {
            return node.accept(this);
        }

        @Nullable
        private Expr resolveOptional(@Nullable Expr node) {
            return node == null ? null : resolve(node);
        }

        private List<Expr> resolveAll(List<Expr> nodes) {
            List<Expr> result = new ArrayList<>(nodes.size());
            for (Expr node : nodes) {
                result.add(resolve(node));
            }
            return result;
        }

        private List<OrderExpr> resolveOrder(List<OrderExpr> nodes) {
            List<OrderExpr> result = new ArrayList<>(nodes.size());
            for (OrderExpr node : nodes) {
                result.add((OrderExpr) resolve(node));
            }
            return result;
        }

        private Scope currentScope() {
            Scope scope = scopes.peek();
            if (scope == null) {
                throw new ResolutionError("Field references are only valid inside a SELECT");
            }
            return scope;
        }

        private int selectDepth() {
            int depth = 0;
            for (Scope scope : scopes) {
                if (scope.kind() == Scope.Kind.SELECT) {
                    depth++;
                }
            }
            return depth;
        }

        @Override
        public Expr visitConstant(Constant node) {
            return node.withType(ConstantType.of(kindOfValue(node.value()), node.value() == null));
        }

        @Override
        public Expr visitField(Field node) {
            if (node.type() != null) {
                return node;
            }
            return lookupField(node);
        }

        @Override
        public Expr visitCompareOperation(CompareOperation node) {
            Expr left = resolve(node.left());
            Expr right = resolve(node.right());
            if (node.op().isCohort() && !(right instanceof Constant)) {
                throw new QueryError("IN COHORT expects a cohort id constant");
            }
            return new CompareOperation(node.op(), left, right, ConstantType.BOOLEAN);
        }

        @Override
        public Expr visitAnd(And node) {
            return new And(resolveAll(node.exprs()), ConstantType.BOOLEAN);
        }

        @Override
        public Expr visitOr(Or node) {
            return new Or(resolveAll(node.exprs()), ConstantType.BOOLEAN);
        }

        @Override
        public Expr visitNot(Not node) {
            return new Not(resolve(node.expr()), ConstantType.BOOLEAN);
        }

        @Override
        public Expr visitCall(Call node) {
            FunctionDef def = context.functions().require(node.name(), node.args().size());
            if (def.aggregate() && aggregateDepth > 0) {
                throw new QueryError("Aggregation '" + node.name() + "' cannot be nested inside another aggregation",
                        node.name(), null);
            }
            if (def.aggregate()) {
                aggregateDepth++;
            }
            List<Expr> args;
            List<Expr> params;
            try {
                args = resolveAll(node.args());
                params = node.params() == null ? null : resolveAll(node.params());
            } finally {
                if (def.aggregate()) {
                    aggregateDepth--;
                }
            }
            return new Call(node.name(), args, params, node.distinct(), new CallType(node.name(), returnTypeOf(def, args)));
        }

        private ConstantType returnTypeOf(FunctionDef def, List<Expr> args) {
            ValueKind kind = def.returnKind();
            if (kind == ValueKind.UNKNOWN && !args.isEmpty()) {
                kind = Types.kindOf(args.get(args.size() > 2 && def.name().equals("if") ? 1 : 0).type());
            }
            boolean nullable;
            switch (def.nullability()) {
                case NEVER:
                    nullable = false;
                    break;
                case ALWAYS:
                    nullable = true;
                    break;
                default:
                    nullable = false;
                    for (Expr arg : args) {
                        if (Types.isNullable(arg.type())) {
                            nullable = true;
                            break;
                        }
                    }
            }
            return ConstantType.of(kind, nullable);
        }

        @Override
        public Expr visitArray(ArrayExpr node) {
            return new ArrayExpr(resolveAll(node.exprs()), ConstantType.of(ValueKind.ARRAY, false));
        }

        @Override
        public Expr visitTuple(TupleExpr node) {
            return new TupleExpr(resolveAll(node.exprs()), ConstantType.of(ValueKind.TUPLE, false));
        }

        @Override
        public Expr visitAlias(Alias node) {
            Scope scope = scopes.peek();
            if (scope != null) {
                scope.beginAlias(node.alias());
            }
            try {
                Expr expr = resolve(node.expr());
                return new Alias(node.alias(), expr, node.hidden(), expr.type());
            } finally {
                if (scope != null) {
                    scope.endAlias(node.alias());
                }
            }
        }

        @Override
        public Expr visitLambda(Lambda node) {
            Scope scope = new Scope(Scope.Kind.LAMBDA);
            for (String arg : node.args()) {
                scope.addLambdaArgument(arg);
            }
            scopes.push(scope);
            try {
                Expr expr = resolve(node.expr());
                return new Lambda(node.args(), expr, ConstantType.UNKNOWN);
            } finally {
                scopes.pop();
            }
        }

        @Override
        public Expr visitSelectQuery(SelectQuery node) {
            if (selectDepth() + 1 > context.settings().maxSubqueryDepth()) {
                throw new QueryError("Subqueries are nested deeper than the limit of "
                        + context.settings().maxSubqueryDepth());
            }
            int savedAggregateDepth = aggregateDepth;
            aggregateDepth = 0;
            Scope scope = new Scope(Scope.Kind.SELECT);
            scopes.push(scope);
            try {
                JoinExpr selectFrom = node.selectFrom() == null ? null : resolveJoinChain(node.selectFrom(), scope);

                ArrayJoin arrayJoin = null;
                if (node.arrayJoin() != null) {
                    List<Expr> exprs = resolveAll(node.arrayJoin().exprs());
                    for (Expr expr : exprs) {
                        if (expr instanceof Alias alias) {
                            scope.addColumnAlias(alias.alias(), new FieldAliasType(alias.alias(), typeOrUnknown(alias)));
                        }
                    }
                    arrayJoin = new ArrayJoin(node.arrayJoin().kind(), exprs);
                }

                List<Expr> select = new ArrayList<>();
                for (Expr column : node.select()) {
                    if (column instanceof Field field && field.type() == null && isAsterisk(field)) {
                        select.addAll(expandAsterisk(field, scope));
                        continue;
                    }
                    Expr resolved = resolve(column);
                    if (resolved instanceof Alias alias && !alias.hidden()) {
                        scope.addColumnAlias(alias.alias(), new FieldAliasType(alias.alias(), typeOrUnknown(alias)));
                    }
                    select.add(resolved);
                }

                LimitBy limitBy = null;
                if (node.limitBy() != null) {
                    limitBy = new LimitBy(resolve(node.limitBy().n()), resolveOptional(node.limitBy().offset()),
                            resolveAll(node.limitBy().exprs()));
                }

                SelectQuery.Builder builder = SelectQuery.builder()
                        .select(select)
                        .distinct(node.distinct())
                        .selectFrom(selectFrom)
                        .arrayJoin(arrayJoin)
                        .prewhere(resolveOptional(node.prewhere()))
                        .where(resolveOptional(node.where()))
                        .groupBy(resolveAll(node.groupBy()))
                        .having(resolveOptional(node.having()))
                        .orderBy(resolveOrder(node.orderBy()))
                        .limit(resolveOptional(node.limit()))
                        .offset(resolveOptional(node.offset()))
                        .limitBy(limitBy);
                builder.type(new SelectQueryType(columnsOf(select), scope.tables()));
                return builder.build();
            } finally {
                scopes.pop();
                closedScopes.add(scope);
                aggregateDepth = savedAggregateDepth;
            }
        }

        private ResolvedType typeOrUnknown(Expr expr) {
            return expr.type() == null ? ConstantType.UNKNOWN : expr.type();
        }

        private Map<String, ResolvedType> columnsOf(List<Expr> select) {
            Map<String, ResolvedType> columns = new LinkedHashMap<>();
            for (Expr expr : select) {
                if (expr instanceof Alias alias) {
                    columns.put(alias.alias(), typeOrUnknown(alias.expr()));
                } else if (expr instanceof Field field) {
                    columns.putIfAbsent(field.chain().get(field.chain().size() - 1), typeOrUnknown(field));
                }
            }
            return columns;
        }

        private JoinExpr resolveJoinChain(JoinExpr join, Scope scope) {
            List<JoinExpr> resolved = new ArrayList<>();
            for (JoinExpr element : join.toList()) {
                resolved.add(resolveJoinElement(element, scope));
            }
            return JoinExpr.chain(resolved);
        }

        private JoinExpr resolveJoinElement(JoinExpr join, Scope scope) {
            if (join.type() != null) {
                String alias = join.alias() != null ? join.alias() : Types.aliasOf((TableOrSelectType) join.type());
                if (alias != null && !scope.tables().containsKey(alias)) {
                    scope.addTable(alias, (TableOrSelectType) join.type());
                }
                return join;
            }
            Expr table;
            TableOrSelectType tableType;
            String alias;
            if (join.table() instanceof Field field) {
                if (field.chain().size() != 1) {
                    throw new ResolutionError("Unknown table '" + field.dotted() + "'", field.dotted(), null);
                }
                String name = field.chain().get(0);
                Table databaseTable = context.database().getTable(name);
                if (databaseTable == null) {
                    throw new ResolutionError("Unknown table '" + name + "'", name,
                            NearestMatch.find(name, context.database().tableNames()));
                }
                alias = join.alias() != null ? join.alias() : name;
                if (databaseTable instanceof LazyTable lazyTable) {
                    tableType = new LazyTableType(lazyTable, alias);
                } else {
                    TableType plain = new TableType(databaseTable);
                    tableType = join.alias() != null && !join.alias().equals(name)
                            ? new TableAliasType(join.alias(), plain) : plain;
                }
                table = field.withType(tableType);
            } else if (join.table() instanceof SelectQuery subquery) {
                SelectQuery resolvedSubquery = (SelectQuery) resolve(subquery);
                SelectQueryType subqueryType = (SelectQueryType) resolvedSubquery.type();
                alias = join.alias();
                tableType = alias == null ? subqueryType : new SelectQueryAliasType(alias, subqueryType);
                table = resolvedSubquery;
            } else {
                throw new ImpossibleAstError("Unsupported FROM element " + join.table().getClass().getSimpleName());
            }
            if (alias != null) {
                scope.addTable(alias, tableType);
            } else {
                scope.addTable("__subquery_" + scope.tables().size(), tableType);
            }
            JoinConstraint constraint = null;
            if (join.constraint() != null) {
                constraint = join.constraint().withExpr(resolve(join.constraint().expr()));
            }
            return new JoinExpr(join.joinType(), table, join.alias(), constraint, join.sample(), null, tableType);
        }

        @Override
        public Expr visitJoinExpr(JoinExpr node) {
            return resolveJoinChain(node, currentScope());
        }

        @Override
        public Expr visitOrderExpr(OrderExpr node) {
            Expr expr = resolve(node.expr());
            return new OrderExpr(expr, node.order(), expr.type());
        }

        @Override
        public Expr visitWindowFunction(WindowFunction node) {
            FunctionDef def = context.functions().require(node.name(), node.args().size());
            List<Expr> args = resolveAll(node.args());
            WindowExpr over = new WindowExpr(resolveAll(node.over().partitionBy()), resolveOrder(node.over().orderBy()),
                    node.over().frame());
            return new WindowFunction(node.name(), args, over, new CallType(node.name(), returnTypeOf(def, args)));
        }

        // Field lookup

        private boolean isAsterisk(Field field) {
            return "*".equals(field.chain().get(field.chain().size() - 1));
        }

        private List<Expr> expandAsterisk(Field field, Scope scope) {
            Map<String, TableOrSelectType> tables = new LinkedHashMap<>();
            if (field.chain().size() == 1) {
                tables.putAll(scope.tables());
            } else {
                String alias = field.chain().get(0);
                TableOrSelectType type = scope.tables().get(alias);
                if (type == null) {
                    throw new ResolutionError("Unknown table alias '" + alias + "'", field.dotted(),
                            NearestMatch.find(alias, scope.tables().keySet()));
                }
                tables.put(alias, type);
            }
            if (tables.isEmpty()) {
                throw new ResolutionError("SELECT * requires a FROM clause", field.dotted(), null);
            }
            List<Expr> result = new ArrayList<>();
            for (Map.Entry<String, TableOrSelectType> entry : tables.entrySet()) {
                for (String column : visibleColumns(entry.getValue())) {
                    result.add(new Field(List.of(entry.getKey(), column), new FieldType(column, entry.getValue())));
                }
            }
            return result;
        }

        private List<String> visibleColumns(TableOrSelectType type) {
            List<String> columns = new ArrayList<>();
            if (type instanceof SelectQueryAliasType aliasType) {
                columns.addAll(aliasType.selectQueryType().columns().keySet());
                return columns;
            }
            if (type instanceof SelectQueryType selectQueryType) {
                columns.addAll(selectQueryType.columns().keySet());
                return columns;
            }
            Table table = Types.tableOf(type);
            if (table != null) {
                for (DatabaseField field : table.fields().values()) {
                    if (field.hidden()) {
                        continue;
                    }
                    if (field instanceof ColumnField || field instanceof JsonPropertiesField) {
                        columns.add(field.name());
                    }
                }
            }
            return columns;
        }

        private Expr lookupField(Field node) {
            List<String> chain = node.chain();
            String first = chain.get(0);
            if (first.equals("*") && chain.size() == 1) {
                Scope scope = currentScope();
                if (scope.tables().size() == 1) {
                    return node.withType(new AsteriskType(scope.tables().values().iterator().next()));
                }
                throw new ResolutionError("'*' is ambiguous here", "*", null);
            }

            for (Scope scope : scopes) {
                Expr resolved = lookupInScope(node, scope);
                if (resolved != null) {
                    return resolved;
                }
                if (scope.kind() == Scope.Kind.SELECT) {
                    break;
                }
            }
            if (resolvesInEnclosingSelect(node)) {
                throw new ResolutionError("Unable to resolve field '" + node.dotted()
                        + "': it belongs to an enclosing query and correlated subqueries are not supported",
                        node.dotted(), null);
            }
            throw new ResolutionError("Unable to resolve field '" + node.dotted() + "'", node.dotted(),
                    NearestMatch.find(first, candidateNames()));
        }

        private boolean resolvesInEnclosingSelect(Field node) {
            boolean crossedSelect = false;
            for (Scope scope : scopes) {
                if (crossedSelect && lookupInScope(node, scope) != null) {
                    return true;
                }
                if (scope.kind() == Scope.Kind.SELECT) {
                    crossedSelect = true;
                }
            }
            return false;
        }

        private Set<String> candidateNames() {
            Set<String> names = new TreeSet<>();
            for (Scope scope : scopes) {
                names.addAll(scope.columnAliases().keySet());
                names.addAll(scope.tables().keySet());
                for (TableOrSelectType type : scope.tables().values()) {
                    Table table = Types.tableOf(type);
                    if (table != null) {
                        names.addAll(table.fields().keySet());
                    } else {
                        names.addAll(visibleColumns(type));
                    }
                }
                if (scope.kind() == Scope.Kind.SELECT) {
                    break;
                }
            }
            return names;
        }

        @Nullable
        private Expr lookupInScope(Field node, Scope scope) {
            List<String> chain = node.chain();
            String first = chain.get(0);

            if (scope.kind() == Scope.Kind.LAMBDA) {
                if (scope.hasLambdaArgument(first)) {
                    return node.withType(new LambdaArgumentType(first));
                }
                return null;
            }

            if (chain.size() == 1 && scope.isAliasVisible(first)) {
                return node.withType(scope.columnAliases().get(first));
            }

            TableOrSelectType aliased = scope.tables().get(first);
            if (aliased != null && chain.size() > 1) {
                return resolveChainOn(aliased, chain.subList(1, chain.size()), chain);
            }

            TableOrSelectType owner = null;
            for (Map.Entry<String, TableOrSelectType> entry : scope.tables().entrySet()) {
                if (hasMember(entry.getValue(), first)) {
                    if (owner != null) {
                        throw new ResolutionError("Ambiguous reference '" + node.dotted()
                                + "', it exists in more than one table", node.dotted(), null);
                    }
                    owner = entry.getValue();
                }
            }
            if (owner != null) {
                return resolveChainOn(owner, chain, chain);
            }
            if (aliased != null) {
                throw new ResolutionError("'" + first + "' is a table, not a field", first, null);
            }
            return null;
        }

        private boolean hasMember(TableOrSelectType type, String name) {
            if (type instanceof SelectQueryAliasType aliasType) {
                return aliasType.selectQueryType().columns().containsKey(name);
            }
            if (type instanceof SelectQueryType selectQueryType) {
                return selectQueryType.columns().containsKey(name);
            }
            Table table = Types.tableOf(type);
            return table != null && table.hasField(name);
        }

        /**
         * Resolves {@code chain} relative to {@code tableType}. {@code fullChain} is the chain as written,
         * kept on the resulting field node.
         */
        private Expr resolveChainOn(TableOrSelectType tableType, List<String> chain, List<String> fullChain) {
            String name = chain.get(0);
            List<String> rest = chain.subList(1, chain.size());
            String dotted = Joiner.on('.').join(fullChain);

            if (tableType instanceof SelectQueryAliasType || tableType instanceof SelectQueryType) {
                SelectQueryType selectType = tableType instanceof SelectQueryAliasType aliasType
                        ? aliasType.selectQueryType() : (SelectQueryType) tableType;
                ResolvedType column = selectType.columns().get(name);
                if (column == null) {
                    throw new ResolutionError("Unknown column '" + name + "' in subquery", dotted,
                            NearestMatch.find(name, selectType.columns().keySet()));
                }
                FieldType fieldType = new FieldType(name, tableType);
                if (rest.isEmpty()) {
                    return new Field(fullChain, fieldType);
                }
                ResolvedType inner = Types.unwrapAliases(column);
                if (inner instanceof FieldType innerField && Types.databaseFieldOf(innerField) instanceof JsonPropertiesField) {
                    return new Field(fullChain, new PropertyType(rest, fieldType));
                }
                throw new ResolutionError("Cannot access '" + dotted + "', '" + name + "' has no members", dotted, null);
            }

            Table table = Types.tableOf(tableType);
            if (table == null) {
                throw new ImpossibleAstError("Table-like type without a table: " + tableType);
            }
            DatabaseField field = table.getField(name);
            if (field == null) {
                throw new ResolutionError("Unknown field '" + name + "' on table '" + table.name() + "'", dotted,
                        NearestMatch.find(name, table.fields().keySet()));
            }

            if (field instanceof ColumnField) {
                if (!rest.isEmpty()) {
                    throw new ResolutionError("Cannot access '" + dotted + "', '" + name + "' is a plain column",
                            dotted, null);
                }
                return new Field(fullChain, new FieldType(name, tableType));
            }
            if (field instanceof JsonPropertiesField) {
                FieldType fieldType = new FieldType(name, tableType);
                if (rest.isEmpty()) {
                    return new Field(fullChain, fieldType);
                }
                return new Field(fullChain, new PropertyType(rest, fieldType));
            }
            if (field instanceof LazyJoin lazyJoin) {
                if (rest.isEmpty()) {
                    throw new ResolutionError("'" + dotted + "' is a joined table, select one of its fields", dotted,
                            null);
                }
                return resolveChainOn(new LazyJoinType(tableType, name, lazyJoin), rest, fullChain);
            }
            if (field instanceof FieldTraverser traverser) {
                List<String> traversed = new ArrayList<>(traverser.chain());
                traversed.addAll(rest);
                return resolveChainOn(tableType, traversed, fullChain);
            }
            if (field instanceof VirtualTableField virtualTable) {
                if (rest.isEmpty()) {
                    throw new ResolutionError("'" + dotted + "' is a virtual table, select one of its fields", dotted,
                            null);
                }
                FieldTraverser member = virtualTable.fields().get(rest.get(0));
                if (member == null) {
                    throw new ResolutionError("Unknown field '" + rest.get(0) + "' on '" + name + "'", dotted,
                            NearestMatch.find(rest.get(0), virtualTable.fields().keySet()));
                }
                List<String> traversed = new ArrayList<>(member.chain());
                traversed.addAll(rest.subList(1, rest.size()));
                return resolveChainOn(tableType, traversed, fullChain);
            }
            if (field instanceof ExpressionField expressionField) {
                if (!rest.isEmpty()) {
                    throw new ResolutionError("Cannot access '" + dotted + "', '" + name + "' is computed", dotted, null);
                }
                return resolveExpressionField(expressionField, tableType);
            }
            throw new ImpossibleAstError("Unknown database field kind " + field.getClass().getSimpleName());
        }

        private Expr resolveExpressionField(ExpressionField field, TableOrSelectType tableType) {
            Scope scope = new Scope(Scope.Kind.TABLE);
            String alias = Types.aliasOf(tableType);
            scope.addTable(alias == null ? "__table" : alias, tableType);
            scopes.push(scope);
            try {
                Expr expr = resolve(CloningVisitor.cloneExpr(field.expr(), CloneOptions.clearTypes()));
                return new Alias(field.name(), expr, true, expr.type());
            } finally {
                scopes.pop();
            }
        }

        private ValueKind kindOfValue(@Nullable Object value) {
            if (value == null) {
                return ValueKind.UNKNOWN;
            }
            if (value instanceof String) {
                return ValueKind.STRING;
            }
            if (value instanceof Boolean) {
                return ValueKind.BOOLEAN;
            }
            if (value instanceof Integer || value instanceof Long) {
                return ValueKind.INTEGER;
            }
            if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
                return ValueKind.FLOAT;
            }
            if (value instanceof LocalDate) {
                return ValueKind.DATE;
            }
            if (value instanceof Temporal) {
                return ValueKind.DATETIME;
            }
            if (value instanceof UUID) {
                return ValueKind.UUID;
            }
            if (value instanceof List) {
                return ValueKind.ARRAY;
            }
            return ValueKind.UNKNOWN;
        }
    }
}
