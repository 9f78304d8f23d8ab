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

package com.strata.joins;

import com.strata.ast.Alias;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.JoinConstraint;
import com.strata.ast.JoinExpr;
import com.strata.ast.RewritingVisitor;
import com.strata.ast.SelectQuery;
import com.strata.ast.TraversingVisitor;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.LazyJoinType;
import com.strata.ast.types.LazyTableType;
import com.strata.ast.types.PropertyType;
import com.strata.ast.types.SelectQueryAliasType;
import com.strata.ast.types.SelectQueryType;
import com.strata.ast.types.TableAliasType;
import com.strata.ast.types.TableOrSelectType;
import com.strata.ast.types.TableType;
import com.strata.ast.types.Types;
import com.strata.compiler.CompileContext;
import com.strata.compiler.CompilerPass;
import com.strata.database.LazyTable;
import com.strata.database.PhysicalTable;
import com.strata.database.Table;
import com.strata.errors.ImpossibleAstError;
import com.strata.properties.PropertyAccessSelector;
import com.strata.pushdown.NullRejection;
import com.strata.pushdown.PushdownTarget;
import com.strata.pushdown.WherePushdownOptimizer;
import com.strata.resolver.Resolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns lazy joins and lazy tables into concrete joins and subqueries.
 * <p>
 * SELECTs are processed innermost first. For each one, every lazy join its fields walk through is
 * spliced into the FROM chain exactly once, after the existing joins and after the joins its own ON
 * expression depends on. Lazy tables are replaced by the subquery they materialize to, which selects
 * only the fields the SELECT reads. With pushdown enabled the SELECT's WHERE is offered to the
 * {@link WherePushdownOptimizer} for every subquery; into the right side of a LEFT JOIN only
 * null-rejecting filters are pushed.
 */
public class LazyJoinMaterializer implements CompilerPass {
    private static final Logger LOGGER = LoggerFactory.getLogger(LazyJoinMaterializer.class);

    private final Resolver resolver = new Resolver();
    private final PropertyAccessSelector propertyAccessSelector = new PropertyAccessSelector();

    @Override
    public Expr apply(Expr node, CompileContext context) {
        return new MaterializingVisitor(context).rewriteRequired(node);
    }

    @Override
    public String getName() {
        return "LazyJoinMaterializer";
    }

    private static TableOrSelectType rootOf(TableOrSelectType type) {
        TableOrSelectType current = type;
        while (current instanceof LazyJoinType lazyJoinType) {
            current = lazyJoinType.sourceType();
        }
        return current;
    }

    /**
     * Collects the lazy joins referenced by field types, in first-use order, dependencies first.
     */
    private static final class LazyJoinCollector extends TraversingVisitor {
        private final Set<LazyJoinType> found = new LinkedHashSet<>();

        private void add(TableOrSelectType type) {
            if (type instanceof LazyJoinType lazyJoinType) {
                add(lazyJoinType.sourceType());
                found.add(lazyJoinType);
            }
        }

        @Override
        public Void visitField(Field node) {
            if (node.type() instanceof FieldType fieldType) {
                add(fieldType.tableType());
            } else if (node.type() instanceof PropertyType propertyType) {
                add(propertyType.fieldType().tableType());
            }
            return null;
        }
    }

    /**
     * Collects the field names read from each table-like type.
     */
    private static final class RequestedFieldsCollector extends TraversingVisitor {
        private final Map<TableOrSelectType, Set<String>> requested = new HashMap<>();

        Set<String> fieldsOf(TableOrSelectType type) {
            return requested.getOrDefault(type, Set.of());
        }

        @Override
        public Void visitField(Field node) {
            FieldType fieldType = null;
            if (node.type() instanceof FieldType direct) {
                fieldType = direct;
            } else if (node.type() instanceof PropertyType propertyType) {
                fieldType = propertyType.fieldType();
            }
            if (fieldType != null) {
                requested.computeIfAbsent(fieldType.tableType(), k -> new LinkedHashSet<>()).add(fieldType.name());
            }
            return null;
        }
    }

    /**
     * Points fields at the concrete join or subquery that replaced their lazy table type.
     */
    private static final class FieldRetargeter extends RewritingVisitor {
        private final Map<TableOrSelectType, TableOrSelectType> replacements;

        FieldRetargeter(Map<TableOrSelectType, TableOrSelectType> replacements) {
            this.replacements = replacements;
        }

        @Override
        public Optional<Expr> visitField(Field node) {
            if (node.type() instanceof FieldType fieldType) {
                TableOrSelectType replacement = replacements.get(fieldType.tableType());
                if (replacement != null) {
                    return Optional.of(node.withType(fieldType.withTableType(replacement)));
                }
            } else if (node.type() instanceof PropertyType propertyType) {
                FieldType fieldType = propertyType.fieldType();
                TableOrSelectType replacement = replacements.get(fieldType.tableType());
                if (replacement != null) {
                    return Optional.of(node.withType(new PropertyType(propertyType.chain(),
                            fieldType.withTableType(replacement))));
                }
            }
            return Optional.of(node);
        }
    }

    private final class MaterializingVisitor extends RewritingVisitor {
        private final CompileContext context;
        private final WherePushdownOptimizer optimizer;

        MaterializingVisitor(CompileContext context) {
            this.context = context;
            this.optimizer = new WherePushdownOptimizer(context.settings().sessionLookback());
        }

        @Override
        public Optional<Expr> visitSelectQuery(SelectQuery node) {
            // Nested SELECTs first
            Optional<Expr> rewritten = super.visitSelectQuery(node);
            if (rewritten.isEmpty()) {
                return rewritten;
            }
            SelectQuery select = (SelectQuery) rewritten.get();
            if (!(select.type() instanceof SelectQueryType selectType) || select.selectFrom() == null) {
                return Optional.of(select);
            }
            return Optional.of(materialize(select, selectType));
        }

        private SelectQuery materialize(SelectQuery select, SelectQueryType selectType) {
            Collection<TableOrSelectType> ownTables = selectType.tables().values();
            LazyJoinCollector collector = new LazyJoinCollector();
            collector.traverse(select);

            JoinRegistry registry = new JoinRegistry();
            for (LazyJoinType lazyJoinType : collector.found) {
                if (ownTables.contains(rootOf(lazyJoinType))) {
                    ensureJoined(lazyJoinType, registry, new HashSet<>());
                }
            }
            boolean hasLazyTables = false;
            for (JoinExpr join : select.selectFrom().toList()) {
                if (join.type() instanceof LazyTableType) {
                    hasLazyTables = true;
                    break;
                }
            }
            if (registry.size() == 0 && !hasLazyTables) {
                return select;
            }

            RequestedFieldsCollector requested = new RequestedFieldsCollector();
            requested.traverse(select);
            for (JoinRequest request : registry.requests()) {
                requested.traverse(request.constraint());
            }

            Map<String, Expr> selectAliases = selectAliasesOf(select);
            Map<TableOrSelectType, TableOrSelectType> replacements = new LinkedHashMap<>();

            // Lazy tables in FROM
            List<JoinExpr> chain = new ArrayList<>();
            List<JoinExpr> elements = select.selectFrom().toList();
            for (int i = 0; i < elements.size(); i++) {
                JoinExpr join = elements.get(i);
                if (!(join.type() instanceof LazyTableType lazyTableType)) {
                    chain.add(join);
                    continue;
                }
                String joinType = i == 0 || join.joinType() == null ? "" : join.joinType();
                boolean leftSide = joinType.startsWith("LEFT");
                boolean pushable = joinType.isEmpty() || leftSide || joinType.equals("JOIN")
                        || joinType.startsWith("INNER") || joinType.startsWith("CROSS");
                Expr pushed = pushable ? pushedFilter(select.where(), lazyTableType.table(), lazyTableType,
                        selectAliases, leftSide) : null;
                SelectQuery subquery = materializeTable(lazyTableType.table(),
                        requested.fieldsOf(lazyTableType), pushed);
                SelectQueryAliasType replacement = new SelectQueryAliasType(lazyTableType.alias(),
                        (SelectQueryType) subquery.type());
                replacements.put(lazyTableType, replacement);
                chain.add(new JoinExpr(join.joinType(), subquery, lazyTableType.alias(), join.constraint(),
                        join.sample(), null, replacement));
            }

            // Lazy joins, in registration order
            List<JoinExpr> appended = new ArrayList<>();
            Map<String, TableOrSelectType> addedTables = new LinkedHashMap<>();
            for (JoinRequest request : registry.requests()) {
                LazyJoinType lazyJoinType = request.lazyJoinType();
                Table joinTable = lazyJoinType.lazyJoin().joinTable();
                String alias = request.alias();
                Set<String> fields = new LinkedHashSet<>(requested.fieldsOf(lazyJoinType));
                fields.addAll(lazyJoinType.lazyJoin().toFields());

                Expr tableExpr;
                TableOrSelectType replacement;
                if (joinTable instanceof LazyTable lazyTable) {
                    Expr pushed = pushedFilter(select.where(), lazyTable, lazyJoinType, selectAliases,
                            lazyJoinType.lazyJoin().isLeftJoin());
                    SelectQuery subquery = materializeTable(lazyTable, fields, pushed);
                    replacement = new SelectQueryAliasType(alias, (SelectQueryType) subquery.type());
                    tableExpr = subquery;
                } else if (joinTable instanceof PhysicalTable) {
                    TableType tableType = new TableType(joinTable);
                    replacement = new TableAliasType(alias, tableType);
                    tableExpr = new Field(List.of(joinTable.name()), tableType);
                } else {
                    throw new ImpossibleAstError("Cannot join table kind " + joinTable.getClass().getSimpleName());
                }
                replacements.put(lazyJoinType, replacement);
                addedTables.put(alias, replacement);
                appended.add(new JoinExpr(lazyJoinType.lazyJoin().joinType(), tableExpr, alias,
                        JoinConstraint.on(request.constraint()), null, null, replacement));
                LOGGER.debug("Joined {} as {}", joinTable.name(), alias);
            }
            // Duplicates that share a registered join read from it
            for (LazyJoinType lazyJoinType : collector.found) {
                JoinRequest request = registry.lookup(lazyJoinType);
                if (request != null && !replacements.containsKey(lazyJoinType)) {
                    replacements.put(lazyJoinType, replacements.get(request.lazyJoinType()));
                }
            }

            FieldRetargeter retargeter = new FieldRetargeter(replacements);
            List<JoinExpr> finalChain = new ArrayList<>();
            for (JoinExpr join : chain) {
                JoinConstraint constraint = join.constraint() == null ? null
                        : join.constraint().withExpr(retargeter.rewriteRequired(join.constraint().expr()));
                finalChain.add(join.withConstraint(constraint));
            }
            for (JoinExpr join : appended) {
                finalChain.add(join.withConstraint(
                        join.constraint().withExpr(retargeter.rewriteRequired(join.constraint().expr()))));
            }

            SelectQuery withoutFrom = select.withSelectFrom(null);
            SelectQuery retargeted = (SelectQuery) retargeter.rewriteRequired(withoutFrom);

            SelectQueryType newType = new SelectQueryType(selectType.columns(), retargetTables(selectType, replacements));
            for (Map.Entry<String, TableOrSelectType> entry : addedTables.entrySet()) {
                newType = newType.withTable(entry.getKey(), entry.getValue());
            }
            return retargeted.toBuilder()
                    .selectFrom(JoinExpr.chain(finalChain))
                    .type(newType)
                    .build();
        }

        private Map<String, TableOrSelectType> retargetTables(SelectQueryType selectType,
                                                              Map<TableOrSelectType, TableOrSelectType> replacements) {
            Map<String, TableOrSelectType> tables = new LinkedHashMap<>();
            for (Map.Entry<String, TableOrSelectType> entry : selectType.tables().entrySet()) {
                tables.put(entry.getKey(), replacements.getOrDefault(entry.getValue(), entry.getValue()));
            }
            return tables;
        }

        /**
         * Registers the join and, before it, every join its ON expression reads from.
         */
        private JoinRequest ensureJoined(LazyJoinType lazyJoinType, JoinRegistry registry, Set<LazyJoinType> inProgress) {
            JoinRequest existing = registry.lookup(lazyJoinType);
            if (existing != null) {
                return existing;
            }
            if (!inProgress.add(lazyJoinType)) {
                throw new ImpossibleAstError("Lazy join " + lazyJoinType.alias() + " depends on itself");
            }
            if (lazyJoinType.sourceType() instanceof LazyJoinType parent) {
                ensureJoined(parent, registry, inProgress);
            }
            String fromAlias = Types.aliasOf(lazyJoinType.sourceType());
            String toAlias = lazyJoinType.alias();
            Map<String, TableOrSelectType> tables = new LinkedHashMap<>();
            tables.put(fromAlias, lazyJoinType.sourceType());
            tables.put(toAlias, lazyJoinType);
            Expr constraint = resolver.resolveInTables(lazyJoinType.lazyJoin().constraint().build(fromAlias, toAlias),
                    tables, context);

            LazyJoinCollector dependencies = new LazyJoinCollector();
            dependencies.traverse(constraint);
            for (LazyJoinType dependency : dependencies.found) {
                if (!dependency.equals(lazyJoinType)) {
                    ensureJoined(dependency, registry, inProgress);
                }
            }
            inProgress.remove(lazyJoinType);
            return registry.register(new JoinRequest(lazyJoinType, constraint));
        }

        private Map<String, Expr> selectAliasesOf(SelectQuery select) {
            Map<String, Expr> aliases = new HashMap<>();
            for (Expr column : select.select()) {
                if (column instanceof Alias alias) {
                    aliases.put(alias.alias(), alias.expr());
                }
            }
            return aliases;
        }

        @Nullable
        private Expr pushedFilter(@Nullable Expr where, LazyTable table, TableOrSelectType scope,
                                  Map<String, Expr> selectAliases, boolean rightOfLeftJoin) {
            if (where == null || !context.modifiers().enablePushdown()) {
                return null;
            }
            PushdownTarget target = table.pushdownTarget(scope, context);
            if (target == null) {
                return null;
            }
            Optional<Expr> pushed = optimizer.pushdown(where, target, selectAliases);
            if (pushed.isEmpty()) {
                return null;
            }
            if (rightOfLeftJoin && !NullRejection.isNullRejecting(pushed.get())) {
                LOGGER.debug("Filter for {} is not null-rejecting, not pushed into LEFT JOIN", table.name());
                return null;
            }
            return pushed.get();
        }

        private SelectQuery materializeTable(LazyTable table, Set<String> fields, @Nullable Expr pushed) {
            SelectQuery subquery = table.materialize(fields, pushed, context);
            Expr resolved = resolver.apply(subquery, context);
            return (SelectQuery) propertyAccessSelector.apply(resolved, context);
        }
    }
}
