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

package com.strata.properties;

import com.google.common.collect.ImmutableList;
import com.strata.ast.Call;
import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.RewritingVisitor;
import com.strata.ast.types.PropertyType;
import com.strata.ast.types.Types;
import com.strata.catalog.MaterializedProperty;
import com.strata.catalog.PropertyValueType;
import com.strata.compiler.CompileContext;
import com.strata.compiler.CompilerPass;
import com.strata.database.DatabaseField;
import com.strata.database.JsonPropertiesField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces every resolved property read with the cheapest physical access the catalog allows.
 * <p>
 * Strategies are consulted in priority order: dedicated column, side table slot, map column and finally
 * the JSON blob. Comparisons against a property are offered to the chosen strategy first so that it can
 * emit an index-friendly form.
 */
public class PropertyAccessSelector implements CompilerPass {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertyAccessSelector.class);

    private final List<PropertyAccessStrategy> strategies;

    public PropertyAccessSelector() {
        this.strategies = initializeStrategies();
    }

    private List<PropertyAccessStrategy> initializeStrategies() {
        List<PropertyAccessStrategy> list = new ArrayList<>();
        list.add(new DedicatedColumnStrategy());
        list.add(new SideTableSlotStrategy());
        list.add(new MapColumnStrategy());
        list.add(new JsonExtractStrategy());

        // Sort by priority (higher priority first)
        list.sort((s1, s2) -> Integer.compare(s2.getPriority(), s1.getPriority()));
        return ImmutableList.copyOf(list);
    }

    public List<PropertyAccessStrategy> strategies() {
        return strategies;
    }

    @Override
    public Expr apply(Expr node, CompileContext context) {
        return new SelectingVisitor(context).rewriteRequired(node);
    }

    @Override
    public String getName() {
        return "PropertyAccessSelector";
    }

    /**
     * Picks the strategy serving the access. The JSON strategy always applies, so a strategy is always found.
     */
    PropertyAccessStrategy select(PropertyAccess access, CompileContext context) {
        for (PropertyAccessStrategy strategy : strategies) {
            if (strategy.canApply(access, context)) {
                return strategy;
            }
        }
        throw new IllegalStateException("No property access strategy applies to " + access.property());
    }

    /**
     * Describes the read behind a resolved property field.
     */
    static PropertyAccess describe(Field node, PropertyType type, CompileContext context) {
        DatabaseField blob = Types.databaseFieldOf(type.fieldType());
        String catalogTable = blob instanceof JsonPropertiesField properties ? properties.catalogTable() : null;
        String property = type.chain().get(0);
        List<String> nested = type.chain().subList(1, type.chain().size());

        List<MaterializedProperty> entries = List.of();
        PropertyValueType valueType = PropertyValueType.STRING;
        if (catalogTable != null) {
            valueType = context.catalog().valueTypeOf(catalogTable, property);
            if (context.modifiers().materializationEnabled()) {
                entries = context.catalog().lookup(catalogTable, property);
            }
        }
        return new PropertyAccess(node, type, catalogTable, property, nested, entries, valueType);
    }

    private class SelectingVisitor extends RewritingVisitor {
        private final CompileContext context;

        SelectingVisitor(CompileContext context) {
            this.context = context;
        }

        @Nullable
        private PropertyAccess accessOf(Expr expr) {
            if (expr instanceof Field field && field.type() instanceof PropertyType propertyType
                    && !propertyType.chain().isEmpty()) {
                return describe(field, propertyType, context);
            }
            return null;
        }

        @Override
        public Optional<Expr> visitField(Field node) {
            PropertyAccess access = accessOf(node);
            if (access == null) {
                return Optional.of(node);
            }
            PropertyAccessStrategy strategy = select(access, context);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Property {}.{} read through {}", access.catalogTable(), access.property(),
                        strategy.getName());
            }
            return Optional.of(strategy.read(access, context));
        }

        @Override
        public Optional<Expr> visitCompareOperation(CompareOperation node) {
            PropertyAccess access = accessOf(node.left());
            CompareOperator op = node.op();
            Expr other = node.right();
            if (access == null && (op == CompareOperator.EQ || op == CompareOperator.NOT_EQ)) {
                access = accessOf(node.right());
                other = node.left();
            }
            if (access != null) {
                Expr specialized = specialize(access, op, rewriteRequired(other));
                if (specialized != null) {
                    return Optional.of(specialized);
                }
            }
            return super.visitCompareOperation(node);
        }

        @Override
        public Optional<Expr> visitCall(Call node) {
            if (node.args().size() == 1 && (node.name().equals("isNull") || node.name().equals("isNotNull"))) {
                PropertyAccess access = accessOf(node.args().get(0));
                if (access != null) {
                    CompareOperator op = node.name().equals("isNull") ? CompareOperator.EQ : CompareOperator.NOT_EQ;
                    Expr specialized = specialize(access, op, Constant.NULL);
                    if (specialized != null) {
                        return Optional.of(specialized);
                    }
                }
            }
            return super.visitCall(node);
        }

        @Nullable
        private Expr specialize(PropertyAccess access, CompareOperator op, Expr other) {
            PropertyAccessStrategy strategy = select(access, context);
            Expr specialized = strategy.compare(access, op, other, context);
            if (specialized != null && LOGGER.isDebugEnabled()) {
                LOGGER.debug("Comparison {} on property {}.{} specialized by {}", op.symbol(), access.catalogTable(),
                        access.property(), strategy.getName());
            }
            return specialized;
        }
    }
}
